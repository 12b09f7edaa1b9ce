package com.flamingo.ai.mathgrader.service.expression;

/** Adjoint of an operator. */
public record Dagger(Expr operand) implements Expr {

  @Override
  public boolean isCommutative() {
    return operand.isCommutative();
  }

  @Override
  public String toString() {
    return "Dagger(" + operand + ")";
  }
}
