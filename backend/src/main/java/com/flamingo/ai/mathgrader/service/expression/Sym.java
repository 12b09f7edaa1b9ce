package com.flamingo.ai.mathgrader.service.expression;

/** Named symbol; declared parameters and free variables alike. */
public record Sym(String name, boolean commutative) implements Expr {

  @Override
  public boolean isCommutative() {
    return commutative;
  }

  @Override
  public String toString() {
    return name;
  }
}
