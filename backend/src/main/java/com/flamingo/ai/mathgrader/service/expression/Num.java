package com.flamingo.ai.mathgrader.service.expression;

/** Exact numeric literal. */
public record Num(Rational value) implements Expr {

  public static Num of(long value) {
    return new Num(Rational.of(value));
  }

  @Override
  public boolean isCommutative() {
    return true;
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
