package com.flamingo.ai.mathgrader.service.expression;

import java.util.List;

/** Ordered product of factors. */
public record Mul(List<Expr> factors) implements Expr {

  public Mul {
    factors = List.copyOf(factors);
  }

  public static Expr negate(Expr operand) {
    return new Mul(List.of(Num.of(-1), operand));
  }

  @Override
  public boolean isCommutative() {
    return factors.stream().allMatch(Expr::isCommutative);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    List<Expr> rest = factors;
    if (factors.size() > 1
        && factors.get(0) instanceof Num first
        && first.value().equals(Rational.MINUS_ONE)) {
      sb.append('-');
      rest = factors.subList(1, factors.size());
    }
    for (int i = 0; i < rest.size(); i++) {
      Expr factor = rest.get(i);
      if (i > 0) {
        sb.append('*');
      }
      boolean negative = factor instanceof Num n && n.value().signum() < 0;
      boolean wrap = factor instanceof Add || (negative && (i > 0 || sb.length() > 0));
      sb.append(wrap ? "(" + factor + ")" : factor.toString());
    }
    return sb.toString();
  }
}
