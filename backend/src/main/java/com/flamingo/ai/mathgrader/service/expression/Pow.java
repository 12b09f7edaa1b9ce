package com.flamingo.ai.mathgrader.service.expression;

/** Power {@code base**exponent}. */
public record Pow(Expr base, Expr exponent) implements Expr {

  @Override
  public boolean isCommutative() {
    return base.isCommutative() && exponent.isCommutative();
  }

  @Override
  public String toString() {
    return wrap(base) + "**" + wrap(exponent);
  }

  private static String wrap(Expr e) {
    boolean atomic =
        e instanceof Sym
            || e instanceof Constant
            || e instanceof Call
            || e instanceof Dagger
            || (e instanceof Num n && n.value().isInteger() && n.value().signum() >= 0);
    return atomic ? e.toString() : "(" + e + ")";
  }
}
