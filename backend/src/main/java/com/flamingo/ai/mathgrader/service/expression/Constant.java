package com.flamingo.ai.mathgrader.service.expression;

/** Named mathematical constants recognised in canonical text. */
public enum Constant implements Expr {
  PI("pi", Complex.real(Math.PI)),
  E("E", Complex.real(Math.E)),
  I("I", Complex.I);

  private final String symbol;
  private final Complex value;

  Constant(String symbol, Complex value) {
    this.symbol = symbol;
    this.value = value;
  }

  public String symbol() {
    return symbol;
  }

  public Complex value() {
    return value;
  }

  /** Constant written as {@code name}, or null. */
  public static Constant bySymbol(String name) {
    for (Constant c : values()) {
      if (c.symbol.equals(name)) {
        return c;
      }
    }
    return null;
  }

  @Override
  public boolean isCommutative() {
    return true;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
