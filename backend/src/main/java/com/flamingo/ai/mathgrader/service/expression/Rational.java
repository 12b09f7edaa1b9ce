package com.flamingo.ai.mathgrader.service.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/** Exact rational number with a positive denominator in lowest terms. */
public final class Rational implements Comparable<Rational> {

  public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
  public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

  /** Upper bound on the size of an exact power. */
  static final long MAX_POWER_BITS = 1L << 16;

  private final BigInteger numerator;
  private final BigInteger denominator;

  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Rational of(long value) {
    return of(BigInteger.valueOf(value), BigInteger.ONE);
  }

  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static Rational of(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) {
      throw new ArithmeticException("Zero denominator");
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Rational(numerator, denominator);
  }

  /** Parses a decimal literal such as {@code 2}, {@code 0.24} or {@code .5} exactly. */
  public static Rational parse(String literal) {
    BigDecimal decimal = new BigDecimal(literal.startsWith(".") ? "0" + literal : literal);
    if (decimal.scale() <= 0) {
      return of(decimal.toBigIntegerExact(), BigInteger.ONE);
    }
    return of(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
  }

  public BigInteger numerator() {
    return numerator;
  }

  public BigInteger denominator() {
    return denominator;
  }

  public Rational add(Rational other) {
    return of(
        numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public Rational subtract(Rational other) {
    return add(other.negate());
  }

  public Rational multiply(Rational other) {
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  public Rational divide(Rational other) {
    if (other.isZero()) {
      throw new ArithmeticException("Division by zero");
    }
    return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
  }

  public Rational negate() {
    return new Rational(numerator.negate(), denominator);
  }

  /**
   * Integer power; negative exponents invert.
   *
   * @throws ArithmeticException if the result would exceed {@link #MAX_POWER_BITS} bits
   */
  public Rational pow(int exponent) {
    if (isUnit()) {
      return exponent % 2 == 0 ? ONE : this;
    }
    long bits =
        Math.max(numerator.bitLength(), denominator.bitLength()) * Math.abs((long) exponent);
    if (bits > MAX_POWER_BITS) {
      throw new ArithmeticException("Exact power with exponent " + exponent + " is too large");
    }
    if (exponent < 0) {
      return ONE.divide(this).pow(-exponent);
    }
    return of(numerator.pow(exponent), denominator.pow(exponent));
  }

  /** Largest integer not greater than this value. */
  public BigInteger floor() {
    BigInteger[] qr = numerator.divideAndRemainder(denominator);
    return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  /** Whether this is 1 or -1. */
  public boolean isUnit() {
    return numerator.abs().equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
  }

  public boolean isOne() {
    return equals(ONE);
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public int signum() {
    return numerator.signum();
  }

  public double doubleValue() {
    return new BigDecimal(numerator)
        .divide(new BigDecimal(denominator), MathContext.DECIMAL64)
        .doubleValue();
  }

  @Override
  public int compareTo(Rational other) {
    return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Rational other)) {
      return false;
    }
    return numerator.equals(other.numerator) && denominator.equals(other.denominator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numerator, denominator);
  }

  @Override
  public String toString() {
    return isInteger() ? numerator.toString() : numerator + "/" + denominator;
  }
}
