package com.flamingo.ai.mathgrader.service.expression;

import com.flamingo.ai.mathgrader.exception.EvaluationException;

/**
 * Complex number used for numeric evaluation.
 *
 * <p>Every operation on real operands whose result is real stays on the real axis with an exactly
 * zero imaginary part, so a real-valued expression evaluates to a real number. Functions outside
 * their real domain return the principal complex value.
 */
public final class Complex {

  public static final Complex ZERO = new Complex(0.0, 0.0);
  public static final Complex ONE = new Complex(1.0, 0.0);
  public static final Complex I = new Complex(0.0, 1.0);

  private static final double EULER_GAMMA = 0.5772156649015329;
  private static final double[] LANCZOS = {
    0.99999999999980993,
    676.5203681218851,
    -1259.1392167224028,
    771.32342877765313,
    -176.61503916999185,
    12.507343278686905,
    -0.13857109526572012,
    9.9843695780195716e-6,
    1.5056327351493116e-7
  };

  private final double re;
  private final double im;

  public Complex(double re, double im) {
    this.re = re;
    this.im = im;
  }

  public static Complex real(double value) {
    return new Complex(value, 0.0);
  }

  public double re() {
    return re;
  }

  public double im() {
    return im;
  }

  public boolean isReal() {
    return im == 0.0;
  }

  public boolean isZero() {
    return re == 0.0 && im == 0.0;
  }

  public boolean isFinite() {
    return Double.isFinite(re) && Double.isFinite(im);
  }

  public double abs() {
    return Math.hypot(re, im);
  }

  public double arg() {
    return Math.atan2(im, re);
  }

  public Complex plus(Complex o) {
    return new Complex(re + o.re, im + o.im);
  }

  public Complex minus(Complex o) {
    return new Complex(re - o.re, im - o.im);
  }

  public Complex negate() {
    return new Complex(-re, -im);
  }

  public Complex conjugate() {
    return new Complex(re, -im);
  }

  public Complex times(Complex o) {
    if (isReal() && o.isReal()) {
      return real(re * o.re);
    }
    return new Complex(re * o.re - im * o.im, re * o.im + im * o.re);
  }

  public Complex divide(Complex o) {
    if (o.isZero()) {
      throw new EvaluationException("Division by zero");
    }
    if (isReal() && o.isReal()) {
      return real(re / o.re);
    }
    double d = o.re * o.re + o.im * o.im;
    return new Complex((re * o.re + im * o.im) / d, (im * o.re - re * o.im) / d);
  }

  public Complex reciprocal() {
    return ONE.divide(this);
  }

  /** Principal power. Integer exponents use repeated squaring so that e.g. I^2 is exactly -1. */
  public Complex pow(Complex exponent) {
    if (isZero()) {
      if (exponent.isZero()) {
        return ONE;
      }
      if (exponent.re > 0) {
        return ZERO;
      }
      throw new EvaluationException("Division by zero: zero raised to a non-positive power");
    }
    if (exponent.isReal() && exponent.re == Math.rint(exponent.re) && Math.abs(exponent.re) <= 1024) {
      return integerPow((int) exponent.re);
    }
    if (isReal() && exponent.isReal() && re > 0) {
      return real(Math.pow(re, exponent.re));
    }
    return exponent.times(log()).exp();
  }

  private Complex integerPow(int n) {
    if (isReal()) {
      return real(Math.pow(re, n));
    }
    Complex result = ONE;
    Complex base = n < 0 ? reciprocal() : this;
    int k = Math.abs(n);
    while (k > 0) {
      if ((k & 1) == 1) {
        result = result.times(base);
      }
      base = base.times(base);
      k >>= 1;
    }
    return result;
  }

  public Complex exp() {
    if (isReal()) {
      return real(Math.exp(re));
    }
    double m = Math.exp(re);
    return new Complex(m * Math.cos(im), m * Math.sin(im));
  }

  public Complex log() {
    if (isZero()) {
      throw new EvaluationException("Logarithm of zero");
    }
    if (isReal() && re > 0) {
      return real(Math.log(re));
    }
    return new Complex(Math.log(abs()), arg());
  }

  public Complex sqrt() {
    if (isReal() && re >= 0) {
      return real(Math.sqrt(re));
    }
    double r = abs();
    double a = Math.sqrt((r + re) / 2);
    double b = Math.sqrt((r - re) / 2);
    return new Complex(a, im < 0 ? -b : b);
  }

  public Complex sin() {
    if (isReal()) {
      return real(Math.sin(re));
    }
    return new Complex(Math.sin(re) * Math.cosh(im), Math.cos(re) * Math.sinh(im));
  }

  public Complex cos() {
    if (isReal()) {
      return real(Math.cos(re));
    }
    return new Complex(Math.cos(re) * Math.cosh(im), -Math.sin(re) * Math.sinh(im));
  }

  public Complex tan() {
    return isReal() ? real(Math.tan(re)) : sin().divide(cos());
  }

  public Complex sinh() {
    if (isReal()) {
      return real(Math.sinh(re));
    }
    return new Complex(Math.sinh(re) * Math.cos(im), Math.cosh(re) * Math.sin(im));
  }

  public Complex cosh() {
    if (isReal()) {
      return real(Math.cosh(re));
    }
    return new Complex(Math.cosh(re) * Math.cos(im), Math.sinh(re) * Math.sin(im));
  }

  public Complex tanh() {
    return isReal() ? real(Math.tanh(re)) : sinh().divide(cosh());
  }

  public Complex asin() {
    if (isReal() && Math.abs(re) <= 1) {
      return real(Math.asin(re));
    }
    // -i * ln(iz + sqrt(1 - z^2))
    Complex w = I.times(this).plus(ONE.minus(this.times(this)).sqrt()).log();
    return new Complex(w.im, -w.re);
  }

  public Complex acos() {
    if (isReal() && Math.abs(re) <= 1) {
      return real(Math.acos(re));
    }
    return real(Math.PI / 2).minus(asin());
  }

  public Complex atan() {
    if (isReal()) {
      return real(Math.atan(re));
    }
    // (i/2) * ln((i + z) / (i - z))
    Complex w = I.plus(this).divide(I.minus(this)).log();
    return new Complex(-w.im / 2, w.re / 2);
  }

  public Complex asinh() {
    if (isReal()) {
      double x = re;
      return real(Math.log(x + Math.sqrt(x * x + 1)));
    }
    return plus(times(this).plus(ONE).sqrt()).log();
  }

  public Complex acosh() {
    if (isReal() && re >= 1) {
      return real(Math.log(re + Math.sqrt(re * re - 1)));
    }
    return plus(plus(ONE).sqrt().times(minus(ONE).sqrt())).log();
  }

  public Complex atanh() {
    if (isReal() && Math.abs(re) < 1) {
      return real(0.5 * Math.log((1 + re) / (1 - re)));
    }
    Complex half = real(0.5);
    return half.times(ONE.plus(this).log().minus(ONE.minus(this).log()));
  }

  /** Gamma function by the Lanczos approximation, with reflection for {@code re < 1/2}. */
  public Complex gamma() {
    if (isReal() && re <= 0 && re == Math.rint(re)) {
      throw new EvaluationException("Gamma function pole at " + re);
    }
    if (re < 0.5) {
      Complex pi = real(Math.PI);
      return pi.divide(pi.times(this).sin().times(ONE.minus(this).gamma()));
    }
    Complex z = minus(ONE);
    Complex x = real(LANCZOS[0]);
    for (int i = 1; i < LANCZOS.length; i++) {
      x = x.plus(real(LANCZOS[i]).divide(z.plus(real(i))));
    }
    Complex t = z.plus(real(LANCZOS.length - 1.5));
    Complex result =
        real(Math.sqrt(2 * Math.PI)).times(t.pow(z.plus(real(0.5)))).times(t.negate().exp()).times(x);
    return isReal() ? real(result.re) : result;
  }

  /** Exponential integral Ei for real, non-zero arguments. */
  public Complex ei() {
    if (!isReal()) {
      throw new EvaluationException("Ei is only supported for real arguments");
    }
    if (re == 0) {
      throw new EvaluationException("Ei is undefined at 0");
    }
    double sum = 0;
    double term = 1;
    for (int k = 1; k < 500; k++) {
      term *= re / k;
      double delta = term / k;
      sum += delta;
      if (Math.abs(delta) < 1e-17 * Math.abs(sum)) {
        break;
      }
    }
    return real(EULER_GAMMA + Math.log(Math.abs(re)) + sum);
  }

  /** Text form: {@code 2.0} for reals, {@code 0.785-0.658j} otherwise. */
  public String format() {
    if (isReal()) {
      return Double.toString(re);
    }
    return Double.toString(re) + (im < 0 || (im == 0 && 1 / im < 0) ? "-" : "+") + Math.abs(im) + "j";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Complex other)) {
      return false;
    }
    return Double.compare(re, other.re) == 0 && Double.compare(im, other.im) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(re) + Double.hashCode(im);
  }

  @Override
  public String toString() {
    return format();
  }
}
