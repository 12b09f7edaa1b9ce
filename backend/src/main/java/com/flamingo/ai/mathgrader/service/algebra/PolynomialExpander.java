package com.flamingo.ai.mathgrader.service.algebra;

import com.flamingo.ai.mathgrader.exception.EvaluationException;
import com.flamingo.ai.mathgrader.service.expression.Add;
import com.flamingo.ai.mathgrader.service.expression.Call;
import com.flamingo.ai.mathgrader.service.expression.Constant;
import com.flamingo.ai.mathgrader.service.expression.Dagger;
import com.flamingo.ai.mathgrader.service.expression.Expr;
import com.flamingo.ai.mathgrader.service.expression.Mul;
import com.flamingo.ai.mathgrader.service.expression.Num;
import com.flamingo.ai.mathgrader.service.expression.Pow;
import com.flamingo.ai.mathgrader.service.expression.Rational;
import com.flamingo.ai.mathgrader.service.expression.Sym;
import java.math.BigInteger;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Expands an expression tree into a {@link Polynomial}.
 *
 * <p>Sums and products are distributed, integer powers multiplied out, and rational powers of a
 * single atom kept as exponents. Anything else (function applications, symbolic exponents,
 * fractional powers of sums) becomes an opaque atom keyed by the expansion of its parts, so equal
 * sub-expressions still compare equal.
 */
@Component
public class PolynomialExpander {

  /** Integer powers of sums above this are left unexpanded. */
  static final int MAX_EXPANDED_POWER = 16;

  /** Constant exponents whose numerator or denominator exceeds this stay unevaluated. */
  static final BigInteger MAX_EXACT_EXPONENT = BigInteger.valueOf(1024);

  /**
   * Expands {@code expr}.
   *
   * @throws EvaluationException if exact arithmetic fails, e.g. division by zero
   */
  public Polynomial expand(Expr expr) {
    try {
      return expandNode(expr);
    } catch (ArithmeticException e) {
      throw new EvaluationException("Cannot expand expression exactly: " + e.getMessage(), e);
    }
  }

  private Polynomial expandNode(Expr expr) {
    if (expr instanceof Num num) {
      return Polynomial.constant(num.value());
    }
    if (expr instanceof Sym sym) {
      return Polynomial.of(Atom.symbol(sym.name(), sym.commutative()));
    }
    if (expr instanceof Constant constant) {
      return Polynomial.of(
          constant == Constant.I ? Atom.imaginaryUnit() : Atom.realConstant(constant.symbol()));
    }
    if (expr instanceof Add add) {
      Polynomial sum = Polynomial.ZERO;
      for (Expr term : add.terms()) {
        sum = sum.plus(expandNode(term));
      }
      return sum;
    }
    if (expr instanceof Mul mul) {
      Polynomial product = Polynomial.constant(Rational.ONE);
      for (Expr factor : mul.factors()) {
        product = product.times(expandNode(factor));
      }
      return product;
    }
    if (expr instanceof Pow pow) {
      return expandPower(expandNode(pow.base()), expandNode(pow.exponent()));
    }
    if (expr instanceof Call call) {
      String key =
          call.args().isEmpty()
              ? call.function()
              : call.function()
                  + call.args().stream()
                      .map(arg -> expandNode(arg).toString())
                      .collect(Collectors.joining(", ", "(", ")"));
      return Polynomial.of(Atom.symbol(key, call.isCommutative()));
    }
    if (expr instanceof Dagger dagger) {
      return expandNode(dagger.operand()).adjoint();
    }
    throw new IllegalArgumentException("Unsupported expression node " + expr.getClass());
  }

  private Polynomial expandPower(Polynomial base, Polynomial exponent) {
    if (exponent.isConstant()) {
      Rational e = exponent.constantValue();
      if (e.isZero()) {
        return Polynomial.constant(Rational.ONE);
      }
      if (base.isZero()) {
        if (e.signum() < 0) {
          throw new EvaluationException("Division by zero");
        }
        return Polynomial.ZERO;
      }
      if (!isExactExponent(e)) {
        return opaquePower(base, exponent);
      }
      if (base.isConstant() && !e.isInteger() && base.constantValue().signum() > 0) {
        return numericRoot(base.constantValue(), e);
      }
      if (e.isInteger() && e.signum() > 0 && e.compareTo(Rational.of(MAX_EXPANDED_POWER)) <= 0) {
        return base.pow(e.numerator().intValueExact());
      }
      Polynomial raised = base.raiseSingleTerm(e);
      if (raised != null) {
        return raised;
      }
    }
    return opaquePower(base, exponent);
  }

  private static boolean isExactExponent(Rational e) {
    return e.numerator().abs().compareTo(MAX_EXACT_EXPONENT) <= 0
        && e.denominator().compareTo(MAX_EXACT_EXPONENT) <= 0;
  }

  private static Polynomial opaquePower(Polynomial base, Polynomial exponent) {
    String key = "(" + base + ")^(" + exponent + ")";
    return Polynomial.of(Atom.symbol(key, base.isCommutative() && exponent.isCommutative()));
  }

  /** {@code value^e} for positive rational value and non-integer e, as an exact monomial. */
  private static Polynomial numericRoot(Rational value, Rational e) {
    return integerRoot(value.numerator(), e).times(integerRoot(value.denominator(), e.negate()));
  }

  private static Polynomial integerRoot(BigInteger n, Rational e) {
    if (n.equals(BigInteger.ONE)) {
      return Polynomial.constant(Rational.ONE);
    }
    int q = e.denominator().intValueExact();
    BigInteger root = BigInteger.valueOf(Math.round(Math.pow(n.doubleValue(), 1.0 / q)));
    if (root.signum() > 0 && root.pow(q).equals(n)) {
      Rational whole = Rational.of(root, BigInteger.ONE);
      return Polynomial.constant(whole.pow(e.numerator().intValueExact()));
    }
    return Polynomial.of(Atom.numericRoot(Rational.of(n, BigInteger.ONE))).raiseSingleTerm(e);
  }
}
