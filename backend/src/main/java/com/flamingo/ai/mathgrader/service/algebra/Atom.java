package com.flamingo.ai.mathgrader.service.algebra;

import com.flamingo.ai.mathgrader.service.expression.Rational;
import java.util.Objects;

/**
 * Indivisible factor of a polynomial term: a symbol, a constant, a function application, an
 * unexpanded power, or the adjoint of one of these. Atoms are identified by their key.
 */
public final class Atom implements Comparable<Atom> {

  static final String IMAGINARY_KEY = "I";

  private final String key;
  private final boolean commutative;
  private final Atom adjointOf;
  private final boolean selfAdjoint;
  private final Rational numericBase;

  private Atom(
      String key, boolean commutative, Atom adjointOf, boolean selfAdjoint, Rational numericBase) {
    this.key = key;
    this.commutative = commutative;
    this.adjointOf = adjointOf;
    this.selfAdjoint = selfAdjoint;
    this.numericBase = numericBase;
  }

  public static Atom symbol(String key, boolean commutative) {
    return new Atom(key, commutative, null, false, null);
  }

  /** Real constant such as pi or E; its own adjoint. */
  public static Atom realConstant(String key) {
    return new Atom(key, true, null, true, null);
  }

  public static Atom imaginaryUnit() {
    return new Atom(IMAGINARY_KEY, true, null, false, null);
  }

  /** Positive rational that only occurs under a fractional power, e.g. the 2 in 2^(1/2). */
  public static Atom numericRoot(Rational base) {
    return new Atom("#" + base, true, null, true, base);
  }

  public String key() {
    return key;
  }

  public boolean isCommutative() {
    return commutative;
  }

  public boolean isAdjoint() {
    return adjointOf != null;
  }

  public boolean isImaginaryUnit() {
    return IMAGINARY_KEY.equals(key);
  }

  /** The base of a numeric root, or null. */
  public Rational numericBase() {
    return numericBase;
  }

  /** The operator itself: for an adjoint atom its operand, otherwise this atom. */
  public Atom operator() {
    return adjointOf != null ? adjointOf : this;
  }

  /** Adjoint; the imaginary unit is handled by {@link Polynomial#adjoint()}. */
  public Atom adjoint() {
    if (selfAdjoint) {
      return this;
    }
    if (adjointOf != null) {
      return adjointOf;
    }
    return new Atom("Dagger(" + key + ")", commutative, this, false, null);
  }

  @Override
  public int compareTo(Atom other) {
    return key.compareTo(other.key);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Atom other && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key);
  }

  @Override
  public String toString() {
    return numericBase != null ? numericBase.toString() : key;
  }
}
