package com.flamingo.ai.mathgrader.service.algebra;

import com.flamingo.ai.mathgrader.service.expression.Rational;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Product of commuting atoms with rational exponents, followed by an ordered word of
 * non-commuting atoms. Carries no coefficient.
 */
public final class Monomial {

  public static final Monomial ONE = new Monomial(new TreeMap<>(), List.of());

  private final SortedMap<Atom, Rational> powers;
  private final List<Atom> word;
  private final String key;

  private Monomial(SortedMap<Atom, Rational> powers, List<Atom> word) {
    this.powers = Collections.unmodifiableSortedMap(powers);
    this.word = List.copyOf(word);
    this.key = buildKey();
  }

  public static Monomial of(Atom atom) {
    if (atom.isCommutative()) {
      TreeMap<Atom, Rational> powers = new TreeMap<>();
      powers.put(atom, Rational.ONE);
      return new Monomial(powers, List.of());
    }
    return new Monomial(new TreeMap<>(), List.of(atom));
  }

  public static Monomial ofWord(List<Atom> word) {
    return new Monomial(new TreeMap<>(), word);
  }

  public SortedMap<Atom, Rational> powers() {
    return powers;
  }

  public List<Atom> word() {
    return word;
  }

  public boolean isOne() {
    return powers.isEmpty() && word.isEmpty();
  }

  /** Commuting part only, without the word. */
  public Monomial commutingPart() {
    return new Monomial(new TreeMap<>(powers), List.of());
  }

  /** Same commuting part with {@code newWord} as the ordered word. */
  public Monomial withWord(List<Atom> newWord) {
    return new Monomial(new TreeMap<>(powers), newWord);
  }

  /**
   * Product {@code this * other}; the reduction of I^n and of numeric roots may move a factor into
   * the coefficient, which is returned with the monomial.
   */
  Term times(Monomial other) {
    TreeMap<Atom, Rational> merged = new TreeMap<>(powers);
    other.powers.forEach((atom, exp) -> merged.merge(atom, exp, Rational::add));
    List<Atom> joined = new ArrayList<>(word);
    joined.addAll(other.word);
    return reduce(merged, joined);
  }

  /** Raises the commuting part to {@code exponent}; only valid for an empty word. */
  Term raise(Rational exponent) {
    TreeMap<Atom, Rational> raised = new TreeMap<>();
    powers.forEach((atom, exp) -> raised.put(atom, exp.multiply(exponent)));
    return reduce(raised, List.of());
  }

  private static Term reduce(TreeMap<Atom, Rational> powers, List<Atom> word) {
    Rational coefficient = Rational.ONE;
    TreeMap<Atom, Rational> result = new TreeMap<>();
    for (Map.Entry<Atom, Rational> entry : powers.entrySet()) {
      Atom atom = entry.getKey();
      Rational exp = entry.getValue();
      if (atom.isImaginaryUnit() && exp.isInteger()) {
        int n = exp.numerator().mod(BigInteger.valueOf(4)).intValue();
        if (n >= 2) {
          coefficient = coefficient.negate();
        }
        exp = Rational.of(n % 2);
      } else if (atom.numericBase() != null) {
        BigInteger whole = exp.floor();
        coefficient = coefficient.multiply(atom.numericBase().pow(whole.intValueExact()));
        exp = exp.subtract(Rational.of(whole, BigInteger.ONE));
      }
      if (!exp.isZero()) {
        result.put(atom, exp);
      }
    }
    return new Term(coefficient, new Monomial(result, word));
  }

  public String key() {
    return key;
  }

  private String buildKey() {
    String commuting =
        powers.entrySet().stream()
            .map(
                e ->
                    e.getValue().isOne()
                        ? e.getKey().toString()
                        : e.getKey() + "^(" + e.getValue() + ")")
            .collect(Collectors.joining("*"));
    if (word.isEmpty()) {
      return commuting;
    }
    String ordered = word.stream().map(Atom::toString).collect(Collectors.joining(" "));
    return commuting.isEmpty() ? "[" + ordered + "]" : commuting + "*[" + ordered + "]";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Monomial other && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }

  /** A coefficient paired with a monomial. */
  record Term(Rational coefficient, Monomial monomial) {}
}
