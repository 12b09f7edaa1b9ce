package com.flamingo.ai.mathgrader.service.algebra;

import com.flamingo.ai.mathgrader.service.expression.Rational;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fully expanded sum of monomials with exact rational coefficients. Like terms are combined and
 * zero terms dropped on construction, so two polynomials are equal iff their expansions agree.
 * Term insertion order is kept for traversal; equality ignores it.
 */
public final class Polynomial {

  public static final Polynomial ZERO = new Polynomial(Map.of());

  private final Map<Monomial, Rational> terms;

  private Polynomial(Map<Monomial, Rational> terms) {
    this.terms = Collections.unmodifiableMap(terms);
  }

  public static Polynomial constant(Rational value) {
    return of(Monomial.ONE, value);
  }

  public static Polynomial of(Atom atom) {
    return of(Monomial.of(atom), Rational.ONE);
  }

  public static Polynomial of(Monomial monomial, Rational coefficient) {
    Map<Monomial, Rational> terms = new LinkedHashMap<>();
    if (!coefficient.isZero()) {
      terms.put(monomial, coefficient);
    }
    return new Polynomial(terms);
  }

  public Map<Monomial, Rational> terms() {
    return terms;
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  /** True for a polynomial without atoms (including zero). */
  public boolean isConstant() {
    return terms.isEmpty() || (terms.size() == 1 && terms.containsKey(Monomial.ONE));
  }

  public Rational constantValue() {
    return terms.getOrDefault(Monomial.ONE, Rational.ZERO);
  }

  public boolean isCommutative() {
    return terms.keySet().stream().allMatch(m -> m.word().isEmpty());
  }

  public Polynomial plus(Polynomial other) {
    Map<Monomial, Rational> sum = new LinkedHashMap<>(terms);
    other.terms.forEach((m, c) -> accumulate(sum, m, c));
    return new Polynomial(sum);
  }

  public Polynomial negate() {
    Map<Monomial, Rational> negated = new LinkedHashMap<>();
    terms.forEach((m, c) -> negated.put(m, c.negate()));
    return new Polynomial(negated);
  }

  public Polynomial minus(Polynomial other) {
    return plus(other.negate());
  }

  public Polynomial scale(Rational factor) {
    Map<Monomial, Rational> scaled = new LinkedHashMap<>();
    terms.forEach((m, c) -> accumulate(scaled, m, c.multiply(factor)));
    return new Polynomial(scaled);
  }

  /** Product with the factor order of non-commuting words preserved. */
  public Polynomial times(Polynomial other) {
    Map<Monomial, Rational> product = new LinkedHashMap<>();
    for (Map.Entry<Monomial, Rational> left : terms.entrySet()) {
      for (Map.Entry<Monomial, Rational> right : other.terms.entrySet()) {
        Monomial.Term term = left.getKey().times(right.getKey());
        accumulate(
            product,
            term.monomial(),
            left.getValue().multiply(right.getValue()).multiply(term.coefficient()));
      }
    }
    return new Polynomial(product);
  }

  public Polynomial pow(int exponent) {
    if (exponent < 0) {
      throw new IllegalArgumentException("Negative exponent " + exponent);
    }
    Polynomial result = constant(Rational.ONE);
    for (int i = 0; i < exponent; i++) {
      result = result.times(this);
    }
    return result;
  }

  /**
   * Raises a single commuting term to a rational power, or returns null when that is not an exact
   * rewrite.
   */
  Polynomial raiseSingleTerm(Rational exponent) {
    if (terms.size() != 1) {
      return null;
    }
    Map.Entry<Monomial, Rational> only = terms.entrySet().iterator().next();
    Monomial monomial = only.getKey();
    Rational coefficient = only.getValue();
    if (!monomial.word().isEmpty()) {
      return null;
    }
    if (!exponent.isInteger()) {
      boolean singleAtom =
          coefficient.isOne()
              && monomial.powers().size() == 1
              && monomial.powers().values().iterator().next().isOne();
      if (!singleAtom) {
        return null;
      }
    }
    Rational scaled =
        exponent.isInteger()
            ? coefficient.pow(exponent.numerator().intValueExact())
            : Rational.ONE;
    Monomial.Term raised = monomial.raise(exponent);
    return of(raised.monomial(), scaled.multiply(raised.coefficient()));
  }

  /** Adjoint: words reversed, each atom replaced by its adjoint, I conjugated. */
  public Polynomial adjoint() {
    Map<Monomial, Rational> result = new LinkedHashMap<>();
    for (Map.Entry<Monomial, Rational> entry : terms.entrySet()) {
      Monomial monomial = entry.getKey();
      Polynomial term = constant(entry.getValue());
      for (Map.Entry<Atom, Rational> power : monomial.powers().entrySet()) {
        Atom atom = power.getKey();
        Polynomial factor = atom.isImaginaryUnit() ? of(atom).negate() : of(atom.adjoint());
        Polynomial raised = factor.raiseSingleTerm(power.getValue());
        term = term.times(raised != null ? raised : factor);
      }
      List<Atom> reversed = new ArrayList<>(monomial.word());
      Collections.reverse(reversed);
      for (Atom atom : reversed) {
        term = term.times(of(atom.adjoint()));
      }
      term.terms.forEach((m, c) -> accumulate(result, m, c));
    }
    return new Polynomial(result);
  }

  /**
   * Replaces the word of every term by a linear combination of words, keeping the commuting part
   * and the coefficient as factors.
   */
  public Polynomial rewriteWords(Function<List<Atom>, Map<List<Atom>, Rational>> rewrite) {
    Map<Monomial, Rational> result = new LinkedHashMap<>();
    for (Map.Entry<Monomial, Rational> entry : terms.entrySet()) {
      Monomial monomial = entry.getKey();
      if (monomial.word().isEmpty()) {
        accumulate(result, monomial, entry.getValue());
        continue;
      }
      rewrite
          .apply(monomial.word())
          .forEach(
              (word, factor) ->
                  accumulate(result, monomial.withWord(word), entry.getValue().multiply(factor)));
    }
    return new Polynomial(result);
  }

  private static void accumulate(Map<Monomial, Rational> target, Monomial m, Rational c) {
    Rational sum = target.getOrDefault(m, Rational.ZERO).add(c);
    if (sum.isZero()) {
      target.remove(m);
    } else {
      target.put(m, sum);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Polynomial other && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  /** Canonical text with terms sorted by monomial. */
  @Override
  public String toString() {
    if (terms.isEmpty()) {
      return "0";
    }
    return terms.entrySet().stream()
        .sorted(Map.Entry.comparingByKey(Comparator.comparing(Monomial::key)))
        .map(e -> formatTerm(e.getKey(), e.getValue()))
        .collect(Collectors.joining(" + "));
  }

  private static String formatTerm(Monomial monomial, Rational coefficient) {
    if (monomial.isOne()) {
      return coefficient.toString();
    }
    if (coefficient.isOne()) {
      return monomial.key();
    }
    return "(" + coefficient + ")*" + monomial.key();
  }
}
