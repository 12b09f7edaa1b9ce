package com.flamingo.ai.mathgrader.service.equivalence;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.NonConvergenceException;
import com.flamingo.ai.mathgrader.service.algebra.Atom;
import com.flamingo.ai.mathgrader.service.algebra.Monomial;
import com.flamingo.ai.mathgrader.service.algebra.Polynomial;
import com.flamingo.ai.mathgrader.service.expression.Rational;
import com.flamingo.ai.mathgrader.service.rewrite.CapPolicy;
import com.flamingo.ai.mathgrader.service.rewrite.Fixpoint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Normal-orders non-commuting words under fermionic anticommutation relations.
 *
 * <p>Operators are ranked by the order in which they first occur in the polynomial. For ranks
 * {@code i < j} the rules are
 *
 * <ul>
 *   <li>{@code a_i† a_j† -> -a_j† a_i†}
 *   <li>{@code a_i a_j -> -a_j a_i}
 * </ul>
 *
 * and for every {@code i, j}: {@code a_i a_j† -> δ_ij - a_j† a_i}. Each pass rewrites every word
 * once from left to right at non-overlapping positions; passes repeat until nothing changes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NormalOrderer {

  private final GraderConfig config;

  /**
   * Rewrites {@code polynomial} into normal order.
   *
   * @throws NonConvergenceException if the rules do not settle within the configured cap
   */
  public Polynomial normalOrder(Polynomial polynomial) {
    List<Atom> order = operators(polynomial);
    if (order.isEmpty()) {
      return polynomial;
    }
    log.debug("Normal ordering over operators {}", order);
    RuleSet rules = new RuleSet(order);
    Fixpoint<Polynomial> fixpoint =
        new Fixpoint<>(
            "Normal ordering",
            p -> p.rewriteWords(rules::rewrite),
            config.getEquivalence().getNormalOrderingCap(),
            CapPolicy.FAIL);
    Fixpoint.Outcome<Polynomial> outcome = fixpoint.apply(polynomial);
    log.debug("Normal ordering settled after {} passes: {}", outcome.getPasses(), outcome.getValue());
    return outcome.getValue();
  }

  /** Non-commuting operators in first-occurrence order; an adjoint contributes its operand. */
  static List<Atom> operators(Polynomial polynomial) {
    Set<Atom> seen = new LinkedHashSet<>();
    for (Monomial monomial : polynomial.terms().keySet()) {
      for (Atom atom : monomial.word()) {
        seen.add(atom.operator());
      }
    }
    return new ArrayList<>(seen);
  }

  /** Rule lookup for one operator ranking. */
  private static final class RuleSet {

    private final Map<Atom, Integer> rank = new LinkedHashMap<>();

    RuleSet(List<Atom> order) {
      for (int i = 0; i < order.size(); i++) {
        rank.put(order.get(i), i);
      }
    }

    Map<List<Atom>, Rational> rewrite(List<Atom> word) {
      Map<List<Atom>, Rational> out = new LinkedHashMap<>();
      expand(new ArrayList<>(), word, 0, Rational.ONE, out);
      return out;
    }

    private void expand(
        List<Atom> prefix, List<Atom> word, int from, Rational sign, Map<List<Atom>, Rational> out) {
      int i = from;
      List<Atom> head = new ArrayList<>(prefix);
      while (i + 1 < word.size()) {
        Atom left = word.get(i);
        Atom right = word.get(i + 1);
        Swap swap = swap(left, right);
        if (swap != Swap.NONE) {
          List<Atom> swapped = new ArrayList<>(head);
          swapped.add(right);
          swapped.add(left);
          expand(swapped, word, i + 2, sign.negate(), out);
          if (swap == Swap.WITH_DELTA) {
            expand(head, word, i + 2, sign, out);
          }
          return;
        }
        head.add(left);
        i++;
      }
      head.addAll(word.subList(i, word.size()));
      out.merge(head, sign, Rational::add);
    }

    private Swap swap(Atom left, Atom right) {
      Integer l = rank.get(left.operator());
      Integer r = rank.get(right.operator());
      if (l == null || r == null) {
        return Swap.NONE;
      }
      if (left.isAdjoint() && right.isAdjoint()) {
        return l < r ? Swap.PLAIN : Swap.NONE;
      }
      if (!left.isAdjoint() && !right.isAdjoint()) {
        return l < r ? Swap.PLAIN : Swap.NONE;
      }
      if (!left.isAdjoint()) {
        return l.equals(r) ? Swap.WITH_DELTA : Swap.PLAIN;
      }
      return Swap.NONE;
    }
  }

  private enum Swap {
    NONE,
    PLAIN,
    WITH_DELTA
  }
}
