package com.flamingo.ai.mathgrader.service.equivalence;

import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;
import org.springframework.stereotype.Component;

/**
 * Matches the members of two answers with a pairwise predicate.
 *
 * <p>Lists are compared position by position. Sets are matched greedily: each candidate member
 * takes the first still-unmatched reference member it is equivalent to, with no backtracking. The
 * greedy result is only order-independent when the predicate is transitive, which tolerance-based
 * numeric closeness is not.
 */
@Component
public class SetListMatcher {

  /**
   * Compares {@code candidate} with {@code reference}.
   *
   * @param kind how members are matched
   * @param equivalent pairwise predicate, called as {@code equivalent.test(candidateMember,
   *     referenceMember)}
   */
  public <T> EquivalenceVerdict match(
      List<T> candidate, List<T> reference, AnswerKind kind, BiPredicate<T, T> equivalent) {
    if (candidate.size() != reference.size()) {
      return EquivalenceVerdict.notEquivalent(
          "Answer has " + candidate.size() + " parts, expected " + reference.size());
    }
    return kind == AnswerKind.LIST
        ? matchPositional(candidate, reference, equivalent)
        : matchGreedy(candidate, reference, equivalent);
  }

  private static <T> EquivalenceVerdict matchPositional(
      List<T> candidate, List<T> reference, BiPredicate<T, T> equivalent) {
    for (int i = 0; i < candidate.size(); i++) {
      if (!equivalent.test(candidate.get(i), reference.get(i))) {
        return EquivalenceVerdict.notEquivalent("Part " + i + " differs");
      }
    }
    return EquivalenceVerdict.equivalent();
  }

  private static <T> EquivalenceVerdict matchGreedy(
      List<T> candidate, List<T> reference, BiPredicate<T, T> equivalent) {
    List<T> remaining = new ArrayList<>(reference);
    for (int i = 0; i < candidate.size(); i++) {
      T member = candidate.get(i);
      int hit = -1;
      for (int j = 0; j < remaining.size(); j++) {
        if (equivalent.test(member, remaining.get(j))) {
          hit = j;
          break;
        }
      }
      if (hit < 0) {
        return EquivalenceVerdict.notEquivalent("No match for part " + i);
      }
      remaining.remove(hit);
    }
    return EquivalenceVerdict.equivalent();
  }
}
