package com.flamingo.ai.mathgrader.service.equivalence;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Compares numeric literal answers.
 *
 * <p>A candidate equals the truth if it matches as written, if the truth is a set containing only
 * the candidate, or if the candidate's members taken as a set match the truth. Numbers match within
 * the configured tolerance; sets ignore order and repeated members.
 */
@Component
@RequiredArgsConstructor
public class NumericLiteralComparator {

  private final SetListMatcher matcher;
  private final GraderConfig config;

  public boolean isEqual(LiteralValue candidate, LiteralValue truth) {
    if (matches(candidate, truth)) {
      return true;
    }
    if (matches(new LiteralValue.Set(List.of(candidate)), truth)) {
      return true;
    }
    List<LiteralValue> members = members(candidate);
    return members != null && matches(new LiteralValue.Set(members), truth);
  }

  private boolean matches(LiteralValue a, LiteralValue b) {
    if (a instanceof LiteralValue.Number x && b instanceof LiteralValue.Number y) {
      GraderConfig.Equivalence tolerance = config.getEquivalence();
      return Math.abs(x.value() - y.value())
          <= tolerance.getAbsoluteTolerance() + tolerance.getRelativeTolerance() * Math.abs(y.value());
    }
    if (a instanceof LiteralValue.Tuple x && b instanceof LiteralValue.Tuple y) {
      return matcher.match(x.elements(), y.elements(), AnswerKind.LIST, this::matches).equal();
    }
    if (a instanceof LiteralValue.Sequence x && b instanceof LiteralValue.Sequence y) {
      return matcher.match(x.elements(), y.elements(), AnswerKind.LIST, this::matches).equal();
    }
    if (a instanceof LiteralValue.Set x && b instanceof LiteralValue.Set y) {
      return matcher
          .match(distinct(x.elements()), distinct(y.elements()), AnswerKind.SET, this::matches)
          .equal();
    }
    return false;
  }

  private List<LiteralValue> distinct(List<LiteralValue> values) {
    List<LiteralValue> kept = new ArrayList<>();
    for (LiteralValue value : values) {
      if (kept.stream().noneMatch(k -> matches(k, value))) {
        kept.add(value);
      }
    }
    return kept;
  }

  private static List<LiteralValue> members(LiteralValue value) {
    if (value instanceof LiteralValue.Tuple t) {
      return t.elements();
    }
    if (value instanceof LiteralValue.Sequence s) {
      return s.elements();
    }
    if (value instanceof LiteralValue.Set s) {
      return s.elements();
    }
    return null;
  }
}
