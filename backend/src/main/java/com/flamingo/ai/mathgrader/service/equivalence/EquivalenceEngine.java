package com.flamingo.ai.mathgrader.service.equivalence;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.GradingException;
import com.flamingo.ai.mathgrader.service.algebra.Polynomial;
import com.flamingo.ai.mathgrader.service.algebra.PolynomialExpander;
import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a candidate answer is equivalent to a reference answer.
 *
 * <p>A set answer never equals a list answer. A bare answer takes the kind of the other side; when
 * both are bare, numeric results are compared position by position and expressions as a multiset.
 * Pipeline failures raised while expanding or normal-ordering are reported as {@link
 * EquivalenceVerdict.Outcome#FAILED}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EquivalenceEngine {

  private final PolynomialExpander expander;
  private final NormalOrderer normalOrderer;
  private final SetListMatcher matcher;
  private final GraderConfig config;
  private final MeterRegistry meterRegistry;

  public EquivalenceVerdict compare(
      ComparableAnswer candidate, ComparableAnswer reference, ComparisonMode mode) {
    EquivalenceVerdict verdict;
    AnswerKind kind = matchingKind(candidate.kind(), reference.kind(), mode);
    try {
      if (kind == null) {
        verdict =
            EquivalenceVerdict.notEquivalent(
                "Answer kind "
                    + candidate.kind().name().toLowerCase()
                    + " differs from expected "
                    + reference.kind().name().toLowerCase());
      } else {
        verdict =
            switch (mode) {
              case NUMERIC -> compareNumeric(candidate, reference, kind);
              case SYMBOLIC -> compareSymbolic(candidate, reference, kind);
              case NON_COMMUTATIVE -> compareNonCommutative(candidate, reference, kind);
            };
      }
    } catch (GradingException e) {
      log.warn("Comparison failed in {} stage: {}", e.getStage(), e.getMessage());
      verdict = EquivalenceVerdict.failed(e.getMessage());
    }
    Counter.builder("grader.comparisons")
        .tag("mode", mode.tag())
        .tag("outcome", verdict.outcome().name().toLowerCase())
        .register(meterRegistry)
        .increment();
    log.debug("{} comparison: {} {}", mode, verdict.outcome(), verdict.diagnostic());
    return verdict;
  }

  /** Set or list matching for the two kinds, or null when they cannot be equal. */
  static AnswerKind matchingKind(AnswerKind candidate, AnswerKind reference, ComparisonMode mode) {
    if (mode == ComparisonMode.NUMERIC) {
      if (candidate == AnswerKind.BARE) {
        return reference.orList();
      }
      if (reference == AnswerKind.BARE || candidate == reference) {
        return candidate;
      }
      return null;
    }
    return candidate.orSet() == reference.orSet() ? reference.orSet() : null;
  }

  private EquivalenceVerdict compareNumeric(
      ComparableAnswer candidate, ComparableAnswer reference, AnswerKind kind) {
    if (candidate.values().size() != reference.values().size()) {
      return EquivalenceVerdict.notEquivalent(
          "Evaluation shapes don't match: "
              + candidate.values().size()
              + " vs "
              + reference.values().size());
    }
    return matcher.match(candidate.values(), reference.values(), kind, this::isClose);
  }

  private EquivalenceVerdict compareSymbolic(
      ComparableAnswer candidate, ComparableAnswer reference, AnswerKind kind) {
    return matcher.match(expandAll(candidate), expandAll(reference), kind, Polynomial::equals);
  }

  private EquivalenceVerdict compareNonCommutative(
      ComparableAnswer candidate, ComparableAnswer reference, AnswerKind kind) {
    return matcher.match(
        expandAll(candidate),
        expandAll(reference),
        kind,
        (a, b) -> normalOrderer.normalOrder(a.minus(b)).isZero());
  }

  private List<Polynomial> expandAll(ComparableAnswer answer) {
    List<Polynomial> expanded = new ArrayList<>(answer.expressions().size());
    answer.expressions().forEach(e -> expanded.add(expander.expand(e)));
    return expanded;
  }

  /** {@code |a - b| <= atol + rtol * |b|}, with {@code b} the reference value. */
  boolean isClose(Complex a, Complex b) {
    GraderConfig.Equivalence tolerance = config.getEquivalence();
    return a.minus(b).abs()
        <= tolerance.getAbsoluteTolerance() + tolerance.getRelativeTolerance() * b.abs();
  }
}
