package com.flamingo.ai.mathgrader.service.equivalence;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mathgrader.GraderFixtures;
import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EquivalenceEngineTest {

  private GraderFixtures fixtures;
  private EquivalenceEngine engine;

  @BeforeEach
  void setUp() {
    fixtures = new GraderFixtures();
    engine = fixtures.engine;
  }

  private ComparableAnswer answer(String text, String parameters, String functions) {
    return fixtures.parsingService.parse(text, parameters, functions).toComparable();
  }

  private EquivalenceVerdict compare(
      String candidate, String reference, String parameters, String functions, ComparisonMode mode) {
    return engine.compare(
        answer(candidate, parameters, functions), answer(reference, parameters, functions), mode);
  }

  @Nested
  @DisplayName("numeric")
  class Numeric {

    @Test
    @DisplayName("equal values within tolerance are equivalent")
    void equalValues() {
      EquivalenceVerdict verdict =
          compare("\\boxed{\\frac{1}{2}}", "\\boxed{0.5}", "", "", ComparisonMode.NUMERIC);

      assertThat(verdict.equal()).isTrue();
      assertThat(
              fixtures
                  .meterRegistry
                  .counter("grader.comparisons", "mode", "numeric", "outcome", "equivalent")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("bare answers are compared position by position")
    void bareAnswersRespectOrder() {
      EquivalenceVerdict verdict =
          compare("\\boxed{2; 1}", "\\boxed{1; 2}", "", "", ComparisonMode.NUMERIC);

      assertThat(verdict.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
      assertThat(verdict.diagnostic()).isEqualTo("Part 0 differs");
    }

    @Test
    @DisplayName("sets match regardless of order")
    void setsIgnoreOrder() {
      EquivalenceVerdict verdict =
          compare(
              "\\boxed{\\{x^2; x\\}}",
              "\\boxed{\\{x; x^2\\}}",
              "x",
              "",
              ComparisonMode.NUMERIC);

      assertThat(verdict.equal()).isTrue();
    }

    @Test
    @DisplayName("a bare answer is matched as a set against a set reference")
    void bareAnswerAgainstSet() {
      EquivalenceVerdict verdict =
          compare(
              "\\boxed{x^2; x}", "\\boxed{\\{x; x^2\\}}", "x", "", ComparisonMode.NUMERIC);

      assertThat(verdict.equal()).isTrue();
    }

    @Test
    @DisplayName("lists respect order")
    void listsRespectOrder() {
      EquivalenceVerdict verdict =
          compare("\\boxed{[x^2; x]}", "\\boxed{[x; x^2]}", "x", "", ComparisonMode.NUMERIC);

      assertThat(verdict.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
    }

    @Test
    @DisplayName("a different number of parts is reported as a shape mismatch")
    void shapeMismatch() {
      EquivalenceVerdict verdict =
          compare("\\boxed{1; 2}", "\\boxed{1}", "", "", ComparisonMode.NUMERIC);

      assertThat(verdict.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
      assertThat(verdict.diagnostic()).isEqualTo("Evaluation shapes don't match: 2 vs 1");
    }

    @Test
    @DisplayName("closeness is measured against the reference value")
    void toleranceIsRelativeToReference() {
      assertThat(engine.isClose(Complex.real(100000.5), Complex.real(100000.0))).isTrue();
      assertThat(engine.isClose(Complex.real(1.001), Complex.real(1.0))).isFalse();
      assertThat(engine.isClose(new Complex(0.0, 1.0), new Complex(0.0, 1.0 + 1e-8))).isTrue();
    }
  }

  @Nested
  @DisplayName("symbolic")
  class Symbolic {

    @Test
    @DisplayName("algebraically equal expressions with declared functions are equivalent")
    void equalExpressions() {
      EquivalenceVerdict verdict =
          compare("\\boxed{f(x) + f(x)}", "\\boxed{2 f(x)}", "x", "f", ComparisonMode.SYMBOLIC);

      assertThat(verdict.equal()).isTrue();
    }

    @Test
    @DisplayName("bare answers are compared as a multiset")
    void bareAnswersIgnoreOrder() {
      EquivalenceVerdict verdict =
          compare("\\boxed{f(x); x}", "\\boxed{x; f(x)}", "x", "f", ComparisonMode.SYMBOLIC);

      assertThat(verdict.equal()).isTrue();
    }

    @Test
    @DisplayName("huge integer exponents stay unexpanded")
    void hugeExponentStaysOpaque() {
      EquivalenceVerdict same =
          compare(
              "\\boxed{x^{10000000000}}",
              "\\boxed{x^{10000000000}}",
              "x",
              "f",
              ComparisonMode.SYMBOLIC);
      EquivalenceVerdict different =
          compare(
              "\\boxed{2^{1000000000}}",
              "\\boxed{2^{1000000001}}",
              "x",
              "f",
              ComparisonMode.SYMBOLIC);

      assertThat(same.equal()).isTrue();
      assertThat(different.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
    }

    @Test
    @DisplayName("an exact power too large to compute is a failed verdict")
    void oversizedPowerFails() {
      EquivalenceVerdict verdict =
          compare(
              "\\boxed{(10^{1000})^{1000}}", "\\boxed{1}", "x", "f", ComparisonMode.SYMBOLIC);

      assertThat(verdict.isFailed()).isTrue();
      assertThat(verdict.diagnostic()).contains("too large");
    }

    @Test
    @DisplayName("different arguments are not equivalent")
    void differentArguments() {
      EquivalenceVerdict verdict =
          compare("\\boxed{f(2x)}", "\\boxed{2 f(x)}", "x", "f", ComparisonMode.SYMBOLIC);

      assertThat(verdict.equal()).isFalse();
    }
  }

  @Nested
  @DisplayName("non-commutative")
  class NonCommutative {

    @Test
    @DisplayName("anticommutation relations are applied")
    void anticommutation() {
      EquivalenceVerdict verdict =
          compare(
              "\\boxed{c c^\\dagger}",
              "\\boxed{1 - c^\\dagger c}",
              "(c, NC)",
              "",
              ComparisonMode.NON_COMMUTATIVE);

      assertThat(verdict.equal()).isTrue();
    }

    @Test
    @DisplayName("operator order still matters")
    void orderMatters() {
      EquivalenceVerdict verdict =
          compare(
              "\\boxed{c c^\\dagger}",
              "\\boxed{c^\\dagger c}",
              "(c, NC)",
              "",
              ComparisonMode.NON_COMMUTATIVE);

      assertThat(verdict.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
    }

    @Test
    @DisplayName("non-convergence is a failed verdict, not an exception")
    void nonConvergenceFails() {
      fixtures.config.getEquivalence().setNormalOrderingCap(1);

      EquivalenceVerdict verdict =
          compare(
              "\\boxed{c c^\\dagger}",
              "\\boxed{1 - c^\\dagger c}",
              "(c, NC)",
              "",
              ComparisonMode.NON_COMMUTATIVE);

      assertThat(verdict.isFailed()).isTrue();
      assertThat(verdict.diagnostic()).contains("did not converge");
    }
  }

  @Nested
  @DisplayName("answer kinds")
  class Kinds {

    private final ComparableAnswer set =
        new ComparableAnswer(
            AnswerKind.SET, List.of(), List.of(Complex.real(2.0), Complex.real(1.0)));
    private final ComparableAnswer list =
        new ComparableAnswer(
            AnswerKind.LIST, List.of(), List.of(Complex.real(1.0), Complex.real(2.0)));

    @Test
    @DisplayName("a set never equals a list, whichever side is the reference")
    void setAndListDiffer() {
      EquivalenceVerdict listAgainstSet = engine.compare(list, set, ComparisonMode.NUMERIC);
      EquivalenceVerdict setAgainstList = engine.compare(set, list, ComparisonMode.NUMERIC);

      assertThat(listAgainstSet.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
      assertThat(listAgainstSet.diagnostic())
          .isEqualTo("Answer kind list differs from expected set");
      assertThat(setAgainstList.outcome()).isEqualTo(EquivalenceVerdict.Outcome.NOT_EQUIVALENT);
      assertThat(setAgainstList.diagnostic())
          .isEqualTo("Answer kind set differs from expected list");
    }

    @Test
    @DisplayName("symbolic answers of different kinds differ in both directions")
    void symbolicKindsDiffer() {
      EquivalenceVerdict listAgainstSet =
          compare(
              "\\boxed{[1; 2]}", "\\boxed{\\{2; 1\\}}", "x", "f", ComparisonMode.SYMBOLIC);
      EquivalenceVerdict setAgainstList =
          compare(
              "\\boxed{\\{2; 1\\}}", "\\boxed{[1; 2]}", "x", "f", ComparisonMode.SYMBOLIC);

      assertThat(listAgainstSet.equal()).isFalse();
      assertThat(setAgainstList.equal()).isFalse();
    }

    @Test
    @DisplayName("bare answers count as lists for numbers and as sets for expressions")
    void bareKindDependsOnMode() {
      assertThat(
              EquivalenceEngine.matchingKind(
                  AnswerKind.BARE, AnswerKind.BARE, ComparisonMode.NUMERIC))
          .isEqualTo(AnswerKind.LIST);
      assertThat(
              EquivalenceEngine.matchingKind(
                  AnswerKind.BARE, AnswerKind.BARE, ComparisonMode.SYMBOLIC))
          .isEqualTo(AnswerKind.SET);
      assertThat(
              EquivalenceEngine.matchingKind(
                  AnswerKind.BARE, AnswerKind.LIST, ComparisonMode.NON_COMMUTATIVE))
          .isNull();
    }
  }
}
