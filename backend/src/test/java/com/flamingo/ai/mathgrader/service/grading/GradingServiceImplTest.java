package com.flamingo.ai.mathgrader.service.grading;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.service.equivalence.ComparisonMode;
import com.flamingo.ai.mathgrader.service.equivalence.EquivalenceEngine;
import com.flamingo.ai.mathgrader.service.equivalence.EquivalenceVerdict;
import com.flamingo.ai.mathgrader.service.equivalence.LiteralValueParser;
import com.flamingo.ai.mathgrader.service.equivalence.NumericLiteralComparator;
import com.flamingo.ai.mathgrader.service.equivalence.SetListMatcher;
import com.flamingo.ai.mathgrader.service.extraction.BoxedAnswerExtractor;
import com.flamingo.ai.mathgrader.service.llm.LlmQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GradingServiceImplTest {

  private static final String MODEL = "GPT-4o-mini";

  @Mock private AnswerParsingService parsingService;

  @Mock private EquivalenceEngine equivalenceEngine;

  @Mock private LlmQueryService llmQueryService;

  private MeterRegistry meterRegistry;

  private GradingServiceImpl service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new GradingServiceImpl(
            parsingService,
            equivalenceEngine,
            llmQueryService,
            new BoxedAnswerExtractor(),
            new LiteralValueParser(),
            new NumericLiteralComparator(new SetListMatcher(), new GraderConfig()),
            meterRegistry);
  }

  private static ParsingResult parsed() {
    return ParsingResult.builder().variant(InputVariant.PLAIN_NUMERIC).build();
  }

  private static ParsingResult failed(String message) {
    return ParsingResult.builder()
        .variant(InputVariant.PLAIN_NUMERIC)
        .errorMessage(message)
        .failedStage("extraction")
        .build();
  }

  @Nested
  @DisplayName("compare")
  class Compare {

    @Test
    @DisplayName("should report a broken solution without parsing the answer")
    void shouldStopOnBrokenSolution() {
      // Given
      when(parsingService.parse("sol", null, null)).thenReturn(failed("No boxed answer found"));

      // When
      GradingResult result = service.compare("ans", "sol", null, null);

      // Then
      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorMessage())
          .isEqualTo("Failed to evaluate reference solution: No boxed answer found");
      verify(parsingService, never()).parse(eq("ans"), any(), any());
      verifyNoInteractions(equivalenceEngine);
    }

    @Test
    @DisplayName("should report a broken answer")
    void shouldReportBrokenAnswer() {
      when(parsingService.parse("sol", null, null)).thenReturn(parsed());
      when(parsingService.parse("ans", null, null)).thenReturn(failed("Boxed answer is empty"));

      GradingResult result = service.compare("ans", "sol", null, null);

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorMessage()).isEqualTo("Failed to evaluate answer: Boxed answer is empty");
      assertThat(result.getSolution()).isNotNull();
      assertThat(result.getAnswer()).isNotNull();
    }

    @Test
    @DisplayName("should grade with the mode chosen by the solution")
    void shouldGrade() {
      when(parsingService.parse(anyString(), any(), any())).thenReturn(parsed());
      when(equivalenceEngine.compare(any(), any(), eq(ComparisonMode.NUMERIC)))
          .thenReturn(EquivalenceVerdict.equivalent());

      GradingResult result = service.compare("ans", "sol", null, null);

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.isEquivalent()).isTrue();
      assertThat(result.getMode()).isEqualTo(ComparisonMode.NUMERIC);
      assertThat(result.getModelName()).isNull();
    }

    @Test
    @DisplayName("should turn a failed verdict into an unsuccessful result")
    void shouldReportFailedVerdict() {
      when(parsingService.parse(anyString(), any(), any())).thenReturn(parsed());
      when(equivalenceEngine.compare(any(), any(), any()))
          .thenReturn(EquivalenceVerdict.failed("Normal ordering did not converge"));

      GradingResult result = service.compare("ans", "sol", null, null);

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.isEquivalent()).isFalse();
      assertThat(result.getErrorMessage()).isEqualTo("Normal ordering did not converge");
    }
  }

  @Nested
  @DisplayName("evaluate")
  class Evaluate {

    @Test
    @DisplayName("should not call the model when the solution is broken")
    void shouldNotQueryOnBrokenSolution() {
      when(parsingService.parse("sol", "x", null)).thenReturn(failed("No boxed answer found"));

      GradingResult result = service.evaluate("question", "sol", "x", null, MODEL);

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getModelName()).isEqualTo(MODEL);
      verifyNoInteractions(llmQueryService);
    }

    @Test
    @DisplayName("should grade the model response")
    void shouldGradeModelResponse() {
      when(parsingService.parse("sol", "x", null)).thenReturn(parsed());
      when(llmQueryService.solve("question", MODEL)).thenReturn("\\boxed{2x}");
      when(parsingService.parse("\\boxed{2x}", "x", null)).thenReturn(parsed());
      when(equivalenceEngine.compare(any(), any(), any()))
          .thenReturn(EquivalenceVerdict.notEquivalent("No match for part 0"));

      GradingResult result = service.evaluate("question", "sol", "x", null, MODEL);

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.isEquivalent()).isFalse();
      assertThat(result.getModelResponse()).isEqualTo("\\boxed{2x}");
      assertThat(result.getDiagnostic()).isEqualTo("No match for part 0");
    }

    @Test
    @DisplayName("should name the model response when it cannot be parsed")
    void shouldReportBrokenModelResponse() {
      when(parsingService.parse("sol", null, null)).thenReturn(parsed());
      when(llmQueryService.solve("question", MODEL)).thenReturn("I don't know");
      when(parsingService.parse("I don't know", null, null))
          .thenReturn(failed("No boxed answer found"));

      GradingResult result = service.evaluate("question", "sol", null, null, MODEL);

      assertThat(result.getErrorMessage())
          .isEqualTo("Failed to evaluate model response: No boxed answer found");
      assertThat(result.getModelResponse()).isEqualTo("I don't know");
    }
  }

  @Nested
  @DisplayName("evaluateNumericLiterals")
  class NumericLiterals {

    @Test
    @DisplayName("should compare a boxed set with the expected set")
    void shouldCompareSets() {
      when(llmQueryService.solve("question", MODEL)).thenReturn("so \\boxed{\\{1, 2\\}}");

      LiteralGradingResult result = service.evaluateNumericLiterals("question", "{2, 1}", MODEL);

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.isEquivalent()).isTrue();
      assertThat(result.getExtractedAnswer()).isEqualTo("\\{1, 2\\}");
      assertThat(result.getParsedAnswer()).isEqualTo("{1.0, 2.0}");
      assertThat(result.getParsedTruth()).isEqualTo("{2.0, 1.0}");
      assertThat(
              meterRegistry
                  .counter("grader.comparisons", "mode", "literal", "outcome", "equivalent")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not call the model when the expected value is malformed")
    void shouldRejectMalformedTruth() {
      LiteralGradingResult result = service.evaluateNumericLiterals("question", "(1, 2", MODEL);

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorMessage()).startsWith("Failed to parse expected value");
      verifyNoInteractions(llmQueryService);
    }

    @Test
    @DisplayName("should report an unboxed model response")
    void shouldReportUnboxedResponse() {
      when(llmQueryService.solve("question", MODEL)).thenReturn("about 3");

      LiteralGradingResult result = service.evaluateNumericLiterals("question", "3", MODEL);

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorMessage()).startsWith("Failed to evaluate model response");
      assertThat(result.getModelResponse()).isEqualTo("about 3");
    }
  }
}
