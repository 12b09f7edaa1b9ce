package com.flamingo.ai.mathgrader.service.grading;

import com.flamingo.ai.mathgrader.exception.GradingException;
import com.flamingo.ai.mathgrader.service.equivalence.ComparisonMode;
import com.flamingo.ai.mathgrader.service.equivalence.EquivalenceEngine;
import com.flamingo.ai.mathgrader.service.equivalence.EquivalenceVerdict;
import com.flamingo.ai.mathgrader.service.equivalence.LiteralValue;
import com.flamingo.ai.mathgrader.service.equivalence.LiteralValueParser;
import com.flamingo.ai.mathgrader.service.equivalence.NumericLiteralComparator;
import com.flamingo.ai.mathgrader.service.extraction.BoxedAnswerExtractor;
import com.flamingo.ai.mathgrader.service.llm.LlmQueryService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link GradingService}.
 *
 * <p>The reference solution is always processed first so a broken solution is reported without
 * spending a model call. The comparison mode comes from the solution's input variant and symbol
 * table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GradingServiceImpl implements GradingService {

  private final AnswerParsingService parsingService;
  private final EquivalenceEngine equivalenceEngine;
  private final LlmQueryService llmQueryService;
  private final BoxedAnswerExtractor extractor;
  private final LiteralValueParser literalParser;
  private final NumericLiteralComparator literalComparator;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "grader.compare", description = "Time to grade a supplied answer")
  public GradingResult compare(
      String answer, String solution, String parameters, String functions) {
    ParsingResult solutionResult = parsingService.parse(solution, parameters, functions);
    if (!solutionResult.isSuccess()) {
      return solutionFailure(solutionResult, null);
    }
    return grade(solutionResult, answer, parameters, functions, null);
  }

  @Override
  @Timed(value = "grader.evaluate", description = "Time to query a model and grade its answer")
  public GradingResult evaluate(
      String question, String solution, String parameters, String functions, String modelName) {
    ParsingResult solutionResult = parsingService.parse(solution, parameters, functions);
    if (!solutionResult.isSuccess()) {
      return solutionFailure(solutionResult, modelName);
    }
    String response = llmQueryService.solve(question, modelName);
    return grade(solutionResult, response, parameters, functions, modelName);
  }

  @Override
  @Timed(value = "grader.evaluate.literal", description = "Time to grade a literal answer")
  public LiteralGradingResult evaluateNumericLiterals(
      String question, String truth, String modelName) {
    LiteralValue expected;
    try {
      expected = literalParser.parse(truth);
    } catch (GradingException e) {
      log.warn("Expected literal '{}' is malformed: {}", truth, e.getMessage());
      return LiteralGradingResult.builder()
          .modelName(modelName)
          .errorMessage("Failed to parse expected value: " + e.getMessage())
          .build();
    }

    String response = llmQueryService.solve(question, modelName);
    LiteralGradingResult.LiteralGradingResultBuilder result =
        LiteralGradingResult.builder()
            .modelName(modelName)
            .modelResponse(response)
            .parsedTruth(expected.toString());
    try {
      String payload = extractor.extract(response).payload();
      result.extractedAnswer(payload);
      LiteralValue actual = literalParser.parse(payload);
      boolean equivalent = literalComparator.isEqual(actual, expected);
      countComparison("literal", equivalent ? "equivalent" : "not_equivalent");
      return result.parsedAnswer(actual.toString()).equivalent(equivalent).success(true).build();
    } catch (GradingException e) {
      log.warn("Literal answer from '{}' failed at {} stage: {}", modelName, e.getStage(), e.getMessage());
      countComparison("literal", "failed");
      return result.errorMessage("Failed to evaluate model response: " + e.getMessage()).build();
    }
  }

  private GradingResult grade(
      ParsingResult solutionResult,
      String answer,
      String parameters,
      String functions,
      String modelName) {
    GradingResult.GradingResultBuilder result =
        GradingResult.builder()
            .modelName(modelName)
            .modelResponse(modelName != null ? answer : null)
            .solution(solutionResult);

    ParsingResult answerResult = parsingService.parse(answer, parameters, functions);
    result.answer(answerResult);
    if (!answerResult.isSuccess()) {
      String source = modelName != null ? "model response" : "answer";
      return result
          .errorMessage("Failed to evaluate " + source + ": " + answerResult.getErrorMessage())
          .build();
    }

    ComparisonMode mode =
        solutionResult.getVariant().comparisonMode(solutionResult.getSymbolTable());
    EquivalenceVerdict verdict =
        equivalenceEngine.compare(
            answerResult.toComparable(), solutionResult.toComparable(), mode);
    log.info(
        "Graded {} answer: {}{}",
        mode,
        verdict.outcome(),
        modelName != null ? " (model " + modelName + ")" : "");
    return result
        .mode(mode)
        .success(!verdict.isFailed())
        .equivalent(verdict.equal())
        .diagnostic(verdict.diagnostic())
        .errorMessage(verdict.isFailed() ? verdict.diagnostic() : "")
        .build();
  }

  private static GradingResult solutionFailure(ParsingResult solutionResult, String modelName) {
    return GradingResult.builder()
        .modelName(modelName)
        .solution(solutionResult)
        .errorMessage(
            "Failed to evaluate reference solution: " + solutionResult.getErrorMessage())
        .build();
  }

  private void countComparison(String mode, String outcome) {
    meterRegistry.counter("grader.comparisons", "mode", mode, "outcome", outcome).increment();
  }
}
