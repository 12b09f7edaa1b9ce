package com.flamingo.ai.mathgrader.service.grading;

import com.flamingo.ai.mathgrader.exception.GradingException;
import com.flamingo.ai.mathgrader.service.evaluation.EvaluationDriver;
import com.flamingo.ai.mathgrader.service.evaluation.EvaluationSample;
import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.expression.Expr;
import com.flamingo.ai.mathgrader.service.expression.ExpressionParser;
import com.flamingo.ai.mathgrader.service.extraction.BoxedAnswerExtractor;
import com.flamingo.ai.mathgrader.service.extraction.ExtractedAnswer;
import com.flamingo.ai.mathgrader.service.normalize.LatexNormalizer;
import com.flamingo.ai.mathgrader.service.symbol.SymbolRegistry;
import com.flamingo.ai.mathgrader.service.symbol.SymbolTable;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link AnswerParsingService}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerParsingServiceImpl implements AnswerParsingService {

  private final BoxedAnswerExtractor extractor;
  private final LatexNormalizer normalizer;
  private final SymbolRegistry registry;
  private final ExpressionParser parser;
  private final EvaluationDriver driver;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "grader.parse", description = "Time to parse and evaluate one answer")
  public ParsingResult parse(String input, String parameters, String functions) {
    InputVariant variant = InputVariant.of(parameters, functions);
    ParsingResult.ParsingResultBuilder result = ParsingResult.builder().variant(variant);
    try {
      ExtractedAnswer extracted = extractor.extract(input);
      result.extractedSolutions(extracted.parts()).kind(extracted.kind());

      List<String> canonical = new ArrayList<>(extracted.size());
      for (String part : extracted.parts()) {
        canonical.add(normalizer.normalize(part));
      }
      result.intermediateExpressions(canonical);

      SymbolTable table = registry.build(parameters, functions);
      result.symbolTable(table);

      List<Expr> expressions = new ArrayList<>(canonical.size());
      for (String text : canonical) {
        expressions.add(parser.parse(text, table));
      }
      result.expressions(expressions);

      if (variant.evaluates(table)) {
        evaluate(expressions, table, result);
      }
    } catch (GradingException e) {
      recordFailure(result, e);
    }
    ParsingResult built = result.build();
    log.debug(
        "Parsed {} sub-answer(s) as {}: success={}",
        built.getExtractedSolutions().size(),
        variant,
        built.isSuccess());
    return built;
  }

  /** Evaluates every sub-answer; the first failure is recorded but later ones are still tried. */
  private void evaluate(
      List<Expr> expressions, SymbolTable table, ParsingResult.ParsingResultBuilder result) {
    EvaluationSample sample = driver.sample(table, driver.newGenerator());
    result.parameterValues(sample.values());
    List<Complex> values = new ArrayList<>(expressions.size());
    GradingException firstFailure = null;
    for (Expr expression : expressions) {
      try {
        values.add(driver.evaluate(expression, sample));
      } catch (GradingException e) {
        values.add(null);
        if (firstFailure == null) {
          firstFailure = e;
        }
      }
    }
    result.evaluationResults(values);
    if (firstFailure != null) {
      recordFailure(result, firstFailure);
    }
  }

  private void recordFailure(ParsingResult.ParsingResultBuilder result, GradingException e) {
    log.warn("Answer pipeline failed at {} stage: {}", e.getStage(), e.getMessage());
    meterRegistry.counter("grader.stage.failures", "stage", e.getStage()).increment();
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    result.errorMessage(message).failedStage(e.getStage());
  }
}
