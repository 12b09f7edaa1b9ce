package com.flamingo.ai.mathgrader.service.grading;

import com.flamingo.ai.mathgrader.service.equivalence.ComparableAnswer;
import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.expression.Expr;
import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import com.flamingo.ai.mathgrader.service.symbol.SymbolTable;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything the pipeline produced for one answer, up to the first failing stage.
 *
 * <p>Fields of stages that did not run are empty. {@code evaluationResults} holds {@code null} at
 * the position of a sub-answer that failed to evaluate.
 */
@Getter
@Builder
public class ParsingResult {

  private final InputVariant variant;

  @Builder.Default private final List<String> extractedSolutions = List.of();

  @Builder.Default private final AnswerKind kind = AnswerKind.BARE;

  @Builder.Default private final List<String> intermediateExpressions = List.of();

  @Builder.Default private final List<Expr> expressions = List.of();

  @Builder.Default private final SymbolTable symbolTable = SymbolTable.empty();

  @Builder.Default private final Map<String, Double> parameterValues = Map.of();

  @Builder.Default private final List<Complex> evaluationResults = List.of();

  /** Message of the first failure; empty on success. */
  @Builder.Default private final String errorMessage = "";

  /** Stage of the first failure, or null on success. */
  private final String failedStage;

  public boolean isSuccess() {
    return errorMessage.isEmpty();
  }

  /** The parsed answer as one side of a comparison. */
  public ComparableAnswer toComparable() {
    return new ComparableAnswer(kind, expressions, evaluationResults);
  }
}
