package com.flamingo.ai.mathgrader.api.dto.response;

import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.grading.ParsingResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for one parsed answer.
 *
 * <p>Real evaluation results are JSON numbers; complex ones are strings such as {@code
 * "0.785398-0.658479j"}. A sub-answer that failed to evaluate is {@code null}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsingResponse {

  private boolean success;
  private String errorMessage;
  private String failedStage;
  private String variant;
  private String answerKind;
  private List<String> extractedSolutions;
  private List<String> intermediateExpressions;
  private List<String> expressions;
  private Map<String, Double> parameterValues;
  private List<Object> evaluationResults;

  public static ParsingResponse fromResult(ParsingResult result) {
    return ParsingResponse.builder()
        .success(result.isSuccess())
        .errorMessage(result.getErrorMessage())
        .failedStage(result.getFailedStage())
        .variant(result.getVariant() != null ? result.getVariant().name() : null)
        .answerKind(result.getKind().name())
        .extractedSolutions(result.getExtractedSolutions())
        .intermediateExpressions(result.getIntermediateExpressions())
        .expressions(result.getExpressions().stream().map(Object::toString).toList())
        .parameterValues(result.getParameterValues())
        .evaluationResults(serialize(result.getEvaluationResults()))
        .build();
  }

  private static List<Object> serialize(List<Complex> values) {
    List<Object> serialized = new ArrayList<>(values.size());
    for (Complex value : values) {
      if (value == null) {
        serialized.add(null);
      } else if (value.isReal()) {
        serialized.add(value.re());
      } else {
        serialized.add(value.format());
      }
    }
    return serialized;
  }
}
