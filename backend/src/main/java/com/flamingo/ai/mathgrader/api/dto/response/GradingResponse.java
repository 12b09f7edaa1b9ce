package com.flamingo.ai.mathgrader.api.dto.response;

import com.flamingo.ai.mathgrader.service.grading.GradingResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a graded answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GradingResponse {

  private boolean success;
  private String errorMessage;
  private String modelName;
  private String modelResponse;
  private String mode;
  private boolean equivalent;
  private String diagnostic;
  private ParsingResponse solution;
  private ParsingResponse answer;

  public static GradingResponse fromResult(GradingResult result) {
    return GradingResponse.builder()
        .success(result.isSuccess())
        .errorMessage(result.getErrorMessage())
        .modelName(result.getModelName())
        .modelResponse(result.getModelResponse())
        .mode(result.getMode() != null ? result.getMode().name() : null)
        .equivalent(result.isEquivalent())
        .diagnostic(result.getDiagnostic())
        .solution(
            result.getSolution() != null ? ParsingResponse.fromResult(result.getSolution()) : null)
        .answer(result.getAnswer() != null ? ParsingResponse.fromResult(result.getAnswer()) : null)
        .build();
  }
}
