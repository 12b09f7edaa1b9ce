package com.flamingo.ai.mathgrader.api.dto.response;

import com.flamingo.ai.mathgrader.service.grading.LiteralGradingResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a graded numeric literal answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiteralGradingResponse {

  private boolean success;
  private String errorMessage;
  private String modelName;
  private String modelResponse;
  private String extractedAnswer;
  private String parsedAnswer;
  private String parsedSolution;
  private boolean equivalent;

  public static LiteralGradingResponse fromResult(LiteralGradingResult result) {
    return LiteralGradingResponse.builder()
        .success(result.isSuccess())
        .errorMessage(result.getErrorMessage())
        .modelName(result.getModelName())
        .modelResponse(result.getModelResponse())
        .extractedAnswer(result.getExtractedAnswer())
        .parsedAnswer(result.getParsedAnswer())
        .parsedSolution(result.getParsedTruth())
        .equivalent(result.isEquivalent())
        .build();
  }
}
