package com.flamingo.ai.mathgrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for grading a model answer against an expected numeric literal. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiteralEvalRequest {

  /** Question sent to the model. */
  @NotBlank(message = "Input is required")
  private String input;

  /** Expected value, e.g. {@code 3}, {@code (1, 2)} or {@code {1, 2}}. */
  @NotBlank(message = "Solution is required")
  private String solution;

  @NotBlank(message = "Model is required")
  private String model;
}
