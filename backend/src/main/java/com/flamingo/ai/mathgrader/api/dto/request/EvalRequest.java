package com.flamingo.ai.mathgrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a model a question and grading its answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvalRequest {

  /** Question sent to the model. */
  @NotBlank(message = "Input is required")
  private String input;

  @NotBlank(message = "Solution is required")
  private String solution;

  private String parameters;

  private String functions;

  @NotBlank(message = "Model is required")
  private String model;
}
