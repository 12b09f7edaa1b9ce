package com.flamingo.ai.mathgrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a raw model query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Prompt is required")
  private String prompt;

  @NotBlank(message = "Model is required")
  private String model;
}
