package com.flamingo.ai.mathgrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for grading a supplied answer against a solution. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {

  /** Answer text containing one boxed payload. */
  @NotBlank(message = "Input is required")
  private String input;

  @NotBlank(message = "Solution is required")
  private String solution;

  private String parameters;

  private String functions;
}
