package com.flamingo.ai.mathgrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for parsing and evaluating one answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseRequest {

  @NotBlank(message = "Input is required")
  private String input;

  /** Parameter declaration, e.g. {@code x; (s, up, down); m_s}. */
  private String parameters;

  /** Function declaration; its presence makes the comparison symbolic. */
  private String functions;
}
