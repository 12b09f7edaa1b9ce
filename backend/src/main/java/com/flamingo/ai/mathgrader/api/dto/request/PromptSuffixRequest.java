package com.flamingo.ai.mathgrader.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for replacing the prompt suffix; an empty suffix is allowed. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptSuffixRequest {

  @NotNull(message = "Suffix is required")
  private String suffix;
}
