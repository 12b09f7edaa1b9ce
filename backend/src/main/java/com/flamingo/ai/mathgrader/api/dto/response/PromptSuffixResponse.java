package com.flamingo.ai.mathgrader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO carrying the current prompt suffix. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptSuffixResponse {

  private String suffix;
}
