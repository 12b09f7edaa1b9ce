package com.flamingo.ai.mathgrader.service.grading;

import com.flamingo.ai.mathgrader.service.equivalence.ComparisonMode;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of grading one answer against a reference solution.
 *
 * <p>{@code success} is false when either side failed in the pipeline or the comparison itself
 * failed; {@code equivalent} is only meaningful when {@code success} is true.
 */
@Getter
@Builder
public class GradingResult {

  private final boolean success;

  @Builder.Default private final String errorMessage = "";

  /** Model asked for the answer, or null when the answer was supplied directly. */
  private final String modelName;

  private final String modelResponse;

  private final ComparisonMode mode;

  private final boolean equivalent;

  @Builder.Default private final String diagnostic = "";

  private final ParsingResult solution;

  private final ParsingResult answer;
}
