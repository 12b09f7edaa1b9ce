package com.flamingo.ai.mathgrader.service.grading;

import lombok.Builder;
import lombok.Getter;

/** Outcome of comparing a numeric literal answer with the expected literal. */
@Getter
@Builder
public class LiteralGradingResult {

  private final boolean success;

  @Builder.Default private final String errorMessage = "";

  private final String modelName;

  private final String modelResponse;

  /** Boxed payload taken from the model response. */
  private final String extractedAnswer;

  /** Parsed answer in literal notation. */
  private final String parsedAnswer;

  /** Parsed expected value in literal notation. */
  private final String parsedTruth;

  private final boolean equivalent;
}
