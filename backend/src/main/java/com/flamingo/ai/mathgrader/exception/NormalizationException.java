package com.flamingo.ai.mathgrader.exception;

/** Exception thrown when the rewrite cascade leaves nothing to parse. */
public class NormalizationException extends GradingException {

  public NormalizationException(String message) {
    super(message);
  }

  public NormalizationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getStage() {
    return "normalization";
  }
}
