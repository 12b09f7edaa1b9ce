package com.flamingo.ai.mathgrader.exception;

/** Exception thrown when no single well-formed boxed answer can be found. */
public class ExtractionException extends GradingException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getStage() {
    return "extraction";
  }
}
