package com.flamingo.ai.mathgrader.exception;

/**
 * Base class for failures raised inside the grading pipeline.
 *
 * <p>The pipeline catches these and records {@link #getStage()} and the message in the result, so
 * they never reach the REST layer on their own.
 */
public abstract class GradingException extends RuntimeException {

  protected GradingException(String message) {
    super(message);
  }

  protected GradingException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short pipeline stage name used in metrics and log lines. */
  public abstract String getStage();
}
