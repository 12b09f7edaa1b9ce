package com.flamingo.ai.mathgrader.exception;

/** Exception thrown when an expression cannot be evaluated to a finite number. */
public class EvaluationException extends GradingException {

  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getStage() {
    return "evaluation";
  }
}
