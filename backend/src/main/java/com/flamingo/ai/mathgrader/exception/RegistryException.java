package com.flamingo.ai.mathgrader.exception;

/** Exception thrown for malformed parameter or function declarations. */
public class RegistryException extends GradingException {

  public RegistryException(String message) {
    super(message);
  }

  public RegistryException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getStage() {
    return "registry";
  }
}
