package com.flamingo.ai.mathgrader.exception;

/** Exception thrown when a language model cannot be reached or returns no answer. */
public class LlmServiceException extends RuntimeException {

  private final String modelName;
  private final String userMessage;

  public LlmServiceException(String modelName, String message, Throwable cause) {
    super(message, cause);
    this.modelName = modelName;
    this.userMessage =
        "Model '" + modelName + "' is temporarily unavailable. Please try again later.";
  }

  public String getModelName() {
    return modelName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
