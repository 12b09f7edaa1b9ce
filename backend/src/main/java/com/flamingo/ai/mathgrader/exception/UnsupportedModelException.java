package com.flamingo.ai.mathgrader.exception;

import java.util.Collection;

/** Exception thrown when a request names a language model that is not in the catalog. */
public class UnsupportedModelException extends RuntimeException {

  private final String modelName;

  public UnsupportedModelException(String modelName, Collection<String> supported) {
    super("Model '" + modelName + "' is not supported. Supported models: " + supported);
    this.modelName = modelName;
  }

  public String getModelName() {
    return modelName;
  }
}
