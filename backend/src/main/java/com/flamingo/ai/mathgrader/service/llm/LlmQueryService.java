package com.flamingo.ai.mathgrader.service.llm;

import java.util.List;

/** Service for querying language models. */
public interface LlmQueryService {

  /**
   * Asks a model to solve a question; the current prompt suffix is appended.
   *
   * @throws com.flamingo.ai.mathgrader.exception.UnsupportedModelException for unknown models
   * @throws com.flamingo.ai.mathgrader.exception.LlmServiceException if the model cannot answer
   */
  String solve(String question, String modelName);

  /** Sends a prompt unchanged and returns the raw reply. */
  String query(String prompt, String modelName);

  List<String> supportedModels();
}
