package com.flamingo.ai.mathgrader.service.grading;

/** Service for grading answers against reference solutions. */
public interface GradingService {

  /**
   * Grades a given answer against a solution without asking a model.
   *
   * @param answer raw answer text with one boxed payload
   * @param solution raw solution text with one boxed payload
   * @param parameters parameter declaration, may be blank
   * @param functions function declaration, may be blank
   */
  GradingResult compare(String answer, String solution, String parameters, String functions);

  /**
   * Asks a model the question, then grades its answer against the solution.
   *
   * @throws com.flamingo.ai.mathgrader.exception.UnsupportedModelException for unknown models
   * @throws com.flamingo.ai.mathgrader.exception.LlmServiceException if the model cannot answer
   */
  GradingResult evaluate(
      String question, String solution, String parameters, String functions, String modelName);

  /**
   * Asks a model the question, then compares its boxed answer with the expected literal value
   * (numbers, tuples, lists and sets of numbers).
   */
  LiteralGradingResult evaluateNumericLiterals(String question, String truth, String modelName);
}
