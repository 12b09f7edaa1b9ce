package com.flamingo.ai.mathgrader.service.grading;

/** Runs the answer pipeline: extraction, normalization, symbol table, parsing and evaluation. */
public interface AnswerParsingService {

  /**
   * Parses an answer and, for numeric variants, evaluates it. Never throws for bad input; failures
   * are reported in the result.
   *
   * @param input raw text containing one boxed answer
   * @param parameters parameter declaration, may be blank
   * @param functions function declaration, may be blank
   */
  ParsingResult parse(String input, String parameters, String functions);
}
