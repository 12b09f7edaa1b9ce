package com.flamingo.ai.mathgrader.service.extraction;

import java.util.List;

/**
 * The answer-bearing part of a response, split into sub-answers.
 *
 * @param payload raw text found inside the box marker
 * @param parts trimmed, non-empty sub-answers in written order
 * @param kind set or list, from the bracket style of the payload
 */
public record ExtractedAnswer(String payload, List<String> parts, AnswerKind kind) {

  public ExtractedAnswer {
    parts = List.copyOf(parts);
  }

  public int size() {
    return parts.size();
  }
}
