package com.flamingo.ai.mathgrader.service.symbol;

import java.util.List;

/**
 * Finite set of values an index letter ranges over, e.g. {@code (s, up, down)}.
 *
 * @param letter the index as written in subscripts
 * @param values substituted values in declared order
 */
public record IndexDomain(String letter, List<String> values) {

  public IndexDomain {
    values = List.copyOf(values);
  }
}
