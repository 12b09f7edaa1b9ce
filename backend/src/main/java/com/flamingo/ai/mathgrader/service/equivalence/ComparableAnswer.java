package com.flamingo.ai.mathgrader.service.equivalence;

import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.expression.Expr;
import com.flamingo.ai.mathgrader.service.extraction.AnswerKind;
import java.util.List;

/**
 * One side of a comparison: the parsed sub-answers and, for numeric comparison, their values.
 *
 * @param kind set or list
 * @param expressions parsed sub-answers
 * @param values evaluated sub-answers; empty when the answer was not evaluated
 */
public record ComparableAnswer(AnswerKind kind, List<Expr> expressions, List<Complex> values) {

  public ComparableAnswer {
    expressions = List.copyOf(expressions);
    values = List.copyOf(values);
  }
}
