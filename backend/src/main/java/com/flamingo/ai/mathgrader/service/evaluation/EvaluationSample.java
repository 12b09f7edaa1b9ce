package com.flamingo.ai.mathgrader.service.evaluation;

import com.flamingo.ai.mathgrader.service.expression.Complex;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values assigned to the parameters for one evaluation, in declaration order.
 *
 * @param values parameter name to value
 */
public record EvaluationSample(Map<String, Double> values) {

  public EvaluationSample {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static EvaluationSample empty() {
    return new EvaluationSample(Map.of());
  }

  /** Values as complex numbers for {@link com.flamingo.ai.mathgrader.service.expression.ExpressionEvaluator}. */
  public Map<String, Complex> asComplex() {
    Map<String, Complex> result = new LinkedHashMap<>();
    values.forEach((name, value) -> result.put(name, Complex.real(value)));
    return result;
  }
}
