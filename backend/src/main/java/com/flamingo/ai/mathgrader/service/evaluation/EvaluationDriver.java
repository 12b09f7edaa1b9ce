package com.flamingo.ai.mathgrader.service.evaluation;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.EvaluationException;
import com.flamingo.ai.mathgrader.service.expression.Complex;
import com.flamingo.ai.mathgrader.service.expression.Expr;
import com.flamingo.ai.mathgrader.service.expression.ExpressionEvaluator;
import com.flamingo.ai.mathgrader.service.symbol.SymbolSpec;
import com.flamingo.ai.mathgrader.service.symbol.SymbolTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Draws parameter values and evaluates expressions numerically.
 *
 * <p>Each parameter gets a uniform value in {@code [lower, upper)} from the generator the caller
 * passes in; the pinned variable always gets the pinned value. Callers create one generator per
 * request with {@link #newGenerator()}, so equal inputs always see equal samples and concurrent
 * requests never share random state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvaluationDriver {

  private final ExpressionEvaluator evaluator;
  private final GraderConfig config;

  /** A generator seeded with the configured seed. */
  public Random newGenerator() {
    return new Random(config.getSampling().getSeed());
  }

  /** Draws one value per parameter in declaration order. */
  public EvaluationSample sample(SymbolTable table, Random random) {
    GraderConfig.Sampling sampling = config.getSampling();
    Map<String, Double> values = new LinkedHashMap<>();
    for (SymbolSpec spec : table.parameters()) {
      double drawn = sampling.getLower() + (sampling.getUpper() - sampling.getLower()) * random.nextDouble();
      values.put(spec.name(), drawn);
    }
    if (values.containsKey(sampling.getPinnedVariable())) {
      values.put(sampling.getPinnedVariable(), sampling.getPinnedValue());
    }
    log.debug("Sampled parameter values {}", values);
    return new EvaluationSample(values);
  }

  /**
   * Evaluates every expression under {@code sample}.
   *
   * @throws EvaluationException if any expression fails to evaluate
   */
  public List<Complex> evaluate(List<Expr> expressions, EvaluationSample sample) {
    List<Complex> results = new ArrayList<>(expressions.size());
    for (Expr expression : expressions) {
      results.add(evaluate(expression, sample));
    }
    return results;
  }

  /**
   * Evaluates one expression under {@code sample}.
   *
   * @throws EvaluationException if the expression does not evaluate to a finite number
   */
  public Complex evaluate(Expr expression, EvaluationSample sample) {
    return evaluator.evaluate(expression, sample.asComplex());
  }
}
