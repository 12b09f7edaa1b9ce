package com.flamingo.ai.mathgrader;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.service.algebra.PolynomialExpander;
import com.flamingo.ai.mathgrader.service.equivalence.EquivalenceEngine;
import com.flamingo.ai.mathgrader.service.equivalence.NormalOrderer;
import com.flamingo.ai.mathgrader.service.equivalence.SetListMatcher;
import com.flamingo.ai.mathgrader.service.evaluation.EvaluationDriver;
import com.flamingo.ai.mathgrader.service.expression.ExpressionEvaluator;
import com.flamingo.ai.mathgrader.service.expression.ExpressionParser;
import com.flamingo.ai.mathgrader.service.extraction.BoxedAnswerExtractor;
import com.flamingo.ai.mathgrader.service.grading.AnswerParsingServiceImpl;
import com.flamingo.ai.mathgrader.service.normalize.LatexNormalizer;
import com.flamingo.ai.mathgrader.service.normalize.SubscriptCanonicalizer;
import com.flamingo.ai.mathgrader.service.symbol.SymbolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/** Real pipeline components wired by hand, with default configuration. */
public final class GraderFixtures {

  public final GraderConfig config = new GraderConfig();
  public final MeterRegistry meterRegistry = new SimpleMeterRegistry();
  public final BoxedAnswerExtractor extractor = new BoxedAnswerExtractor();
  public final SubscriptCanonicalizer canonicalizer = new SubscriptCanonicalizer();
  public final LatexNormalizer normalizer =
      new LatexNormalizer(canonicalizer, config, meterRegistry);
  public final SymbolRegistry registry = new SymbolRegistry(canonicalizer);
  public final ExpressionParser parser = new ExpressionParser();
  public final ExpressionEvaluator evaluator = new ExpressionEvaluator();
  public final EvaluationDriver driver = new EvaluationDriver(evaluator, config);
  public final PolynomialExpander expander = new PolynomialExpander();
  public final SetListMatcher matcher = new SetListMatcher();
  public final NormalOrderer normalOrderer = new NormalOrderer(config);
  public final EquivalenceEngine engine =
      new EquivalenceEngine(expander, normalOrderer, matcher, config, meterRegistry);
  public final AnswerParsingServiceImpl parsingService =
      new AnswerParsingServiceImpl(extractor, normalizer, registry, parser, driver, meterRegistry);
}
