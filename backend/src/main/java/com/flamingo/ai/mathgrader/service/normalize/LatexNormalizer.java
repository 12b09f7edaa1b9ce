package com.flamingo.ai.mathgrader.service.normalize;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.NormalizationException;
import com.flamingo.ai.mathgrader.service.rewrite.CapPolicy;
import com.flamingo.ai.mathgrader.service.rewrite.Fixpoint;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns one LaTeX sub-answer into canonical expression text.
 *
 * <p>Phases run in a fixed order: identifier canonicalization, markup deletion, function rewrites,
 * nested rewrites repeated until stable (bounded by {@code grader.normalizer.nested-rule-cap}),
 * final rewrites, function-argument resolution, and removal of leftover backslashes. Running the
 * normalizer on its own output returns the output unchanged.
 */
@Component
@Slf4j
public class LatexNormalizer {

  private static final Pattern SQUARED_FUNCTION =
      Pattern.compile(
          "(?<![a-zA-Z_])\\\\?"
              + NormalizationRules.SQUARED_PREFIX
              + "("
              + NormalizationRules.TRIG
              + ")(?![a-zA-Z])");

  private final SubscriptCanonicalizer canonicalizer;
  private final Fixpoint<String> nestedPhase;
  private final MeterRegistry meterRegistry;

  public LatexNormalizer(
      SubscriptCanonicalizer canonicalizer, GraderConfig config, MeterRegistry meterRegistry) {
    this.canonicalizer = canonicalizer;
    this.meterRegistry = meterRegistry;
    this.nestedPhase =
        new Fixpoint<>(
            "Nested LaTeX rewrite",
            text -> applyAll(NormalizationRules.NESTED, text),
            config.getNormalizer().getNestedRuleCap(),
            CapPolicy.STOP);
  }

  /**
   * Normalizes a sub-answer.
   *
   * @param subAnswer LaTeX text of one sub-answer
   * @return canonical expression text
   * @throws NormalizationException if nothing is left after rewriting
   */
  public String normalize(String subAnswer) {
    if (subAnswer == null) {
      throw new NormalizationException("Sub-answer is null");
    }
    String text = canonicalizer.canonicalize(subAnswer);
    text = applyAll(NormalizationRules.DELETIONS, text);
    text = applyAll(NormalizationRules.FUNCTIONS, text);

    Fixpoint.Outcome<String> nested = nestedPhase.apply(text);
    if (!nested.isConverged()) {
      log.warn("Nested rewrite cap reached for '{}'", subAnswer);
      meterRegistry.counter("grader.normalizer.cap_reached").increment();
    }
    text = applyAll(NormalizationRules.FINAL, nested.getValue());

    text = NormalizationRules.SPACE_BEFORE_FUNCTION.apply(text);
    text = NormalizationRules.IMPLICIT_APPLICATION.apply(text);
    text = expandSquaredFunctions(text);
    text = text.replace("\\", "").replaceAll("\\s+", " ").trim();

    if (text.isEmpty()) {
      throw new NormalizationException("Expression is empty after normalization: '" + subAnswer + "'");
    }
    log.debug("Normalized '{}' -> '{}'", subAnswer, text);
    return text;
  }

  private static String applyAll(List<RewriteRule> rules, String text) {
    String result = text;
    for (RewriteRule rule : rules) {
      result = rule.apply(result);
    }
    return result;
  }

  /** Rewrites {@code sqsin(arg)} to {@code sin(arg)^2} and a bare {@code sqsin} to {@code sin^2}. */
  static String expandSquaredFunctions(String text) {
    StringBuilder out = new StringBuilder();
    Matcher matcher = SQUARED_FUNCTION.matcher(text);
    int last = 0;
    while (matcher.find(last)) {
      out.append(text, last, matcher.start());
      String function = matcher.group(1);
      int open = matcher.end();
      while (open < text.length() && text.charAt(open) == ' ') {
        open++;
      }
      int close = open < text.length() && text.charAt(open) == '(' ? matchingParen(text, open) : -1;
      if (close < 0) {
        out.append(function).append("^2");
        last = matcher.end();
      } else {
        out.append(function).append(text, open, close + 1).append("^2");
        last = close + 1;
      }
    }
    out.append(text.substring(last));
    return out.toString();
  }

  private static int matchingParen(String text, int open) {
    int depth = 0;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }
}
