package com.flamingo.ai.mathgrader.service.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.NormalizationException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LatexNormalizerTest {

  private MeterRegistry meterRegistry;
  private LatexNormalizer normalizer;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    normalizer = new LatexNormalizer(new SubscriptCanonicalizer(), new GraderConfig(), meterRegistry);
  }

  @Nested
  @DisplayName("rewrites")
  class Rewrites {

    @Test
    @DisplayName("fractions become divisions")
    void shouldRewriteFraction() {
      assertThat(normalizer.normalize("\\frac{1}{2}")).isEqualTo("(1)/(2)");
    }

    @Test
    @DisplayName("nested fractions are fully rewritten")
    void shouldRewriteNestedFraction() {
      assertThat(normalizer.normalize("\\frac{\\frac{1}{2}}{3}")).isEqualTo("((1)/(2))/(3)");
    }

    @Test
    @DisplayName("hyperbolic functions are not split into shorter names")
    void shouldKeepHyperbolicName() {
      assertThat(normalizer.normalize("\\cosh x")).isEqualTo("cosh(x)");
    }

    @Test
    @DisplayName("squared trig functions square the applied function")
    void shouldSquareTrigFunction() {
      assertThat(normalizer.normalize("\\sin^2 x")).isEqualTo("sin(x)^2");
    }

    @Test
    @DisplayName("a bare e becomes Euler's number")
    void shouldRewriteEuler() {
      assertThat(normalizer.normalize("e^{x}")).isEqualTo("E^(x)");
    }

    @Test
    @DisplayName("sizing delimiters are dropped")
    void shouldDropDelimiterSizing() {
      assertThat(normalizer.normalize("\\left( x \\right)")).isEqualTo("( x )");
    }
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"\\frac{1}{2}", "\\sqrt{x+1}", "\\cosh x", "c^\\dagger_i c_i", "e^{-x^{2}}"})
  @DisplayName("normalizing canonical text leaves it unchanged")
  void shouldBeIdempotent(String input) {
    String once = normalizer.normalize(input);

    assertThat(normalizer.normalize(once)).isEqualTo(once);
  }

  @Test
  @DisplayName("empty result is an error")
  void shouldRejectEmptyResult() {
    assertThatThrownBy(() -> normalizer.normalize("$$"))
        .isInstanceOf(NormalizationException.class)
        .hasMessageContaining("empty");
  }

  @Test
  @DisplayName("reaching the nested rewrite cap is counted but not fatal")
  void shouldCountCapReached() {
    // Given
    GraderConfig config = new GraderConfig();
    config.getNormalizer().setNestedRuleCap(1);
    LatexNormalizer capped = new LatexNormalizer(new SubscriptCanonicalizer(), config, meterRegistry);

    // When
    String result = capped.normalize("\\frac{\\frac{1}{2}}{3}");

    // Then
    assertThat(result).isNotEmpty();
    assertThat(meterRegistry.counter("grader.normalizer.cap_reached").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("converging inputs do not touch the cap counter")
  void shouldNotCountWhenConverged() {
    normalizer.normalize("\\frac{\\frac{1}{2}}{3}");

    assertThat(meterRegistry.counter("grader.normalizer.cap_reached").count()).isZero();
  }
}
