package com.flamingo.ai.mathgrader.service.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.mathgrader.exception.EvaluationException;
import com.flamingo.ai.mathgrader.service.expression.ExpressionParser;
import com.flamingo.ai.mathgrader.service.expression.Rational;
import com.flamingo.ai.mathgrader.service.normalize.SubscriptCanonicalizer;
import com.flamingo.ai.mathgrader.service.symbol.SymbolRegistry;
import com.flamingo.ai.mathgrader.service.symbol.SymbolTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PolynomialExpanderTest {

  private final ExpressionParser parser = new ExpressionParser();
  private final PolynomialExpander expander = new PolynomialExpander();
  private final SymbolRegistry registry = new SymbolRegistry(new SubscriptCanonicalizer());

  private Polynomial expand(String text, SymbolTable table) {
    return expander.expand(parser.parse(text, table));
  }

  private Polynomial expand(String text) {
    return expand(text, SymbolTable.empty());
  }

  @Test
  @DisplayName("squares of sums are multiplied out")
  void shouldExpandSquare() {
    assertThat(expand("(x+1)^2")).isEqualTo(expand("x^2 + 2x + 1"));
  }

  @Test
  @DisplayName("commuting factors compare equal in any order")
  void commutingOrderIsIrrelevant() {
    assertThat(expand("x y z")).isEqualTo(expand("z*x*y"));
  }

  @Test
  @DisplayName("non-commuting factors keep their order")
  void nonCommutingOrderMatters() {
    SymbolTable table = registry.build("(a, NC); (b, NC)", "");

    assertThat(expand("a b", table)).isNotEqualTo(expand("b a", table));
    assertThat(expand("a b", table).isCommutative()).isFalse();
  }

  @Test
  @DisplayName("exact roots of integers are evaluated")
  void shouldTakeExactRoot() {
    Polynomial root = expand("4^(1/2)");

    assertThat(root.isConstant()).isTrue();
    assertThat(root.constantValue()).isEqualTo(Rational.of(2));
  }

  @Test
  @DisplayName("a difference of equal expressions is zero")
  void differenceIsZero() {
    assertThat(expand("(x - 1)(x + 1)").minus(expand("x^2 - 1")).isZero()).isTrue();
  }

  @Test
  @DisplayName("function applications compare by their expanded arguments")
  void functionsCompareByArguments() {
    SymbolTable table = registry.build("x", "f");

    assertThat(expand("f(2x + x)", table)).isEqualTo(expand("f(3x)", table));
    assertThat(expand("f(x)", table)).isNotEqualTo(expand("f(2x)", table));
  }

  @Test
  @DisplayName("integer exponents beyond the exact range are kept as opaque powers")
  void hugeExponentIsOpaque() {
    Polynomial power = expand("x^10000000000");

    assertThat(power).isEqualTo(expand("x^10000000000"));
    assertThat(power).isNotEqualTo(expand("x^10000000001"));
    assertThat(expand("2^1000000000").isConstant()).isFalse();
  }

  @Test
  @DisplayName("an exact power that grows too large is an evaluation error")
  void oversizedExactPowerFails() {
    assertThatThrownBy(() -> expand("(10^1000)^1000"))
        .isInstanceOf(EvaluationException.class)
        .hasMessageContaining("too large");
  }
}
