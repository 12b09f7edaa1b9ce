package com.flamingo.ai.mathgrader.service.normalize;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/** Rule tables for {@link LatexNormalizer}, grouped by phase and applied in list order. */
public final class NormalizationRules {

  private NormalizationRules() {}

  /** Trigonometric and hyperbolic functions that take {@code ^{-1}} and {@code ^2} forms. */
  public static final List<String> TRIG_FUNCTIONS =
      List.of(
          "sin", "cos", "tan", "csc", "sec", "cot", "sinh", "cosh", "tanh", "csch", "sech", "coth");

  /** Prefix marking a squared trig function until implicit application has run. */
  static final String SQUARED_PREFIX = "sq";

  /** Functions written as markup commands that may take an argument without parentheses. */
  public static final List<String> KNOWN_FUNCTIONS = buildKnownFunctions();

  static final String TRIG = alternation(TRIG_FUNCTIONS);
  static final String KNOWN = alternation(KNOWN_FUNCTIONS);

  static final List<RewriteRule> DELETIONS =
      List.of(
          RewriteRule.of("invisible-delimiter", "\\\\(?:left|right)\\.", ""),
          RewriteRule.of("left-right", "\\\\(?:left|right)(?![a-zA-Z])", ""),
          RewriteRule.of("big", "\\\\[Bb]igg?[lr]?(?![a-zA-Z])", ""),
          RewriteRule.of(
              "layout",
              "\\\\(?:hline|vline|displaystyle|textstyle|pm|mp|langle|rangle|quad|qquad)"
                  + "(?![a-zA-Z])",
              ""),
          RewriteRule.of("spacing", "\\\\[,;:! ]", " "),
          RewriteRule.of("math-shift", "\\$", ""));

  static final List<RewriteRule> FUNCTIONS =
      List.of(
          RewriteRule.of("exp", "\\\\?exp(?![a-zA-Z])", "E^"),
          RewriteRule.of("cdot", "\\\\(?:cdot|times)(?![a-zA-Z])", "*"),
          RewriteRule.of("div", "\\\\div(?![a-zA-Z])", "/"),
          RewriteRule.of("pi", "\\\\pi(?![a-zA-Z])", "pi"),
          RewriteRule.of("imaginary", "\\\\i(?![a-zA-Z])", "I"),
          RewriteRule.of("arc", "\\\\arc(" + TRIG + ")(?![a-zA-Z])", "\\\\a$1"),
          RewriteRule.of("inverse", "\\\\(" + TRIG + ")\\^\\{?-1\\}?(?![0-9])", "\\\\a$1"),
          RewriteRule.of(
              "squared", "\\\\(" + TRIG + ")\\^\\{?2\\}?(?![0-9])", "\\\\" + SQUARED_PREFIX + "$1"),
          RewriteRule.of(
              "squared-bare",
              "(?<![a-zA-Z_\\\\])(" + TRIG + ")\\^\\{?2\\}?(?![0-9])",
              "\\\\" + SQUARED_PREFIX + "$1"));

  static final List<RewriteRule> NESTED =
      List.of(
          RewriteRule.of("frac", "\\\\[dt]?frac\\{([^{}]*)\\}\\{([^{}]*)\\}", "($1)/($2)"),
          RewriteRule.of("nth-root", "\\\\sqrt\\[([^\\[\\]{}]*)\\]\\{([^{}]*)\\}", "($2)**(1/($1))"),
          RewriteRule.of("sqrt", "\\\\sqrt\\{([^{}]*)\\}", "($1)**(1/2)"),
          RewriteRule.of("superscript", "\\^\\{([^{}]*)\\}", "^($1)"),
          RewriteRule.of("subscript", "_\\{([^{}]*)\\}", "$1"),
          RewriteRule.of(
              "text",
              "\\\\(?:mathrm|text|textrm|textit|mathit|mathbf|operatorname)\\{([^{}]*)\\}",
              "$1"));

  static final List<RewriteRule> FINAL =
      List.of(
          RewriteRule.of("euler", "(?<![a-zA-Z_\\\\])e(?![a-zA-Z_'†])", "E"),
          RewriteRule.of("euler-product", "(?<![a-zA-Z\\\\])([a-zA-Z])e\\^", "$1*E^"),
          RewriteRule.of("open-brace", "\\\\?\\{", "("),
          RewriteRule.of("close-brace", "\\\\?\\}", ")"),
          RewriteRule.of("open-bracket", "\\\\?\\[", "("),
          RewriteRule.of("close-bracket", "\\\\?\\]", ")"),
          RewriteRule.of("gamma", "\\\\Gamma(?=\\s*\\()", "gamma"),
          RewriteRule.of("approx", "\\\\(?:approx|simeq|sim)(?![a-zA-Z])", "="));

  static final RewriteRule SPACE_BEFORE_FUNCTION =
      RewriteRule.of("space", "(?<=\\S)\\\\(" + KNOWN + ")(?![a-zA-Z])", " \\\\$1");

  static final RewriteRule IMPLICIT_APPLICATION =
      RewriteRule.of(
          "application",
          "\\\\(" + KNOWN + ")(?![a-zA-Z])\\s*([^{}\\s()+\\-*/^=,]+)",
          " $1($2)");

  private static List<String> buildKnownFunctions() {
    List<String> names = new ArrayList<>(TRIG_FUNCTIONS);
    for (String trig : TRIG_FUNCTIONS) {
      names.add("a" + trig);
      names.add(SQUARED_PREFIX + trig);
    }
    names.addAll(List.of("ln", "log", "exp", "sqrt"));
    return List.copyOf(names);
  }

  /** Longest names first so that {@code cosh} is never read as {@code cos} followed by {@code h}. */
  static String alternation(List<String> names) {
    return names.stream()
        .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(s -> s))
        .collect(Collectors.joining("|"));
  }
}
