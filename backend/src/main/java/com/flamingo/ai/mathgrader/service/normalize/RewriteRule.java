package com.flamingo.ai.mathgrader.service.normalize;

import java.util.regex.Pattern;

/**
 * One regex rewrite applied to every match in the text.
 *
 * @param name short label used in debug logs
 * @param pattern what to match
 * @param replacement {@link java.util.regex.Matcher#replaceAll(String)} replacement
 */
public record RewriteRule(String name, Pattern pattern, String replacement) {

  public static RewriteRule of(String name, String regex, String replacement) {
    return new RewriteRule(name, Pattern.compile(regex), replacement);
  }

  public String apply(String text) {
    return pattern.matcher(text).replaceAll(replacement);
  }
}
