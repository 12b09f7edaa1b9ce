package com.flamingo.ai.mathgrader.service.symbol;

import com.flamingo.ai.mathgrader.exception.RegistryException;
import com.flamingo.ai.mathgrader.service.normalize.SubscriptCanonicalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a declaration string such as {@code $R_i; (c_{m,n}, NC); (m, R_i, R_j)$} into identifier
 * tokens, non-commuting markers and index domains.
 */
final class DeclarationParser {

  private static final Pattern NC_MARKER = Pattern.compile("\\(([^()]*?),\\s*NC\\s*\\)");
  private static final Pattern INDEX_DOMAIN = Pattern.compile("\\(([^()]+)\\)");

  private DeclarationParser() {}

  static Declaration parse(String declaration) {
    if (declaration == null || declaration.isBlank()) {
      return new Declaration(List.of(), List.of(), Map.of());
    }
    String text = declaration.replace("$", "").trim();

    List<String> nonCommuting = new ArrayList<>();
    Matcher nc = NC_MARKER.matcher(text);
    StringBuilder rest = new StringBuilder();
    while (nc.find()) {
      String payload = nc.group(1).trim();
      if (payload.isEmpty()) {
        throw new RegistryException("Empty name in non-commuting marker: '" + declaration + "'");
      }
      nonCommuting.add(payload);
      nc.appendReplacement(rest, ";");
    }
    nc.appendTail(rest);
    text = rest.toString();

    Map<String, IndexDomain> domains = new LinkedHashMap<>();
    Matcher domain = INDEX_DOMAIN.matcher(text);
    rest = new StringBuilder();
    while (domain.find()) {
      IndexDomain parsed = parseDomain(domain.group(1), declaration);
      IndexDomain previous = domains.putIfAbsent(parsed.letter(), parsed);
      if (previous != null && !previous.values().equals(parsed.values())) {
        throw new RegistryException(
            "Index '" + parsed.letter() + "' is declared with conflicting values");
      }
      domain.appendReplacement(rest, ";");
    }
    domain.appendTail(rest);
    text = rest.toString();

    if (text.indexOf('(') >= 0 || text.indexOf(')') >= 0) {
      throw new RegistryException("Unbalanced parentheses in declaration: '" + declaration + "'");
    }

    List<String> identifiers = new ArrayList<>();
    for (String token : splitTokens(text)) {
      if (!token.isEmpty()) {
        identifiers.add(token);
      }
    }
    return new Declaration(identifiers, nonCommuting, domains);
  }

  private static IndexDomain parseDomain(String body, String declaration) {
    List<String> parts = splitTopLevel(body, ',');
    if (parts.size() < 2) {
      throw new RegistryException("Index domain without values: '(" + body + ")'");
    }
    String letter = parts.get(0).trim();
    if (!letter.matches("[A-Za-z]")) {
      throw new RegistryException(
          "Index must be a single letter, got '" + letter + "' in '" + declaration + "'");
    }
    List<String> values = new ArrayList<>();
    for (String raw : parts.subList(1, parts.size())) {
      String value = SubscriptCanonicalizer.sanitize(raw.replace("\\", "").trim());
      if (value.isEmpty()) {
        throw new RegistryException("Empty value in index domain '" + letter + "'");
      }
      values.add(value);
    }
    return new IndexDomain(letter, values);
  }

  /** Splits on semicolons and on commas outside braces. */
  private static List<String> splitTokens(String text) {
    List<String> tokens = new ArrayList<>();
    for (String part : text.split(";")) {
      for (String token : splitTopLevel(part, ',')) {
        tokens.add(token.trim());
      }
    }
    return tokens;
  }

  private static List<String> splitTopLevel(String text, char separator) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      } else if (c == separator && depth == 0) {
        parts.add(text.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(text.substring(start));
    return parts;
  }
}
