package com.flamingo.ai.mathgrader.service.extraction;

import com.flamingo.ai.mathgrader.exception.ExtractionException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds the single {@code boxed{...}} or {@code fbox{...}} payload in a response and splits it into
 * sub-answers on top-level semicolons.
 */
@Component
@Slf4j
public class BoxedAnswerExtractor {

  private static final Pattern BOX_MARKER = Pattern.compile("(boxed|fbox)\\{");

  private static final Map<String, String> UNICODE_REPLACEMENTS = new LinkedHashMap<>();

  static {
    UNICODE_REPLACEMENTS.put("√", "\\sqrt");
    UNICODE_REPLACEMENTS.put("×", "\\cdot ");
    UNICODE_REPLACEMENTS.put("⋅", "\\cdot ");
    UNICODE_REPLACEMENTS.put("−", "-");
    UNICODE_REPLACEMENTS.put("π", "\\pi ");
    UNICODE_REPLACEMENTS.put("≈", "\\approx ");
  }

  /**
   * Extracts the boxed answer.
   *
   * @param rawText full response text
   * @return the payload split into sub-answers
   * @throws ExtractionException when there is no payload, more than one, unbalanced braces, or an
   *     empty part
   */
  public ExtractedAnswer extract(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      throw new ExtractionException("No boxed answer found: input is empty");
    }
    String text = replaceUnicode(rawText);

    Matcher matcher = BOX_MARKER.matcher(text);
    if (!matcher.find()) {
      throw new ExtractionException("No boxed answer found");
    }
    int open = matcher.end() - 1;
    int close = findClosingBrace(text, open);
    if (close < 0) {
      throw new ExtractionException("Unbalanced braces in boxed answer");
    }
    if (matcher.find(close + 1)) {
      throw new ExtractionException("More than one boxed answer found");
    }

    String payload = text.substring(open + 1, close).trim();
    if (payload.isEmpty()) {
      throw new ExtractionException("Boxed answer is empty");
    }

    AnswerKind kind = AnswerKind.BARE;
    String inner = payload;
    if (isWrapped(payload, "\\{", "\\}")) {
      inner = payload.substring(2, payload.length() - 2);
      kind = AnswerKind.SET;
    } else if (isWrapped(payload, "{", "}")) {
      inner = payload.substring(1, payload.length() - 1);
      kind = AnswerKind.SET;
    } else if (isWrapped(payload, "[", "]")) {
      inner = payload.substring(1, payload.length() - 1);
      kind = AnswerKind.LIST;
    }

    List<String> parts = splitTopLevel(inner);
    for (int i = 0; i < parts.size(); i++) {
      if (parts.get(i).isEmpty()) {
        throw new ExtractionException("Empty solution part found at index " + i);
      }
    }
    log.debug("Extracted {} {} part(s) from boxed payload", parts.size(), kind);
    return new ExtractedAnswer(payload, parts, kind);
  }

  String replaceUnicode(String text) {
    String result = text;
    for (Map.Entry<String, String> entry : UNICODE_REPLACEMENTS.entrySet()) {
      result = result.replace(entry.getKey(), entry.getValue());
    }
    return result;
  }

  /** Index of the brace closing the one at {@code open}, or -1. Escaped braces are not counted. */
  static int findClosingBrace(String text, int open) {
    int depth = 0;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        char next = text.charAt(i + 1);
        if (next == '{' || next == '}') {
          i++;
          continue;
        }
      }
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static boolean isWrapped(String payload, String left, String right) {
    if (!payload.startsWith(left) || !payload.endsWith(right)) {
      return false;
    }
    if (left.equals("{")) {
      return findClosingBrace(payload, 0) == payload.length() - 1;
    }
    int depth = 0;
    int i = 0;
    while (i < payload.length()) {
      if (payload.startsWith(left, i)) {
        depth++;
        i += left.length();
      } else if (payload.startsWith(right, i)) {
        depth--;
        if (depth == 0) {
          return i == payload.length() - right.length();
        }
        i += right.length();
      } else {
        i++;
      }
    }
    return false;
  }

  /** Splits on semicolons that are not nested inside braces, brackets or parentheses. */
  private static List<String> splitTopLevel(String text) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '{' || c == '(' || c == '[') {
        depth++;
      } else if (c == '}' || c == ')' || c == ']') {
        depth = Math.max(0, depth - 1);
      } else if (c == ';' && depth == 0) {
        parts.add(text.substring(start, i).trim());
        start = i + 1;
      }
    }
    parts.add(text.substring(start).trim());
    return parts;
  }
}
