package com.flamingo.ai.mathgrader.service.equivalence;

import com.flamingo.ai.mathgrader.exception.ExpressionParseException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Parses numeric literal answers such as {@code 3}, {@code -1/2}, {@code (1, 2)}, {@code [0.5, 1]}
 * or <code>\{1, 2\}</code>.
 *
 * <p>Grammar: {@code value := number | '(' items ')' | '[' items ']' | '{' items '}'}, {@code
 * number := sign? decimal ('/' sign? decimal)?}. Text with a top-level comma is a tuple. Nothing is
 * evaluated beyond a single fraction.
 */
@Component
public class LiteralValueParser {

  public LiteralValue parse(String text) {
    String cleaned = text.replace("\\{", "{").replace("\\}", "}").replace("$", "").trim();
    return new Cursor(cleaned).parseTop();
  }

  private static final class Cursor {
    private final String text;
    private int pos;

    Cursor(String text) {
      this.text = text;
    }

    LiteralValue parseTop() {
      if (text.isEmpty()) {
        throw new ExpressionParseException("Empty literal");
      }
      Items items = parseItems('\0');
      skipSpaces();
      if (pos < text.length()) {
        throw error("Unexpected '" + text.charAt(pos) + "'");
      }
      return items.single() ? items.values().get(0) : new LiteralValue.Tuple(items.values());
    }

    private Items parseItems(char close) {
      List<LiteralValue> values = new ArrayList<>();
      skipSpaces();
      if (close != '\0' && peek() == close) {
        return new Items(values, false);
      }
      while (true) {
        values.add(parseValue());
        skipSpaces();
        if (peek() != ',') {
          return new Items(values, false);
        }
        pos++;
        skipSpaces();
        if (pos >= text.length() || peek() == close) {
          return new Items(values, true);
        }
      }
    }

    private LiteralValue parseValue() {
      skipSpaces();
      char c = peek();
      return switch (c) {
        case '(' -> {
          pos++;
          Items items = parseItems(')');
          expect(')');
          yield items.single() ? items.values().get(0) : new LiteralValue.Tuple(items.values());
        }
        case '[' -> {
          pos++;
          Items items = parseItems(']');
          expect(']');
          yield new LiteralValue.Sequence(items.values());
        }
        case '{' -> {
          pos++;
          Items items = parseItems('}');
          expect('}');
          yield new LiteralValue.Set(items.values());
        }
        default -> parseNumber();
      };
    }

    private LiteralValue parseNumber() {
      double numerator = parseDecimal();
      skipSpaces();
      if (peek() != '/') {
        return new LiteralValue.Number(numerator);
      }
      pos++;
      skipSpaces();
      double denominator = parseDecimal();
      if (denominator == 0.0) {
        throw error("Division by zero");
      }
      return new LiteralValue.Number(numerator / denominator);
    }

    private double parseDecimal() {
      int start = pos;
      if (peek() == '+' || peek() == '-') {
        pos++;
      }
      int digits = 0;
      while (Character.isDigit(peek()) || peek() == '.') {
        pos++;
        digits++;
      }
      if (digits > 0 && (peek() == 'e' || peek() == 'E')) {
        int mark = pos;
        pos++;
        if (peek() == '+' || peek() == '-') {
          pos++;
        }
        if (!Character.isDigit(peek())) {
          pos = mark;
        }
        while (Character.isDigit(peek())) {
          pos++;
        }
      }
      if (digits == 0) {
        throw error("Expected a number");
      }
      try {
        return Double.parseDouble(text.substring(start, pos));
      } catch (NumberFormatException e) {
        throw error("Malformed number '" + text.substring(start, pos) + "'");
      }
    }

    private void expect(char c) {
      skipSpaces();
      if (peek() != c) {
        throw error("Expected '" + c + "'");
      }
      pos++;
    }

    private char peek() {
      return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipSpaces() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private ExpressionParseException error(String message) {
      return new ExpressionParseException(message, text, pos);
    }
  }

  /** Comma-separated values; a trailing comma makes a single value a one-element tuple. */
  private record Items(List<LiteralValue> values, boolean trailingComma) {
    boolean single() {
      return values.size() == 1 && !trailingComma;
    }
  }
}
