package com.flamingo.ai.mathgrader.service.expression;

import com.flamingo.ai.mathgrader.exception.ExpressionParseException;
import com.flamingo.ai.mathgrader.service.normalize.DecoratedIdentifier;
import java.util.ArrayList;
import java.util.List;

/** Splits canonical text into tokens. {@code **} and {@code ^} are the same power operator. */
final class Lexer {

  private Lexer() {}

  static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (Character.isDigit(c) || (c == '.' && i + 1 < text.length()
          && Character.isDigit(text.charAt(i + 1)))) {
        int start = i;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
          i++;
        }
        if (i < text.length() && text.charAt(i) == '.') {
          i++;
          while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
          }
        }
        tokens.add(new Token(Token.Type.NUMBER, text.substring(start, i), start));
      } else if (Character.isLetter(c)) {
        int start = i;
        while (i < text.length() && isIdentifierPart(text, i)) {
          i += text.startsWith(DecoratedIdentifier.DAGGER, i) ? DecoratedIdentifier.DAGGER.length() : 1;
        }
        tokens.add(new Token(Token.Type.IDENT, text.substring(start, i), start));
      } else if (c == '*' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
        tokens.add(new Token(Token.Type.CARET, "**", i));
        i += 2;
      } else {
        Token.Type type =
            switch (c) {
              case '+' -> Token.Type.PLUS;
              case '-' -> Token.Type.MINUS;
              case '*' -> Token.Type.STAR;
              case '/' -> Token.Type.SLASH;
              case '^' -> Token.Type.CARET;
              case '(' -> Token.Type.LPAREN;
              case ')' -> Token.Type.RPAREN;
              case ',' -> Token.Type.COMMA;
              default -> throw new ExpressionParseException(
                  "Unexpected character '" + c + "'", text, i);
            };
        tokens.add(new Token(type, String.valueOf(c), i));
        i++;
      }
    }
    tokens.add(new Token(Token.Type.EOF, "", text.length()));
    return tokens;
  }

  private static boolean isIdentifierPart(String text, int i) {
    char c = text.charAt(i);
    return Character.isLetterOrDigit(c)
        || c == '_'
        || c == '\''
        || text.startsWith(DecoratedIdentifier.DAGGER, i);
  }
}
