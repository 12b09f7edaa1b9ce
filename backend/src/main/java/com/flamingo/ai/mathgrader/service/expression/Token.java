package com.flamingo.ai.mathgrader.service.expression;

/** Lexical token of canonical expression text. */
record Token(Type type, String text, int position) {

  enum Type {
    NUMBER,
    IDENT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    LPAREN,
    RPAREN,
    COMMA,
    EOF
  }

  boolean is(Type t) {
    return type == t;
  }

  /** True if this token can begin an implicitly multiplied factor. */
  boolean startsFactor() {
    return type == Type.NUMBER || type == Type.IDENT || type == Type.LPAREN;
  }
}
