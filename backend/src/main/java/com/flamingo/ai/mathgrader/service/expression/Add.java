package com.flamingo.ai.mathgrader.service.expression;

import java.util.List;

/** Sum of terms. */
public record Add(List<Expr> terms) implements Expr {

  public Add {
    terms = List.copyOf(terms);
  }

  @Override
  public boolean isCommutative() {
    return terms.stream().allMatch(Expr::isCommutative);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Expr term : terms) {
      String text = term.toString();
      if (sb.length() == 0) {
        sb.append(text);
      } else if (text.startsWith("-")) {
        sb.append(" - ").append(text.substring(1));
      } else {
        sb.append(" + ").append(text);
      }
    }
    return sb.toString();
  }
}
