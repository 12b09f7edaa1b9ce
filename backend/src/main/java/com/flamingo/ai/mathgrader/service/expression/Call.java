package com.flamingo.ai.mathgrader.service.expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function application.
 *
 * @param function name as written
 * @param args arguments; empty for a declared function used without parentheses
 * @param builtin the numerically evaluable function, or null for a declared function
 * @param commutative false for declared non-commuting operator functions
 */
public record Call(String function, List<Expr> args, BuiltinFunction builtin, boolean commutative)
    implements Expr {

  public Call {
    args = List.copyOf(args);
  }

  @Override
  public boolean isCommutative() {
    return commutative && args.stream().allMatch(Expr::isCommutative);
  }

  @Override
  public String toString() {
    if (args.isEmpty()) {
      return function;
    }
    return function + args.stream().map(Expr::toString).collect(Collectors.joining(", ", "(", ")"));
  }
}
