package com.flamingo.ai.mathgrader.service.expression;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/** Functions with a numeric implementation. All take one argument. */
public enum BuiltinFunction {
  SIN("sin", Complex::sin),
  COS("cos", Complex::cos),
  TAN("tan", Complex::tan),
  CSC("csc", z -> z.sin().reciprocal()),
  SEC("sec", z -> z.cos().reciprocal()),
  COT("cot", z -> z.cos().divide(z.sin())),
  SINH("sinh", Complex::sinh),
  COSH("cosh", Complex::cosh),
  TANH("tanh", Complex::tanh),
  CSCH("csch", z -> z.sinh().reciprocal()),
  SECH("sech", z -> z.cosh().reciprocal()),
  COTH("coth", z -> z.cosh().divide(z.sinh())),
  ASIN("asin", Complex::asin),
  ACOS("acos", Complex::acos),
  ATAN("atan", Complex::atan),
  ACSC("acsc", z -> z.reciprocal().asin()),
  ASEC("asec", z -> z.reciprocal().acos()),
  ACOT("acot", z -> z.isZero() ? Complex.real(Math.PI / 2) : z.reciprocal().atan()),
  ASINH("asinh", Complex::asinh),
  ACOSH("acosh", Complex::acosh),
  ATANH("atanh", Complex::atanh),
  ACSCH("acsch", z -> z.reciprocal().asinh()),
  ASECH("asech", z -> z.reciprocal().acosh()),
  ACOTH("acoth", z -> z.reciprocal().atanh()),
  LN("ln", Complex::log),
  LOG("log", Complex::log),
  EXP("exp", Complex::exp),
  SQRT("sqrt", Complex::sqrt),
  GAMMA("gamma", Complex::gamma),
  EI("Ei", Complex::ei),
  ABS("abs", z -> Complex.real(z.abs()));

  private static final Map<String, BuiltinFunction> BY_NAME =
      Arrays.stream(values()).collect(Collectors.toMap(f -> f.name, Function.identity()));

  private final String name;
  private final UnaryOperator<Complex> implementation;

  BuiltinFunction(String name, UnaryOperator<Complex> implementation) {
    this.name = name;
    this.implementation = implementation;
  }

  public String functionName() {
    return name;
  }

  public Complex apply(Complex argument) {
    return implementation.apply(argument);
  }

  /** Function called {@code name}, or null. */
  public static BuiltinFunction byName(String name) {
    return BY_NAME.get(name);
  }
}
