package com.flamingo.ai.mathgrader.service.grading;

import com.flamingo.ai.mathgrader.service.equivalence.ComparisonMode;
import com.flamingo.ai.mathgrader.service.symbol.SymbolTable;

/**
 * Shape of a grading request, fixed once from which declarations it carries.
 *
 * <ul>
 *   <li>{@link #PLAIN_NUMERIC}: no declarations, answers are numbers
 *   <li>{@link #PARAMETERIZED_NUMERIC}: parameters only, answers are sampled and evaluated
 *   <li>{@link #SYMBOLIC_WITH_FUNCTIONS}: function declarations present, answers are compared
 *       symbolically
 * </ul>
 */
public enum InputVariant {
  PLAIN_NUMERIC,
  PARAMETERIZED_NUMERIC,
  SYMBOLIC_WITH_FUNCTIONS;

  public static InputVariant of(String parameters, String functions) {
    if (functions != null && !functions.isBlank()) {
      return SYMBOLIC_WITH_FUNCTIONS;
    }
    if (parameters != null && !parameters.isBlank()) {
      return PARAMETERIZED_NUMERIC;
    }
    return PLAIN_NUMERIC;
  }

  /** Whether answers of this variant are evaluated under a parameter sample. */
  public boolean evaluates(SymbolTable table) {
    return this != SYMBOLIC_WITH_FUNCTIONS && !table.hasNonCommuting();
  }

  /** Comparison used for this variant; non-commuting symbols always need normal ordering. */
  public ComparisonMode comparisonMode(SymbolTable table) {
    if (table.hasNonCommuting()) {
      return ComparisonMode.NON_COMMUTATIVE;
    }
    return this == SYMBOLIC_WITH_FUNCTIONS ? ComparisonMode.SYMBOLIC : ComparisonMode.NUMERIC;
  }
}
