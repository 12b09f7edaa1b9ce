package com.flamingo.ai.mathgrader.service.equivalence;

/** Strategy used to decide whether two answers are equivalent. */
public enum ComparisonMode {
  /** Elementwise closeness of evaluated values under one sample. */
  NUMERIC,
  /** Exact equality of fully expanded expressions. */
  SYMBOLIC,
  /** Expanded difference normal-ordered under fermionic anticommutation rules. */
  NON_COMMUTATIVE;

  public String tag() {
    return name().toLowerCase();
  }
}
