package com.flamingo.ai.mathgrader.service.symbol;

/** Where a symbol was declared. */
public enum SymbolRole {
  /** Declared in the parameter string; sampled during numeric evaluation. */
  PARAMETER,
  /** Declared in the function string; applied to arguments, never sampled. */
  FUNCTION
}
