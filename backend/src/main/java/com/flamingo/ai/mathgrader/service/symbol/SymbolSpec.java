package com.flamingo.ai.mathgrader.service.symbol;

/**
 * A declared symbol.
 *
 * @param name canonical name as it appears in canonical expression text
 * @param role parameter or function
 * @param commuting false for operators whose order in a product matters
 */
public record SymbolSpec(String name, SymbolRole role, boolean commuting) {

  public boolean isFunction() {
    return role == SymbolRole.FUNCTION;
  }
}
