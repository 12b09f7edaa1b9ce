package com.flamingo.ai.mathgrader.service.symbol;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Declared symbols by canonical name, in declaration order. */
public final class SymbolTable {

  private static final SymbolTable EMPTY = new SymbolTable(Map.of());

  private final Map<String, SymbolSpec> symbols;

  public SymbolTable(Map<String, SymbolSpec> symbols) {
    this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
  }

  public static SymbolTable empty() {
    return EMPTY;
  }

  public Optional<SymbolSpec> lookup(String name) {
    return Optional.ofNullable(symbols.get(name));
  }

  public boolean contains(String name) {
    return symbols.containsKey(name);
  }

  public Collection<SymbolSpec> all() {
    return symbols.values();
  }

  /** Parameters in declaration order; these are the sampled symbols. */
  public List<SymbolSpec> parameters() {
    return symbols.values().stream().filter(spec -> !spec.isFunction()).toList();
  }

  public boolean hasNonCommuting() {
    return symbols.values().stream().anyMatch(spec -> !spec.commuting());
  }

  public int size() {
    return symbols.size();
  }

  public boolean isEmpty() {
    return symbols.isEmpty();
  }

  @Override
  public String toString() {
    return "SymbolTable" + symbols.values();
  }
}
