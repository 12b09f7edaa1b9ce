package com.flamingo.ai.mathgrader.service.expression;

/**
 * Node of a parsed expression tree.
 *
 * <p>Products keep their factor order, which only matters when non-commuting operators are
 * involved. {@link #toString()} gives a stable textual form for results and logs.
 */
public interface Expr {

  /** False when this node contains a non-commuting symbol. */
  boolean isCommutative();
}
