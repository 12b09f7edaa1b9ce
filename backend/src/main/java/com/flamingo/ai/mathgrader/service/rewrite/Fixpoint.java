package com.flamingo.ai.mathgrader.service.rewrite;

import com.flamingo.ai.mathgrader.exception.NonConvergenceException;
import java.util.Objects;
import java.util.function.UnaryOperator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies one rewrite pass repeatedly until a pass leaves the value unchanged.
 *
 * <p>Used by the lexical nested-rule phase ({@link CapPolicy#STOP}, cap 5) and by non-commutative
 * normal ordering ({@link CapPolicy#FAIL}, cap 100). Values are compared with {@code equals}.
 */
@Slf4j
public final class Fixpoint<T> {

  private final String name;
  private final UnaryOperator<T> pass;
  private final int cap;
  private final CapPolicy policy;

  public Fixpoint(String name, UnaryOperator<T> pass, int cap, CapPolicy policy) {
    if (cap < 1) {
      throw new IllegalArgumentException("Iteration cap must be positive: " + cap);
    }
    this.name = name;
    this.pass = Objects.requireNonNull(pass);
    this.cap = cap;
    this.policy = Objects.requireNonNull(policy);
  }

  /** Runs passes from {@code initial} and reports the value reached. */
  public Outcome<T> apply(T initial) {
    T current = initial;
    for (int i = 1; i <= cap; i++) {
      T next = pass.apply(current);
      if (Objects.equals(next, current)) {
        return new Outcome<>(next, i, true);
      }
      current = next;
    }
    if (policy == CapPolicy.FAIL) {
      throw new NonConvergenceException(name, cap);
    }
    log.warn("{} stopped at iteration cap {} without reaching a fixpoint", name, cap);
    return new Outcome<>(current, cap, false);
  }

  /** Result of a fixpoint run. */
  @Getter
  public static final class Outcome<T> {
    private final T value;
    private final int passes;
    private final boolean converged;

    Outcome(T value, int passes, boolean converged) {
      this.value = value;
      this.passes = passes;
      this.converged = converged;
    }
  }
}
