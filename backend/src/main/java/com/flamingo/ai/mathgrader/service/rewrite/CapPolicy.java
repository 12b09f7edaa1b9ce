package com.flamingo.ai.mathgrader.service.rewrite;

/** What a {@link Fixpoint} does when the iteration cap is reached before the value stabilises. */
public enum CapPolicy {
  /** Return the last value produced. */
  STOP,
  /** Throw {@link com.flamingo.ai.mathgrader.exception.NonConvergenceException}. */
  FAIL
}
