package com.flamingo.ai.mathgrader.exception;

/** Exception thrown when a rewrite does not reach a fixpoint within its iteration cap. */
public class NonConvergenceException extends GradingException {

  private final int iterations;

  public NonConvergenceException(String what, int iterations) {
    super(what + " did not converge within " + iterations + " iterations");
    this.iterations = iterations;
  }

  public int getIterations() {
    return iterations;
  }

  @Override
  public String getStage() {
    return "equivalence";
  }
}
