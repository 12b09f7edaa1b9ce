package com.flamingo.ai.mathgrader.service.equivalence;

/**
 * Terminal result of a comparison. A verdict is either equivalent, not equivalent, or an explicit
 * failure; comparisons never throw.
 *
 * @param outcome result kind
 * @param diagnostic human-readable reason, empty for a plain match
 */
public record EquivalenceVerdict(Outcome outcome, String diagnostic) {

  /** Kinds of verdict. */
  public enum Outcome {
    EQUIVALENT,
    NOT_EQUIVALENT,
    FAILED
  }

  public static EquivalenceVerdict equivalent() {
    return new EquivalenceVerdict(Outcome.EQUIVALENT, "");
  }

  public static EquivalenceVerdict notEquivalent(String diagnostic) {
    return new EquivalenceVerdict(Outcome.NOT_EQUIVALENT, diagnostic);
  }

  public static EquivalenceVerdict failed(String diagnostic) {
    return new EquivalenceVerdict(Outcome.FAILED, diagnostic);
  }

  public boolean equal() {
    return outcome == Outcome.EQUIVALENT;
  }

  public boolean isFailed() {
    return outcome == Outcome.FAILED;
  }
}
