package com.flamingo.ai.mathgrader.service.extraction;

/** How the sub-answers of a boxed payload were grouped. */
public enum AnswerKind {
  /** Written without enclosing brackets, e.g. {@code a; b}. */
  BARE,
  /** Written as {@code \{a; b\}} or {@code {a; b}}; order is not significant. */
  SET,
  /** Written as {@code [a; b]}; order is significant. */
  LIST;

  /** Kind used when a bare payload counts as a set. */
  public AnswerKind orSet() {
    return this == BARE ? SET : this;
  }

  /** Kind used when a bare payload counts as a list. */
  public AnswerKind orList() {
    return this == BARE ? LIST : this;
  }
}
