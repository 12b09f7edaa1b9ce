package com.flamingo.ai.mathgrader.exception;

/** Exception thrown when canonical text does not form a valid expression. */
public class ExpressionParseException extends GradingException {

  private final String text;
  private final int position;

  public ExpressionParseException(String message, String text, int position) {
    super(position >= 0 ? message + " at position " + position + " in '" + text + "'" : message);
    this.text = text;
    this.position = position;
  }

  public ExpressionParseException(String message) {
    this(message, "", -1);
  }

  public String getText() {
    return text;
  }

  public int getPosition() {
    return position;
  }

  @Override
  public String getStage() {
    return "parse";
  }
}
