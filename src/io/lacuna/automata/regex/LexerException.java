package io.lacuna.automata.regex;

/**
 * Thrown when a regular expression cannot be split into tokens.
 */
public class LexerException extends RegexException {

  private final int position;

  public LexerException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }

  public int position() {
    return position;
  }
}
