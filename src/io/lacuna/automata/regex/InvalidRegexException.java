package io.lacuna.automata.regex;

/**
 * Thrown when a regular expression is not well-formed.
 */
public class InvalidRegexException extends RegexException {

  public InvalidRegexException(String message) {
    super(message);
  }

  public InvalidRegexException(String message, Throwable cause) {
    super(message, cause);
  }
}
