package io.lacuna.automata.regex;

import io.lacuna.automata.AutomatonException;

/**
 * The root of every error raised while reading a regular expression.
 */
public class RegexException extends AutomatonException {

  public RegexException(String message) {
    super(message);
  }

  public RegexException(String message, Throwable cause) {
    super(message, cause);
  }
}
