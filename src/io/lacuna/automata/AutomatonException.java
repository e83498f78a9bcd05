package io.lacuna.automata;

/**
 * The root of every error raised while building, validating or running an automaton.
 *
 * @author ztellman
 */
public class AutomatonException extends RuntimeException {

  public AutomatonException(String message) {
    super(message);
  }

  public AutomatonException(String message, Throwable cause) {
    super(message, cause);
  }
}
