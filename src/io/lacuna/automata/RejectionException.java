package io.lacuna.automata;

/**
 * Thrown by {@link Automaton#readInput(String)} when the input is not accepted.
 */
public class RejectionException extends AutomatonException {

  private final Object configuration;

  public RejectionException(String message, Object configuration) {
    super(message);
    this.configuration = configuration;
  }

  /**
   * @return the last configuration reached before the input was rejected
   */
  public Object configuration() {
    return configuration;
  }
}
