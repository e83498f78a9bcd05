package io.lacuna.automata;

/**
 * A GNFA whose initial state has incoming transitions, or doubles as its final state.
 */
public class InitialStateException extends AutomatonException {

  public InitialStateException(String message) {
    super(message);
  }
}
