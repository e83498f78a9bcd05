package io.lacuna.automata;

/**
 * A DFA which does not allow partial transitions lacks a transition for some symbol.
 */
public class MissingSymbolException extends AutomatonException {

  public MissingSymbolException(String message) {
    super(message);
  }
}
