package io.lacuna.automata;

/**
 * Thrown when a symbol is not part of the alphabet.
 */
public class InvalidSymbolException extends AutomatonException {

  public InvalidSymbolException(String message) {
    super(message);
  }
}
