package io.lacuna.automata;

/**
 * Thrown when the operands use different alphabets.
 */
public class SymbolMismatchException extends AutomatonException {

  public SymbolMismatchException(String message) {
    super(message);
  }
}
