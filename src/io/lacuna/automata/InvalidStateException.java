package io.lacuna.automata;

public class InvalidStateException extends AutomatonException {

  public InvalidStateException(String message) {
    super(message);
  }
}
