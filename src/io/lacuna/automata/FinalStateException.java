package io.lacuna.automata;

public class FinalStateException extends AutomatonException {

  public FinalStateException(String message) {
    super(message);
  }
}
