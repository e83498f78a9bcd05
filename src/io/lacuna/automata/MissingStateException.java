package io.lacuna.automata;

public class MissingStateException extends AutomatonException {

  public MissingStateException(String message) {
    super(message);
  }
}
