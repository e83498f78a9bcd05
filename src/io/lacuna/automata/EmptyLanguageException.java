package io.lacuna.automata;

/**
 * Thrown when asking for the shortest or longest word of an automaton which accepts nothing.
 */
public class EmptyLanguageException extends AutomatonException {

  public EmptyLanguageException(String message) {
    super(message);
  }
}
