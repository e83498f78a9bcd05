package io.lacuna.automata;

/**
 * Raised when counting the words of an infinite language, or walking its predecessors with no maximum length.
 */
public class InfiniteLanguageException extends AutomatonException {

  public InfiniteLanguageException(String message) {
    super(message);
  }
}
