package io.lacuna.automata.fa;

import java.util.Objects;

/**
 * The current state of a {@link DFA}, and the input it has yet to read.
 */
public final class DFAConfiguration<S> {

  private final S state;
  private final String input;
  private final int offset;

  public DFAConfiguration(S state, String remainingInput) {
    this(state, remainingInput, 0);
  }

  /**
   * @param offset the index in {@code input} of the first unread character
   */
  public DFAConfiguration(S state, String input, int offset) {
    this.state = state;
    this.input = input;
    this.offset = offset;
  }

  public S state() {
    return state;
  }

  public String remainingInput() {
    return input.substring(offset);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof DFAConfiguration) {
      DFAConfiguration<?> c = (DFAConfiguration<?>) obj;
      return Objects.equals(state, c.state) && remainingInput().equals(c.remainingInput());
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, remainingInput());
  }

  @Override
  public String toString() {
    return "{" + state + "}'" + remainingInput() + "'";
  }
}
