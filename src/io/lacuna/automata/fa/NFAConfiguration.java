package io.lacuna.automata.fa;

import io.lacuna.automata.Utils;
import io.lacuna.bifurcan.ISet;

/**
 * The set of states an {@link NFA} currently occupies, and the input it has yet to read.
 */
public final class NFAConfiguration<S> {

  private final ISet<S> states;
  private final String input;
  private final int offset;

  public NFAConfiguration(ISet<S> states, String remainingInput) {
    this(states, remainingInput, 0);
  }

  /**
   * @param offset the index in {@code input} of the first unread character
   */
  public NFAConfiguration(ISet<S> states, String input, int offset) {
    this.states = states;
    this.input = input;
    this.offset = offset;
  }

  public ISet<S> states() {
    return states;
  }

  public String remainingInput() {
    return input.substring(offset);
  }

  @Override
  @SuppressWarnings("unchecked")
  public boolean equals(Object obj) {
    if (obj instanceof NFAConfiguration) {
      NFAConfiguration<S> c = (NFAConfiguration<S>) obj;
      return remainingInput().equals(c.remainingInput()) && Utils.sameElements(states, c.states);
    }
    return false;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (S s : states) {
      hash += s.hashCode();
    }
    return 31 * hash + remainingInput().hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (S s : states) {
      sb.append(s).append(", ");
    }
    if (states.size() > 0) {
      sb.delete(sb.length() - 2, sb.length());
    }
    return sb.append("}'").append(remainingInput()).append("'").toString();
  }
}
