package io.lacuna.automata.fa;

import java.util.Objects;

/**
 * A single labelled edge. In an NFA the label may be {@link NFA#EPSILON}, and in a GNFA it is a regular expression.
 */
public final class Transition<S> {

  private final S from;
  private final String label;
  private final S to;

  public Transition(S from, String label, S to) {
    this.from = from;
    this.label = label;
    this.to = to;
  }

  public S from() {
    return from;
  }

  public String label() {
    return label;
  }

  public S to() {
    return to;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Transition) {
      Transition<?> t = (Transition<?>) obj;
      return Objects.equals(from, t.from) && label.equals(t.label) && Objects.equals(to, t.to);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, label, to);
  }

  @Override
  public String toString() {
    return from + " -" + label + "-> " + to;
  }
}
