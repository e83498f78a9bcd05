package io.lacuna.automata;

import java.util.Objects;

/**
 * An ordered pair of states, used to name the states of product automata.
 *
 * @param <A> the left state type
 * @param <B> the right state type
 */
public final class StatePair<A, B> {

  private final A first;
  private final B second;

  private StatePair(A first, B second) {
    this.first = first;
    this.second = second;
  }

  public static <A, B> StatePair<A, B> of(A first, B second) {
    return new StatePair<>(first, second);
  }

  public A first() {
    return first;
  }

  public B second() {
    return second;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof StatePair) {
      StatePair<?, ?> p = (StatePair<?, ?>) obj;
      return Objects.equals(first, p.first) && Objects.equals(second, p.second);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hashCode(first) + Objects.hashCode(second);
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
