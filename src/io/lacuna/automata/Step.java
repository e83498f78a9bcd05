package io.lacuna.automata;

import java.util.Objects;

/**
 * A single configuration produced while reading an input, and whether reading has finished.
 *
 * @param <C> the configuration type
 */
public final class Step<C> {

  public enum Status {
    READING,
    ACCEPTED,
    REJECTED
  }

  private final C configuration;
  private final Status status;

  private Step(C configuration, Status status) {
    this.configuration = configuration;
    this.status = status;
  }

  public static <C> Step<C> reading(C configuration) {
    return new Step<>(configuration, Status.READING);
  }

  public static <C> Step<C> accepted(C configuration) {
    return new Step<>(configuration, Status.ACCEPTED);
  }

  public static <C> Step<C> rejected(C configuration) {
    return new Step<>(configuration, Status.REJECTED);
  }

  public C configuration() {
    return configuration;
  }

  public Status status() {
    return status;
  }

  /**
   * @return true if no further steps follow this one
   */
  public boolean isTerminal() {
    return status != Status.READING;
  }

  public boolean isAccepted() {
    return status == Status.ACCEPTED;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof Step) {
      Step<?> s = (Step<?>) obj;
      return status == s.status && Objects.equals(configuration, s.configuration);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(configuration, status);
  }

  @Override
  public String toString() {
    return status.name().toLowerCase() + "[" + configuration + "]";
  }
}
