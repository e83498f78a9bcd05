package io.lacuna.automata;

import io.lacuna.bifurcan.ISet;

import java.util.Iterator;
import java.util.Optional;

/**
 * The contract shared by every recognizer: read a word step by step, and report whether it was accepted.
 *
 * @param <C> the configuration an automaton passes through while reading
 * @author ztellman
 */
public abstract class Automaton<C> {

  protected final AutomatonSettings settings;

  protected Automaton(AutomatonSettings settings) {
    this.settings = settings;
  }

  public AutomatonSettings settings() {
    return settings;
  }

  public abstract ISet<String> inputSymbols();

  /**
   * @return a lazy sequence of the configurations visited while reading {@code input}, whose last element is
   * terminal and either accepted or rejected
   */
  public abstract Iterator<Step<C>> readInputStepwise(String input);

  /**
   * @return the first structural violation in this automaton, if any
   */
  public abstract Optional<AutomatonException> findViolation();

  public abstract Automaton<C> copy();

  /**
   * @return the final configuration reached after reading {@code input}
   * @throws RejectionException if the input is not accepted
   */
  public C readInput(String input) {
    Step<C> last = lastStep(input);
    if (!last.isAccepted()) {
      throw new RejectionException("the input '" + input + "' was rejected at " + last.configuration(), last.configuration());
    }
    return last.configuration();
  }

  /**
   * @return true if reading {@code input} ends in acceptance; rejection is reported as false, never thrown
   * @throws UnsupportedOperationException if this kind of automaton cannot read input at all, as with a GNFA
   */
  public boolean acceptsInput(String input) {
    return lastStep(input).isAccepted();
  }

  /**
   * @throws AutomatonException if the automaton is malformed
   */
  public void validate() {
    Optional<AutomatonException> violation = findViolation();
    if (violation.isPresent()) {
      throw violation.get();
    }
  }

  private Step<C> lastStep(String input) {
    Iterator<Step<C>> steps = readInputStepwise(input);
    Step<C> step = steps.next();
    while (steps.hasNext()) {
      step = steps.next();
    }
    return step;
  }
}
