package io.lacuna.automata.fa;

import io.lacuna.automata.Automaton;
import io.lacuna.automata.AutomatonException;
import io.lacuna.automata.AutomatonSettings;
import io.lacuna.automata.InvalidStateException;
import io.lacuna.automata.InvalidSymbolException;
import io.lacuna.bifurcan.ISet;

import java.util.Optional;

/**
 * The state set, alphabet and initial state shared by every finite-state recognizer.
 *
 * @param <S> the state type
 * @param <C> the configuration type
 */
public abstract class FiniteAutomaton<S, C> extends Automaton<C> {

  protected final ISet<S> states;
  protected final ISet<String> inputSymbols;
  protected final S initialState;

  protected FiniteAutomaton(AutomatonSettings settings, ISet<S> states, ISet<String> inputSymbols, S initialState) {
    super(settings);
    this.states = states;
    this.inputSymbols = inputSymbols;
    this.initialState = initialState;
  }

  public ISet<S> states() {
    return states;
  }

  @Override
  public ISet<String> inputSymbols() {
    return inputSymbols;
  }

  public S initialState() {
    return initialState;
  }

  /**
   * @return every transition, one entry per edge
   */
  public abstract Iterable<Transition<S>> iterTransitions();

  protected Optional<AutomatonException> checkInitialState() {
    if (!states.contains(initialState)) {
      return Optional.of(new InvalidStateException(initialState + " is not a valid initial state"));
    }
    return Optional.empty();
  }

  protected Optional<AutomatonException> checkFinalStates(Iterable<S> finalStates) {
    for (S s : finalStates) {
      if (!states.contains(s)) {
        return Optional.of(new InvalidStateException(s + " is not a valid final state"));
      }
    }
    return Optional.empty();
  }

  protected Optional<AutomatonException> checkState(S state) {
    if (!states.contains(state)) {
      return Optional.of(new InvalidStateException(state + " is not a valid state"));
    }
    return Optional.empty();
  }

  protected Optional<AutomatonException> checkSymbol(S state, String symbol) {
    if (!inputSymbols.contains(symbol)) {
      return Optional.of(new InvalidSymbolException(symbol + " in state " + state + " is not a valid input symbol"));
    }
    return Optional.empty();
  }
}
