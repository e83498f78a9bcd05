package io.lacuna.automata.fa;

import io.lacuna.automata.AutomatonException;
import io.lacuna.automata.AutomatonSettings;
import io.lacuna.automata.InvalidStateException;
import io.lacuna.automata.MissingStateException;
import io.lacuna.automata.StatePair;
import io.lacuna.automata.Step;
import io.lacuna.automata.Utils;
import io.lacuna.automata.regex.RegexCompiler;
import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A nondeterministic finite automaton, whose transitions may lead to any number of states and may be taken without
 * reading a symbol, by labelling them with {@link #EPSILON}.
 *
 * @param <S> the state type
 */
public class NFA<S> extends FiniteAutomaton<S, NFAConfiguration<S>> {

  /**
   * The label of transitions which consume no input.
   */
  public static final String EPSILON = "";

  @SuppressWarnings("rawtypes")
  private static final IMap NO_TRANSITIONS = new LinearMap<>().forked();

  @SuppressWarnings("rawtypes")
  private static final ISet NO_STATES = new LinearSet<>().forked();

  private final IMap<S, IMap<String, ISet<S>>> transitions;
  private final ISet<S> finalStates;

  // computed on demand, guarded by itself
  private final LinearMap<S, ISet<S>> closures = new LinearMap<>();

  private NFA(
          AutomatonSettings settings,
          ISet<S> states,
          ISet<String> inputSymbols,
          IMap<S, IMap<String, ISet<S>>> transitions,
          S initialState,
          ISet<S> finalStates) {
    super(settings, states, inputSymbols, initialState);
    this.transitions = transitions;
    this.finalStates = finalStates;
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  /**
   * Accumulates the parameters of an {@link NFA}.
   */
  public static final class Builder<S> {

    private final LinearSet<S> states = new LinearSet<>();
    private final LinearSet<String> inputSymbols = new LinearSet<>();
    private final LinearMap<S, LinearMap<String, LinearSet<S>>> transitions = new LinearMap<>();
    private final LinearSet<S> finalStates = new LinearSet<>();
    private S initialState;
    private AutomatonSettings settings = AutomatonSettings.global();

    private Builder() {
    }

    public Builder<S> state(S state) {
      states.add(state);
      return this;
    }

    public Builder<S> states(Iterable<S> states) {
      states.forEach(this.states::add);
      return this;
    }

    @SafeVarargs
    public final Builder<S> states(S... states) {
      for (S s : states) {
        this.states.add(s);
      }
      return this;
    }

    public Builder<S> inputSymbols(Iterable<String> symbols) {
      symbols.forEach(inputSymbols::add);
      return this;
    }

    public Builder<S> inputSymbols(String... symbols) {
      for (String s : symbols) {
        inputSymbols.add(s);
      }
      return this;
    }

    /**
     * Adds a transition from {@code from} to {@code to} on {@code symbol}, which may be {@link NFA#EPSILON}.
     */
    public Builder<S> transition(S from, String symbol, S to) {
      targets(from, symbol).add(to);
      return this;
    }

    public Builder<S> transitions(S from, String symbol, Iterable<S> to) {
      LinearSet<S> targets = targets(from, symbol);
      to.forEach(targets::add);
      return this;
    }

    public Builder<S> initialState(S state) {
      initialState = state;
      return this;
    }

    public Builder<S> finalState(S state) {
      finalStates.add(state);
      return this;
    }

    public Builder<S> finalStates(Iterable<S> states) {
      states.forEach(finalStates::add);
      return this;
    }

    @SafeVarargs
    public final Builder<S> finalStates(S... states) {
      for (S s : states) {
        finalStates.add(s);
      }
      return this;
    }

    public Builder<S> settings(AutomatonSettings settings) {
      this.settings = settings;
      return this;
    }

    private LinearSet<S> targets(S from, String symbol) {
      LinearMap<String, LinearSet<S>> row = transitions.get(from, null);
      if (row == null) {
        row = new LinearMap<>();
        transitions.put(from, row);
      }
      LinearSet<S> targets = row.get(symbol, null);
      if (targets == null) {
        targets = new LinearSet<>();
        row.put(symbol, targets);
      }
      return targets;
    }

    public NFA<S> build() {
      if (initialState == null) {
        throw new MissingStateException("no initial state was specified");
      }

      boolean mutable = settings.allowMutableAutomata();
      LinearMap<S, IMap<String, ISet<S>>> t = new LinearMap<>();
      for (S s : transitions.keys()) {
        LinearMap<String, LinearSet<S>> row = transitions.get(s, null);
        LinearMap<String, ISet<S>> r = new LinearMap<>();
        for (String symbol : row.keys()) {
          LinearSet<S> targets = row.get(symbol, null);
          r.put(symbol, mutable ? targets : targets.forked());
        }
        t.put(s, mutable ? r : r.forked());
      }

      NFA<S> nfa = new NFA<>(
              settings,
              mutable ? states : states.forked(),
              mutable ? inputSymbols : inputSymbols.forked(),
              mutable ? t : t.forked(),
              initialState,
              mutable ? finalStates : finalStates.forked());

      if (settings.validate()) {
        nfa.validate();
      }
      return nfa;
    }
  }

  public Builder<S> toBuilder() {
    Builder<S> b = NFA.<S>builder()
            .settings(settings)
            .states(states)
            .inputSymbols(inputSymbols)
            .initialState(initialState)
            .finalStates(finalStates);
    for (Transition<S> t : iterTransitions()) {
      b.transition(t.from(), t.label(), t.to());
    }
    return b;
  }

  ///

  public IMap<S, IMap<String, ISet<S>>> transitions() {
    return transitions;
  }

  public ISet<S> finalStates() {
    return finalStates;
  }

  public boolean isFinal(S state) {
    return finalStates.contains(state);
  }

  @SuppressWarnings("unchecked")
  public ISet<S> targets(S state, String symbol) {
    IMap<String, ISet<S>> row = transitions.get(state, NO_TRANSITIONS);
    return row.get(symbol, NO_STATES);
  }

  @Override
  public Iterable<Transition<S>> iterTransitions() {
    LinearList<Transition<S>> result = new LinearList<>();
    for (S s : transitions.keys()) {
      IMap<String, ISet<S>> row = transitions.get(s, null);
      for (String symbol : row.keys()) {
        for (S to : row.get(symbol, null)) {
          result.addLast(new Transition<>(s, symbol, to));
        }
      }
    }
    return result;
  }

  /// epsilon closure

  /**
   * @return every state reachable from {@code state} without consuming input, including itself
   */
  @SuppressWarnings("unchecked")
  public ISet<S> epsilonClosure(S state) {
    if (!states.contains(state)) {
      return NO_STATES;
    }
    synchronized (closures) {
      ISet<S> closure = closures.get(state, null);
      if (closure == null) {
        closure = epsilonClosure(LinearList.of(state));
        closures.put(state, closure);
      }
      return closure;
    }
  }

  public ISet<S> epsilonClosure(Iterable<S> states) {
    LinearSet<S> closure = new LinearSet<>();
    LinearList<S> stack = new LinearList<>();
    for (S s : states) {
      if (!closure.contains(s)) {
        closure.add(s);
        stack.addLast(s);
      }
    }
    while (stack.size() > 0) {
      for (S s : targets(stack.popLast(), EPSILON)) {
        if (!closure.contains(s)) {
          closure.add(s);
          stack.addLast(s);
        }
      }
    }
    return closure.forked();
  }

  /**
   * @return the epsilon-closed set of states reached from {@code current} by reading {@code symbol}
   */
  public ISet<S> next(ISet<S> current, String symbol) {
    LinearSet<S> moved = new LinearSet<>();
    for (S s : current) {
      targets(s, symbol).forEach(moved::add);
    }
    return epsilonClosure(moved);
  }

  @Override
  public Optional<AutomatonException> findViolation() {
    for (S s : transitions.keys()) {
      Optional<AutomatonException> e = checkState(s);
      if (e.isPresent()) {
        return e;
      }

      IMap<String, ISet<S>> row = transitions.get(s, null);
      for (String symbol : row.keys()) {
        if (!symbol.equals(EPSILON)) {
          e = checkSymbol(s, symbol);
          if (e.isPresent()) {
            return e;
          }
        }
        for (S to : row.get(symbol, null)) {
          if (!states.contains(to)) {
            return Optional.of(new InvalidStateException(
                    "end state " + to + " for transition on " + s + " is not valid"));
          }
        }
      }
    }

    Optional<AutomatonException> e = checkInitialState();
    return e.isPresent() ? e : checkFinalStates(finalStates);
  }

  @Override
  public Iterator<Step<NFAConfiguration<S>>> readInputStepwise(String input) {
    return new Iterator<Step<NFAConfiguration<S>>>() {
      private ISet<S> current = epsilonClosure(initialState);
      // char offset of the next unread symbol, negative before the initial configuration
      private int offset = -1;
      private boolean done = false;

      @Override
      public boolean hasNext() {
        return !done;
      }

      @Override
      public Step<NFAConfiguration<S>> next() {
        if (done) {
          throw new NoSuchElementException();
        }

        if (offset < 0) {
          offset = 0;
        } else {
          String symbol = Utils.symbolAt(input, offset);
          ISet<S> next = NFA.this.next(current, symbol);
          if (next.size() == 0) {
            done = true;
            return Step.rejected(new NFAConfiguration<>(current, input, offset));
          }
          current = next;
          offset += symbol.length();
        }

        NFAConfiguration<S> configuration = new NFAConfiguration<>(current, input, offset);
        if (offset == input.length()) {
          done = true;
          return Utils.containsAny(finalStates, current) ? Step.accepted(configuration) : Step.rejected(configuration);
        }
        return Step.reading(configuration);
      }
    };
  }

  @Override
  public boolean acceptsInput(String input) {
    ISet<S> current = epsilonClosure(initialState);
    for (int i = 0; i < input.length(); ) {
      String symbol = Utils.symbolAt(input, i);
      current = next(current, symbol);
      if (current.size() == 0) {
        return false;
      }
      i += symbol.length();
    }
    return Utils.containsAny(finalStates, current);
  }

  @Override
  public NFA<S> copy() {
    return new NFA<>(settings, states, inputSymbols, transitions, initialState, finalStates);
  }

  /// renaming

  /**
   * Adds every state and transition of {@code nfa} to {@code builder}, with states renamed by {@code name}.
   */
  private static <S> void copyInto(Builder<Integer> builder, NFA<S> nfa, Function<S, Integer> name) {
    builder.inputSymbols(nfa.inputSymbols);
    for (S s : nfa.states) {
      builder.state(name.apply(s));
    }
    for (Transition<S> t : nfa.iterTransitions()) {
      builder.transition(name.apply(t.from()), t.label(), name.apply(t.to()));
    }
  }

  private Builder<Integer> renamedBuilder(Function<S, Integer> name) {
    Builder<Integer> b = NFA.<Integer>builder().settings(settings);
    copyInto(b, this, name);
    return b;
  }

  /// combinators

  /**
   * @return an automaton accepting any word accepted by either operand
   */
  public NFA<Integer> union(NFA<?> other) {
    return union(this, other);
  }

  private static <S, R> NFA<Integer> union(NFA<S> a, NFA<R> b) {
    AtomicInteger counter = new AtomicInteger();
    int init = counter.getAndIncrement();
    Function<S, Integer> left = Utils.renamer(counter);
    Function<R, Integer> right = Utils.renamer(counter);

    Builder<Integer> builder = a.renamedBuilder(left).state(init).initialState(init);
    copyInto(builder, b, right);
    builder.transition(init, EPSILON, left.apply(a.initialState))
            .transition(init, EPSILON, right.apply(b.initialState));
    a.finalStates.forEach(s -> builder.finalState(left.apply(s)));
    b.finalStates.forEach(s -> builder.finalState(right.apply(s)));
    return builder.build();
  }

  /**
   * @return an automaton accepting a word of this automaton followed by a word of {@code other}
   */
  public NFA<Integer> concatenate(NFA<?> other) {
    return concatenate(this, other);
  }

  private static <S, R> NFA<Integer> concatenate(NFA<S> a, NFA<R> b) {
    AtomicInteger counter = new AtomicInteger();
    Function<S, Integer> left = Utils.renamer(counter);
    Function<R, Integer> right = Utils.renamer(counter);

    Builder<Integer> builder = a.renamedBuilder(left).initialState(left.apply(a.initialState));
    copyInto(builder, b, right);
    a.finalStates.forEach(s -> builder.transition(left.apply(s), EPSILON, right.apply(b.initialState)));
    b.finalStates.forEach(s -> builder.finalState(right.apply(s)));
    return builder.build();
  }

  /**
   * @return an automaton accepting any number of consecutive words of this automaton, including none
   */
  public NFA<Integer> kleeneStar() {
    AtomicInteger counter = new AtomicInteger();
    int init = counter.getAndIncrement();
    Function<S, Integer> name = Utils.renamer(counter);

    Builder<Integer> builder = renamedBuilder(name)
            .state(init)
            .initialState(init)
            .finalState(init)
            .transition(init, EPSILON, name.apply(initialState));
    for (S s : finalStates) {
      builder.finalState(name.apply(s)).transition(name.apply(s), EPSILON, name.apply(initialState));
    }
    return builder.build();
  }

  /**
   * @return an automaton accepting the words of this automaton, and the empty word
   */
  public NFA<Integer> option() {
    AtomicInteger counter = new AtomicInteger();
    int init = counter.getAndIncrement();
    Function<S, Integer> name = Utils.renamer(counter);

    Builder<Integer> builder = renamedBuilder(name)
            .state(init)
            .initialState(init)
            .finalState(init)
            .transition(init, EPSILON, name.apply(initialState));
    finalStates.forEach(s -> builder.finalState(name.apply(s)));
    return builder.build();
  }

  /**
   * @return an automaton accepting the reversal of every word this automaton accepts
   */
  public NFA<Integer> reverse() {
    AtomicInteger counter = new AtomicInteger();
    int init = counter.getAndIncrement();
    Function<S, Integer> name = Utils.renamer(counter);

    Builder<Integer> builder = NFA.<Integer>builder()
            .settings(settings)
            .inputSymbols(inputSymbols)
            .state(init)
            .initialState(init);
    for (S s : states) {
      builder.state(name.apply(s));
    }
    for (Transition<S> t : iterTransitions()) {
      builder.transition(name.apply(t.to()), t.label(), name.apply(t.from()));
    }
    for (S s : finalStates) {
      builder.transition(init, EPSILON, name.apply(s));
    }
    return builder.finalState(name.apply(initialState)).build();
  }

  /**
   * @return an automaton accepting the words accepted by both operands
   */
  public <R> NFA<StatePair<S, R>> intersection(NFA<R> other) {
    return product(other, true);
  }

  /**
   * @return an automaton accepting every interleaving of a word of this automaton with a word of {@code other}
   */
  public <R> NFA<StatePair<S, R>> shuffleProduct(NFA<R> other) {
    return product(other, false);
  }

  // in lockstep, both sides read each symbol; otherwise exactly one side does
  private <R> NFA<StatePair<S, R>> product(NFA<R> other, boolean lockstep) {
    StatePair<S, R> init = StatePair.of(initialState, other.initialState);
    Builder<StatePair<S, R>> builder = NFA.<StatePair<S, R>>builder()
            .settings(settings)
            .inputSymbols(Utils.union(inputSymbols, other.inputSymbols))
            .initialState(init);

    LinearSet<StatePair<S, R>> seen = LinearSet.of(init);
    LinearList<StatePair<S, R>> queue = LinearList.of(init);
    while (queue.size() > 0) {
      StatePair<S, R> pair = queue.popFirst();
      S p = pair.first();
      R q = pair.second();
      builder.state(pair);
      if (isFinal(p) && other.isFinal(q)) {
        builder.finalState(pair);
      }

      LinearList<Transition<StatePair<S, R>>> moves = new LinearList<>();
      for (S next : targets(p, EPSILON)) {
        moves.addLast(new Transition<>(pair, EPSILON, StatePair.of(next, q)));
      }
      for (R next : other.targets(q, EPSILON)) {
        moves.addLast(new Transition<>(pair, EPSILON, StatePair.of(p, next)));
      }

      for (String symbol : builder.inputSymbols) {
        if (lockstep) {
          for (S a : targets(p, symbol)) {
            for (R b : other.targets(q, symbol)) {
              moves.addLast(new Transition<>(pair, symbol, StatePair.of(a, b)));
            }
          }
        } else {
          for (S a : targets(p, symbol)) {
            moves.addLast(new Transition<>(pair, symbol, StatePair.of(a, q)));
          }
          for (R b : other.targets(q, symbol)) {
            moves.addLast(new Transition<>(pair, symbol, StatePair.of(p, b)));
          }
        }
      }

      for (Transition<StatePair<S, R>> move : moves) {
        builder.transition(move.from(), move.label(), move.to());
        if (!seen.contains(move.to())) {
          seen.add(move.to());
          queue.addLast(move.to());
        }
      }
    }
    return builder.build();
  }

  /**
   * @return every pair reachable from {@code init} in the product of this automaton and {@code other}, where
   * symbols are read in lockstep and epsilon transitions are taken independently
   */
  private <R> ISet<StatePair<S, R>> jointlyReachable(NFA<R> other, StatePair<S, R> init) {
    LinearSet<StatePair<S, R>> seen = LinearSet.of(init);
    LinearList<StatePair<S, R>> queue = LinearList.of(init);
    while (queue.size() > 0) {
      StatePair<S, R> pair = queue.popFirst();
      LinearList<StatePair<S, R>> next = new LinearList<>();
      for (S p : epsilonClosure(pair.first())) {
        next.addLast(StatePair.of(p, pair.second()));
      }
      for (R q : other.epsilonClosure(pair.second())) {
        next.addLast(StatePair.of(pair.first(), q));
      }
      for (String symbol : inputSymbols) {
        for (S p : targets(pair.first(), symbol)) {
          for (R q : other.targets(pair.second(), symbol)) {
            next.addLast(StatePair.of(p, q));
          }
        }
      }
      for (StatePair<S, R> n : next) {
        if (!seen.contains(n)) {
          seen.add(n);
          queue.addLast(n);
        }
      }
    }
    return seen;
  }

  /**
   * @return an automaton accepting each word {@code w} such that {@code wx} is accepted by this automaton for some
   * {@code x} accepted by {@code other}
   */
  public <R> NFA<S> rightQuotient(NFA<R> other) {
    Builder<S> builder = NFA.<S>builder()
            .settings(settings)
            .states(states)
            .inputSymbols(Utils.union(inputSymbols, other.inputSymbols))
            .initialState(initialState);
    for (Transition<S> t : iterTransitions()) {
      builder.transition(t.from(), t.label(), t.to());
    }

    for (S s : states) {
      for (StatePair<S, R> pair : jointlyReachable(other, StatePair.of(s, other.initialState))) {
        if (isFinal(pair.first()) && other.isFinal(pair.second())) {
          builder.finalState(s);
          break;
        }
      }
    }
    return builder.build();
  }

  /**
   * @return an automaton accepting each word {@code w} such that {@code xw} is accepted by this automaton for some
   * {@code x} accepted by {@code other}
   */
  public <R> NFA<Integer> leftQuotient(NFA<R> other) {
    AtomicInteger counter = new AtomicInteger();
    int init = counter.getAndIncrement();
    Function<S, Integer> name = Utils.renamer(counter);

    Builder<Integer> builder = renamedBuilder(name)
            .inputSymbols(other.inputSymbols)
            .state(init)
            .initialState(init);
    finalStates.forEach(s -> builder.finalState(name.apply(s)));

    for (StatePair<S, R> pair : jointlyReachable(other, StatePair.of(initialState, other.initialState))) {
      if (other.isFinal(pair.second())) {
        builder.transition(init, EPSILON, name.apply(pair.first()));
      }
    }
    return builder.build();
  }

  /**
   * @return an equivalent automaton without epsilon transitions, and without states that become unreachable
   */
  public NFA<S> eliminateLambda() {
    LinearMap<S, LinearMap<String, LinearSet<S>>> moves = new LinearMap<>();
    for (S s : states) {
      LinearMap<String, LinearSet<S>> row = new LinearMap<>();
      for (S p : epsilonClosure(s)) {
        IMap<String, ISet<S>> r = transitions.get(p, NO_TRANSITIONS);
        for (String symbol : r.keys()) {
          if (symbol.equals(EPSILON)) {
            continue;
          }
          LinearSet<S> targets = row.get(symbol, null);
          if (targets == null) {
            targets = new LinearSet<>();
            row.put(symbol, targets);
          }
          r.get(symbol, null).forEach(targets::add);
        }
      }
      moves.put(s, row);
    }

    Builder<S> builder = NFA.<S>builder()
            .settings(settings)
            .inputSymbols(inputSymbols)
            .initialState(initialState);

    LinearSet<S> seen = LinearSet.of(initialState);
    LinearList<S> queue = LinearList.of(initialState);
    while (queue.size() > 0) {
      S s = queue.popFirst();
      builder.state(s);
      if (Utils.containsAny(finalStates, epsilonClosure(s))) {
        builder.finalState(s);
      }
      LinearMap<String, LinearSet<S>> row = moves.get(s, null);
      for (String symbol : row.keys()) {
        for (S to : row.get(symbol, null)) {
          builder.transition(s, symbol, to);
          if (!seen.contains(to)) {
            seen.add(to);
            queue.addLast(to);
          }
        }
      }
    }
    return builder.build();
  }

  /**
   * @return the minimal DFA for this automaton's language
   */
  public DFA<Integer> toDFA() {
    return DFA.fromNFA(this);
  }

  /// construction

  public static <S> NFA<S> fromDFA(DFA<S> dfa) {
    Builder<S> builder = NFA.<S>builder()
            .settings(dfa.settings())
            .states(dfa.states())
            .inputSymbols(dfa.inputSymbols())
            .initialState(dfa.initialState())
            .finalStates(dfa.finalStates());
    for (Transition<S> t : dfa.iterTransitions()) {
      builder.transition(t.from(), t.label(), t.to());
    }
    return builder.build();
  }

  /**
   * @return an automaton accepting the language of {@code regex}, over the symbols it mentions
   */
  public static NFA<Integer> fromRegex(String regex) {
    return RegexCompiler.compile(regex, null);
  }

  public static NFA<Integer> fromRegex(String regex, Iterable<String> inputSymbols) {
    return RegexCompiler.compile(regex, inputSymbols);
  }

  /**
   * Equivalent to {@code editDistance(inputSymbols, reference, maxEdits, true, true, true)}.
   */
  public static NFA<StatePair<Integer, Integer>> editDistance(Iterable<String> inputSymbols, String reference, int maxEdits) {
    return editDistance(inputSymbols, reference, maxEdits, true, true, true);
  }

  /**
   * @return an automaton accepting every word within {@code maxEdits} edits of {@code reference}, where each state
   * is a pair of the position in {@code reference} and the number of edits used
   */
  public static NFA<StatePair<Integer, Integer>> editDistance(
          Iterable<String> inputSymbols,
          String reference,
          int maxEdits,
          boolean insertion,
          boolean deletion,
          boolean substitution) {
    if (!insertion && !deletion && !substitution) {
      throw new IllegalArgumentException("at least one of insertion, deletion or substitution must be allowed");
    } else if (maxEdits < 0) {
      throw new IllegalArgumentException("the maximum edit distance must be non-negative, was " + maxEdits);
    }

    IList<String> ref = Utils.symbols(reference);
    LinearSet<String> symbols = new LinearSet<>();
    inputSymbols.forEach(symbols::add);
    Utils.checkSymbols(symbols, ref);

    int n = (int) ref.size();
    Builder<StatePair<Integer, Integer>> builder = NFA.<StatePair<Integer, Integer>>builder()
            .inputSymbols(symbols)
            .initialState(StatePair.of(0, 0));

    for (int i = 0; i <= n; i++) {
      for (int e = 0; e <= maxEdits; e++) {
        StatePair<Integer, Integer> state = StatePair.of(i, e);
        builder.state(state);
        if (i == n) {
          builder.finalState(state);
        } else {
          builder.transition(state, ref.nth(i), StatePair.of(i + 1, e));
        }

        if (e < maxEdits) {
          for (String symbol : symbols) {
            if (insertion) {
              builder.transition(state, symbol, StatePair.of(i, e + 1));
            }
            if (substitution && i < n && !symbol.equals(ref.nth(i))) {
              builder.transition(state, symbol, StatePair.of(i + 1, e + 1));
            }
          }
          if (deletion && i < n) {
            builder.transition(state, EPSILON, StatePair.of(i + 1, e + 1));
          }
        }
      }
    }
    return builder.build();
  }

  ///

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof NFA) {
      NFA<?> other = (NFA<?>) obj;
      return Utils.sameElements(inputSymbols, other.inputSymbols)
              && DFA.fromNFA(this, false).equals(DFA.fromNFA(other, false));
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Utils.hash(inputSymbols);
  }

  @Override
  public String toString() {
    return "NFA[states=" + states.size()
            + ", symbols=" + Utils.sorted(inputSymbols)
            + ", initial=" + initialState
            + ", finals=" + finalStates.size()
            + "]";
  }
}
