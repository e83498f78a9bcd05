package io.lacuna.automata.fa;

import io.lacuna.automata.AutomatonException;
import io.lacuna.automata.AutomatonSettings;
import io.lacuna.automata.EmptyLanguageException;
import io.lacuna.automata.InfiniteLanguageException;
import io.lacuna.automata.InvalidStateException;
import io.lacuna.automata.MissingStateException;
import io.lacuna.automata.MissingSymbolException;
import io.lacuna.automata.Step;
import io.lacuna.automata.Utils;
import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * A deterministic finite automaton. Unless {@code allowPartial} is set, every state has exactly one transition for
 * every input symbol; a partial DFA treats a missing transition as an implicit, non-accepting trap.
 * <p>
 * Instances are immutable, and compare equal when they accept the same language over the same alphabet.
 *
 * @param <S> the state type
 */
public class DFA<S> extends FiniteAutomaton<S, DFAConfiguration<S>> {

  @SuppressWarnings("rawtypes")
  private static final IMap NO_TRANSITIONS = new LinearMap<>().forked();

  private final IMap<S, IMap<String, S>> transitions;
  private final ISet<S> finalStates;
  private final boolean allowPartial;
  private final WordCounter<S> counter;

  private DFA(
          AutomatonSettings settings,
          ISet<S> states,
          ISet<String> inputSymbols,
          IMap<S, IMap<String, S>> transitions,
          S initialState,
          ISet<S> finalStates,
          boolean allowPartial) {
    super(settings, states, inputSymbols, initialState);
    this.transitions = transitions;
    this.finalStates = finalStates;
    this.allowPartial = allowPartial;
    this.counter = new WordCounter<>(this);
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  /**
   * Accumulates the parameters of a {@link DFA}. Collections passed in are copied, so the builder may be reused.
   */
  public static final class Builder<S> {

    private final LinearSet<S> states = new LinearSet<>();
    private final LinearSet<String> inputSymbols = new LinearSet<>();
    private final LinearMap<S, LinearMap<String, S>> transitions = new LinearMap<>();
    private final LinearSet<S> finalStates = new LinearSet<>();
    private S initialState;
    private boolean allowPartial;
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

    public Builder<S> transition(S from, String symbol, S to) {
      row(from).put(symbol, to);
      return this;
    }

    /**
     * Declares every transition out of {@code from}. An empty map declares a state with no transitions.
     */
    public Builder<S> transitions(S from, Map<String, S> row) {
      LinearMap<String, S> r = row(from);
      row.forEach(r::put);
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

    public Builder<S> allowPartial(boolean allowPartial) {
      this.allowPartial = allowPartial;
      return this;
    }

    public Builder<S> settings(AutomatonSettings settings) {
      this.settings = settings;
      return this;
    }

    private LinearMap<String, S> row(S state) {
      LinearMap<String, S> row = transitions.get(state, null);
      if (row == null) {
        row = new LinearMap<>();
        transitions.put(state, row);
      }
      return row;
    }

    /**
     * @throws AutomatonException if validation is enabled and the parameters do not describe a valid DFA
     */
    public DFA<S> build() {
      if (initialState == null) {
        throw new MissingStateException("no initial state was specified");
      }

      boolean mutable = settings.allowMutableAutomata();
      LinearMap<S, IMap<String, S>> t = new LinearMap<>();
      for (S s : transitions.keys()) {
        LinearMap<String, S> row = transitions.get(s, null);
        t.put(s, mutable ? row : row.forked());
      }

      DFA<S> dfa = new DFA<>(
              settings,
              mutable ? states : states.forked(),
              mutable ? inputSymbols : inputSymbols.forked(),
              mutable ? t : t.forked(),
              initialState,
              mutable ? finalStates : finalStates.forked(),
              allowPartial);

      if (settings.validate()) {
        dfa.validate();
      }
      return dfa;
    }
  }

  /**
   * @return a builder pre-populated with this automaton's parameters
   */
  public Builder<S> toBuilder() {
    Builder<S> b = DFA.<S>builder()
            .settings(settings)
            .states(states)
            .inputSymbols(inputSymbols)
            .initialState(initialState)
            .finalStates(finalStates)
            .allowPartial(allowPartial);
    for (S s : transitions.keys()) {
      IMap<String, S> row = transitions.get(s, null);
      LinearMap<String, S> r = b.row(s);
      for (String symbol : row.keys()) {
        r.put(symbol, row.get(symbol, null));
      }
    }
    return b;
  }

  ///

  public IMap<S, IMap<String, S>> transitions() {
    return transitions;
  }

  public ISet<S> finalStates() {
    return finalStates;
  }

  public boolean allowPartial() {
    return allowPartial;
  }

  public boolean isFinal(S state) {
    return finalStates.contains(state);
  }

  @SuppressWarnings("unchecked")
  public IMap<String, S> transitionsFrom(S state) {
    return transitions.get(state, NO_TRANSITIONS);
  }

  public Optional<S> transition(S state, String symbol) {
    return Optional.ofNullable(step(state, symbol));
  }

  // null when there is no transition
  S step(S state, String symbol) {
    return transitionsFrom(state).get(symbol, null);
  }

  WordCounter<S> counter() {
    return counter;
  }

  /**
   * @return true if some state lacks a transition for some symbol
   */
  public boolean isPartial() {
    for (S s : states) {
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : inputSymbols) {
        if (!row.contains(symbol)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public Iterable<Transition<S>> iterTransitions() {
    LinearList<Transition<S>> result = new LinearList<>();
    for (S s : transitions.keys()) {
      IMap<String, S> row = transitions.get(s, null);
      for (String symbol : row.keys()) {
        result.addLast(new Transition<>(s, symbol, row.get(symbol, null)));
      }
    }
    return result;
  }

  @Override
  public Optional<AutomatonException> findViolation() {
    for (S s : transitions.keys()) {
      Optional<AutomatonException> e = checkState(s);
      if (e.isPresent()) {
        return e;
      }

      IMap<String, S> row = transitions.get(s, null);
      for (String symbol : row.keys()) {
        e = checkSymbol(s, symbol);
        if (e.isPresent()) {
          return e;
        }
        S to = row.get(symbol, null);
        if (!states.contains(to)) {
          return Optional.of(new InvalidStateException(
                  "end state " + to + " for transition on " + s + " is not valid"));
        }
      }
    }

    if (!allowPartial) {
      for (S s : states) {
        if (!transitions.contains(s)) {
          return Optional.of(new MissingStateException("state " + s + " is missing from the transitions"));
        }
        IMap<String, S> row = transitions.get(s, null);
        for (String symbol : inputSymbols) {
          if (!row.contains(symbol)) {
            return Optional.of(new MissingSymbolException("state " + s + " is missing a transition for " + symbol));
          }
        }
      }
    }

    Optional<AutomatonException> e = checkInitialState();
    return e.isPresent() ? e : checkFinalStates(finalStates);
  }

  @Override
  public Iterator<Step<DFAConfiguration<S>>> readInputStepwise(String input) {
    return new Iterator<Step<DFAConfiguration<S>>>() {
      private S state = initialState;
      // char offset of the next unread symbol, negative before the initial configuration
      private int offset = -1;
      private boolean done = false;

      @Override
      public boolean hasNext() {
        return !done;
      }

      @Override
      public Step<DFAConfiguration<S>> next() {
        if (done) {
          throw new NoSuchElementException();
        }

        if (offset < 0) {
          offset = 0;
        } else {
          String symbol = Utils.symbolAt(input, offset);
          S next = step(state, symbol);
          if (next == null) {
            done = true;
            return Step.rejected(new DFAConfiguration<>(state, input, offset));
          }
          state = next;
          offset += symbol.length();
        }

        DFAConfiguration<S> configuration = new DFAConfiguration<>(state, input, offset);
        if (offset == input.length()) {
          done = true;
          return isFinal(state) ? Step.accepted(configuration) : Step.rejected(configuration);
        }
        return Step.reading(configuration);
      }
    };
  }

  @Override
  public boolean acceptsInput(String input) {
    S state = initialState;
    for (int i = 0; i < input.length(); ) {
      String symbol = Utils.symbolAt(input, i);
      state = step(state, symbol);
      if (state == null) {
        return false;
      }
      i += symbol.length();
    }
    return isFinal(state);
  }

  @Override
  public DFA<S> copy() {
    return new DFA<>(settings, states, inputSymbols, transitions, initialState, finalStates, allowPartial);
  }

  /// reachability

  public ISet<S> reachableStates() {
    LinearSet<S> reached = LinearSet.of(initialState);
    LinearList<S> queue = LinearList.of(initialState);
    while (queue.size() > 0) {
      IMap<String, S> row = transitionsFrom(queue.popFirst());
      for (String symbol : row.keys()) {
        S next = row.get(symbol, null);
        if (!reached.contains(next)) {
          reached.add(next);
          queue.addLast(next);
        }
      }
    }
    return reached;
  }

  /**
   * @return every state from which some final state can be reached
   */
  public ISet<S> coreachableStates() {
    LinearMap<S, LinearSet<S>> predecessors = new LinearMap<>();
    for (Transition<S> t : iterTransitions()) {
      LinearSet<S> p = predecessors.get(t.to(), null);
      if (p == null) {
        p = new LinearSet<>();
        predecessors.put(t.to(), p);
      }
      p.add(t.from());
    }

    LinearSet<S> reached = new LinearSet<>();
    LinearList<S> queue = new LinearList<>();
    for (S s : finalStates) {
      reached.add(s);
      queue.addLast(s);
    }
    while (queue.size() > 0) {
      LinearSet<S> p = predecessors.get(queue.popFirst(), null);
      if (p != null) {
        for (S s : p) {
          if (!reached.contains(s)) {
            reached.add(s);
            queue.addLast(s);
          }
        }
      }
    }
    return reached;
  }

  // reachable from the initial state, and able to reach a final state
  ISet<S> liveStates() {
    ISet<S> coreachable = coreachableStates();
    LinearSet<S> live = new LinearSet<>();
    for (S s : reachableStates()) {
      if (coreachable.contains(s)) {
        live.add(s);
      }
    }
    return live;
  }

  /**
   * @return an equivalent automaton with every state renamed, in breadth-first order over sorted symbols
   */
  <T> DFA<T> mapStates(Function<S, T> name) {
    List<String> symbols = Utils.sorted(inputSymbols);
    Builder<T> b = DFA.<T>builder()
            .settings(settings)
            .inputSymbols(inputSymbols)
            .allowPartial(allowPartial)
            .initialState(name.apply(initialState));

    LinearSet<S> seen = LinearSet.of(initialState);
    LinearList<S> queue = LinearList.of(initialState);
    while (queue.size() > 0) {
      S s = queue.popFirst();
      T t = name.apply(s);
      b.state(t);
      if (isFinal(s)) {
        b.finalState(t);
      }

      for (String symbol : symbols) {
        S next = step(s, symbol);
        if (next == null) {
          continue;
        }
        if (!seen.contains(next)) {
          seen.add(next);
          queue.addLast(next);
        }
        b.transition(t, symbol, name.apply(next));
      }
    }
    return b.build();
  }

  DFA<Integer> renumber() {
    return mapStates(Utils.renamer(new AtomicInteger()));
  }

  /// transformations

  /**
   * @return the minimal DFA for this language, with states numbered from zero in breadth-first order
   */
  public DFA<Integer> minify() {
    return Minimizer.minify(this, Utils.renamer(new AtomicInteger()));
  }

  /**
   * @return the minimal DFA for this language, with each state named by the set of original states it merges
   */
  public DFA<ISet<S>> minifyRetainingNames() {
    return Minimizer.minify(this, Function.identity());
  }

  /**
   * @return an equivalent complete DFA, where every missing transition leads to {@code trapState}
   * @throws InvalidStateException if {@code trapState} is already a state of this automaton
   */
  public DFA<S> toComplete(S trapState) {
    if (!isPartial()) {
      return copy();
    } else if (states.contains(trapState)) {
      throw new InvalidStateException("the trap state " + trapState + " is already a state");
    }

    Builder<S> b = toBuilder().allowPartial(false).state(trapState);
    for (S s : b.states) {
      for (String symbol : inputSymbols) {
        if (!b.row(s).contains(symbol)) {
          b.transition(s, symbol, trapState);
        }
      }
    }
    return b.build();
  }

  /**
   * @return an equivalent partial DFA without any state that cannot lead to acceptance, other than the initial state
   */
  public DFA<S> toPartial() {
    LinearSet<S> keep = LinearSet.of(initialState);
    liveStates().forEach(keep::add);

    Builder<S> b = DFA.<S>builder()
            .settings(settings)
            .inputSymbols(inputSymbols)
            .states(keep)
            .initialState(initialState)
            .allowPartial(true);
    for (S s : keep) {
      if (isFinal(s)) {
        b.finalState(s);
      }
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : row.keys()) {
        S to = row.get(symbol, null);
        if (keep.contains(to)) {
          b.transition(s, symbol, to);
        }
      }
    }
    return b.build();
  }

  /**
   * Like {@link #toPartial()}, but with states renamed to integers, and minified if {@code minify} is set.
   */
  public DFA<Integer> toPartial(boolean minify) {
    DFA<S> partial = toPartial();
    return minify ? partial.minify() : partial.renumber();
  }

  public DFA<Integer> complement() {
    return complement(true);
  }

  /**
   * @return a DFA accepting exactly the words over this alphabet that this one rejects
   */
  public DFA<Integer> complement(boolean minify) {
    DFA<Integer> complete = renumber();
    complete = complete.toComplete((int) complete.states().size());

    LinearSet<Integer> flipped = new LinearSet<>();
    for (Integer s : complete.states()) {
      if (!complete.isFinal(s)) {
        flipped.add(s);
      }
    }

    DFA<Integer> result = new DFA<>(
            settings,
            complete.states,
            complete.inputSymbols,
            complete.transitions,
            complete.initialState,
            flipped.forked(),
            false);
    return minify ? result.minify() : result;
  }

  public DFA<Integer> union(DFA<?> other) {
    return union(other, true);
  }

  public DFA<Integer> union(DFA<?> other, boolean minify) {
    return combine(other, ProductConstruction.Operation.UNION, minify);
  }

  public DFA<Integer> intersection(DFA<?> other) {
    return intersection(other, true);
  }

  public DFA<Integer> intersection(DFA<?> other, boolean minify) {
    return combine(other, ProductConstruction.Operation.INTERSECTION, minify);
  }

  public DFA<Integer> difference(DFA<?> other) {
    return difference(other, true);
  }

  public DFA<Integer> difference(DFA<?> other, boolean minify) {
    return combine(other, ProductConstruction.Operation.DIFFERENCE, minify);
  }

  public DFA<Integer> symmetricDifference(DFA<?> other) {
    return symmetricDifference(other, true);
  }

  public DFA<Integer> symmetricDifference(DFA<?> other, boolean minify) {
    return combine(other, ProductConstruction.Operation.SYMMETRIC_DIFFERENCE, minify);
  }

  private DFA<Integer> combine(DFA<?> other, ProductConstruction.Operation operation, boolean minify) {
    DFA<Integer> product = ProductConstruction.build(this, other, operation);
    return minify ? product.minify() : product;
  }

  /// predicates

  public boolean isSubset(DFA<?> other) {
    return !ProductConstruction.reachesFinal(this, other, ProductConstruction.Operation.DIFFERENCE);
  }

  public boolean isSuperset(DFA<?> other) {
    return other.isSubset(this);
  }

  public boolean isStrictSubset(DFA<?> other) {
    return isSubset(other) && !other.isSubset(this);
  }

  public boolean isStrictSuperset(DFA<?> other) {
    return other.isStrictSubset(this);
  }

  public boolean isDisjoint(DFA<?> other) {
    return !ProductConstruction.reachesFinal(this, other, ProductConstruction.Operation.INTERSECTION);
  }

  public boolean isEmpty() {
    return !Utils.containsAny(finalStates, reachableStates());
  }

  public boolean isFinite() {
    return topologicalOrder(liveStates()) != null;
  }

  /**
   * Kahn's algorithm over the transitions between {@code live} states.
   *
   * @return the live states with every state before its successors, or null if they contain a cycle
   */
  private IList<S> topologicalOrder(ISet<S> live) {
    LinearMap<S, Integer> incoming = new LinearMap<>();
    for (S s : live) {
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : row.keys()) {
        S next = row.get(symbol, null);
        if (live.contains(next)) {
          incoming.put(next, incoming.get(next, 0) + 1);
        }
      }
    }

    LinearList<S> order = new LinearList<>();
    LinearList<S> ready = new LinearList<>();
    for (S s : live) {
      if (!incoming.contains(s)) {
        ready.addLast(s);
      }
    }
    while (ready.size() > 0) {
      S s = ready.popFirst();
      order.addLast(s);
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : row.keys()) {
        S next = row.get(symbol, null);
        if (live.contains(next)) {
          int remaining = incoming.get(next, 0) - 1;
          incoming.put(next, remaining);
          if (remaining == 0) {
            ready.addLast(next);
          }
        }
      }
    }
    return order.size() == live.size() ? order : null;
  }

  /// word lengths

  /**
   * @throws EmptyLanguageException if no word is accepted
   */
  public int minimumWordLength() {
    LinearMap<S, Integer> distance = new LinearMap<>();
    distance.put(initialState, 0);
    LinearList<S> queue = LinearList.of(initialState);
    while (queue.size() > 0) {
      S s = queue.popFirst();
      int d = distance.get(s, null);
      if (isFinal(s)) {
        return d;
      }
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : row.keys()) {
        S next = row.get(symbol, null);
        if (!distance.contains(next)) {
          distance.put(next, d + 1);
          queue.addLast(next);
        }
      }
    }
    throw new EmptyLanguageException("the language is empty, and has no minimum word length");
  }

  /**
   * @return the length of the longest accepted word, or nothing if the language is infinite
   * @throws EmptyLanguageException if no word is accepted
   */
  public OptionalInt maximumWordLength() {
    ISet<S> live = liveStates();
    if (!live.contains(initialState)) {
      throw new EmptyLanguageException("the language is empty, and has no maximum word length");
    }

    IList<S> order = topologicalOrder(live);
    if (order == null) {
      return OptionalInt.empty();
    }

    // every live state reaches a final state, so each longest suffix is non-negative
    LinearMap<S, Integer> longest = new LinearMap<>();
    for (long i = order.size() - 1; i >= 0; i--) {
      S s = order.nth(i);
      int n = 0;
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : row.keys()) {
        Integer l = longest.get(row.get(symbol, null), null);
        if (l != null) {
          n = Math.max(n, l + 1);
        }
      }
      longest.put(s, n);
    }
    return OptionalInt.of(longest.get(initialState, null));
  }

  /// counting and enumeration

  public BigInteger countWordsOfLength(int k) {
    if (k < 0) {
      throw new IllegalArgumentException("word length must be non-negative, was " + k);
    }
    return counter.count(initialState, k);
  }

  /**
   * @return the number of accepted words
   * @throws InfiniteLanguageException if the language is infinite
   */
  public BigInteger cardinality() {
    ISet<S> live = liveStates();
    if (!live.contains(initialState)) {
      return BigInteger.ZERO;
    }

    IList<S> order = topologicalOrder(live);
    if (order == null) {
      throw new InfiniteLanguageException("the language is infinite");
    }

    // distinct paths to a final state spell distinct words
    LinearMap<S, BigInteger> paths = new LinearMap<>();
    for (long i = order.size() - 1; i >= 0; i--) {
      S s = order.nth(i);
      BigInteger n = isFinal(s) ? BigInteger.ONE : BigInteger.ZERO;
      IMap<String, S> row = transitionsFrom(s);
      for (String symbol : row.keys()) {
        n = n.add(paths.get(row.get(symbol, null), BigInteger.ZERO));
      }
      paths.put(s, n);
    }
    return paths.get(initialState, null);
  }

  /**
   * @return every accepted word of length {@code k}, in lexicographic order
   */
  public Iterator<String> wordsOfLength(int k) {
    if (k < 0) {
      throw new IllegalArgumentException("word length must be non-negative, was " + k);
    }
    return successors(null, false, Comparator.naturalOrder(), k, k);
  }

  /**
   * @return every accepted word, ordered by length and then lexicographically
   */
  public Iterable<String> words() {
    return () -> successors(null, false, Comparator.naturalOrder(), 0, null);
  }

  public Iterator<String> successors(String pivot) {
    return successors(pivot, true, Comparator.naturalOrder(), 0, null);
  }

  /**
   * Lazily enumerates accepted words after {@code pivot} in shortlex order: shorter words first, and words of equal
   * length by {@code symbolOrder}.
   *
   * @param pivot       the word to start after, or null to start from the shortest word
   * @param strict      if false, {@code pivot} itself is included when accepted
   * @param symbolOrder the order of symbols within words of equal length
   * @param minLength   the shortest word to yield
   * @param maxLength   the longest word to yield, or null for no bound
   */
  public Iterator<String> successors(
          String pivot,
          boolean strict,
          Comparator<String> symbolOrder,
          int minLength,
          Integer maxLength) {
    checkLengths(minLength, maxLength);
    IList<String> p = pivot(pivot);
    if (isEmpty()) {
      return Collections.emptyIterator();
    }

    Integer last = maxLength;
    if (last == null && isFinite()) {
      last = maximumWordLength().getAsInt();
    }

    return new ShortlexIterator<>(
            this,
            Utils.sorted(inputSymbols, symbolOrder),
            p,
            strict,
            false,
            Math.max(minLength, p == null ? 0 : (int) p.size()),
            last);
  }

  public Optional<String> successor(String pivot) {
    return first(successors(pivot));
  }

  public Optional<String> successor(
          String pivot,
          boolean strict,
          Comparator<String> symbolOrder,
          int minLength,
          Integer maxLength) {
    return first(successors(pivot, strict, symbolOrder, minLength, maxLength));
  }

  public Iterator<String> predecessors(String pivot) {
    return predecessors(pivot, true, Comparator.naturalOrder(), 0, null);
  }

  /**
   * Lazily enumerates accepted words before {@code pivot}, in descending shortlex order.
   *
   * @param pivot     the word to start before, or null to start from the longest word
   * @param maxLength the longest word to yield, or null for no bound
   * @throws InfiniteLanguageException if the language is infinite and {@code maxLength} is null
   */
  public Iterator<String> predecessors(
          String pivot,
          boolean strict,
          Comparator<String> symbolOrder,
          int minLength,
          Integer maxLength) {
    checkLengths(minLength, maxLength);
    IList<String> p = pivot(pivot);
    if (isEmpty()) {
      return Collections.emptyIterator();
    }

    int top;
    if (maxLength != null) {
      top = maxLength;
    } else {
      OptionalInt max = maximumWordLength();
      if (!max.isPresent()) {
        throw new InfiniteLanguageException("predecessors of an infinite language require a maximum length");
      }
      top = max.getAsInt();
    }
    if (p != null) {
      top = Math.min(top, (int) p.size());
    }

    return new ShortlexIterator<>(
            this,
            Utils.sorted(inputSymbols, symbolOrder.reversed()),
            p,
            strict,
            true,
            top,
            minLength);
  }

  public Optional<String> predecessor(String pivot) {
    return first(predecessors(pivot));
  }

  public Optional<String> predecessor(
          String pivot,
          boolean strict,
          Comparator<String> symbolOrder,
          int minLength,
          Integer maxLength) {
    return first(predecessors(pivot, strict, symbolOrder, minLength, maxLength));
  }

  private static void checkLengths(int minLength, Integer maxLength) {
    if (minLength < 0) {
      throw new IllegalArgumentException("minimum length must be non-negative, was " + minLength);
    } else if (maxLength != null && maxLength < 0) {
      throw new IllegalArgumentException("maximum length must be non-negative, was " + maxLength);
    }
  }

  private IList<String> pivot(String pivot) {
    if (pivot == null) {
      return null;
    }
    IList<String> symbols = Utils.symbols(pivot);
    Utils.checkSymbols(inputSymbols, symbols);
    return symbols;
  }

  private static Optional<String> first(Iterator<String> it) {
    return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
  }

  public String randomWord(int k) {
    return randomWord(k, new Random());
  }

  /**
   * @return an accepted word of length {@code k}, chosen uniformly among all such words
   * @throws IllegalArgumentException if no word of length {@code k} is accepted
   */
  public String randomWord(int k, Random random) {
    if (countWordsOfLength(k).signum() == 0) {
      throw new IllegalArgumentException("no word of length " + k + " is accepted");
    }

    List<String> symbols = Utils.sorted(inputSymbols);
    StringBuilder sb = new StringBuilder();
    S state = initialState;
    for (int i = k; i > 0; i--) {
      BigInteger total = counter.count(state, i);
      BigInteger choice;
      do {
        choice = new BigInteger(total.bitLength(), random);
      } while (choice.compareTo(total) >= 0);

      for (String symbol : symbols) {
        S next = step(state, symbol);
        if (next == null) {
          continue;
        }
        BigInteger n = counter.count(next, i - 1);
        if (choice.compareTo(n) < 0) {
          sb.append(symbol);
          state = next;
          break;
        }
        choice = choice.subtract(n);
      }
    }
    return sb.toString();
  }

  /// construction

  /**
   * @return the minimal DFA accepting the same language as {@code nfa}
   */
  public static <S> DFA<Integer> fromNFA(NFA<S> nfa) {
    return fromNFA(nfa, true);
  }

  public static <S> DFA<Integer> fromNFA(NFA<S> nfa, boolean minify) {
    DFA<ISet<S>> dfa = Determinizer.subsetConstruction(nfa);
    return minify ? dfa.minify() : dfa.renumber();
  }

  /**
   * @return a partial DFA whose states are the reachable, epsilon-closed sets of {@code nfa}'s states
   */
  public static <S> DFA<ISet<S>> fromNFARetainingNames(NFA<S> nfa) {
    return Determinizer.subsetConstruction(nfa);
  }

  public static DFA<Integer> universalLanguage(Iterable<String> symbols) {
    return PatternConstructions.universalLanguage(symbols);
  }

  public static DFA<Integer> emptyLanguage(Iterable<String> symbols) {
    return PatternConstructions.emptyLanguage(symbols);
  }

  /**
   * @return a DFA accepting words whose count of {@code symbolsToCount} lies within {@code [minLength, maxLength]}
   */
  public static DFA<Integer> ofLength(Iterable<String> symbols, int minLength, Integer maxLength, Iterable<String> symbolsToCount) {
    return PatternConstructions.ofLength(symbols, minLength, maxLength, symbolsToCount);
  }

  public static DFA<Integer> ofLength(Iterable<String> symbols, int minLength, Integer maxLength) {
    return PatternConstructions.ofLength(symbols, minLength, maxLength, symbols);
  }

  /**
   * @return a DFA accepting words whose count of {@code symbolsToCount}, modulo {@code k}, is one of
   * {@code remainders}
   */
  public static DFA<Integer> countMod(Iterable<String> symbols, int k, Iterable<Integer> remainders, Iterable<String> symbolsToCount) {
    return PatternConstructions.countMod(symbols, k, remainders, symbolsToCount);
  }

  public static DFA<Integer> countMod(Iterable<String> symbols, int k) {
    return PatternConstructions.countMod(symbols, k, LinearSet.of(0), symbols);
  }

  public static DFA<Integer> fromPrefix(Iterable<String> symbols, String prefix, boolean contains, boolean asPartial) {
    return PatternConstructions.fromPrefix(symbols, prefix, contains, asPartial);
  }

  public static DFA<Integer> fromPrefix(Iterable<String> symbols, String prefix) {
    return fromPrefix(symbols, prefix, true, true);
  }

  public static DFA<Integer> fromSuffix(Iterable<String> symbols, String suffix, boolean contains) {
    return PatternConstructions.fromSuffix(symbols, suffix, contains);
  }

  public static DFA<Integer> fromSuffix(Iterable<String> symbols, String suffix) {
    return fromSuffix(symbols, suffix, true);
  }

  public static DFA<Integer> fromSubstring(Iterable<String> symbols, String substring, boolean contains, boolean mustBeSuffix) {
    return PatternConstructions.fromSubstring(symbols, substring, contains, mustBeSuffix);
  }

  public static DFA<Integer> fromSubstring(Iterable<String> symbols, String substring) {
    return fromSubstring(symbols, substring, true, false);
  }

  public static DFA<Integer> fromSubstrings(Iterable<String> symbols, Iterable<String> substrings, boolean contains, boolean mustBeSuffix) {
    return PatternConstructions.fromSubstrings(symbols, substrings, contains, mustBeSuffix);
  }

  public static DFA<Integer> fromSubstrings(Iterable<String> symbols, Iterable<String> substrings) {
    return fromSubstrings(symbols, substrings, true, false);
  }

  public static DFA<Integer> fromSubsequence(Iterable<String> symbols, String subsequence, boolean contains) {
    return PatternConstructions.fromSubsequence(symbols, subsequence, contains);
  }

  public static DFA<Integer> fromSubsequence(Iterable<String> symbols, String subsequence) {
    return fromSubsequence(symbols, subsequence, true);
  }

  /**
   * @return a DFA accepting words whose {@code n}th symbol, counting from one, is {@code symbol}
   */
  public static DFA<Integer> nthFromStart(Iterable<String> symbols, String symbol, int n) {
    return PatternConstructions.nthFromStart(symbols, symbol, n);
  }

  /**
   * @return a DFA accepting words whose {@code n}th symbol from the end, counting from one, is {@code symbol}
   */
  public static DFA<Integer> nthFromEnd(Iterable<String> symbols, String symbol, int n) {
    return PatternConstructions.nthFromEnd(symbols, symbol, n);
  }

  /**
   * @return the minimal DFA accepting exactly the words in {@code language}
   */
  public static DFA<Integer> fromFiniteLanguage(Iterable<String> symbols, Iterable<String> language, boolean asPartial) {
    return PatternConstructions.fromFiniteLanguage(symbols, language, asPartial);
  }

  public static DFA<Integer> fromFiniteLanguage(Iterable<String> symbols, Iterable<String> language) {
    return fromFiniteLanguage(symbols, language, true);
  }

  ///

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (obj instanceof DFA) {
      DFA<?> other = (DFA<?>) obj;
      return Utils.sameElements(inputSymbols, other.inputSymbols)
              && !ProductConstruction.reachesFinal(this, other, ProductConstruction.Operation.SYMMETRIC_DIFFERENCE);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Utils.hash(inputSymbols);
  }

  @Override
  public String toString() {
    return "DFA[states=" + states.size()
            + ", symbols=" + Utils.sorted(inputSymbols)
            + ", initial=" + initialState
            + ", finals=" + finalStates.size()
            + (allowPartial ? ", partial" : "")
            + "]";
  }
}
