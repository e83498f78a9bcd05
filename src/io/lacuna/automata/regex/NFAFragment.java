package io.lacuna.automata.regex;

import io.lacuna.automata.StatePair;
import io.lacuna.automata.fa.NFA;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static io.lacuna.automata.fa.NFA.EPSILON;

/**
 * A mutable piece of an NFA with a single entry state, which is grown by Thompson's construction. States are integers
 * drawn from a counter shared by every fragment of the same expression, so fragments can be joined without renaming.
 */
final class NFAFragment {

  private final AtomicInteger counter;

  int init;
  LinearSet<Integer> states = new LinearSet<>();
  LinearSet<Integer> accept = new LinearSet<>();
  private final LinearMap<Integer, LinearMap<String, LinearSet<Integer>>> transitions = new LinearMap<>();

  private NFAFragment(AtomicInteger counter) {
    this.counter = counter;
    this.init = newState();
  }

  private NFAFragment(AtomicInteger counter, int init) {
    this.counter = counter;
    this.init = init;
    states.add(init);
  }

  /// constructors

  /**
   * @return a fragment which only accepts the empty string
   */
  static NFAFragment empty(AtomicInteger counter) {
    NFAFragment f = new NFAFragment(counter);
    f.accept.add(f.init);
    return f;
  }

  /**
   * @return a fragment which accepts any one of {@code symbols}, or nothing if there are none
   */
  static NFAFragment match(AtomicInteger counter, Iterable<String> symbols) {
    NFAFragment f = new NFAFragment(counter);
    int s = f.newState();
    for (String symbol : symbols) {
      f.addTransition(f.init, symbol, s);
    }
    f.accept.add(s);
    return f;
  }

  /// combinators

  /**
   * @return the current fragment, extended to match {@code fragment} after its current accept states
   */
  NFAFragment concat(NFAFragment fragment) {
    for (int a : accept) {
      addTransition(a, EPSILON, fragment.init);
    }
    absorb(fragment);
    accept = fragment.accept;
    return this;
  }

  /**
   * @return the current fragment, updated to match either its own pattern or that of {@code fragment}
   */
  NFAFragment union(NFAFragment fragment) {
    int s = newState();
    addTransition(s, EPSILON, init);
    addTransition(s, EPSILON, fragment.init);
    absorb(fragment);
    fragment.accept.forEach(accept::add);
    init = s;
    return this;
  }

  /**
   * @return the current fragment, updated to match its pattern zero or one times
   */
  NFAFragment maybe() {
    // a fresh entry, so that loops back to the old one don't become optional
    int s = newState();
    addTransition(s, EPSILON, init);
    init = s;
    accept.add(s);
    return this;
  }

  /**
   * @return the current fragment, updated to match its pattern zero or more times
   */
  NFAFragment kleene() {
    int s = newState();
    addTransition(s, EPSILON, init);
    for (int a : accept) {
      addTransition(a, EPSILON, s);
    }
    init = s;
    accept = LinearSet.of(s);
    return this;
  }

  /**
   * @return the current fragment, updated to match its pattern one or more times
   */
  NFAFragment plus() {
    for (int a : accept) {
      addTransition(a, EPSILON, init);
    }
    return this;
  }

  /**
   * @param upper the maximum number of repetitions, or null for no maximum
   * @return a new fragment, matching this fragment's pattern between {@code lower} and {@code upper} times
   */
  NFAFragment repeat(int lower, Integer upper) {
    NFAFragment result = empty(counter);
    for (int i = 0; i < lower; i++) {
      result.concat(copy());
    }
    if (upper == null) {
      result.concat(copy().kleene());
    } else {
      for (int i = lower; i < upper; i++) {
        result.concat(copy().maybe());
      }
    }
    return result;
  }

  /**
   * @return a new fragment which accepts the words matched by both this fragment and {@code fragment}
   */
  NFAFragment intersection(NFAFragment fragment) {
    return product(fragment, false);
  }

  /**
   * @return a new fragment which accepts every interleaving of a word matched by this fragment with a word matched by
   * {@code fragment}
   */
  NFAFragment shuffle(NFAFragment fragment) {
    return product(fragment, true);
  }

  /**
   * @return an identical fragment with fresh states
   */
  NFAFragment copy() {
    LinearMap<Integer, Integer> names = new LinearMap<>();
    Function<Integer, Integer> name = s -> {
      Integer n = names.get(s, null);
      if (n == null) {
        n = counter.getAndIncrement();
        names.put(s, n);
      }
      return n;
    };

    NFAFragment f = new NFAFragment(counter, name.apply(init));
    for (int s : states) {
      f.states.add(name.apply(s));
    }
    for (int s : accept) {
      f.accept.add(name.apply(s));
    }
    for (int from : transitions.keys()) {
      LinearMap<String, LinearSet<Integer>> row = transitions.get(from, null);
      for (String symbol : row.keys()) {
        for (int to : row.get(symbol, null)) {
          f.addTransition(name.apply(from), symbol, name.apply(to));
        }
      }
    }
    return f;
  }

  NFA<Integer> toNFA(ISet<String> inputSymbols) {
    NFA.Builder<Integer> builder = NFA.<Integer>builder()
            .inputSymbols(inputSymbols)
            .states(states)
            .initialState(init)
            .finalStates(accept);

    for (int from : transitions.keys()) {
      LinearMap<String, LinearSet<Integer>> row = transitions.get(from, null);
      for (String symbol : row.keys()) {
        builder.transitions(from, symbol, row.get(symbol, null));
      }
    }
    return builder.build();
  }

  ///

  private int newState() {
    int s = counter.getAndIncrement();
    states.add(s);
    return s;
  }

  private void addTransition(int from, String symbol, int to) {
    LinearMap<String, LinearSet<Integer>> row = transitions.get(from, null);
    if (row == null) {
      row = new LinearMap<>();
      transitions.put(from, row);
    }
    LinearSet<Integer> targets = row.get(symbol, null);
    if (targets == null) {
      targets = new LinearSet<>();
      row.put(symbol, targets);
    }
    targets.add(to);
  }

  private LinearMap<String, LinearSet<Integer>> row(int state) {
    return transitions.get(state, new LinearMap<>());
  }

  private void absorb(NFAFragment fragment) {
    fragment.states.forEach(states::add);
    for (int from : fragment.transitions.keys()) {
      LinearMap<String, LinearSet<Integer>> row = fragment.transitions.get(from, null);
      for (String symbol : row.keys()) {
        for (int to : row.get(symbol, null)) {
          addTransition(from, symbol, to);
        }
      }
    }
  }

  /**
   * Explores the pairs of states reachable from both entries. Either side may always follow an epsilon transition on
   * its own, while a symbol moves both sides together, or, when {@code interleave} is set, either side alone.
   */
  private NFAFragment product(NFAFragment other, boolean interleave) {
    NFAFragment f = new NFAFragment(counter);
    LinearMap<StatePair<Integer, Integer>, Integer> names = new LinearMap<>();
    LinearList<StatePair<Integer, Integer>> queue = new LinearList<>();

    StatePair<Integer, Integer> start = StatePair.of(init, other.init);
    names.put(start, f.init);
    queue.addLast(start);

    while (queue.size() > 0) {
      StatePair<Integer, Integer> pair = queue.popFirst();
      int from = names.get(pair, null);
      int p = pair.first();
      int q = pair.second();
      if (accept.contains(p) && other.accept.contains(q)) {
        f.accept.add(from);
      }

      LinearList<StatePair<String, StatePair<Integer, Integer>>> moves = new LinearList<>();
      LinearMap<String, LinearSet<Integer>> left = row(p);
      LinearMap<String, LinearSet<Integer>> right = other.row(q);

      for (String symbol : left.keys()) {
        for (int next : left.get(symbol, null)) {
          if (symbol.equals(EPSILON) || interleave) {
            moves.addLast(StatePair.of(symbol, StatePair.of(next, q)));
          }
          if (!symbol.equals(EPSILON) && !interleave) {
            for (int otherNext : right.get(symbol, new LinearSet<>())) {
              moves.addLast(StatePair.of(symbol, StatePair.of(next, otherNext)));
            }
          }
        }
      }
      for (String symbol : right.keys()) {
        if (symbol.equals(EPSILON) || interleave) {
          for (int next : right.get(symbol, null)) {
            moves.addLast(StatePair.of(symbol, StatePair.of(p, next)));
          }
        }
      }

      for (StatePair<String, StatePair<Integer, Integer>> move : moves) {
        StatePair<Integer, Integer> target = move.second();
        Integer to = names.get(target, null);
        if (to == null) {
          to = f.newState();
          names.put(target, to);
          queue.addLast(target);
        }
        f.addTransition(from, move.first(), to);
      }
    }

    return f;
  }
}
