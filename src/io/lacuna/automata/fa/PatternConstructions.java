package io.lacuna.automata.fa;

import io.lacuna.automata.InvalidSymbolException;
import io.lacuna.automata.Utils;
import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * DFAs built directly from a description of their language, without going through an NFA.
 */
final class PatternConstructions {

  private PatternConstructions() {
  }

  private static LinearSet<String> alphabet(Iterable<String> symbols) {
    LinearSet<String> alphabet = new LinearSet<>();
    symbols.forEach(alphabet::add);
    return alphabet;
  }

  private static IList<String> word(LinearSet<String> alphabet, String word) {
    IList<String> symbols = Utils.symbols(word);
    Utils.checkSymbols(alphabet, symbols);
    return symbols;
  }

  private static DFA.Builder<Integer> builder(LinearSet<String> alphabet, int stateCount) {
    DFA.Builder<Integer> builder = DFA.<Integer>builder().inputSymbols(alphabet).initialState(0);
    for (int i = 0; i < stateCount; i++) {
      builder.state(i);
    }
    return builder;
  }

  // flips finality, for the 'does not contain' variants of complete constructions
  private static DFA.Builder<Integer> finals(DFA.Builder<Integer> builder, int stateCount, boolean contains, int... accepting) {
    LinearSet<Integer> a = new LinearSet<>();
    for (int s : accepting) {
      a.add(s);
    }
    for (int i = 0; i < stateCount; i++) {
      if (a.contains(i) == contains) {
        builder.finalState(i);
      }
    }
    return builder;
  }

  ///

  static DFA<Integer> universalLanguage(Iterable<String> symbols) {
    LinearSet<String> alphabet = alphabet(symbols);
    DFA.Builder<Integer> builder = builder(alphabet, 1).finalState(0);
    alphabet.forEach(c -> builder.transition(0, c, 0));
    return builder.build();
  }

  static DFA<Integer> emptyLanguage(Iterable<String> symbols) {
    LinearSet<String> alphabet = alphabet(symbols);
    DFA.Builder<Integer> builder = builder(alphabet, 1);
    alphabet.forEach(c -> builder.transition(0, c, 0));
    return builder.build();
  }

  static DFA<Integer> ofLength(Iterable<String> symbols, int minLength, Integer maxLength, Iterable<String> symbolsToCount) {
    if (minLength < 0) {
      throw new IllegalArgumentException("minimum length must be non-negative, was " + minLength);
    } else if (maxLength != null && maxLength < minLength) {
      throw new IllegalArgumentException("maximum length " + maxLength + " is less than minimum length " + minLength);
    }

    LinearSet<String> alphabet = alphabet(symbols);
    LinearSet<String> counted = alphabet(symbolsToCount);
    Utils.checkSymbols(alphabet, counted);

    // with no maximum, the last state loops; otherwise it is a trap
    int last = maxLength == null ? minLength : maxLength + 1;
    DFA.Builder<Integer> builder = builder(alphabet, last + 1);
    for (int i = 0; i <= last; i++) {
      boolean accepting = i >= minLength && (maxLength == null || i <= maxLength);
      if (accepting) {
        builder.finalState(i);
      }
      for (String c : alphabet) {
        builder.transition(i, c, counted.contains(c) && i < last ? i + 1 : i);
      }
    }
    return builder.build();
  }

  static DFA<Integer> countMod(Iterable<String> symbols, int k, Iterable<Integer> remainders, Iterable<String> symbolsToCount) {
    if (k <= 0) {
      throw new IllegalArgumentException("the modulus must be positive, was " + k);
    }

    LinearSet<String> alphabet = alphabet(symbols);
    LinearSet<String> counted = alphabet(symbolsToCount);
    Utils.checkSymbols(alphabet, counted);

    DFA.Builder<Integer> builder = builder(alphabet, k);
    for (int r : remainders) {
      if (r < 0 || r >= k) {
        throw new IllegalArgumentException("remainder " + r + " is not within [0, " + k + ")");
      }
      builder.finalState(r);
    }
    for (int i = 0; i < k; i++) {
      for (String c : alphabet) {
        builder.transition(i, c, counted.contains(c) ? (i + 1) % k : i);
      }
    }
    return builder.build();
  }

  /**
   * States {@code 0..n} track how much of the prefix has been read, and {@code n + 1} is the trap entered on a
   * mismatch.
   */
  static DFA<Integer> fromPrefix(Iterable<String> symbols, String prefix, boolean contains, boolean asPartial) {
    LinearSet<String> alphabet = alphabet(symbols);
    IList<String> p = word(alphabet, prefix);
    int n = (int) p.size();

    if (n == 0) {
      return contains ? universalLanguage(alphabet) : emptyLanguage(alphabet);
    }

    // when the prefix is required the trap can be dropped, and when it is excluded the matched state can
    boolean dropTrap = asPartial && contains;
    boolean dropMatched = asPartial && !contains;
    int trap = dropMatched ? n : n + 1;

    DFA.Builder<Integer> builder = DFA.<Integer>builder()
            .inputSymbols(alphabet)
            .initialState(0)
            .allowPartial(asPartial);

    for (int i = 0; i < n; i++) {
      builder.state(i);
      if (!contains) {
        builder.finalState(i);
      }
      for (String c : alphabet) {
        if (!c.equals(p.nth(i))) {
          if (!dropTrap) {
            builder.transition(i, c, trap);
          }
        } else if (i + 1 < n || !dropMatched) {
          builder.transition(i, c, i + 1);
        }
      }
    }

    if (!dropMatched) {
      builder.state(n);
      if (contains) {
        builder.finalState(n);
      }
      alphabet.forEach(c -> builder.transition(n, c, n));
    }
    if (!dropTrap) {
      builder.state(trap);
      if (!contains) {
        builder.finalState(trap);
      }
      alphabet.forEach(c -> builder.transition(trap, c, trap));
    }
    return builder.build();
  }

  /**
   * The KMP automaton for {@code pattern}, where state {@code i} means the longest suffix of the input which is a
   * prefix of the pattern has length {@code i}.
   *
   * @param absorbing if true, a complete match is never left
   */
  private static int[][] kmp(List<String> alphabet, IList<String> pattern, boolean absorbing) {
    int n = (int) pattern.size();
    int[][] delta = new int[n + 1][alphabet.size()];
    int fallback = 0;
    for (int i = 0; i <= n; i++) {
      for (int c = 0; c < alphabet.size(); c++) {
        if (i < n && alphabet.get(c).equals(pattern.nth(i))) {
          delta[i][c] = i + 1;
        } else if (i == n && absorbing) {
          delta[i][c] = n;
        } else {
          delta[i][c] = i == 0 ? 0 : delta[fallback][c];
        }
      }
      if (i > 0 && i < n) {
        fallback = delta[fallback][alphabet.indexOf(pattern.nth(i))];
      }
    }
    return delta;
  }

  private static DFA<Integer> fromKmp(LinearSet<String> alphabet, IList<String> pattern, boolean contains, boolean absorbing) {
    List<String> symbols = Utils.sorted(alphabet);
    int n = (int) pattern.size();
    int[][] delta = kmp(symbols, pattern, absorbing);

    DFA.Builder<Integer> builder = finals(builder(alphabet, n + 1), n + 1, contains, n);
    for (int i = 0; i <= n; i++) {
      for (int c = 0; c < symbols.size(); c++) {
        builder.transition(i, symbols.get(c), delta[i][c]);
      }
    }
    return builder.build();
  }

  static DFA<Integer> fromSuffix(Iterable<String> symbols, String suffix, boolean contains) {
    LinearSet<String> alphabet = alphabet(symbols);
    IList<String> s = word(alphabet, suffix);
    if (s.size() == 0) {
      return contains ? universalLanguage(alphabet) : emptyLanguage(alphabet);
    }
    return fromKmp(alphabet, s, contains, false);
  }

  static DFA<Integer> fromSubstring(Iterable<String> symbols, String substring, boolean contains, boolean mustBeSuffix) {
    if (mustBeSuffix) {
      return fromSuffix(symbols, substring, contains);
    }

    LinearSet<String> alphabet = alphabet(symbols);
    IList<String> s = word(alphabet, substring);
    if (s.size() == 0) {
      return contains ? universalLanguage(alphabet) : emptyLanguage(alphabet);
    }
    return fromKmp(alphabet, s, contains, true);
  }

  /**
   * The Aho-Corasick automaton over {@code substrings}, with the goto function completed by failure links.
   */
  static DFA<Integer> fromSubstrings(Iterable<String> symbols, Iterable<String> substrings, boolean contains, boolean mustBeSuffix) {
    LinearSet<String> alphabet = alphabet(symbols);
    List<String> sorted = Utils.sorted(alphabet);

    // trie
    List<LinearMap<String, Integer>> children = new ArrayList<>();
    List<Boolean> output = new ArrayList<>();
    children.add(new LinearMap<>());
    output.add(false);
    for (String substring : substrings) {
      int node = 0;
      for (String c : word(alphabet, substring)) {
        Integer child = children.get(node).get(c, null);
        if (child == null) {
          child = children.size();
          children.add(new LinearMap<>());
          output.add(false);
          children.get(node).put(c, child);
        }
        node = child;
      }
      output.set(node, true);
    }

    // failure links, breadth first
    int size = children.size();
    int[][] delta = new int[size][sorted.size()];
    int[] fail = new int[size];
    LinearList<Integer> queue = new LinearList<>();
    for (int c = 0; c < sorted.size(); c++) {
      Integer child = children.get(0).get(sorted.get(c), null);
      delta[0][c] = child == null ? 0 : child;
      if (child != null) {
        fail[child] = 0;
        queue.addLast(child);
      }
    }
    while (queue.size() > 0) {
      int node = queue.popFirst();
      output.set(node, output.get(node) || output.get(fail[node]));
      for (int c = 0; c < sorted.size(); c++) {
        Integer child = children.get(node).get(sorted.get(c), null);
        if (child == null) {
          delta[node][c] = delta[fail[node]][c];
        } else {
          delta[node][c] = child;
          fail[child] = delta[fail[node]][c];
          queue.addLast(child);
        }
      }
    }

    DFA.Builder<Integer> builder = builder(alphabet, size);
    for (int i = 0; i < size; i++) {
      boolean matched = output.get(i);
      if (matched == contains) {
        builder.finalState(i);
      }
      for (int c = 0; c < sorted.size(); c++) {
        builder.transition(i, sorted.get(c), matched && !mustBeSuffix ? i : delta[i][c]);
      }
    }
    return builder.build().minify();
  }

  /**
   * State {@code i} means the first {@code i} symbols of the subsequence have been seen, in order.
   */
  static DFA<Integer> fromSubsequence(Iterable<String> symbols, String subsequence, boolean contains) {
    LinearSet<String> alphabet = alphabet(symbols);
    IList<String> s = word(alphabet, subsequence);
    int n = (int) s.size();

    DFA.Builder<Integer> builder = finals(builder(alphabet, n + 1), n + 1, contains, n);
    for (int i = 0; i <= n; i++) {
      for (String c : alphabet) {
        builder.transition(i, c, i < n && c.equals(s.nth(i)) ? i + 1 : i);
      }
    }
    return builder.build();
  }

  /**
   * States {@code 0..n-1} count the symbols read so far, {@code n} accepts everything and {@code n + 1} rejects
   * everything.
   */
  static DFA<Integer> nthFromStart(Iterable<String> symbols, String symbol, int n) {
    LinearSet<String> alphabet = alphabet(symbols);
    check(alphabet, symbol, n);
    if (alphabet.size() == 1) {
      return ofLength(alphabet, n, null, alphabet);
    }

    DFA.Builder<Integer> builder = builder(alphabet, n + 2).finalState(n);
    for (int i = 0; i <= n + 1; i++) {
      for (String c : alphabet) {
        int to;
        if (i < n - 1) {
          to = i + 1;
        } else if (i == n - 1) {
          to = c.equals(symbol) ? n : n + 1;
        } else {
          to = i;
        }
        builder.transition(i, c, to);
      }
    }
    return builder.build();
  }

  /**
   * Each state is a bitmask of which of the last {@code n} symbols were {@code symbol}, most recent in the lowest
   * bit. All {@code 2^n} masks are reachable and pairwise distinguishable.
   */
  static DFA<Integer> nthFromEnd(Iterable<String> symbols, String symbol, int n) {
    LinearSet<String> alphabet = alphabet(symbols);
    check(alphabet, symbol, n);
    if (alphabet.size() == 1) {
      return ofLength(alphabet, n, null, alphabet);
    }
    if (n > 24) {
      throw new IllegalArgumentException("n = " + n + " would require 2^" + n + " states");
    }

    int size = 1 << n;
    DFA.Builder<Integer> builder = DFA.<Integer>builder().inputSymbols(alphabet).initialState(0);
    for (int mask = 0; mask < size; mask++) {
      builder.state(mask);
      if ((mask >> (n - 1) & 1) == 1) {
        builder.finalState(mask);
      }
      for (String c : alphabet) {
        builder.transition(mask, c, ((mask << 1) | (c.equals(symbol) ? 1 : 0)) & (size - 1));
      }
    }
    return builder.build().renumber();
  }

  private static void check(LinearSet<String> alphabet, String symbol, int n) {
    if (n < 1) {
      throw new IllegalArgumentException("n must be at least 1, was " + n);
    } else if (!alphabet.contains(symbol)) {
      throw new InvalidSymbolException("'" + symbol + "' is not a valid input symbol");
    }
  }

  /**
   * Inserts each word into a trie, then merges trie nodes bottom-up whenever they have the same finality and the
   * same transitions to already-merged nodes. The result is the minimal acyclic DFA.
   */
  static DFA<Integer> fromFiniteLanguage(Iterable<String> symbols, Iterable<String> language, boolean asPartial) {
    LinearSet<String> alphabet = alphabet(symbols);
    List<String> sorted = Utils.sorted(alphabet);

    List<LinearMap<String, Integer>> children = new ArrayList<>();
    List<Boolean> accepting = new ArrayList<>();
    children.add(new LinearMap<>());
    accepting.add(false);
    for (String w : language) {
      int node = 0;
      for (String c : word(alphabet, w)) {
        Integer child = children.get(node).get(c, null);
        if (child == null) {
          child = children.size();
          children.add(new LinearMap<>());
          accepting.add(false);
          children.get(node).put(c, child);
        }
        node = child;
      }
      accepting.set(node, true);
    }

    if (!accepting.contains(true)) {
      return emptyLanguage(alphabet);
    }

    // children always have larger ids than their parents, so a reverse scan is bottom-up
    int[] canonical = new int[children.size()];
    LinearMap<String, Integer> register = new LinearMap<>();
    for (int node = children.size() - 1; node >= 0; node--) {
      StringBuilder signature = new StringBuilder(accepting.get(node) ? "1" : "0");
      for (String c : sorted) {
        Integer child = children.get(node).get(c, null);
        if (child != null) {
          signature.append('\u0000').append(c).append('\u0000').append(canonical[child]);
        }
      }
      String key = signature.toString();
      Integer existing = register.get(key, null);
      if (existing == null) {
        register.put(key, node);
        canonical[node] = node;
      } else {
        canonical[node] = existing;
      }
    }

    AtomicInteger counter = new AtomicInteger();
    Function<Integer, Integer> name = Utils.renamer(counter);
    DFA.Builder<Integer> builder = DFA.<Integer>builder()
            .inputSymbols(alphabet)
            .initialState(name.apply(0))
            .allowPartial(asPartial);

    LinearSet<Integer> seen = LinearSet.of(0);
    LinearList<Integer> queue = LinearList.of(0);
    while (queue.size() > 0) {
      int node = queue.popFirst();
      int s = name.apply(node);
      builder.state(s);
      if (accepting.get(node)) {
        builder.finalState(s);
      }
      for (String c : sorted) {
        Integer child = children.get(node).get(c, null);
        if (child == null) {
          continue;
        }
        int target = canonical[child];
        if (!seen.contains(target)) {
          seen.add(target);
          queue.addLast(target);
        }
        builder.transition(s, c, name.apply(target));
      }
    }

    DFA<Integer> dfa = builder.build();
    return asPartial ? dfa : dfa.toComplete(counter.get());
  }
}
