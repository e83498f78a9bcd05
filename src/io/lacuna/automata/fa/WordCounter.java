package io.lacuna.automata.fa;

import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;

import java.math.BigInteger;

/**
 * Memoizes, for each length {@code k} and state {@code s}, how many words of length {@code k} lead from {@code s} to
 * a final state. Rows are added on demand.
 */
final class WordCounter<S> {

  private final DFA<S> dfa;
  private final LinearList<LinearMap<S, BigInteger>> counts = new LinearList<>();

  WordCounter(DFA<S> dfa) {
    this.dfa = dfa;
  }

  synchronized BigInteger count(S state, int length) {
    while (counts.size() <= length) {
      extend();
    }
    return counts.nth(length).get(state, BigInteger.ZERO);
  }

  private void extend() {
    LinearMap<S, BigInteger> row = new LinearMap<>();
    if (counts.size() == 0) {
      for (S s : dfa.states()) {
        row.put(s, dfa.isFinal(s) ? BigInteger.ONE : BigInteger.ZERO);
      }
    } else {
      LinearMap<S, BigInteger> previous = counts.nth(counts.size() - 1);
      for (S s : dfa.states()) {
        BigInteger sum = BigInteger.ZERO;
        IMap<String, S> transitions = dfa.transitionsFrom(s);
        for (String symbol : transitions.keys()) {
          sum = sum.add(previous.get(transitions.get(symbol, null), BigInteger.ZERO));
        }
        row.put(s, sum);
      }
    }
    counts.addLast(row);
  }
}
