package io.lacuna.automata.fa;

import io.lacuna.automata.Utils;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The subset construction. Each reachable, epsilon-closed set of NFA states becomes one DFA state; the empty set is
 * never materialized, so the result is partial.
 */
final class Determinizer {

  private static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

  private Determinizer() {
  }

  static <S> DFA<ISet<S>> subsetConstruction(NFA<S> nfa) {
    List<String> symbols = Utils.sorted(nfa.inputSymbols());
    ISet<S> init = nfa.epsilonClosure(LinearSet.of(nfa.initialState()));

    DFA.Builder<ISet<S>> builder = DFA.<ISet<S>>builder()
            .settings(nfa.settings())
            .inputSymbols(symbols)
            .initialState(init)
            .allowPartial(true);

    LinearSet<ISet<S>> seen = LinearSet.of(init);
    LinearList<ISet<S>> queue = LinearList.of(init);
    while (queue.size() > 0) {
      ISet<S> current = queue.popFirst();
      builder.state(current);
      if (Utils.containsAny(nfa.finalStates(), current)) {
        builder.finalState(current);
      }

      for (String symbol : symbols) {
        ISet<S> next = nfa.next(current, symbol);
        if (next.size() == 0) {
          continue;
        }
        if (!seen.contains(next)) {
          seen.add(next);
          queue.addLast(next);
        }
        builder.transition(current, symbol, next);
      }
    }

    logger.debug("determinized {} states into {} subsets", nfa.states().size(), seen.size());
    return builder.build();
  }
}
