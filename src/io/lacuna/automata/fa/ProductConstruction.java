package io.lacuna.automata.fa;

import io.lacuna.automata.StatePair;
import io.lacuna.automata.SymbolMismatchException;
import io.lacuna.automata.Utils;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Walks the cartesian product of two DFAs, starting from the pair of initial states. A side without a transition is
 * represented by a null component, which behaves as a non-accepting trap; pairs whose acceptance can no longer
 * change are not explored.
 */
final class ProductConstruction {

  private static final Logger logger = LoggerFactory.getLogger(ProductConstruction.class);

  enum Operation {
    UNION {
      @Override
      boolean apply(boolean a, boolean b) {
        return a || b;
      }
    },
    INTERSECTION {
      @Override
      boolean apply(boolean a, boolean b) {
        return a && b;
      }
    },
    DIFFERENCE {
      @Override
      boolean apply(boolean a, boolean b) {
        return a && !b;
      }
    },
    SYMMETRIC_DIFFERENCE {
      @Override
      boolean apply(boolean a, boolean b) {
        return a ^ b;
      }
    };

    abstract boolean apply(boolean a, boolean b);
  }

  private ProductConstruction() {
  }

  /**
   * @return the reachable product of {@code a} and {@code b}, accepting where {@code operation} holds
   */
  static <S, R> DFA<Integer> build(DFA<S> a, DFA<R> b, Operation operation) {
    checkSymbols(a, b);

    List<String> symbols = Utils.sorted(a.inputSymbols());
    Function<StatePair<S, R>, Integer> name = Utils.renamer(new AtomicInteger());
    StatePair<S, R> init = StatePair.of(a.initialState(), b.initialState());

    DFA.Builder<Integer> builder = DFA.<Integer>builder()
            .settings(a.settings())
            .inputSymbols(symbols)
            .initialState(name.apply(init));

    boolean partial = false;
    LinearSet<StatePair<S, R>> seen = LinearSet.of(init);
    LinearList<StatePair<S, R>> queue = LinearList.of(init);
    while (queue.size() > 0) {
      StatePair<S, R> pair = queue.popFirst();
      Integer id = name.apply(pair);
      builder.state(id);
      if (isFinal(a, b, pair, operation)) {
        builder.finalState(id);
      }

      for (String symbol : symbols) {
        StatePair<S, R> next = advance(a, b, pair, symbol, operation);
        if (next == null) {
          partial = true;
          continue;
        }
        if (!seen.contains(next)) {
          seen.add(next);
          queue.addLast(next);
        }
        builder.transition(id, symbol, name.apply(next));
      }
    }

    logger.debug("{} of {} and {} states has {} states", operation, a.states().size(), b.states().size(), seen.size());
    return builder.allowPartial(partial).build();
  }

  /**
   * @return true if some reachable pair of states is accepting under {@code operation}
   */
  static <S, R> boolean reachesFinal(DFA<S> a, DFA<R> b, Operation operation) {
    checkSymbols(a, b);

    List<String> symbols = Utils.sorted(a.inputSymbols());
    StatePair<S, R> init = StatePair.of(a.initialState(), b.initialState());
    LinearSet<StatePair<S, R>> seen = LinearSet.of(init);
    LinearList<StatePair<S, R>> queue = LinearList.of(init);
    while (queue.size() > 0) {
      StatePair<S, R> pair = queue.popFirst();
      if (isFinal(a, b, pair, operation)) {
        return true;
      }
      for (String symbol : symbols) {
        StatePair<S, R> next = advance(a, b, pair, symbol, operation);
        if (next != null && !seen.contains(next)) {
          seen.add(next);
          queue.addLast(next);
        }
      }
    }
    return false;
  }

  private static <S, R> StatePair<S, R> advance(DFA<S> a, DFA<R> b, StatePair<S, R> pair, String symbol, Operation operation) {
    S left = pair.first() == null ? null : a.step(pair.first(), symbol);
    R right = pair.second() == null ? null : b.step(pair.second(), symbol);

    if (left == null && right == null) {
      return null;
    } else if (left == null && !operation.apply(false, true)) {
      return null;
    } else if (right == null && !operation.apply(true, false)) {
      return null;
    }
    return StatePair.of(left, right);
  }

  private static <S, R> boolean isFinal(DFA<S> a, DFA<R> b, StatePair<S, R> pair, Operation operation) {
    return operation.apply(
            pair.first() != null && a.isFinal(pair.first()),
            pair.second() != null && b.isFinal(pair.second()));
  }

  private static void checkSymbols(DFA<?> a, DFA<?> b) {
    if (!Utils.sameElements(a.inputSymbols(), b.inputSymbols())) {
      throw new SymbolMismatchException("the input symbols " + Utils.sorted(a.inputSymbols())
              + " and " + Utils.sorted(b.inputSymbols()) + " do not match");
    }
  }
}
