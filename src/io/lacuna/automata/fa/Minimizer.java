package io.lacuna.automata.fa;

import io.lacuna.automata.Utils;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Hopcroft's algorithm, refining the reachable states on their inverse transitions. Missing transitions lead to a
 * private trap, and whichever block the trap ends up in is dropped from the result.
 */
final class Minimizer {

  private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

  private static final Object TRAP = new Object() {
    @Override
    public String toString() {
      return "trap";
    }
  };

  private Minimizer() {
  }

  /**
   * @param namer names each block of equivalent states, and is called in breadth-first order from the initial block
   */
  @SuppressWarnings("unchecked")
  static <S, T> DFA<T> minify(DFA<S> dfa, Function<ISet<S>, T> namer) {
    List<String> symbols = Utils.sorted(dfa.inputSymbols());
    ISet<S> reachable = dfa.reachableStates();

    // inverse transitions, per symbol
    LinearMap<String, LinearMap<Object, LinearSet<Object>>> inverse = new LinearMap<>();
    symbols.forEach(symbol -> inverse.put(symbol, new LinearMap<>()));

    boolean trapped = false;
    for (S s : reachable) {
      for (String symbol : symbols) {
        Object next = dfa.step(s, symbol);
        if (next == null) {
          next = TRAP;
          trapped = true;
        }
        predecessors(inverse, symbol, next).add(s);
      }
    }

    LinearSet<Object> universe = new LinearSet<>();
    reachable.forEach(universe::add);
    if (trapped) {
      universe.add(TRAP);
      symbols.forEach(symbol -> predecessors(inverse, symbol, TRAP).add(TRAP));
    }

    PartitionRefinement<Object> partition = new PartitionRefinement<>(universe);
    LinearSet<Object> finals = new LinearSet<>();
    for (S s : reachable) {
      if (dfa.isFinal(s)) {
        finals.add(s);
      }
    }

    LinearSet<Integer> processing = new LinearSet<>();
    for (PartitionRefinement.Split split : partition.refine(finals)) {
      processing.add(smaller(partition, split));
    }

    while (processing.size() > 0) {
      Integer id = processing.iterator().next();
      processing.remove(id);

      List<Object> block = Utils.list(partition.block(id));
      for (String symbol : symbols) {
        LinearMap<Object, LinearSet<Object>> m = inverse.get(symbol, null);
        LinearSet<Object> splitter = new LinearSet<>();
        for (Object s : block) {
          LinearSet<Object> p = m.get(s, null);
          if (p != null) {
            p.forEach(splitter::add);
          }
        }

        for (PartitionRefinement.Split split : partition.refine(splitter)) {
          if (processing.contains(split.remaining)) {
            processing.add(split.added);
          } else {
            processing.add(smaller(partition, split));
          }
        }
      }
    }

    int trapBlock = trapped ? partition.blockOf(TRAP) : -1;
    int initialBlock = partition.blockOf(dfa.initialState());
    Function<Integer, T> name = Utils.memoize(id -> namer.apply(members(partition, id)));

    DFA.Builder<T> builder = DFA.<T>builder()
            .settings(dfa.settings())
            .inputSymbols(symbols)
            .initialState(name.apply(initialBlock));

    if (initialBlock == trapBlock) {
      // nothing is accepted
      T state = name.apply(initialBlock);
      builder.state(state);
      symbols.forEach(symbol -> builder.transition(state, symbol, state));
      logger.debug("minimized {} states to an empty language", dfa.states().size());
      return builder.build();
    }

    boolean partial = false;
    LinearSet<Integer> seen = LinearSet.of(initialBlock);
    LinearList<Integer> queue = LinearList.of(initialBlock);
    while (queue.size() > 0) {
      int id = queue.popFirst();
      S representative = (S) members(partition, id).iterator().next();
      T state = name.apply(id);
      builder.state(state);
      if (dfa.isFinal(representative)) {
        builder.finalState(state);
      }

      for (String symbol : symbols) {
        S next = dfa.step(representative, symbol);
        int target = next == null ? trapBlock : partition.blockOf(next);
        if (target == trapBlock) {
          partial = true;
          continue;
        }
        if (!seen.contains(target)) {
          seen.add(target);
          queue.addLast(target);
        }
        builder.transition(state, symbol, name.apply(target));
      }
    }

    logger.debug("minimized {} states to {}", dfa.states().size(), seen.size());
    return builder.allowPartial(partial).build();
  }

  private static LinearSet<Object> predecessors(LinearMap<String, LinearMap<Object, LinearSet<Object>>> inverse, String symbol, Object state) {
    LinearMap<Object, LinearSet<Object>> m = inverse.get(symbol, null);
    LinearSet<Object> p = m.get(state, null);
    if (p == null) {
      p = new LinearSet<>();
      m.put(state, p);
    }
    return p;
  }

  private static int smaller(PartitionRefinement<Object> partition, PartitionRefinement.Split split) {
    return partition.block(split.added).size() <= partition.block(split.remaining).size()
            ? split.added
            : split.remaining;
  }

  @SuppressWarnings("unchecked")
  private static <S> ISet<S> members(PartitionRefinement<Object> partition, int id) {
    LinearSet<S> members = new LinearSet<>();
    for (Object s : partition.block(id)) {
      if (s != TRAP) {
        members.add((S) s);
      }
    }
    return members.forked();
  }
}
