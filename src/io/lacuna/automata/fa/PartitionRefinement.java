package io.lacuna.automata.fa;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

/**
 * A partition of a fixed universe into disjoint, numbered blocks, which can only be made finer.
 *
 * @param <V> the element type
 */
final class PartitionRefinement<V> {

  static final class Split {
    final int added;
    final int remaining;

    Split(int added, int remaining) {
      this.added = added;
      this.remaining = remaining;
    }
  }

  private final LinearMap<Integer, LinearSet<V>> blocks = new LinearMap<>();
  private final LinearMap<V, Integer> partition = new LinearMap<>();
  private int nextId = 0;

  PartitionRefinement(Iterable<V> universe) {
    LinearSet<V> all = new LinearSet<>();
    int id = nextId++;
    for (V v : universe) {
      all.add(v);
      partition.put(v, id);
    }
    blocks.put(id, all);
  }

  ISet<V> block(int id) {
    return blocks.get(id, null);
  }

  /**
   * @return the id of the block containing {@code v}, or -1 if it is not in the universe
   */
  int blockOf(V v) {
    return partition.get(v, -1);
  }

  /**
   * Splits every block which {@code splitter} only partially covers. The covered part moves to a new block, and the
   * remainder keeps the old id.
   *
   * @return a split for each block that was divided
   */
  LinearList<Split> refine(Iterable<V> splitter) {
    LinearMap<Integer, LinearSet<V>> hit = new LinearMap<>();
    for (V v : splitter) {
      Integer id = partition.get(v, null);
      if (id == null) {
        continue;
      }
      LinearSet<V> covered = hit.get(id, null);
      if (covered == null) {
        covered = new LinearSet<>();
        hit.put(id, covered);
      }
      covered.add(v);
    }

    LinearList<Split> splits = new LinearList<>();
    for (Integer id : hit.keys()) {
      LinearSet<V> block = blocks.get(id, null);
      LinearSet<V> covered = hit.get(id, null);
      if (covered.size() < block.size()) {
        int added = nextId++;
        blocks.put(added, covered);
        for (V v : covered) {
          partition.put(v, added);
          block.remove(v);
        }
        splits.addLast(new Split(added, id));
      }
    }
    return splits;
  }
}
