package io.lacuna.automata.fa;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Enumerates accepted words one length at a time, each length by a depth-first walk over {@code symbols} in order.
 * Branches which cannot complete a word of the current length are pruned using the DFA's word counts.
 * <p>
 * When a pivot is given, the walk at the pivot's length stays "tight" along the pivot's own symbols, so that only
 * words on the far side of the pivot are yielded.
 */
final class ShortlexIterator<S> implements Iterator<String> {

  private static final class Frame<S> {
    final S state;
    final String prefix;
    final int depth;
    final boolean tight;
    int next;

    Frame(S state, String prefix, int depth, boolean tight, int next) {
      this.state = state;
      this.prefix = prefix;
      this.depth = depth;
      this.tight = tight;
      this.next = next;
    }
  }

  private final DFA<S> dfa;
  private final WordCounter<S> counter;
  private final List<String> symbols;
  private final IList<String> pivot;
  private final int[] pivotIndex;
  private final boolean strict;
  private final boolean descending;
  private final Integer last;

  private final LinearList<Frame<S>> stack = new LinearList<>();
  private int length;
  private boolean started = false;
  private boolean exhausted = false;
  private String next = null;

  /**
   * @param first the first length to walk
   * @param last  the last length to walk, or null to keep ascending without end
   */
  ShortlexIterator(
          DFA<S> dfa,
          List<String> symbols,
          IList<String> pivot,
          boolean strict,
          boolean descending,
          int first,
          Integer last) {
    if (first < 0 || (last != null && last < 0)) {
      throw new IllegalArgumentException("word lengths must be non-negative, were " + first + " and " + last);
    } else if (descending && last == null) {
      throw new IllegalArgumentException("a descending walk needs a last length");
    }

    this.dfa = dfa;
    this.counter = dfa.counter();
    this.symbols = symbols;
    this.pivot = pivot;
    this.strict = strict;
    this.descending = descending;
    this.length = first;
    this.last = last;

    this.pivotIndex = new int[pivot == null ? 0 : (int) pivot.size()];
    for (int i = 0; i < pivotIndex.length; i++) {
      pivotIndex[i] = symbols.indexOf(pivot.nth(i));
    }
  }

  @Override
  public boolean hasNext() {
    if (next == null && !exhausted) {
      next = advance();
      exhausted = next == null;
    }
    return next != null;
  }

  @Override
  public String next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    String word = next;
    next = null;
    return word;
  }

  private boolean isTight(int length) {
    return pivot != null && length == pivot.size();
  }

  private Frame<S> frame(S state, String prefix, int depth, boolean tight) {
    return new Frame<>(state, prefix, depth, tight, tight && depth < pivotIndex.length ? pivotIndex[depth] : 0);
  }

  private boolean nextLength() {
    if (started) {
      length += descending ? -1 : 1;
    }
    started = true;

    if (last != null && (descending ? length < last : length > last)) {
      return false;
    }

    if (counter.count(dfa.initialState(), length).signum() > 0) {
      stack.addLast(frame(dfa.initialState(), "", 0, isTight(length)));
    }
    return true;
  }

  private String advance() {
    for (;;) {
      if (stack.size() == 0) {
        if (!nextLength()) {
          return null;
        }
        continue;
      }

      Frame<S> f = stack.nth(stack.size() - 1);
      if (f.depth == length) {
        stack.popLast();
        if (f.tight && strict) {
          continue;
        }
        return f.prefix;
      }

      if (f.next >= symbols.size()) {
        stack.popLast();
        continue;
      }

      int index = f.next++;
      String symbol = symbols.get(index);
      S target = dfa.step(f.state, symbol);
      if (target == null || counter.count(target, length - f.depth - 1).signum() == 0) {
        continue;
      }
      stack.addLast(frame(target, f.prefix + symbol, f.depth + 1, f.tight && index == pivotIndex[f.depth]));
    }
  }
}
