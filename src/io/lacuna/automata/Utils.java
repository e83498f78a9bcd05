package io.lacuna.automata;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * @author ztellman
 */
public class Utils {

  /**
   * @return the symbols of {@code word}, one per code point
   */
  public static IList<String> symbols(String word) {
    LinearList<String> symbols = new LinearList<>();
    word.codePoints().forEach(c -> symbols.addLast(new String(Character.toChars(c))));
    return symbols;
  }

  /**
   * @return the symbol of {@code word} which begins at the char index {@code offset}
   */
  public static String symbolAt(String word, int offset) {
    return new String(Character.toChars(word.codePointAt(offset)));
  }

  public static <U, V> Function<U, V> memoize(Function<U, V> f) {
    LinearMap<U, V> cache = new LinearMap<>();
    return (U x) -> {
      if (!cache.contains(x)) {
        cache.put(x, f.apply(x));
      }
      return cache.get(x, null);
    };
  }

  /**
   * @return a function which assigns each distinct value the next number from {@code counter}, and returns the same
   * number for it thereafter
   */
  public static <U> Function<U, Integer> renamer(AtomicInteger counter) {
    return memoize(x -> counter.getAndIncrement());
  }

  public static <V> LinearSet<V> union(Iterable<V> a, Iterable<V> b) {
    LinearSet<V> result = new LinearSet<>();
    a.forEach(result::add);
    b.forEach(result::add);
    return result;
  }

  public static <V> boolean containsAny(ISet<V> set, Iterable<V> values) {
    for (V v : values) {
      if (set.contains(v)) {
        return true;
      }
    }
    return false;
  }

  public static <V> boolean sameElements(ISet<V> a, ISet<V> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (V v : a) {
      if (!b.contains(v)) {
        return false;
      }
    }
    return true;
  }

  public static int hash(Iterable<String> symbols) {
    int hash = 0;
    for (String s : symbols) {
      hash += s.hashCode();
    }
    return hash;
  }

  public static List<String> sorted(Iterable<String> symbols, Comparator<String> comparator) {
    List<String> result = new ArrayList<>();
    symbols.forEach(result::add);
    result.sort(comparator);
    return result;
  }

  public static List<String> sorted(Iterable<String> symbols) {
    return sorted(symbols, Comparator.naturalOrder());
  }

  public static <V> List<V> list(Iterable<V> values) {
    List<V> result = new ArrayList<>();
    values.forEach(result::add);
    return Collections.unmodifiableList(result);
  }

  /**
   * @throws InvalidSymbolException if any element of {@code symbols} is not in {@code alphabet}
   */
  public static void checkSymbols(ISet<String> alphabet, Iterable<String> symbols) {
    for (String s : symbols) {
      if (!alphabet.contains(s)) {
        throw new InvalidSymbolException("'" + s + "' is not a valid input symbol");
      }
    }
  }
}
