package io.lacuna.automata.regex;

import io.lacuna.automata.fa.DFA;
import io.lacuna.automata.fa.NFA;
import io.lacuna.bifurcan.LinearSet;

/**
 * Static checks over regular expressions, which compare them by the languages they denote.
 */
public final class Regex {

  private Regex() {
  }

  /**
   * @throws InvalidRegexException if {@code regex} is not well-formed
   */
  public static void validate(String regex) {
    RegexParser.parse(regex);
  }

  public static boolean isValid(String regex) {
    try {
      validate(regex);
      return true;
    } catch (RegexException e) {
      return false;
    }
  }

  /**
   * Compares two expressions over the union of the symbols they name.
   */
  public static boolean isEqual(String a, String b) {
    return isEqual(a, b, symbols(a, b));
  }

  public static boolean isEqual(String a, String b, Iterable<String> inputSymbols) {
    return dfa(a, inputSymbols).equals(dfa(b, inputSymbols));
  }

  /**
   * @return true if every word matched by {@code a} is matched by {@code b}
   */
  public static boolean isSubset(String a, String b) {
    return isSubset(a, b, symbols(a, b));
  }

  public static boolean isSubset(String a, String b, Iterable<String> inputSymbols) {
    return dfa(a, inputSymbols).isSubset(dfa(b, inputSymbols));
  }

  public static boolean isSuperset(String a, String b) {
    return isSubset(b, a);
  }

  public static boolean isSuperset(String a, String b, Iterable<String> inputSymbols) {
    return isSubset(b, a, inputSymbols);
  }

  ///

  private static DFA<Integer> dfa(String regex, Iterable<String> inputSymbols) {
    return DFA.fromNFA(NFA.fromRegex(regex, inputSymbols));
  }

  private static LinearSet<String> symbols(String a, String b) {
    LinearSet<String> symbols = new LinearSet<>();
    RegexParser.parse(a).collectSymbols(symbols);
    RegexParser.parse(b).collectSymbols(symbols);
    return symbols;
  }
}
