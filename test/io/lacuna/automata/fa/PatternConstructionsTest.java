package io.lacuna.automata.fa;

import io.lacuna.automata.InvalidSymbolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.lacuna.automata.fa.DFATest.all;
import static org.junit.jupiter.api.Assertions.*;

class PatternConstructionsTest {

  private static final List<String> AB = Arrays.asList("a", "b");
  private static final List<String> ABC = Arrays.asList("a", "b", "c");

  private static void assertAccepts(DFA<?> dfa, String... words) {
    for (String w : words) {
      assertTrue(dfa.acceptsInput(w), "should accept '" + w + "'");
    }
  }

  private static void assertRejects(DFA<?> dfa, String... words) {
    for (String w : words) {
      assertFalse(dfa.acceptsInput(w), "should reject '" + w + "'");
    }
  }

  @Nested
  @DisplayName("trivial languages")
  class TrivialTests {

    @Test
    void universal() {
      DFA<Integer> dfa = DFA.universalLanguage(AB);
      assertAccepts(dfa, "", "a", "abba");
      assertEquals(1, dfa.states().size());
    }

    @Test
    void empty() {
      DFA<Integer> dfa = DFA.emptyLanguage(AB);
      assertRejects(dfa, "", "a", "abba");
      assertEquals(DFA.universalLanguage(AB).complement(), dfa);
    }
  }

  @Nested
  @DisplayName("counting")
  class CountingTests {

    @Test
    void boundedLength() {
      DFA<Integer> dfa = DFA.ofLength(AB, 2, 3);
      assertAccepts(dfa, "ab", "aba");
      assertRejects(dfa, "", "a", "abab");
    }

    @Test
    void unboundedLength() {
      DFA<Integer> dfa = DFA.ofLength(AB, 2, null);
      assertAccepts(dfa, "ab", "abab", "bbbbbbbb");
      assertRejects(dfa, "", "a");
    }

    @Test
    @DisplayName("only the counted symbols contribute to the length")
    void countedSymbols() {
      DFA<Integer> dfa = DFA.ofLength(AB, 1, 1, Arrays.asList("a"));
      assertAccepts(dfa, "a", "bab", "bbbab");
      assertRejects(dfa, "", "bb", "aa");
    }

    @Test
    void invalidLengths() {
      assertAll(
              () -> assertThrows(IllegalArgumentException.class, () -> DFA.ofLength(AB, -1, 2)),
              () -> assertThrows(IllegalArgumentException.class, () -> DFA.ofLength(AB, 3, 2)),
              () -> assertThrows(InvalidSymbolException.class, () -> DFA.ofLength(AB, 1, 2, Arrays.asList("c")))
      );
    }

    @Test
    void countMod() {
      DFA<Integer> dfa = DFA.countMod(AB, 3);
      assertAccepts(dfa, "", "abb", "aaaaaa");
      assertRejects(dfa, "a", "ab", "abba");
    }

    @Test
    void countModWithRemainders() {
      DFA<Integer> dfa = DFA.countMod(AB, 2, Arrays.asList(1), Arrays.asList("a"));
      assertAccepts(dfa, "a", "bab", "aaa");
      assertRejects(dfa, "", "b", "aa", "abab");
    }

    @Test
    void invalidModulus() {
      assertAll(
              () -> assertThrows(IllegalArgumentException.class, () -> DFA.countMod(AB, 0)),
              () -> assertThrows(IllegalArgumentException.class,
                      () -> DFA.countMod(AB, 2, Arrays.asList(2), AB))
      );
    }
  }

  @Nested
  @DisplayName("prefixes and suffixes")
  class AffixTests {

    @Test
    void prefix() {
      DFA<Integer> dfa = DFA.fromPrefix(AB, "ab");
      assertAccepts(dfa, "ab", "abba", "aba");
      assertRejects(dfa, "", "a", "ba", "bab");
      assertTrue(dfa.isPartial());
    }

    @Test
    @DisplayName("every combination of flags describes the same language")
    void prefixVariants() {
      DFA<Integer> excluded = DFA.fromPrefix(AB, "ab", false, true);
      assertAccepts(excluded, "", "a", "ba", "aa");
      assertRejects(excluded, "ab", "abb");

      assertAll(
              () -> assertEquals(DFA.fromPrefix(AB, "ab"), DFA.fromPrefix(AB, "ab", true, false)),
              () -> assertFalse(DFA.fromPrefix(AB, "ab", true, false).isPartial()),
              () -> assertEquals(excluded, DFA.fromPrefix(AB, "ab", false, false)),
              () -> assertEquals(DFA.fromPrefix(AB, "ab").complement(), excluded)
      );
    }

    @Test
    @DisplayName("an empty prefix is always present")
    void emptyPrefix() {
      assertAll(
              () -> assertEquals(DFA.universalLanguage(AB), DFA.fromPrefix(AB, "")),
              () -> assertTrue(DFA.fromPrefix(AB, "", false, true).isEmpty())
      );
    }

    @Test
    void suffix() {
      DFA<Integer> dfa = DFA.fromSuffix(AB, "ab");
      assertAccepts(dfa, "ab", "bab", "aab", "abab");
      assertRejects(dfa, "", "b", "aba", "ba");

      DFA<Integer> excluded = DFA.fromSuffix(AB, "ab", false);
      assertAccepts(excluded, "", "b", "aba");
      assertRejects(excluded, "ab", "bab");
    }

    @Test
    @DisplayName("symbols outside the alphabet are rejected")
    void invalidSymbol() {
      assertAll(
              () -> assertThrows(InvalidSymbolException.class, () -> DFA.fromPrefix(AB, "ac")),
              () -> assertThrows(InvalidSymbolException.class, () -> DFA.fromSuffix(AB, "c"))
      );
    }
  }

  @Nested
  @DisplayName("substrings and subsequences")
  class SubstringTests {

    @Test
    void substring() {
      DFA<Integer> dfa = DFA.fromSubstring(AB, "aba");
      assertAccepts(dfa, "aba", "babab", "abaa", "bbabab");
      assertRejects(dfa, "", "ab", "abba", "baab");
    }

    @Test
    void substringAsSuffix() {
      DFA<Integer> dfa = DFA.fromSubstring(AB, "aba", true, true);
      assertAccepts(dfa, "aba", "bbaba");
      assertRejects(dfa, "abab", "abaa");
    }

    @Test
    void excludedSubstring() {
      DFA<Integer> dfa = DFA.fromSubstring(AB, "aa", false, false);
      assertAccepts(dfa, "", "a", "abab", "babba");
      assertRejects(dfa, "aa", "baab", "abaa");
    }

    @Test
    @DisplayName("any of several substrings")
    void substrings() {
      DFA<Integer> dfa = DFA.fromSubstrings(ABC, Arrays.asList("ab", "ca"));
      assertAccepts(dfa, "ab", "cab", "cca", "bcab");
      assertRejects(dfa, "", "acb", "cc", "ba");
      assertEquals(
              DFA.fromSubstring(ABC, "ab").union(DFA.fromSubstring(ABC, "ca")),
              dfa);
    }

    @Test
    void substringsAsSuffixes() {
      DFA<Integer> dfa = DFA.fromSubstrings(ABC, Arrays.asList("ab", "ca"), true, true);
      assertAccepts(dfa, "ab", "cab", "bca");
      assertRejects(dfa, "abc", "cac");
    }

    @Test
    void excludedSubstrings() {
      DFA<Integer> dfa = DFA.fromSubstrings(ABC, Arrays.asList("ab", "ca"), false, false);
      assertAccepts(dfa, "", "ba", "acb", "cc");
      assertRejects(dfa, "ab", "cab", "ca");
    }

    @Test
    void subsequence() {
      DFA<Integer> dfa = DFA.fromSubsequence(AB, "ab");
      assertAccepts(dfa, "ab", "aab", "bab", "abba", "baaab");
      assertRejects(dfa, "", "ba", "bbba", "aaa");

      DFA<Integer> excluded = DFA.fromSubsequence(AB, "ab", false);
      assertEquals(dfa.complement(), excluded);
    }
  }

  @Nested
  @DisplayName("positional symbols")
  class PositionTests {

    @Test
    void nthFromStart() {
      DFA<Integer> dfa = DFA.nthFromStart(AB, "b", 2);
      assertAccepts(dfa, "ab", "bb", "bbaa");
      assertRejects(dfa, "", "a", "b", "ba", "aab");
    }

    @Test
    void nthFromEnd() {
      DFA<Integer> dfa = DFA.nthFromEnd(AB, "a", 3);
      assertAccepts(dfa, "abb", "aaa", "babb", "aab");
      assertRejects(dfa, "", "ab", "bbb", "abbb");
    }

    @Test
    @DisplayName("the nth-from-end automaton is already minimal")
    void nthFromEndIsMinimal() {
      DFA<Integer> dfa = DFA.nthFromEnd(AB, "a", 3);
      assertAll(
              () -> assertEquals(8, dfa.states().size()),
              () -> assertEquals(8, dfa.minify().states().size())
      );
    }

    @Test
    @DisplayName("with a single symbol only the length matters")
    void unary() {
      List<String> a = Collections.singletonList("a");
      assertAll(
              () -> assertEquals(DFA.ofLength(a, 2, null), DFA.nthFromStart(a, "a", 2)),
              () -> assertEquals(DFA.ofLength(a, 2, null), DFA.nthFromEnd(a, "a", 2))
      );
    }

    @Test
    void invalidPositions() {
      assertAll(
              () -> assertThrows(IllegalArgumentException.class, () -> DFA.nthFromStart(AB, "a", 0)),
              () -> assertThrows(IllegalArgumentException.class, () -> DFA.nthFromEnd(AB, "a", 0)),
              () -> assertThrows(InvalidSymbolException.class, () -> DFA.nthFromEnd(AB, "c", 1))
      );
    }
  }

  @Nested
  @DisplayName("finite languages")
  class FiniteLanguageTests {

    private final List<String> words = Arrays.asList("a", "ab", "bab", "bb");

    @Test
    @DisplayName("accepts exactly the given words")
    void exact() {
      DFA<Integer> dfa = DFA.fromFiniteLanguage(AB, words);
      assertAll(
              () -> assertEquals(Arrays.asList("a", "ab", "bb", "bab"), all(dfa.words().iterator())),
              () -> assertTrue(dfa.isFinite()),
              () -> assertTrue(dfa.isPartial())
      );
    }

    @Test
    @DisplayName("the result is already minimal")
    void minimal() {
      DFA<Integer> dfa = DFA.fromFiniteLanguage(AB, words);
      assertEquals(dfa.minify().states().size(), dfa.states().size());
    }

    @Test
    void complete() {
      DFA<Integer> complete = DFA.fromFiniteLanguage(AB, words, false);
      assertAll(
              () -> assertFalse(complete.isPartial()),
              () -> assertEquals(DFA.fromFiniteLanguage(AB, words), complete)
      );
    }

    @Test
    void emptyWord() {
      DFA<Integer> dfa = DFA.fromFiniteLanguage(AB, Arrays.asList(""));
      assertAccepts(dfa, "");
      assertRejects(dfa, "a", "b");
    }

    @Test
    void noWords() {
      assertAll(
              () -> assertTrue(DFA.fromFiniteLanguage(AB, Collections.emptyList()).isEmpty()),
              () -> assertThrows(InvalidSymbolException.class,
                      () -> DFA.fromFiniteLanguage(AB, Arrays.asList("abc")))
      );
    }
  }
}
