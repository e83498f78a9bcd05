package io.lacuna.automata.regex;

import io.lacuna.automata.InvalidSymbolException;
import io.lacuna.automata.fa.DFA;
import io.lacuna.automata.fa.NFA;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegexTest {

  private static final List<String> ABC = Arrays.asList("a", "b", "c");

  @Nested
  @DisplayName("validity")
  class ValidityTests {

    @ParameterizedTest
    @ValueSource(strings = {"ab|", "?", "a|b|*", "a||b", "((abc*)))((abd)", "*", "ab(bc)*((bbcd)", "a(*)", "a(|)",
            "a{1,0}", "a{-1,}", "a{-2,-1}", "[]", "[^]", "[c-a]", "a{}"})
    @DisplayName("malformed expressions are rejected")
    void invalid(String regex) {
      assertAll(
              () -> assertThrows(InvalidRegexException.class, () -> Regex.validate(regex)),
              () -> assertFalse(Regex.isValid(regex))
      );
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "()", "a", "a(b|c)*", "a+b?", "(a&b)^c", "[a-c]{2,}", "[^a]", ".*", "a b", "x{,3}"})
    void valid(String regex) {
      assertAll(
              () -> assertDoesNotThrow(() -> Regex.validate(regex)),
              () -> assertTrue(Regex.isValid(regex))
      );
    }

    @Test
    @DisplayName("unbalanced braces and brackets fail while tokenizing")
    void lexerErrors() {
      LexerException e = assertThrows(LexerException.class, () -> Regex.validate("a}"));
      assertAll(
              () -> assertEquals(1, e.position()),
              () -> assertThrows(LexerException.class, () -> Regex.validate("a{2")),
              () -> assertThrows(LexerException.class, () -> Regex.validate("[ab")),
              () -> assertThrows(LexerException.class, () -> Regex.validate("ab]")),
              () -> assertTrue(e instanceof RegexException)
      );
    }
  }

  @Nested
  @DisplayName("equivalence")
  class EquivalenceTests {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "aa?;a|aa",
            "a(a*b|b);aaa*b|ab",
            "aa*;a+",
            "a&a+;a",
            "a^b;ab|ba",
            "a{2};aa",
            "a{2,};aaa*",
            "a{,2};a?a?",
            "a{1,3};a|aa|aaa",
            "(ab){0,1};(ab)?",
            "[a-c]x;(a|b|c)x",
            "[-a];-|a",
            "a b;ab",
            "ab|c&ab;ab",
            "(a|b)*;(a*b*)*",
            "ab^c;abc|acb|cab"
    })
    @DisplayName("equivalent expressions denote the same language")
    void equal(String a, String b) {
      assertTrue(Regex.isEqual(a, b), a + " should equal " + b);
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "a*;a+",
            "ab;ba",
            "a{2,3};a{2,4}",
            "a|b;a&b"
    })
    void notEqual(String a, String b) {
      assertFalse(Regex.isEqual(a, b), a + " should not equal " + b);
    }

    @Test
    @DisplayName("wildcards and negated classes range over the given alphabet")
    void alphabet() {
      assertAll(
              () -> assertTrue(Regex.isEqual("a|b|c", ".", ABC)),
              () -> assertTrue(Regex.isEqual("[^a]", "b|c", ABC)),
              () -> assertFalse(Regex.isEqual("a|b", ".", ABC))
      );
    }

    @Test
    void subsets() {
      assertAll(
              () -> assertTrue(Regex.isSubset("ab", "a*b*")),
              () -> assertTrue(Regex.isSuperset("a*b*", "ab")),
              () -> assertFalse(Regex.isSubset("a*", "a")),
              () -> assertTrue(Regex.isSubset("a", ".", ABC)),
              () -> assertTrue(Regex.isSuperset(".*", "abc", ABC))
      );
    }
  }

  @Nested
  @DisplayName("compilation")
  class CompilationTests {

    @Test
    @DisplayName("the default alphabet is every symbol the expression names")
    void defaultAlphabet() {
      NFA<Integer> nfa = NFA.fromRegex("a[bc]");
      assertAll(
              () -> assertEquals(3, nfa.inputSymbols().size()),
              () -> assertTrue(nfa.inputSymbols().contains("a")),
              () -> assertTrue(nfa.inputSymbols().contains("c"))
      );
    }

    @Test
    void wildcard() {
      NFA<Integer> nfa = NFA.fromRegex("a.", Arrays.asList("a", "b"));
      assertAll(
              () -> assertTrue(nfa.acceptsInput("ab")),
              () -> assertTrue(nfa.acceptsInput("aa")),
              () -> assertFalse(nfa.acceptsInput("a")),
              () -> assertFalse(nfa.acceptsInput("ba"))
      );
    }

    @Test
    @DisplayName("an empty expression accepts only the empty word")
    void emptyExpression() {
      NFA<Integer> nfa = NFA.fromRegex("", ABC);
      assertAll(
              () -> assertTrue(nfa.acceptsInput("")),
              () -> assertFalse(nfa.acceptsInput("a")),
              () -> assertEquals(NFA.fromRegex("()", ABC), nfa)
      );
    }

    @Test
    @DisplayName("symbols are code points")
    void unicode() {
      NFA<Integer> nfa = NFA.fromRegex("é😀+");
      assertAll(
              () -> assertTrue(nfa.acceptsInput("é😀")),
              () -> assertTrue(nfa.acceptsInput("é😀😀")),
              () -> assertFalse(nfa.acceptsInput("é"))
      );
    }

    @Test
    @DisplayName("bounded repetition of a group")
    void repetition() {
      DFA<Integer> dfa = DFA.fromNFA(NFA.fromRegex("(ab){2,3}"));
      assertAll(
              () -> assertTrue(dfa.acceptsInput("abab")),
              () -> assertTrue(dfa.acceptsInput("ababab")),
              () -> assertFalse(dfa.acceptsInput("ab")),
              () -> assertFalse(dfa.acceptsInput("abababab")),
              () -> assertTrue(dfa.isFinite())
      );
    }

    @Test
    void alphabetErrors() {
      assertAll(
              () -> assertThrows(InvalidSymbolException.class, () -> NFA.fromRegex("a", Arrays.asList("a", "*"))),
              () -> assertThrows(InvalidSymbolException.class, () -> NFA.fromRegex("ab", Arrays.asList("a"))),
              () -> assertThrows(InvalidSymbolException.class, () -> NFA.fromRegex("[ab]", Arrays.asList("a"))),
              () -> assertDoesNotThrow(() -> NFA.fromRegex("[^b]", Arrays.asList("a")))
      );
    }

    @Test
    @DisplayName("a negated class matches nothing once the alphabet is exhausted")
    void exhaustedClass() {
      NFA<Integer> nfa = NFA.fromRegex("[^ab]", Arrays.asList("a", "b"));
      assertTrue(DFA.fromNFA(nfa).isEmpty());
    }
  }
}
