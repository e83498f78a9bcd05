package io.lacuna.automata.fa;

import io.lacuna.automata.InvalidStateException;
import io.lacuna.automata.InvalidSymbolException;
import io.lacuna.automata.StatePair;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static io.lacuna.automata.fa.NFA.EPSILON;
import static org.junit.jupiter.api.Assertions.*;

class NFATest {

  private static final List<String> AB = Arrays.asList("a", "b");

  /**
   * Accepts words over {a, b} ending in "ab".
   */
  private static NFA<Integer> endsWithAb() {
    return NFA.<Integer>builder()
            .inputSymbols("a", "b")
            .states(0, 1, 2)
            .transition(0, "a", 0).transition(0, "a", 1).transition(0, "b", 0)
            .transition(1, "b", 2)
            .initialState(0)
            .finalState(2)
            .build();
  }

  /**
   * 0 reaches 2 without reading anything, and 2 reads "a" into 3.
   */
  private static NFA<Integer> epsilonChain() {
    return NFA.<Integer>builder()
            .inputSymbols("a")
            .states(0, 1, 2, 3)
            .transition(0, EPSILON, 1)
            .transition(1, EPSILON, 2)
            .transition(2, "a", 3)
            .initialState(0)
            .finalState(3)
            .build();
  }

  private static void assertAccepts(NFA<?> nfa, String... words) {
    for (String w : words) {
      assertTrue(nfa.acceptsInput(w), "should accept '" + w + "'");
    }
  }

  private static void assertRejects(NFA<?> nfa, String... words) {
    for (String w : words) {
      assertFalse(nfa.acceptsInput(w), "should reject '" + w + "'");
    }
  }

  @Nested
  @DisplayName("reading input")
  class ReadingTests {

    @Test
    void accepts() {
      assertAccepts(endsWithAb(), "ab", "aab", "bab", "abab");
      assertRejects(endsWithAb(), "", "a", "ba", "abb", "c");
    }

    @Test
    @DisplayName("the final configuration holds every current state")
    void configuration() {
      NFAConfiguration<Integer> c = endsWithAb().readInput("aab");
      assertEquals(LinearSet.of(0, 2).forked(), c.states());
    }

    @Test
    void epsilonClosure() {
      NFA<Integer> nfa = epsilonChain();
      assertAll(
              () -> assertEquals(LinearSet.of(0, 1, 2).forked(), nfa.epsilonClosure(0)),
              () -> assertEquals(LinearSet.of(1, 2).forked(), nfa.epsilonClosure(1)),
              () -> assertEquals(LinearSet.of(3).forked(), nfa.epsilonClosure(3)),
              () -> assertEquals(LinearSet.of(3).forked(), nfa.next(nfa.epsilonClosure(0), "a")),
              () -> assertAccepts(nfa, "a"),
              () -> assertRejects(nfa, "", "aa")
      );
    }

    @Test
    void validation() {
      assertAll(
              () -> assertThrows(InvalidStateException.class, () -> NFA.<Integer>builder()
                      .inputSymbols("a")
                      .state(0)
                      .transition(0, "a", 1)
                      .initialState(0)
                      .build()),
              () -> assertThrows(InvalidSymbolException.class, () -> NFA.<Integer>builder()
                      .inputSymbols("a")
                      .state(0)
                      .transition(0, "b", 0)
                      .initialState(0)
                      .build()),
              () -> assertThrows(InvalidStateException.class, () -> NFA.<Integer>builder()
                      .inputSymbols("a")
                      .state(0)
                      .initialState(0)
                      .finalState(1)
                      .build())
      );
    }
  }

  @Nested
  @DisplayName("combinators")
  class CombinatorTests {

    @Test
    void union() {
      NFA<Integer> nfa = endsWithAb().union(NFA.fromRegex("b*", AB));
      assertAccepts(nfa, "", "bb", "ab", "bab");
      assertRejects(nfa, "a", "ba");
    }

    @Test
    void concatenate() {
      NFA<Integer> nfa = NFA.fromRegex("a").concatenate(NFA.fromRegex("b"));
      assertAccepts(nfa, "ab");
      assertRejects(nfa, "", "a", "b", "abab");
      assertEquals(LinearSet.of("a", "b").forked(), nfa.inputSymbols());
    }

    @Test
    void kleeneStar() {
      NFA<Integer> nfa = NFA.fromRegex("ab").kleeneStar();
      assertAccepts(nfa, "", "ab", "abab");
      assertRejects(nfa, "a", "aba", "ba");
    }

    @Test
    void option() {
      NFA<Integer> nfa = NFA.fromRegex("ab").option();
      assertAccepts(nfa, "", "ab");
      assertRejects(nfa, "a", "abab");
    }

    @Test
    void reverse() {
      NFA<Integer> nfa = endsWithAb().reverse();
      assertAccepts(nfa, "ba", "baa", "bab");
      assertRejects(nfa, "", "ab", "aab");
    }

    @Test
    void intersection() {
      NFA<StatePair<Integer, Integer>> nfa = NFA.fromRegex("a*b*", AB).intersection(NFA.fromRegex("(ab)*", AB));
      assertAccepts(nfa, "", "ab");
      assertRejects(nfa, "a", "abab", "aabb");
    }

    @Test
    void shuffleProduct() {
      NFA<StatePair<Integer, Integer>> nfa = NFA.fromRegex("ab").shuffleProduct(NFA.fromRegex("c"));
      assertAccepts(nfa, "abc", "acb", "cab");
      assertRejects(nfa, "ab", "bac", "abcc");
    }

    @Test
    void rightQuotient() {
      List<String> abcd = Arrays.asList("a", "b", "c", "d");
      NFA<Integer> nfa = NFA.fromRegex("abc|abd", abcd).rightQuotient(NFA.fromRegex("c|d", abcd));
      assertAccepts(nfa, "ab");
      assertRejects(nfa, "", "a", "abc");
    }

    @Test
    void leftQuotient() {
      List<String> abcd = Arrays.asList("a", "b", "c", "d");
      NFA<Integer> nfa = NFA.fromRegex("abc|abd", abcd).leftQuotient(NFA.fromRegex("ab", abcd));
      assertAccepts(nfa, "c", "d");
      assertRejects(nfa, "", "abc", "cd");
    }

    @Test
    @DisplayName("removing epsilon transitions preserves the language")
    void eliminateLambda() {
      NFA<Integer> nfa = NFA.fromRegex("a*b|c");
      NFA<Integer> lambdaFree = nfa.eliminateLambda();

      boolean hasEpsilon = false;
      for (Transition<Integer> t : lambdaFree.iterTransitions()) {
        hasEpsilon |= t.label().equals(EPSILON);
      }
      assertFalse(hasEpsilon);
      assertEquals(nfa, lambdaFree);
      assertAccepts(lambdaFree, "b", "aab", "c");
    }
  }

  @Nested
  @DisplayName("large automata")
  class ScaleTests {

    @Test
    @DisplayName("a long chain of epsilon moves is closed without deep recursion")
    void longEpsilonChain() {
      NFA<Integer> nfa = NFA.fromRegex("a?".repeat(20000));
      assertAll(
              () -> assertTrue(nfa.acceptsInput("")),
              () -> assertTrue(nfa.acceptsInput("aaaaa")),
              () -> assertFalse(nfa.acceptsInput("b")),
              () -> assertTrue(nfa.epsilonClosure(nfa.initialState()).size() > 20000)
      );
    }

    @Test
    @DisplayName("long inputs are read in linear time")
    void longInput() {
      NFA<Integer> nfa = NFA.fromRegex("(0|1)*1");
      String word = "0".repeat(200000) + "1";
      assertTimeoutPreemptively(Duration.ofSeconds(20), () -> {
        assertTrue(nfa.acceptsInput(word));
        assertEquals("", nfa.readInput(word).remainingInput());
        assertFalse(nfa.acceptsInput(word + "0"));
      });
    }
  }

  @Nested
  @DisplayName("determinization")
  class DeterminizationTests {

    @Test
    @DisplayName("the subset construction accepts the same language")
    void fromNFA() {
      DFA<Integer> dfa = DFA.fromNFA(endsWithAb());
      assertAll(
              () -> assertEquals(DFA.fromSuffix(AB, "ab"), dfa),
              () -> assertEquals(3, dfa.states().size()),
              () -> assertEquals(dfa, DFA.fromNFA(endsWithAb(), false))
      );
    }

    @Test
    @DisplayName("subsets are epsilon-closed")
    void retainingNames() {
      DFA<ISet<Integer>> dfa = DFA.fromNFARetainingNames(epsilonChain());
      assertAll(
              () -> assertEquals(LinearSet.of(0, 1, 2).forked(), dfa.initialState()),
              () -> assertTrue(dfa.acceptsInput("a")),
              () -> assertEquals(2, dfa.states().size())
      );
    }

    @Test
    void roundTrip() {
      DFA<String> dfa = DFATest.oddOnes();
      NFA<String> nfa = NFA.fromDFA(dfa);
      assertAll(
              () -> assertEquals(dfa.states(), nfa.states()),
              () -> assertAccepts(nfa, "1", "01", "111"),
              () -> assertEquals(dfa, DFA.fromNFA(nfa)),
              () -> assertEquals(2, nfa.toDFA().states().size())
      );
    }

    @Test
    @DisplayName("determinizing keeps the verdict on every word up to length six")
    void preservesLanguage() {
      List<String> words = Languages.allWords(AB, 6);
      List<NFA<?>> nfas = Arrays.asList(
              endsWithAb(),
              NFA.fromRegex("(a|b)*a(a|b)(a|b)", AB),
              NFA.fromRegex("(ab)*&(a|b)*b|a^b", AB),
              NFA.editDistance(AB, "ab", 1));
      for (NFA<?> nfa : nfas) {
        Languages.assertSameLanguage(nfa, DFA.fromNFA(nfa), words);
        Languages.assertSameLanguage(nfa, DFA.fromNFA(nfa, false), words);
        Languages.assertSameLanguage(nfa, DFA.fromNFARetainingNames(nfa), words);
      }
      Languages.assertSameLanguage(epsilonChain(), DFA.fromNFA(epsilonChain()), Languages.allWords(Arrays.asList("a"), 4));
    }

    @Test
    @DisplayName("determinizing random automata with epsilon moves keeps their languages")
    void preservesRandomLanguages() {
      Random random = new Random(29);
      List<String> words = Languages.allWords(AB, 6);
      for (int i = 0; i < 40; i++) {
        NFA<Integer> nfa = Languages.randomNFA(random, AB, 4);
        Languages.assertSameLanguage(nfa, DFA.fromNFA(nfa), words);
      }
    }

    @Test
    @DisplayName("NFAs are equal when their languages are")
    void equality() {
      assertAll(
              () -> assertEquals(NFA.fromRegex("a|b", AB), NFA.fromRegex("b|a", AB)),
              () -> assertNotEquals(NFA.fromRegex("a", AB), NFA.fromRegex("b", AB)),
              () -> assertNotEquals(NFA.fromRegex("a"), NFA.fromRegex("a", AB))
      );
    }
  }

  @Nested
  @DisplayName("edit distance")
  class EditDistanceTests {

    @Test
    @DisplayName("words within one edit of 'ab'")
    void oneEdit() {
      NFA<StatePair<Integer, Integer>> nfa = NFA.editDistance(AB, "ab", 1);
      assertAccepts(nfa, "ab", "a", "b", "aab", "abb", "aa", "bb", "bab");
      assertRejects(nfa, "", "ba", "bba", "aaaa");
    }

    @Test
    @DisplayName("only deletions")
    void deletionsOnly() {
      NFA<StatePair<Integer, Integer>> nfa = NFA.editDistance(AB, "ab", 1, false, true, false);
      assertAccepts(nfa, "ab", "a", "b");
      assertRejects(nfa, "aab", "aa", "bb", "");
    }

    @Test
    @DisplayName("only substitutions")
    void substitutionsOnly() {
      NFA<StatePair<Integer, Integer>> nfa = NFA.editDistance(AB, "ab", 1, false, false, true);
      assertAccepts(nfa, "ab", "aa", "bb");
      assertRejects(nfa, "a", "aab", "ba");
    }

    @Test
    @DisplayName("zero edits accepts only the reference")
    void zeroEdits() {
      NFA<StatePair<Integer, Integer>> nfa = NFA.editDistance(AB, "ab", 0);
      assertAccepts(nfa, "ab");
      assertRejects(nfa, "a", "abb", "");
    }

    @Test
    void invalidArguments() {
      assertAll(
              () -> assertThrows(IllegalArgumentException.class,
                      () -> NFA.editDistance(AB, "ab", 1, false, false, false)),
              () -> assertThrows(IllegalArgumentException.class, () -> NFA.editDistance(AB, "ab", -1)),
              () -> assertThrows(InvalidSymbolException.class, () -> NFA.editDistance(AB, "abc", 1))
      );
    }
  }
}
