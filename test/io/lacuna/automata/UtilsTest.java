package io.lacuna.automata;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearSet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

  @Test
  void symbolsSplitOnCodePoints() {
    IList<String> symbols = Utils.symbols("aé😀");
    assertAll(
            () -> assertEquals(3, symbols.size()),
            () -> assertEquals("é", symbols.nth(1)),
            () -> assertEquals("😀", symbols.nth(2)),
            () -> assertEquals(0, Utils.symbols("").size())
    );
  }

  @Test
  void symbolAtCharOffset() {
    String word = "a😀b";
    assertAll(
            () -> assertEquals("a", Utils.symbolAt(word, 0)),
            () -> assertEquals("😀", Utils.symbolAt(word, 1)),
            () -> assertEquals("b", Utils.symbolAt(word, 3))
    );
  }

  @Test
  void renamerIsStable() {
    Function<String, Integer> name = Utils.renamer(new AtomicInteger(5));
    assertAll(
            () -> assertEquals(Integer.valueOf(5), name.apply("x")),
            () -> assertEquals(Integer.valueOf(6), name.apply("y")),
            () -> assertEquals(Integer.valueOf(5), name.apply("x"))
    );
  }

  @Test
  void sortedUsesComparator() {
    List<String> symbols = Arrays.asList("b", "c", "a");
    assertAll(
            () -> assertEquals(Arrays.asList("a", "b", "c"), Utils.sorted(symbols)),
            () -> assertEquals(Arrays.asList("c", "b", "a"), Utils.sorted(symbols, (x, y) -> y.compareTo(x)))
    );
  }

  @Test
  void sameElementsIgnoresOrder() {
    assertAll(
            () -> assertTrue(Utils.sameElements(LinearSet.of("a", "b"), LinearSet.of("b", "a"))),
            () -> assertFalse(Utils.sameElements(LinearSet.of("a", "b"), LinearSet.of("a"))),
            () -> assertFalse(Utils.sameElements(LinearSet.of("a", "b"), LinearSet.of("a", "c")))
    );
  }

  @Test
  void checkSymbols() {
    LinearSet<String> alphabet = LinearSet.of("a", "b");
    assertDoesNotThrow(() -> Utils.checkSymbols(alphabet, Utils.symbols("abba")));
    assertThrows(InvalidSymbolException.class, () -> Utils.checkSymbols(alphabet, Utils.symbols("abc")));
  }

  @Test
  void steps() {
    Step<String> reading = Step.reading("x");
    Step<String> accepted = Step.accepted("y");
    Step<String> rejected = Step.rejected("z");
    assertAll(
            () -> assertFalse(reading.isTerminal()),
            () -> assertEquals(Step.Status.READING, reading.status()),
            () -> assertTrue(accepted.isTerminal()),
            () -> assertTrue(accepted.isAccepted()),
            () -> assertTrue(rejected.isTerminal()),
            () -> assertFalse(rejected.isAccepted()),
            () -> assertEquals("z", rejected.configuration()),
            () -> assertEquals(Step.accepted("y"), accepted)
    );
  }

  @Test
  void statePairs() {
    StatePair<Integer, String> pair = StatePair.of(1, null);
    assertAll(
            () -> assertEquals(1, pair.first()),
            () -> assertNull(pair.second()),
            () -> assertEquals(StatePair.of(1, null), pair),
            () -> assertNotEquals(StatePair.of(1, "a"), pair)
    );
  }
}
