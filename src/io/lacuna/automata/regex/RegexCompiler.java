package io.lacuna.automata.regex;

import io.lacuna.automata.InvalidSymbolException;
import io.lacuna.automata.fa.NFA;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles regular expressions into NFAs.
 *
 * @author ztellman
 */
public final class RegexCompiler {

  private static final Logger logger = LoggerFactory.getLogger(RegexCompiler.class);

  private RegexCompiler() {
  }

  /**
   * @param inputSymbols the alphabet of the result, or null to use the symbols named in {@code regex}
   * @throws InvalidRegexException if {@code regex} is not well-formed
   * @throws InvalidSymbolException if {@code inputSymbols} includes a reserved character, or lacks a symbol which
   * {@code regex} uses
   */
  public static NFA<Integer> compile(String regex, Iterable<String> inputSymbols) {
    RegexNode node = RegexParser.parse(regex);

    ISet<String> alphabet;
    if (inputSymbols == null) {
      alphabet = node.symbols();
    } else {
      LinearSet<String> symbols = new LinearSet<>();
      for (String symbol : inputSymbols) {
        if (RegexLexer.isReserved(symbol)) {
          throw new InvalidSymbolException("'" + symbol + "' is reserved, and cannot be an input symbol");
        }
        symbols.add(symbol);
      }

      LinearSet<String> literals = new LinearSet<>();
      node.collectLiterals(literals);
      for (String literal : literals) {
        if (!symbols.contains(literal)) {
          throw new InvalidSymbolException("'" + literal + "' in '" + regex + "' is not an input symbol");
        }
      }
      alphabet = symbols.forked();
    }

    NFA<Integer> nfa = node.compile(new AtomicInteger(), alphabet).toNFA(alphabet);
    logger.debug("compiled '{}' into {} states", regex, nfa.states().size());
    return nfa;
  }
}
