package io.lacuna.automata.regex;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A parsed regular expression.
 */
public abstract class RegexNode {

  private RegexNode() {
  }

  /**
   * Adds every symbol the expression names explicitly, as a literal or a class member, to {@code symbols}.
   */
  abstract void collectSymbols(LinearSet<String> symbols);

  /**
   * Adds every symbol which must belong to the input alphabet to {@code symbols}. Unlike
   * {@link #collectSymbols(LinearSet)}, this ignores the members of negated classes.
   */
  void collectLiterals(LinearSet<String> symbols) {
    collectSymbols(symbols);
  }

  abstract NFAFragment compile(AtomicInteger counter, ISet<String> alphabet);

  public ISet<String> symbols() {
    LinearSet<String> symbols = new LinearSet<>();
    collectSymbols(symbols);
    return symbols.forked();
  }

  /// nodes

  static final class Empty extends RegexNode {

    @Override
    void collectSymbols(LinearSet<String> symbols) {
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      return NFAFragment.empty(counter);
    }

    @Override
    public String toString() {
      return "()";
    }
  }

  static final class Literal extends RegexNode {
    final String symbol;

    Literal(String symbol) {
      this.symbol = symbol;
    }

    @Override
    void collectSymbols(LinearSet<String> symbols) {
      symbols.add(symbol);
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      return NFAFragment.match(counter, LinearSet.of(symbol));
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  static final class Wildcard extends RegexNode {

    @Override
    void collectSymbols(LinearSet<String> symbols) {
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      return NFAFragment.match(counter, alphabet);
    }

    @Override
    public String toString() {
      return ".";
    }
  }

  static final class CharacterClass extends RegexNode {
    final String text;
    final ISet<String> members;
    final boolean negated;

    CharacterClass(String text, ISet<String> members, boolean negated) {
      this.text = text;
      this.members = members;
      this.negated = negated;
    }

    @Override
    void collectSymbols(LinearSet<String> symbols) {
      members.forEach(symbols::add);
    }

    @Override
    void collectLiterals(LinearSet<String> symbols) {
      if (!negated) {
        collectSymbols(symbols);
      }
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      if (!negated) {
        return NFAFragment.match(counter, members);
      }
      LinearSet<String> rest = new LinearSet<>();
      for (String symbol : alphabet) {
        if (!members.contains(symbol)) {
          rest.add(symbol);
        }
      }
      return NFAFragment.match(counter, rest);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  static final class Concatenation extends RegexNode {
    final List<RegexNode> nodes;

    Concatenation(List<RegexNode> nodes) {
      this.nodes = nodes;
    }

    @Override
    void collectSymbols(LinearSet<String> symbols) {
      nodes.forEach(n -> n.collectSymbols(symbols));
    }

    @Override
    void collectLiterals(LinearSet<String> symbols) {
      nodes.forEach(n -> n.collectLiterals(symbols));
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      NFAFragment f = nodes.get(0).compile(counter, alphabet);
      for (int i = 1; i < nodes.size(); i++) {
        f.concat(nodes.get(i).compile(counter, alphabet));
      }
      return f;
    }

    @Override
    public String toString() {
      return nodes.stream().map(RegexNode::toString).collect(Collectors.joining());
    }
  }

  /**
   * One of the infix operators, which all bind equally loosely and associate to the left.
   */
  static final class Binary extends RegexNode {
    final Token.Type operator;
    final RegexNode left, right;

    Binary(Token.Type operator, RegexNode left, RegexNode right) {
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override
    void collectSymbols(LinearSet<String> symbols) {
      left.collectSymbols(symbols);
      right.collectSymbols(symbols);
    }

    @Override
    void collectLiterals(LinearSet<String> symbols) {
      left.collectLiterals(symbols);
      right.collectLiterals(symbols);
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      NFAFragment a = left.compile(counter, alphabet);
      NFAFragment b = right.compile(counter, alphabet);
      switch (operator) {
        case UNION:
          return a.union(b);
        case INTERSECTION:
          return a.intersection(b);
        case SHUFFLE:
          return a.shuffle(b);
        default:
          throw new IllegalStateException("not an infix operator: " + operator);
      }
    }

    @Override
    public String toString() {
      String op = operator == Token.Type.UNION ? "|" : operator == Token.Type.INTERSECTION ? "&" : "^";
      return "(" + left + op + right + ")";
    }
  }

  static final class Repetition extends RegexNode {
    final RegexNode node;
    final int lower;
    final Integer upper;

    Repetition(RegexNode node, int lower, Integer upper) {
      this.node = node;
      this.lower = lower;
      this.upper = upper;
    }

    @Override
    void collectSymbols(LinearSet<String> symbols) {
      node.collectSymbols(symbols);
    }

    @Override
    void collectLiterals(LinearSet<String> symbols) {
      node.collectLiterals(symbols);
    }

    @Override
    NFAFragment compile(AtomicInteger counter, ISet<String> alphabet) {
      NFAFragment f = node.compile(counter, alphabet);
      if (upper == null && lower == 0) {
        return f.kleene();
      } else if (upper == null && lower == 1) {
        return f.plus();
      } else if (upper != null && lower == 0 && upper == 1) {
        return f.maybe();
      }
      return f.repeat(lower, upper);
    }

    @Override
    public String toString() {
      String suffix = upper == null ? "{" + lower + ",}" : "{" + lower + "," + upper + "}";
      return "(" + node + ")" + suffix;
    }
  }
}
