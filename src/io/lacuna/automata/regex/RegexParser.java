package io.lacuna.automata.regex;

import io.lacuna.bifurcan.IList;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive descent parser over the output of {@link RegexLexer}. Postfix operators bind tightest, then
 * concatenation, then the infix operators {@code |}, {@code &} and {@code ^} which share the loosest level.
 */
public final class RegexParser {

  private final IList<Token> tokens;
  private long position = 0;

  private RegexParser(IList<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * @throws InvalidRegexException if {@code regex} is not well-formed
   */
  public static RegexNode parse(String regex) {
    IList<Token> tokens = RegexLexer.tokenize(regex);
    if (tokens.size() == 0) {
      return new RegexNode.Empty();
    }

    RegexParser parser = new RegexParser(tokens);
    RegexNode node = parser.expression();
    Token t = parser.peek();
    if (t != null) {
      if (t.type() == Token.Type.RIGHT_PAREN) {
        throw new InvalidRegexException("unbalanced parentheses in '" + regex + "' at position " + t.position());
      }
      throw unexpected(t);
    }
    return node;
  }

  private Token peek() {
    return position < tokens.size() ? tokens.nth(position) : null;
  }

  private Token next() {
    Token t = peek();
    if (t == null) {
      throw unexpected(null);
    }
    position++;
    return t;
  }

  private static InvalidRegexException unexpected(Token t) {
    if (t == null) {
      return new InvalidRegexException("the regex ends unexpectedly");
    }
    return new InvalidRegexException("unexpected '" + t.text() + "' at position " + t.position());
  }

  ///

  private RegexNode expression() {
    RegexNode left = term();
    while (peek() != null && peek().isInfix()) {
      Token operator = next();
      left = new RegexNode.Binary(operator.type(), left, term());
    }
    return left;
  }

  private RegexNode term() {
    List<RegexNode> factors = new ArrayList<>();
    while (peek() != null && peek().startsAtom()) {
      factors.add(factor());
    }
    if (factors.isEmpty()) {
      throw unexpected(peek());
    }
    return factors.size() == 1 ? factors.get(0) : new RegexNode.Concatenation(factors);
  }

  private RegexNode factor() {
    RegexNode node = atom();
    while (peek() != null && peek().isPostfix()) {
      Token t = next();
      switch (t.type()) {
        case STAR:
          node = new RegexNode.Repetition(node, 0, null);
          break;
        case PLUS:
          node = new RegexNode.Repetition(node, 1, null);
          break;
        case OPTION:
          node = new RegexNode.Repetition(node, 0, 1);
          break;
        default:
          node = new RegexNode.Repetition(node, t.lower(), t.upper());
      }
    }
    return node;
  }

  private RegexNode atom() {
    Token t = next();
    switch (t.type()) {
      case SYMBOL:
        return new RegexNode.Literal(t.text());
      case WILDCARD:
        return new RegexNode.Wildcard();
      case CLASS:
        return new RegexNode.CharacterClass(t.text(), t.members(), t.negated());
      case LEFT_PAREN: {
        Token n = peek();
        if (n != null && n.type() == Token.Type.RIGHT_PAREN) {
          next();
          return new RegexNode.Empty();
        }
        RegexNode inner = expression();
        n = peek();
        if (n == null || n.type() != Token.Type.RIGHT_PAREN) {
          throw new InvalidRegexException("unbalanced parentheses at position " + t.position());
        }
        next();
        return inner;
      }
      default:
        throw unexpected(t);
    }
  }
}
