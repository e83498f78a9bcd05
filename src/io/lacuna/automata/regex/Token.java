package io.lacuna.automata.regex;

import io.lacuna.bifurcan.ISet;

/**
 * A lexical unit of a regular expression.
 */
public final class Token {

  public enum Type {
    SYMBOL,
    WILDCARD,
    CLASS,
    UNION,
    INTERSECTION,
    SHUFFLE,
    STAR,
    PLUS,
    OPTION,
    QUANTIFIER,
    LEFT_PAREN,
    RIGHT_PAREN
  }

  private final Type type;
  private final String text;
  private final int position;

  // character classes
  private final ISet<String> members;
  private final boolean negated;

  // quantifiers
  private final int lower;
  private final Integer upper;

  private Token(Type type, String text, int position, ISet<String> members, boolean negated, int lower, Integer upper) {
    this.type = type;
    this.text = text;
    this.position = position;
    this.members = members;
    this.negated = negated;
    this.lower = lower;
    this.upper = upper;
  }

  static Token of(Type type, String text, int position) {
    return new Token(type, text, position, null, false, 0, null);
  }

  static Token characterClass(String text, int position, ISet<String> members, boolean negated) {
    return new Token(Type.CLASS, text, position, members, negated, 0, null);
  }

  static Token quantifier(String text, int position, int lower, Integer upper) {
    return new Token(Type.QUANTIFIER, text, position, null, false, lower, upper);
  }

  public Type type() {
    return type;
  }

  public String text() {
    return text;
  }

  public int position() {
    return position;
  }

  public ISet<String> members() {
    return members;
  }

  public boolean negated() {
    return negated;
  }

  public int lower() {
    return lower;
  }

  /**
   * @return the upper bound of a quantifier, or null if it is unbounded
   */
  public Integer upper() {
    return upper;
  }

  public boolean startsAtom() {
    return type == Type.SYMBOL || type == Type.WILDCARD || type == Type.CLASS || type == Type.LEFT_PAREN;
  }

  public boolean isInfix() {
    return type == Type.UNION || type == Type.INTERSECTION || type == Type.SHUFFLE;
  }

  public boolean isPostfix() {
    return type == Type.STAR || type == Type.PLUS || type == Type.OPTION || type == Type.QUANTIFIER;
  }

  @Override
  public String toString() {
    return type + "('" + text + "')@" + position;
  }
}
