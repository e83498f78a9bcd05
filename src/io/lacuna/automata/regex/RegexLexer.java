package io.lacuna.automata.regex;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a regular expression into {@link Token}s. Every code point outside of {@link #RESERVED} and whitespace is
 * a symbol.
 */
public final class RegexLexer {

  /**
   * Characters with a meaning of their own, which can never be input symbols.
   */
  public static final String RESERVED = "*|()?&+.^{}[]";

  private static final Pattern QUANTIFIER = Pattern.compile("\\{(-?\\d*)(?:,(-?\\d*))?\\}");

  private RegexLexer() {
  }

  public static boolean isReserved(String symbol) {
    return symbol.length() == 1 && RESERVED.contains(symbol);
  }

  public static IList<Token> tokenize(String regex) {
    LinearList<Token> tokens = new LinearList<>();

    int i = 0;
    while (i < regex.length()) {
      int codePoint = regex.codePointAt(i);
      String c = new String(Character.toChars(codePoint));
      int next = i + Character.charCount(codePoint);

      switch (c) {
        case " ":
        case "\t":
          break;
        case "*":
          tokens.addLast(Token.of(Token.Type.STAR, c, i));
          break;
        case "+":
          tokens.addLast(Token.of(Token.Type.PLUS, c, i));
          break;
        case "?":
          tokens.addLast(Token.of(Token.Type.OPTION, c, i));
          break;
        case "|":
          tokens.addLast(Token.of(Token.Type.UNION, c, i));
          break;
        case "&":
          tokens.addLast(Token.of(Token.Type.INTERSECTION, c, i));
          break;
        case "^":
          tokens.addLast(Token.of(Token.Type.SHUFFLE, c, i));
          break;
        case ".":
          tokens.addLast(Token.of(Token.Type.WILDCARD, c, i));
          break;
        case "(":
          tokens.addLast(Token.of(Token.Type.LEFT_PAREN, c, i));
          break;
        case ")":
          tokens.addLast(Token.of(Token.Type.RIGHT_PAREN, c, i));
          break;
        case "{": {
          int close = regex.indexOf('}', i);
          if (close < 0) {
            throw new LexerException("unmatched '{'", i);
          }
          tokens.addLast(quantifier(regex.substring(i, close + 1), i));
          next = close + 1;
          break;
        }
        case "[": {
          int close = regex.indexOf(']', i);
          if (close < 0) {
            throw new LexerException("unmatched '['", i);
          }
          tokens.addLast(characterClass(regex.substring(i, close + 1), i));
          next = close + 1;
          break;
        }
        case "}":
        case "]":
          throw new LexerException("unmatched '" + c + "'", i);
        default:
          tokens.addLast(Token.of(Token.Type.SYMBOL, c, i));
      }
      i = next;
    }

    return tokens;
  }

  /// quantifiers

  private static Token quantifier(String text, int position) {
    Matcher m = QUANTIFIER.matcher(text);
    if (!m.matches()) {
      throw new InvalidRegexException("invalid quantifier '" + text + "' at position " + position);
    }

    int lower;
    Integer upper;
    if (m.group(2) == null) {
      if (m.group(1).isEmpty()) {
        throw new InvalidRegexException("empty quantifier at position " + position);
      }
      lower = bound(m.group(1), text);
      upper = lower;
    } else {
      lower = m.group(1).isEmpty() ? 0 : bound(m.group(1), text);
      upper = m.group(2).isEmpty() ? null : bound(m.group(2), text);
    }

    if (lower < 0 || (upper != null && upper < 0)) {
      throw new InvalidRegexException("quantifier '" + text + "' has a negative bound");
    } else if (upper != null && lower > upper) {
      throw new InvalidRegexException("quantifier '" + text + "' has a lower bound greater than its upper bound");
    }

    return Token.quantifier(text, position, lower, upper);
  }

  private static int bound(String s, String text) {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw new InvalidRegexException("invalid bound in quantifier '" + text + "'", e);
    }
  }

  /// character classes

  private static Token characterClass(String text, int position) {
    String body = text.substring(1, text.length() - 1);
    boolean negated = body.startsWith("^");
    if (negated) {
      body = body.substring(1);
    }
    if (body.isEmpty()) {
      throw new InvalidRegexException("empty character class at position " + position);
    }

    int[] codePoints = body.codePoints().toArray();
    LinearSet<String> members = new LinearSet<>();
    int j = 0;
    while (j < codePoints.length) {
      if (j + 2 < codePoints.length && codePoints[j + 1] == '-') {
        int start = codePoints[j];
        int end = codePoints[j + 2];
        if (start > end) {
          throw new InvalidRegexException("invalid range in character class '" + text + "'");
        }
        for (int cp = start; cp <= end; cp++) {
          members.add(new String(Character.toChars(cp)));
        }
        j += 3;
      } else {
        members.add(new String(Character.toChars(codePoints[j])));
        j++;
      }
    }

    for (String member : members) {
      if (isReserved(member)) {
        throw new InvalidRegexException("character class '" + text + "' contains the reserved symbol '" + member + "'");
      }
    }

    return Token.characterClass(text, position, members.forked(), negated);
  }
}
