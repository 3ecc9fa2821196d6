package com.squareup.tspan;

import java.util.regex.PatternSyntaxException;

/**
 * <p>
 *   A predicate matching if a regular expression is found in the value of a token.
 *   This is for token specs like <pre>{"TEXT": {"REGEX": "^[Uu]\\.?[Ss]\\.?$"}}</pre>,
 *   and for the free-text pseudo-attribute <pre>{"REGEX": "New\\s+York"}</pre>.
 * </p>
 *
 * <p>
 *   As with {@link java.util.regex.Matcher#find()}, the expression may match anywhere
 *   inside the value, unless it is anchored with a leading {@code ^} and/or a trailing
 *   {@code $}. The anchors are stripped from the expression, and the unanchored sides
 *   are padded instead.
 * </p>
 *
 * <p>
 *   When matched against a single value, the expression is confined so that it can
 *   never reach past the value: the wildcard, negated character classes and the
 *   negated shorthand classes that would match a
 *   {@linkplain AttributeProjection#SEPARATOR separator} are rewritten to exclude it,
 *   and a literal space is read as the {@linkplain AttributeProjection#SEPARATOR_SUBSTITUTE
 *   substitute} it was replaced with when the value was projected.
 * </p>
 */
public class RegexPredicate extends Predicate {

  /** Any character of a value. */
  private static final String CHAR = "[^ ]";

  /** The expression, exactly as it was written in the pattern. */
  public final String source;

  /** The expression without its anchors. */
  private final String body;

  /** The compiled {@link #body}, for matching over the natural text. */
  private final java.util.regex.Pattern compiledBody;

  /** If true, the expression must match at the start of the value. */
  private final boolean anchoredStart;

  /** If true, the expression must match at the end of the value. */
  private final boolean anchoredEnd;

  /**
   * Create a new regular expression predicate.
   *
   * @param source See {@link #source}.
   *
   * @throws PatternSyntaxException If the expression is not a valid regular expression.
   */
  public RegexPredicate(String source) throws PatternSyntaxException {
    this.source = source;
    String body = source;
    this.anchoredStart = body.startsWith("^");
    if (anchoredStart) {
      body = body.substring(1);
    }
    this.anchoredEnd = endsWithUnescapedDollar(body);
    if (anchoredEnd) {
      body = body.substring(0, body.length() - 1);
    }
    this.body = body;
    this.compiledBody = java.util.regex.Pattern.compile(body);
    // Validate eagerly, so that bad expressions fail when the pattern is added
    java.util.regex.Pattern.compile(fragment());
  }

  /** @return The expression without its leading {@code ^} and trailing {@code $}. */
  String body() {
    return body;
  }

  /** @return The compiled {@link #body()}. */
  java.util.regex.Pattern bodyPattern() {
    return compiledBody;
  }

  /** @return True if the expression was anchored with a leading {@code ^}. */
  boolean isAnchoredStart() {
    return anchoredStart;
  }

  /** @return True if the expression was anchored with a trailing {@code $}. */
  boolean isAnchoredEnd() {
    return anchoredEnd;
  }

  /** {@inheritDoc} */
  @Override public String fragment() {
    StringBuilder b = new StringBuilder();
    if (!anchoredStart) {
      b.append(CHAR).append("*?");
    }
    b.append("(?:").append(confine(body)).append(')');
    if (!anchoredEnd) {
      b.append(CHAR).append("*?");
    }
    return b.toString();
  }

  /**
   * Check if an expression ends with a {@code $} that is not escaped.
   */
  private static boolean endsWithUnescapedDollar(String regex) {
    if (!regex.endsWith("$")) {
      return false;
    }
    int backslashes = 0;
    for (int i = regex.length() - 2; i >= 0 && regex.charAt(i) == '\\'; --i) {
      backslashes += 1;
    }
    return backslashes % 2 == 0;
  }

  /**
   * Rewrite an expression so that it never matches a separator.
   *
   * @param regex The expression to rewrite.
   *
   * @return An equivalent expression over a single value.
   */
  static String confine(String regex) {
    StringBuilder b = new StringBuilder(regex.length() + 16);
    int length = regex.length();
    int i = 0;
    while (i < length) {
      char c = regex.charAt(i);
      if (c == '\\' && i + 1 < length) {
        char escaped = regex.charAt(i + 1);
        if (escaped == 'Q') {
          int stop = quoteEnd(regex, i);
          b.append(regex.substring(i, stop).replace(AttributeProjection.SEPARATOR,
              AttributeProjection.SEPARATOR_SUBSTITUTE));
          i = stop;
          continue;
        }
        switch (escaped) {
          case 's':
            b.append("[^\\S ]");
            break;
          case 'W':
            b.append("[^\\w ]");
            break;
          case 'D':
            b.append("[^\\d ]");
            break;
          case 'h':
            b.append("[^\\H ]");
            break;
          case 'V':
            b.append("[^\\v ]");
            break;
          default:
            b.append(c).append(escaped);
            break;
        }
        i += 2;
      } else if (c == '[') {
        int stop = classEnd(regex, i);
        String characterClass = regex.substring(i, stop);
        if (characterClass.startsWith("[^")) {
          b.append("[^ ").append(characterClass, 2, characterClass.length());
        } else {
          b.append("(?:(?! )").append(characterClass).append(')');
        }
        i = stop;
      } else if (c == '.') {
        b.append(CHAR);
        i += 1;
      } else if (c == AttributeProjection.SEPARATOR) {
        b.append(AttributeProjection.SEPARATOR_SUBSTITUTE);
        i += 1;
      } else {
        b.append(c);
        i += 1;
      }
    }
    return b.toString();
  }

  /**
   * Find the end of a {@code \Q...\E} quotation.
   *
   * @param regex The expression.
   * @param start The index of the backslash of the {@code \Q}.
   *
   * @return The index just past the closing {@code \E}, or the end of the expression.
   */
  private static int quoteEnd(String regex, int start) {
    int close = regex.indexOf("\\E", start + 2);
    return close < 0 ? regex.length() : close + 2;
  }

  /**
   * Find the end of a (possibly nested) character class.
   *
   * @param regex The expression.
   * @param start The index of the opening bracket.
   *
   * @return The index just past the closing bracket, or the end of the expression if
   *         the class is never closed.
   */
  private static int classEnd(String regex, int start) {
    int length = regex.length();
    int i = start + 1;
    if (i < length && regex.charAt(i) == '^') {
      i += 1;
    }
    if (i < length && regex.charAt(i) == ']') {
      i += 1;  // a leading ']' is a literal
    }
    int depth = 1;
    while (i < length) {
      char c = regex.charAt(i);
      if (c == '\\' && i + 1 < length) {
        i = regex.charAt(i + 1) == 'Q' ? quoteEnd(regex, i) : i + 2;
        continue;
      }
      if (c == '[') {
        depth += 1;
      } else if (c == ']') {
        depth -= 1;
        if (depth == 0) {
          return i + 1;
        }
      }
      i += 1;
    }
    return length;
  }

  /** {@inheritDoc} */
  @Override protected void populateToString(StringBuilder b) {
    b.append("{REGEX: /").append(source).append("/}");
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return source.equals(((RegexPredicate) o).source);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return source.hashCode();
  }
}
