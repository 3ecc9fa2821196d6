package com.squareup.tspan;

import java.util.List;
import java.util.Objects;

/**
 * A single match of a rule: the key of the rule, and the half-open span of tokens
 * {@code [start, end)} one of its patterns matched.
 */
public final class Match {

  /** The key of the rule that matched. */
  public final String key;

  /** The first matched token. */
  public final int start;

  /** The end of the match, exclusive. */
  public final int end;

  /**
   * Create a match.
   *
   * @param key See {@link #key}.
   * @param start See {@link #start}.
   * @param end See {@link #end}.
   */
  public Match(String key, int start, int end) {
    if (start < 0 || end <= start) {
      throw new IndexOutOfBoundsException("Invalid match span [" + start + "," + end + ")");
    }
    this.key = Objects.requireNonNull(key);
    this.start = start;
    this.end = end;
  }

  /** @return The span of this match. */
  public TokenSpan span() {
    return new TokenSpan(start, end);
  }

  /** @return The number of matched tokens. */
  public int length() {
    return end - start;
  }

  /**
   * @param tokens The tokens that were matched.
   *
   * @return The matched tokens. This is an immutable list.
   */
  public <T> List<T> matchedTokens(List<T> tokens) {
    return span().of(tokens);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Match match = (Match) o;
    return start == match.start && end == match.end && key.equals(match.key);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(key, start, end);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "(" + key + ", " + start + ", " + end + ")";
  }
}
