package com.squareup.tspan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A half-open span of token indices, {@code [beginInclusive, endExclusive)}.
 * The match engine uses these both for whole matches and for the spans of
 * individual positions of a pattern.
 */
public final class TokenSpan implements Comparable<TokenSpan> {

  /** The begin index of the span, inclusive. */
  private final int beginInclusive;
  /** The end index of the span, exclusive. */
  private final int endExclusive;

  /**
   * Create a span.
   *
   * @param beginInclusive See {@link #getBeginInclusive()}.
   * @param endExclusive See {@link #getEndExclusive()}.
   */
  public TokenSpan(int beginInclusive, int endExclusive) {
    if (beginInclusive < 0 || endExclusive < beginInclusive) {
      throw new IndexOutOfBoundsException("Invalid span [" + beginInclusive + "," + endExclusive + ")");
    }
    this.beginInclusive = beginInclusive;
    this.endExclusive = endExclusive;
  }

  /**
   * @return The begin index of the span, inclusive.
   */
  public int getBeginInclusive() {
    return beginInclusive;
  }

  /**
   * @return The end index of the span, exclusive.
   */
  public int getEndExclusive() {
    return endExclusive;
  }

  /** @return The number of tokens in the span. */
  public int length() {
    return endExclusive - beginInclusive;
  }

  /** @return True if the span covers no token. */
  public boolean isEmpty() {
    return endExclusive == beginInclusive;
  }

  /**
   * @param tokens The tokens this span indexes into.
   *
   * @return The tokens in this span. This is an immutable list.
   */
  public <T> List<T> of(List<T> tokens) {
    return Collections.unmodifiableList(tokens.subList(beginInclusive, endExclusive));
  }

  /** Spans are ordered by begin index, then by end index. */
  @Override public int compareTo(TokenSpan o) {
    int cmp = Integer.compare(beginInclusive, o.beginInclusive);
    return cmp != 0 ? cmp : Integer.compare(endExclusive, o.endExclusive);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TokenSpan that = (TokenSpan) o;
    return beginInclusive == that.beginInclusive &&
        endExclusive == that.endExclusive;
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(beginInclusive, endExclusive);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "[" + beginInclusive + "," + endExclusive + ")";
  }
}
