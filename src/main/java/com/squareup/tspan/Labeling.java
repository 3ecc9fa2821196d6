package com.squareup.tspan;

import java.util.Comparator;
import java.util.Objects;

/**
 * A span of tokens with a label, as produced by a {@link Labeler}.
 */
public final class Labeling {

  /**
   * Labelings in document order: by start, and the longest first among those sharing
   * a start.
   */
  public static final Comparator<Labeling> DOCUMENT_ORDER =
      Comparator.comparingInt((Labeling l) -> l.start).thenComparingInt(l -> -l.length());

  /** The label. */
  public final String label;

  /** The first labeled token. */
  public final int start;

  /** The end of the labeled span, exclusive. */
  public final int end;

  /**
   * Create a labeling.
   *
   * @param label See {@link #label}.
   * @param start See {@link #start}.
   * @param end See {@link #end}.
   */
  public Labeling(String label, int start, int end) {
    this.label = Objects.requireNonNull(label);
    this.start = start;
    this.end = end;
  }

  /** @return The number of labeled tokens. */
  public int length() {
    return end - start;
  }

  /** @return The labeled span. */
  public TokenSpan span() {
    return new TokenSpan(start, end);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Labeling that = (Labeling) o;
    return start == that.start && end == that.end && label.equals(that.label);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(label, start, end);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return label + "[" + start + "," + end + ")";
  }
}
