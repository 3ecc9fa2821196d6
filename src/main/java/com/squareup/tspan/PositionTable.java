package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * <p>
 *   The quantifier alignment of a pattern across its attributes. Every attribute of a
 *   pattern is matched by its own regular expression, with one group per position of
 *   the pattern; this table decides, for each (position, attribute) pair, which unit of
 *   text that group matches and with which quantifier, so that all of the expressions
 *   stay in lock-step.
 * </p>
 *
 * <ul>
 *   <li>A position constraining the attribute uses its own predicates and its declared
 *       quantifier.</li>
 *   <li>A position not constraining the attribute matches any token, with the declared
 *       quantifier; a negated position matches exactly one token.</li>
 *   <li>A negated position constraining several attributes matches any one token in
 *       every expression: only the conjunction of its constraints is negated, which no
 *       single attribute can decide.</li>
 *   <li>A free-text position may span several tokens in every other expression: one or
 *       more for {@code 1} and {@code +}, zero or more for {@code ?} and {@code *}.</li>
 * </ul>
 */
final class PositionTable {

  /** The positions of the pattern. */
  private final List<TokenSpec> specs;

  /** Every attribute constrained somewhere in the pattern, in order of appearance. */
  private final Set<AttributeKey> attributes;

  /**
   * Build the table for a pattern.
   *
   * @param specs The positions of the pattern.
   */
  PositionTable(List<TokenSpec> specs) {
    this.specs = Collections.unmodifiableList(new ArrayList<>(specs));
    Set<AttributeKey> attributes = new LinkedHashSet<>();
    for (TokenSpec spec : specs) {
      attributes.addAll(spec.attributes());
    }
    if (attributes.isEmpty()) {
      // Nothing is constrained; we still need one expression to find the spans
      attributes.add(AttributeKey.of(Attribute.TEXT));
    }
    this.attributes = Collections.unmodifiableSet(attributes);
  }

  /** @return The number of positions in the pattern. */
  int size() {
    return specs.size();
  }

  /** @return The spec at a position. */
  TokenSpec spec(int position) {
    return specs.get(position);
  }

  /** @return Every attribute we need an expression for. */
  Set<AttributeKey> attributes() {
    return attributes;
  }

  /**
   * @return True if the expression for the given attribute matches the constraints of
   *         this position, rather than any token.
   */
  boolean constrains(int position, AttributeKey key) {
    TokenSpec spec = specs.get(position);
    if (!spec.constrains(key)) {
      return false;
    }
    return spec.quantifier() != Quantifier.NEGATED || spec.attributes().size() == 1;
  }

  /**
   * @return The quantifier the expression for the given attribute uses at a position.
   */
  Quantifier aligned(int position, AttributeKey key) {
    TokenSpec spec = specs.get(position);
    Quantifier declared = spec.quantifier();
    if (spec.isFreeText() && !key.isFreeText()) {
      return declared == Quantifier.ZERO_OR_ONE || declared == Quantifier.ZERO_OR_MORE
          ? Quantifier.ZERO_OR_MORE : Quantifier.ONE_OR_MORE;
    }
    if (declared == Quantifier.NEGATED && !constrains(position, key)) {
      return Quantifier.ONE;
    }
    return declared;
  }

  /**
   * A repeating position is matched reluctantly if the next position repeats too, and
   * is matched the same way by this attribute's expression. This keeps adjacent
   * repetitions from backtracking over every split between them; the later repetition
   * takes the longest run.
   */
  boolean isReluctant(int position, AttributeKey key) {
    if (position + 1 >= specs.size()) {
      return false;
    }
    return aligned(position, key).isRepeating()
        && aligned(position + 1, key).isRepeating()
        && constrains(position, key) == constrains(position + 1, key);
  }

  /**
   * Anchors are the positions that must consume at least one token, whether or not
   * this attribute constrains them. Their spans must agree across attributes.
   * Free-text positions span a variable number of tokens in the token expressions, so
   * they are never anchors.
   *
   * @return The anchor positions for the attribute, in increasing order.
   */
  int[] anchors(AttributeKey key) {
    if (key.isFreeText()) {
      return new int[0];
    }
    List<Integer> anchors = new ArrayList<>();
    for (int i = 0; i < specs.size(); ++i) {
      TokenSpec spec = specs.get(i);
      if (spec.quantifier().isAnchor() && !spec.isFreeText()) {
        anchors.add(i);
      }
    }
    return anchors.stream().mapToInt(Integer::intValue).toArray();
  }
}
