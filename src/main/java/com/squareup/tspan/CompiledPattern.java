package com.squareup.tspan;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * <p>
 *   A pattern compiled for matching. This holds the positions of the pattern, and one
 *   {@linkplain Pass attribute pass} per attribute the pattern references: a regular
 *   expression over that attribute's {@link AttributeProjection}, with one named group
 *   per position.
 * </p>
 *
 * <p>
 *   Compiled patterns are immutable, and can be shared between threads.
 * </p>
 *
 * @see PatternCompiler
 * @see MatchEngine
 */
public final class CompiledPattern {

  /**
   * A single attribute pass over a projection.
   */
  static final class Pass {
    /** The attribute whose projection this pass runs over. */
    final AttributeKey key;
    /** The expression for the whole pattern, over this attribute. */
    final java.util.regex.Pattern regex;
    /**
     * The positions whose group spans must agree with the spans found by other
     * passes. See {@link PositionTable#anchors(AttributeKey)}.
     */
    final int[] anchors;

    Pass(AttributeKey key, java.util.regex.Pattern regex, int[] anchors) {
      this.key = key;
      this.regex = regex;
      this.anchors = anchors;
    }

    /** {@inheritDoc} */
    @Override public String toString() {
      return key + ": /" + regex.pattern() + "/";
    }
  }

  /** The positions of the pattern. */
  private final List<TokenSpec> specs;

  /** The attribute passes, in the order they are run. */
  private final List<Pass> passes;

  CompiledPattern(List<TokenSpec> specs, List<Pass> passes) {
    this.specs = Collections.unmodifiableList(specs);
    this.passes = Collections.unmodifiableList(passes);
  }

  /**
   * @param position A position of the pattern.
   *
   * @return The name of the group capturing that position in every pass.
   */
  static String groupName(int position) {
    return "tok" + position;
  }

  /** @return The positions of the pattern. */
  public List<TokenSpec> specs() {
    return specs;
  }

  /** @return The attribute passes, in the order they are run. */
  List<Pass> passes() {
    return passes;
  }

  /**
   * @return The built-in attributes this pattern reads. These are the attributes
   *         checked for annotation before matching.
   */
  public Set<Attribute> attributes() {
    Set<Attribute> attributes = EnumSet.noneOf(Attribute.class);
    for (TokenSpec spec : specs) {
      for (AttributeKey key : spec.attributes()) {
        if (key.attribute() != null) {
          attributes.add(key.attribute());
        }
      }
    }
    return attributes;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return specs.toString();
  }
}
