package com.squareup.tspan;

/**
 * Thrown when a registered pattern references an attribute that has to be computed
 * upstream (e.g., {@link Attribute#POS} or {@link Attribute#LEMMA}), but no token of
 * the input carries it. Pass {@code allowMissing} to
 * {@link RuleRegistry#call(java.util.List, boolean)} to match such tokens anyways.
 */
public class MissingAnnotationException extends IllegalStateException {

  /** The attribute that is missing. */
  public final Attribute attribute;

  /**
   * Create a new exception.
   *
   * @param attribute See {@link #attribute}.
   */
  public MissingAnnotationException(Attribute attribute) {
    super("Patterns reference " + attribute + ", but no input token is annotated with it. "
        + "Run the annotator producing " + attribute + " before matching, "
        + "or match with allowMissing set.");
    this.attribute = attribute;
  }
}
