package com.squareup.tspan;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 *   Builds and caches the {@linkplain AttributeProjection projections} of one token
 *   sequence, for the duration of one matching call. Every call of
 *   {@link RuleRegistry#call(List, boolean)} creates its own projector, so the cache
 *   is never shared between calls or threads.
 * </p>
 */
final class AttributeProjector {

  /** The tokens we are projecting. */
  private final List<? extends InputToken> tokens;
  /** If true, do not fail on attributes that were never annotated. */
  private final boolean allowMissing;
  /** The projections computed so far. */
  private final Map<AttributeKey, AttributeProjection> cache = new HashMap<>();

  /**
   * Create a projector over a token sequence.
   *
   * @param tokens The tokens of the document.
   * @param allowMissing If true, unannotated attributes are projected as empty values
   *                     rather than failing with a {@link MissingAnnotationException}.
   */
  AttributeProjector(List<? extends InputToken> tokens, boolean allowMissing) {
    this.tokens = tokens;
    this.allowMissing = allowMissing;
  }

  /** @return The tokens we are projecting. */
  List<? extends InputToken> tokens() {
    return tokens;
  }

  /**
   * Get the projection for an attribute, computing it if needed.
   *
   * @param key The attribute to project.
   *
   * @return The projection of that attribute over our tokens.
   *
   * @throws MissingAnnotationException If the attribute requires annotation, no token
   *         carries it, and we were not asked to allow missing annotations.
   */
  AttributeProjection project(AttributeKey key) {
    AttributeProjection projection = cache.get(key);
    if (projection == null) {
      if (!allowMissing && key.attribute() != null) {
        checkAnnotated(tokens, key.attribute());
      }
      projection = AttributeProjection.project(tokens, key);
      cache.put(key, projection);
    }
    return projection;
  }

  /**
   * Check that every attribute requiring annotation has been annotated on the tokens.
   *
   * @param tokens The tokens to check.
   * @param attributes The attributes referenced by the patterns we are about to run.
   *
   * @throws MissingAnnotationException On the first attribute that is not annotated.
   */
  static void checkAnnotated(List<? extends InputToken> tokens, Collection<Attribute> attributes) {
    for (Attribute attribute : attributes) {
      checkAnnotated(tokens, attribute);
    }
  }

  /**
   * An attribute counts as annotated if any token carries a value for it.
   * An empty sequence is trivially annotated.
   */
  private static void checkAnnotated(List<? extends InputToken> tokens, Attribute attribute) {
    if (!attribute.requiresAnnotation() || tokens.isEmpty()) {
      return;
    }
    for (InputToken token : tokens) {
      if (token.get(attribute) != null) {
        return;
      }
    }
    throw new MissingAnnotationException(attribute);
  }
}
