package com.squareup.tspan;

import javax.annotation.Nullable;

/**
 * <p>
 *   A single token in the sequence to be matched. Conceptually this is a map from
 *   {@linkplain Attribute attributes} to string values, plus an open-ended namespace of
 *   extension values. The matcher never mutates a token; it only reads values through
 *   this interface.
 * </p>
 *
 * <p>
 *   Note that for complex patterns, {@link #get(Attribute)} may be called several times
 *   for the same attribute on a token, and it's the responsibility of the implementer to
 *   manage any caching that may be desired.
 * </p>
 */
@FunctionalInterface
public interface InputToken {

  /**
   * Get the value of a built-in attribute. Flags should be returned as "True" or
   * "False".
   *
   * @param attribute The attribute we are looking up for this token.
   *
   * @return The value of the attribute, or null if it was never computed for this
   *         token (e.g., a part of speech on an untagged token).
   */
  @Nullable String get(Attribute attribute);

  /**
   * Get the value of a custom extension attribute.
   *
   * @param name The name of the extension.
   *
   * @return The extension value, or null if it is not set.
   */
  default @Nullable Object getExtension(String name) {
    return null;
  }

  /**
   * @return The whitespace following this token in the original text.
   *         Used to rebuild the natural text for free-text expressions.
   */
  default String whitespace() {
    return " ";
  }
}
