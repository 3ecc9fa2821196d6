package com.squareup.tspan;

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * The identity of an attribute as it appears in a compiled pattern: either one of
 * the built-in {@link Attribute}s, or the name of an extension value. Each distinct
 * key gets its own {@linkplain AttributeProjection projection} and its own attribute
 * pass when matching.
 */
public final class AttributeKey {

  /** The built-in attribute, or null if this is an extension. */
  @Nullable private final Attribute attribute;
  /** The extension name, or null if this is a built-in attribute. */
  @Nullable private final String extension;

  private AttributeKey(@Nullable Attribute attribute, @Nullable String extension) {
    this.attribute = attribute;
    this.extension = extension;
  }

  /** Create a key for a built-in attribute. */
  public static AttributeKey of(Attribute attribute) {
    return new AttributeKey(Objects.requireNonNull(attribute), null);
  }

  /** Create a key for an extension value. */
  public static AttributeKey extension(String name) {
    return new AttributeKey(null, Objects.requireNonNull(name));
  }

  /**
   * @return The built-in attribute, or null if this is an extension.
   */
  public @Nullable Attribute attribute() {
    return attribute;
  }

  /**
   * @return The extension name, or null if this is a built-in attribute.
   */
  public @Nullable String extensionName() {
    return extension;
  }

  /** @see Attribute#isFreeText() */
  public boolean isFreeText() {
    return attribute != null && attribute.isFreeText();
  }

  /** @see Attribute#isCaseInsensitive() */
  public boolean isCaseInsensitive() {
    return attribute != null && attribute.isCaseInsensitive();
  }

  /** @see Attribute#requiresAnnotation() */
  public boolean requiresAnnotation() {
    return attribute != null && attribute.requiresAnnotation();
  }

  /**
   * The order in which attribute passes run: the cheap, selective text attributes
   * first, the free-text pass last.
   */
  int evaluationRank() {
    if (attribute == null) {
      return 1;
    }
    switch (attribute) {
      case ORTH:
      case TEXT:
      case LOWER:
      case LEMMA:
        return 0;
      case REGEX:
        return 2;
      default:
        return 1;
    }
  }

  /**
   * Read the value of this attribute off a token, rendered as a string.
   *
   * @param token The token to read.
   *
   * @return The value, or null if the token has no value for this attribute.
   */
  @Nullable String valueOf(InputToken token) {
    if (attribute != null) {
      return token.get(attribute.valueSource());
    }
    Object value = token.getExtension(extension);
    return value == null ? null : render(value);
  }

  /**
   * Render a raw value the way it is projected and the way literals in a pattern are
   * compared: booleans as "True" / "False", everything else by its string form.
   */
  static String render(Object value) {
    if (value instanceof Boolean) {
      return LexicalFeatures.flag((Boolean) value);
    }
    return value.toString();
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AttributeKey that = (AttributeKey) o;
    return attribute == that.attribute && Objects.equals(extension, that.extension);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(attribute, extension);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return attribute != null ? attribute.name() : "_." + extension;
  }
}
