package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   A simple implementation of an input token that does a lookup in a Java map. This
 *   can be used to match against a list of maps, where each element of the list
 *   corresponds to the information in a token.
 * </p>
 *
 * <p>
 *   The map is keyed by attribute name (e.g., "TEXT", "POS"); lower-case keys are
 *   accepted. The whitespace following the token is stored under {@link #WHITESPACE}.
 *   Any lexical attribute missing from the map is derived from the token text.
 * </p>
 */
public class MapInputToken implements InputToken {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(MapInputToken.class);

  /** The map key under which the trailing whitespace of the token is stored. */
  public static final String WHITESPACE = "WHITESPACE";

  /** The Map that's backing this token, keyed by upper-cased attribute name. */
  private final Map<String, String> token;

  /** The extension values of this token. */
  private final Map<String, Object> extensions;

  /**
   * Create a token backed by a Java Map.
   *
   * @param token The Map that's backing the values in this token
   */
  public MapInputToken(Map<String, String> token) {
    this(token, Collections.emptyMap());
  }

  /**
   * Create a token backed by a Java Map, with extension values.
   *
   * @param token The Map that's backing the values in this token
   * @param extensions The extension values of this token, by extension name.
   */
  public MapInputToken(Map<String, String> token, Map<String, ?> extensions) {
    Map<String, String> normalized = new HashMap<>();
    for (Map.Entry<String, String> entry : token.entrySet()) {
      normalized.put(entry.getKey().toUpperCase(Locale.ROOT), entry.getValue());
    }
    if (!normalized.containsKey(Attribute.TEXT.name()) && normalized.containsKey(Attribute.ORTH.name())) {
      normalized.put(Attribute.TEXT.name(), normalized.get(Attribute.ORTH.name()));
    }
    if (!normalized.containsKey(Attribute.TEXT.name())) {
      log.warn("[[Token has no TEXT value; lexical attributes will be empty: {}]]", token);
    }
    this.token = Collections.unmodifiableMap(normalized);
    this.extensions = Collections.unmodifiableMap(new HashMap<>(extensions));
  }

  /**
   * Create a token from its text alone, followed by a single space.
   *
   * @param text The text of the token.
   *
   * @return A token with only lexical attributes.
   */
  public static MapInputToken of(String text) {
    return new MapInputToken(Map.of(Attribute.TEXT.name(), text));
  }

  /**
   * Create a token sequence from the token texts. Every token is followed by a single
   * space, except the last one.
   *
   * @param texts The texts of the tokens, in order.
   *
   * @return The token sequence.
   */
  public static List<MapInputToken> sequence(String... texts) {
    List<MapInputToken> tokens = new ArrayList<>(texts.length);
    for (int i = 0; i < texts.length; ++i) {
      tokens.add(new MapInputToken(Map.of(
          Attribute.TEXT.name(), texts[i],
          WHITESPACE, i == texts.length - 1 ? "" : " ")));
    }
    return tokens;
  }

  /**
   * Return a copy of this token with an additional extension value.
   *
   * @param name The name of the extension.
   * @param value The value of the extension.
   *
   * @return A new token; this one is left unchanged.
   */
  public MapInputToken withExtension(String name, Object value) {
    Map<String, Object> copy = new HashMap<>(extensions);
    copy.put(name, value);
    return new MapInputToken(token, copy);
  }

  /**
   * Return a copy of this token with an additional attribute value.
   *
   * @param attribute The attribute to set.
   * @param value The value of the attribute.
   *
   * @return A new token; this one is left unchanged.
   */
  public MapInputToken with(Attribute attribute, String value) {
    Map<String, String> copy = new HashMap<>(token);
    copy.put(attribute.name(), value);
    return new MapInputToken(copy, extensions);
  }

  /** {@inheritDoc} */
  @Override public @Nullable String get(Attribute attribute) {
    String value = token.get(attribute.name());
    if (value != null) {
      return value;
    }
    if (attribute == Attribute.ORTH) {
      value = token.get(Attribute.TEXT.name());
      if (value != null) {
        return value;
      }
    }
    if (attribute.kind == Attribute.Kind.LEXICAL || attribute.kind == Attribute.Kind.FLAG) {
      String text = token.get(Attribute.TEXT.name());
      return text == null ? null : LexicalFeatures.derive(attribute, text);
    }
    return null;
  }

  /** {@inheritDoc} */
  @Override public @Nullable Object getExtension(String name) {
    return extensions.get(name);
  }

  /** {@inheritDoc} */
  @Override public String whitespace() {
    return token.getOrDefault(WHITESPACE, " ");
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return token.toString();
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MapInputToken that = (MapInputToken) o;
    return token.equals(that.token) && extensions.equals(that.extensions);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(token, extensions);
  }
}
