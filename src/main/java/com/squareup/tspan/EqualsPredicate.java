package com.squareup.tspan;

import java.util.Objects;

/**
 * A predicate matching a single literal value exactly, optionally modulo casing
 * when the attribute is compared case-insensitively. This is for token specs like
 * <pre>{"LOWER": "apple"}</pre> or <pre>{"IS_PUNCT": true}</pre>.
 */
public class EqualsPredicate extends Predicate {

  /** The value the token must have, as rendered by {@link AttributeKey#render(Object)}. */
  public final String value;

  /** Create a new equality predicate. */
  public EqualsPredicate(String value) {
    this.value = Objects.requireNonNull(value);
  }

  /** {@inheritDoc} */
  @Override public String fragment() {
    return java.util.regex.Pattern.quote(AttributeProjection.sanitize(value));
  }

  /** {@inheritDoc} */
  @Override protected void populateToString(StringBuilder b) {
    b.append('"').append(value).append('"');
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return value.equals(((EqualsPredicate) o).value);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return value.hashCode();
  }
}
