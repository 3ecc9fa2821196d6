package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * <p>
 *   The constraints on a single position of a pattern: the predicates that must hold
 *   on each constrained attribute, and the {@link Quantifier} saying how many tokens
 *   the position consumes. A spec with no constraints matches any token.
 * </p>
 *
 * <p>
 *   A spec constraining the free-text {@link Attribute#REGEX} pseudo-attribute
 *   constrains nothing else, and may consume several tokens at once.
 * </p>
 */
public final class TokenSpec {

  /** The key of the free-text pseudo-attribute. */
  private static final AttributeKey FREE_TEXT = AttributeKey.of(Attribute.REGEX);

  /** A spec matching exactly one token, whatever it is. */
  public static final TokenSpec ANY = new TokenSpec(Collections.emptyMap(), Quantifier.ONE);

  /** The predicates on each attribute, in the order they were declared. */
  private final Map<AttributeKey, List<Predicate>> constraints;

  /** The quantifier of this position. */
  private final Quantifier quantifier;

  /**
   * Create a new token spec.
   *
   * @param constraints The predicates on each attribute. These are all conjoined.
   * @param quantifier The quantifier of this position.
   */
  public TokenSpec(Map<AttributeKey, ? extends List<? extends Predicate>> constraints,
                   Quantifier quantifier) {
    Map<AttributeKey, List<Predicate>> copy = new LinkedHashMap<>();
    for (Map.Entry<AttributeKey, ? extends List<? extends Predicate>> entry : constraints.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    this.constraints = Collections.unmodifiableMap(copy);
    this.quantifier = quantifier;
  }

  /** @return The quantifier of this position. */
  public Quantifier quantifier() {
    return quantifier;
  }

  /** @return The attributes this position constrains, in declaration order. */
  public Set<AttributeKey> attributes() {
    return constraints.keySet();
  }

  /**
   * @param key An attribute.
   *
   * @return The predicates on that attribute, or the empty list if it is not constrained.
   */
  public List<Predicate> predicates(AttributeKey key) {
    return constraints.getOrDefault(key, Collections.emptyList());
  }

  /** @return True if this position matches any token. */
  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  /** @return True if this position constrains the given attribute. */
  public boolean constrains(AttributeKey key) {
    return constraints.containsKey(key);
  }

  /** @return True if this position is a free-text {@link Attribute#REGEX} expression. */
  public boolean isFreeText() {
    return constraints.containsKey(FREE_TEXT);
  }

  /**
   * @return The free-text expression of this position.
   *
   * @throws IllegalStateException If this is not a {@linkplain #isFreeText() free-text}
   *         position.
   */
  RegexPredicate freeText() {
    List<Predicate> predicates = constraints.get(FREE_TEXT);
    if (predicates == null || predicates.isEmpty()) {
      throw new IllegalStateException("Not a free-text token spec: " + this);
    }
    return (RegexPredicate) predicates.get(0);
  }

  /**
   * The regular expression matching one value of the given attribute at this position:
   * the conjunction of all of the predicates on that attribute.
   *
   * @param key The attribute to get the fragment for.
   *
   * @return The regular expression fragment, or {@link Predicate#ANY_VALUE} if the
   *         attribute is not constrained here.
   */
  String fragment(AttributeKey key) {
    List<Predicate> predicates = predicates(key);
    if (predicates.isEmpty()) {
      return Predicate.ANY_VALUE;
    }
    StringBuilder b = new StringBuilder();
    for (int i = 0; i < predicates.size() - 1; ++i) {
      b.append("(?=(?:").append(predicates.get(i).fragment()).append(")(?= |\\z))");
    }
    b.append("(?:").append(predicates.get(predicates.size() - 1).fragment()).append(')');
    return b.toString();
  }

  /**
   * Check a single projected value against all of the predicates on an attribute.
   *
   * @param key The attribute the value was projected from.
   * @param value The projected value.
   *
   * @return True if every predicate on that attribute holds.
   */
  boolean matches(AttributeKey key, String value) {
    int flags = flags(key);
    for (Predicate predicate : predicates(key)) {
      if (!predicate.test(value, flags)) {
        return false;
      }
    }
    return true;
  }

  /**
   * The {@link java.util.regex.Pattern} flags for matching values of an attribute.
   */
  static int flags(AttributeKey key) {
    return key.isCaseInsensitive()
        ? java.util.regex.Pattern.CASE_INSENSITIVE | java.util.regex.Pattern.UNICODE_CASE
        : 0;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    StringBuilder b = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<AttributeKey, List<Predicate>> entry : constraints.entrySet()) {
      for (Predicate predicate : entry.getValue()) {
        if (!first) {
          b.append(", ");
        }
        b.append(entry.getKey()).append(": ");
        predicate.populateToString(b);
        first = false;
      }
    }
    if (quantifier != Quantifier.ONE) {
      if (!first) {
        b.append(", ");
      }
      b.append("OP: ").append(quantifier.symbol);
    }
    return b.append('}').toString();
  }
}
