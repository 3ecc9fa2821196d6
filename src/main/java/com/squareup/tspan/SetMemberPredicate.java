package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * <p>
 *   A predicate matching if the value of a token is (or, when negated, is not) one of
 *   a set of literals. This is for token specs like
 *   <pre>{"POS": {"IN": ["NOUN", "PROPN"]}}</pre> or
 *   <pre>{"LOWER": {"NOT_IN": ["the", "a"]}}</pre>.
 * </p>
 */
public class SetMemberPredicate extends Predicate {

  /** The literals of the set, in the order they were given. */
  public final Set<String> values;

  /** If true, this is a {@code NOT_IN} predicate. */
  public final boolean negated;

  /**
   * Create a new set membership predicate.
   *
   * @param values See {@link #values}.
   * @param negated See {@link #negated}.
   */
  public SetMemberPredicate(Iterable<String> values, boolean negated) {
    Set<String> copy = new LinkedHashSet<>();
    for (String value : values) {
      copy.add(value);
    }
    this.values = Collections.unmodifiableSet(copy);
    this.negated = negated;
  }

  /** The alternation of all our literals, or null if the set is empty. */
  private /* @Nullable */ String alternation() {
    if (values.isEmpty()) {
      return null;
    }
    List<String> quoted = new ArrayList<>(values.size());
    for (String value : values) {
      quoted.add(java.util.regex.Pattern.quote(AttributeProjection.sanitize(value)));
    }
    return "(?:" + String.join("|", quoted) + ")";
  }

  /** {@inheritDoc} */
  @Override public String fragment() {
    String alternation = alternation();
    if (alternation == null) {
      return negated ? ANY_VALUE : NEVER;
    }
    if (negated) {
      // The lookahead must see the whole value, or "NOT_IN [a]" would reject "ab"
      return "(?!" + alternation + "(?= |\\z))" + ANY_VALUE;
    } else {
      return alternation;
    }
  }

  /** {@inheritDoc} */
  @Override protected void populateToString(StringBuilder b) {
    b.append('{').append(negated ? "NOT_IN" : "IN").append(": [");
    boolean first = true;
    for (String value : values) {
      if (!first) {
        b.append(", ");
      }
      b.append('"').append(value).append('"');
      first = false;
    }
    b.append("]}");
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SetMemberPredicate that = (SetMemberPredicate) o;
    return negated == that.negated && values.equals(that.values);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return values.hashCode() * 31 + (negated ? 1 : 0);
  }
}
