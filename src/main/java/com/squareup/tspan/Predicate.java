package com.squareup.tspan;

/**
 * <p>
 *   A constraint on the value of a single attribute of a single token; e.g.,
 *   {@code "LOWER": "apple"} or {@code "LENGTH": {">=": 3}}.
 * </p>
 *
 * <p>
 *   Every predicate compiles to a regular expression {@linkplain #fragment() fragment}
 *   over one projected value. The fragment never matches a
 *   {@linkplain AttributeProjection#SEPARATOR separator}, so it can be spliced into the
 *   pattern-level expression that runs over a whole {@link AttributeProjection}, and it
 *   can be run on its own against a single value to verify a token.
 * </p>
 */
public abstract class Predicate {

  /** A fragment that matches no value at all. */
  static final String NEVER = "(?!)";

  /** A fragment that matches any single value, including the empty one. */
  static final String ANY_VALUE = "[^ ]*";

  /** The compiled {@link #fragment()}, for each set of flags we've been asked for. */
  private java.util.regex.Pattern compiled;
  /** The flags {@link #compiled} was compiled with. */
  private int compiledFlags = -1;

  /**
   * The regular expression matching exactly the values that satisfy this predicate.
   * The fragment is a well-formed expression on its own, and never consumes a
   * {@linkplain AttributeProjection#SEPARATOR separator}.
   *
   * @return The fragment, as a regular expression string.
   */
  public abstract String fragment();

  /**
   * Check a single projected value against this predicate.
   *
   * @param value The (sanitized) value of a token.
   * @param flags The {@link java.util.regex.Pattern} flags of the attribute.
   *
   * @return True if the value satisfies this predicate.
   */
  boolean test(String value, int flags) {
    java.util.regex.Pattern compiled;
    synchronized (this) {
      if (this.compiled == null || this.compiledFlags != flags) {
        this.compiled = java.util.regex.Pattern.compile(fragment(), flags);
        this.compiledFlags = flags;
      }
      compiled = this.compiled;
    }
    return compiled.matcher(value).matches();
  }

  /**
   * Generate the string form of this predicate, as it would appear as the value of an
   * attribute in a token spec.
   *
   * @param b The string builder we're appending to.
   */
  protected abstract void populateToString(StringBuilder b);

  /** {@inheritDoc} */
  @Override public String toString() {
    StringBuilder b = new StringBuilder();
    populateToString(b);
    return b.toString();
  }
}
