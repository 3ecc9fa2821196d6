package com.squareup.tspan;

import javax.annotation.Nullable;

/**
 * Thrown when a pattern cannot be compiled: it is empty, references an unknown
 * attribute or predicate, carries a value of an unsupported type, or has a
 * malformed quantifier or regular expression. This is raised when the pattern is
 * added, never when matching.
 */
public class InvalidPatternException extends IllegalArgumentException {

  /** The key of the rule the pattern was added under, if known. */
  @Nullable private final String key;

  /** The index of the pattern within its rule, or -1 if not known. */
  private final int patternIndex;

  /**
   * Create an exception for a pattern not yet associated with a rule.
   *
   * @param message A description of what is wrong with the pattern.
   */
  public InvalidPatternException(String message) {
    this(message, null);
  }

  /**
   * Create an exception for a pattern not yet associated with a rule.
   *
   * @param message A description of what is wrong with the pattern.
   * @param cause The underlying error; e.g., a {@link java.util.regex.PatternSyntaxException}.
   */
  public InvalidPatternException(String message, @Nullable Throwable cause) {
    super(message, cause);
    this.key = null;
    this.patternIndex = -1;
  }

  /**
   * Locate an error within a rule.
   *
   * @param key The key of the rule.
   * @param patternIndex The index of the offending pattern within the rule.
   * @param cause The error we are locating.
   */
  public InvalidPatternException(String key, int patternIndex, InvalidPatternException cause) {
    super("Invalid pattern #" + patternIndex + " for key '" + key + "': " + cause.getMessage(),
        cause.getCause() != null ? cause.getCause() : cause);
    this.key = key;
    this.patternIndex = patternIndex;
  }

  /** @return The key of the rule the pattern was added under, or null if not known. */
  public @Nullable String key() {
    return key;
  }

  /** @return The index of the pattern within its rule, or -1 if not known. */
  public int patternIndex() {
    return patternIndex;
  }
}
