package com.squareup.tspan;

import java.util.NoSuchElementException;

/**
 * Thrown when looking up or removing a rule key that was never added to a
 * {@link RuleRegistry}.
 */
public class UnknownKeyException extends NoSuchElementException {

  /** The key that was not found. */
  public final String key;

  /**
   * Create a new exception.
   *
   * @param key See {@link #key}.
   */
  public UnknownKeyException(String key) {
    super("No rule with key '" + key + "'");
    this.key = key;
  }
}
