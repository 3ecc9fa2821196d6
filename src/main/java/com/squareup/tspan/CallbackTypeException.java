package com.squareup.tspan;

/**
 * Thrown when a callback named in a rule file cannot be bound: either the name is
 * not bound at all, or it is bound to something that is not a {@link MatchCallback}.
 *
 * @see PatternLoader
 */
public class CallbackTypeException extends IllegalArgumentException {

  /** The name of the callback, as it appeared in the rule file. */
  public final String name;

  /**
   * Create a new exception.
   *
   * @param name See {@link #name}.
   * @param message A description of the problem.
   */
  public CallbackTypeException(String name, String message) {
    super(message);
    this.name = name;
  }
}
