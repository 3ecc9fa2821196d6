package com.squareup.tspan;

/**
 * <p>
 *   How many tokens a single position of a pattern consumes, set with the {@code OP}
 *   key of a token spec.
 * </p>
 *
 * <p>
 *   <b>NOTE</b> Please update all callers of this enum if a new constant is added.
 * </p>
 */
public enum Quantifier {
  /** exactly one token; the default */
  ONE("1"),
  /** one or more tokens */
  ONE_OR_MORE("+"),
  /** exactly one token that does not satisfy the constraints */
  NEGATED("!"),
  /** zero or one token */
  ZERO_OR_ONE("?"),
  /** zero or more tokens */
  ZERO_OR_MORE("*"),
  ;

  /** The symbol of this quantifier in a pattern. */
  public final String symbol;

  Quantifier(String symbol) {
    this.symbol = symbol;
  }

  /**
   * @return True if this quantifier can repeat its token; i.e., {@code +} or {@code *}.
   */
  public boolean isRepeating() {
    return this == ONE_OR_MORE || this == ZERO_OR_MORE;
  }

  /**
   * @return True if a position with this quantifier always consumes at least one token
   *         matching its constraints; these positions are the anchors of a pattern.
   */
  public boolean isAnchor() {
    return this == ONE || this == ONE_OR_MORE;
  }

  /**
   * Look up a quantifier by its symbol.
   *
   * @param symbol The value of an {@code OP} key.
   *
   * @return The quantifier, or null if the symbol is not a known quantifier.
   */
  static /* @Nullable */ Quantifier forSymbol(String symbol) {
    for (Quantifier q : values()) {
      if (q.symbol.equals(symbol)) {
        return q;
      }
    }
    return null;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return symbol;
  }
}
