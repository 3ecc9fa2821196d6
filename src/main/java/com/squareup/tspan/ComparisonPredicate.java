package com.squareup.tspan;

/**
 * This is a predicate comparing the length of the value of a token against a number.
 * This is for token specs like <pre>{"LENGTH": {"&gt;=": 4}}</pre>. The comparison is
 * compiled to a bounded repetition, so it never has to parse the value.
 */
public class ComparisonPredicate extends Predicate {

  /**
   * <p>
   *   The type of numeric operator. This determines the comparison we are making
   *   between the value in the pattern and the length of the value in the input token.
   * </p>
   *
   * <p>
   *   <b>NOTE</b> Please update all callers of this enum if a new constant is added.
   * </p>
   */
  public enum Operator {
    /** equal to */
    EQ("=="),
    /** not equal to */
    NEQ("!="),
    /** greater than or equal to */
    GTE(">="),
    /** less than or equal to */
    LTE("<="),
    /** greater than */
    GT(">"),
    /** less than */
    LT("<"),
    ;

    /** The symbol of this operator in a pattern. */
    public final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    /**
     * Look up an operator by its symbol.
     *
     * @param symbol The predicate key; e.g., "&gt;=".
     *
     * @return The operator, or null if this is not a comparison.
     */
    static /* @Nullable */ Operator forSymbol(String symbol) {
      for (Operator op : values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      return null;
    }
  }

  /** A single character of a value. */
  private static final String CHAR = "[^ ]";

  /**
   * The operator we are using for the comparison. For example, equality or
   * less than, etc.
   */
  public final Operator op;

  /**
   * The target length we are comparing the length of the value against.
   */
  public final int value;

  /**
   * Create a new length comparison predicate.
   *
   * @param op See {@link #op}
   * @param value See {@link #value}
   */
  public ComparisonPredicate(Operator op, int value) {
    this.op = op;
    this.value = value;
  }

  /** {@inheritDoc} */
  @Override public String fragment() {
    switch (op) {
      case LT:
        return value <= 0 ? NEVER : CHAR + "{0," + (value - 1) + "}";
      case LTE:
        return value < 0 ? NEVER : CHAR + "{0," + value + "}";
      case GT:
        if (value == Integer.MAX_VALUE) {
          return NEVER;
        }
        return value < 0 ? ANY_VALUE : CHAR + "{" + (value + 1) + ",}";
      case GTE:
        return value <= 0 ? ANY_VALUE : CHAR + "{" + value + ",}";
      case NEQ:
        if (value < 0) {
          return ANY_VALUE;
        } else if (value == 0) {
          return CHAR + "+";
        } else if (value == Integer.MAX_VALUE) {
          return CHAR + "{0," + (value - 1) + "}";
        } else {
          return "(?:" + CHAR + "{0," + (value - 1) + "}|" + CHAR + "{" + (value + 1) + ",})";
        }
      default:
      case EQ:
        return value < 0 ? NEVER : CHAR + "{" + value + "}";
    }
  }

  /** {@inheritDoc} */
  @Override protected void populateToString(StringBuilder b) {
    b.append("{\"").append(op.symbol).append("\": ").append(value).append('}');
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ComparisonPredicate that = (ComparisonPredicate) o;
    return op == that.op && value == that.value;
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return op.hashCode() * 31 + value;
  }
}
