package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * <p>
 *   Parses the literal form of a pattern (a list of maps, as it would be read from
 *   JSON) into a list of {@link TokenSpec}s. Each map is one position of the pattern:
 * </p>
 *
 * <pre>
 *   [{"LOWER": "new"}, {"IS_TITLE": true, "OP": "+"}, {"_": {"is_city": true}}]
 * </pre>
 *
 * <p>
 *   Attribute names are case-insensitive. A value is either a literal (a string, a
 *   boolean or an integer), or a map of predicates keyed by {@code REGEX},
 *   {@code IN}, {@code NOT_IN}, or one of the comparisons {@code ==, !=, >=, <=, >, <}.
 *   Every problem with a pattern is reported as an {@link InvalidPatternException}.
 * </p>
 */
final class PatternParser {

  /** The key of the quantifier of a position. */
  static final String OP = "OP";

  /** The key of the extension namespace. */
  static final String EXTENSIONS = "_";

  private PatternParser() {}

  /**
   * Parse a pattern.
   *
   * @param pattern The pattern literal.
   *
   * @return The token specs of the pattern, one per position.
   *
   * @throws InvalidPatternException If the pattern is not well formed.
   */
  static List<TokenSpec> parse(/* @Nullable */ List<?> pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new InvalidPatternException("Pattern is empty");
    }
    List<TokenSpec> specs = new ArrayList<>(pattern.size());
    for (int i = 0; i < pattern.size(); ++i) {
      Object spec = pattern.get(i);
      if (!(spec instanceof Map)) {
        throw new InvalidPatternException("Token spec #" + i + " is not a map: " + spec);
      }
      try {
        specs.add(parseTokenSpec((Map<?, ?>) spec));
      } catch (InvalidPatternException e) {
        throw new InvalidPatternException("Token spec #" + i + ": " + e.getMessage(), e.getCause());
      }
    }
    return Collections.unmodifiableList(specs);
  }

  /**
   * Parse a single position of a pattern.
   */
  private static TokenSpec parseTokenSpec(Map<?, ?> spec) {
    Map<AttributeKey, List<Predicate>> constraints = new LinkedHashMap<>();
    Quantifier quantifier = Quantifier.ONE;
    for (Map.Entry<?, ?> entry : spec.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new InvalidPatternException("Attribute names must be strings: " + entry.getKey());
      }
      String name = ((String) entry.getKey()).toUpperCase(Locale.ROOT);
      Object value = entry.getValue();
      if (OP.equals(name)) {
        // Case: the quantifier
        quantifier = value instanceof String ? Quantifier.forSymbol((String) value) : null;
        if (quantifier == null) {
          throw new InvalidPatternException(
              "Invalid OP '" + value + "'; expected one of 1, +, !, ?, *");
        }
      } else if (EXTENSIONS.equals(name)) {
        // Case: the extension namespace
        if (!(value instanceof Map)) {
          throw new InvalidPatternException("Extensions must be a map of name to value: " + value);
        }
        for (Map.Entry<?, ?> extension : ((Map<?, ?>) value).entrySet()) {
          if (!(extension.getKey() instanceof String)) {
            throw new InvalidPatternException("Extension names must be strings: " + extension.getKey());
          }
          AttributeKey key = AttributeKey.extension((String) extension.getKey());
          constraints.put(key, parseValue(key, extension.getValue()));
        }
      } else {
        // Case: a built-in attribute
        Attribute attribute = Attribute.forName(name);
        if (attribute == null) {
          throw new InvalidPatternException("Unknown attribute '" + entry.getKey() + "'");
        }
        AttributeKey key = AttributeKey.of(attribute);
        if (attribute.isFreeText()) {
          if (!(value instanceof String)) {
            throw new InvalidPatternException("REGEX must be a string: " + value);
          }
          constraints.put(key, Collections.singletonList(regex((String) value)));
        } else {
          constraints.put(key, parseValue(key, value));
        }
      }
    }

    // Validate the free-text pseudo-attribute
    TokenSpec parsed = new TokenSpec(constraints, quantifier);
    if (parsed.isFreeText()) {
      if (constraints.size() > 1) {
        throw new InvalidPatternException(
            "REGEX cannot be combined with other attributes: " + constraints.keySet());
      }
      if (quantifier == Quantifier.NEGATED) {
        throw new InvalidPatternException("REGEX cannot be negated");
      }
    }
    return parsed;
  }

  /**
   * Parse the value of an attribute into its predicates.
   */
  private static List<Predicate> parseValue(AttributeKey key, /* @Nullable */ Object value) {
    if (value instanceof Map) {
      Map<?, ?> predicates = (Map<?, ?>) value;
      if (predicates.isEmpty()) {
        throw new InvalidPatternException("No predicates for " + key);
      }
      List<Predicate> parsed = new ArrayList<>(predicates.size());
      for (Map.Entry<?, ?> predicate : predicates.entrySet()) {
        parsed.add(parsePredicate(key, String.valueOf(predicate.getKey()), predicate.getValue()));
      }
      return parsed;
    }
    if (key.attribute() == Attribute.LENGTH) {
      if (!isInteger(value)) {
        throw new InvalidPatternException("LENGTH must be an integer or a comparison: " + value);
      }
      return Collections.singletonList(
          new ComparisonPredicate(ComparisonPredicate.Operator.EQ, toInt(key, value)));
    }
    return Collections.singletonList(new EqualsPredicate(literal(key, value)));
  }

  /**
   * Parse a single entry of a predicate map.
   */
  private static Predicate parsePredicate(AttributeKey key, String name, /* @Nullable */ Object argument) {
    String upper = name.toUpperCase(Locale.ROOT);
    switch (upper) {
      case "REGEX":
        if (!(argument instanceof String)) {
          throw new InvalidPatternException("REGEX predicate on " + key + " must be a string: " + argument);
        }
        return regex((String) argument);
      case "IN":
      case "NOT_IN":
        if (!(argument instanceof Collection)) {
          throw new InvalidPatternException(upper + " predicate on " + key + " must be a list: " + argument);
        }
        List<String> members = new ArrayList<>();
        for (Object member : (Collection<?>) argument) {
          members.add(literal(key, member));
        }
        return new SetMemberPredicate(members, "NOT_IN".equals(upper));
      default:
        ComparisonPredicate.Operator op = ComparisonPredicate.Operator.forSymbol(name);
        if (op == null) {
          throw new InvalidPatternException("Unknown predicate '" + name + "' on " + key);
        }
        if (!isInteger(argument)) {
          throw new InvalidPatternException(
              "Comparison " + name + " on " + key + " must be an integer: " + argument);
        }
        return new ComparisonPredicate(op, toInt(key, argument));
    }
  }

  /**
   * Compile a regular expression predicate, reporting a syntax error as an invalid pattern.
   */
  private static RegexPredicate regex(String source) {
    try {
      return new RegexPredicate(source);
    } catch (PatternSyntaxException e) {
      throw new InvalidPatternException("Invalid regular expression /" + source + "/", e);
    }
  }

  /**
   * Render a literal value, failing on anything that is not a string, boolean or
   * integer.
   */
  private static String literal(AttributeKey key, /* @Nullable */ Object value) {
    if (value instanceof String || value instanceof Boolean || isInteger(value)) {
      return AttributeKey.render(value);
    }
    throw new InvalidPatternException("Unsupported value for " + key + ": " + value
        + (value == null ? "" : " (" + value.getClass().getSimpleName() + ")"));
  }

  /** @return True if the value is an integral number. */
  private static boolean isInteger(/* @Nullable */ Object value) {
    return value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte;
  }

  /** Narrow an integral value to an int, failing if it is out of range. */
  private static int toInt(AttributeKey key, Object value) {
    long asLong = ((Number) value).longValue();
    if (asLong < Integer.MIN_VALUE || asLong > Integer.MAX_VALUE) {
      throw new InvalidPatternException("Integer out of range for " + key + ": " + value);
    }
    return (int) asLong;
  }
}
