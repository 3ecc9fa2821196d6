package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   Compiles a pattern into one regular expression per referenced attribute.
 * </p>
 *
 * <p>
 *   Over a regular (non free-text) projection, every token is a separator followed by
 *   its value, so a token whose value satisfies a fragment <i>F</i> is matched by
 *   <code>" (?:F)(?= |\z)"</code>. Each position of the pattern wraps such a unit in a
 *   named group according to its {@linkplain PositionTable#aligned(int, AttributeKey)
 *   aligned quantifier}:
 * </p>
 *
 * <ul>
 *   <li>{@code 1}: {@code (?<tokN>U)}</li>
 *   <li>{@code +}: {@code (?<tokN>(?:U)+)}, or {@code +?} when reluctant</li>
 *   <li>{@code ?}: {@code (?<tokN>(?:U)?)}</li>
 *   <li>{@code *}: {@code (?<tokN>(?:U)*)}, or {@code *?} when reluctant</li>
 *   <li>{@code !}: {@code (?<tokN>(?!U) [^ ]*(?= |\z))}</li>
 * </ul>
 *
 * <p>
 *   Over the free-text projection, a token is a run of non-whitespace followed by
 *   whitespace, and a free-text position is its expression padded to the surrounding
 *   tokens. This pass only approximates token boundaries; the
 *   {@link SpanVerifier} has the final say.
 * </p>
 */
public final class PatternCompiler {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(PatternCompiler.class);

  /** Any one token of a regular projection. */
  private static final String ANY_TOKEN = " [^ ]*(?= |\\z)";

  /** Any one token of the free-text projection, or a part of one. */
  private static final String ANY_TEXT = "\\S+?\\s*";

  private PatternCompiler() {}

  /**
   * Parse and compile a pattern literal.
   *
   * @param pattern The pattern, as a list of token spec maps.
   *
   * @return The compiled pattern.
   *
   * @throws InvalidPatternException If the pattern is not well formed.
   */
  public static CompiledPattern compile(List<? extends Map<String, ?>> pattern) {
    return compileSpecs(PatternParser.parse(pattern));
  }

  /**
   * Compile a pattern from its token specs.
   *
   * @param specs The positions of the pattern.
   *
   * @return The compiled pattern.
   *
   * @throws InvalidPatternException If the pattern is empty, or if a pass does not
   *         compile.
   */
  public static CompiledPattern compileSpecs(List<TokenSpec> specs) {
    if (specs.isEmpty()) {
      throw new InvalidPatternException("Pattern is empty");
    }
    PositionTable table = new PositionTable(specs);
    List<AttributeKey> order = new ArrayList<>(table.attributes());
    order.sort(Comparator.comparingInt(AttributeKey::evaluationRank));  // stable

    List<CompiledPattern.Pass> passes = new ArrayList<>(order.size());
    for (AttributeKey key : order) {
      String regex = key.isFreeText() ? freeTextRegex(table) : attributeRegex(table, key);
      try {
        passes.add(new CompiledPattern.Pass(
            key, java.util.regex.Pattern.compile(regex, TokenSpec.flags(key)), table.anchors(key)));
      } catch (PatternSyntaxException e) {
        throw new InvalidPatternException("Could not compile the " + key + " pass of " + specs, e);
      }
      log.debug("Compiled {} pass for {}: /{}/", key, specs, regex);
    }
    return new CompiledPattern(new ArrayList<>(specs), passes);
  }

  /**
   * The expression for an attribute over its regular projection.
   */
  static String attributeRegex(PositionTable table, AttributeKey key) {
    StringBuilder b = new StringBuilder();
    for (int i = 0; i < table.size(); ++i) {
      TokenSpec spec = table.spec(i);
      Quantifier q = table.aligned(i, key);
      String unit = table.constrains(i, key)
          ? " (?:" + spec.fragment(key) + ")(?= |\\z)"
          : ANY_TOKEN;
      wrap(b, i, q, unit, table.isReluctant(i, key));
    }
    return b.toString();
  }

  /**
   * The expression for the free-text pseudo-attribute over the natural text.
   */
  static String freeTextRegex(PositionTable table) {
    AttributeKey key = AttributeKey.of(Attribute.REGEX);
    StringBuilder b = new StringBuilder();
    for (int i = 0; i < table.size(); ++i) {
      TokenSpec spec = table.spec(i);
      String unit;
      if (spec.isFreeText()) {
        RegexPredicate expression = spec.freeText();
        unit = (expression.isAnchoredStart() ? "" : "\\S*?")
            + "(?:" + expression.body() + ")"
            + (expression.isAnchoredEnd() ? "" : "\\S*?")
            + "\\s*";
      } else {
        unit = ANY_TEXT;
      }
      wrap(b, i, table.aligned(i, key), unit, table.isReluctant(i, key));
    }
    return b.toString();
  }

  /**
   * Append a single position, wrapped in its named group.
   *
   * @param b The expression we are building.
   * @param position The position in the pattern.
   * @param q The aligned quantifier of the position.
   * @param unit The expression matching one token at the position.
   * @param reluctant If true, a repeating quantifier is made reluctant.
   */
  private static void wrap(StringBuilder b, int position, Quantifier q, String unit, boolean reluctant) {
    b.append("(?<").append(CompiledPattern.groupName(position)).append('>');
    switch (q) {
      case ONE_OR_MORE:
        b.append("(?:").append(unit).append(")+");
        if (reluctant) {
          b.append('?');
        }
        break;
      case ZERO_OR_ONE:
        b.append("(?:").append(unit).append(")?");
        break;
      case ZERO_OR_MORE:
        b.append("(?:").append(unit).append(")*");
        if (reluctant) {
          b.append('?');
        }
        break;
      case NEGATED:
        b.append("(?!").append(unit).append(')').append(ANY_TOKEN);
        break;
      default:
      case ONE:
        b.append(unit);
        break;
    }
    b.append(')');
  }
}
