package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   The entry point for matching: a set of rules, each a key with one or more
 *   alternative patterns and an optional {@link MatchCallback}. For example:
 * </p>
 *
 * <pre>{@code
 *   RuleRegistry registry = new RuleRegistry();
 *   registry.add("JS", List.of(List.of(Map.of("TEXT", "JavaScript"))), null);
 *   List<Match> matches = registry.call(MapInputToken.sequence("JavaScript", "is", "good"));
 *   // matches == [(JS, 0, 1)]
 * }</pre>
 *
 * <p>
 *   Patterns are validated and compiled when they are added, so that an invalid
 *   pattern never makes it into the registry. Adding patterns under an existing key
 *   appends them to the rule, and replaces its callback.
 * </p>
 *
 * <p>
 *   A registry is not thread-safe for mutation. Calls to {@link #call(List)} on a
 *   registry that is not being mutated are independent, and may run concurrently.
 * </p>
 */
public class RuleRegistry {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

  /** The rules, in the order their keys were first added. */
  private final Map<String, Rule> rules = new LinkedHashMap<>();

  /** Every built-in attribute read by some pattern of some rule. */
  private Set<Attribute> attributes = Collections.unmodifiableSet(EnumSet.noneOf(Attribute.class));

  /**
   * Add patterns to a rule, creating it if needed.
   *
   * @param key The key of the rule.
   * @param patterns The alternative patterns to add. Each pattern is a list of token spec
   *                 maps; see {@link PatternParser}.
   * @param callback The callback to fire on matches of this rule, or null. This replaces
   *                 any callback the rule had.
   *
   * @throws InvalidPatternException If any of the patterns is invalid. In that case, the
   *         registry is left unchanged.
   */
  public void add(String key, List<? extends List<? extends Map<String, ?>>> patterns,
                  @Nullable MatchCallback callback) {
    Objects.requireNonNull(key, "Rule keys cannot be null");
    if (patterns == null) {
      throw new InvalidPatternException("No patterns given for key '" + key + "'");
    }

    // Compile everything before touching any state
    List<List<Map<String, ?>>> copies = new ArrayList<>(patterns.size());
    List<CompiledPattern> compiled = new ArrayList<>(patterns.size());
    for (int i = 0; i < patterns.size(); ++i) {
      List<? extends Map<String, ?>> pattern = patterns.get(i);
      try {
        compiled.add(PatternCompiler.compile(pattern));
      } catch (InvalidPatternException e) {
        throw new InvalidPatternException(key, i, e);
      }
      copies.add(Collections.unmodifiableList(new ArrayList<>(pattern)));
    }

    // Register the patterns
    Rule existing = rules.get(key);
    rules.put(key, existing == null
        ? new Rule(key, copies, compiled, callback)
        : existing.extend(copies, compiled, callback));
    recomputeAttributes();
    log.debug("Added {} pattern(s) under key '{}'", compiled.size(), key);
  }

  /**
   * Add patterns to a rule with no callback.
   *
   * @see #add(String, List, MatchCallback)
   */
  public void add(String key, List<? extends List<? extends Map<String, ?>>> patterns) {
    add(key, patterns, null);
  }

  /**
   * Remove a rule, with all of its patterns.
   *
   * @param key The key of the rule.
   *
   * @throws UnknownKeyException If there is no rule with this key.
   */
  public void remove(String key) {
    if (rules.remove(key) == null) {
      throw new UnknownKeyException(key);
    }
    recomputeAttributes();
    log.debug("Removed key '{}'", key);
  }

  /**
   * @param key The key of a rule.
   *
   * @return The rule with this key.
   *
   * @throws UnknownKeyException If there is no rule with this key.
   */
  public Rule get(String key) {
    Rule rule = rules.get(key);
    if (rule == null) {
      throw new UnknownKeyException(key);
    }
    return rule;
  }

  /**
   * @param key The key of a rule.
   *
   * @return The rule with this key, or null if there is none.
   */
  public @Nullable Rule getIfPresent(String key) {
    return rules.get(key);
  }

  /** @return True if there is a rule with this key. */
  public boolean contains(String key) {
    return rules.containsKey(key);
  }

  /** @return The number of rules (not patterns) in this registry. */
  public int size() {
    return rules.size();
  }

  /** @return The keys of the rules, in the order they were first added. */
  public Set<String> keys() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(rules.keySet()));
  }

  /**
   * @return Every built-in attribute read by some pattern of some rule. An upstream
   *         pipeline can use this to decide which annotators need to run.
   */
  public Set<Attribute> attributes() {
    return attributes;
  }

  /**
   * Match every rule against a token sequence, and fire the callbacks of the matched
   * rules.
   *
   * @param tokens The tokens to match.
   *
   * @return Every match, grouped by rule in the order the rules were added, and
   *         ordered by start within a rule.
   *
   * @throws MissingAnnotationException If a pattern reads an attribute that has to be
   *         annotated upstream, but no token carries it.
   *
   * @see #call(List, boolean)
   */
  public List<Match> call(List<? extends InputToken> tokens) {
    return call(tokens, false);
  }

  /**
   * Match every rule against a token sequence, and fire the callbacks of the matched
   * rules. Callbacks are fired in match order; an exception thrown by a callback
   * propagates, and no further callbacks are fired.
   *
   * @param tokens The tokens to match.
   * @param allowMissing If true, attributes that were never annotated are matched as
   *                     empty values rather than failing.
   *
   * @return Every match, grouped by rule in the order the rules were added, and
   *         ordered by start within a rule.
   *
   * @throws MissingAnnotationException If a pattern reads an attribute that has to be
   *         annotated upstream, no token carries it, and {@code allowMissing} is false.
   */
  public List<Match> call(List<? extends InputToken> tokens, boolean allowMissing) {
    if (!allowMissing) {
      AttributeProjector.checkAnnotated(tokens, attributes);
    }

    // Match
    MatchEngine engine = new MatchEngine(new AttributeProjector(tokens, allowMissing));
    List<Match> matches = new ArrayList<>();
    Map<String, MatchCallback> callbacks = new LinkedHashMap<>();
    for (Rule rule : rules.values()) {
      // Submatches are filtered per pattern; across patterns only identical spans collapse
      Set<TokenSpan> spans = new TreeSet<>();
      for (CompiledPattern pattern : rule.compiled()) {
        spans.addAll(engine.run(pattern));
      }
      for (TokenSpan span : spans) {
        matches.add(new Match(rule.key, span.getBeginInclusive(), span.getEndExclusive()));
      }
      if (rule.callback() != null) {
        callbacks.put(rule.key, rule.callback());
      }
    }
    log.debug("Found {} match(es) over {} token(s)", matches.size(), tokens.size());

    // Fire the callbacks
    List<Match> result = Collections.unmodifiableList(matches);
    for (int i = 0; i < result.size(); ++i) {
      MatchCallback callback = callbacks.get(result.get(i).key);
      if (callback != null) {
        callback.onMatch(this, tokens, i, result);
      }
    }
    return result;
  }

  /** Recompute {@link #attributes} from scratch. */
  private void recomputeAttributes() {
    Set<Attribute> attributes = EnumSet.noneOf(Attribute.class);
    for (Rule rule : rules.values()) {
      for (CompiledPattern pattern : rule.compiled()) {
        attributes.addAll(pattern.attributes());
      }
    }
    this.attributes = Collections.unmodifiableSet(attributes);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "RuleRegistry" + rules.keySet();
  }
}
