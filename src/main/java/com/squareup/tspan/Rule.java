package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A rule of a {@link RuleRegistry}: the alternative patterns registered under a key,
 * both as they were given and compiled, and the callback fired on their matches.
 * Rules are immutable; adding patterns to a key replaces its rule.
 */
public final class Rule {

  /** The key of the rule. */
  public final String key;

  /** The patterns, as they were given. */
  private final List<List<Map<String, ?>>> patterns;

  /** The compiled patterns, in the same order as {@link #patterns}. */
  private final List<CompiledPattern> compiled;

  /** The callback fired on matches, if any. */
  @Nullable private final MatchCallback callback;

  Rule(String key, List<List<Map<String, ?>>> patterns, List<CompiledPattern> compiled,
       @Nullable MatchCallback callback) {
    this.key = key;
    this.patterns = Collections.unmodifiableList(patterns);
    this.compiled = Collections.unmodifiableList(compiled);
    this.callback = callback;
  }

  /**
   * Create a new rule with more patterns.
   *
   * @param morePatterns The patterns to append, as they were given.
   * @param moreCompiled The compiled forms of those patterns.
   * @param callback The callback of the new rule. This replaces our callback.
   *
   * @return A new rule; this one is unchanged.
   */
  Rule extend(List<List<Map<String, ?>>> morePatterns, List<CompiledPattern> moreCompiled,
              @Nullable MatchCallback callback) {
    List<List<Map<String, ?>>> patterns = new ArrayList<>(this.patterns);
    patterns.addAll(morePatterns);
    List<CompiledPattern> compiled = new ArrayList<>(this.compiled);
    compiled.addAll(moreCompiled);
    return new Rule(key, patterns, compiled, callback);
  }

  /** @return The patterns of this rule, as they were given. */
  public List<List<Map<String, ?>>> patterns() {
    return patterns;
  }

  /** @return The compiled patterns of this rule. */
  public List<CompiledPattern> compiled() {
    return compiled;
  }

  /** @return The callback fired on matches of this rule, or null if there is none. */
  public @Nullable MatchCallback callback() {
    return callback;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return key + " -> " + compiled;
  }
}
