package com.squareup.tspan;

import java.util.List;

/**
 * An action fired for each match of a rule, once all of the matches of a call are
 * known. Callbacks run in match order, and may have side effects on the tokens
 * (e.g., merging the matched span) that later callbacks observe.
 */
@FunctionalInterface
public interface MatchCallback {

  /**
   * Handle a match.
   *
   * @param registry The registry that produced the match.
   * @param tokens The tokens that were matched.
   * @param index The index of the match in {@code matches}.
   * @param matches Every match of the call, in order.
   */
  void onMatch(RuleRegistry registry, List<? extends InputToken> tokens, int index, List<Match> matches);
}
