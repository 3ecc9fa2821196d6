package com.squareup.tspan;

import java.util.BitSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 *   Checks a candidate span token by token against every position of a pattern. The
 *   attribute passes of the {@link MatchEngine} each see a single attribute; this is
 *   where the constraints of a position are checked together, and where a negated
 *   position rejects the conjunction of its constraints.
 * </p>
 *
 * <p>
 *   Verification walks the pattern once, keeping the set of token indices reachable
 *   after each position. Every split of a {@code +} or {@code *} is explored, but each
 *   index is visited only once per position.
 *   A verifier belongs to a single matching call; it caches per-token results for the
 *   duration of that call.
 * </p>
 */
final class SpanVerifier {

  /** The key of the free-text pseudo-attribute. */
  private static final AttributeKey FREE_TEXT = AttributeKey.of(Attribute.REGEX);

  /** The projections of the tokens we are verifying. */
  private final AttributeProjector projector;

  /**
   * Whether each token matches the constraints of a spec: 0 if unknown, 1 if it
   * matches, 2 if it does not.
   */
  private final Map<TokenSpec, byte[]> tokenMatches = new IdentityHashMap<>();

  /** The token ranges each free-text expression was checked on. */
  private final Map<RegexPredicate, Map<Long, Boolean>> textMatches = new IdentityHashMap<>();

  SpanVerifier(AttributeProjector projector) {
    this.projector = projector;
  }

  /**
   * Verify a candidate span.
   *
   * @param specs The positions of the pattern.
   * @param start The first token of the candidate.
   * @param end The end of the candidate, exclusive.
   *
   * @return The end of the span that the pattern matches from {@code start}: {@code end}
   *         itself if the candidate is an exact match, else the longest match ending
   *         before {@code end}. If the pattern matches no non-empty span from
   *         {@code start} within the candidate, -1.
   */
  int verify(List<TokenSpec> specs, int start, int end) {
    BitSet reach = new BitSet(end + 1);
    reach.set(start);
    for (TokenSpec spec : specs) {
      reach = advance(spec, reach, end);
      if (reach.isEmpty()) {
        return -1;
      }
    }
    if (reach.get(end)) {
      return end;
    }
    int longest = reach.previousSetBit(end);
    return longest > start ? longest : -1;
  }

  /**
   * Advance the reachable token indices over one position.
   *
   * @param spec The position.
   * @param reach The token indices at which the position may start.
   * @param limit The end of the candidate; nothing past it is reachable.
   *
   * @return The token indices at which the next position may start.
   */
  private BitSet advance(TokenSpec spec, BitSet reach, int limit) {
    BitSet next;
    switch (spec.quantifier()) {
      case ZERO_OR_ONE:
        next = (BitSet) reach.clone();
        next.or(step(spec, reach, limit));
        return next;
      case ONE_OR_MORE:
        return closure(spec, reach, limit);
      case ZERO_OR_MORE:
        next = (BitSet) reach.clone();
        next.or(closure(spec, reach, limit));
        return next;
      case NEGATED:
      case ONE:
      default:
        return step(spec, reach, limit);
    }
  }

  /**
   * Every index reachable by matching the position one or more times.
   */
  private BitSet closure(TokenSpec spec, BitSet reach, int limit) {
    BitSet result = new BitSet(limit + 1);
    BitSet frontier = step(spec, reach, limit);
    while (!frontier.isEmpty()) {
      frontier.andNot(result);
      result.or(frontier);
      frontier = step(spec, frontier, limit);
      frontier.andNot(result);
    }
    return result;
  }

  /**
   * Every index reachable by matching the position exactly once.
   */
  private BitSet step(TokenSpec spec, BitSet reach, int limit) {
    BitSet next = new BitSet(limit + 1);
    for (int t = reach.nextSetBit(0); t >= 0 && t < limit; t = reach.nextSetBit(t + 1)) {
      if (spec.isFreeText()) {
        for (int u = t + 1; u <= limit; ++u) {
          if (coversText(spec.freeText(), t, u)) {
            next.set(u);
          }
        }
      } else if (matchesToken(spec, t) != (spec.quantifier() == Quantifier.NEGATED)) {
        next.set(t + 1);
      }
    }
    return next;
  }

  /**
   * Check whether a token satisfies every constraint of a spec.
   * The empty spec is satisfied by every token.
   */
  private boolean matchesToken(TokenSpec spec, int token) {
    byte[] cache = tokenMatches.computeIfAbsent(spec, s -> new byte[projector.tokens().size()]);
    if (cache[token] == 0) {
      boolean matches = true;
      for (AttributeKey key : spec.attributes()) {
        AttributeProjection projection = projector.project(key);
        if (!spec.matches(key, projection.valueOf(token))) {
          matches = false;
          break;
        }
      }
      cache[token] = matches ? (byte) 1 : (byte) 2;
    }
    return cache[token] == 1;
  }

  /**
   * <p>
   *   Check whether a free-text expression covers exactly the tokens {@code [first, end)}
   *   of the natural text: some match of the expression starts inside the first token
   *   and ends inside the last one. An anchored expression must start at the start of the
   *   first token, or end at the end of the last one.
   * </p>
   *
   * <p>
   *   When the expression covers more than one token, it must consume at least one
   *   character of both the first and the last token.
   * </p>
   */
  private boolean coversText(RegexPredicate expression, int first, int end) {
    long rangeKey = ((long) first << 32) | end;
    Map<Long, Boolean> cache = textMatches.computeIfAbsent(expression, e -> new HashMap<>());
    Boolean cached = cache.get(rangeKey);
    if (cached != null) {
      return cached;
    }

    AttributeProjection text = projector.project(FREE_TEXT);
    int last = end - 1;
    boolean spansTokens = last > first;
    int startLow = text.offsetOf(first);
    int startHigh = spansTokens ? text.valueEndOf(first) - 1 : text.valueEndOf(first);
    int endHigh = text.valueEndOf(last);
    int endLow = spansTokens ? text.offsetOf(last) + 1 : text.offsetOf(last);
    if (expression.isAnchoredStart()) {
      startHigh = Math.min(startHigh, startLow);
    }
    if (expression.isAnchoredEnd()) {
      endLow = Math.max(endLow, endHigh);
    }

    boolean covers = false;
    java.util.regex.Matcher m = expression.bodyPattern().matcher(text.text());
    m.useTransparentBounds(true);
    m.useAnchoringBounds(false);
    for (int s = startLow; s <= startHigh && !covers; ++s) {
      for (int e = Math.max(s, endLow); e <= endHigh && !covers; ++e) {
        m.region(s, e);
        covers = m.matches();
      }
    }
    cache.put(rangeKey, covers);
    return covers;
  }
}
