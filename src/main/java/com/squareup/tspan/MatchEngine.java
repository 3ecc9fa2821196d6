package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   Finds the spans of a token sequence matched by a {@link CompiledPattern}.
 * </p>
 *
 * <p>
 *   Matching narrows a set of candidates, each a window of tokens plus the spans of
 *   the anchor positions found so far. Initially the only candidate is the whole
 *   sequence. Each attribute pass runs its expression over the window of every
 *   candidate, finding every match (including overlapping ones), and turns each
 *   match into a narrower candidate. A match whose anchor positions disagree with
 *   the spans an earlier pass found for them is dropped.
 * </p>
 *
 * <p>
 *   The surviving windows are then checked by the {@link SpanVerifier}, and finally
 *   {@linkplain #filterSubmatches(Collection) submatches} are removed.
 * </p>
 *
 * <p>
 *   An engine belongs to a single matching call, and is not thread-safe.
 * </p>
 */
public final class MatchEngine {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

  /**
   * A window of tokens that may hold a match, with the anchor spans found in it.
   */
  private static final class Candidate {
    /** The first token of the window. */
    final int start;
    /** The end of the window, exclusive. */
    final int end;
    /** The span of each anchor position found so far, by position. */
    final Map<Integer, TokenSpan> anchors;

    Candidate(int start, int end, Map<Integer, TokenSpan> anchors) {
      this.start = start;
      this.end = end;
      this.anchors = anchors;
    }

    /** {@inheritDoc} */
    @Override public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Candidate that = (Candidate) o;
      return start == that.start && end == that.end && anchors.equals(that.anchors);
    }

    /** {@inheritDoc} */
    @Override public int hashCode() {
      return Objects.hash(start, end, anchors);
    }

    /** {@inheritDoc} */
    @Override public String toString() {
      return "[" + start + "," + end + ") " + anchors;
    }
  }

  /** The projections of the tokens we are matching. */
  private final AttributeProjector projector;

  /** The verifier for the final candidates. */
  private final SpanVerifier verifier;

  /**
   * Create an engine for one matching call.
   *
   * @param projector The projections of the tokens to match.
   */
  MatchEngine(AttributeProjector projector) {
    this.projector = projector;
    this.verifier = new SpanVerifier(projector);
  }

  /**
   * Find every span of a token sequence matched by a pattern.
   *
   * @param tokens The tokens to match.
   * @param pattern The pattern to match.
   * @param allowMissing If false, fail if the pattern references an attribute that has
   *                     to be annotated upstream, but no token carries it.
   *
   * @return The matched spans, in order of their start.
   *
   * @throws MissingAnnotationException If an attribute the pattern needs is not annotated.
   */
  public static List<TokenSpan> run(List<? extends InputToken> tokens, CompiledPattern pattern,
                                    boolean allowMissing) {
    return new MatchEngine(new AttributeProjector(tokens, allowMissing)).run(pattern);
  }

  /**
   * Find every span of our tokens matched by a pattern.
   *
   * @param pattern The pattern to match.
   *
   * @return The matched spans, in order of their start.
   */
  List<TokenSpan> run(CompiledPattern pattern) {
    int size = projector.tokens().size();
    if (size == 0) {
      return Collections.emptyList();
    }

    // Narrow the candidates, one attribute at a time
    Collection<Candidate> candidates =
        Collections.singletonList(new Candidate(0, size, Collections.emptyMap()));
    for (CompiledPattern.Pass pass : pattern.passes()) {
      AttributeProjection projection = projector.project(pass.key);
      Set<Candidate> narrowed = new LinkedHashSet<>();
      for (Candidate candidate : candidates) {
        scan(pass, projection, candidate, narrowed);
      }
      log.trace("{} pass of {} left {} candidates", pass.key, pattern, narrowed.size());
      if (narrowed.isEmpty()) {
        return Collections.emptyList();
      }
      candidates = narrowed;
    }

    // Verify the candidates
    List<TokenSpan> spans = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      int end = verifier.verify(pattern.specs(), candidate.start, candidate.end);
      if (end > candidate.start) {
        spans.add(new TokenSpan(candidate.start, end));
      } else {
        log.trace("Rejected candidate {} of {}", candidate, pattern);
      }
    }
    return filterSubmatches(spans);
  }

  /**
   * Run one attribute pass over the window of a candidate.
   *
   * @param pass The pass to run.
   * @param projection The projection of the pass's attribute.
   * @param candidate The candidate whose window we are scanning.
   * @param narrowed The set we add the narrower candidates to.
   */
  private void scan(CompiledPattern.Pass pass, AttributeProjection projection,
                    Candidate candidate, Set<Candidate> narrowed) {
    java.util.regex.Matcher m = pass.regex.matcher(projection.text());
    int from = projection.offsetOf(candidate.start);
    int to = projection.offsetOf(candidate.end);
    while (from < to) {
      m.region(from, to);
      if (!m.find()) {
        break;
      }
      from = m.start() + 1;  // overlapping matches
      if (m.end() == m.start()) {
        continue;  // an empty match of an all-optional pattern
      }
      int start = projection.tokenAtOrBefore(m.start());
      int end = projection.tokenAtOrAfter(m.end());
      if (end <= start) {
        continue;
      }

      // Check the anchors against the earlier passes
      Map<Integer, TokenSpan> anchors = candidate.anchors;
      boolean consistent = true;
      if (!projection.isFreeText() && pass.anchors.length > 0) {
        anchors = new HashMap<>(candidate.anchors);
        for (int position : pass.anchors) {
          String group = CompiledPattern.groupName(position);
          if (m.start(group) < 0) {
            continue;
          }
          TokenSpan span = new TokenSpan(
              projection.tokenAtOrBefore(m.start(group)),
              projection.tokenAtOrAfter(m.end(group)));
          TokenSpan earlier = anchors.putIfAbsent(position, span);
          if (earlier != null && !earlier.equals(span)) {
            consistent = false;
            break;
          }
        }
      }
      if (consistent) {
        narrowed.add(new Candidate(start, end, anchors));
      }
    }
  }

  /**
   * <p>
   *   Remove submatches from a collection of spans: identical spans are collapsed, and
   *   of the spans sharing an end, only the one starting first is kept.
   * </p>
   *
   * @param spans The spans to filter.
   *
   * @return The filtered spans, ordered by their start.
   */
  public static List<TokenSpan> filterSubmatches(Collection<TokenSpan> spans) {
    Map<Integer, TokenSpan> longestByEnd = new TreeMap<>();
    for (TokenSpan span : spans) {
      TokenSpan existing = longestByEnd.get(span.getEndExclusive());
      if (existing == null || span.getBeginInclusive() < existing.getBeginInclusive()) {
        longestByEnd.put(span.getEndExclusive(), span);
      }
    }
    List<TokenSpan> filtered = new ArrayList<>(longestByEnd.values());
    Collections.sort(filtered);
    return filtered;
  }
}
