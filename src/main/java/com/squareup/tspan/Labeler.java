package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * <p>
 *   Labels spans of tokens with the key of the rule that matched them. Each rule of a
 *   labeler is a label with its patterns; labeling a token sequence collects every
 *   match as a {@link Labeling}, and every label on each token.
 * </p>
 *
 * <p>
 *   If only the longest labelings are kept, overlapping labelings are resolved: a
 *   labeling contained in another one is dropped, and two labelings overlapping tail to
 *   head are merged into one spanning both, with the label of the later one.
 * </p>
 */
public class Labeler {

  /**
   * The labelings of a token sequence.
   */
  public static final class Result {
    /** The labelings, in {@linkplain Labeling#DOCUMENT_ORDER document order}. */
    private final List<Labeling> labelings;
    /** The labels of each token, in the order they were found. */
    private final List<Set<String>> tokenLabels;

    Result(List<Labeling> labelings, List<Set<String>> tokenLabels) {
      this.labelings = Collections.unmodifiableList(labelings);
      this.tokenLabels = Collections.unmodifiableList(tokenLabels);
    }

    /** @return The labelings, in document order. */
    public List<Labeling> labelings() {
      return labelings;
    }

    /**
     * @param token The index of a token.
     *
     * @return The labels of every match covering that token.
     */
    public Set<String> labels(int token) {
      return tokenLabels.get(token);
    }

    /** {@inheritDoc} */
    @Override public String toString() {
      return labelings.toString();
    }
  }

  /** The rules, one per label. */
  private final RuleRegistry registry = new RuleRegistry();

  /** If true, resolve overlapping labelings. */
  private final boolean onlyLongest;

  /** Create a labeler keeping every labeling. */
  public Labeler() {
    this(false);
  }

  /**
   * Create a labeler.
   *
   * @param onlyLongest If true, resolve overlapping labelings.
   */
  public Labeler(boolean onlyLongest) {
    this.onlyLongest = onlyLongest;
  }

  /**
   * Add patterns for a label.
   *
   * @param label The label of spans matched by these patterns.
   * @param patterns The patterns.
   * @param callback A callback fired on matches of these patterns, or null.
   *
   * @throws InvalidPatternException If any of the patterns is invalid.
   */
  public void add(String label, List<? extends List<? extends Map<String, ?>>> patterns,
                  @Nullable MatchCallback callback) {
    registry.add(label, patterns, callback);
  }

  /**
   * Add patterns for a label.
   *
   * @see #add(String, List, MatchCallback)
   */
  public void add(String label, List<? extends List<? extends Map<String, ?>>> patterns) {
    add(label, patterns, null);
  }

  /** @return The registry holding our rules, e.g., to load rules into with a {@link PatternLoader}. */
  public RuleRegistry registry() {
    return registry;
  }

  /**
   * Label a token sequence.
   *
   * @param tokens The tokens to label.
   *
   * @return The labelings of the tokens.
   */
  public Result label(List<? extends InputToken> tokens) {
    List<Set<String>> tokenLabels = new ArrayList<>(tokens.size());
    for (int i = 0; i < tokens.size(); ++i) {
      tokenLabels.add(new LinkedHashSet<>());
    }
    List<Labeling> labelings = new ArrayList<>();
    for (Match match : registry.call(tokens)) {
      for (int i = match.start; i < match.end; ++i) {
        tokenLabels.get(i).add(match.key);
      }
      labelings.add(new Labeling(match.key, match.start, match.end));
    }
    if (onlyLongest) {
      labelings = fixOverlaps(labelings);
    }
    labelings.sort(Labeling.DOCUMENT_ORDER);
    List<Set<String>> frozen = new ArrayList<>(tokenLabels.size());
    for (Set<String> labels : tokenLabels) {
      frozen.add(Collections.unmodifiableSet(labels));
    }
    return new Result(labelings, frozen);
  }

  /**
   * Resolve overlapping labelings: contained labelings are dropped, and labelings
   * overlapping tail to head are merged, taking the label of the one starting later.
   *
   * @param labelings The labelings to resolve.
   *
   * @return The resolved labelings, without duplicates.
   */
  static List<Labeling> fixOverlaps(List<Labeling> labelings) {
    Set<Labeling> kept = new LinkedHashSet<>();
    for (Labeling span : labelings) {
      boolean keep = false;
      for (Labeling other : labelings) {
        if ((span.start == other.start && span.end == other.end)
            || span.start >= other.end || span.end <= other.start) {
          // Identical or disjoint
          keep = true;
          continue;
        }
        if ((span.start > other.start && span.end <= other.end)
            || (span.start >= other.start && span.end < other.end)) {
          // Contained in the other
          keep = false;
          break;
        }
        if (span.start < other.start && span.end > other.start && span.end < other.end) {
          // Our tail overlaps its head
          kept.add(new Labeling(other.label, span.start, other.end));
          keep = false;
          break;
        }
        if (span.start > other.start && span.start < other.end && span.end > other.end) {
          // Its tail overlaps our head
          kept.add(new Labeling(span.label, other.start, span.end));
          keep = false;
          break;
        }
      }
      if (keep) {
        kept.add(span);
      }
    }
    return new ArrayList<>(kept);
  }
}
