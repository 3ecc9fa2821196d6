package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * <p>
 *   Detects phrases as the non-overlapping matches of a single set of patterns over
 *   part-of-speech tags. The presets {@link #nounPhrases()} and {@link #verbPhrases()}
 *   use universal POS tags, so the tokens must be tagged with those.
 * </p>
 */
public class PhraseDetector {

  /** The patterns of a noun phrase: modifiers, an optional linker, and a nominal head. */
  public static final List<List<Map<String, Object>>> NOUN_PHRASE_PATTERNS = List.of(List.of(
      Map.of("POS", Map.of("IN", List.of("ADJ", "ADV", "DET", "NUM", "PROPN")), "OP", "*"),
      Map.of("POS", Map.of("IN", List.of("ADP", "CONJ", "CCONJ")), "OP", "?"),
      Map.of("POS", Map.of("IN", List.of("ADJ", "ADP", "ADV", "NOUN", "NUM", "PRON", "PROPN")),
          "OP", "+")));

  /** The patterns of a verb phrase: a run of verbs, auxiliaries, particles and adverbs. */
  public static final List<List<Map<String, Object>>> VERB_PHRASE_PATTERNS = List.of(List.of(
      Map.of("POS", Map.of("IN", List.of("ADV", "AUX", "PART", "VERB")), "OP", "+")));

  /** Phrases in document order: by start, then longest first. */
  private static final Comparator<TokenSpan> DOCUMENT_ORDER =
      Comparator.comparingInt(TokenSpan::getBeginInclusive).thenComparingInt(s -> -s.length());

  /** The name of the kind of phrase we detect. */
  public final String name;

  /** The registry holding our single rule. */
  private final RuleRegistry registry = new RuleRegistry();

  /**
   * Create a phrase detector.
   *
   * @param name The name of the kind of phrase; e.g., "noun_phrases".
   * @param patterns The patterns of a phrase.
   *
   * @throws InvalidPatternException If any of the patterns is invalid.
   */
  public PhraseDetector(String name, List<? extends List<? extends Map<String, ?>>> patterns) {
    this.name = name;
    this.registry.add(name, patterns, null);
  }

  /** @return A detector of noun phrases. */
  public static PhraseDetector nounPhrases() {
    return new PhraseDetector("noun_phrases", NOUN_PHRASE_PATTERNS);
  }

  /** @return A detector of verb phrases. */
  public static PhraseDetector verbPhrases() {
    return new PhraseDetector("verb_phrases", VERB_PHRASE_PATTERNS);
  }

  /**
   * Find the phrases of a token sequence. A match ending at or before the end of the
   * previously kept phrase is skipped.
   *
   * @param tokens The tokens, tagged with universal POS tags.
   *
   * @return The phrases, in document order.
   *
   * @throws MissingAnnotationException If the tokens are not tagged.
   */
  public List<TokenSpan> detect(List<? extends InputToken> tokens) {
    List<TokenSpan> phrases = new ArrayList<>();
    int lastEnd = 0;
    for (Match match : registry.call(tokens)) {
      if (lastEnd >= match.end) {
        continue;
      }
      lastEnd = match.end;
      phrases.add(match.span());
    }
    phrases.sort(DOCUMENT_ORDER);
    return phrases;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "PhraseDetector[" + name + "]";
  }
}
