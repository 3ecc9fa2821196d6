package com.squareup.tspan;

import edu.stanford.nlp.ling.CoreAnnotations;
import edu.stanford.nlp.ling.CoreLabel;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   An {@link InputToken} that wraps a CoreLabel. This is functionally
 *   a wrapper around {@link CoreLabel#get(Class)}, but (1) caches the common values
 *   locally to avoid expensive lookups, (2) maps the built-in {@link Attribute}s onto
 *   the CoreLabel annotations, and (3) exposes every other annotation as an extension,
 *   keyed by the simple name of its annotation class.
 * </p>
 *
 * <p>
 *   CoreNLP has a single tagger, so {@link Attribute#POS} and {@link Attribute#TAG}
 *   both return the {@linkplain CoreLabel#tag() tag}. Lexical attributes are derived
 *   from the original text.
 * </p>
 */
public class CoreLabelInputToken implements InputToken {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(CoreLabelInputToken.class);

  /**
   * The backing CoreLabel for this input token.
   */
  public final CoreLabel token;

  /**
   * The original text at this token, falling back to the word.
   * See {@link CoreLabel#originalText()} and {@link CoreLabel#word()}.
   */
  @Nullable private final String text;
  /** The part of speech tag at this token. See {@link CoreLabel#tag()}. */
  @Nullable private final String tag;
  /** The lemma at this token. See {@link CoreLabel#lemma()}. */
  @Nullable private final String lemma;
  /** The named entity tag at this token. See {@link CoreLabel#ner()}. */
  @Nullable private final String ner;
  /**
   * A cached version of all the annotations in the CoreLabel, mapped from both their
   * fully qualified class name as well as their simple class name, lower-cased. This is
   * null at construction time to cut down on the compute time and memory required,
   * since extensions are rarely used.
   */
  @Nullable private Map<String, Object> values = null;

  /**
   * Create an input token wrapping the given CoreLabel
   *
   * @param token The underlying CoreLabel to use for matching against this token.
   */
  public CoreLabelInputToken(CoreLabel token) {
    this.token = token;
    // CoreLabel#originalText() reads an absent annotation as "", so ask for it directly
    String originalText = token.get(CoreAnnotations.OriginalTextAnnotation.class);
    this.text = originalText != null ? originalText : token.word();
    this.tag = token.tag();
    this.lemma = token.lemma();
    this.ner = token.ner();
  }

  /**
   * Recompute the cached values in {@link #values}.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  private void populateValues() {
    values = new HashMap<>();
    for (Class key : token.keySet()) {
      Object value = token.get(key);
      if (value != null) {
        values.put(key.getSimpleName().toLowerCase(Locale.ROOT), value);
        values.put(key.getName().toLowerCase(Locale.ROOT), value);
      }
    }
  }

  /** {@inheritDoc} */
  @Override public @Nullable String get(Attribute attribute) {
    switch (attribute) {
      case ORTH:
      case TEXT:
      case REGEX:
        return text;
      case POS:
      case TAG:
        return tag;
      case LEMMA:
        return lemma;
      case ENT_TYPE:
        return ner;
      case IS_SENT_START:
        return LexicalFeatures.flag(token.index() == 1);
      case DEP:
      case MORPH:
      case LANG:
        return null;
      default:
        return text == null ? null : LexicalFeatures.derive(attribute, text);
    }
  }

  /** {@inheritDoc} */
  @Override public @Nullable Object getExtension(String name) {
    if (values == null) {
      populateValues();
    }
    Object value = values.get(name.toLowerCase(Locale.ROOT));
    if (value == null) {
      log.warn("[[Could not find value in CoreLabel for extension {}]]", name);
    }
    return value;
  }

  /** {@inheritDoc} */
  @Override public String whitespace() {
    String after = token.get(CoreAnnotations.AfterAnnotation.class);
    return after == null ? " " : after;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return token.toString();
  }
}
