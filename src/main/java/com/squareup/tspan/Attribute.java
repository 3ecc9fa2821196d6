package com.squareup.tspan;

import java.util.Locale;

/**
 * <p>
 *   The closed set of built-in token attributes a pattern can constrain. Each
 *   attribute is read off an {@link InputToken} through
 *   {@link InputToken#get(Attribute)}; values outside this set live in the
 *   extension namespace (see {@link InputToken#getExtension(String)}).
 * </p>
 *
 * <p>
 *   <b>NOTE</b> Please update {@link LexicalFeatures#derive(Attribute, String)} if a
 *   new lexical constant is added.
 * </p>
 */
public enum Attribute {
  /** The verbatim token text. */
  ORTH(Kind.LEXICAL),
  /** The verbatim token text; a synonym of {@link #ORTH}. */
  TEXT(Kind.LEXICAL),
  /** The lower-cased token text. Matched case-insensitively. */
  LOWER(Kind.LEXICAL),
  /** The normalized form of the token. */
  NORM(Kind.LEXICAL),
  /** The lemma. Requires a lemmatizer upstream. */
  LEMMA(Kind.ANNOTATED),
  /** The coarse-grained part of speech. Requires a tagger upstream. */
  POS(Kind.ANNOTATED),
  /** The fine-grained part of speech. Requires a tagger upstream. */
  TAG(Kind.ANNOTATED),
  /** The morphological features. Requires a morphologizer upstream. */
  MORPH(Kind.ANNOTATED),
  /** The syntactic dependency label. Requires a parser upstream. */
  DEP(Kind.ANNOTATED),
  /** The named entity type, if any. */
  ENT_TYPE(Kind.PROVIDED),
  /** The orthographic shape; e.g., "Xxxx" or "dd". */
  SHAPE(Kind.LEXICAL),
  /** The first character of the token. */
  PREFIX(Kind.LEXICAL),
  /** The last three characters of the token. */
  SUFFIX(Kind.LEXICAL),
  /** The length of the token text. Projected as the text itself, case-insensitively. */
  LENGTH(Kind.LEXICAL),
  /** The language of the token. */
  LANG(Kind.PROVIDED),
  IS_ALPHA(Kind.FLAG),
  IS_ASCII(Kind.FLAG),
  IS_DIGIT(Kind.FLAG),
  IS_LOWER(Kind.FLAG),
  IS_UPPER(Kind.FLAG),
  IS_TITLE(Kind.FLAG),
  IS_PUNCT(Kind.FLAG),
  IS_SPACE(Kind.FLAG),
  IS_STOP(Kind.FLAG),
  IS_BRACKET(Kind.FLAG),
  IS_QUOTE(Kind.FLAG),
  IS_LEFT_PUNCT(Kind.FLAG),
  IS_RIGHT_PUNCT(Kind.FLAG),
  IS_CURRENCY(Kind.FLAG),
  IS_SENT_START(Kind.FLAG),
  LIKE_NUM(Kind.FLAG),
  LIKE_URL(Kind.FLAG),
  LIKE_EMAIL(Kind.FLAG),
  /**
   * The free-text pseudo-attribute. This reads the token text, but is matched
   * against the natural text of the document (tokens joined with their
   * original whitespace), so a single regular expression can span tokens.
   */
  REGEX(Kind.LEXICAL),
  ;

  /** How the value of an attribute comes to be. */
  enum Kind {
    /** Derivable from the token text alone. */
    LEXICAL,
    /** A True / False flag, mostly derivable from the token text. */
    FLAG,
    /** Set by the tokenizer if at all, but never required. */
    PROVIDED,
    /** Must have been computed by an upstream annotator before matching. */
    ANNOTATED,
  }

  /** See {@link Kind}. */
  final Kind kind;

  Attribute(Kind kind) {
    this.kind = kind;
  }

  /**
   * @return True if this attribute has to be computed by an upstream annotator (tagger,
   *         lemmatizer, parser...) before a pattern referencing it can be matched.
   */
  public boolean requiresAnnotation() {
    return kind == Kind.ANNOTATED;
  }

  /**
   * @return True if this attribute is a boolean flag, rendered as "True" or "False".
   */
  public boolean isFlag() {
    return kind == Kind.FLAG;
  }

  /**
   * @return True if values of this attribute are compared ignoring case.
   */
  public boolean isCaseInsensitive() {
    return this == LOWER || this == LENGTH;
  }

  /**
   * @return True if this is the {@link #REGEX} pseudo-attribute.
   */
  public boolean isFreeText() {
    return this == REGEX;
  }

  /**
   * The attribute whose value is actually projected for this attribute. Length
   * comparisons and free-text expressions both run over the token text.
   *
   * @return The attribute to read off the token.
   */
  Attribute valueSource() {
    switch (this) {
      case LENGTH:
        return LOWER;
      case REGEX:
        return TEXT;
      default:
        return this;
    }
  }

  /**
   * Look up an attribute by its name in a pattern. Lower-case names are accepted,
   * and a handful of aliases are resolved.
   *
   * @param name The attribute name, as it appears in a token spec.
   *
   * @return The attribute, or null if there is no such attribute.
   */
  static /* @Nullable */ Attribute forName(String name) {
    String upper = name.toUpperCase(Locale.ROOT);
    if ("SENT_START".equals(upper)) {
      return IS_SENT_START;
    }
    try {
      return Attribute.valueOf(upper);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
