package com.squareup.tspan;

import java.util.Arrays;
import java.util.List;

/**
 * <p>
 *   A whole-document string built from one attribute's values across all tokens,
 *   with the maps between token indices and character offsets in that string. This
 *   is what the per-attribute regular expressions of a {@link CompiledPattern} run
 *   over.
 * </p>
 *
 * <p>
 *   There are two layouts:
 * </p>
 *
 * <ol>
 *   <li>For most attributes, every token contributes one {@linkplain #SEPARATOR
 *       separator} followed by its value, so the offset of token <i>i</i> is the
 *       offset of its separator. Separators inside a value are replaced by
 *       {@link #SEPARATOR_SUBSTITUTE}, so there is exactly one separator per token
 *       whatever the attribute holds.</li>
 *   <li>For the free-text {@link Attribute#REGEX} pseudo-attribute, the token texts are
 *       concatenated with their original trailing whitespace, so offsets correspond
 *       to positions in the natural text.</li>
 * </ol>
 *
 * <p>
 *   In both layouts the offsets array has one entry per token plus a sentinel equal
 *   to the length of the text, and is strictly increasing (for the free-text layout,
 *   as long as no token is empty).
 * </p>
 */
public final class AttributeProjection {

  /** The character separating tokens in the non-free-text layout. */
  public static final char SEPARATOR = ' ';

  /** The character that replaces a {@link #SEPARATOR} occurring inside a value. */
  public static final char SEPARATOR_SUBSTITUTE = '\u00A0';

  /** The projected text. */
  private final String text;
  /** The start offset of each token, plus a sentinel at {@code text.length()}. */
  private final int[] offsets;
  /** The end offset of each token's value, excluding separators and whitespace. */
  private final int[] valueEnds;
  /** The (sanitized) value of each token. */
  private final String[] values;
  /** True if this is the natural-text layout. */
  private final boolean freeText;

  private AttributeProjection(String text, int[] offsets, int[] valueEnds, String[] values,
      boolean freeText) {
    this.text = text;
    this.offsets = offsets;
    this.valueEnds = valueEnds;
    this.values = values;
    this.freeText = freeText;
  }

  /**
   * Project an attribute over a token sequence.
   *
   * @param tokens The tokens of the document.
   * @param key The attribute to project.
   *
   * @return The projection of that attribute.
   */
  public static AttributeProjection project(List<? extends InputToken> tokens, AttributeKey key) {
    int size = tokens.size();
    int[] offsets = new int[size + 1];
    int[] valueEnds = new int[size];
    String[] values = new String[size];
    StringBuilder b = new StringBuilder();
    boolean freeText = key.isFreeText();
    for (int i = 0; i < size; ++i) {
      InputToken token = tokens.get(i);
      String value = key.valueOf(token);
      if (value == null) {
        value = "";
      }
      if (freeText) {
        offsets[i] = b.length();
        b.append(value);
        valueEnds[i] = b.length();
        b.append(token.whitespace());
      } else {
        value = sanitize(value);
        offsets[i] = b.length();
        b.append(SEPARATOR).append(value);
        valueEnds[i] = b.length();
      }
      values[i] = value;
    }
    offsets[size] = b.length();
    return new AttributeProjection(b.toString(), offsets, valueEnds, values, freeText);
  }

  /**
   * Replace separators inside a value, so the value reads as a single token.
   * Literals in patterns go through the same transformation.
   */
  static String sanitize(String value) {
    return value.indexOf(SEPARATOR) < 0 ? value : value.replace(SEPARATOR, SEPARATOR_SUBSTITUTE);
  }

  /** @return The projected text. */
  public String text() {
    return text;
  }

  /** @return The number of tokens projected. */
  public int size() {
    return values.length;
  }

  /** @return True if this is the natural-text layout of {@link Attribute#REGEX}. */
  public boolean isFreeText() {
    return freeText;
  }

  /**
   * @param tokenIndex A token index, between 0 and {@link #size()} inclusive.
   *
   * @return The character offset at which that token starts; for {@link #size()}, the
   *         length of the text.
   */
  public int offsetOf(int tokenIndex) {
    return offsets[tokenIndex];
  }

  /**
   * @param tokenIndex A token index.
   *
   * @return The character offset just past the value of that token.
   */
  public int valueEndOf(int tokenIndex) {
    return valueEnds[tokenIndex];
  }

  /**
   * @param tokenIndex A token index.
   *
   * @return The projected value of that token.
   */
  public String valueOf(int tokenIndex) {
    return values[tokenIndex];
  }

  /**
   * Map a character offset to the token it falls in: the last token starting at or
   * before the offset. This is how match starts are mapped back to tokens.
   *
   * @param offset A character offset in {@link #text()}.
   *
   * @return A token index between 0 and {@link #size()}.
   */
  public int tokenAtOrBefore(int offset) {
    int found = Arrays.binarySearch(offsets, offset);
    if (found >= 0) {
      return firstWithOffset(found);
    }
    return Math.max(0, -found - 2);
  }

  /**
   * Map a character offset to the first token boundary at or after it. This is how
   * match ends are mapped back to (exclusive) token indices.
   *
   * @param offset A character offset in {@link #text()}.
   *
   * @return A token index between 0 and {@link #size()}.
   */
  public int tokenAtOrAfter(int offset) {
    int found = Arrays.binarySearch(offsets, offset);
    if (found >= 0) {
      return firstWithOffset(found);
    }
    return Math.min(values.length, -found - 1);
  }

  /** Empty free-text tokens share an offset; resolve to the first of them. */
  private int firstWithOffset(int index) {
    while (index > 0 && offsets[index - 1] == offsets[index]) {
      index -= 1;
    }
    return index;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "\"" + text + "\"";
  }
}
