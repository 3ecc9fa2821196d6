package com.squareup.tspan;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical attributes computed from the token text alone: lower case, shape, affixes
 * and the {@code IS_*} / {@code LIKE_*} flags. Token implementations without a
 * richer source of truth (e.g., {@link MapInputToken}) fall back on these.
 */
final class LexicalFeatures {

  /** A loose check for URL-looking tokens. */
  private static final Pattern URL = Pattern.compile(
      "(?i)^(?:(?:https?|ftp)://|www\\.)\\S+$|^[a-z0-9.-]+\\.(?:com|org|net|edu|gov|io|co|uk|de|it|fr)(?:/\\S*)?$");

  /** A loose check for email-looking tokens. */
  private static final Pattern EMAIL = Pattern.compile(
      "^[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)+$");

  /** Number-like tokens: digits with optional separators, or simple fractions. */
  private static final Pattern NUMBER = Pattern.compile(
      "^[+-]?(?:\\d+(?:[.,]\\d+)*|\\d+/\\d+)$");

  /** English number words, for {@link Attribute#LIKE_NUM}. */
  private static final Pattern NUMBER_WORD = Pattern.compile(
      "(?i)^(?:zero|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve|thirteen"
          + "|fourteen|fifteen|sixteen|seventeen|eighteen|nineteen|twenty|thirty|forty|fifty"
          + "|sixty|seventy|eighty|ninety|hundred|thousand|million|billion|trillion)$");

  private static final String LEFT_PUNCT = "([{«‘“‹";
  private static final String RIGHT_PUNCT = ")]}»’”›";
  private static final String BRACKETS = "()[]{}<>";
  private static final String QUOTES = "\"'`«»‘’‚‛“”„‹›";

  private LexicalFeatures() {}

  /**
   * Derive the value of a lexical attribute from the token text.
   *
   * @param attribute The attribute to derive.
   * @param text The token text.
   *
   * @return The derived value, or null if the attribute cannot be derived from the
   *         text alone (e.g., {@link Attribute#POS}).
   */
  static /* @Nullable */ String derive(Attribute attribute, String text) {
    switch (attribute) {
      case ORTH:
      case TEXT:
      case REGEX:
        return text;
      case LOWER:
      case NORM:
        return text.toLowerCase(Locale.ROOT);
      case SHAPE:
        return shape(text);
      case PREFIX:
        return text.isEmpty() ? "" : text.substring(0, text.offsetByCodePoints(0, 1));
      case SUFFIX:
        return suffix(text);
      case LENGTH:
        return Integer.toString(text.codePointCount(0, text.length()));
      case IS_ALPHA:
        return flag(!text.isEmpty() && text.codePoints().allMatch(Character::isLetter));
      case IS_ASCII:
        return flag(text.chars().allMatch(c -> c < 128));
      case IS_DIGIT:
        return flag(!text.isEmpty() && text.codePoints().allMatch(Character::isDigit));
      case IS_LOWER:
        return flag(hasCased(text) && text.equals(text.toLowerCase(Locale.ROOT)));
      case IS_UPPER:
        return flag(hasCased(text) && text.equals(text.toUpperCase(Locale.ROOT)));
      case IS_TITLE:
        return flag(isTitle(text));
      case IS_PUNCT:
        return flag(!text.isEmpty() && text.codePoints().allMatch(LexicalFeatures::isPunct));
      case IS_SPACE:
        return flag(!text.isEmpty() && text.codePoints().allMatch(Character::isWhitespace));
      case IS_BRACKET:
        return flag(text.length() == 1 && BRACKETS.indexOf(text.charAt(0)) >= 0);
      case IS_QUOTE:
        return flag(text.length() == 1 && QUOTES.indexOf(text.charAt(0)) >= 0);
      case IS_LEFT_PUNCT:
        return flag(text.length() == 1 && LEFT_PUNCT.indexOf(text.charAt(0)) >= 0);
      case IS_RIGHT_PUNCT:
        return flag(text.length() == 1 && RIGHT_PUNCT.indexOf(text.charAt(0)) >= 0);
      case IS_CURRENCY:
        return flag(!text.isEmpty() && text.codePoints()
            .allMatch(c -> Character.getType(c) == Character.CURRENCY_SYMBOL));
      case LIKE_NUM:
        return flag(NUMBER.matcher(text).matches() || NUMBER_WORD.matcher(text).matches());
      case LIKE_URL:
        return flag(URL.matcher(text).find());
      case LIKE_EMAIL:
        return flag(EMAIL.matcher(text).matches());
      case IS_STOP:
      case IS_SENT_START:
        return flag(false);
      default:
        return null;
    }
  }

  /** Render a boolean the way flags are projected. */
  static String flag(boolean value) {
    return value ? "True" : "False";
  }

  /**
   * The orthographic shape of a token: letters become x/X, digits become d, and
   * runs of the same character class longer than four are cut at four.
   */
  static String shape(String text) {
    StringBuilder b = new StringBuilder(text.length());
    char last = 0;
    int run = 0;
    for (int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      char mapped;
      if (Character.isLetter(c)) {
        mapped = Character.isUpperCase(c) ? 'X' : 'x';
      } else if (Character.isDigit(c)) {
        mapped = 'd';
      } else {
        mapped = c;
      }
      run = mapped == last ? run + 1 : 1;
      last = mapped;
      if (run <= 4) {
        b.append(mapped);
      }
    }
    return b.toString();
  }

  private static String suffix(String text) {
    int length = text.codePointCount(0, text.length());
    if (length <= 3) {
      return text;
    }
    return text.substring(text.offsetByCodePoints(0, length - 3));
  }

  private static boolean hasCased(String text) {
    return text.codePoints().anyMatch(c -> Character.isUpperCase(c) || Character.isLowerCase(c));
  }

  private static boolean isTitle(String text) {
    if (text.isEmpty() || !Character.isUpperCase(text.codePointAt(0))) {
      return false;
    }
    String rest = text.substring(text.offsetByCodePoints(0, 1));
    return rest.codePoints().noneMatch(Character::isUpperCase);
  }

  private static boolean isPunct(int c) {
    switch (Character.getType(c)) {
      case Character.CONNECTOR_PUNCTUATION:
      case Character.DASH_PUNCTUATION:
      case Character.START_PUNCTUATION:
      case Character.END_PUNCTUATION:
      case Character.INITIAL_QUOTE_PUNCTUATION:
      case Character.FINAL_QUOTE_PUNCTUATION:
      case Character.OTHER_PUNCTUATION:
        return true;
      default:
        return false;
    }
  }
}
