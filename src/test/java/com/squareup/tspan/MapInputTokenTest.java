package com.squareup.tspan;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test the map-backed token, and the lexical attributes it derives from its text.
 */
@SuppressWarnings("InnerClassMayBeStatic")
class MapInputTokenTest {

  @Nested
  class LookupTest {

    @Test
    void keysAreCaseInsensitive() {
      MapInputToken token = new MapInputToken(Map.of("text", "Apple", "pos", "PROPN"));
      assertEquals("Apple", token.get(Attribute.TEXT));
      assertEquals("Apple", token.get(Attribute.ORTH));
      assertEquals("PROPN", token.get(Attribute.POS));
    }

    @Test
    void orthStandsInForText() {
      assertEquals("Apple", new MapInputToken(Map.of("ORTH", "Apple")).get(Attribute.TEXT));
    }

    @Test
    void explicitValuesWin() {
      MapInputToken token = new MapInputToken(Map.of("TEXT", "Apple", "LOWER", "fruit"));
      assertEquals("fruit", token.get(Attribute.LOWER));
    }

    @Test
    void annotatedAttributesAreNotDerived() {
      MapInputToken token = MapInputToken.of("Apple");
      assertNull(token.get(Attribute.POS));
      assertNull(token.get(Attribute.LEMMA));
      assertNull(token.get(Attribute.ENT_TYPE));
    }

    @Test
    void extensions() {
      MapInputToken token = MapInputToken.of("Apple").withExtension("is_fruit", true);
      assertEquals(true, token.getExtension("is_fruit"));
      assertNull(token.getExtension("color"));
      assertNull(MapInputToken.of("Apple").getExtension("is_fruit"));
    }

    @Test
    void withIsACopy() {
      MapInputToken token = MapInputToken.of("run");
      MapInputToken tagged = token.with(Attribute.POS, "VERB");
      assertNull(token.get(Attribute.POS));
      assertEquals("VERB", tagged.get(Attribute.POS));
      assertNotEquals(token, tagged);
      assertEquals(tagged, token.with(Attribute.POS, "VERB"));
    }

    @Test
    void whitespace() {
      List<MapInputToken> tokens = MapInputToken.sequence("a", "b");
      assertEquals(" ", tokens.get(0).whitespace());
      assertEquals("", tokens.get(1).whitespace());
      assertEquals(" ", MapInputToken.of("a").whitespace());
    }
  }

  @TestFactory
  Iterable<DynamicTest> lexicalAttributes() {
    return Arrays.asList(
        derives(Attribute.LOWER, "Apple", "apple"),
        derives(Attribute.NORM, "Apple", "apple"),
        derives(Attribute.SHAPE, "Apple", "Xxxxx"),
        derives(Attribute.SHAPE, "Mississippi", "Xxxxx"),
        derives(Attribute.SHAPE, "Hello123", "Xxxxxddd"),
        derives(Attribute.SHAPE, "U.S.", "X.X."),
        derives(Attribute.PREFIX, "Apple", "A"),
        derives(Attribute.SUFFIX, "Apple", "ple"),
        derives(Attribute.SUFFIX, "at", "at"),
        derives(Attribute.LENGTH, "Apple", "5"),
        derives(Attribute.IS_ALPHA, "Apple", "True"),
        derives(Attribute.IS_ALPHA, "R2D2", "False"),
        derives(Attribute.IS_DIGIT, "42", "True"),
        derives(Attribute.IS_DIGIT, "4.2", "False"),
        derives(Attribute.IS_ASCII, "café", "False"),
        derives(Attribute.IS_LOWER, "apple", "True"),
        derives(Attribute.IS_LOWER, "42", "False"),
        derives(Attribute.IS_UPPER, "NASA", "True"),
        derives(Attribute.IS_TITLE, "Apple", "True"),
        derives(Attribute.IS_TITLE, "APPLE", "False"),
        derives(Attribute.IS_PUNCT, "!", "True"),
        derives(Attribute.IS_PUNCT, "\"", "True"),
        derives(Attribute.IS_PUNCT, "a!", "False"),
        derives(Attribute.IS_BRACKET, "(", "True"),
        derives(Attribute.IS_QUOTE, "\"", "True"),
        derives(Attribute.IS_LEFT_PUNCT, "(", "True"),
        derives(Attribute.IS_RIGHT_PUNCT, "(", "False"),
        derives(Attribute.IS_CURRENCY, "$", "True"),
        derives(Attribute.LIKE_NUM, "42", "True"),
        derives(Attribute.LIKE_NUM, "1,000", "True"),
        derives(Attribute.LIKE_NUM, "ten", "True"),
        derives(Attribute.LIKE_NUM, "cat", "False"),
        derives(Attribute.LIKE_EMAIL, "jane@example.com", "True"),
        derives(Attribute.LIKE_EMAIL, "example.com", "False"),
        derives(Attribute.LIKE_URL, "www.example.com", "True"),
        derives(Attribute.LIKE_URL, "https://example.org/a", "True"),
        derives(Attribute.LIKE_URL, "example", "False"),
        derives(Attribute.IS_STOP, "the", "False")
    );
  }

  private static DynamicTest derives(Attribute attribute, String text, String expected) {
    return DynamicTest.dynamicTest(attribute + "(" + text + ")",
        () -> assertEquals(expected, MapInputToken.of(text).get(attribute)));
  }
}
