package com.squareup.tspan;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.squareup.tspan.Patterns.pattern;
import static com.squareup.tspan.Patterns.spec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test finding the spans of a single compiled pattern.
 */
@SuppressWarnings("InnerClassMayBeStatic")
class MatchEngineTest {

  private static List<TokenSpan> run(List<? extends InputToken> tokens, List<Map<String, ?>> pattern) {
    return MatchEngine.run(tokens, PatternCompiler.compile(pattern), false);
  }

  private static List<TokenSpan> spans(int... startEndPairs) {
    TokenSpan[] spans = new TokenSpan[startEndPairs.length / 2];
    for (int i = 0; i < spans.length; ++i) {
      spans[i] = new TokenSpan(startEndPairs[2 * i], startEndPairs[2 * i + 1]);
    }
    return Arrays.asList(spans);
  }

  @Nested
  class FilterSubmatchesTest {

    @Test
    void keepsEarliestStartPerEnd() {
      assertEquals(spans(0, 3, 2, 4),
          MatchEngine.filterSubmatches(spans(1, 3, 0, 3, 2, 3, 2, 4, 3, 4)));
    }

    @Test
    void collapsesDuplicates() {
      assertEquals(spans(0, 1), MatchEngine.filterSubmatches(spans(0, 1, 0, 1)));
    }

    @Test
    void ordersByStart() {
      assertEquals(spans(0, 5, 1, 2), MatchEngine.filterSubmatches(spans(1, 2, 0, 5)));
    }

    @Test
    void empty() {
      assertEquals(Collections.emptyList(), MatchEngine.filterSubmatches(Collections.emptyList()));
    }
  }

  @Nested
  class QuantifierTest {

    @Test
    void one() {
      assertEquals(spans(1, 2), run(Tokens.text("a b c"), pattern(spec("LOWER", "b"))));
    }

    @Test
    void oneOrMore() {
      assertEquals(spans(1, 3), run(Tokens.text("a b b c"), pattern(spec("LOWER", "b", "OP", "+"))));
    }

    @Test
    void zeroOrOne() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "a"), spec("LOWER", "b", "OP", "?"), spec("LOWER", "c"));
      assertEquals(spans(0, 2), run(Tokens.text("a c"), pattern));
      assertEquals(spans(0, 3), run(Tokens.text("a b c"), pattern));
      assertEquals(spans(), run(Tokens.text("a b b c"), pattern));
    }

    @Test
    void negatedConsumesOneToken() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "a"), spec("LOWER", "b", "OP", "!"));
      assertEquals(spans(0, 2), run(Tokens.text("a c a b"), pattern));
    }

    @Test
    void negatedConjunction() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "a"), spec("LOWER", "b", "IS_TITLE", true, "OP", "!"));
      assertEquals(spans(2, 4), run(Tokens.text("a B a b"), pattern));
    }

    @Test
    void negatedEmptySpecNeverMatches() {
      assertEquals(spans(), run(Tokens.text("a b"), pattern(spec("LOWER", "a"), spec("OP", "!"))));
    }

    @Test
    void adjacentRepetitions() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "a", "OP", "+"), spec("LOWER", "a", "OP", "*"));
      assertEquals(spans(0, 3), run(Tokens.text("a a a"), pattern));
    }
  }

  @Nested
  class MultipleAttributesTest {

    @Test
    void repetitionFollowedByTag() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "big", "OP", "+"), spec("POS", "NOUN"));
      assertEquals(spans(0, 3), run(Tokens.tagged("big/ADJ big/ADJ dog/NOUN"), pattern));
    }

    @Test
    void twoAttributesOnOnePosition() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "can", "POS", "VERB"));
      assertEquals(spans(3, 4), run(Tokens.tagged("a/DET can/NOUN of/ADP can/VERB"), pattern));
    }

    @Test
    void unconstrainedPositionsAgreeAcrossPasses() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "b"), spec("POS", "Y", "OP", "?"));
      assertEquals(spans(0, 1, 1, 3), run(Tokens.tagged("b/X b/X b/Y"), pattern));
    }

    @Test
    void extensionAndBuiltIn() {
      List<MapInputToken> tokens = Tokens.text("red apple green apple");
      tokens = Arrays.asList(tokens.get(0), tokens.get(1), tokens.get(2), tokens.get(3).withExtension("ripe", false));
      List<Map<String, ?>> pattern = pattern(spec("OP", "?"), spec("LOWER", "apple", "_", spec("ripe", false)));
      assertEquals(spans(2, 4), run(tokens, pattern));
    }
  }

  @Nested
  class RegexTest {

    @Test
    void tokenExpression() {
      List<Map<String, ?>> pattern = pattern(spec("TEXT", spec("REGEX", "^[Uu]\\.?[Ss]\\.?$")));
      assertEquals(spans(1, 2, 3, 4), run(Tokens.text("the U.S. and us"), pattern));
    }

    @Test
    void unanchoredTokenExpression() {
      assertEquals(spans(0, 1), run(Tokens.text("Running is fun"), pattern(spec("LOWER", spec("REGEX", "ing")))));
    }

    @Test
    void tokenExpressionStaysInsideTheToken() {
      assertEquals(spans(), run(Tokens.text("a b"), pattern(spec("TEXT", spec("REGEX", "a.b")))));
    }

    @Test
    void freeTextAcrossTokens() {
      List<Map<String, ?>> pattern = pattern(spec("REGEX", "New\\s+York"));
      assertEquals(spans(3, 5), run(Tokens.text("I live in New York now"), pattern));
    }

    @Test
    void freeTextWithinOneToken() {
      List<Map<String, ?>> pattern = pattern(spec("REGEX", "ork"));
      assertEquals(spans(4, 5), run(Tokens.text("I live in New York now"), pattern));
    }

    @Test
    void freeTextAfterAToken() {
      List<Map<String, ?>> pattern = pattern(spec("LOWER", "in"), spec("REGEX", "New\\s+York"));
      assertEquals(spans(2, 5), run(Tokens.text("I live in New York now"), pattern));
    }

    @Test
    void anchoredFreeText() {
      assertEquals(spans(), run(Tokens.text("a Newer York"), pattern(spec("REGEX", "^ewer"))));
      assertEquals(spans(1, 2), run(Tokens.text("a Newer York"), pattern(spec("REGEX", "^Newer$"))));
    }

    @Test
    void freeTextMustCoverWholeTokens() {
      assertEquals(spans(), run(Tokens.text("ab c"), pattern(spec("LOWER", "ab"), spec("REGEX", "^b"))));
    }
  }

  @Test
  void emptyTokens() {
    assertEquals(spans(), run(Collections.emptyList(), pattern(spec("LOWER", "a"))));
  }

  @Test
  void missingAnnotation() {
    assertThrows(MissingAnnotationException.class, () -> run(Tokens.text("a"), pattern(spec("POS", "X"))));
    assertEquals(spans(),
        MatchEngine.run(Tokens.text("a"), PatternCompiler.compile(pattern(spec("POS", "X"))), true));
  }
}
