package com.squareup.tspan;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

import static com.squareup.tspan.Patterns.pattern;
import static com.squareup.tspan.Patterns.patterns;
import static com.squareup.tspan.Patterns.spec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test detecting noun and verb phrases from universal POS tags.
 */
class PhraseDetectorTest {

  @Test
  void nounPhrases() {
    assertEquals(Collections.singletonList(new TokenSpan(0, 3)),
        PhraseDetector.nounPhrases().detect(Tokens.tagged("the/DET big/ADJ dog/NOUN barked/VERB")));
  }

  @Test
  void nounPhraseWithLinker() {
    assertEquals(Collections.singletonList(new TokenSpan(0, 4)),
        PhraseDetector.nounPhrases().detect(Tokens.tagged("big/ADJ and/CCONJ small/ADJ dogs/NOUN")));
  }

  @Test
  void separateNounPhrases() {
    assertEquals(Arrays.asList(new TokenSpan(0, 2), new TokenSpan(3, 5)),
        PhraseDetector.nounPhrases().detect(
            Tokens.tagged("the/DET cat/NOUN saw/VERB a/DET bird/NOUN")));
  }

  @Test
  void verbPhrases() {
    assertEquals(Collections.singletonList(new TokenSpan(2, 4)),
        PhraseDetector.verbPhrases().detect(Tokens.tagged("the/DET dog/NOUN has/AUX barked/VERB")));
  }

  @Test
  void customPatterns() {
    PhraseDetector numbers = new PhraseDetector("numbers", patterns(pattern(spec("POS", "NUM", "OP", "+"))));
    assertEquals("numbers", numbers.name);
    assertEquals(Collections.singletonList(new TokenSpan(1, 3)),
        numbers.detect(Tokens.tagged("the/DET 3/NUM 4/NUM cats/NOUN")));
  }

  @Test
  void untaggedTokens() {
    assertThrows(MissingAnnotationException.class,
        () -> PhraseDetector.nounPhrases().detect(Tokens.text("the big dog")));
  }
}
