package com.squareup.tspan;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import static com.squareup.tspan.Patterns.spec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test parsing pattern literals into {@link TokenSpec}s.
 */
@SuppressWarnings("InnerClassMayBeStatic")
public class PatternParserTest {

  private static final AttributeKey LOWER = AttributeKey.of(Attribute.LOWER);

  @Nested
  class ValidTest {

    @Test
    void literal() {
      List<TokenSpec> specs = PatternParser.parse(Collections.singletonList(spec("LOWER", "a")));
      assertEquals(1, specs.size());
      assertEquals(Quantifier.ONE, specs.get(0).quantifier());
      assertEquals(Collections.singletonList(new EqualsPredicate("a")), specs.get(0).predicates(LOWER));
    }

    @Test
    void namesAreCaseInsensitive() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(spec("lower", "a", "op", "+"))).get(0);
      assertEquals(Quantifier.ONE_OR_MORE, spec.quantifier());
      assertTrue(spec.constrains(LOWER));
    }

    @Test
    void sentStartAlias() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(spec("SENT_START", true))).get(0);
      assertEquals(Collections.singletonList(new EqualsPredicate("True")),
          spec.predicates(AttributeKey.of(Attribute.IS_SENT_START)));
    }

    @Test
    void literalsAreRendered() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(
          spec("IS_DIGIT", false, "TEXT", 42L))).get(0);
      assertEquals(Collections.singletonList(new EqualsPredicate("False")),
          spec.predicates(AttributeKey.of(Attribute.IS_DIGIT)));
      assertEquals(Collections.singletonList(new EqualsPredicate("42")),
          spec.predicates(AttributeKey.of(Attribute.TEXT)));
    }

    @Test
    void lengthLiteralIsEquality() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(spec("LENGTH", 3))).get(0);
      assertEquals(Collections.singletonList(new ComparisonPredicate(ComparisonPredicate.Operator.EQ, 3)),
          spec.predicates(AttributeKey.of(Attribute.LENGTH)));
    }

    @Test
    void predicateMap() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(
          spec("LENGTH", spec(">=", 2, "<", 5)))).get(0);
      assertEquals(Arrays.asList(
          new ComparisonPredicate(ComparisonPredicate.Operator.GTE, 2),
          new ComparisonPredicate(ComparisonPredicate.Operator.LT, 5)),
          spec.predicates(AttributeKey.of(Attribute.LENGTH)));
    }

    @Test
    void setMembership() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(
          spec("LOWER", spec("NOT_IN", Arrays.asList("a", "the"))))).get(0);
      assertEquals(Collections.singletonList(new SetMemberPredicate(Arrays.asList("a", "the"), true)),
          spec.predicates(LOWER));
    }

    @Test
    void extensions() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(
          spec("_", spec("is_fruit", true, "color", spec("IN", Arrays.asList("red", "green")))))).get(0);
      assertTrue(spec.constrains(AttributeKey.extension("is_fruit")));
      assertTrue(spec.constrains(AttributeKey.extension("color")));
      assertEquals(2, spec.attributes().size());
    }

    @Test
    void freeText() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(spec("REGEX", "New\\s+York", "OP", "?"))).get(0);
      assertTrue(spec.isFreeText());
      assertEquals("New\\s+York", spec.freeText().source);
    }

    @Test
    void emptySpecIsAnyToken() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(spec("OP", "*"))).get(0);
      assertTrue(spec.isEmpty());
      assertEquals(Quantifier.ZERO_OR_MORE, spec.quantifier());
    }

    @Test
    void tokenSpecToString() {
      TokenSpec spec = PatternParser.parse(Collections.singletonList(spec("LOWER", "a", "OP", "+"))).get(0);
      assertEquals("{LOWER: \"a\", OP: +}", spec.toString());
    }
  }

  /**
   * Every pattern here is rejected.
   */
  @TestFactory
  Iterable<DynamicTest> invalidPatterns() {
    return Arrays.asList(
        invalid("empty pattern", Collections.emptyList()),
        invalid("null pattern", null),
        invalid("not a map", Collections.singletonList("LOWER")),
        invalid("unknown attribute", Collections.singletonList(spec("FOO", "x"))),
        invalid("unknown op", Collections.singletonList(spec("LOWER", "a", "OP", "{2}"))),
        invalid("non-string op", Collections.singletonList(spec("LOWER", "a", "OP", 1))),
        invalid("floating point literal", Collections.singletonList(spec("LOWER", 1.5))),
        invalid("list literal", Collections.singletonList(spec("LOWER", Arrays.asList("a", "b")))),
        invalid("null literal", Collections.singletonList(spec("LOWER", null))),
        invalid("unknown predicate", Collections.singletonList(spec("LOWER", spec("MATCHES", "a")))),
        invalid("empty predicate map", Collections.singletonList(spec("LOWER", Collections.emptyMap()))),
        invalid("set membership of a string", Collections.singletonList(spec("LOWER", spec("IN", "a")))),
        invalid("non-integer comparison", Collections.singletonList(spec("LENGTH", spec(">=", "3")))),
        invalid("string length", Collections.singletonList(spec("LENGTH", "3"))),
        invalid("integer out of range", Collections.singletonList(spec("LENGTH", 1L << 40))),
        invalid("non-string predicate regex", Collections.singletonList(spec("LOWER", spec("REGEX", 1)))),
        invalid("non-string free text", Collections.singletonList(spec("REGEX", 1))),
        invalid("free text with another attribute", Collections.singletonList(spec("REGEX", "a", "LOWER", "a"))),
        invalid("negated free text", Collections.singletonList(spec("REGEX", "a", "OP", "!"))),
        invalid("extensions not a map", Collections.singletonList(spec("_", "is_fruit")))
    );
  }

  private static DynamicTest invalid(String name, /* @Nullable */ List<?> pattern) {
    return DynamicTest.dynamicTest(name, () ->
        assertThrows(InvalidPatternException.class, () -> PatternParser.parse(pattern)));
  }

  @Test
  void invalidRegexKeepsItsCause() {
    InvalidPatternException e = assertThrows(InvalidPatternException.class, () ->
        PatternParser.parse(Arrays.asList(spec("LOWER", "a"), spec("LOWER", spec("REGEX", "(")))));
    assertTrue(e.getMessage().startsWith("Token spec #1: "), e.getMessage());
    assertTrue(e.getCause() instanceof PatternSyntaxException);
  }
}
