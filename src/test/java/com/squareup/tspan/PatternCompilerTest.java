package com.squareup.tspan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.squareup.tspan.Patterns.pattern;
import static com.squareup.tspan.Patterns.spec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test compiling patterns into attribute passes, and the position table they are
 * aligned with.
 */
@SuppressWarnings("InnerClassMayBeStatic")
class PatternCompilerTest {

  private static final AttributeKey LOWER = AttributeKey.of(Attribute.LOWER);
  private static final AttributeKey POS = AttributeKey.of(Attribute.POS);
  private static final AttributeKey REGEX = AttributeKey.of(Attribute.REGEX);

  private static PositionTable table(List<Map<String, ?>> pattern) {
    return new PositionTable(PatternParser.parse(pattern));
  }

  private static List<AttributeKey> passOrder(CompiledPattern compiled) {
    List<AttributeKey> keys = new ArrayList<>();
    for (CompiledPattern.Pass pass : compiled.passes()) {
      keys.add(pass.key);
    }
    return keys;
  }

  @Nested
  class PositionTableTest {

    @Test
    void negatedSingleAttribute() {
      PositionTable table = table(pattern(spec("LOWER", "a", "OP", "!")));
      assertTrue(table.constrains(0, LOWER));
      assertEquals(Quantifier.NEGATED, table.aligned(0, LOWER));
    }

    @Test
    void negatedConjunctionIsAnyToken() {
      PositionTable table = table(pattern(spec("LOWER", "a", "POS", "X", "OP", "!")));
      assertFalse(table.constrains(0, LOWER));
      assertFalse(table.constrains(0, POS));
      assertEquals(Quantifier.ONE, table.aligned(0, LOWER));
    }

    @Test
    void freeTextSpansAnyNumberOfTokens() {
      PositionTable table = table(pattern(spec("REGEX", "x", "OP", "?"), spec("REGEX", "y"), spec("LOWER", "a")));
      assertEquals(Quantifier.ZERO_OR_MORE, table.aligned(0, LOWER));
      assertEquals(Quantifier.ONE_OR_MORE, table.aligned(1, LOWER));
      assertEquals(Quantifier.ZERO_OR_ONE, table.aligned(0, REGEX));
      assertEquals(Quantifier.ONE, table.aligned(1, REGEX));
    }

    @Test
    void adjacentRepetitionsAreReluctant() {
      PositionTable table = table(pattern(spec("LOWER", "a", "OP", "+"), spec("LOWER", "b", "OP", "*")));
      assertTrue(table.isReluctant(0, LOWER));
      assertFalse(table.isReluctant(1, LOWER));
    }

    @Test
    void repetitionsOnDifferentAttributesAreGreedy() {
      PositionTable table = table(pattern(spec("LOWER", "a", "OP", "+"), spec("POS", "X", "OP", "*")));
      assertFalse(table.isReluctant(0, LOWER));
      assertFalse(table.isReluctant(0, POS));
    }

    @Test
    void repetitionBeforeOptionalIsGreedy() {
      PositionTable table = table(pattern(spec("LOWER", "a", "OP", "*"), spec("LOWER", "b", "OP", "?")));
      assertFalse(table.isReluctant(0, LOWER));
    }

    @Test
    void anchors() {
      PositionTable table = table(pattern(
          spec("LOWER", "a"),
          spec("LOWER", "b", "OP", "*"),
          spec("LOWER", "c", "OP", "+"),
          spec("POS", "X"),
          spec("LOWER", "d", "OP", "!")));
      assertArrayEquals(new int[]{0, 2, 3}, table.anchors(LOWER));
      assertArrayEquals(new int[]{0, 2, 3}, table.anchors(POS));
    }

    @Test
    void freeTextIsNeverAnAnchor() {
      assertArrayEquals(new int[]{0}, table(pattern(spec("LOWER", "a"), spec("REGEX", "x"))).anchors(LOWER));
    }

    @Test
    void freeTextHasNoAnchors() {
      assertArrayEquals(new int[0], table(pattern(spec("REGEX", "x"))).anchors(REGEX));
    }

    @Test
    void unconstrainedPatternReadsText() {
      assertEquals(Collections.singleton(AttributeKey.of(Attribute.TEXT)),
          table(pattern(spec(), spec("OP", "*"))).attributes());
    }
  }

  @Nested
  class CompileTest {

    @Test
    void singleLiteral() {
      CompiledPattern compiled = PatternCompiler.compile(pattern(spec("LOWER", "a")));
      assertEquals(1, compiled.passes().size());
      assertEquals("(?<tok0> (?:(?:\\Qa\\E))(?= |\\z))", compiled.passes().get(0).regex.pattern());
      assertArrayEquals(new int[]{0}, compiled.passes().get(0).anchors);
    }

    @Test
    void reluctantRepetition() {
      String regex = PatternCompiler.attributeRegex(
          table(pattern(spec("LOWER", "a", "OP", "+"), spec("LOWER", "b", "OP", "*"))), LOWER);
      assertTrue(regex.startsWith("(?<tok0>(?: (?:(?:\\Qa\\E))(?= |\\z))+?)"), regex);
      assertTrue(regex.endsWith("(?<tok1>(?: (?:(?:\\Qb\\E))(?= |\\z))*)"), regex);
    }

    @Test
    void negation() {
      String regex = PatternCompiler.attributeRegex(table(pattern(spec("LOWER", "a", "OP", "!"))), LOWER);
      assertEquals("(?<tok0>(?! (?:(?:\\Qa\\E))(?= |\\z)) [^ ]*(?= |\\z))", regex);
    }

    @Test
    void unconstrainedPositionIsAnyToken() {
      String regex = PatternCompiler.attributeRegex(
          table(pattern(spec("LOWER", "a"), spec("POS", "X", "OP", "?"))), LOWER);
      assertEquals("(?<tok0> (?:(?:\\Qa\\E))(?= |\\z))(?<tok1>(?: [^ ]*(?= |\\z))?)", regex);
    }

    @Test
    void freeTextPass() {
      String regex = PatternCompiler.freeTextRegex(table(pattern(spec("LOWER", "in"), spec("REGEX", "^New\\s+York"))));
      assertEquals("(?<tok0>\\S+?\\s*)(?<tok1>(?:New\\s+York)\\S*?\\s*)", regex);
    }

    @Test
    void passOrderIsTextFirst() {
      CompiledPattern compiled = PatternCompiler.compile(pattern(
          spec("POS", "NOUN"), spec("REGEX", "x"), spec("IS_TITLE", true), spec("LOWER", "a")));
      assertEquals(Arrays.asList(LOWER, POS, AttributeKey.of(Attribute.IS_TITLE), REGEX), passOrder(compiled));
    }

    @Test
    void builtInAttributes() {
      CompiledPattern compiled = PatternCompiler.compile(pattern(
          spec("POS", "NOUN"), spec("_", spec("is_fruit", true))));
      assertEquals(EnumSet.of(Attribute.POS), compiled.attributes());
    }

    @Test
    void emptyPattern() {
      assertThrows(InvalidPatternException.class, () -> PatternCompiler.compileSpecs(Collections.emptyList()));
    }

    @Test
    void specsAreKept() {
      CompiledPattern compiled = PatternCompiler.compile(pattern(spec("LOWER", "a"), spec("OP", "*")));
      assertEquals(2, compiled.specs().size());
      assertEquals(Quantifier.ZERO_OR_MORE, compiled.specs().get(1).quantifier());
    }
  }
}
