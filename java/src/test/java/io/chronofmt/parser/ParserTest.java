package io.chronofmt.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.chronofmt.ErrorKind;
import io.chronofmt.InvalidFormatDescriptionException;
import io.chronofmt.Span;
import io.chronofmt.ast.ComponentItem;
import io.chronofmt.ast.ComponentKind;
import io.chronofmt.ast.Count;
import io.chronofmt.ast.FirstItem;
import io.chronofmt.ast.FormatItem;
import io.chronofmt.ast.HourRepr;
import io.chronofmt.ast.LiteralItem;
import io.chronofmt.ast.ModifierKey;
import io.chronofmt.ast.MonthRepr;
import io.chronofmt.ast.OptionalItem;
import io.chronofmt.ast.Padding;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ParserTest {

  @Test
  void testParseDate() throws InvalidFormatDescriptionException {
    List<FormatItem> items = Parser.parse("[year]-[month]-[day]", 1);
    assertEquals(5, items.size());
    assertEquals(ComponentKind.YEAR, component(items.get(0)).spec().kind());
    assertEquals(new LiteralItem("-"), items.get(1));
    assertEquals(ComponentKind.MONTH, component(items.get(2)).spec().kind());
    assertEquals(ComponentKind.DAY, component(items.get(4)).spec().kind());
  }

  @Test
  void testEmptyDescription() throws InvalidFormatDescriptionException {
    assertTrue(Parser.parse("", 1).isEmpty());
    assertTrue(Parser.parse("", 2).isEmpty());
  }

  @Test
  void testVersionDirective() throws InvalidFormatDescriptionException {
    Parser.Compiled compiled = Parser.compile("version = 2, [day]", 1);
    assertEquals(2, compiled.version());
    assertEquals(1, compiled.items().size());

    compiled = Parser.compile("version=1,[day]", 2);
    assertEquals(1, compiled.version());
    assertEquals(1, compiled.items().size());
  }

  @Test
  void testVersionWithoutEqualsIsLiteral() throws InvalidFormatDescriptionException {
    Parser.Compiled compiled = Parser.compile("version [day]", 2);
    assertEquals(2, compiled.version());
    assertEquals(new LiteralItem("version "), compiled.items().get(0));
    assertEquals(2, compiled.items().size());
  }

  @Test
  void testDefaultVersionMustBeKnown() {
    assertThrows(IllegalArgumentException.class, () -> Parser.compile("[day]", 3));
    assertThrows(IllegalArgumentException.class, () -> Parser.compile("[day]", 0));
  }

  @Test
  void testDoubledBracketIsLiteral() throws InvalidFormatDescriptionException {
    assertEquals(List.of(new LiteralItem("a[b")), Parser.parse("a[[b", 1));
    assertEquals(List.of(new LiteralItem("a[b")), Parser.parse("a[[b", 2));
  }

  @Test
  void testTopLevelClosingBracketIsLiteral() throws InvalidFormatDescriptionException {
    assertEquals(List.of(new LiteralItem("a]")), Parser.parse("a]", 1));
    assertEquals(List.of(new LiteralItem("a]")), Parser.parse("a]", 2));
  }

  @Test
  void testEscapes() throws InvalidFormatDescriptionException {
    assertEquals(List.of(new LiteralItem("[]\\")), Parser.parse("\\[\\]\\\\", 2));
    // no escapes in version 1
    List<FormatItem> items = Parser.parse("a\\[day]", 1);
    assertEquals(new LiteralItem("a\\"), items.get(0));
    assertEquals(2, items.size());
  }

  @Test
  void testNamesAreCaseInsensitive() throws InvalidFormatDescriptionException {
    ComponentItem item = component(Parser.parse("[MONTH Repr:SHORT]", 1).get(0));
    assertEquals(ComponentKind.MONTH, item.spec().kind());
    assertEquals(MonthRepr.SHORT, item.spec().get(ModifierKey.REPR, MonthRepr.class));
  }

  @Test
  void testDefaultsAreFilledIn() throws InvalidFormatDescriptionException {
    ComponentItem item = component(Parser.parse("[hour]", 1).get(0));
    assertEquals(Padding.ZERO, item.spec().padding());
    assertEquals(HourRepr.TWENTY_FOUR, item.spec().get(ModifierKey.REPR, HourRepr.class));
    assertFalse(item.spec().isExplicit(ModifierKey.PADDING));
  }

  @Test
  void testRepeatedModifierLastWins() throws InvalidFormatDescriptionException {
    ComponentItem item = component(Parser.parse("[day padding:space padding:none]", 1).get(0));
    assertEquals(Padding.NONE, item.spec().padding());
  }

  @Test
  void testExtraWhitespaceInsideBrackets() throws InvalidFormatDescriptionException {
    ComponentItem item = component(Parser.parse("[  ignore \t count:3  ]", 1).get(0));
    assertEquals(ComponentKind.IGNORE, item.spec().kind());
    assertEquals(new Count(3), item.spec().get(ModifierKey.COUNT, Count.class));
  }

  @Test
  void testOptional() throws InvalidFormatDescriptionException {
    List<FormatItem> items = Parser.parse("[optional [:[second]]]", 2);
    assertEquals(1, items.size());
    OptionalItem optional = assertInstanceOf(OptionalItem.class, items.get(0));
    assertEquals(2, optional.items().size());
    assertEquals(new LiteralItem(":"), optional.items().get(0));
  }

  @Test
  void testFirst() throws InvalidFormatDescriptionException {
    List<FormatItem> items = Parser.parse("[first [[hour]] [[hour repr:12]]]", 2);
    FirstItem first = assertInstanceOf(FirstItem.class, items.get(0));
    assertEquals(2, first.alternatives().size());
    ComponentItem second = component(first.alternatives().get(1).get(0));
    assertEquals(HourRepr.TWELVE, second.spec().get(ModifierKey.REPR, HourRepr.class));
  }

  @Test
  void testKeywordsAreCaseInsensitive() throws InvalidFormatDescriptionException {
    assertInstanceOf(OptionalItem.class, Parser.parse("[OPTIONAL [x]]", 2).get(0));
    assertInstanceOf(FirstItem.class, Parser.parse("[First [x] [y]]", 2).get(0));
  }

  @Test
  void testKeywordsAreComponentsInVersionOne() {
    InvalidFormatDescriptionException e =
        assertThrows(InvalidFormatDescriptionException.class, () -> Parser.parse("[optional]", 1));
    assertEquals(ErrorKind.INVALID_COMPONENT, e.kind());
    assertEquals(new Span(1, 9), e.span());
  }

  @Test
  void testNestingUpToLimit() throws InvalidFormatDescriptionException {
    List<FormatItem> items = Parser.parse(nested(Parser.MAX_NESTING_DEPTH), 2);
    FormatItem item = items.get(0);
    for (int i = 0; i < Parser.MAX_NESTING_DEPTH; i++) {
      item = assertInstanceOf(OptionalItem.class, item).items().get(0);
    }
    assertEquals(new LiteralItem("x"), item);
  }

  @Test
  void testNestingLimitExceeded() {
    InvalidFormatDescriptionException e =
        assertThrows(
            InvalidFormatDescriptionException.class,
            () -> Parser.parse(nested(Parser.MAX_NESTING_DEPTH + 1), 2));
    assertEquals(ErrorKind.NESTING_LIMIT_EXCEEDED, e.kind());
    assertEquals(new Span(352, 353), e.span());
  }

  @Test
  void testMissingWhitespaceAfterKeyword() {
    assertError("[optional[x]]", ErrorKind.EXPECTED_WHITESPACE_AFTER_OPTIONAL, 9, 10);
    assertError("[first[x]]", ErrorKind.EXPECTED_WHITESPACE_AFTER_FIRST, 6, 7);
  }

  @Test
  void testNestedDescriptionErrors() {
    assertError("[optional x]", ErrorKind.EXPECTED_OPENING_BRACKET, 10, 11);
    assertError("[optional [x]", ErrorKind.UNCLOSED_BRACKET, 0, 1);
    assertError("[optional [x", ErrorKind.UNCLOSED_BRACKET, 10, 11);
    assertError("[optional [x] y]", ErrorKind.UNEXPECTED_TOKEN, 14, 15);
    assertError("[optional ", ErrorKind.UNCLOSED_BRACKET, 0, 1);
  }

  @Test
  void testUnclosedBracket() {
    assertError("[", ErrorKind.UNCLOSED_BRACKET, 0, 1);
    assertError("ab[day", ErrorKind.UNCLOSED_BRACKET, 2, 3);
    assertError("[day padding:zero", ErrorKind.UNCLOSED_BRACKET, 0, 1);
  }

  @Test
  void testModifierErrors() {
    assertError("[day padding]", ErrorKind.EXPECTED_MODIFIER_VALUE, 5, 12);
    assertError("[day padding:]", ErrorKind.EXPECTED_MODIFIER_VALUE, 12, 13);
    assertError("[day padding:wide]", ErrorKind.INVALID_MODIFIER_VALUE, 13, 17);
    assertError("[hour case:upper]", ErrorKind.INVALID_MODIFIER_KEY, 6, 10);
  }

  @Test
  void testVersionErrors() {
    assertError("version = 3, [day]", ErrorKind.INVALID_FORMAT_DESCRIPTION_VERSION, 10, 11);
    assertError("version = , x", ErrorKind.UNEXPECTED_TOKEN, 10, 11);
  }

  @Test
  void testDisplayRich() {
    InvalidFormatDescriptionException e =
        assertThrows(InvalidFormatDescriptionException.class, () -> Parser.parse("[foo]", 1));
    assertEquals(
        "error: invalid component `foo` at byte index 1\n  [foo]\n   ^^^", e.displayRich());
  }

  // Helper methods

  private static ComponentItem component(FormatItem item) {
    return assertInstanceOf(ComponentItem.class, item);
  }

  private static String nested(int depth) {
    return "[optional [".repeat(depth) + "x" + "]]".repeat(depth);
  }

  private static void assertError(String description, ErrorKind kind, int start, int end) {
    InvalidFormatDescriptionException e =
        assertThrows(
            InvalidFormatDescriptionException.class,
            () -> Parser.parse(description, 2),
            description);
    assertEquals(kind, e.kind(), e.displayRich());
    assertEquals(new Span(start, end), e.span(), e.displayRich());
  }
}
