package io.chronofmt;

import static org.junit.jupiter.api.Assertions.*;

import io.chronofmt.parsing.Parsed;
import io.chronofmt.parsing.ParsedField;
import io.chronofmt.render.TemporalValueProvider;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

/** Tests for the FormatDescription entry points. */
public class FormatDescriptionTest {
  private static final OffsetDateTime VALUE =
      OffsetDateTime.of(2024, 3, 7, 13, 5, 9, 120_000_000, ZoneOffset.ofHoursMinutes(-5, -30));

  @Test
  void testCompileDefaultsToVersionOne() throws InvalidFormatDescriptionException {
    assertEquals(1, FormatDescription.compile("[day]").version());
    assertEquals(2, FormatDescription.compile("[day]", 2).version());
    assertEquals(2, FormatDescription.compile("version = 2, [day]").version());
  }

  @Test
  void testConstant() {
    assertEquals("[day]", FormatDescription.constant("[day padding:zero]").toString());
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> FormatDescription.constant("[foo]"));
    assertTrue(e.getMessage().endsWith("^^^"), e.getMessage());
    assertInstanceOf(InvalidFormatDescriptionException.class, e.getCause());
  }

  @Test
  void testValidate() throws InvalidFormatDescriptionException {
    FormatDescription.validate("[hour]:[minute]");
    InvalidFormatDescriptionException e =
        assertThrows(
            InvalidFormatDescriptionException.class, () -> FormatDescription.validate("[hour"));
    assertEquals(ErrorKind.UNCLOSED_BRACKET, e.kind());

    FormatDescription.validate("[optional [[day]]]", 2);
    assertThrows(
        InvalidFormatDescriptionException.class,
        () -> FormatDescription.validate("[optional [[day]]]", 1));
    assertThrows(IllegalArgumentException.class, () -> FormatDescription.validate("[day]", 3));
  }

  @Test
  void testCompileStrftime() throws Exception {
    FormatDescription fd = FormatDescription.compileStrftime("%Y-%m-%dT%H:%M:%S%z");
    assertEquals(1, fd.version());
    assertEquals(
        "[year]-[month]-[day]T[hour]:[minute]:[second][offset_hour sign:mandatory][offset_minute]",
        fd.toString());
    assertEquals("2024-03-07T13:05:09-0530", fd.format(VALUE));
    assertEquals(VALUE.withNano(0), fd.parse("2024-03-07T13:05:09-0530").toOffsetDateTime());

    InvalidFormatDescriptionException e =
        assertThrows(
            InvalidFormatDescriptionException.class, () -> FormatDescription.compileStrftime("%Q"));
    assertEquals(ErrorKind.INVALID_COMPONENT, e.kind());
    assertEquals(new Span(1, 2), e.span());
  }

  @Test
  void testEqualityIgnoresSpelling() throws InvalidFormatDescriptionException {
    FormatDescription a = FormatDescription.compile("[day padding:zero]-[MONTH]");
    FormatDescription b = FormatDescription.compile("[day]-[month]");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, FormatDescription.compile("[day]/[month]"));
  }

  @Test
  void testFormatIsDeterministic() throws Exception {
    FormatDescription fd =
        FormatDescription.compile(
            "[year]-[month]-[day]T[hour]:[minute]:[second].[subsecond digits:3]"
                + "[offset_hour sign:mandatory]:[offset_minute]");
    String first = fd.format(VALUE);
    assertEquals("2024-03-07T13:05:09.120-05:30", first);
    assertEquals(first, fd.format(VALUE));
  }

  @Test
  void testFormatInto() throws Exception {
    FormatDescription fd = FormatDescription.compile("[month repr:short] [day padding:none]");
    StringBuilder out = new StringBuilder("on ");
    int written = fd.formatInto(out, TemporalValueProvider.of(VALUE));
    assertEquals("on Mar 7", out.toString());
    assertEquals(5, written);
  }

  @Test
  void testFormatThenParse() throws Exception {
    FormatDescription fd =
        FormatDescription.compile(
            "version = 2, [weekday repr:short] [day] [month repr:long] [year]"
                + "[optional [ [hour]:[minute]]]");
    LocalDate date = LocalDate.of(1999, 12, 31);
    String text = fd.format(date);
    assertEquals("Fri 31 December 1999", text);
    assertEquals(date, fd.parse(text).toLocalDate());

    LocalDateTime dateTime = LocalDateTime.of(2000, 1, 1, 0, 30);
    String withTime = fd.format(dateTime);
    assertEquals("Sat 01 January 2000 00:30", withTime);
    assertEquals(dateTime, fd.parse(withTime).toLocalDateTime());
  }

  @Test
  void testNegativeYearThroughCentury() throws Exception {
    FormatDescription fd =
        FormatDescription.compile(
            "[year repr:century range:standard][year repr:last_two]-[month]-[day]");
    LocalDate date = LocalDate.of(-23, 3, 7);
    String text = fd.format(date);
    assertEquals("-0023-03-07", text);
    Parsed parsed = fd.parse(text);
    assertEquals(0, parsed.getInt(ParsedField.YEAR_CENTURY).getAsInt());
    assertTrue(parsed.get(ParsedField.YEAR_CENTURY_IS_NEGATIVE, Boolean.class).orElseThrow());
    assertEquals(date, parsed.toLocalDate());

    assertEquals(LocalDate.of(23, 3, 7), fd.parse("+0023-03-07").toLocalDate());
    assertEquals(LocalDate.of(23, 3, 7), fd.parse("0023-03-07").toLocalDate());
  }

  @Test
  void testParseRejectsTrailingCharacters() throws InvalidFormatDescriptionException {
    FormatDescription fd = FormatDescription.compile("[day]");
    ParseFromDescriptionException e =
        assertThrows(ParseFromDescriptionException.class, () -> fd.parse("07x"));
    assertEquals(ErrorKind.UNEXPECTED_TRAILING_CHARACTERS, e.kind());
    assertEquals(2, e.offset());
  }

  @Test
  void testParsePartial() throws Exception {
    PartialParse partial = FormatDescription.compile("[day]").parsePartial("07x");
    assertEquals(2, partial.consumed());
    assertEquals(7, partial.parsed().getInt(ParsedField.DAY).getAsInt());
  }

  @Test
  void testFirstFallsBackInOrder() throws Exception {
    FormatDescription fd = FormatDescription.compile("[first [[hour repr:12]] [[hour]]]", 2);
    assertEquals(9, fd.parse("09").getInt(ParsedField.HOUR_12).getAsInt());
    assertFalse(fd.parse("09").has(ParsedField.HOUR_24));
    assertEquals(13, fd.parse("13").getInt(ParsedField.HOUR_24).getAsInt());
    assertFalse(fd.parse("13").has(ParsedField.HOUR_12));
  }

  @Test
  void testParseOffsetDateTime() throws Exception {
    FormatDescription fd =
        FormatDescription.compile(
            "[year]-[month]-[day] [hour repr:12]:[minute] [period] [offset_hour]:[offset_minute]");
    Parsed parsed = fd.parse("2024-03-07 01:05 PM -05:30");
    assertEquals(
        OffsetDateTime.of(2024, 3, 7, 13, 5, 0, 0, ZoneOffset.ofHoursMinutes(-5, -30)),
        parsed.toOffsetDateTime());
  }

  @Test
  void testErrorFamilies() {
    assertEquals(ErrorKind.Family.DESCRIPTION, ErrorKind.UNCLOSED_BRACKET.family());
    assertEquals(ErrorKind.Family.RUNTIME, ErrorKind.INVALID_LITERAL.family());
    assertEquals(ErrorKind.Family.CONVERSION, ErrorKind.COMPONENT_RANGE.family());
    assertEquals("unclosed_bracket", ErrorKind.UNCLOSED_BRACKET.toString());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            InvalidFormatDescriptionException.of(
                ErrorKind.INVALID_LITERAL, "not a description error", Span.at(0), "x"));
  }
}
