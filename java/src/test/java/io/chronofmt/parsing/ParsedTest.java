package io.chronofmt.parsing;

import static org.junit.jupiter.api.Assertions.*;

import io.chronofmt.ErrorKind;
import io.chronofmt.ParseFromDescriptionException;
import io.chronofmt.TryFromParsedException;
import io.chronofmt.ast.Weekday;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import org.junit.jupiter.api.Test;

public class ParsedTest {

  @Test
  void testSetSameValueTwice() throws ParseFromDescriptionException {
    Parsed parsed = new Parsed();
    parsed.set(ParsedField.DAY, 7, 0);
    parsed.set(ParsedField.DAY, 7, 5);
    assertEquals(7, parsed.getInt(ParsedField.DAY).getAsInt());
  }

  @Test
  void testSetConflictingValue() throws ParseFromDescriptionException {
    Parsed parsed = new Parsed();
    parsed.set(ParsedField.DAY, 7, 0);
    ParseFromDescriptionException e =
        assertThrows(ParseFromDescriptionException.class, () -> parsed.set(ParsedField.DAY, 8, 3));
    assertEquals(ErrorKind.INCONSISTENT_PARSED_FIELD, e.kind());
    assertEquals(3, e.offset());
    assertEquals(7, parsed.getInt(ParsedField.DAY).getAsInt());
  }

  @Test
  void testSetWrongType() {
    Parsed parsed = new Parsed();
    assertThrows(IllegalArgumentException.class, () -> parsed.set(ParsedField.YEAR, "2024", 0));
    assertThrows(IllegalArgumentException.class, () -> parsed.set(ParsedField.WEEKDAY, 3, 0));
    assertFalse(parsed.has(ParsedField.YEAR));
  }

  @Test
  void testCopyAndRestore() throws ParseFromDescriptionException {
    Parsed parsed = of(ParsedField.YEAR, 2024);
    Parsed snapshot = parsed.copy();
    parsed.set(ParsedField.MONTH, 3, 5);
    assertNotEquals(snapshot, parsed);

    parsed.restore(snapshot);
    assertEquals(snapshot, parsed);
    assertFalse(parsed.has(ParsedField.MONTH));
  }

  @Test
  void testDateFromCalendarFields() throws Exception {
    assertEquals(
        LocalDate.of(2024, 3, 7),
        of(ParsedField.YEAR, 2024, ParsedField.MONTH, 3, ParsedField.DAY, 7).toLocalDate());
    assertEquals(
        LocalDate.of(2024, 2, 29),
        of(ParsedField.YEAR, 2024, ParsedField.ORDINAL, 60).toLocalDate());
  }

  @Test
  void testDateFromCenturyAndLastTwo() throws Exception {
    Parsed parsed =
        of(
            ParsedField.YEAR_CENTURY, 19,
            ParsedField.YEAR_LAST_TWO, 99,
            ParsedField.MONTH, 12,
            ParsedField.DAY, 31);
    assertEquals(LocalDate.of(1999, 12, 31), parsed.toLocalDate());
  }

  @Test
  void testDateFromNegativeCentury() throws Exception {
    Parsed zeroCentury =
        of(
            ParsedField.YEAR_CENTURY, 0,
            ParsedField.YEAR_CENTURY_IS_NEGATIVE, true,
            ParsedField.YEAR_LAST_TWO, 23,
            ParsedField.MONTH, 3,
            ParsedField.DAY, 7);
    assertEquals(LocalDate.of(-23, 3, 7), zeroCentury.toLocalDate());

    Parsed signedCentury =
        of(
            ParsedField.YEAR_CENTURY, -1,
            ParsedField.YEAR_CENTURY_IS_NEGATIVE, true,
            ParsedField.YEAR_LAST_TWO, 23,
            ParsedField.ORDINAL, 1);
    assertEquals(LocalDate.ofYearDay(-123, 1), signedCentury.toLocalDate());

    Parsed positive =
        of(
            ParsedField.ISO_YEAR_CENTURY, 0,
            ParsedField.ISO_YEAR_CENTURY_IS_NEGATIVE, false,
            ParsedField.ISO_YEAR_LAST_TWO, 23,
            ParsedField.ISO_WEEK_NUMBER, 1,
            ParsedField.WEEKDAY, Weekday.MONDAY);
    assertEquals(23, positive.toLocalDate().get(IsoFields.WEEK_BASED_YEAR));
  }

  @Test
  void testDateFromIsoWeek() throws Exception {
    Parsed parsed =
        of(
            ParsedField.ISO_YEAR, 2020,
            ParsedField.ISO_WEEK_NUMBER, 53,
            ParsedField.WEEKDAY, Weekday.FRIDAY);
    assertEquals(LocalDate.of(2021, 1, 1), parsed.toLocalDate());

    Parsed noSuchWeek =
        of(
            ParsedField.ISO_YEAR, 2021,
            ParsedField.ISO_WEEK_NUMBER, 53,
            ParsedField.WEEKDAY, Weekday.FRIDAY);
    TryFromParsedException e = assertThrows(TryFromParsedException.class, noSuchWeek::toLocalDate);
    assertEquals(ErrorKind.COMPONENT_RANGE, e.kind());
  }

  @Test
  void testDateFromSundayAndMondayWeeks() throws Exception {
    // 2024-01-01 is a Monday, so its Sunday-based week is 0
    assertEquals(
        LocalDate.of(2024, 1, 1),
        of(
                ParsedField.YEAR, 2024,
                ParsedField.SUNDAY_WEEK_NUMBER, 0,
                ParsedField.WEEKDAY, Weekday.MONDAY)
            .toLocalDate());
    assertEquals(
        LocalDate.of(2024, 1, 7),
        of(
                ParsedField.YEAR, 2024,
                ParsedField.SUNDAY_WEEK_NUMBER, 1,
                ParsedField.WEEKDAY, Weekday.SUNDAY)
            .toLocalDate());
    assertEquals(
        LocalDate.of(2024, 1, 1),
        of(
                ParsedField.YEAR, 2024,
                ParsedField.MONDAY_WEEK_NUMBER, 1,
                ParsedField.WEEKDAY, Weekday.MONDAY)
            .toLocalDate());
  }

  @Test
  void testDateErrors() throws Exception {
    TryFromParsedException insufficient =
        assertThrows(TryFromParsedException.class, () -> of(ParsedField.YEAR, 2024).toLocalDate());
    assertEquals(ErrorKind.INSUFFICIENT_INFORMATION, insufficient.kind());

    Parsed feb29 = of(ParsedField.YEAR, 2023, ParsedField.MONTH, 2, ParsedField.DAY, 29);
    TryFromParsedException range = assertThrows(TryFromParsedException.class, feb29::toLocalDate);
    assertEquals(ErrorKind.COMPONENT_RANGE, range.kind());
  }

  @Test
  void testTimeFromTwelveHourClock() throws Exception {
    assertEquals(
        LocalTime.MIDNIGHT,
        of(ParsedField.HOUR_12, 12, ParsedField.HOUR_12_IS_PM, false).toLocalTime());
    assertEquals(
        LocalTime.of(13, 5),
        of(ParsedField.HOUR_12, 1, ParsedField.HOUR_12_IS_PM, true, ParsedField.MINUTE, 5)
            .toLocalTime());
    TryFromParsedException e =
        assertThrows(TryFromParsedException.class, () -> of(ParsedField.HOUR_12, 1).toLocalTime());
    assertEquals(ErrorKind.INSUFFICIENT_INFORMATION, e.kind());
  }

  @Test
  void testTimeDefaults() throws Exception {
    assertEquals(LocalTime.of(9, 0), of(ParsedField.HOUR_24, 9).toLocalTime());
    assertEquals(
        LocalTime.of(9, 30, 15, 5),
        of(
                ParsedField.HOUR_24, 9,
                ParsedField.MINUTE, 30,
                ParsedField.SECOND, 15,
                ParsedField.SUBSECOND, 5)
            .toLocalTime());
  }

  @Test
  void testZoneOffset() throws Exception {
    assertEquals(
        ZoneOffset.ofHoursMinutes(-5, -30),
        of(ParsedField.OFFSET_HOUR, -5, ParsedField.OFFSET_MINUTE, 30).toZoneOffset());
    assertEquals(
        ZoneOffset.ofTotalSeconds(-30 * 60),
        of(
                ParsedField.OFFSET_HOUR, 0,
                ParsedField.OFFSET_IS_NEGATIVE, true,
                ParsedField.OFFSET_MINUTE, 30)
            .toZoneOffset());
    TryFromParsedException e =
        assertThrows(
            TryFromParsedException.class, () -> of(ParsedField.OFFSET_HOUR, 25).toZoneOffset());
    assertEquals(ErrorKind.COMPONENT_RANGE, e.kind());
  }

  @Test
  void testLocalDateTime() throws Exception {
    Parsed parsed =
        of(
            ParsedField.YEAR, 2024,
            ParsedField.MONTH, 3,
            ParsedField.DAY, 7,
            ParsedField.HOUR_24, 13);
    assertEquals(LocalDateTime.of(2024, 3, 7, 13, 0), parsed.toLocalDateTime());
  }

  @Test
  void testOffsetDateTimeFromFields() throws Exception {
    Parsed parsed =
        of(
            ParsedField.YEAR, 2024,
            ParsedField.MONTH, 3,
            ParsedField.DAY, 7,
            ParsedField.HOUR_24, 13,
            ParsedField.OFFSET_HOUR, 2);
    assertEquals(
        OffsetDateTime.of(2024, 3, 7, 13, 0, 0, 0, ZoneOffset.ofHours(2)),
        parsed.toOffsetDateTime());
  }

  @Test
  void testOffsetDateTimeFromTimestamp() throws Exception {
    Parsed utc = of(ParsedField.UNIX_TIMESTAMP_NANOS, BigInteger.valueOf(-1));
    assertEquals(
        OffsetDateTime.of(1969, 12, 31, 23, 59, 59, 999_999_999, ZoneOffset.UTC),
        utc.toOffsetDateTime());

    Parsed shifted =
        of(ParsedField.UNIX_TIMESTAMP_NANOS, BigInteger.ZERO, ParsedField.OFFSET_HOUR, 1);
    assertEquals(
        OffsetDateTime.of(1970, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1)),
        shifted.toOffsetDateTime());
  }

  @Test
  void testTimestampOutOfRange() throws Exception {
    Parsed parsed = of(ParsedField.UNIX_TIMESTAMP_NANOS, BigInteger.TEN.pow(30));
    TryFromParsedException e = assertThrows(TryFromParsedException.class, parsed::toOffsetDateTime);
    assertEquals(ErrorKind.COMPONENT_RANGE, e.kind());
  }

  // Helper methods

  private static Parsed of(Object... fieldsAndValues) throws ParseFromDescriptionException {
    Parsed parsed = new Parsed();
    for (int i = 0; i < fieldsAndValues.length; i += 2) {
      parsed.set((ParsedField) fieldsAndValues[i], fieldsAndValues[i + 1], 0);
    }
    return parsed;
  }
}
