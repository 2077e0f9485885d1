package io.chronofmt.parsing;

import io.chronofmt.ParseFromDescriptionException;
import io.chronofmt.TryFromParsedException;
import io.chronofmt.ast.Weekday;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Conflict-checked accumulator of the field values decoded by a parse.
 *
 * <p>A field can be set any number of times to the same value. Setting it to a different value
 * fails. The conversion methods build {@code java.time} values from the collected fields.
 */
public final class Parsed {
  private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

  private final Map<ParsedField, Object> values = new EnumMap<>(ParsedField.class);

  /** Creates an empty accumulator. */
  public Parsed() {}

  /**
   * Stores a field value.
   *
   * @param field the field
   * @param value the value, of the field's {@link ParsedField#type()}
   * @param offset the input offset the value was read from, for error reporting
   * @throws ParseFromDescriptionException if the field already holds a different value
   */
  public void set(ParsedField field, Object value, int offset)
      throws ParseFromDescriptionException {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(value, "value");
    if (!field.type().isInstance(value)) {
      throw new IllegalArgumentException(
          field + " holds " + field.type().getSimpleName() + ", not " + value.getClass());
    }
    Object prev = values.putIfAbsent(field, value);
    if (prev != null && !prev.equals(value)) {
      throw ParseFromDescriptionException.inconsistentField(field.displayName(), offset);
    }
  }

  /**
   * Returns whether a field has been set.
   *
   * @param field the field
   * @return true if the field holds a value
   */
  public boolean has(ParsedField field) {
    return values.containsKey(field);
  }

  /**
   * Returns an integer field.
   *
   * @param field a field holding an {@link Integer}
   * @return the value, or empty if unset
   */
  public OptionalInt getInt(ParsedField field) {
    Object value = values.get(field);
    return value == null ? OptionalInt.empty() : OptionalInt.of((Integer) value);
  }

  /**
   * Returns a field value of any type.
   *
   * @param field the field
   * @param type the field's value type
   * @param <T> the value type
   * @return the value, or empty if unset
   */
  public <T> Optional<T> get(ParsedField field, Class<T> type) {
    return Optional.ofNullable(values.get(field)).map(type::cast);
  }

  public Optional<Weekday> weekday() {
    return get(ParsedField.WEEKDAY, Weekday.class);
  }

  public Optional<BigInteger> unixTimestampNanos() {
    return get(ParsedField.UNIX_TIMESTAMP_NANOS, BigInteger.class);
  }

  /**
   * Returns every field that has been set.
   *
   * @return an unmodifiable view, in field order
   */
  public Map<ParsedField, Object> values() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * Takes a snapshot for backtracking.
   *
   * @return an independent copy
   */
  public Parsed copy() {
    Parsed copy = new Parsed();
    copy.values.putAll(values);
    return copy;
  }

  /**
   * Rolls back to a snapshot taken with {@link #copy()}.
   *
   * @param snapshot the snapshot
   */
  public void restore(Parsed snapshot) {
    values.clear();
    values.putAll(snapshot.values);
  }

  // Conversions

  /**
   * Builds a date from the year with ordinal, month and day, or week number and weekday.
   *
   * @return the date
   * @throws TryFromParsedException if the fields do not determine a date or describe none
   */
  public LocalDate toLocalDate() throws TryFromParsedException {
    OptionalInt year =
        resolveYear(
            ParsedField.YEAR,
            ParsedField.YEAR_CENTURY,
            ParsedField.YEAR_CENTURY_IS_NEGATIVE,
            ParsedField.YEAR_LAST_TWO);
    OptionalInt isoYear =
        resolveYear(
            ParsedField.ISO_YEAR,
            ParsedField.ISO_YEAR_CENTURY,
            ParsedField.ISO_YEAR_CENTURY_IS_NEGATIVE,
            ParsedField.ISO_YEAR_LAST_TWO);
    OptionalInt ordinal = getInt(ParsedField.ORDINAL);
    OptionalInt month = getInt(ParsedField.MONTH);
    OptionalInt day = getInt(ParsedField.DAY);
    OptionalInt isoWeek = getInt(ParsedField.ISO_WEEK_NUMBER);
    OptionalInt sundayWeek = getInt(ParsedField.SUNDAY_WEEK_NUMBER);
    OptionalInt mondayWeek = getInt(ParsedField.MONDAY_WEEK_NUMBER);
    Optional<Weekday> weekday = weekday();

    try {
      if (year.isPresent() && ordinal.isPresent()) {
        return LocalDate.ofYearDay(year.getAsInt(), ordinal.getAsInt());
      }
      if (year.isPresent() && month.isPresent() && day.isPresent()) {
        return LocalDate.of(year.getAsInt(), month.getAsInt(), day.getAsInt());
      }
      if (isoYear.isPresent() && isoWeek.isPresent() && weekday.isPresent()) {
        return fromIsoWeekDate(isoYear.getAsInt(), isoWeek.getAsInt(), weekday.get());
      }
      if (year.isPresent() && sundayWeek.isPresent() && weekday.isPresent()) {
        LocalDate jan1 = LocalDate.of(year.getAsInt(), 1, 1);
        int first = Weekday.fromDayOfWeek(jan1.getDayOfWeek()).daysFromSunday();
        int week = sundayWeek.getAsInt() - (first == 0 ? 1 : 0);
        int day0 = 7 * week + weekday.get().daysFromSunday() - first + 1;
        return LocalDate.ofYearDay(year.getAsInt(), day0);
      }
      if (year.isPresent() && mondayWeek.isPresent() && weekday.isPresent()) {
        LocalDate jan1 = LocalDate.of(year.getAsInt(), 1, 1);
        int first = Weekday.fromDayOfWeek(jan1.getDayOfWeek()).daysFromMonday();
        int week = mondayWeek.getAsInt() - (first == 0 ? 1 : 0);
        int day0 = 7 * week + weekday.get().daysFromMonday() - first + 1;
        return LocalDate.ofYearDay(year.getAsInt(), day0);
      }
    } catch (DateTimeException e) {
      throw TryFromParsedException.range(e.getMessage());
    }
    throw TryFromParsedException.insufficient("a date");
  }

  private static LocalDate fromIsoWeekDate(int isoYear, int week, Weekday weekday)
      throws TryFromParsedException {
    LocalDate jan4 = LocalDate.of(isoYear, 1, 4);
    long weeks = jan4.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
    if (week > weeks) {
      throw TryFromParsedException.range(isoYear + " has no ISO week " + week);
    }
    return jan4.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
        .with(ChronoField.DAY_OF_WEEK, weekday.toDayOfWeek().getValue());
  }

  private OptionalInt resolveYear(
      ParsedField full, ParsedField century, ParsedField centuryIsNegative, ParsedField lastTwo) {
    OptionalInt year = getInt(full);
    if (year.isPresent()) {
      return year;
    }
    OptionalInt c = getInt(century);
    OptionalInt l = getInt(lastTwo);
    if (c.isPresent() && l.isPresent()) {
      boolean negative =
          c.getAsInt() < 0 || get(centuryIsNegative, Boolean.class).orElse(false);
      int magnitude = Math.abs(c.getAsInt()) * 100 + l.getAsInt();
      return OptionalInt.of(negative ? -magnitude : magnitude);
    }
    return OptionalInt.empty();
  }

  /**
   * Builds a time of day. Minute, second and subsecond default to zero.
   *
   * @return the time
   * @throws TryFromParsedException if no hour is known
   */
  public LocalTime toLocalTime() throws TryFromParsedException {
    int hour;
    OptionalInt hour24 = getInt(ParsedField.HOUR_24);
    OptionalInt hour12 = getInt(ParsedField.HOUR_12);
    Optional<Boolean> pm = get(ParsedField.HOUR_12_IS_PM, Boolean.class);
    if (hour24.isPresent()) {
      hour = hour24.getAsInt();
    } else if (hour12.isPresent() && pm.isPresent()) {
      hour = hour12.getAsInt() % 12 + (pm.get() ? 12 : 0);
    } else {
      throw TryFromParsedException.insufficient("a time");
    }
    try {
      return LocalTime.of(
          hour,
          getInt(ParsedField.MINUTE).orElse(0),
          getInt(ParsedField.SECOND).orElse(0),
          getInt(ParsedField.SUBSECOND).orElse(0));
    } catch (DateTimeException e) {
      throw TryFromParsedException.range(e.getMessage());
    }
  }

  /**
   * Builds a UTC offset. Minutes and seconds default to zero and take the sign of the hour.
   *
   * @return the offset
   * @throws TryFromParsedException if the offset hour is missing or the offset is out of range
   */
  public ZoneOffset toZoneOffset() throws TryFromParsedException {
    OptionalInt hour = getInt(ParsedField.OFFSET_HOUR);
    if (hour.isEmpty()) {
      throw TryFromParsedException.insufficient("a UTC offset");
    }
    boolean negative =
        hour.getAsInt() < 0 || get(ParsedField.OFFSET_IS_NEGATIVE, Boolean.class).orElse(false);
    int sign = negative ? -1 : 1;
    try {
      return ZoneOffset.ofHoursMinutesSeconds(
          hour.getAsInt(),
          sign * getInt(ParsedField.OFFSET_MINUTE).orElse(0),
          sign * getInt(ParsedField.OFFSET_SECOND).orElse(0));
    } catch (DateTimeException e) {
      throw TryFromParsedException.range(e.getMessage());
    }
  }

  /**
   * Builds a date and time from {@link #toLocalDate()} and {@link #toLocalTime()}.
   *
   * @return the date and time
   * @throws TryFromParsedException if either part cannot be built
   */
  public LocalDateTime toLocalDateTime() throws TryFromParsedException {
    return LocalDateTime.of(toLocalDate(), toLocalTime());
  }

  /**
   * Builds an offset date and time.
   *
   * <p>A Unix timestamp, when present, fixes the instant. It is shown at the parsed offset, or
   * at UTC when no offset was parsed.
   *
   * @return the offset date and time
   * @throws TryFromParsedException if the fields do not determine one
   */
  public OffsetDateTime toOffsetDateTime() throws TryFromParsedException {
    Optional<BigInteger> timestamp = unixTimestampNanos();
    if (timestamp.isPresent()) {
      ZoneOffset offset = has(ParsedField.OFFSET_HOUR) ? toZoneOffset() : ZoneOffset.UTC;
      Instant instant = toInstant(timestamp.get());
      try {
        return OffsetDateTime.ofInstant(instant, offset);
      } catch (DateTimeException e) {
        throw TryFromParsedException.range(e.getMessage());
      }
    }
    return OffsetDateTime.of(toLocalDateTime(), toZoneOffset());
  }

  private static Instant toInstant(BigInteger nanos) throws TryFromParsedException {
    BigInteger[] qr = nanos.divideAndRemainder(NANOS_PER_SECOND);
    BigInteger seconds = qr[0];
    BigInteger rem = qr[1];
    if (rem.signum() < 0) {
      seconds = seconds.subtract(BigInteger.ONE);
      rem = rem.add(NANOS_PER_SECOND);
    }
    if (seconds.bitLength() >= Long.SIZE) {
      throw TryFromParsedException.range("Unix timestamp " + nanos + "ns is out of range");
    }
    try {
      return Instant.ofEpochSecond(seconds.longValue(), rem.longValue());
    } catch (DateTimeException e) {
      throw TryFromParsedException.range(e.getMessage());
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Parsed other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Parsed" + values;
  }
}
