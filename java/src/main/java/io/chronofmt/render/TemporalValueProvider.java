package io.chronofmt.render;

import io.chronofmt.ast.Weekday;
import java.time.DayOfWeek;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAccessor;

/** Adapts any {@code java.time} value to a {@link ValueProvider}. */
public final class TemporalValueProvider implements ValueProvider {
  private final TemporalAccessor temporal;

  private TemporalValueProvider(TemporalAccessor temporal) {
    this.temporal = temporal;
  }

  /**
   * Wraps a temporal value. Field families are supplied according to the fields it supports: a
   * {@code LocalDate} supplies the date, an {@code OffsetDateTime} everything.
   *
   * @param temporal the value to render
   * @return a provider reading from the value
   */
  public static TemporalValueProvider of(TemporalAccessor temporal) {
    return new TemporalValueProvider(temporal);
  }

  @Override
  public boolean suppliesDate() {
    return temporal.isSupported(ChronoField.EPOCH_DAY);
  }

  @Override
  public boolean suppliesTime() {
    return temporal.isSupported(ChronoField.NANO_OF_DAY);
  }

  @Override
  public boolean suppliesOffset() {
    return temporal.isSupported(ChronoField.OFFSET_SECONDS);
  }

  @Override
  public boolean suppliesTimestamp() {
    return temporal.isSupported(ChronoField.INSTANT_SECONDS);
  }

  @Override
  public int year() {
    return temporal.get(ChronoField.YEAR);
  }

  @Override
  public int isoYear() {
    return temporal.get(IsoFields.WEEK_BASED_YEAR);
  }

  @Override
  public int month() {
    return temporal.get(ChronoField.MONTH_OF_YEAR);
  }

  @Override
  public int day() {
    return temporal.get(ChronoField.DAY_OF_MONTH);
  }

  @Override
  public int ordinal() {
    return temporal.get(ChronoField.DAY_OF_YEAR);
  }

  @Override
  public Weekday weekday() {
    return Weekday.fromDayOfWeek(DayOfWeek.of(temporal.get(ChronoField.DAY_OF_WEEK)));
  }

  @Override
  public int isoWeekNumber() {
    return temporal.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
  }

  @Override
  public int hour() {
    return temporal.get(ChronoField.HOUR_OF_DAY);
  }

  @Override
  public int minute() {
    return temporal.get(ChronoField.MINUTE_OF_HOUR);
  }

  @Override
  public int second() {
    return temporal.get(ChronoField.SECOND_OF_MINUTE);
  }

  @Override
  public int nanosecond() {
    return temporal.get(ChronoField.NANO_OF_SECOND);
  }

  @Override
  public boolean offsetIsNegative() {
    return offsetSeconds() < 0;
  }

  @Override
  public int offsetHour() {
    return Math.abs(offsetSeconds()) / 3600;
  }

  @Override
  public int offsetMinute() {
    return Math.abs(offsetSeconds()) / 60 % 60;
  }

  @Override
  public int offsetSecond() {
    return Math.abs(offsetSeconds()) % 60;
  }

  private int offsetSeconds() {
    return temporal.get(ChronoField.OFFSET_SECONDS);
  }

  @Override
  public long unixTimestampSeconds() {
    return temporal.getLong(ChronoField.INSTANT_SECONDS);
  }

  @Override
  public int unixTimestampNanos() {
    return temporal.get(ChronoField.NANO_OF_SECOND);
  }
}
