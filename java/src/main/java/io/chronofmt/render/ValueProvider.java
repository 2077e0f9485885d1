package io.chronofmt.render;

import io.chronofmt.ast.Weekday;

/**
 * Supplies field values to the {@link Renderer}.
 *
 * <p>A provider declares which field families it carries. Getters of a family the provider does
 * not supply are never called.
 */
public interface ValueProvider {
  boolean suppliesDate();

  boolean suppliesTime();

  boolean suppliesOffset();

  boolean suppliesTimestamp();

  /** Returns the proleptic calendar year, which may be zero or negative. */
  int year();

  /** Returns the ISO week-based year. */
  int isoYear();

  int month();

  int day();

  /** Returns the day of the year, 1 to 366. */
  int ordinal();

  Weekday weekday();

  /** Returns the ISO week number, 1 to 53. */
  int isoWeekNumber();

  /**
   * Returns the week number counting weeks that start on Sunday, 0 to 53. Days before the first
   * Sunday of the year are in week 0.
   *
   * @return the Sunday-based week number
   */
  default int sundayWeekNumber() {
    return (ordinal() + 6 - weekday().daysFromSunday()) / 7;
  }

  /**
   * Returns the week number counting weeks that start on Monday, 0 to 53. Days before the first
   * Monday of the year are in week 0.
   *
   * @return the Monday-based week number
   */
  default int mondayWeekNumber() {
    return (ordinal() + 6 - weekday().daysFromMonday()) / 7;
  }

  int hour();

  int minute();

  int second();

  int nanosecond();

  boolean offsetIsNegative();

  /** Returns the absolute whole hours of the UTC offset. */
  int offsetHour();

  /** Returns the absolute minutes of the UTC offset, excluding whole hours. */
  int offsetMinute();

  /** Returns the absolute seconds of the UTC offset, excluding whole minutes. */
  int offsetSecond();

  /** Returns whole seconds since 1970-01-01T00:00Z, rounded toward negative infinity. */
  long unixTimestampSeconds();

  /** Returns the nanoseconds to add to {@link #unixTimestampSeconds()}, 0 to 999,999,999. */
  int unixTimestampNanos();
}
