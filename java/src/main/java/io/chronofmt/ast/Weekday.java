package io.chronofmt.ast;

import java.time.DayOfWeek;

/** Weekday names as written by the {@code weekday} component. */
public enum Weekday {
  MONDAY("Monday", "Mon"),
  TUESDAY("Tuesday", "Tue"),
  WEDNESDAY("Wednesday", "Wed"),
  THURSDAY("Thursday", "Thu"),
  FRIDAY("Friday", "Fri"),
  SATURDAY("Saturday", "Sat"),
  SUNDAY("Sunday", "Sun");

  private final String longName;
  private final String shortName;

  Weekday(String longName, String shortName) {
    this.longName = longName;
    this.shortName = shortName;
  }

  public String longName() {
    return longName;
  }

  public String shortName() {
    return shortName;
  }

  /**
   * Returns the number of days since the previous Sunday (Sunday=0, Saturday=6).
   *
   * @return days from Sunday
   */
  public int daysFromSunday() {
    return (ordinal() + 1) % 7;
  }

  /**
   * Returns the number of days since the previous Monday (Monday=0, Sunday=6).
   *
   * @return days from Monday
   */
  public int daysFromMonday() {
    return ordinal();
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.of(ordinal() + 1);
  }
}
