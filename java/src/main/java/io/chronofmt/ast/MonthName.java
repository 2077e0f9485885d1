package io.chronofmt.ast;

/** Month names as written by the {@code month} component. */
public enum MonthName {
  JANUARY("January", "Jan"),
  FEBRUARY("February", "Feb"),
  MARCH("March", "Mar"),
  APRIL("April", "Apr"),
  MAY("May", "May"),
  JUNE("June", "Jun"),
  JULY("July", "Jul"),
  AUGUST("August", "Aug"),
  SEPTEMBER("September", "Sep"),
  OCTOBER("October", "Oct"),
  NOVEMBER("November", "Nov"),
  DECEMBER("December", "Dec");

  private final String longName;
  private final String shortName;

  MonthName(String longName, String shortName) {
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
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return ordinal() + 1;
  }

  /**
   * Returns the month with the given number.
   *
   * @param number 1 to 12
   * @return the month
   */
  public static MonthName of(int number) {
    return values()[number - 1];
  }
}
