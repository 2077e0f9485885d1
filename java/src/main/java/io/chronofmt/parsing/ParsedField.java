package io.chronofmt.parsing;

import io.chronofmt.ast.Weekday;
import java.math.BigInteger;

/** The fields a parse can fill in, with the Java type each one holds. */
public enum ParsedField {
  YEAR("year", Integer.class),
  YEAR_CENTURY("year century", Integer.class),
  YEAR_CENTURY_IS_NEGATIVE("year century sign", Boolean.class),
  YEAR_LAST_TWO("year last two digits", Integer.class),
  ISO_YEAR("ISO year", Integer.class),
  ISO_YEAR_CENTURY("ISO year century", Integer.class),
  ISO_YEAR_CENTURY_IS_NEGATIVE("ISO year century sign", Boolean.class),
  ISO_YEAR_LAST_TWO("ISO year last two digits", Integer.class),
  MONTH("month", Integer.class),
  DAY("day", Integer.class),
  ORDINAL("ordinal", Integer.class),
  WEEKDAY("weekday", Weekday.class),
  ISO_WEEK_NUMBER("ISO week number", Integer.class),
  SUNDAY_WEEK_NUMBER("Sunday-based week number", Integer.class),
  MONDAY_WEEK_NUMBER("Monday-based week number", Integer.class),
  HOUR_24("hour", Integer.class),
  HOUR_12("12-hour clock hour", Integer.class),
  HOUR_12_IS_PM("period", Boolean.class),
  MINUTE("minute", Integer.class),
  SECOND("second", Integer.class),
  SUBSECOND("subsecond", Integer.class),
  OFFSET_HOUR("offset hour", Integer.class),
  OFFSET_IS_NEGATIVE("offset sign", Boolean.class),
  OFFSET_MINUTE("offset minute", Integer.class),
  OFFSET_SECOND("offset second", Integer.class),
  UNIX_TIMESTAMP_NANOS("Unix timestamp", BigInteger.class);

  private final String displayName;
  private final Class<?> type;

  ParsedField(String displayName, Class<?> type) {
    this.displayName = displayName;
    this.type = type;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Returns the type of value stored for this field.
   *
   * @return the value type
   */
  public Class<?> type() {
    return type;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
