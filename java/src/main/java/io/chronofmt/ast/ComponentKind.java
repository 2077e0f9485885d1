package io.chronofmt.ast;

import io.chronofmt.lexer.Ascii;
import java.util.Map;
import java.util.Optional;

/** The components a format description can name. */
public enum ComponentKind {
  DAY("day"),
  END("end"),
  HOUR("hour"),
  IGNORE("ignore"),
  MINUTE("minute"),
  MONTH("month"),
  OFFSET_HOUR("offset_hour"),
  OFFSET_MINUTE("offset_minute"),
  OFFSET_SECOND("offset_second"),
  ORDINAL("ordinal"),
  PERIOD("period"),
  SECOND("second"),
  SUBSECOND("subsecond"),
  UNIX_TIMESTAMP("unix_timestamp"),
  WEEKDAY("weekday"),
  WEEK_NUMBER("week_number"),
  YEAR("year");

  private final String displayName;

  ComponentKind(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the component name as written in a format description.
   *
   * @return the component name
   */
  public String displayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, ComponentKind> PARSE_MAP =
      Map.ofEntries(
          Map.entry("day", DAY),
          Map.entry("end", END),
          Map.entry("hour", HOUR),
          Map.entry("ignore", IGNORE),
          Map.entry("minute", MINUTE),
          Map.entry("month", MONTH),
          Map.entry("offset_hour", OFFSET_HOUR),
          Map.entry("offset_minute", OFFSET_MINUTE),
          Map.entry("offset_second", OFFSET_SECOND),
          Map.entry("ordinal", ORDINAL),
          Map.entry("period", PERIOD),
          Map.entry("second", SECOND),
          Map.entry("subsecond", SUBSECOND),
          Map.entry("unix_timestamp", UNIX_TIMESTAMP),
          Map.entry("weekday", WEEKDAY),
          Map.entry("week_number", WEEK_NUMBER),
          Map.entry("year", YEAR));

  /**
   * Parses a component name (ASCII case insensitive).
   *
   * @param s the name as written
   * @return the component if known
   */
  public static Optional<ComponentKind> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(Ascii.toLowerCase(s)));
  }
}
