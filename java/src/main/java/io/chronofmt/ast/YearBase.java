package io.chronofmt.ast;

/** Calendar year or ISO week-based year. */
public enum YearBase implements ModifierValue {
  CALENDAR("calendar"),
  ISO_WEEK("iso_week");

  private final String token;

  YearBase(String token) {
    this.token = token;
  }

  @Override
  public String token() {
    return token;
  }
}
