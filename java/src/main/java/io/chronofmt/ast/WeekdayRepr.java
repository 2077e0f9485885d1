package io.chronofmt.ast;

/** How a weekday is written: by name or by number counted from Sunday or Monday. */
public enum WeekdayRepr implements ModifierValue {
  LONG("long"),
  SHORT("short"),
  SUNDAY("sunday"),
  MONDAY("monday");

  private final String token;

  WeekdayRepr(String token) {
    this.token = token;
  }

  @Override
  public String token() {
    return token;
  }

  @Override
  public String toString() {
    return token;
  }
}
