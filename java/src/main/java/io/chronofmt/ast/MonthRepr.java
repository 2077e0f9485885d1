package io.chronofmt.ast;

/** How a month is written. */
public enum MonthRepr implements ModifierValue {
  NUMERICAL("numerical"),
  LONG("long"),
  SHORT("short");

  private final String token;

  MonthRepr(String token) {
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
