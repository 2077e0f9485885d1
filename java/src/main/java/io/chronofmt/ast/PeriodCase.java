package io.chronofmt.ast;

/** Letter case of the AM/PM marker. */
public enum PeriodCase implements ModifierValue {
  UPPER("upper"),
  LOWER("lower");

  private final String token;

  PeriodCase(String token) {
    this.token = token;
  }

  @Override
  public String token() {
    return token;
  }
}
