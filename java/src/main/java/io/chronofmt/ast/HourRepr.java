package io.chronofmt.ast;

/** Hour clock: 24-hour or 12-hour. */
public enum HourRepr implements ModifierValue {
  TWENTY_FOUR("24"),
  TWELVE("12");

  private final String token;

  HourRepr(String token) {
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
