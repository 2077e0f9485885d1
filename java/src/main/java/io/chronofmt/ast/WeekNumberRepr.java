package io.chronofmt.ast;

/** Week numbering scheme. */
public enum WeekNumberRepr implements ModifierValue {
  ISO("iso"),
  SUNDAY("sunday"),
  MONDAY("monday");

  private final String token;

  WeekNumberRepr(String token) {
    this.token = token;
  }

  @Override
  public String token() {
    return token;
  }
}
