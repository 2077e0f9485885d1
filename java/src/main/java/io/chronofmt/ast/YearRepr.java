package io.chronofmt.ast;

/** How many digits of a year are written. */
public enum YearRepr implements ModifierValue {
  FULL("full"),
  CENTURY("century"),
  LAST_TWO("last_two");

  private final String token;

  YearRepr(String token) {
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
