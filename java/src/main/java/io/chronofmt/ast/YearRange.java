package io.chronofmt.ast;

/** Whether years beyond four digits are allowed. */
public enum YearRange implements ModifierValue {
  EXTENDED("extended"),
  STANDARD("standard");

  private final String token;

  YearRange(String token) {
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
