package io.chronofmt.ast;

/** What the {@code end} component does with input left after it. */
public enum TrailingInput implements ModifierValue {
  PROHIBIT("prohibit"),
  DISCARD("discard");

  private final String token;

  TrailingInput(String token) {
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
