package io.chronofmt.ast;

/** Padding applied to numeric components narrower than their natural width. */
public enum Padding implements ModifierValue {
  ZERO("zero"),
  SPACE("space"),
  NONE("none");

  private final String token;

  Padding(String token) {
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
