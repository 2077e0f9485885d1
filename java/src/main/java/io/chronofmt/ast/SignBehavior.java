package io.chronofmt.ast;

/** When a sign is written for a signed component. */
public enum SignBehavior implements ModifierValue {
  AUTOMATIC("automatic"),
  MANDATORY("mandatory");

  private final String token;

  SignBehavior(String token) {
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
