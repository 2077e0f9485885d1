package io.chronofmt.ast;

/** A boolean modifier value. */
public enum Flag implements ModifierValue {
  TRUE("true"),
  FALSE("false");

  private final String token;

  Flag(String token) {
    this.token = token;
  }

  @Override
  public String token() {
    return token;
  }

  /**
   * Returns the boolean this value stands for.
   *
   * @return true for {@link #TRUE}
   */
  public boolean isTrue() {
    return this == TRUE;
  }

  @Override
  public String toString() {
    return token;
  }
}
