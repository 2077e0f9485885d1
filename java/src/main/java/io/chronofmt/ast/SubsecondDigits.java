package io.chronofmt.ast;

/** Number of subsecond digits: a fixed count from 1 to 9, or as many as needed. */
public enum SubsecondDigits implements ModifierValue {
  ONE("1", 1),
  TWO("2", 2),
  THREE("3", 3),
  FOUR("4", 4),
  FIVE("5", 5),
  SIX("6", 6),
  SEVEN("7", 7),
  EIGHT("8", 8),
  NINE("9", 9),
  ONE_OR_MORE("1+", 0);

  private final String token;
  private final int count;

  SubsecondDigits(String token, int count) {
    this.token = token;
    this.count = count;
  }

  /**
   * Returns the fixed digit count.
   *
   * @return 1 to 9, or 0 for {@link #ONE_OR_MORE}
   */
  public int count() {
    return count;
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
