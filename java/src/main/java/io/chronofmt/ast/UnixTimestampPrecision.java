package io.chronofmt.ast;

/** Unit of a Unix timestamp. */
public enum UnixTimestampPrecision implements ModifierValue {
  SECOND("second", 1_000_000_000L),
  MILLISECOND("millisecond", 1_000_000L),
  MICROSECOND("microsecond", 1_000L),
  NANOSECOND("nanosecond", 1L);

  private final String token;
  private final long nanosPerUnit;

  UnixTimestampPrecision(String token, long nanosPerUnit) {
    this.token = token;
    this.nanosPerUnit = nanosPerUnit;
  }

  /**
   * Returns the number of nanoseconds in one unit.
   *
   * @return nanoseconds per unit
   */
  public long nanosPerUnit() {
    return nanosPerUnit;
  }

  @Override
  public String token() {
    return token;
  }
}
