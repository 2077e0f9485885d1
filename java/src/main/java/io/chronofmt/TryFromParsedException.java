package io.chronofmt;

/** Exception thrown when parsed fields cannot be converted into a date or time value. */
public final class TryFromParsedException extends ChronoFmtException {
  private TryFromParsedException(ErrorKind kind, String message) {
    super(kind, message);
  }

  /**
   * Creates an error for fields that do not determine the requested value.
   *
   * @param what the value that was requested
   * @return a new exception
   */
  public static TryFromParsedException insufficient(String what) {
    return new TryFromParsedException(
        ErrorKind.INSUFFICIENT_INFORMATION, "insufficient information to construct " + what);
  }

  /**
   * Creates an error for fields whose combination is out of range.
   *
   * @param message a description of the range violation
   * @return a new exception
   */
  public static TryFromParsedException range(String message) {
    return new TryFromParsedException(ErrorKind.COMPONENT_RANGE, message);
  }
}
