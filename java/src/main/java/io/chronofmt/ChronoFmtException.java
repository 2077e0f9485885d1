package io.chronofmt;

/** Base class of every error raised while compiling, formatting, parsing or converting. */
public abstract class ChronoFmtException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /**
   * Creates a new exception.
   *
   * @param kind the error kind
   * @param message the error message
   */
  protected ChronoFmtException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }
}
