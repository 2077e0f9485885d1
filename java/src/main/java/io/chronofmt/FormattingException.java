package io.chronofmt;

/** Exception thrown when a value cannot be formatted with a compiled format description. */
public final class FormattingException extends ChronoFmtException {
  /** The component that could not be written. */
  private final String component;

  private FormattingException(ErrorKind kind, String message, String component) {
    super(kind, message);
    this.component = component;
  }

  /**
   * Creates an error for a component the value does not supply.
   *
   * @param component the component name
   * @return a new exception
   */
  public static FormattingException unsupported(String component) {
    return new FormattingException(
        ErrorKind.UNSUPPORTED_COMPONENT,
        "the value does not supply the " + component + " component",
        component);
  }

  /**
   * Creates an error for a value the component's modifiers cannot represent.
   *
   * @param component the component name
   * @param value the offending value
   * @return a new exception
   */
  public static FormattingException invalidValue(String component, Object value) {
    return new FormattingException(
        ErrorKind.INVALID_COMPONENT_VALUE,
        "the " + component + " component cannot represent the value " + value,
        component);
  }

  /**
   * Returns the component that could not be written.
   *
   * @return the component name
   */
  public String component() {
    return component;
  }
}
