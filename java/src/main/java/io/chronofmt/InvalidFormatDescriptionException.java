package io.chronofmt;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** Exception thrown when a format description cannot be compiled. */
public final class InvalidFormatDescriptionException extends ChronoFmtException {
  /** The byte span of the offending part of the description. */
  private final Span span;

  /** The description being compiled. */
  private final String input;

  private InvalidFormatDescriptionException(
      ErrorKind kind, String message, Span span, String input) {
    super(kind, message + " at byte index " + span.start());
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new format description error.
   *
   * @param kind the error kind, which must belong to {@link ErrorKind.Family#DESCRIPTION}
   * @param message the error message
   * @param span the location of the error in the description
   * @param input the description
   * @return a new exception
   */
  public static InvalidFormatDescriptionException of(
      ErrorKind kind, String message, Span span, String input) {
    if (kind.family() != ErrorKind.Family.DESCRIPTION) {
      throw new IllegalArgumentException("not a format description error: " + kind);
    }
    return new InvalidFormatDescriptionException(kind, message, span, input);
  }

  /**
   * Returns the byte span where the error occurred.
   *
   * @return the span
   */
  public Span span() {
    return span;
  }

  /**
   * Returns the description that failed to compile, if available.
   *
   * @return the description, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending bytes.
   *
   * <p>Produces output like:
   *
   * <pre>
   * error: invalid component `foo` at byte index 1
   *   [foo]
   *    ^^^
   * </pre>
   *
   * <p>The underline is positioned by bytes, so it lines up only for ASCII descriptions.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (input == null) {
      return "error: " + getMessage();
    }
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage()).append("\n");
    sb.append("  ").append(input).append("\n");

    int inputLength = input.getBytes(StandardCharsets.UTF_8).length;
    int start = Math.min(span.start(), inputLength);
    sb.append(" ".repeat(start + 2));
    sb.append("^".repeat(span.length()));
    return sb.toString();
  }
}
