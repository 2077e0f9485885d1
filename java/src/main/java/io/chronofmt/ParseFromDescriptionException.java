package io.chronofmt;

import java.util.Optional;

/** Exception thrown when input does not match a compiled format description. */
public final class ParseFromDescriptionException extends ChronoFmtException {
  /** The byte offset in the input where matching failed. */
  private final int offset;

  /** The component or field involved, if any. */
  private final String subject;

  private ParseFromDescriptionException(
      ErrorKind kind, String message, int offset, String subject) {
    super(kind, message);
    this.offset = offset;
    this.subject = subject;
  }

  /**
   * Creates an error for input that does not match a literal.
   *
   * @param offset the byte offset of the mismatch
   * @return a new exception
   */
  public static ParseFromDescriptionException invalidLiteral(int offset) {
    return new ParseFromDescriptionException(
        ErrorKind.INVALID_LITERAL,
        "the input does not match the literal at byte index " + offset,
        offset,
        null);
  }

  /**
   * Creates an error for input that holds no valid value for a component.
   *
   * @param component the component name, as written in a description
   * @param offset the byte offset where the component starts
   * @return a new exception
   */
  public static ParseFromDescriptionException invalidComponent(String component, int offset) {
    return new ParseFromDescriptionException(
        ErrorKind.INVALID_COMPONENT_VALUE,
        "the " + component + " component could not be parsed at byte index " + offset,
        offset,
        component);
  }

  /**
   * Creates an error for a field that was parsed twice with different values.
   *
   * @param field the field name
   * @param offset the byte offset of the second value
   * @return a new exception
   */
  public static ParseFromDescriptionException inconsistentField(String field, int offset) {
    return new ParseFromDescriptionException(
        ErrorKind.INCONSISTENT_PARSED_FIELD,
        "the " + field + " field conflicts with an earlier value at byte index " + offset,
        offset,
        field);
  }

  /**
   * Creates an error for input left over after a full match.
   *
   * @param offset the byte offset of the first unconsumed byte
   * @return a new exception
   */
  public static ParseFromDescriptionException trailingCharacters(int offset) {
    return new ParseFromDescriptionException(
        ErrorKind.UNEXPECTED_TRAILING_CHARACTERS,
        "unexpected trailing characters at byte index " + offset,
        offset,
        null);
  }

  /**
   * Returns the byte offset in the input where the error occurred.
   *
   * @return the offset
   */
  public int offset() {
    return offset;
  }

  /**
   * Returns the component name or field name involved, if any.
   *
   * @return the name, or empty for literal and trailing input errors
   */
  public Optional<String> subject() {
    return Optional.ofNullable(subject);
  }
}
