package io.chronofmt;

/** The type of error that occurred while compiling, formatting, parsing or converting. */
public enum ErrorKind {
  // Format description errors

  /** An opening bracket is not followed by a component name. */
  MISSING_COMPONENT_NAME("missing_component_name", Family.DESCRIPTION),
  /** The component name is not known. */
  INVALID_COMPONENT("invalid_component", Family.DESCRIPTION),
  /** The modifier key is not legal for the component. */
  INVALID_MODIFIER_KEY("invalid_modifier_key", Family.DESCRIPTION),
  /** The modifier value is not legal for the modifier key. */
  INVALID_MODIFIER_VALUE("invalid_modifier_value", Family.DESCRIPTION),
  /** A modifier has no {@code :} or no value after it. */
  EXPECTED_MODIFIER_VALUE("expected_modifier_value", Family.DESCRIPTION),
  /** A modifier the component cannot do without was not given. */
  MISSING_REQUIRED_MODIFIER("missing_required_modifier", Family.DESCRIPTION),
  /** End of input was reached before a closing bracket. */
  UNCLOSED_BRACKET("unclosed_bracket", Family.DESCRIPTION),
  /** A nested description does not start with an opening bracket. */
  EXPECTED_OPENING_BRACKET("expected_opening_bracket", Family.DESCRIPTION),
  /** The {@code optional} keyword is not followed by whitespace. */
  EXPECTED_WHITESPACE_AFTER_OPTIONAL("expected_whitespace_after_optional", Family.DESCRIPTION),
  /** The {@code first} keyword is not followed by whitespace. */
  EXPECTED_WHITESPACE_AFTER_FIRST("expected_whitespace_after_first", Family.DESCRIPTION),
  /** A backslash escape is not one of the recognized ones. */
  INVALID_ESCAPE_SEQUENCE("invalid_escape_sequence", Family.DESCRIPTION),
  /** A byte that cannot appear at this position. */
  UNEXPECTED_TOKEN("unexpected_token", Family.DESCRIPTION),
  /** The version directive names a version other than 1 or 2. */
  INVALID_FORMAT_DESCRIPTION_VERSION("invalid_format_description_version", Family.DESCRIPTION),
  /** Optional and first groups are nested too deeply. */
  NESTING_LIMIT_EXCEEDED("nesting_limit_exceeded", Family.DESCRIPTION),
  /** A strftime conversion or flag that has no counterpart among the components. */
  NOT_SUPPORTED("not_supported", Family.DESCRIPTION),

  // Parse and formatting errors

  /** The input does not match a literal. */
  INVALID_LITERAL("invalid_literal", Family.RUNTIME),
  /**
   * The input does not hold a valid value for a component, or a value cannot be written with the
   * component's modifiers.
   */
  INVALID_COMPONENT_VALUE("invalid_component_value", Family.RUNTIME),
  /** The value being formatted does not supply the component. */
  UNSUPPORTED_COMPONENT("unsupported_component", Family.RUNTIME),
  /** A field was parsed twice with different values. */
  INCONSISTENT_PARSED_FIELD("inconsistent_parsed_field", Family.RUNTIME),
  /** Input remains after the description was fully matched. */
  UNEXPECTED_TRAILING_CHARACTERS("unexpected_trailing_characters", Family.RUNTIME),

  // Conversion errors

  /** The parsed fields do not determine a value. */
  INSUFFICIENT_INFORMATION("insufficient_information", Family.CONVERSION),
  /** A parsed field combination is outside the range of the target type. */
  COMPONENT_RANGE("component_range", Family.CONVERSION);

  /** The stage an error kind belongs to. */
  public enum Family {
    /** Compiling a format description. */
    DESCRIPTION,
    /** Parsing input against, or formatting a value with, a compiled description. */
    RUNTIME,
    /** Converting parsed fields into a value. */
    CONVERSION
  }

  private final String value;
  private final Family family;

  ErrorKind(String value, Family family) {
    this.value = value;
    this.family = family;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  /**
   * Returns the stage this kind of error is raised by.
   *
   * @return the family
   */
  public Family family() {
    return family;
  }

  @Override
  public String toString() {
    return value;
  }
}
