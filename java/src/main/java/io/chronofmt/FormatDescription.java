package io.chronofmt;

import io.chronofmt.ast.FormatItem;
import io.chronofmt.display.Display;
import io.chronofmt.lexer.Cursor;
import io.chronofmt.parser.Parser;
import io.chronofmt.parser.StrftimeParser;
import io.chronofmt.parsing.InputParser;
import io.chronofmt.parsing.Parsed;
import io.chronofmt.render.Renderer;
import io.chronofmt.render.TemporalValueProvider;
import io.chronofmt.render.ValueProvider;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Objects;

/**
 * A compiled format description.
 *
 * <p>Instances are immutable and can be shared freely between threads.
 *
 * <pre>
 * FormatDescription iso = FormatDescription.compile("[year]-[month]-[day]");
 * iso.format(LocalDate.of(2024, 3, 7));                     // "2024-03-07"
 * iso.parse("2024-03-07").toLocalDate();                    // 2024-03-07
 * </pre>
 */
public final class FormatDescription {
  private final int version;
  private final List<FormatItem> items;

  private FormatDescription(int version, List<FormatItem> items) {
    this.version = version;
    this.items = items;
  }

  /**
   * Compiles a format description using version 1 unless it carries a directive.
   *
   * @param description the description
   * @return the compiled description
   * @throws InvalidFormatDescriptionException if the description is invalid
   */
  public static FormatDescription compile(String description)
      throws InvalidFormatDescriptionException {
    return compile(description, 1);
  }

  /**
   * Compiles a format description.
   *
   * @param description the description
   * @param defaultVersion the version used when the description has no directive, 1 or 2
   * @return the compiled description
   * @throws InvalidFormatDescriptionException if the description is invalid
   */
  public static FormatDescription compile(String description, int defaultVersion)
      throws InvalidFormatDescriptionException {
    Objects.requireNonNull(description, "description");
    Parser.Compiled compiled = Parser.compile(description, defaultVersion);
    return new FormatDescription(compiled.version(), compiled.items());
  }

  /**
   * Compiles a description known to be valid, for use in {@code static final} fields.
   *
   * @param description the description
   * @return the compiled description
   * @throws IllegalArgumentException if the description is invalid
   */
  public static FormatDescription constant(String description) {
    return constant(description, 1);
  }

  /**
   * Compiles a description known to be valid, for use in {@code static final} fields.
   *
   * @param description the description
   * @param defaultVersion the version used when the description has no directive, 1 or 2
   * @return the compiled description
   * @throws IllegalArgumentException if the description is invalid
   */
  public static FormatDescription constant(String description, int defaultVersion) {
    try {
      return compile(description, defaultVersion);
    } catch (InvalidFormatDescriptionException e) {
      throw new IllegalArgumentException(e.displayRich(), e);
    }
  }

  /**
   * Checks a format description without keeping the result.
   *
   * @param description the description
   * @throws InvalidFormatDescriptionException if the description is invalid
   */
  public static void validate(String description) throws InvalidFormatDescriptionException {
    validate(description, 1);
  }

  /**
   * Checks a format description without keeping the result.
   *
   * @param description the description
   * @param defaultVersion the version used when the description has no directive, 1 or 2
   * @throws InvalidFormatDescriptionException if the description is invalid
   */
  public static void validate(String description, int defaultVersion)
      throws InvalidFormatDescriptionException {
    compile(description, defaultVersion);
  }

  /**
   * Compiles a strftime-style description such as {@code %Y-%m-%dT%H:%M:%S}.
   *
   * <p>The result holds ordinary components and literals, so it displays as a version 1
   * description.
   *
   * @param description the strftime description
   * @return the compiled description
   * @throws InvalidFormatDescriptionException if a conversion is unknown or incomplete
   */
  public static FormatDescription compileStrftime(String description)
      throws InvalidFormatDescriptionException {
    Objects.requireNonNull(description, "description");
    return new FormatDescription(1, StrftimeParser.parse(description));
  }

  public List<FormatItem> items() {
    return items;
  }

  /**
   * Returns the grammar version the description was compiled with.
   *
   * @return 1 or 2
   */
  public int version() {
    return version;
  }

  /**
   * Formats a value.
   *
   * @param value the value provider
   * @return the formatted text
   * @throws FormattingException if the value cannot be formatted
   */
  public String format(ValueProvider value) throws FormattingException {
    StringBuilder sb = new StringBuilder();
    formatInto(sb, value);
    return sb.toString();
  }

  /**
   * Formats a {@code java.time} value.
   *
   * @param temporal the value
   * @return the formatted text
   * @throws FormattingException if the value lacks a field the description needs
   */
  public String format(TemporalAccessor temporal) throws FormattingException {
    return format(TemporalValueProvider.of(temporal));
  }

  /**
   * Formats a value, appending to a buffer. Nothing is appended on failure.
   *
   * @param out the buffer
   * @param value the value provider
   * @return the number of UTF-8 bytes appended
   * @throws FormattingException if the value cannot be formatted
   */
  public int formatInto(StringBuilder out, ValueProvider value) throws FormattingException {
    return Renderer.render(items, value, out);
  }

  /**
   * Parses the whole input.
   *
   * @param input the text to parse
   * @return the decoded fields
   * @throws ParseFromDescriptionException if the input does not match or has trailing text
   */
  public Parsed parse(String input) throws ParseFromDescriptionException {
    Cursor cursor = Cursor.of(input);
    Parsed parsed = new Parsed();
    InputParser.parse(items, cursor, parsed);
    if (!cursor.atEnd()) {
      throw ParseFromDescriptionException.trailingCharacters(cursor.offset());
    }
    return parsed;
  }

  /**
   * Parses a prefix of the input.
   *
   * @param input the text to parse
   * @return the decoded fields and the number of bytes matched
   * @throws ParseFromDescriptionException if the input does not match
   */
  public PartialParse parsePartial(String input) throws ParseFromDescriptionException {
    Cursor cursor = Cursor.of(input);
    Parsed parsed = new Parsed();
    InputParser.parse(items, cursor, parsed);
    return new PartialParse(parsed, cursor.offset());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FormatDescription other && items.equals(other.items);
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }

  /** Returns the canonical description, which compiles back to an equal description. */
  @Override
  public String toString() {
    return Display.render(items, version);
  }
}
