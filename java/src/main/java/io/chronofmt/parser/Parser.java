package io.chronofmt.parser;

import io.chronofmt.ErrorKind;
import io.chronofmt.InvalidFormatDescriptionException;
import io.chronofmt.Span;
import io.chronofmt.ast.ComponentItem;
import io.chronofmt.ast.ComponentKind;
import io.chronofmt.ast.ComponentSpec;
import io.chronofmt.ast.ComponentTable;
import io.chronofmt.ast.FirstItem;
import io.chronofmt.ast.FormatItem;
import io.chronofmt.ast.LiteralItem;
import io.chronofmt.ast.ModifierKey;
import io.chronofmt.ast.ModifierRule;
import io.chronofmt.ast.ModifierValue;
import io.chronofmt.ast.OptionalItem;
import io.chronofmt.lexer.Ascii;
import io.chronofmt.lexer.Cursor;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent compiler for format descriptions.
 *
 * <p>Version 1 knows literals, {@code [[} escapes and components. Version 2 adds backslash
 * escapes and the nested {@code optional} and {@code first} groups. A description may select its
 * version with a leading {@code version = N,} directive.
 */
public final class Parser {
  /** The deepest allowed nesting of {@code optional} and {@code first} groups. */
  public static final int MAX_NESTING_DEPTH = 32;

  private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

  private static final byte[] VERSION = "version".getBytes(StandardCharsets.US_ASCII);

  /**
   * A compiled description and the grammar version it was compiled with.
   *
   * @param version 1 or 2
   * @param items the compiled items
   */
  public record Compiled(int version, List<FormatItem> items) {
    public Compiled {
      items = List.copyOf(items);
    }
  }

  private final String input;
  private final Cursor cursor;
  private int version;

  private Parser(String input, int version) {
    this.input = input;
    this.cursor = Cursor.of(input);
    this.version = version;
  }

  /**
   * Compiles a format description into format items.
   *
   * @param source the description
   * @param defaultVersion the version used when the description has no directive
   * @return the compiled items
   * @throws InvalidFormatDescriptionException if the description is invalid
   */
  public static List<FormatItem> parse(String source, int defaultVersion)
      throws InvalidFormatDescriptionException {
    return compile(source, defaultVersion).items();
  }

  /**
   * Compiles a format description, reporting the version that applied.
   *
   * @param source the description
   * @param defaultVersion the version used when the description has no directive
   * @return the compiled description
   * @throws InvalidFormatDescriptionException if the description is invalid
   */
  public static Compiled compile(String source, int defaultVersion)
      throws InvalidFormatDescriptionException {
    if (defaultVersion != 1 && defaultVersion != 2) {
      throw new IllegalArgumentException("unsupported default version " + defaultVersion);
    }
    Parser parser = new Parser(source, defaultVersion);
    parser.parseVersionDirective();
    List<FormatItem> items = parser.parseItems(0);
    LOG.debug(
        "compiled format description (version {}) into {} items", parser.version, items.size());
    return new Compiled(parser.version, items);
  }

  private void parseVersionDirective() throws InvalidFormatDescriptionException {
    if (!cursor.startsWith(VERSION)) {
      return;
    }
    cursor.skip(VERSION.length);
    cursor.takeWhile(Ascii::isWhitespace);
    if (!cursor.consumeIf('=')) {
      // an ordinary literal that happens to start with "version"
      cursor.reset(0);
      return;
    }
    cursor.takeWhile(Ascii::isWhitespace);

    int tokenStart = cursor.offset();
    cursor.takeWhile(b -> !Ascii.isWhitespace(b) && b != ',');
    int tokenEnd = cursor.offset();
    if (tokenStart == tokenEnd) {
      throw error(ErrorKind.UNEXPECTED_TOKEN, "expected a version number", byteAt(tokenStart));
    }
    String token = cursor.slice(tokenStart, tokenEnd);
    Span tokenSpan = new Span(tokenStart, tokenEnd);
    if (!token.chars().allMatch(Ascii::isDigit)) {
      throw error(ErrorKind.UNEXPECTED_TOKEN, "expected a version number", tokenSpan);
    }
    if (!token.equals("1") && !token.equals("2")) {
      throw error(
          ErrorKind.INVALID_FORMAT_DESCRIPTION_VERSION,
          "unsupported format description version " + token,
          tokenSpan);
    }
    version = token.charAt(0) - '0';

    cursor.takeWhile(Ascii::isWhitespace);
    if (!cursor.consumeIf(',')) {
      throw error(
          ErrorKind.UNEXPECTED_TOKEN,
          "expected a comma after the version number",
          byteAt(cursor.offset()));
    }
    cursor.consumeIf(' ');
  }

  /**
   * Parses items until end of input, or, inside a nested description, until its closing
   * bracket. The closing bracket is left for the caller.
   */
  private List<FormatItem> parseItems(int depth) throws InvalidFormatDescriptionException {
    List<FormatItem> items = new ArrayList<>();
    ByteArrayOutputStream literal = new ByteArrayOutputStream();
    while (!cursor.atEnd()) {
      int b = cursor.peek();
      if (b == '[') {
        if (cursor.peekAt(1) == '[') {
          cursor.skip(2);
          literal.write('[');
          continue;
        }
        flushLiteral(literal, items);
        items.add(parseBracket(depth));
      } else if (b == ']' && depth > 0) {
        break;
      } else if (b == '\\' && version >= 2) {
        literal.write(parseEscape());
      } else {
        literal.write(cursor.advance());
      }
    }
    flushLiteral(literal, items);
    return items;
  }

  private static void flushLiteral(ByteArrayOutputStream literal, List<FormatItem> items) {
    if (literal.size() > 0) {
      items.add(new LiteralItem(literal.toString(StandardCharsets.UTF_8)));
      literal.reset();
    }
  }

  private int parseEscape() throws InvalidFormatDescriptionException {
    int backslash = cursor.offset();
    cursor.advance();
    int escaped = cursor.peek();
    if (escaped == Cursor.EOF) {
      throw error(ErrorKind.INVALID_ESCAPE_SEQUENCE, "trailing backslash", byteAt(backslash));
    }
    if (escaped != '\\' && escaped != '[' && escaped != ']') {
      throw error(
          ErrorKind.INVALID_ESCAPE_SEQUENCE,
          "invalid escape sequence",
          byteAt(cursor.offset()));
    }
    return cursor.advance();
  }

  private FormatItem parseBracket(int depth) throws InvalidFormatDescriptionException {
    int open = cursor.offset();
    cursor.advance();
    cursor.takeWhile(Ascii::isWhitespace);

    int nameStart = cursor.offset();
    cursor.takeWhile(b -> !Ascii.isWhitespace(b) && b != '[' && b != ']');
    int nameEnd = cursor.offset();
    if (nameStart == nameEnd) {
      if (cursor.atEnd()) {
        throw unclosed(open);
      }
      if (cursor.peek() == '[' && version >= 2) {
        throw error(ErrorKind.UNEXPECTED_TOKEN, "unexpected opening bracket", byteAt(nameEnd));
      }
      throw error(ErrorKind.MISSING_COMPONENT_NAME, "missing component name", byteAt(open));
    }
    String name = cursor.slice(nameStart, nameEnd);
    Span nameSpan = new Span(nameStart, nameEnd);

    if (version >= 2) {
      if (Ascii.equalsIgnoreCase(name, "optional")) {
        checkDepth(depth, open);
        return parseOptional(open, depth);
      }
      if (Ascii.equalsIgnoreCase(name, "first")) {
        checkDepth(depth, open);
        return parseFirst(open, depth);
      }
    }

    List<Span> modifiers = scanModifiers(open);
    ComponentKind kind =
        ComponentKind.parse(name)
            .orElseThrow(
                () ->
                    error(
                        ErrorKind.INVALID_COMPONENT, "invalid component `" + name + "`", nameSpan));
    return new ComponentItem(validateModifiers(kind, nameSpan, modifiers));
  }

  /** Collects the raw modifier tokens up to and including the closing bracket. */
  private List<Span> scanModifiers(int open) throws InvalidFormatDescriptionException {
    List<Span> tokens = new ArrayList<>();
    while (true) {
      cursor.takeWhile(Ascii::isWhitespace);
      int b = cursor.peek();
      if (b == Cursor.EOF) {
        throw unclosed(open);
      }
      if (b == ']') {
        cursor.advance();
        return tokens;
      }
      if (b == '[' && version >= 2) {
        throw error(
            ErrorKind.UNEXPECTED_TOKEN, "unexpected opening bracket", byteAt(cursor.offset()));
      }
      int start = cursor.offset();
      cursor.takeWhile(c -> !Ascii.isWhitespace(c) && c != ']' && !(c == '[' && version >= 2));
      tokens.add(new Span(start, cursor.offset()));
    }
  }

  private ComponentSpec validateModifiers(ComponentKind kind, Span nameSpan, List<Span> tokens)
      throws InvalidFormatDescriptionException {
    Map<ModifierKey, ModifierValue> explicit = new EnumMap<>(ModifierKey.class);
    for (Span token : tokens) {
      int colon = cursor.indexOf(':', token.start(), token.end());
      if (colon < 0) {
        throw error(ErrorKind.EXPECTED_MODIFIER_VALUE, "expected a modifier value", token);
      }
      Span keySpan = new Span(token.start(), colon);
      String keyText = cursor.slice(token.start(), colon);
      Optional<ModifierKey> key = ModifierKey.parse(keyText);
      ModifierRule rule = key.map(k -> ComponentTable.rule(kind, k)).orElse(null);
      if (rule == null) {
        throw error(
            ErrorKind.INVALID_MODIFIER_KEY,
            "invalid modifier key `" + keyText + "` for " + kind,
            keySpan);
      }
      if (colon + 1 == token.end()) {
        throw error(ErrorKind.EXPECTED_MODIFIER_VALUE, "expected a modifier value", byteAt(colon));
      }
      Span valueSpan = new Span(colon + 1, token.end());
      String valueText = cursor.slice(colon + 1, token.end());
      ModifierValue value =
          rule.parse(valueText)
              .orElseThrow(
                  () ->
                      error(
                          ErrorKind.INVALID_MODIFIER_VALUE,
                          "invalid value `" + valueText + "` for modifier " + rule.key(),
                          valueSpan));
      explicit.put(rule.key(), value);
    }
    for (ModifierRule rule : ComponentTable.rules(kind).values()) {
      if (rule.required() && !explicit.containsKey(rule.key())) {
        throw error(
            ErrorKind.MISSING_REQUIRED_MODIFIER,
            "missing required modifier " + rule.key() + " for " + kind,
            nameSpan);
      }
    }
    return ComponentSpec.of(kind, explicit);
  }

  private FormatItem parseOptional(int open, int depth) throws InvalidFormatDescriptionException {
    expectWhitespace(open, ErrorKind.EXPECTED_WHITESPACE_AFTER_OPTIONAL, "optional");
    List<FormatItem> items = parseNested(open, depth);
    cursor.takeWhile(Ascii::isWhitespace);
    expectClosingBracket(open);
    return new OptionalItem(items);
  }

  private FormatItem parseFirst(int open, int depth) throws InvalidFormatDescriptionException {
    expectWhitespace(open, ErrorKind.EXPECTED_WHITESPACE_AFTER_FIRST, "first");
    List<List<FormatItem>> alternatives = new ArrayList<>();
    alternatives.add(parseNested(open, depth));
    while (true) {
      cursor.takeWhile(Ascii::isWhitespace);
      if (cursor.peek() != '[') {
        break;
      }
      alternatives.add(parseNested(open, depth));
    }
    expectClosingBracket(open);
    return new FirstItem(alternatives);
  }

  private void expectWhitespace(int open, ErrorKind kind, String keyword)
      throws InvalidFormatDescriptionException {
    if (cursor.takeWhile(Ascii::isWhitespace) > 0) {
      return;
    }
    if (cursor.atEnd()) {
      throw unclosed(open);
    }
    throw error(kind, "expected whitespace after `" + keyword + "`", byteAt(cursor.offset()));
  }

  /** Parses one bracketed nested description, consuming both of its brackets. */
  private List<FormatItem> parseNested(int open, int depth)
      throws InvalidFormatDescriptionException {
    int nestedOpen = cursor.offset();
    int b = cursor.peek();
    if (b == Cursor.EOF) {
      throw unclosed(open);
    }
    if (b != '[') {
      throw error(
          ErrorKind.EXPECTED_OPENING_BRACKET, "expected an opening bracket", byteAt(nestedOpen));
    }
    cursor.advance();
    List<FormatItem> items = parseItems(depth + 1);
    if (!cursor.consumeIf(']')) {
      throw unclosed(nestedOpen);
    }
    return items;
  }

  private void expectClosingBracket(int open) throws InvalidFormatDescriptionException {
    int b = cursor.peek();
    if (b == Cursor.EOF) {
      throw unclosed(open);
    }
    if (b != ']') {
      throw error(
          ErrorKind.UNEXPECTED_TOKEN, "expected a closing bracket", byteAt(cursor.offset()));
    }
    cursor.advance();
  }

  private void checkDepth(int depth, int open) throws InvalidFormatDescriptionException {
    if (depth + 1 > MAX_NESTING_DEPTH) {
      throw error(
          ErrorKind.NESTING_LIMIT_EXCEEDED,
          "nesting deeper than " + MAX_NESTING_DEPTH + " levels",
          byteAt(open));
    }
  }

  // Helper methods

  private static Span byteAt(int offset) {
    return new Span(offset, offset + 1);
  }

  private InvalidFormatDescriptionException unclosed(int open) {
    return error(ErrorKind.UNCLOSED_BRACKET, "unclosed opening bracket", byteAt(open));
  }

  private InvalidFormatDescriptionException error(ErrorKind kind, String message, Span span) {
    return InvalidFormatDescriptionException.of(kind, message, span, input);
  }
}
