package io.chronofmt.parser;

import io.chronofmt.ErrorKind;
import io.chronofmt.InvalidFormatDescriptionException;
import io.chronofmt.Span;
import io.chronofmt.ast.ComponentItem;
import io.chronofmt.ast.ComponentKind;
import io.chronofmt.ast.ComponentSpec;
import io.chronofmt.ast.Flag;
import io.chronofmt.ast.FormatItem;
import io.chronofmt.ast.HourRepr;
import io.chronofmt.ast.LiteralItem;
import io.chronofmt.ast.ModifierKey;
import io.chronofmt.ast.ModifierValue;
import io.chronofmt.ast.MonthRepr;
import io.chronofmt.ast.Padding;
import io.chronofmt.ast.PeriodCase;
import io.chronofmt.ast.SignBehavior;
import io.chronofmt.ast.WeekNumberRepr;
import io.chronofmt.ast.WeekdayRepr;
import io.chronofmt.ast.YearBase;
import io.chronofmt.ast.YearRepr;
import io.chronofmt.lexer.Cursor;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles strftime-style descriptions such as {@code %Y-%m-%d} into format items.
 *
 * <p>A conversion is {@code %}, an optional padding flag and one conversion character. The flag
 * is {@code _} for spaces, {@code -} for none or {@code 0} for zeros, and only changes numeric
 * conversions that stand for a single padded component. Everything outside a conversion is
 * literal text.
 */
public final class StrftimeParser {
  private static final Logger LOG = LoggerFactory.getLogger(StrftimeParser.class);

  private final String input;
  private final Cursor cursor;
  private final List<FormatItem> items = new ArrayList<>();
  private final ByteArrayOutputStream literal = new ByteArrayOutputStream();

  private StrftimeParser(String input) {
    this.input = input;
    this.cursor = Cursor.of(input);
  }

  /**
   * Compiles a strftime description.
   *
   * @param source the description
   * @return the compiled items
   * @throws InvalidFormatDescriptionException if a conversion is unknown, unsupported or cut off
   */
  public static List<FormatItem> parse(String source) throws InvalidFormatDescriptionException {
    StrftimeParser parser = new StrftimeParser(source);
    parser.parseItems();
    LOG.debug("compiled strftime description into {} items", parser.items.size());
    return List.copyOf(parser.items);
  }

  private void parseItems() throws InvalidFormatDescriptionException {
    while (!cursor.atEnd()) {
      if (cursor.peek() == '%') {
        parseConversion();
      } else {
        literal.write(cursor.advance());
      }
    }
    flushLiteral();
  }

  private void parseConversion() throws InvalidFormatDescriptionException {
    int percent = cursor.offset();
    cursor.advance();
    Padding flag = null;
    switch (cursor.peek()) {
      case '_' -> flag = Padding.SPACE;
      case '-' -> flag = Padding.NONE;
      case '0' -> flag = Padding.ZERO;
      default -> {}
    }
    if (flag != null) {
      cursor.advance();
    }
    int at = cursor.offset();
    int c = cursor.advance();
    if (c == Cursor.EOF) {
      throw error(
          ErrorKind.INVALID_ESCAPE_SEQUENCE,
          "expected a conversion character after `%`",
          new Span(percent, at));
    }
    switch (c) {
      case '%' -> literal.write('%');
      case 'n' -> literal.write('\n');
      case 't' -> literal.write('\t');
      case 'a' -> component(ComponentKind.WEEKDAY, Map.of(ModifierKey.REPR, WeekdayRepr.SHORT));
      case 'A' -> component(ComponentKind.WEEKDAY, Map.of(ModifierKey.REPR, WeekdayRepr.LONG));
      case 'b', 'h' ->
          component(ComponentKind.MONTH, Map.of(ModifierKey.REPR, MonthRepr.SHORT));
      case 'B' -> component(ComponentKind.MONTH, Map.of(ModifierKey.REPR, MonthRepr.LONG));
      case 'c' -> {
        component(ComponentKind.WEEKDAY, Map.of(ModifierKey.REPR, WeekdayRepr.SHORT));
        literal(" ");
        component(ComponentKind.MONTH, Map.of(ModifierKey.REPR, MonthRepr.SHORT));
        literal(" ");
        component(ComponentKind.DAY, Map.of(ModifierKey.PADDING, Padding.SPACE));
        literal(" ");
        time();
        literal(" ");
        component(ComponentKind.YEAR, Map.of());
      }
      case 'C' ->
          component(
              ComponentKind.YEAR,
              Map.of(
                  ModifierKey.REPR, YearRepr.CENTURY, ModifierKey.PADDING, or(flag, Padding.ZERO)));
      case 'd' -> padded(ComponentKind.DAY, flag, Padding.ZERO);
      case 'D', 'x' -> {
        component(ComponentKind.MONTH, Map.of());
        literal("/");
        component(ComponentKind.DAY, Map.of());
        literal("/");
        component(ComponentKind.YEAR, Map.of(ModifierKey.REPR, YearRepr.LAST_TWO));
      }
      case 'e' -> padded(ComponentKind.DAY, flag, Padding.SPACE);
      case 'F' -> {
        component(ComponentKind.YEAR, Map.of());
        literal("-");
        component(ComponentKind.MONTH, Map.of());
        literal("-");
        component(ComponentKind.DAY, Map.of());
      }
      case 'g' ->
          component(
              ComponentKind.YEAR,
              Map.of(
                  ModifierKey.REPR, YearRepr.LAST_TWO,
                  ModifierKey.BASE, YearBase.ISO_WEEK,
                  ModifierKey.PADDING, or(flag, Padding.ZERO)));
      case 'G' -> component(ComponentKind.YEAR, Map.of(ModifierKey.BASE, YearBase.ISO_WEEK));
      case 'H' -> padded(ComponentKind.HOUR, flag, Padding.ZERO);
      case 'I' -> hour12(or(flag, Padding.ZERO));
      case 'j' -> padded(ComponentKind.ORDINAL, flag, Padding.ZERO);
      case 'k' -> padded(ComponentKind.HOUR, flag, Padding.SPACE);
      case 'l' -> hour12(or(flag, Padding.SPACE));
      case 'm' -> padded(ComponentKind.MONTH, flag, Padding.ZERO);
      case 'M' -> padded(ComponentKind.MINUTE, flag, Padding.ZERO);
      case 'p' -> component(ComponentKind.PERIOD, Map.of(ModifierKey.CASE, PeriodCase.UPPER));
      case 'P' -> component(ComponentKind.PERIOD, Map.of(ModifierKey.CASE, PeriodCase.LOWER));
      case 'r' -> {
        hour12(Padding.ZERO);
        literal(":");
        component(ComponentKind.MINUTE, Map.of());
        literal(":");
        component(ComponentKind.SECOND, Map.of());
        literal(" ");
        component(ComponentKind.PERIOD, Map.of());
      }
      case 'R' -> {
        component(ComponentKind.HOUR, Map.of());
        literal(":");
        component(ComponentKind.MINUTE, Map.of());
      }
      case 's' -> component(ComponentKind.UNIX_TIMESTAMP, Map.of());
      case 'S' -> padded(ComponentKind.SECOND, flag, Padding.ZERO);
      case 'T', 'X' -> time();
      case 'u' ->
          component(
              ComponentKind.WEEKDAY,
              Map.of(ModifierKey.REPR, WeekdayRepr.MONDAY, ModifierKey.ONE_INDEXED, Flag.TRUE));
      case 'w' ->
          component(
              ComponentKind.WEEKDAY,
              Map.of(ModifierKey.REPR, WeekdayRepr.SUNDAY, ModifierKey.ONE_INDEXED, Flag.FALSE));
      case 'U' -> weekNumber(WeekNumberRepr.SUNDAY, or(flag, Padding.ZERO));
      case 'V' -> weekNumber(WeekNumberRepr.ISO, or(flag, Padding.ZERO));
      case 'W' -> weekNumber(WeekNumberRepr.MONDAY, or(flag, Padding.ZERO));
      case 'y' ->
          component(
              ComponentKind.YEAR,
              Map.of(
                  ModifierKey.REPR,
                  YearRepr.LAST_TWO,
                  ModifierKey.PADDING,
                  or(flag, Padding.ZERO)));
      case 'Y' -> component(ComponentKind.YEAR, Map.of());
      case 'z' -> {
        component(ComponentKind.OFFSET_HOUR, Map.of(ModifierKey.SIGN, SignBehavior.MANDATORY));
        component(ComponentKind.OFFSET_MINUTE, Map.of());
      }
      case 'E', 'O' ->
          throw error(
              ErrorKind.NOT_SUPPORTED,
              "the locale modifier `" + (char) c + "` is not supported",
              new Span(at, at + 1));
      case 'Z' ->
          throw error(
              ErrorKind.NOT_SUPPORTED,
              "time zone names are not supported",
              new Span(at, at + 1));
      default -> throw invalidConversion(at, c);
    }
  }

  private void time() {
    component(ComponentKind.HOUR, Map.of());
    literal(":");
    component(ComponentKind.MINUTE, Map.of());
    literal(":");
    component(ComponentKind.SECOND, Map.of());
  }

  private void hour12(Padding padding) {
    component(
        ComponentKind.HOUR,
        Map.of(ModifierKey.REPR, HourRepr.TWELVE, ModifierKey.PADDING, padding));
  }

  private void weekNumber(WeekNumberRepr repr, Padding padding) {
    component(
        ComponentKind.WEEK_NUMBER, Map.of(ModifierKey.REPR, repr, ModifierKey.PADDING, padding));
  }

  private void padded(ComponentKind kind, Padding flag, Padding fallback) {
    component(kind, Map.of(ModifierKey.PADDING, or(flag, fallback)));
  }

  private InvalidFormatDescriptionException invalidConversion(int at, int lead) {
    // a non-ASCII conversion character spans its whole UTF-8 sequence
    int length = 1;
    if ((lead & 0xE0) == 0xC0) {
      length = 2;
    } else if ((lead & 0xF0) == 0xE0) {
      length = 3;
    } else if ((lead & 0xF8) == 0xF0) {
      length = 4;
    }
    int end = Math.min(at + length, at + 1 + cursor.remaining());
    String name = cursor.slice(at, end);
    return error(
        ErrorKind.INVALID_COMPONENT, "invalid conversion `%" + name + "`", new Span(at, end));
  }

  // Helper methods

  private static Padding or(Padding flag, Padding fallback) {
    return flag != null ? flag : fallback;
  }

  private void component(ComponentKind kind, Map<ModifierKey, ModifierValue> explicit) {
    flushLiteral();
    items.add(new ComponentItem(ComponentSpec.of(kind, explicit)));
  }

  private void literal(String text) {
    literal.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }

  private void flushLiteral() {
    if (literal.size() > 0) {
      items.add(new LiteralItem(literal.toString(StandardCharsets.UTF_8)));
      literal.reset();
    }
  }

  private InvalidFormatDescriptionException error(ErrorKind kind, String message, Span span) {
    return InvalidFormatDescriptionException.of(kind, message, span, input);
  }
}
