package io.chronofmt.parsing;

import io.chronofmt.ParseFromDescriptionException;
import io.chronofmt.ast.ComponentItem;
import io.chronofmt.ast.ComponentSpec;
import io.chronofmt.ast.Count;
import io.chronofmt.ast.FirstItem;
import io.chronofmt.ast.Flag;
import io.chronofmt.ast.FormatItem;
import io.chronofmt.ast.HourRepr;
import io.chronofmt.ast.LiteralItem;
import io.chronofmt.ast.ModifierKey;
import io.chronofmt.ast.MonthName;
import io.chronofmt.ast.MonthRepr;
import io.chronofmt.ast.OptionalItem;
import io.chronofmt.ast.Padding;
import io.chronofmt.ast.PeriodCase;
import io.chronofmt.ast.SubsecondDigits;
import io.chronofmt.ast.TrailingInput;
import io.chronofmt.ast.UnixTimestampPrecision;
import io.chronofmt.ast.WeekNumberRepr;
import io.chronofmt.ast.Weekday;
import io.chronofmt.ast.WeekdayRepr;
import io.chronofmt.ast.YearBase;
import io.chronofmt.ast.YearRange;
import io.chronofmt.ast.YearRepr;
import io.chronofmt.lexer.Ascii;
import io.chronofmt.lexer.Cursor;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes compiled format items against input text, filling a {@link Parsed} accumulator.
 *
 * <p>Trailing input is left in the cursor; whether it is allowed is the caller's decision.
 */
public final class InputParser {
  private static final Logger LOG = LoggerFactory.getLogger(InputParser.class);

  private final Cursor cursor;
  private final Parsed parsed;

  private InputParser(Cursor cursor, Parsed parsed) {
    this.cursor = cursor;
    this.parsed = parsed;
  }

  /**
   * Matches format items against the input at the cursor.
   *
   * @param items the compiled items
   * @param cursor the input, advanced past everything matched
   * @param parsed the accumulator receiving decoded fields
   * @throws ParseFromDescriptionException if the input does not match
   */
  public static void parse(List<FormatItem> items, Cursor cursor, Parsed parsed)
      throws ParseFromDescriptionException {
    new InputParser(cursor, parsed).parseItems(items);
  }

  private void parseItems(List<FormatItem> items) throws ParseFromDescriptionException {
    for (FormatItem item : items) {
      parseItem(item);
    }
  }

  private void parseItem(FormatItem item) throws ParseFromDescriptionException {
    if (item instanceof LiteralItem literal) {
      if (!cursor.startsWith(literal.value().getBytes(StandardCharsets.UTF_8))) {
        throw ParseFromDescriptionException.invalidLiteral(cursor.offset());
      }
      cursor.skip(literal.value().getBytes(StandardCharsets.UTF_8).length);
    } else if (item instanceof ComponentItem component) {
      parseComponent(component.spec());
    } else if (item instanceof OptionalItem optional) {
      int mark = cursor.mark();
      Parsed snapshot = parsed.copy();
      try {
        parseItems(optional.items());
      } catch (ParseFromDescriptionException e) {
        LOG.trace("optional group skipped at byte {}: {}", mark, e.getMessage());
        cursor.reset(mark);
        parsed.restore(snapshot);
      }
    } else if (item instanceof FirstItem first) {
      parseFirst(first);
    } else {
      throw new IllegalStateException("unknown format item: " + item);
    }
  }

  private void parseFirst(FirstItem first) throws ParseFromDescriptionException {
    int mark = cursor.mark();
    Parsed snapshot = parsed.copy();
    ParseFromDescriptionException last = null;
    for (List<FormatItem> alternative : first.alternatives()) {
      try {
        parseItems(alternative);
        return;
      } catch (ParseFromDescriptionException e) {
        LOG.trace("first alternative failed at byte {}: {}", mark, e.getMessage());
        cursor.reset(mark);
        parsed.restore(snapshot);
        last = e;
      }
    }
    throw last;
  }

  private void parseComponent(ComponentSpec spec) throws ParseFromDescriptionException {
    int start = cursor.mark();
    if (!matchComponent(spec, start)) {
      cursor.reset(start);
      throw ParseFromDescriptionException.invalidComponent(spec.kind().displayName(), start);
    }
  }

  /** Returns false if the input holds no valid value for the component. */
  private boolean matchComponent(ComponentSpec spec, int start)
      throws ParseFromDescriptionException {
    Padding padding = paddingOf(spec);
    return switch (spec.kind()) {
      case DAY -> store(ParsedField.DAY, digits(2, 2, padding), 1, 31, start);
      case MONTH -> matchMonth(spec, padding, start);
      case ORDINAL -> store(ParsedField.ORDINAL, digits(3, 3, padding), 1, 366, start);
      case WEEKDAY -> matchWeekday(spec, start);
      case WEEK_NUMBER -> matchWeekNumber(spec, padding, start);
      case YEAR -> matchYear(spec, padding, start);
      case HOUR -> matchHour(spec, padding, start);
      case MINUTE -> store(ParsedField.MINUTE, digits(2, 2, padding), 0, 59, start);
      case PERIOD -> matchPeriod(spec, start);
      case SECOND -> store(ParsedField.SECOND, digits(2, 2, padding), 0, 59, start);
      case SUBSECOND -> matchSubsecond(spec, start);
      case OFFSET_HOUR -> matchOffsetHour(spec, padding, start);
      case OFFSET_MINUTE -> store(ParsedField.OFFSET_MINUTE, digits(2, 2, padding), 0, 59, start);
      case OFFSET_SECOND -> store(ParsedField.OFFSET_SECOND, digits(2, 2, padding), 0, 59, start);
      case UNIX_TIMESTAMP -> matchUnixTimestamp(spec, start);
      case IGNORE -> matchIgnore(spec);
      case END -> matchEnd(spec);
    };
  }

  private static Padding paddingOf(ComponentSpec spec) {
    return spec.modifiers().containsKey(ModifierKey.PADDING) ? spec.padding() : Padding.ZERO;
  }

  private boolean store(ParsedField field, long value, int min, int max, int start)
      throws ParseFromDescriptionException {
    if (value < min || value > max) {
      return false;
    }
    parsed.set(field, (int) value, start);
    return true;
  }

  private boolean matchMonth(ComponentSpec spec, Padding padding, int start)
      throws ParseFromDescriptionException {
    MonthRepr repr = spec.get(ModifierKey.REPR, MonthRepr.class);
    if (repr == MonthRepr.NUMERICAL) {
      return store(ParsedField.MONTH, digits(2, 2, padding), 1, 12, start);
    }
    for (MonthName month : MonthName.values()) {
      String name = repr == MonthRepr.LONG ? month.longName() : month.shortName();
      if (matchName(name, spec.caseSensitive())) {
        parsed.set(ParsedField.MONTH, month.number(), start);
        return true;
      }
    }
    return false;
  }

  private boolean matchWeekday(ComponentSpec spec, int start)
      throws ParseFromDescriptionException {
    WeekdayRepr repr = spec.get(ModifierKey.REPR, WeekdayRepr.class);
    if (repr == WeekdayRepr.LONG || repr == WeekdayRepr.SHORT) {
      for (Weekday weekday : Weekday.values()) {
        String name = repr == WeekdayRepr.LONG ? weekday.longName() : weekday.shortName();
        if (matchName(name, spec.caseSensitive())) {
          parsed.set(ParsedField.WEEKDAY, weekday, start);
          return true;
        }
      }
      return false;
    }
    int b = cursor.peek();
    if (!Ascii.isDigit(b)) {
      return false;
    }
    cursor.advance();
    int days = b - '0' - (spec.get(ModifierKey.ONE_INDEXED, Flag.class).isTrue() ? 1 : 0);
    if (days < 0 || days > 6) {
      return false;
    }
    // days counted from Monday map straight onto the enum order
    int fromMonday = repr == WeekdayRepr.MONDAY ? days : (days + 6) % 7;
    parsed.set(ParsedField.WEEKDAY, Weekday.values()[fromMonday], start);
    return true;
  }

  private boolean matchWeekNumber(ComponentSpec spec, Padding padding, int start)
      throws ParseFromDescriptionException {
    long week = digits(2, 2, padding);
    return switch (spec.get(ModifierKey.REPR, WeekNumberRepr.class)) {
      case ISO -> store(ParsedField.ISO_WEEK_NUMBER, week, 1, 53, start);
      case SUNDAY -> store(ParsedField.SUNDAY_WEEK_NUMBER, week, 0, 53, start);
      case MONDAY -> store(ParsedField.MONDAY_WEEK_NUMBER, week, 0, 53, start);
    };
  }

  private boolean matchYear(ComponentSpec spec, Padding padding, int start)
      throws ParseFromDescriptionException {
    YearRepr repr = spec.get(ModifierKey.REPR, YearRepr.class);
    boolean iso = spec.get(ModifierKey.BASE, YearBase.class) == YearBase.ISO_WEEK;
    boolean extended = spec.get(ModifierKey.RANGE, YearRange.class) == YearRange.EXTENDED;

    if (repr == YearRepr.LAST_TWO) {
      ParsedField field = iso ? ParsedField.ISO_YEAR_LAST_TWO : ParsedField.YEAR_LAST_TWO;
      return store(field, digits(2, 2, padding), 0, 99, start);
    }

    int sign = sign();
    long value;
    if (sign != 0) {
      value =
          repr == YearRepr.FULL
              ? digits(4, extended ? 6 : 4, padding)
              : digits(2, extended ? 4 : 2, padding);
    } else if (spec.signMandatory()) {
      return false;
    } else {
      value = repr == YearRepr.FULL ? digits(4, 4, padding) : digits(1, 2, padding);
    }
    if (value < 0) {
      return false;
    }
    int year = (int) (sign < 0 ? -value : value);
    if (repr == YearRepr.FULL) {
      parsed.set(iso ? ParsedField.ISO_YEAR : ParsedField.YEAR, year, start);
      return true;
    }
    parsed.set(iso ? ParsedField.ISO_YEAR_CENTURY : ParsedField.YEAR_CENTURY, year, start);
    // "-00" has no sign in its value
    if (sign != 0) {
      ParsedField negative =
          iso ? ParsedField.ISO_YEAR_CENTURY_IS_NEGATIVE : ParsedField.YEAR_CENTURY_IS_NEGATIVE;
      parsed.set(negative, sign < 0, start);
    }
    return true;
  }

  private boolean matchHour(ComponentSpec spec, Padding padding, int start)
      throws ParseFromDescriptionException {
    long hour = digits(2, 2, padding);
    if (spec.get(ModifierKey.REPR, HourRepr.class) == HourRepr.TWELVE) {
      return store(ParsedField.HOUR_12, hour, 1, 12, start);
    }
    return store(ParsedField.HOUR_24, hour, 0, 23, start);
  }

  private boolean matchPeriod(ComponentSpec spec, int start)
      throws ParseFromDescriptionException {
    boolean upper = spec.get(ModifierKey.CASE, PeriodCase.class) == PeriodCase.UPPER;
    String am = upper ? "AM" : "am";
    String pm = upper ? "PM" : "pm";
    if (matchName(am, spec.caseSensitive())) {
      parsed.set(ParsedField.HOUR_12_IS_PM, Boolean.FALSE, start);
      return true;
    }
    if (matchName(pm, spec.caseSensitive())) {
      parsed.set(ParsedField.HOUR_12_IS_PM, Boolean.TRUE, start);
      return true;
    }
    return false;
  }

  private boolean matchSubsecond(ComponentSpec spec, int start)
      throws ParseFromDescriptionException {
    int count = spec.get(ModifierKey.DIGITS, SubsecondDigits.class).count();
    int digitsStart = cursor.offset();
    int taken =
        count == 0 ? cursor.takeWhile(Ascii::isDigit) : cursor.takeWhile(Ascii::isDigit, count);
    if (taken == 0 || (count != 0 && taken < count)) {
      return false;
    }
    // digits past the ninth are below nanosecond precision
    String text = cursor.slice(digitsStart, digitsStart + Math.min(taken, 9));
    int nanos = Integer.parseInt(text);
    for (int i = text.length(); i < 9; i++) {
      nanos *= 10;
    }
    parsed.set(ParsedField.SUBSECOND, nanos, start);
    return true;
  }

  private boolean matchOffsetHour(ComponentSpec spec, Padding padding, int start)
      throws ParseFromDescriptionException {
    int sign = sign();
    long hour = digits(2, 2, padding);
    if (hour < 0 || hour > 25 || (sign == 0 && spec.signMandatory())) {
      return false;
    }
    parsed.set(ParsedField.OFFSET_HOUR, (int) (sign < 0 ? -hour : hour), start);
    parsed.set(ParsedField.OFFSET_IS_NEGATIVE, sign < 0, start);
    return true;
  }

  private boolean matchUnixTimestamp(ComponentSpec spec, int start)
      throws ParseFromDescriptionException {
    UnixTimestampPrecision precision =
        spec.get(ModifierKey.PRECISION, UnixTimestampPrecision.class);
    int sign = sign();
    if (sign == 0 && spec.signMandatory()) {
      return false;
    }
    int maxDigits =
        switch (precision) {
          case SECOND -> 14;
          case MILLISECOND -> 17;
          case MICROSECOND -> 20;
          case NANOSECOND -> 23;
        };
    int digitsStart = cursor.offset();
    int taken = cursor.takeWhile(Ascii::isDigit, maxDigits);
    if (taken == 0) {
      return false;
    }
    BigInteger nanos =
        new BigInteger(cursor.slice(digitsStart, digitsStart + taken))
            .multiply(BigInteger.valueOf(precision.nanosPerUnit()));
    parsed.set(ParsedField.UNIX_TIMESTAMP_NANOS, sign < 0 ? nanos.negate() : nanos, start);
    return true;
  }

  private boolean matchIgnore(ComponentSpec spec) {
    int count = spec.get(ModifierKey.COUNT, Count.class).value();
    if (cursor.remaining() < count) {
      return false;
    }
    cursor.skip(count);
    return true;
  }

  private boolean matchEnd(ComponentSpec spec) {
    if (spec.get(ModifierKey.TRAILING_INPUT, TrailingInput.class) == TrailingInput.DISCARD) {
      cursor.skip(cursor.remaining());
      return true;
    }
    return cursor.atEnd();
  }

  // Helper methods

  private boolean matchName(String name, boolean caseSensitive) {
    byte[] bytes = name.getBytes(StandardCharsets.US_ASCII);
    boolean matched = caseSensitive ? cursor.startsWith(bytes) : cursor.startsWithIgnoreCase(bytes);
    if (matched) {
      cursor.skip(bytes.length);
    }
    return matched;
  }

  /** Consumes an optional sign, returning -1, 1, or 0 when there is none. */
  private int sign() {
    if (cursor.consumeIf('-')) {
      return -1;
    }
    return cursor.consumeIf('+') ? 1 : 0;
  }

  /**
   * Reads a number of {@code min} to {@code max} digits under the given padding.
   *
   * <p>{@code zero} needs at least {@code min} digits, {@code none} at least one. {@code space}
   * accepts up to {@code min - 1} leading spaces standing in for digits.
   *
   * @return the value, or -1 if the input does not hold a number here
   */
  private long digits(int min, int max, Padding padding) {
    int start = cursor.offset();
    int taken;
    switch (padding) {
      case NONE -> taken = cursor.takeWhile(Ascii::isDigit, max);
      case ZERO -> {
        taken = cursor.takeWhile(Ascii::isDigit, max);
        if (taken < min) {
          return -1;
        }
      }
      case SPACE -> {
        int spaces = cursor.takeWhile(b -> b == ' ', min - 1);
        start = cursor.offset();
        taken = cursor.takeWhile(Ascii::isDigit, max - spaces);
        if (taken < min - spaces) {
          return -1;
        }
      }
      default -> throw new IllegalStateException("unhandled padding " + padding);
    }
    if (taken == 0) {
      return -1;
    }
    return Long.parseLong(cursor.slice(start, start + taken));
  }
}
