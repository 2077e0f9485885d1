package io.chronofmt.render;

import io.chronofmt.FormattingException;
import io.chronofmt.ast.ComponentItem;
import io.chronofmt.ast.ComponentKind;
import io.chronofmt.ast.ComponentSpec;
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
import io.chronofmt.ast.UnixTimestampPrecision;
import io.chronofmt.ast.WeekNumberRepr;
import io.chronofmt.ast.Weekday;
import io.chronofmt.ast.WeekdayRepr;
import io.chronofmt.ast.YearBase;
import io.chronofmt.ast.YearRange;
import io.chronofmt.ast.YearRepr;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Executes compiled format items against a {@link ValueProvider}, producing text. */
public final class Renderer {
  private static final Logger LOG = LoggerFactory.getLogger(Renderer.class);

  private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

  private final ValueProvider value;

  private Renderer(ValueProvider value) {
    this.value = value;
  }

  /**
   * Renders format items into a buffer.
   *
   * <p>Nothing is appended to {@code out} if rendering fails.
   *
   * @param items the compiled items
   * @param value the value to render
   * @param out the buffer to append to
   * @return the number of UTF-8 bytes appended
   * @throws FormattingException if a component cannot be rendered outside any optional or first
   *     group that absorbs the failure
   */
  public static int render(List<FormatItem> items, ValueProvider value, StringBuilder out)
      throws FormattingException {
    StringBuilder scratch = new StringBuilder();
    new Renderer(value).renderItems(items, scratch);
    out.append(scratch);
    return scratch.toString().getBytes(StandardCharsets.UTF_8).length;
  }

  private void renderItems(List<FormatItem> items, StringBuilder out) throws FormattingException {
    for (FormatItem item : items) {
      renderItem(item, out);
    }
  }

  private void renderItem(FormatItem item, StringBuilder out) throws FormattingException {
    if (item instanceof LiteralItem literal) {
      out.append(literal.value());
    } else if (item instanceof ComponentItem component) {
      renderComponent(component.spec(), out);
    } else if (item instanceof OptionalItem optional) {
      StringBuilder scratch = new StringBuilder();
      try {
        renderItems(optional.items(), scratch);
        out.append(scratch);
      } catch (FormattingException e) {
        LOG.trace("dropping optional group: {}", e.getMessage());
      }
    } else if (item instanceof FirstItem first) {
      renderFirst(first, out);
    } else {
      throw new IllegalStateException("unknown format item: " + item);
    }
  }

  private void renderFirst(FirstItem first, StringBuilder out) throws FormattingException {
    FormattingException last = null;
    for (List<FormatItem> alternative : first.alternatives()) {
      StringBuilder scratch = new StringBuilder();
      try {
        renderItems(alternative, scratch);
        out.append(scratch);
        return;
      } catch (FormattingException e) {
        LOG.trace("first alternative failed: {}", e.getMessage());
        last = e;
      }
    }
    throw last;
  }

  private void renderComponent(ComponentSpec spec, StringBuilder out) throws FormattingException {
    ComponentKind kind = spec.kind();
    if (!supplied(kind)) {
      throw FormattingException.unsupported(kind.displayName());
    }
    switch (kind) {
      case DAY -> digits(out, value.day(), 2, spec.padding());
      case MONTH -> renderMonth(spec, out);
      case ORDINAL -> digits(out, value.ordinal(), 3, spec.padding());
      case WEEKDAY -> renderWeekday(spec, out);
      case WEEK_NUMBER -> renderWeekNumber(spec, out);
      case YEAR -> renderYear(spec, out);
      case HOUR -> renderHour(spec, out);
      case MINUTE -> digits(out, value.minute(), 2, spec.padding());
      case PERIOD -> renderPeriod(spec, out);
      case SECOND -> digits(out, value.second(), 2, spec.padding());
      case SUBSECOND -> renderSubsecond(spec, out);
      case OFFSET_HOUR -> {
        sign(out, value.offsetIsNegative(), spec.signMandatory());
        digits(out, value.offsetHour(), 2, spec.padding());
      }
      case OFFSET_MINUTE -> digits(out, value.offsetMinute(), 2, spec.padding());
      case OFFSET_SECOND -> digits(out, value.offsetSecond(), 2, spec.padding());
      case UNIX_TIMESTAMP -> renderUnixTimestamp(spec, out);
      case IGNORE, END -> {
        // nothing to write
      }
      default -> throw new IllegalStateException("unhandled component " + kind);
    }
  }

  private boolean supplied(ComponentKind kind) {
    return switch (kind) {
      case DAY, MONTH, ORDINAL, WEEKDAY, WEEK_NUMBER, YEAR -> value.suppliesDate();
      case HOUR, MINUTE, PERIOD, SECOND, SUBSECOND -> value.suppliesTime();
      case OFFSET_HOUR, OFFSET_MINUTE, OFFSET_SECOND -> value.suppliesOffset();
      case UNIX_TIMESTAMP -> value.suppliesTimestamp();
      case IGNORE, END -> true;
    };
  }

  private void renderMonth(ComponentSpec spec, StringBuilder out) {
    MonthName month = MonthName.of(value.month());
    switch (spec.get(ModifierKey.REPR, MonthRepr.class)) {
      case NUMERICAL -> digits(out, month.number(), 2, spec.padding());
      case LONG -> out.append(month.longName());
      case SHORT -> out.append(month.shortName());
    }
  }

  private void renderWeekday(ComponentSpec spec, StringBuilder out) {
    Weekday weekday = value.weekday();
    int oneIndexed = spec.get(ModifierKey.ONE_INDEXED, Flag.class).isTrue() ? 1 : 0;
    switch (spec.get(ModifierKey.REPR, WeekdayRepr.class)) {
      case LONG -> out.append(weekday.longName());
      case SHORT -> out.append(weekday.shortName());
      case SUNDAY -> out.append(weekday.daysFromSunday() + oneIndexed);
      case MONDAY -> out.append(weekday.daysFromMonday() + oneIndexed);
    }
  }

  private void renderWeekNumber(ComponentSpec spec, StringBuilder out) {
    WeekNumberRepr repr = spec.get(ModifierKey.REPR, WeekNumberRepr.class);
    int week =
        switch (repr) {
          case ISO -> value.isoWeekNumber();
          case SUNDAY -> value.sundayWeekNumber();
          case MONDAY -> value.mondayWeekNumber();
        };
    digits(out, week, 2, spec.padding());
  }

  private void renderYear(ComponentSpec spec, StringBuilder out) throws FormattingException {
    int year =
        spec.get(ModifierKey.BASE, YearBase.class) == YearBase.ISO_WEEK
            ? value.isoYear()
            : value.year();
    YearRepr repr = spec.get(ModifierKey.REPR, YearRepr.class);
    boolean extended = spec.get(ModifierKey.RANGE, YearRange.class) == YearRange.EXTENDED;
    int abs = Math.abs(year);

    if (repr == YearRepr.LAST_TWO) {
      digits(out, abs % 100, 2, spec.padding());
      return;
    }
    if (!extended && abs > 9_999) {
      throw FormattingException.invalidValue(ComponentKind.YEAR.displayName(), year);
    }
    if (extended && abs > 999_999) {
      throw FormattingException.invalidValue(ComponentKind.YEAR.displayName(), year);
    }
    // five and six digit years always carry a sign so they parse back unambiguously
    sign(out, year < 0, spec.signMandatory() || year >= 10_000);
    if (repr == YearRepr.FULL) {
      if (abs <= 9_999) {
        digits(out, abs, 4, spec.padding());
      } else {
        digits(out, abs, abs <= 99_999 ? 5 : 6, Padding.ZERO);
      }
    } else {
      int century = abs / 100;
      digits(out, century, century <= 99 ? 2 : century <= 999 ? 3 : 4, spec.padding());
    }
  }

  private void renderHour(ComponentSpec spec, StringBuilder out) {
    int hour = value.hour();
    if (spec.get(ModifierKey.REPR, HourRepr.class) == HourRepr.TWELVE) {
      hour = hour % 12 == 0 ? 12 : hour % 12;
    }
    digits(out, hour, 2, spec.padding());
  }

  private void renderPeriod(ComponentSpec spec, StringBuilder out) {
    boolean pm = value.hour() >= 12;
    boolean upper = spec.get(ModifierKey.CASE, PeriodCase.class) == PeriodCase.UPPER;
    out.append(upper ? (pm ? "PM" : "AM") : (pm ? "pm" : "am"));
  }

  private void renderSubsecond(ComponentSpec spec, StringBuilder out) {
    StringBuilder nanos = new StringBuilder(9);
    digits(nanos, value.nanosecond(), 9, Padding.ZERO);
    int count = spec.get(ModifierKey.DIGITS, SubsecondDigits.class).count();
    if (count == 0) {
      count = 9;
      while (count > 1 && nanos.charAt(count - 1) == '0') {
        count--;
      }
    }
    out.append(nanos, 0, count);
  }

  private void renderUnixTimestamp(ComponentSpec spec, StringBuilder out) {
    UnixTimestampPrecision precision =
        spec.get(ModifierKey.PRECISION, UnixTimestampPrecision.class);
    BigInteger nanos =
        BigInteger.valueOf(value.unixTimestampSeconds())
            .multiply(NANOS_PER_SECOND)
            .add(BigInteger.valueOf(value.unixTimestampNanos()));
    // BigInteger division truncates toward zero
    BigInteger timestamp = nanos.divide(BigInteger.valueOf(precision.nanosPerUnit()));
    sign(out, timestamp.signum() < 0, spec.signMandatory());
    out.append(timestamp.abs());
  }

  private static void sign(StringBuilder out, boolean negative, boolean mandatory) {
    if (negative) {
      out.append('-');
    } else if (mandatory) {
      out.append('+');
    }
  }

  private static void digits(StringBuilder out, int n, int width, Padding padding) {
    String s = Integer.toString(n);
    if (padding != Padding.NONE) {
      char pad = padding == Padding.ZERO ? '0' : ' ';
      for (int i = s.length(); i < width; i++) {
        out.append(pad);
      }
    }
    out.append(s);
  }
}
