package io.chronofmt.ast;

/**
 * A validated modifier value.
 *
 * <p>Every enumerated value knows the token that spells it in a format description. Integer
 * values are carried by {@link Count}.
 */
public sealed interface ModifierValue
    permits Padding,
        SignBehavior,
        MonthRepr,
        HourRepr,
        WeekdayRepr,
        WeekNumberRepr,
        YearRepr,
        YearBase,
        YearRange,
        SubsecondDigits,
        UnixTimestampPrecision,
        PeriodCase,
        TrailingInput,
        Flag,
        Count {
  /**
   * Returns the token that spells this value in a format description.
   *
   * @return the description token
   */
  String token();
}
