package io.chronofmt.ast;

import static io.chronofmt.ast.ModifierRule.oneOf;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Static registry of the modifiers each component accepts, with their values and defaults. */
public final class ComponentTable {
  private ComponentTable() {}

  private static final ModifierRule PADDING =
      oneOf(ModifierKey.PADDING, Padding.ZERO, Padding.SPACE, Padding.NONE);
  private static final ModifierRule SIGN =
      oneOf(ModifierKey.SIGN, SignBehavior.AUTOMATIC, SignBehavior.MANDATORY);
  private static final ModifierRule CASE_SENSITIVE =
      oneOf(ModifierKey.CASE_SENSITIVE, Flag.TRUE, Flag.FALSE);

  private static final Map<ComponentKind, Map<ModifierKey, ModifierRule>> RULES = build();

  private static Map<ComponentKind, Map<ModifierKey, ModifierRule>> build() {
    Map<ComponentKind, Map<ModifierKey, ModifierRule>> rules = new EnumMap<>(ComponentKind.class);
    put(rules, ComponentKind.DAY, PADDING);
    put(
        rules,
        ComponentKind.END,
        oneOf(ModifierKey.TRAILING_INPUT, TrailingInput.PROHIBIT, TrailingInput.DISCARD));
    put(
        rules,
        ComponentKind.HOUR,
        PADDING,
        oneOf(ModifierKey.REPR, HourRepr.TWENTY_FOUR, HourRepr.TWELVE));
    put(rules, ComponentKind.IGNORE, ModifierRule.requiredCount(ModifierKey.COUNT, 1, 65_535));
    put(rules, ComponentKind.MINUTE, PADDING);
    put(
        rules,
        ComponentKind.MONTH,
        PADDING,
        oneOf(ModifierKey.REPR, MonthRepr.NUMERICAL, MonthRepr.LONG, MonthRepr.SHORT),
        CASE_SENSITIVE);
    put(rules, ComponentKind.OFFSET_HOUR, SIGN, PADDING);
    put(rules, ComponentKind.OFFSET_MINUTE, PADDING);
    put(rules, ComponentKind.OFFSET_SECOND, PADDING);
    put(rules, ComponentKind.ORDINAL, PADDING);
    put(
        rules,
        ComponentKind.PERIOD,
        oneOf(ModifierKey.CASE, PeriodCase.UPPER, PeriodCase.LOWER),
        CASE_SENSITIVE);
    put(rules, ComponentKind.SECOND, PADDING);
    put(
        rules,
        ComponentKind.SUBSECOND,
        oneOf(
            ModifierKey.DIGITS,
            SubsecondDigits.ONE_OR_MORE,
            SubsecondDigits.ONE,
            SubsecondDigits.TWO,
            SubsecondDigits.THREE,
            SubsecondDigits.FOUR,
            SubsecondDigits.FIVE,
            SubsecondDigits.SIX,
            SubsecondDigits.SEVEN,
            SubsecondDigits.EIGHT,
            SubsecondDigits.NINE));
    put(
        rules,
        ComponentKind.UNIX_TIMESTAMP,
        oneOf(
            ModifierKey.PRECISION,
            UnixTimestampPrecision.SECOND,
            UnixTimestampPrecision.MILLISECOND,
            UnixTimestampPrecision.MICROSECOND,
            UnixTimestampPrecision.NANOSECOND),
        SIGN);
    put(
        rules,
        ComponentKind.WEEKDAY,
        oneOf(
            ModifierKey.REPR,
            WeekdayRepr.LONG,
            WeekdayRepr.SHORT,
            WeekdayRepr.SUNDAY,
            WeekdayRepr.MONDAY),
        oneOf(ModifierKey.ONE_INDEXED, Flag.TRUE, Flag.FALSE),
        CASE_SENSITIVE);
    put(
        rules,
        ComponentKind.WEEK_NUMBER,
        PADDING,
        oneOf(ModifierKey.REPR, WeekNumberRepr.ISO, WeekNumberRepr.SUNDAY, WeekNumberRepr.MONDAY));
    put(
        rules,
        ComponentKind.YEAR,
        PADDING,
        oneOf(ModifierKey.REPR, YearRepr.FULL, YearRepr.CENTURY, YearRepr.LAST_TWO),
        oneOf(ModifierKey.BASE, YearBase.CALENDAR, YearBase.ISO_WEEK),
        SIGN,
        oneOf(ModifierKey.RANGE, YearRange.EXTENDED, YearRange.STANDARD));
    return Collections.unmodifiableMap(rules);
  }

  private static void put(
      Map<ComponentKind, Map<ModifierKey, ModifierRule>> rules,
      ComponentKind kind,
      ModifierRule... modifiers) {
    Map<ModifierKey, ModifierRule> byKey = new LinkedHashMap<>();
    for (ModifierRule rule : modifiers) {
      byKey.put(rule.key(), rule);
    }
    rules.put(kind, Collections.unmodifiableMap(byKey));
  }

  /**
   * Returns the modifiers a component accepts, in the order a description lists them.
   *
   * @param kind the component
   * @return an ordered, unmodifiable map from key to rule
   */
  public static Map<ModifierKey, ModifierRule> rules(ComponentKind kind) {
    return RULES.get(kind);
  }

  /**
   * Returns the rule for one key on one component.
   *
   * @param kind the component
   * @param key the modifier key
   * @return the rule, or null if the key is not legal for the component
   */
  public static ModifierRule rule(ComponentKind kind, ModifierKey key) {
    return RULES.get(kind).get(key);
  }

  /**
   * Fills in defaults for every modifier not given explicitly.
   *
   * <p>The caller must have checked that every required modifier is present.
   *
   * @param kind the component
   * @param explicit the modifiers written in the description
   * @return an ordered, unmodifiable map holding every key legal for the component
   */
  public static Map<ModifierKey, ModifierValue> resolve(
      ComponentKind kind, Map<ModifierKey, ModifierValue> explicit) {
    Map<ModifierKey, ModifierValue> resolved = new LinkedHashMap<>();
    for (ModifierRule rule : rules(kind).values()) {
      ModifierValue value = explicit.get(rule.key());
      if (value == null) {
        value =
            rule.defaultValue()
                .orElseThrow(
                    () ->
                        new IllegalArgumentException(
                            "missing required modifier " + rule.key() + " on " + kind));
      }
      resolved.put(rule.key(), value);
    }
    return Collections.unmodifiableMap(resolved);
  }
}
