package io.chronofmt.ast;

import io.chronofmt.lexer.Ascii;
import java.util.List;
import java.util.Optional;

/**
 * The legal values of one modifier key on one component.
 *
 * <p>A rule either enumerates its values or accepts an integer range. Optional modifiers have a
 * default; required ones have none.
 */
public final class ModifierRule {
  private final ModifierKey key;
  private final List<ModifierValue> values;
  private final int min;
  private final int max;
  private final ModifierValue defaultValue;

  private ModifierRule(
      ModifierKey key, List<ModifierValue> values, int min, int max, ModifierValue defaultValue) {
    this.key = key;
    this.values = values;
    this.min = min;
    this.max = max;
    this.defaultValue = defaultValue;
  }

  /**
   * Creates a rule over an enumerated set of values. The first value is the default.
   *
   * @param key the modifier key
   * @param values the legal values, default first
   * @return a new rule
   */
  public static ModifierRule oneOf(ModifierKey key, ModifierValue... values) {
    return new ModifierRule(key, List.of(values), 0, 0, values[0]);
  }

  /**
   * Creates a required rule accepting integers in {@code [min, max]}.
   *
   * @param key the modifier key
   * @param min the smallest legal value
   * @param max the largest legal value
   * @return a new rule
   */
  public static ModifierRule requiredCount(ModifierKey key, int min, int max) {
    return new ModifierRule(key, List.of(), min, max, null);
  }

  public ModifierKey key() {
    return key;
  }

  /**
   * Returns whether the modifier must be written explicitly.
   *
   * @return true if the rule has no default
   */
  public boolean required() {
    return defaultValue == null;
  }

  /**
   * Returns the value used when the modifier is not written.
   *
   * @return the default, or empty for a required modifier
   */
  public Optional<ModifierValue> defaultValue() {
    return Optional.ofNullable(defaultValue);
  }

  /**
   * Validates a value token as written in a description.
   *
   * @param token the value as written
   * @return the value, or empty if it is not legal for this rule
   */
  public Optional<ModifierValue> parse(String token) {
    if (values.isEmpty()) {
      return parseCount(token);
    }
    for (ModifierValue value : values) {
      if (Ascii.equalsIgnoreCase(value.token(), token)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  private Optional<ModifierValue> parseCount(String token) {
    // at most 9 digits keeps the accumulator inside an int
    if (token.isEmpty() || token.length() > 9) {
      return Optional.empty();
    }
    int n = 0;
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      if (!Ascii.isDigit(c)) {
        return Optional.empty();
      }
      n = n * 10 + (c - '0');
    }
    return n >= min && n <= max ? Optional.of(new Count(n)) : Optional.empty();
  }
}
