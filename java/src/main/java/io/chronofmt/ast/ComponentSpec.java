package io.chronofmt.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A component together with the value of every modifier it accepts.
 *
 * <p>The map holds exactly the keys legal for {@code kind}, in table order, each set either to
 * the value written in the description or to the documented default.
 *
 * @param kind the component
 * @param modifiers the resolved modifiers
 */
public record ComponentSpec(ComponentKind kind, Map<ModifierKey, ModifierValue> modifiers) {
  /** Creates a spec, checking the modifiers against the component table. */
  public ComponentSpec {
    Map<ModifierKey, ModifierRule> rules = ComponentTable.rules(kind);
    if (!rules.keySet().equals(modifiers.keySet())) {
      throw new IllegalArgumentException(
          "modifiers " + modifiers.keySet() + " do not match " + kind + " " + rules.keySet());
    }
    Map<ModifierKey, ModifierValue> ordered = new LinkedHashMap<>();
    for (ModifierKey key : rules.keySet()) {
      ordered.put(key, modifiers.get(key));
    }
    modifiers = Collections.unmodifiableMap(ordered);
  }

  /**
   * Creates a spec with every modifier at its default.
   *
   * @param kind a component without required modifiers
   * @return the spec
   */
  public static ComponentSpec defaults(ComponentKind kind) {
    return of(kind, Map.of());
  }

  /**
   * Creates a spec from explicitly written modifiers, filling in the rest with defaults.
   *
   * @param kind the component
   * @param explicit the modifiers written in the description
   * @return the spec
   */
  public static ComponentSpec of(ComponentKind kind, Map<ModifierKey, ModifierValue> explicit) {
    return new ComponentSpec(kind, ComponentTable.resolve(kind, explicit));
  }

  /**
   * Returns the value of a modifier, cast to its value type.
   *
   * @param key the modifier key
   * @param type the value type
   * @param <T> the value type
   * @return the value
   * @throws IllegalArgumentException if the key is not legal for this component
   */
  public <T extends ModifierValue> T get(ModifierKey key, Class<T> type) {
    ModifierValue value = modifiers.get(key);
    if (value == null) {
      throw new IllegalArgumentException(kind + " has no " + key + " modifier");
    }
    return type.cast(value);
  }

  /**
   * Returns whether the modifier has a value other than its default.
   *
   * @param key the modifier key
   * @return true if the value differs from the default
   */
  public boolean isExplicit(ModifierKey key) {
    ModifierRule rule = ComponentTable.rule(kind, key);
    return rule != null && !rule.defaultValue().equals(Optional.of(modifiers.get(key)));
  }

  public Padding padding() {
    return get(ModifierKey.PADDING, Padding.class);
  }

  public boolean signMandatory() {
    return get(ModifierKey.SIGN, SignBehavior.class) == SignBehavior.MANDATORY;
  }

  public boolean caseSensitive() {
    return get(ModifierKey.CASE_SENSITIVE, Flag.class).isTrue();
  }

  @Override
  public String toString() {
    return kind + modifiers.toString();
  }
}
