package io.chronofmt.ast;

/**
 * An integer modifier value, such as the byte count of {@code ignore}.
 *
 * @param value the count
 */
public record Count(int value) implements ModifierValue {
  @Override
  public String token() {
    return Integer.toString(value);
  }
}
