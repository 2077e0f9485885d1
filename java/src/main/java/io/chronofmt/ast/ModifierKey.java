package io.chronofmt.ast;

import io.chronofmt.lexer.Ascii;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** The modifier keys of a format description. Which ones are legal depends on the component. */
public enum ModifierKey {
  PADDING("padding"),
  REPR("repr"),
  CASE_SENSITIVE("case_sensitive"),
  CASE("case"),
  SIGN("sign"),
  COUNT("count"),
  DIGITS("digits"),
  PRECISION("precision"),
  ONE_INDEXED("one_indexed"),
  BASE("base"),
  RANGE("range"),
  TRAILING_INPUT("trailing_input");

  private final String token;

  ModifierKey(String token) {
    this.token = token;
  }

  /**
   * Returns the key as written in a format description.
   *
   * @return the key token
   */
  public String token() {
    return token;
  }

  @Override
  public String toString() {
    return token;
  }

  private static final Map<String, ModifierKey> PARSE_MAP =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(k -> k.token, Function.identity()));

  /**
   * Looks up a key by name (ASCII case insensitive).
   *
   * @param s the key as written
   * @return the key if known
   */
  public static Optional<ModifierKey> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(Ascii.toLowerCase(s)));
  }
}
