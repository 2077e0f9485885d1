package io.chronofmt.lexer;

/** ASCII byte classification shared by the description grammar and the input matchers. */
public final class Ascii {
  private Ascii() {}

  /**
   * Returns true for the ASCII whitespace bytes accepted between description tokens.
   *
   * @param b an unsigned byte value
   * @return whether the byte is whitespace
   */
  public static boolean isWhitespace(int b) {
    return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0B || b == 0x0C;
  }

  /**
   * Returns true for an ASCII decimal digit.
   *
   * @param b an unsigned byte value
   * @return whether the byte is a digit
   */
  public static boolean isDigit(int b) {
    return b >= '0' && b <= '9';
  }

  /**
   * Lowercases an ASCII letter and leaves every other byte alone.
   *
   * @param b an unsigned byte value
   * @return the lowercased byte
   */
  public static int toLower(int b) {
    return b >= 'A' && b <= 'Z' ? b + ('a' - 'A') : b;
  }

  /**
   * Compares two strings ignoring ASCII case only.
   *
   * @param a the first string
   * @param b the second string
   * @return whether they are equal up to ASCII case
   */
  public static boolean equalsIgnoreCase(String a, String b) {
    if (a.length() != b.length()) {
      return false;
    }
    for (int i = 0; i < a.length(); i++) {
      char x = a.charAt(i);
      char y = b.charAt(i);
      if (x != y && (x > 0x7F || y > 0x7F || toLower(x) != toLower(y))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Lowercases ASCII letters in a string.
   *
   * @param s the string
   * @return the string with A-Z mapped to a-z
   */
  public static String toLowerCase(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      sb.append((char) (s.charAt(i) <= 0x7F ? toLower(s.charAt(i)) : s.charAt(i)));
    }
    return sb.toString();
  }
}
