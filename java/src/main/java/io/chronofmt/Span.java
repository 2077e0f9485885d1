package io.chronofmt;

/**
 * Represents a range of byte positions in a format description.
 *
 * @param start the start offset (inclusive)
 * @param end the end offset (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Creates an empty span at a single offset.
   *
   * @param offset the offset
   * @return a span starting and ending at {@code offset}
   */
  public static Span at(int offset) {
    return new Span(offset, offset);
  }

  /**
   * Returns the length of this span, never less than one so it can always be underlined.
   *
   * @return the number of bytes covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }
}
