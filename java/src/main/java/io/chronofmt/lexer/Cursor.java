package io.chronofmt.lexer;

import java.nio.charset.StandardCharsets;
import java.util.function.IntPredicate;

/**
 * Byte-level position tracker over a UTF-8 byte sequence.
 *
 * <p>The same cursor walks a format description while it is compiled and the input text while it
 * is parsed. Backtracking takes a {@link #mark()} and later calls {@link #reset(int)}.
 */
public final class Cursor {
  /** Returned by {@link #peek()} at the end of input. */
  public static final int EOF = -1;

  private final byte[] bytes;
  private int position;

  private Cursor(byte[] bytes) {
    this.bytes = bytes;
    this.position = 0;
  }

  /**
   * Creates a cursor over the UTF-8 encoding of a string.
   *
   * @param text the text to walk
   * @return a new cursor positioned at offset 0
   */
  public static Cursor of(String text) {
    return new Cursor(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Creates a cursor over raw bytes. The array is not copied.
   *
   * @param bytes the bytes to walk
   * @return a new cursor positioned at offset 0
   */
  public static Cursor of(byte[] bytes) {
    return new Cursor(bytes);
  }

  /**
   * Returns the current byte without consuming it.
   *
   * @return the unsigned byte value, or {@link #EOF} at the end of input
   */
  public int peek() {
    return peekAt(0);
  }

  /**
   * Returns the byte {@code ahead} positions after the current one without consuming anything.
   *
   * @param ahead how many bytes to look past the current one
   * @return the unsigned byte value, or {@link #EOF} past the end of input
   */
  public int peekAt(int ahead) {
    int index = position + ahead;
    return index < bytes.length ? bytes[index] & 0xFF : EOF;
  }

  /**
   * Consumes and returns the current byte.
   *
   * @return the unsigned byte value, or {@link #EOF} if nothing remains
   */
  public int advance() {
    if (position >= bytes.length) {
      return EOF;
    }
    return bytes[position++] & 0xFF;
  }

  /**
   * Consumes the current byte if it equals {@code expected}.
   *
   * @param expected the byte to match
   * @return true if the byte matched and was consumed
   */
  public boolean consumeIf(int expected) {
    if (peek() == expected) {
      position++;
      return true;
    }
    return false;
  }

  /**
   * Consumes the longest run of bytes matching the predicate.
   *
   * @param predicate the byte test
   * @return the number of bytes consumed
   */
  public int takeWhile(IntPredicate predicate) {
    int start = position;
    while (position < bytes.length && predicate.test(bytes[position] & 0xFF)) {
      position++;
    }
    return position - start;
  }

  /**
   * Consumes at most {@code max} bytes matching the predicate.
   *
   * @param predicate the byte test
   * @param max the maximum number of bytes to consume
   * @return the number of bytes consumed
   */
  public int takeWhile(IntPredicate predicate, int max) {
    int start = position;
    while (position < bytes.length
        && position - start < max
        && predicate.test(bytes[position] & 0xFF)) {
      position++;
    }
    return position - start;
  }

  /**
   * Checks whether the remaining input starts with the given bytes.
   *
   * @param prefix the bytes to look for
   * @return true if the prefix matches at the current position
   */
  public boolean startsWith(byte[] prefix) {
    if (bytes.length - position < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (bytes[position + i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Checks whether the remaining input starts with the given ASCII bytes, ignoring ASCII case.
   *
   * @param prefix the bytes to look for
   * @return true if the prefix matches at the current position
   */
  public boolean startsWithIgnoreCase(byte[] prefix) {
    if (bytes.length - position < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (Ascii.toLower(bytes[position + i] & 0xFF) != Ascii.toLower(prefix[i] & 0xFF)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Skips {@code count} bytes.
   *
   * @param count the number of bytes to skip
   * @throws IndexOutOfBoundsException if fewer than {@code count} bytes remain
   */
  public void skip(int count) {
    if (count < 0 || count > remaining()) {
      throw new IndexOutOfBoundsException("cannot skip " + count + " of " + remaining() + " bytes");
    }
    position += count;
  }

  /**
   * Returns the current offset, for use with {@link #reset(int)}.
   *
   * @return the current offset
   */
  public int mark() {
    return position;
  }

  /**
   * Moves back (or forward) to an offset returned by {@link #mark()}.
   *
   * @param mark the offset to restore
   */
  public void reset(int mark) {
    if (mark < 0 || mark > bytes.length) {
      throw new IndexOutOfBoundsException("mark " + mark + " outside 0.." + bytes.length);
    }
    position = mark;
  }

  /**
   * Returns the current byte offset from the start of input.
   *
   * @return the offset
   */
  public int offset() {
    return position;
  }

  /**
   * Returns the number of unconsumed bytes.
   *
   * @return the remaining byte count
   */
  public int remaining() {
    return bytes.length - position;
  }

  /**
   * Returns true if every byte has been consumed.
   *
   * @return whether the cursor is at the end of input
   */
  public boolean atEnd() {
    return position >= bytes.length;
  }

  /**
   * Finds a byte between two offsets without moving the cursor.
   *
   * @param b the byte to look for
   * @param from the inclusive start offset
   * @param to the exclusive end offset
   * @return the offset of the first match, or -1
   */
  public int indexOf(int b, int from, int to) {
    for (int i = from; i < to; i++) {
      if ((bytes[i] & 0xFF) == b) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Decodes the bytes between two offsets as UTF-8.
   *
   * @param start the inclusive start offset
   * @param end the exclusive end offset
   * @return the decoded text
   */
  public String slice(int start, int end) {
    return new String(bytes, start, end - start, StandardCharsets.UTF_8);
  }
}
