package io.chronofmt.lexer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class CursorTest {

  @Test
  void testPeekAndAdvance() {
    Cursor c = Cursor.of("ab");
    assertEquals('a', c.peek());
    assertEquals('b', c.peekAt(1));
    assertEquals(Cursor.EOF, c.peekAt(2));
    assertEquals('a', c.advance());
    assertEquals('b', c.advance());
    assertEquals(Cursor.EOF, c.advance());
    assertTrue(c.atEnd());
    assertEquals(2, c.offset());
  }

  @Test
  void testEmptyInput() {
    Cursor c = Cursor.of("");
    assertTrue(c.atEnd());
    assertEquals(0, c.remaining());
    assertEquals(Cursor.EOF, c.peek());
  }

  @Test
  void testOffsetsAreBytes() {
    Cursor c = Cursor.of("é[");
    assertEquals(3, c.remaining());
    c.skip(2);
    assertEquals('[', c.peek());
    assertEquals("é", c.slice(0, 2));
  }

  @Test
  void testHighBytesAreUnsigned() {
    Cursor c = Cursor.of(new byte[] {(byte) 0xC3, (byte) 0xA9});
    assertEquals(0xC3, c.advance());
    assertEquals(0xA9, c.peek());
  }

  @Test
  void testConsumeIf() {
    Cursor c = Cursor.of("[x");
    assertFalse(c.consumeIf(']'));
    assertEquals(0, c.offset());
    assertTrue(c.consumeIf('['));
    assertEquals(1, c.offset());
  }

  @Test
  void testTakeWhile() {
    Cursor c = Cursor.of("12345x");
    assertEquals(3, c.takeWhile(Ascii::isDigit, 3));
    assertEquals(2, c.takeWhile(Ascii::isDigit));
    assertEquals(0, c.takeWhile(Ascii::isDigit));
    assertEquals('x', c.peek());
  }

  @Test
  void testStartsWith() {
    Cursor c = Cursor.of("March 7");
    assertTrue(c.startsWith("Mar".getBytes(StandardCharsets.UTF_8)));
    assertFalse(c.startsWith("mar".getBytes(StandardCharsets.UTF_8)));
    assertTrue(c.startsWithIgnoreCase("mARCH".getBytes(StandardCharsets.UTF_8)));
    assertFalse(c.startsWith("March 7th".getBytes(StandardCharsets.UTF_8)));
    assertEquals(0, c.offset());
  }

  @Test
  void testMarkAndReset() {
    Cursor c = Cursor.of("abc");
    int mark = c.mark();
    c.skip(3);
    assertTrue(c.atEnd());
    c.reset(mark);
    assertEquals(3, c.remaining());
    assertThrows(IndexOutOfBoundsException.class, () -> c.reset(4));
  }

  @Test
  void testSkipPastEnd() {
    Cursor c = Cursor.of("ab");
    assertThrows(IndexOutOfBoundsException.class, () -> c.skip(3));
    assertThrows(IndexOutOfBoundsException.class, () -> c.skip(-1));
    assertEquals(0, c.offset());
  }

  @Test
  void testIndexOf() {
    Cursor c = Cursor.of("a:b:c");
    assertEquals(1, c.indexOf(':', 0, 5));
    assertEquals(3, c.indexOf(':', 2, 5));
    assertEquals(-1, c.indexOf(':', 4, 5));
  }
}
