package io.ircd.ext;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SlotCodecsTest {

  @Test
  void integerCodecAcceptsSurroundingWhitespace() {
    assertEquals(42, SlotCodecs.integer().decode(" 42 "));
    assertEquals("-7", SlotCodecs.integer().encode(-7));
  }

  @Test
  void integerCodecRejectsText() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> SlotCodecs.integer().decode("1x"));
    assertInstanceOf(NumberFormatException.class, ex.getCause());
    assertEquals(0, SlotCodecs.integer().invalidValue("1x"));
  }

  @Test
  void stringCodecDecodesTextUnchanged() {
    assertEquals("a b c", SlotCodecs.string().decode("a b c"));
    assertEquals("", SlotCodecs.string().decode(""));
    assertEquals("a b c", SlotCodecs.string().encode("a b c"));
  }

  @Test
  void stringCodecReplacesLineBreaks() {
    String encoded = SlotCodecs.string().encode("first\r\nQUIT :injected\nlast");

    assertEquals("first  QUIT :injected last", encoded);
    assertFalse(encoded.contains("\r"));
    assertFalse(encoded.contains("\n"));
  }
}
