package io.ircd.config;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTagTest {

  private static ConfigTag tag() {
    return ConfigTag.builder("limits")
        .location("ircd.conf", 42)
        .put("Name", "main")
        .put("size", "4k")
        .put("plain", "12")
        .put("broken", "twelve")
        .put("ratio", "0.75")
        .put("flag", "yes")
        .put("off", "OFF")
        .put("maybe", "perhaps")
        .build();
  }

  @Test
  void stringsAreLookedUpCaseInsensitively() {
    ConfigTag tag = tag();

    assertEquals("main", tag.getString("name"));
    assertEquals("main", tag.getString("NAME", "x"));
    assertEquals("fallback", tag.getString("missing", "fallback"));
    assertEquals(Optional.empty(), tag.readString("missing"));
  }

  @Test
  void integersAcceptMagnitudeSuffix() {
    ConfigTag tag = tag();

    assertEquals(4096, tag.getInt("size", 0));
    assertEquals(12, tag.getInt("plain", 0));
    assertEquals(7, tag.getInt("missing", 7));
  }

  @Test
  void malformedValuesFallBackToDefault() {
    ConfigTag tag = tag();

    assertEquals(3, tag.getInt("broken", 3));
    assertEquals(1.5, tag.getFloat("broken", 1.5));
    assertTrue(tag.getBool("maybe", true));
    assertFalse(tag.getBool("maybe", false));
  }

  @Test
  void booleansAcceptCommonSpellings() {
    ConfigTag tag = tag();

    assertTrue(tag.getBool("flag"));
    assertFalse(tag.getBool("off", true));
    assertFalse(tag.getBool("missing"));
    assertEquals(0.75, tag.getFloat("ratio", 0));
  }

  @Test
  void firstValueOfRepeatedKeyWins() {
    ConfigTag tag = ConfigTag.builder("oper").put("name", "first").put("NAME", "second").build();

    assertEquals("first", tag.getString("name"));
  }

  @Test
  void emptyTagReportsAutoLocation() {
    ConfigTag empty = ConfigTag.empty("sslinfo");

    assertTrue(empty.isEmpty());
    assertEquals("<auto>:0", empty.location());
    assertEquals("ircd.conf:42", tag().location());
  }
}
