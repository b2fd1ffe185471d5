package io.ircd.ext;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetadataLineTest {

  @Test
  void valueKeepsEmbeddedSpaces() {
    MetadataLine line = MetadataLine.parse("ssl_cert T ab12 /CN=a /CN=Some CA");

    assertEquals("ssl_cert", line.name());
    assertEquals("T ab12 /CN=a /CN=Some CA", line.value());
  }

  @Test
  void nameWithoutValueParsesToEmptyValue() {
    MetadataLine line = MetadataLine.parse("flag");

    assertEquals("", line.value());
    assertEquals("flag", line.toString());
  }

  @Test
  void invalidNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> MetadataLine.parse(" leading"));
    assertThrows(IllegalArgumentException.class, () -> new MetadataLine("a b", "v"));
  }
}
