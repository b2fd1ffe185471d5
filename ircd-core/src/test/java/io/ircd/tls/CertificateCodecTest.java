package io.ircd.tls;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CertificateCodecTest {
  private final CertificateCodec codec = CertificateCodec.INSTANCE;

  @Test
  void trustedCertificateEncodesFlagsThenFields() {
    CertificateInfo cert = CertificateInfo.builder()
        .trusted(true)
        .fingerprint("ab12")
        .dn("/CN=alice")
        .issuer("/CN=Example CA")
        .build();

    assertEquals("T ab12 /CN=alice /CN=Example CA", codec.encode(cert));
  }

  @Test
  void certificateWithoutFlagsWritesPlaceholder() {
    CertificateInfo cert = CertificateInfo.builder().fingerprint("ff").dn("/CN=a").issuer("/CN=b").build();

    assertEquals("e ff /CN=a /CN=b", codec.encode(cert));
    assertEquals(cert, codec.decode("e ff /CN=a /CN=b"));
  }

  @Test
  void errorCertificateCarriesErrorToEndOfLine() {
    CertificateInfo cert = CertificateInfo.unusable("WebIRC users can not specify valid certs yet");

    String line = codec.encode(cert);

    assertEquals("vRsE WebIRC users can not specify valid certs yet", line);
    CertificateInfo decoded = codec.decode(line);
    assertEquals(cert, decoded);
    assertTrue(decoded.isInvalid());
    assertFalse(decoded.isTrusted());
    assertEquals("", decoded.fingerprint());
  }

  @Test
  void issuerMayContainSpaces() {
    CertificateInfo decoded = codec.decode("Ts 0a0b /O=Org /C=US, O=Let's Encrypt, CN=R3");

    assertTrue(decoded.isTrusted());
    assertTrue(decoded.isUnknownSigner());
    assertEquals("0a0b", decoded.fingerprint());
    assertEquals("/O=Org", decoded.dn());
    assertEquals("/C=US, O=Let's Encrypt, CN=R3", decoded.issuer());
  }

  @Test
  void everyFlagRoundTrips() {
    CertificateInfo cert = CertificateInfo.builder()
        .invalid(true).trusted(true).revoked(true).unknownSigner(true)
        .fingerprint("f").dn("d").issuer("i")
        .build();

    assertEquals("vTRs f d i", codec.encode(cert));
    assertEquals(cert, codec.decode(codec.encode(cert)));
  }

  @Test
  void decodeStopsAtLineBreak() {
    CertificateInfo decoded = codec.decode("T ab12 /CN=a /CN=b\r\nextra");

    assertEquals("/CN=b", decoded.issuer());
  }

  // ── Malformed input ─────────────────────────────────────────────

  @Test
  void malformedInputIsRejectedByDecode() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode(""));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("   "));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(null));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(" ab12 /CN=a /CN=b"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("ab12 /CN=a /CN=b"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("T"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("T ab12"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("T ab12 /CN=a"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("vE"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode("vE "));
  }

  @Test
  void unknownFlagCharactersAreIgnored() {
    CertificateInfo decoded = codec.decode("VTrSe ab12 /CN=alice /CN=CA");

    assertTrue(decoded.isTrusted());
    assertFalse(decoded.isInvalid());
    assertFalse(decoded.isRevoked());
    assertFalse(decoded.isUnknownSigner());
    assertFalse(decoded.hasError());
    assertEquals("ab12", decoded.fingerprint());
    assertEquals("/CN=alice", decoded.dn());
    assertEquals("/CN=CA", decoded.issuer());
  }

  @Test
  void invalidValueGrantsNothing() {
    CertificateInfo sentinel = codec.invalidValue("garbage");

    assertTrue(sentinel.isInvalid());
    assertTrue(sentinel.isRevoked());
    assertTrue(sentinel.isUnknownSigner());
    assertFalse(sentinel.isTrusted());
    assertTrue(sentinel.hasError());
    assertFalse(sentinel.isUsable());
    assertFalse(sentinel.isCaVerified());
  }

  @Test
  void caVerificationNeedsTrustAndKnownSigner() {
    CertificateInfo.Builder base = CertificateInfo.builder().fingerprint("f").dn("d").issuer("i");

    assertTrue(base.trusted(true).build().isCaVerified());
    assertFalse(base.trusted(true).unknownSigner(true).build().isCaVerified());
    assertFalse(CertificateInfo.builder().fingerprint("f").build().isCaVerified());
    assertTrue(CertificateInfo.builder().fingerprint("f").build().isUsable());
  }
}
