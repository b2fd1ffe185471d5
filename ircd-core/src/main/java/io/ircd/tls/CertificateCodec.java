package io.ircd.tls;

import io.ircd.ext.SlotCodec;

/**
 * Wire form of a {@link CertificateInfo} as exchanged between linked servers.
 *
 * <p>The line starts with a flags token made of {@code v} (invalid), {@code T} (trusted),
 * {@code R} (revoked), {@code s} (unknown signer) and {@code E} (error present). When
 * {@code E} is set the rest of the line is the error text; otherwise the token is
 * followed by {@code fingerprint dn issuer}, with the issuer running to end of line.
 * A certificate with no flag at all writes the placeholder {@code e} so the token is
 * never empty; {@code e} carries no meaning on decode. Any other flag character is
 * ignored.
 *
 * <pre>
 * T ab12 /CN=alice /CN=Example CA
 * vRsE WebIRC users can not specify valid certs yet
 * </pre>
 *
 * <p>The distinguished name ends at the first space, so a DN containing spaces does
 * not survive a round trip.
 */
public final class CertificateCodec implements SlotCodec<CertificateInfo> {
  public static final CertificateCodec INSTANCE = new CertificateCodec();

  static final String MALFORMED_ERROR = "Malformed TLS (SSL) client certificate metadata";

  private CertificateCodec() {
  }

  @Override
  public String encode(CertificateInfo cert) {
    StringBuilder line = new StringBuilder();
    if (cert.isInvalid()) {
      line.append('v');
    }
    if (cert.isTrusted()) {
      line.append('T');
    }
    if (cert.isRevoked()) {
      line.append('R');
    }
    if (cert.isUnknownSigner()) {
      line.append('s');
    }
    if (cert.hasError()) {
      line.append('E');
    }
    if (line.length() == 0) {
      line.append('e');
    }
    line.append(' ');
    if (cert.hasError()) {
      line.append(stripLineBreaks(cert.error()));
    } else {
      line.append(cert.fingerprint()).append(' ')
          .append(cert.dn()).append(' ')
          .append(stripLineBreaks(cert.issuer()));
    }
    return line.toString();
  }

  @Override
  public CertificateInfo decode(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Empty certificate metadata");
    }
    int eol = text.indexOf('\n');
    String line = eol >= 0 ? text.substring(0, eol) : text;
    if (line.endsWith("\r")) {
      line = line.substring(0, line.length() - 1);
    }

    int space = line.indexOf(' ');
    String flags = space >= 0 ? line.substring(0, space) : line;
    String rest = space >= 0 ? line.substring(space + 1) : null;
    if (flags.isEmpty()) {
      throw new IllegalArgumentException("Missing certificate flags token");
    }

    CertificateInfo.Builder cert = CertificateInfo.builder()
        .invalid(flags.indexOf('v') >= 0)
        .trusted(flags.indexOf('T') >= 0)
        .revoked(flags.indexOf('R') >= 0)
        .unknownSigner(flags.indexOf('s') >= 0);

    if (flags.indexOf('E') >= 0) {
      if (rest == null || rest.isEmpty()) {
        throw new IllegalArgumentException("Certificate error flag without error text");
      }
      return cert.error(rest).build();
    }

    if (rest == null) {
      throw new IllegalArgumentException("Missing certificate fingerprint, DN and issuer");
    }
    int afterFingerprint = rest.indexOf(' ');
    if (afterFingerprint < 0) {
      throw new IllegalArgumentException("Missing certificate DN and issuer");
    }
    int afterDn = rest.indexOf(' ', afterFingerprint + 1);
    if (afterDn < 0) {
      throw new IllegalArgumentException("Missing certificate issuer");
    }
    return cert
        .fingerprint(rest.substring(0, afterFingerprint))
        .dn(rest.substring(afterFingerprint + 1, afterDn))
        .issuer(rest.substring(afterDn + 1))
        .build();
  }

  /**
   * Returns an unusable certificate carrying a fixed error, so a garbled line from a
   * peer never grants trust.
   */
  @Override
  public CertificateInfo invalidValue(String text) {
    return CertificateInfo.unusable(MALFORMED_ERROR);
  }

  private static String stripLineBreaks(String value) {
    return value.replace('\r', ' ').replace('\n', ' ');
  }
}
