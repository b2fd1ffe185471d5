package io.ircd.tls;

import io.ircd.ext.AbstractRefCounted;

import java.util.Objects;

/**
 * A client certificate as seen by the server: verification flags plus the identity
 * fields, or an error explaining why no usable certificate exists.
 *
 * <p>Instances are immutable and reference-counted so one certificate can be bound to
 * several slots or users at once; see {@link io.ircd.ext.RefCounted}.
 */
public final class CertificateInfo extends AbstractRefCounted {
  private final boolean invalid;
  private final boolean trusted;
  private final boolean revoked;
  private final boolean unknownSigner;
  private final String fingerprint;
  private final String dn;
  private final String issuer;
  private final String error;

  private CertificateInfo(Builder builder) {
    this.invalid = builder.invalid;
    this.trusted = builder.trusted;
    this.revoked = builder.revoked;
    this.unknownSigner = builder.unknownSigner;
    this.fingerprint = builder.fingerprint;
    this.dn = builder.dn;
    this.issuer = builder.issuer;
    this.error = builder.error;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a certificate that grants nothing: invalid, revoked, untrusted and signed by
   * an unknown issuer.
   *
   * @param error the reason shown to users
   * @return a new unusable certificate
   */
  public static CertificateInfo unusable(String error) {
    return builder()
        .invalid(true)
        .revoked(true)
        .trusted(false)
        .unknownSigner(true)
        .error(error)
        .build();
  }

  public boolean isInvalid() {
    return invalid;
  }

  public boolean isTrusted() {
    return trusted;
  }

  public boolean isRevoked() {
    return revoked;
  }

  public boolean isUnknownSigner() {
    return unknownSigner;
  }

  public String fingerprint() {
    return fingerprint;
  }

  public String dn() {
    return dn;
  }

  public String issuer() {
    return issuer;
  }

  public String error() {
    return error;
  }

  public boolean hasError() {
    return !error.isEmpty();
  }

  /**
   * Returns {@code true} if the certificate is valid, not revoked and has no error.
   *
   * @return whether the certificate may be used at all
   */
  public boolean isUsable() {
    return !invalid && !revoked && error.isEmpty();
  }

  /**
   * Returns {@code true} if the certificate is usable and chains to a trusted CA.
   *
   * @return whether the certificate is CA-verified
   */
  public boolean isCaVerified() {
    return isUsable() && trusted && !unknownSigner;
  }

  /**
   * Compares flags and fields; the reference count is not part of equality.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CertificateInfo other)) {
      return false;
    }
    return invalid == other.invalid
        && trusted == other.trusted
        && revoked == other.revoked
        && unknownSigner == other.unknownSigner
        && fingerprint.equals(other.fingerprint)
        && dn.equals(other.dn)
        && issuer.equals(other.issuer)
        && error.equals(other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(invalid, trusted, revoked, unknownSigner, fingerprint, dn, issuer, error);
  }

  @Override
  public String toString() {
    return "CertificateInfo{" + CertificateCodec.INSTANCE.encode(this) + "}";
  }

  /** Builder for {@link CertificateInfo}. String fields default to empty. */
  public static final class Builder {
    private boolean invalid;
    private boolean trusted;
    private boolean revoked;
    private boolean unknownSigner;
    private String fingerprint = "";
    private String dn = "";
    private String issuer = "";
    private String error = "";

    private Builder() {}

    public Builder invalid(boolean invalid) {
      this.invalid = invalid;
      return this;
    }

    public Builder trusted(boolean trusted) {
      this.trusted = trusted;
      return this;
    }

    public Builder revoked(boolean revoked) {
      this.revoked = revoked;
      return this;
    }

    public Builder unknownSigner(boolean unknownSigner) {
      this.unknownSigner = unknownSigner;
      return this;
    }

    public Builder fingerprint(String fingerprint) {
      this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
      return this;
    }

    public Builder dn(String dn) {
      this.dn = Objects.requireNonNull(dn, "dn");
      return this;
    }

    public Builder issuer(String issuer) {
      this.issuer = Objects.requireNonNull(issuer, "issuer");
      return this;
    }

    public Builder error(String error) {
      this.error = Objects.requireNonNull(error, "error");
      return this;
    }

    public CertificateInfo build() {
      return new CertificateInfo(this);
    }
  }
}
