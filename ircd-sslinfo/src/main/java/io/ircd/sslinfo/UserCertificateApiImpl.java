package io.ircd.sslinfo;

import io.ircd.entity.LocalUser;
import io.ircd.entity.User;
import io.ircd.ext.ExtensionSlot;
import io.ircd.tls.CertificateInfo;
import io.ircd.tls.TlsSession;
import io.ircd.tls.UserCertificateApi;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link UserCertificateApi} backed by the {@code ssl_cert} and {@code no_ssl_cert} slots.
 *
 * <p>A local user whose certificate was never stored falls back to the certificate of
 * its TLS session, which is then cached in {@code ssl_cert}. Setting {@code no_ssl_cert}
 * disables that fallback, for users whose TLS connection ends at a gateway.
 */
final class UserCertificateApiImpl implements UserCertificateApi {
  private static final Logger logger = Logger.getLogger(UserCertificateApiImpl.class.getName());

  private final ExtensionSlot<CertificateInfo> certSlot;
  private final ExtensionSlot<Integer> noCertSlot;

  UserCertificateApiImpl(ExtensionSlot<CertificateInfo> certSlot, ExtensionSlot<Integer> noCertSlot) {
    this.certSlot = Objects.requireNonNull(certSlot, "certSlot");
    this.noCertSlot = Objects.requireNonNull(noCertSlot, "noCertSlot");
  }

  @Override
  public Optional<CertificateInfo> getCertificate(User user) {
    Optional<CertificateInfo> stored = certSlot.get(user);
    if (stored.isPresent()) {
      return stored;
    }
    if (!(user instanceof LocalUser local) || local.isDestroyed() || isCertificateSuppressed(local)) {
      return Optional.empty();
    }
    Optional<CertificateInfo> fromSession = local.tlsSession().flatMap(TlsSession::peerCertificate);
    fromSession.ifPresent(cert -> setCertificate(user, cert));
    return fromSession;
  }

  @Override
  public void setCertificate(User user, CertificateInfo cert) {
    logger.fine(() -> "Setting TLS client certificate for " + user.fullHost() + ": " + cert);
    certSlot.set(user, cert);
  }

  boolean isCertificateSuppressed(User user) {
    return noCertSlot.get(user).filter(flag -> flag != 0).isPresent();
  }

  /**
   * Forgets the certificate of a user and stops falling back to its TLS session.
   */
  void suppressCertificate(User user) {
    noCertSlot.set(user, 1);
    certSlot.clear(user);
  }

  ExtensionSlot<CertificateInfo> certSlot() {
    return certSlot;
  }

  ExtensionSlot<Integer> noCertSlot() {
    return noCertSlot;
  }
}
