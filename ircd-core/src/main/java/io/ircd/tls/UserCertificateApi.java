package io.ircd.tls;

import io.ircd.entity.User;

import java.util.Optional;

/**
 * Service through which modules read and replace the client certificate of a user.
 *
 * <p>Published by the module that owns the certificate slots; look it up with
 * {@link io.ircd.module.ModuleContext#service(Class)}.
 */
public interface UserCertificateApi {

  /**
   * Returns the certificate of a user.
   *
   * @param user the user
   * @return the certificate, or empty if the user has none or is not using TLS
   */
  Optional<CertificateInfo> getCertificate(User user);

  /**
   * Replaces the certificate of a user.
   *
   * @param user the user
   * @param cert the new certificate
   */
  void setCertificate(User user, CertificateInfo cert);
}
