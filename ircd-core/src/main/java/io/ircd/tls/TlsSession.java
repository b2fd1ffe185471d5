package io.ircd.tls;

import java.util.Optional;

/**
 * TLS state of a local connection, supplied by the socket layer once the handshake
 * has completed.
 */
public interface TlsSession {

  /**
   * Returns the certificate the client presented, if any.
   *
   * @return the peer certificate
   */
  Optional<CertificateInfo> peerCertificate();

  /**
   * Returns the negotiated cipher suite, for example {@code TLS_AES_256_GCM_SHA384}.
   *
   * @return cipher suite name
   */
  String cipherSuite();

  /**
   * Returns the server name the client asked for through SNI.
   *
   * @return requested server name, if the client sent one
   */
  Optional<String> serverName();
}
