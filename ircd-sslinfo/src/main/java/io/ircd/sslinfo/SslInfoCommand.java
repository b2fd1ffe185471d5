package io.ircd.sslinfo;

import io.ircd.Numerics;
import io.ircd.config.ServerConfig;
import io.ircd.entity.User;
import io.ircd.entity.UserDirectory;
import io.ircd.tls.CertificateInfo;
import io.ircd.tls.UserCertificateApi;

import java.util.Objects;
import java.util.Optional;

/**
 * The {@code SSLINFO <nick>} command: shows the TLS client certificate of a user.
 *
 * <p>With {@code <sslinfo operonly="yes">} only operators may look at other users.
 */
public final class SslInfoCommand {
  public static final String NAME = "SSLINFO";

  private final UserDirectory users;
  private final ServerConfig config;
  private final UserCertificateApi certificates;

  SslInfoCommand(UserDirectory users, ServerConfig config, UserCertificateApi certificates) {
    this.users = Objects.requireNonNull(users, "users");
    this.config = Objects.requireNonNull(config, "config");
    this.certificates = Objects.requireNonNull(certificates, "certificates");
  }

  /**
   * Runs the command for {@code source}.
   *
   * @param source the user that sent the command
   * @param nick   the nick to look up
   * @return {@code true} if certificate information (or its absence) was reported
   */
  public boolean handle(User source, String nick) {
    Objects.requireNonNull(source, "source");
    Optional<User> found = users.findNick(nick).filter(User::isRegistered);
    if (found.isEmpty()) {
      source.writeNumeric(Numerics.ERR_NOSUCHNICK, nick, "No such nick");
      return false;
    }
    User target = found.get();

    if (SslInfoModule.isOperOnly(config) && !source.isOper() && target != source) {
      source.writeNotice("*** You cannot view TLS (SSL) client certificate information for other users");
      return false;
    }

    Optional<CertificateInfo> cert = certificates.getCertificate(target);
    if (cert.isEmpty()) {
      source.writeNotice("*** " + target.nick() + " is not connected using TLS (SSL).");
    } else if (cert.get().hasError()) {
      source.writeNotice("*** " + target.nick() + " is connected using TLS (SSL) but has not specified"
          + " a valid client certificate (" + cert.get().error() + ").");
    } else {
      source.writeNotice("*** Distinguished Name: " + cert.get().dn());
      source.writeNotice("*** Issuer:             " + cert.get().issuer());
      source.writeNotice("*** Key Fingerprint:    " + cert.get().fingerprint());
    }
    return true;
  }
}
