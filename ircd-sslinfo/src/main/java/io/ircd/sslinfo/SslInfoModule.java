package io.ircd.sslinfo;

import io.ircd.Numerics;
import io.ircd.config.ConfigTag;
import io.ircd.config.OperInfo;
import io.ircd.config.ServerConfig;
import io.ircd.entity.LocalUser;
import io.ircd.event.AuthenticationAttempt;
import io.ircd.event.ConnectClassSelection;
import io.ircd.event.CoreEvents;
import io.ircd.event.EventOutcome;
import io.ircd.event.GatewayAuthentication;
import io.ircd.event.PostConnect;
import io.ircd.event.WhoLine;
import io.ircd.event.WhoisContext;
import io.ircd.ext.EntityKind;
import io.ircd.ext.ExtensionSlot;
import io.ircd.ext.SlotCodecs;
import io.ircd.module.Module;
import io.ircd.module.ModuleContext;
import io.ircd.tls.CertificateCodec;
import io.ircd.tls.CertificateInfo;
import io.ircd.tls.TlsSession;
import io.ircd.tls.UserCertificateApi;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * User facing TLS information and TLS based access rules.
 *
 * <p>Stores each user's client certificate in the network-synchronized {@code ssl_cert}
 * slot and publishes {@link UserCertificateApi} and {@link SslInfoCommand} as services.
 * Listens for:
 * <ul>
 *   <li>WHOIS: secure connection line and certificate fingerprint</li>
 *   <li>WHO: {@code s} appended to the flags field</li>
 *   <li>OPER: {@code sslonly} and {@code fingerprint} oper block requirements</li>
 *   <li>post-connect: cipher notice and {@code autologin} oper blocks</li>
 *   <li>connect class selection: {@code requiressl} connect class requirement</li>
 *   <li>WebIRC: gateway {@code secure} flag</li>
 * </ul>
 *
 * <p>Reads {@code <sslinfo operonly>} to restrict fingerprints to operators.
 */
public class SslInfoModule implements Module {
  private static final Logger logger = Logger.getLogger(SslInfoModule.class.getName());

  public static final String NAME = "m_sslinfo";
  public static final String CERT_SLOT = "ssl_cert";
  public static final String NO_CERT_SLOT = "no_ssl_cert";

  static final int FAILED_OPER_PENALTY = 10000;
  static final String GATEWAY_CERT_ERROR = "WebIRC users can not specify valid certs yet";

  private UserCertificateApiImpl certificates;
  private ServerConfig config;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Adds user facing TLS (SSL) information, various TLS (SSL) configuration options,"
        + " and the /SSLINFO command to look up TLS (SSL) certificate information for other users.";
  }

  @Override
  public void load(ModuleContext context) {
    ExtensionSlot<CertificateInfo> certSlot = context.register(
        ExtensionSlot.spec(CERT_SLOT, EntityKind.USER, CertificateInfo.class)
            .networked(CertificateCodec.INSTANCE));
    ExtensionSlot<Integer> noCertSlot = context.register(
        ExtensionSlot.spec(NO_CERT_SLOT, EntityKind.USER, Integer.class)
            .networked(SlotCodecs.integer()));
    certificates = new UserCertificateApiImpl(certSlot, noCertSlot);
    config = context.config();

    context.provide(UserCertificateApi.class, certificates);
    context.provide(SslInfoCommand.class, new SslInfoCommand(context.users(), config, certificates));

    context.subscribe(CoreEvents.WHOIS, this::onWhois);
    context.subscribe(CoreEvents.WHO_LINE, this::onWhoLine);
    context.subscribe(CoreEvents.AUTHENTICATION_ATTEMPT, this::onAuthenticationAttempt);
    context.subscribe(CoreEvents.POST_CONNECT, this::onPostConnect);
    context.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, this::onConnectClassSelection);
    context.subscribe(CoreEvents.GATEWAY_FLAG_ANNOUNCEMENT, this::onGatewayAuthentication);
  }

  @Override
  public void unload(ModuleContext context) {
    certificates = null;
    config = null;
  }

  static boolean isOperOnly(ServerConfig config) {
    return config.tag("sslinfo").getBool("operonly");
  }

  // ── Listeners ───────────────────────────────────────────────────

  void onWhois(WhoisContext whois) {
    Optional<CertificateInfo> cert = certificates.getCertificate(whois.target());
    if (cert.isEmpty()) {
      return;
    }
    whois.sendLine(Numerics.RPL_WHOISSECURE, "is using a secure connection");
    boolean visible = !isOperOnly(config) || whois.isSelfWhois() || whois.source().isOper();
    if (visible && !cert.get().fingerprint().isEmpty()) {
      whois.sendLine(Numerics.RPL_WHOISCERTFP,
          "has TLS (SSL) client certificate fingerprint " + cert.get().fingerprint());
    }
  }

  EventOutcome onWhoLine(WhoLine line) {
    if (line.request().fieldIndex('f').isPresent() && certificates.getCertificate(line.user()).isPresent()) {
      line.appendToField('f', "s");
    }
    return EventOutcome.PASS_THROUGH;
  }

  EventOutcome onAuthenticationAttempt(AuthenticationAttempt attempt) {
    Optional<OperInfo> block = attempt.operBlock();
    if (block.isEmpty()) {
      return EventOutcome.PASS_THROUGH;
    }
    LocalUser user = attempt.user();
    ConfigTag operBlock = block.get().block();
    Optional<CertificateInfo> cert = certificates.getCertificate(user);

    if (operBlock.getBool("sslonly") && cert.isEmpty()) {
      return denyOper(user, attempt.login(), "a secure connection is required");
    }

    Optional<String> fingerprints = operBlock.readString("fingerprint");
    if (fingerprints.isPresent() && (cert.isEmpty() || !matchesFingerprint(cert.get(), fingerprints.get()))) {
      return denyOper(user, attempt.login(), "their TLS (SSL) client certificate fingerprint does not match");
    }
    return EventOutcome.PASS_THROUGH;
  }

  void onPostConnect(PostConnect event) {
    LocalUser user = event.user();
    Optional<TlsSession> session = user.tlsSession();
    if (session.isEmpty() || certificates.isCertificateSuppressed(user)) {
      return;
    }
    Optional<CertificateInfo> cert = session.get().peerCertificate();

    StringBuilder text = new StringBuilder("*** You are connected to ")
        .append(session.get().serverName().orElse(config.serverName()))
        .append(" using TLS (SSL) cipher '")
        .append(session.get().cipherSuite())
        .append('\'');
    if (cert.isPresent() && !cert.get().fingerprint().isEmpty()) {
      text.append(" and your TLS (SSL) client certificate fingerprint is ").append(cert.get().fingerprint());
    }
    user.writeNotice(text.toString());

    if (cert.isEmpty()) {
      return;
    }
    for (OperInfo oper : config.operBlocks()) {
      ConfigTag block = oper.block();
      if (matchesFingerprint(cert.get(), block.getString("fingerprint")) && block.getBool("autologin")) {
        user.operUp(oper, "automatically by TLS client certificate");
      }
    }
  }

  EventOutcome onConnectClassSelection(ConnectClassSelection selection) {
    Optional<CertificateInfo> cert = certificates.getCertificate(selection.user());
    ConfigTag classConfig = selection.connectClass().config();
    String requirement = null;
    if ("trusted".equalsIgnoreCase(classConfig.getString("requiressl"))) {
      if (cert.isEmpty() || !cert.get().isCaVerified()) {
        requirement = "a trusted TLS (SSL) client certificate";
      }
    } else if (classConfig.getBool("requiressl")) {
      if (cert.isEmpty()) {
        requirement = "a TLS (SSL) connection";
      }
    }

    if (requirement != null) {
      String required = requirement;
      logger.fine(() -> "The " + selection.connectClass().name()
          + " connect class is not suitable as it requires " + required);
      return EventOutcome.DENY;
    }
    return EventOutcome.PASS_THROUGH;
  }

  void onGatewayAuthentication(GatewayAuthentication auth) {
    Optional<Map<String, String>> flags = auth.flags();
    if (flags.isEmpty()) {
      return;
    }
    // Only a secure gateway connection can vouch for the client side
    LocalUser user = auth.user();
    if (certificates.getCertificate(user).isEmpty()) {
      return;
    }
    if (!flags.get().containsKey("secure")) {
      certificates.suppressCertificate(user);
      return;
    }
    certificates.setCertificate(user, CertificateInfo.builder()
        .error(GATEWAY_CERT_ERROR)
        .invalid(true)
        .revoked(true)
        .trusted(false)
        .unknownSigner(true)
        .build());
  }

  private static EventOutcome denyOper(LocalUser user, String login, String reason) {
    user.writeNumeric(Numerics.ERR_NOOPERHOST, "Invalid oper credentials");
    user.addFloodPenalty(FAILED_OPER_PENALTY);
    logger.warning("Failed oper attempt by " + user.fullRealHost() + " using login '"
        + login + "': " + reason + ".");
    return EventOutcome.DENY;
  }

  static boolean matchesFingerprint(CertificateInfo cert, String fingerprints) {
    if (fingerprints == null || cert.fingerprint().isEmpty()) {
      return false;
    }
    return Arrays.stream(fingerprints.trim().split("\\s+")).anyMatch(cert.fingerprint()::equals);
  }
}
