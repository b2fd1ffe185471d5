package io.ircd.entity;

import io.ircd.Numerics;
import io.ircd.config.ConnectClass;
import io.ircd.config.OperInfo;
import io.ircd.tls.TlsSession;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * A user connected directly to this server.
 */
public final class LocalUser extends User {
  private static final Logger logger = Logger.getLogger(LocalUser.class.getName());

  private final TlsSession tlsSession;
  private ConnectClass connectClass;
  private int commandFloodPenalty;

  /**
   * @param tlsSession the connection's TLS state, or null for plaintext connections
   */
  public LocalUser(String uuid, Server server, ReplySink sink, TlsSession tlsSession) {
    super(uuid, server, sink);
    this.tlsSession = tlsSession;
  }

  @Override
  public boolean isLocal() {
    return true;
  }

  public Optional<TlsSession> tlsSession() {
    return Optional.ofNullable(tlsSession);
  }

  public Optional<ConnectClass> connectClass() {
    return Optional.ofNullable(connectClass);
  }

  public void setConnectClass(ConnectClass connectClass) {
    this.connectClass = connectClass;
  }

  /**
   * Makes this user an operator with the given block and sends {@code RPL_YOUREOPER}.
   *
   * @param oper   the oper block granted
   * @param method how the user authenticated, for the log line
   */
  public void operUp(OperInfo oper, String method) {
    oper(oper);
    logger.info(() -> fullRealHost() + " opered as " + oper.name() + " " + method);
    writeNumeric(Numerics.RPL_YOUREOPER, "You are now an IRC operator");
  }

  /**
   * Returns the accumulated flood penalty in milliseconds.
   *
   * @return flood penalty
   */
  public int commandFloodPenalty() {
    return commandFloodPenalty;
  }

  public void addFloodPenalty(int millis) {
    commandFloodPenalty += millis;
  }
}
