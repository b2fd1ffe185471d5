package io.ircd.entity;

import io.ircd.config.OperInfo;
import io.ircd.ext.EntityKind;
import io.ircd.ext.Extensible;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A user on the network, local or remote.
 */
public abstract class User extends Extensible {
  private final String uuid;
  private final Server server;
  private final ReplySink sink;
  private String nick;
  private String ident;
  private String host;
  private String realHost;
  private boolean registered;
  private OperInfo oper;

  protected User(String uuid, Server server, ReplySink sink) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.server = Objects.requireNonNull(server, "server");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.nick = uuid;
    this.ident = "unknown";
    this.host = "";
    this.realHost = "";
  }

  @Override
  public final EntityKind kind() {
    return EntityKind.USER;
  }

  public abstract boolean isLocal();

  public String uuid() {
    return uuid;
  }

  public Server server() {
    return server;
  }

  public String nick() {
    return nick;
  }

  public void setNick(String nick) {
    this.nick = Objects.requireNonNull(nick, "nick");
  }

  public String ident() {
    return ident;
  }

  public void setIdent(String ident) {
    this.ident = Objects.requireNonNull(ident, "ident");
  }

  /**
   * Returns the displayed host, which may be cloaked.
   *
   * @return displayed host
   */
  public String host() {
    return host;
  }

  public String realHost() {
    return realHost;
  }

  /**
   * Sets both the displayed and the real host.
   */
  public void setHost(String host) {
    this.host = Objects.requireNonNull(host, "host");
    this.realHost = host;
  }

  public void setDisplayedHost(String host) {
    this.host = Objects.requireNonNull(host, "host");
  }

  /**
   * Returns {@code true} once the user has completed registration.
   *
   * @return whether registration is complete
   */
  public boolean isRegistered() {
    return registered;
  }

  public void setRegistered(boolean registered) {
    this.registered = registered;
  }

  public boolean isOper() {
    return oper != null;
  }

  public Optional<OperInfo> oper() {
    return Optional.ofNullable(oper);
  }

  public void oper(OperInfo oper) {
    this.oper = Objects.requireNonNull(oper, "oper");
  }

  public String fullHost() {
    return nick + "!" + ident + "@" + host;
  }

  public String fullRealHost() {
    return nick + "!" + ident + "@" + realHost;
  }

  public void writeNotice(String text) {
    sink.write(new Reply.Notice(text));
  }

  public void writeNumeric(int code, String... params) {
    sink.write(new Reply.Numeric(code, Arrays.asList(params)));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + uuid + ", " + nick + "}";
  }
}
