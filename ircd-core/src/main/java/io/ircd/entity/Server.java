package io.ircd.entity;

import io.ircd.ext.EntityKind;
import io.ircd.ext.Extensible;

import java.util.Objects;

/**
 * A server on the network, including this one.
 */
public final class Server extends Extensible {
  private final String name;
  private final String sid;

  public Server(String name, String sid) {
    this.name = Objects.requireNonNull(name, "name");
    this.sid = Objects.requireNonNull(sid, "sid");
  }

  @Override
  public EntityKind kind() {
    return EntityKind.SERVER;
  }

  public String name() {
    return name;
  }

  public String sid() {
    return sid;
  }

  @Override
  public String toString() {
    return "Server{" + name + "}";
  }
}
