package io.ircd.entity;

/**
 * A user connected to another server on the network.
 */
public final class RemoteUser extends User {

  public RemoteUser(String uuid, Server server) {
    this(uuid, server, ReplySink.DISCARD);
  }

  public RemoteUser(String uuid, Server server, ReplySink sink) {
    super(uuid, server, sink);
  }

  @Override
  public boolean isLocal() {
    return false;
  }
}
