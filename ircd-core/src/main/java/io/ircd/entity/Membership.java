package io.ircd.entity;

import io.ircd.ext.EntityKind;
import io.ircd.ext.Extensible;

import java.util.Objects;

/**
 * A user's presence in a channel.
 */
public final class Membership extends Extensible {
  private final User user;
  private final Channel channel;

  public Membership(User user, Channel channel) {
    this.user = Objects.requireNonNull(user, "user");
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public EntityKind kind() {
    return EntityKind.MEMBERSHIP;
  }

  public User user() {
    return user;
  }

  public Channel channel() {
    return channel;
  }

  @Override
  public String toString() {
    return "Membership{" + user.nick() + " in " + channel.name() + "}";
  }
}
