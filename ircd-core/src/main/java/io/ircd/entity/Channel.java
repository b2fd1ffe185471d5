package io.ircd.entity;

import io.ircd.ext.EntityKind;
import io.ircd.ext.Extensible;

import java.util.Objects;

public final class Channel extends Extensible {
  private final String name;

  public Channel(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  @Override
  public EntityKind kind() {
    return EntityKind.CHANNEL;
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return "Channel{" + name + "}";
  }
}
