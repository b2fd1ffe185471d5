package io.ircd.config;

import java.util.Objects;

/**
 * A named connection policy bucket built from a {@code <connect>} tag.
 *
 * @param name   class name
 * @param config the tag the class was built from
 */
public record ConnectClass(String name, ConfigTag config) {

  public ConnectClass {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(config, "config");
  }
}
