package io.ircd.config;

import java.util.Objects;

/**
 * An operator account built from an {@code <oper>} tag.
 *
 * @param name  login name
 * @param block the tag the account was built from
 */
public record OperInfo(String name, ConfigTag block) {

  public OperInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(block, "block");
  }
}
