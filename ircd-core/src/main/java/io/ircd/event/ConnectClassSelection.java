package io.ircd.event;

import io.ircd.config.ConnectClass;
import io.ircd.entity.LocalUser;

import java.util.Objects;

/**
 * Payload of {@link CoreEvents#CONNECT_CLASS_SELECTION}.
 *
 * @param user         the connecting user
 * @param connectClass the candidate class
 */
public record ConnectClassSelection(LocalUser user, ConnectClass connectClass) {
  public ConnectClassSelection {
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(connectClass, "connectClass");
  }
}
