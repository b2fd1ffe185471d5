package io.ircd.event;

import io.ircd.entity.LocalUser;

import java.util.Objects;

/**
 * Payload of {@link CoreEvents#POST_CONNECT}.
 *
 * @param user the user that finished registering
 */
public record PostConnect(LocalUser user) {
  public PostConnect {
    Objects.requireNonNull(user, "user");
  }
}
