package io.ircd.event;

import io.ircd.entity.LocalUser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload of {@link CoreEvents#GATEWAY_FLAG_ANNOUNCEMENT}: a WebIRC gateway vouched for a
 * user and may have sent connection flags such as {@code secure}.
 */
public final class GatewayAuthentication {
  private final LocalUser user;
  private final Map<String, String> flags;

  /**
   * @param flags connection flags, or null if the gateway sent none; a flag without a
   *     value may map to null and is stored as the empty string
   */
  public GatewayAuthentication(LocalUser user, Map<String, String> flags) {
    this.user = Objects.requireNonNull(user, "user");
    this.flags = flags == null ? null : copyOf(flags);
  }

  public LocalUser user() {
    return user;
  }

  /**
   * Returns the flags the gateway sent.
   *
   * @return the flags, or empty if the gateway sent no flag field at all
   */
  public Optional<Map<String, String>> flags() {
    return Optional.ofNullable(flags);
  }

  private static Map<String, String> copyOf(Map<String, String> flags) {
    Map<String, String> copy = new LinkedHashMap<>();
    flags.forEach((name, value) -> copy.put(name, value == null ? "" : value));
    return Collections.unmodifiableMap(copy);
  }
}
