package io.ircd.event;

import io.ircd.config.OperInfo;
import io.ircd.entity.LocalUser;

import java.util.Objects;
import java.util.Optional;

/**
 * Payload of {@link CoreEvents#AUTHENTICATION_ATTEMPT}: a local user sent {@code OPER}
 * with a login name.
 */
public final class AuthenticationAttempt {
  private final LocalUser user;
  private final String login;
  private final OperInfo operBlock;

  /**
   * @param operBlock the oper block matching {@code login}, or null if none exists
   */
  public AuthenticationAttempt(LocalUser user, String login, OperInfo operBlock) {
    this.user = Objects.requireNonNull(user, "user");
    this.login = Objects.requireNonNull(login, "login");
    this.operBlock = operBlock;
  }

  public LocalUser user() {
    return user;
  }

  public String login() {
    return login;
  }

  public Optional<OperInfo> operBlock() {
    return Optional.ofNullable(operBlock);
  }
}
