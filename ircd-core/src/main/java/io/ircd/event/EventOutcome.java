package io.ircd.event;

import java.util.Objects;

/**
 * A listener's vote on a vetoable event.
 */
public enum EventOutcome {
  /** Permit the action and stop asking further listeners. */
  ALLOW,
  /** Refuse the action and stop asking further listeners. */
  DENY,
  /** No opinion; ask the next listener. */
  PASS_THROUGH;

  /**
   * Resolves {@link #PASS_THROUGH} to the caller's default action.
   *
   * @param defaultOutcome outcome to use when no listener decided
   * @return this outcome, or {@code defaultOutcome} if this is {@link #PASS_THROUGH}
   */
  public EventOutcome orDefault(EventOutcome defaultOutcome) {
    Objects.requireNonNull(defaultOutcome, "defaultOutcome");
    return this == PASS_THROUGH ? defaultOutcome : this;
  }

  public boolean isDecided() {
    return this != PASS_THROUGH;
  }
}
