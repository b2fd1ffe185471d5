package io.ircd.event;

/**
 * Listener for a {@link VetoableEvent}.
 *
 * @param <P> the payload type
 */
@FunctionalInterface
public interface VetoListener<P> {

  /**
   * Handles the event. The payload may be modified regardless of the vote.
   *
   * @param payload the event payload
   * @return the vote; {@link EventOutcome#PASS_THROUGH} to let later listeners decide
   * @throws Exception on failure; counted as {@link EventOutcome#PASS_THROUGH}
   */
  EventOutcome onEvent(P payload) throws Exception;
}
