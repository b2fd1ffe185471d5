package io.ircd.event;

/**
 * Listener for an {@link AdvisoryEvent}.
 *
 * @param <P> the payload type
 */
@FunctionalInterface
public interface AdvisoryListener<P> {

  /**
   * Handles the event.
   *
   * @param payload the event payload
   * @throws Exception on failure; logged, and the remaining listeners still run
   */
  void onEvent(P payload) throws Exception;
}
