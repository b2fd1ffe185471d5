package io.ircd.event;

/**
 * Event kind whose listeners are notified and cannot vote.
 *
 * @param <P> the payload type
 */
public final class AdvisoryEvent<P> extends EventKind<P> {

  AdvisoryEvent(String name, Class<P> payloadType) {
    super(name, payloadType);
  }

  @Override
  public boolean isVetoable() {
    return false;
  }
}
