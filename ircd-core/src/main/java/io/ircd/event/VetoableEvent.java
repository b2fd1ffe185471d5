package io.ircd.event;

/**
 * Event kind whose listeners vote; the first non-pass-through vote decides.
 *
 * @param <P> the payload type
 */
public final class VetoableEvent<P> extends EventKind<P> {

  VetoableEvent(String name, Class<P> payloadType) {
    super(name, payloadType);
  }

  @Override
  public boolean isVetoable() {
    return true;
  }
}
