package io.ircd.event;

import java.util.Objects;

/**
 * A protocol event listeners can subscribe to, typed by its payload.
 *
 * <p>The dispatch mode is part of the kind: {@link VetoableEvent}s collect a vote,
 * {@link AdvisoryEvent}s only notify. The set of kinds is closed and declared in
 * {@link CoreEvents}.
 *
 * @param <P> the payload type
 */
public abstract sealed class EventKind<P> permits VetoableEvent, AdvisoryEvent {
  private final String name;
  private final Class<P> payloadType;

  EventKind(String name, Class<P> payloadType) {
    this.name = Objects.requireNonNull(name, "name");
    this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
  }

  public String name() {
    return name;
  }

  public Class<P> payloadType() {
    return payloadType;
  }

  public abstract boolean isVetoable();

  @Override
  public String toString() {
    return name;
  }
}
