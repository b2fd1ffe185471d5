package io.ircd.event;

import java.util.Comparator;
import java.util.Objects;

/**
 * A listener as stored in a {@link ListenerRegistry}, with its ordering key.
 *
 * <p>Instances are created by {@link EventDispatcher}; {@code sequence} records
 * registration order and breaks priority ties.
 */
public final class RegisteredListener implements Subscription {
  static final Comparator<RegisteredListener> ORDER =
      Comparator.comparingInt(RegisteredListener::priority)
          .thenComparingLong(RegisteredListener::sequence);

  private final EventKind<?> kind;
  private final String owner;
  private final Object listener;
  private final int priority;
  private final long sequence;
  private final ListenerRegistry registry;
  private volatile boolean active = true;

  RegisteredListener(EventKind<?> kind, String owner, Object listener, int priority,
      long sequence, ListenerRegistry registry) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.owner = Objects.requireNonNull(owner, "owner");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.priority = priority;
    this.sequence = sequence;
    this.registry = registry;
  }

  @Override
  public EventKind<?> kind() {
    return kind;
  }

  @Override
  public String owner() {
    return owner;
  }

  /**
   * Returns the {@link VetoListener} or {@link AdvisoryListener}, matching {@link #kind()}.
   *
   * @return the listener callback
   */
  public Object listener() {
    return listener;
  }

  @Override
  public int priority() {
    return priority;
  }

  public long sequence() {
    return sequence;
  }

  @Override
  public boolean isActive() {
    return active;
  }

  @Override
  public boolean cancel() {
    if (!active) {
      return false;
    }
    return registry.remove(this);
  }

  void deactivate() {
    active = false;
  }

  @Override
  public String toString() {
    return "RegisteredListener{" + kind + ", owner=" + owner + ", priority=" + priority + "}";
  }
}
