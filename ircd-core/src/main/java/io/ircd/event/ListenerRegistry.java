package io.ircd.event;

import java.util.List;

/**
 * Registry for looking up event listeners by event kind.
 *
 * <p>The dispatcher uses this registry to find all listeners that should
 * see a given event. Listeners are returned in dispatch order and executed
 * sequentially.
 *
 * @see DefaultListenerRegistry
 */
public interface ListenerRegistry {

  /**
   * Adds a listener in {@code (priority, sequence)} order.
   *
   * @param listener the listener
   */
  void add(RegisteredListener listener);

  /**
   * Removes a listener and marks it inactive.
   *
   * @param listener the listener
   * @return {@code true} if it was registered
   */
  boolean remove(RegisteredListener listener);

  /**
   * Removes every listener registered by an owner.
   *
   * @param owner module name
   * @return number of listeners removed
   */
  int removeOwnedBy(String owner);

  /**
   * Returns the listeners for the given event kind.
   *
   * @param kind the event kind to look up
   * @return immutable snapshot in dispatch order, may be empty
   */
  List<RegisteredListener> listenersFor(EventKind<?> kind);
}
