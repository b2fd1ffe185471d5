package io.ircd.event;

/**
 * Handle returned by {@link EventDispatcher} subscriptions.
 */
public interface Subscription {

  EventKind<?> kind();

  String owner();

  int priority();

  /**
   * Returns {@code false} once the subscription has been cancelled.
   *
   * @return whether the listener still receives events
   */
  boolean isActive();

  /**
   * Removes the listener. Takes effect immediately, including for a dispatch in
   * progress: the listener is skipped if it has not run yet.
   *
   * @return {@code true} if the listener was removed by this call
   */
  boolean cancel();
}
