package io.ircd.event;

import io.ircd.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the listeners subscribed to an event kind in priority order.
 *
 * <p>For a {@link VetoableEvent} the first listener returning something other than
 * {@link EventOutcome#PASS_THROUGH} decides and the remaining listeners are skipped.
 * For an {@link AdvisoryEvent} every listener runs. A listener that throws is logged
 * and treated as passing through.
 *
 * <p>Each dispatch iterates a snapshot of the listener list taken when it starts, so
 * listeners may subscribe or cancel during dispatch. A listener cancelled mid-dispatch
 * is skipped if it has not run yet; one subscribed mid-dispatch first runs on the next
 * dispatch.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventDispatcher dispatcher = EventDispatcher.builder().build();
 * dispatcher.subscribe(CoreEvents.CONNECT_CLASS_SELECTION, "m_example",
 *     selection -> selection.connectClass().config().getBool("blocked")
 *         ? EventOutcome.DENY : EventOutcome.PASS_THROUGH);
 *
 * EventOutcome outcome = dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION, selection);
 * }</pre>
 *
 * <p>Create instances via {@link #builder()}. Not thread-safe; dispatch runs on the
 * server's control thread.
 */
public final class EventDispatcher {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private final ListenerRegistry listenerRegistry;
  private final List<DispatchInterceptor> interceptors;
  private final MetricsExporter metrics;
  private long nextSequence;

  private EventDispatcher(Builder builder) {
    this.listenerRegistry = builder.listenerRegistry != null
        ? builder.listenerRegistry : new DefaultListenerRegistry();
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Subscription ────────────────────────────────────────────────

  public <P> Subscription subscribe(VetoableEvent<P> kind, String owner, VetoListener<? super P> listener) {
    return subscribe(kind, owner, listener, Priority.NORMAL);
  }

  /**
   * Subscribes a voting listener.
   *
   * @param kind     the event kind
   * @param owner    name of the subscribing module
   * @param listener the listener
   * @param priority lower values run first; ties run in subscription order
   * @return handle for cancelling the subscription
   */
  public <P> Subscription subscribe(VetoableEvent<P> kind, String owner, VetoListener<? super P> listener,
      int priority) {
    return add(kind, owner, listener, priority);
  }

  public <P> Subscription subscribe(AdvisoryEvent<P> kind, String owner, AdvisoryListener<? super P> listener) {
    return subscribe(kind, owner, listener, Priority.NORMAL);
  }

  /**
   * Subscribes a notification listener.
   *
   * @param kind     the event kind
   * @param owner    name of the subscribing module
   * @param listener the listener
   * @param priority lower values run first; ties run in subscription order
   * @return handle for cancelling the subscription
   */
  public <P> Subscription subscribe(AdvisoryEvent<P> kind, String owner, AdvisoryListener<? super P> listener,
      int priority) {
    return add(kind, owner, listener, priority);
  }

  /**
   * Removes the first subscription of {@code listener} to {@code kind}.
   *
   * @return {@code true} if a subscription was removed
   */
  public boolean unsubscribe(EventKind<?> kind, Object listener) {
    for (RegisteredListener registered : listenerRegistry.listenersFor(kind)) {
      if (registered.listener() == listener) {
        return registered.cancel();
      }
    }
    return false;
  }

  /**
   * Removes every subscription made by a module.
   *
   * @param owner module name
   * @return number of subscriptions removed
   */
  public int unsubscribeAll(String owner) {
    int removed = listenerRegistry.removeOwnedBy(owner);
    if (removed > 0) {
      logger.fine(() -> "Removed " + removed + " listener(s) owned by " + owner);
    }
    return removed;
  }

  public List<RegisteredListener> listenersFor(EventKind<?> kind) {
    return listenerRegistry.listenersFor(kind);
  }

  // ── Dispatch ────────────────────────────────────────────────────

  /**
   * Asks the listeners of a vetoable event for a decision.
   *
   * @param kind    the event kind
   * @param payload the payload; listeners may modify it
   * @return the first decisive vote, or {@link EventOutcome#PASS_THROUGH} if none decided
   */
  public <P> EventOutcome dispatch(VetoableEvent<P> kind, P payload) {
    checkPayload(kind, payload);
    long start = System.nanoTime();
    int completedBefore = runBeforeDispatch(kind, payload);
    EventOutcome outcome = EventOutcome.PASS_THROUGH;
    for (RegisteredListener registered : listenerRegistry.listenersFor(kind)) {
      if (!registered.isActive()) {
        continue;
      }
      @SuppressWarnings("unchecked")
      VetoListener<P> listener = (VetoListener<P>) registered.listener();
      EventOutcome vote;
      try {
        vote = listener.onEvent(payload);
      } catch (Exception e) {
        listenerFailed(kind, registered, e);
        continue;
      }
      if (vote != null && vote.isDecided()) {
        outcome = vote;
        metrics.incrementDecided(kind.name(), vote.name());
        break;
      }
    }
    finish(kind, payload, outcome, completedBefore, start);
    return outcome;
  }

  /**
   * Notifies every listener of an advisory event.
   *
   * @param kind    the event kind
   * @param payload the payload; listeners may modify it
   */
  public <P> void dispatch(AdvisoryEvent<P> kind, P payload) {
    checkPayload(kind, payload);
    long start = System.nanoTime();
    int completedBefore = runBeforeDispatch(kind, payload);
    for (RegisteredListener registered : listenerRegistry.listenersFor(kind)) {
      if (!registered.isActive()) {
        continue;
      }
      @SuppressWarnings("unchecked")
      AdvisoryListener<P> listener = (AdvisoryListener<P>) registered.listener();
      try {
        listener.onEvent(payload);
      } catch (Exception e) {
        listenerFailed(kind, registered, e);
      }
    }
    finish(kind, payload, null, completedBefore, start);
  }

  private Subscription add(EventKind<?> kind, String owner, Object listener, int priority) {
    Objects.requireNonNull(kind, "kind");
    RegisteredListener registered =
        new RegisteredListener(kind, owner, listener, priority, nextSequence++, listenerRegistry);
    listenerRegistry.add(registered);
    logger.fine(() -> "Subscribed " + registered);
    return registered;
  }

  private static void checkPayload(EventKind<?> kind, Object payload) {
    Objects.requireNonNull(kind, "kind");
    if (!kind.payloadType().isInstance(payload)) {
      throw new IllegalArgumentException("Event " + kind + " expects a " + kind.payloadType().getName()
          + " payload, got " + (payload == null ? "null" : payload.getClass().getName()));
    }
  }

  private void listenerFailed(EventKind<?> kind, RegisteredListener registered, Exception e) {
    logger.log(Level.WARNING, "Listener for " + kind + " owned by " + registered.owner()
        + " failed; treating as pass-through", e);
    metrics.incrementListenerFailure(kind.name());
  }

  private int runBeforeDispatch(EventKind<?> kind, Object payload) {
    for (DispatchInterceptor interceptor : interceptors) {
      try {
        interceptor.beforeDispatch(kind, payload);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Interceptor beforeDispatch failed for " + kind, e);
      }
    }
    return interceptors.size();
  }

  private void finish(EventKind<?> kind, Object payload, EventOutcome outcome, int count, long start) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(kind, payload, outcome);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed for " + kind, ex);
      }
    }
    metrics.incrementDispatched(kind.name());
    metrics.recordDispatchNanos(kind.name(), System.nanoTime() - start);
  }

  /**
   * Builder for {@link EventDispatcher}.
   */
  public static final class Builder {
    private ListenerRegistry listenerRegistry;
    private MetricsExporter metrics;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the listener registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultListenerRegistry}.
     *
     * @param listenerRegistry the listener registry
     * @return this builder
     */
    public Builder listenerRegistry(ListenerRegistry listenerRegistry) {
      this.listenerRegistry = listenerRegistry;
      return this;
    }

    /**
     * Sets the metrics exporter for dispatch counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends a single dispatch interceptor.
     *
     * <p>Optional. Interceptors are invoked in registration order before dispatch,
     * and in reverse order after dispatch.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends multiple dispatch interceptors.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public Builder interceptors(List<DispatchInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
