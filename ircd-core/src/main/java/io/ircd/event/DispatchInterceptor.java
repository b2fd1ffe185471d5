package io.ircd.event;

/**
 * Cross-cutting hook for observing event dispatch.
 *
 * <p>Interceptors run around the listener chain:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Listener execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>Interceptor exceptions are logged and swallowed; they never change the outcome.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventDispatcher.builder()
 *     .interceptor(DispatchInterceptor.before((kind, payload) ->
 *         audit.log(kind.name())))
 *     .interceptor(DispatchInterceptor.after((kind, payload, outcome) -> {
 *         if (outcome == EventOutcome.DENY) denials.increment();
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

    /**
     * Called before the first listener runs.
     *
     * @param kind    the event kind
     * @param payload the event payload
     * @throws Exception logged and ignored
     */
    default void beforeDispatch(EventKind<?> kind, Object payload) throws Exception {
    }

    /**
     * Called after the listener chain finished.
     *
     * @param kind    the event kind
     * @param payload the event payload
     * @param outcome the final vote, or null for advisory events
     */
    default void afterDispatch(EventKind<?> kind, Object payload, EventOutcome outcome) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static DispatchInterceptor before(BeforeHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void beforeDispatch(EventKind<?> kind, Object payload) throws Exception {
                hook.accept(kind, payload);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static DispatchInterceptor after(AfterHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void afterDispatch(EventKind<?> kind, Object payload, EventOutcome outcome) {
                hook.accept(kind, payload, outcome);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(EventKind<?> kind, Object payload) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(EventKind<?> kind, Object payload, EventOutcome outcome);
    }
}
