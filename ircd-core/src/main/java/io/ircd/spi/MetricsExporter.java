package io.ircd.spi;

/**
 * Observability hook for exporting extension and dispatch counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of dispatches for an event kind.
     *
     * @param eventKind event kind name
     */
    void incrementDispatched(String eventKind);

    /**
     * Increments the count of vetoable dispatches decided by a listener.
     *
     * @param eventKind event kind name
     * @param outcome   {@code ALLOW} or {@code DENY}
     */
    void incrementDecided(String eventKind, String outcome);

    /**
     * Increments the count of listeners that threw during dispatch.
     *
     * @param eventKind event kind name
     */
    void incrementListenerFailure(String eventKind);

    /**
     * Increments the count of values released from a slot.
     *
     * @param slotName slot name
     */
    void incrementValueReleased(String slotName);

    /**
     * Increments the count of network values a slot codec could not decode.
     *
     * @param slotName slot name
     */
    void incrementDecodeFailure(String slotName);

    /**
     * Records the number of entities currently holding a value for a slot.
     *
     * @param slotName slot name
     * @param count    bound value count (always non-negative)
     */
    default void recordBoundValues(String slotName, int count) {
    }

    /**
     * Records the time spent running one dispatch.
     *
     * @param eventKind event kind name
     * @param nanos     elapsed time in nanoseconds
     */
    default void recordDispatchNanos(String eventKind, long nanos) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatched(String eventKind) {
        }

        @Override
        public void incrementDecided(String eventKind, String outcome) {
        }

        @Override
        public void incrementListenerFailure(String eventKind) {
        }

        @Override
        public void incrementValueReleased(String slotName) {
        }

        @Override
        public void incrementDecodeFailure(String slotName) {
        }
    }
}
