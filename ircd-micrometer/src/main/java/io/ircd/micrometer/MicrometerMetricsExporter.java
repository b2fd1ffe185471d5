package io.ircd.micrometer;

import io.ircd.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers tagged counters, gauges and timers with a {@link MeterRegistry} for export
 * to Prometheus, Grafana, Datadog, and other monitoring backends. Meters are created
 * lazily, one per event kind or slot name.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code ircd.dispatch} (tag {@code event}): dispatches run</li>
 *   <li>{@code ircd.dispatch.decided} (tags {@code event}, {@code outcome}): votes that ended a chain</li>
 *   <li>{@code ircd.dispatch.listener.failure} (tag {@code event}): listeners that threw</li>
 *   <li>{@code ircd.extension.released} (tag {@code slot}): values released from a slot</li>
 *   <li>{@code ircd.extension.decode.failure} (tag {@code slot}): undecodable network values</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code ircd.extension.bound} (tag {@code slot}): entities holding a value</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code ircd.dispatch.duration} (tag {@code event}): time spent in one dispatch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, Timer> timers = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> boundValues = new ConcurrentHashMap<>();
  private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "ircd"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "ircd");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "hub.ircd"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementDispatched(String eventKind) {
    if (closed) return;
    counter(".dispatch", "Event dispatches run", "event", eventKind).increment();
  }

  @Override
  public void incrementDecided(String eventKind, String outcome) {
    if (closed) return;
    counter(".dispatch.decided", "Dispatches decided by a listener vote",
        "event", eventKind, "outcome", outcome).increment();
  }

  @Override
  public void incrementListenerFailure(String eventKind) {
    if (closed) return;
    counter(".dispatch.listener.failure", "Listeners that threw during dispatch", "event", eventKind).increment();
  }

  @Override
  public void incrementValueReleased(String slotName) {
    if (closed) return;
    counter(".extension.released", "Extension values released", "slot", slotName).increment();
  }

  @Override
  public void incrementDecodeFailure(String slotName) {
    if (closed) return;
    counter(".extension.decode.failure", "Network extension values that failed to decode",
        "slot", slotName).increment();
  }

  @Override
  public void recordBoundValues(String slotName, int count) {
    if (closed) return;
    boundValues.computeIfAbsent(slotName, name -> {
      AtomicInteger holder = new AtomicInteger();
      gauges.put(name, Gauge.builder(namePrefix + ".extension.bound", holder, AtomicInteger::get)
          .description("Entities holding a value for the slot")
          .tag("slot", name)
          .register(registry));
      return holder;
    }).set(count);
  }

  @Override
  public void recordDispatchNanos(String eventKind, long nanos) {
    if (closed) return;
    timers.computeIfAbsent(eventKind, kind -> Timer.builder(namePrefix + ".dispatch.duration")
        .description("Time spent running one dispatch")
        .tag("event", kind)
        .register(registry))
        .record(nanos, TimeUnit.NANOSECONDS);
  }

  private Counter counter(String suffix, String description, String... tags) {
    String key = suffix + String.join("|", tags);
    return counters.computeIfAbsent(key, ignored -> Counter.builder(namePrefix + suffix)
        .description(description)
        .tags(tags)
        .register(registry));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link io.ircd.ServerContext} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.addAll(counters.values());
    meters.addAll(timers.values());
    meters.addAll(gauges.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    counters.clear();
    timers.clear();
    gauges.clear();
    boundValues.clear();
    if (first != null) throw first;
  }
}
