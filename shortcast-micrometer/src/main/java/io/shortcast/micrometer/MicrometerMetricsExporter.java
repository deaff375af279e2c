package io.shortcast.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.shortcast.config.PlatformKind;
import io.shortcast.model.ErrorKind;
import io.shortcast.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code shortcast.fetch.ran} - fetches that completed</li>
 *   <li>{@code shortcast.fetch.items} - items queued by completed fetches</li>
 *   <li>{@code shortcast.fetch.skipped} - fetches skipped by the cooldown</li>
 *   <li>{@code shortcast.fetch.failed} - fetches whose discovery call failed</li>
 *   <li>{@code shortcast.cycle.completed} - publish cycles that reached the fan-out</li>
 *   <li>{@code shortcast.cycle.empty} - publish cycles with nothing to publish</li>
 *   <li>{@code shortcast.cycle.aborted} - publish cycles aborted by a fatal error</li>
 *   <li>{@code shortcast.channel.success} - uploads, tagged {@code platform}</li>
 *   <li>{@code shortcast.channel.failure} - failed or skipped uploads, tagged {@code platform} and {@code error}</li>
 *   <li>{@code shortcast.trigger.dropped} - triggers dropped while a cycle was in flight</li>
 *   <li>{@code shortcast.notification.dropped} - notifications dropped (queue full)</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code shortcast.queue.depth} - items still queued after the last cycle</li>
 *   <li>{@code shortcast.cycle.duration} - publish cycle wall time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter fetchRan;
  private final Counter fetchItems;
  private final Counter fetchSkipped;
  private final Counter fetchFailed;
  private final Counter cycleCompleted;
  private final Counter cycleEmpty;
  private final Counter cycleAborted;
  private final Counter triggerDropped;
  private final Counter notificationDropped;
  private final Gauge queueDepthGauge;
  private final Timer cycleDuration;
  private final Map<String, Counter> channelCounters = new ConcurrentHashMap<>();

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "shortcast"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "shortcast");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several publishers in one process.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "news.shortcast"})
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
    this.fetchRan = counter("fetch.ran", "Fetches that completed");
    this.fetchItems = counter("fetch.items", "Items queued by completed fetches");
    this.fetchSkipped = counter("fetch.skipped", "Fetches skipped by the cooldown");
    this.fetchFailed = counter("fetch.failed", "Fetches whose discovery call failed");
    this.cycleCompleted = counter("cycle.completed", "Publish cycles that reached the fan-out");
    this.cycleEmpty = counter("cycle.empty", "Publish cycles with nothing to publish");
    this.cycleAborted = counter("cycle.aborted", "Publish cycles aborted by a fatal error");
    this.triggerDropped = counter("trigger.dropped", "Triggers dropped while a cycle was in flight");
    this.notificationDropped = counter("notification.dropped", "Notifications dropped (queue full)");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Items still queued after the last cycle")
        .register(registry);
    this.cycleDuration = Timer.builder(namePrefix + ".cycle.duration")
        .description("Publish cycle wall time")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(namePrefix + "." + name)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementFetchRan(int itemsQueued) {
    if (closed) return;
    fetchRan.increment();
    if (itemsQueued > 0) {
      fetchItems.increment(itemsQueued);
    }
  }

  @Override
  public void incrementFetchSkipped() {
    if (closed) return;
    fetchSkipped.increment();
  }

  @Override
  public void incrementFetchFailed() {
    if (closed) return;
    fetchFailed.increment();
  }

  @Override
  public void incrementCycleCompleted() {
    if (closed) return;
    cycleCompleted.increment();
  }

  @Override
  public void incrementCycleEmpty() {
    if (closed) return;
    cycleEmpty.increment();
  }

  @Override
  public void incrementCycleAborted() {
    if (closed) return;
    cycleAborted.increment();
  }

  @Override
  public void incrementChannelSuccess(PlatformKind platformKind) {
    if (closed) return;
    String platform = platformKind.code();
    channelCounters.computeIfAbsent("success:" + platform, key -> Counter.builder(namePrefix + ".channel.success")
        .description("Successful uploads")
        .tag("platform", platform)
        .register(registry)).increment();
  }

  @Override
  public void incrementChannelFailure(PlatformKind platformKind, ErrorKind errorKind) {
    if (closed) return;
    String platform = platformKind.code();
    String error = errorKind.name().toLowerCase(Locale.ROOT);
    channelCounters.computeIfAbsent("failure:" + platform + ":" + error,
        key -> Counter.builder(namePrefix + ".channel.failure")
            .description("Failed or skipped uploads")
            .tag("platform", platform)
            .tag("error", error)
            .register(registry)).increment();
  }

  @Override
  public void incrementTriggerDropped() {
    if (closed) return;
    triggerDropped.increment();
  }

  @Override
  public void incrementNotificationDropped() {
    if (closed) return;
    notificationDropped.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordCycleDurationMs(long durationMs) {
    if (closed) return;
    cycleDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called when the owning {@link io.shortcast.Shortcast} is closed, so stale gauges
   * do not outlive it.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(fetchRan, fetchItems, fetchSkipped, fetchFailed,
        cycleCompleted, cycleEmpty, cycleAborted, triggerDropped, notificationDropped,
        queueDepthGauge, cycleDuration));
    meters.addAll(channelCounters.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
