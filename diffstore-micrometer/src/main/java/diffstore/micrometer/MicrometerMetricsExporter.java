package diffstore.micrometer;

import diffstore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends. Every meter carries a
 * {@code collection} tag; meters of a collection are registered the first time the
 * collection reports anything.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code diffstore.add.staged}: adds that staged a change</li>
 *   <li>{@code diffstore.add.unchanged}: adds that found nothing to stage</li>
 *   <li>{@code diffstore.add.conflict}: adds rejected as a repeated identity</li>
 *   <li>{@code diffstore.apply.success}: changes applied and committed</li>
 *   <li>{@code diffstore.apply.failure}: changes whose callback failed (stay pending)</li>
 *   <li>{@code diffstore.apply.cancelled}: scans stopped by cancellation</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code diffstore.pending}: pending changes left after the last scan</li>
 *   <li>{@code diffstore.scan.duration.ms}: wall time of the last scan in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  private static final String COLLECTION_TAG = "collection";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, CollectionMeters> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "diffstore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "diffstore");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "crm.sync"})
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
  public void incrementStaged(String collection) {
    if (closed) return;
    meters(collection).staged.increment();
  }

  @Override
  public void incrementUnchanged(String collection) {
    if (closed) return;
    meters(collection).unchanged.increment();
  }

  @Override
  public void incrementConflicts(String collection) {
    if (closed) return;
    meters(collection).conflicts.increment();
  }

  @Override
  public void incrementApplied(String collection) {
    if (closed) return;
    meters(collection).applied.increment();
  }

  @Override
  public void incrementApplyFailures(String collection) {
    if (closed) return;
    meters(collection).failed.increment();
  }

  @Override
  public void incrementCancelled(String collection) {
    if (closed) return;
    meters(collection).cancelled.increment();
  }

  @Override
  public void recordPending(String collection, int pending) {
    if (closed) return;
    meters(collection).pending.set(pending);
  }

  @Override
  public void recordScanDurationMs(String collection, long durationMs) {
    if (closed) return;
    meters(collection).scanDurationMs.set(durationMs);
  }

  private CollectionMeters meters(String collection) {
    Objects.requireNonNull(collection, "collection");
    return meters.computeIfAbsent(collection, c -> new CollectionMeters(registry, namePrefix, c));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link diffstore.DiffDatabase} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (CollectionMeters collectionMeters : meters.values()) {
      for (Meter meter : collectionMeters.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
    }
    meters.clear();
    if (first != null) throw first;
  }

  private static final class CollectionMeters {
    private final Counter staged;
    private final Counter unchanged;
    private final Counter conflicts;
    private final Counter applied;
    private final Counter failed;
    private final Counter cancelled;
    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong scanDurationMs = new AtomicLong();
    private final Gauge pendingGauge;
    private final Gauge scanDurationGauge;

    private CollectionMeters(MeterRegistry registry, String prefix, String collection) {
      this.staged = counter(registry, prefix + ".add.staged", "Adds that staged a change", collection);
      this.unchanged = counter(registry, prefix + ".add.unchanged", "Adds that found nothing to stage", collection);
      this.conflicts = counter(registry, prefix + ".add.conflict", "Adds rejected as a repeated identity", collection);
      this.applied = counter(registry, prefix + ".apply.success", "Changes applied and committed", collection);
      this.failed = counter(registry, prefix + ".apply.failure", "Changes whose apply callback failed", collection);
      this.cancelled = counter(registry, prefix + ".apply.cancelled", "Scans stopped by cancellation", collection);
      this.pendingGauge = Gauge.builder(prefix + ".pending", pending, AtomicLong::get)
          .description("Pending changes after the last scan")
          .tag(COLLECTION_TAG, collection)
          .register(registry);
      this.scanDurationGauge = Gauge.builder(prefix + ".scan.duration.ms", scanDurationMs, AtomicLong::get)
          .description("Wall time of the last scan")
          .baseUnit("milliseconds")
          .tag(COLLECTION_TAG, collection)
          .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description, String collection) {
      return Counter.builder(name)
          .description(description)
          .tag(COLLECTION_TAG, collection)
          .register(registry);
    }

    private List<Meter> all() {
      return List.of(staged, unchanged, conflicts, applied, failed, cancelled,
          pendingGauge, scanDurationGauge);
    }
  }
}
