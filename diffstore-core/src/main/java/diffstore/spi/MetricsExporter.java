package diffstore.spi;

/**
 * Observability hook for exporting change tracking counters and gauges to a metrics
 * backend.
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
   * Increments the count of {@code add} calls that staged a change.
   *
   * @param collection the collection name
   */
  void incrementStaged(String collection);

  /**
   * Increments the count of {@code add} calls that found nothing to stage.
   *
   * @param collection the collection name
   */
  void incrementUnchanged(String collection);

  /**
   * Increments the count of {@code add} calls rejected as a conflicting identity.
   *
   * @param collection the collection name
   */
  default void incrementConflicts(String collection) {
  }

  /**
   * Increments the count of items applied and promoted to committed.
   *
   * @param collection the collection name
   */
  void incrementApplied(String collection);

  /**
   * Increments the count of items whose apply callback failed.
   *
   * @param collection the collection name
   */
  void incrementApplyFailures(String collection);

  /**
   * Increments the count of scans stopped by cancellation.
   *
   * @param collection the collection name
   */
  default void incrementCancelled(String collection) {
  }

  /**
   * Records the number of pending changes left after a scan committed.
   *
   * @param collection the collection name
   * @param pending    pending record count
   */
  void recordPending(String collection, int pending);

  /**
   * Records the wall time of a scan, callbacks included.
   *
   * @param collection the collection name
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordScanDurationMs(String collection, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementStaged(String collection) {
    }

    @Override
    public void incrementUnchanged(String collection) {
    }

    @Override
    public void incrementApplied(String collection) {
    }

    @Override
    public void incrementApplyFailures(String collection) {
    }

    @Override
    public void recordPending(String collection, int pending) {
    }
  }
}
