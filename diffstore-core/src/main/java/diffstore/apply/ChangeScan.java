package diffstore.apply;

import diffstore.CorruptedStateError;
import diffstore.codec.ValueCodec;
import diffstore.model.Entry;
import diffstore.model.Region;
import diffstore.spi.MetricsExporter;
import diffstore.spi.RegionStore;
import diffstore.tx.TransactionManager;
import diffstore.tx.TransactionManager.Transaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One pass over the pending changes of a collection, inside a single write transaction
 * that the scan owns from {@link #begin} until it commits or is closed.
 *
 * <p>The first statement of the transaction takes the write lock of the collection, so
 * adds and other scans of the same collection wait until this scan commits or rolls back.
 * Pending records are visited in ascending identity order, one page of
 * {@code pageSize} records at a time. For each record the cancellation token is polled
 * first; then the payload is decoded lazily and handed to the {@link ApplyFunction}.
 * A successful callback moves the fingerprint to {@link Region#COMMITTED} and removes
 * the pending record, and the payload too once no other pending record refers to it.
 * A failed callback leaves everything in place.
 *
 * <p>Whatever was applied is committed even when callbacks failed or the scan was
 * cancelled; the failures are then reported as an {@link ApplyException}. Store
 * failures, a missing payload ({@link CorruptedStateError}) and errors thrown by
 * callbacks abort the scan; {@link #close()} rolls it back.
 *
 * <p>Instances are single-use and not thread-safe.
 */
public final class ChangeScan implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChangeScan.class.getName());

  private final Transaction tx;
  private final RegionStore store;
  private final String collection;
  private final ValueCodec codec;
  private final int pageSize;
  private final MetricsExporter metrics;

  private final List<ItemFailure> failures = new ArrayList<>();
  private CancellationException cancellation;
  private int applied;
  private boolean started;

  private ChangeScan(Transaction tx, RegionStore store, String collection, ValueCodec codec,
      int pageSize, MetricsExporter metrics) {
    this.tx = tx;
    this.store = store;
    this.collection = collection;
    this.codec = codec;
    this.pageSize = pageSize;
    this.metrics = metrics;
  }

  /**
   * Opens the write transaction of a new scan.
   *
   * @throws SQLException if the transaction cannot be started
   */
  public static ChangeScan begin(TransactionManager txManager, RegionStore store, String collection,
      ValueCodec codec, int pageSize, MetricsExporter metrics) throws SQLException {
    Objects.requireNonNull(txManager, "txManager");
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(codec, "codec");
    Objects.requireNonNull(metrics, "metrics");
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    return new ChangeScan(txManager.begin(), store, collection, codec, pageSize, metrics);
  }

  /**
   * Visits the pending changes, commits, and reports failures.
   *
   * @param token cancellation token, polled once per pending change
   * @param fn    the callback applying each change
   * @return the number of changes applied
   * @throws ApplyException after committing, if a callback failed or the scan was cancelled
   * @throws SQLException   if the commit fails; nothing of this scan is persisted then
   */
  public int run(CancellationToken token, ApplyFunction fn) throws SQLException {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(fn, "fn");
    if (started) {
      throw new IllegalStateException("ChangeScan already ran");
    }
    started = true;

    Connection conn = tx.connection();
    store.lockCollection(conn, collection);
    byte[] afterKey = null;
    scan:
    while (true) {
      List<Entry> page = store.scan(conn, collection, Region.PENDING, afterKey, pageSize);
      for (Entry entry : page) {
        if (token.isCancellationRequested()) {
          cancellation = new CancellationException(token.reason());
          break scan;
        }
        applyOne(conn, entry.key(), entry.value(), fn);
        afterKey = entry.key();
      }
      if (page.size() < pageSize) {
        break;
      }
    }

    int pending = store.count(conn, collection, Region.PENDING);
    tx.commit();

    metrics.recordPending(collection, pending);
    if (cancellation != null) {
      metrics.incrementCancelled(collection);
      logger.log(Level.WARNING, "Scan of collection {0} cancelled after applying {1} changes: {2}",
          new Object[] {collection, applied, cancellation.getMessage()});
    }
    logger.log(Level.FINE, "Scan of collection {0} applied {1}, failed {2}, {3} still pending",
        new Object[] {collection, applied, failures.size(), pending});

    if (!failures.isEmpty() || cancellation != null) {
      throw new ApplyException(collection, applied, failures, cancellation);
    }
    return applied;
  }

  private void applyOne(Connection conn, byte[] id, byte[] fingerprint, ApplyFunction fn) {
    byte[] payload = store.get(conn, collection, Region.PAYLOAD, fingerprint);
    if (payload == null) {
      HexFormat hex = HexFormat.of();
      String message = "Missing payload for pending change: collection=" + collection
          + ", id=" + hex.formatHex(id) + ", fingerprint=" + hex.formatHex(fingerprint);
      logger.log(Level.SEVERE, message);
      throw new CorruptedStateError(message);
    }

    try {
      fn.apply(id.clone(), codec.decoder(payload));
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      failures.add(new ItemFailure(id, e));
      metrics.incrementApplyFailures(collection);
      logger.log(Level.WARNING, "Failed to apply change id=" + HexFormat.of().formatHex(id)
          + " of collection " + collection + "; it stays pending", e);
      return;
    }

    store.put(conn, collection, Region.COMMITTED, id, fingerprint);
    store.delete(conn, collection, Region.PENDING, id);
    if (!store.containsValue(conn, collection, Region.PENDING, fingerprint, null)) {
      store.delete(conn, collection, Region.PAYLOAD, fingerprint);
    }
    applied++;
    metrics.incrementApplied(collection);
  }

  /**
   * Rolls the transaction back unless {@link #run} committed it.
   */
  @Override
  public void close() throws SQLException {
    tx.close();
  }
}
