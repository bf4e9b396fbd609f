package diffstore;

import diffstore.apply.ApplyException;
import diffstore.apply.ApplyFunction;
import diffstore.apply.CancellationToken;
import diffstore.apply.ChangeScan;
import diffstore.codec.CodecException;
import diffstore.codec.ValueCodec;
import diffstore.conflict.ConflictTracker;
import diffstore.conflict.ConflictingKeyException;
import diffstore.fingerprint.FingerprintException;
import diffstore.fingerprint.Fingerprinter;
import diffstore.model.Region;
import diffstore.spi.MetricsExporter;
import diffstore.spi.RegionStore;
import diffstore.tx.TransactionManager;
import diffstore.tx.TransactionManager.Transaction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks changes of the items of one named collection.
 *
 * <p>Each item is identified by a caller-chosen byte string, typically the primary key
 * of an upstream row. {@link #add} fingerprints the observed value and stages it as a
 * pending change only if the fingerprint differs from the one last applied and from the
 * one already pending. {@link #each} later drains the pending changes through a
 * callback; every change the callback accepts becomes the new committed fingerprint of
 * its item, every change it rejects stays pending for the next scan.
 *
 * <p>Obtain instances from {@link DiffDatabase#open(String)}. Each {@code add} and each
 * scan runs in its own transaction that first takes the write lock of the collection
 * ({@link RegionStore#lockCollection}). Concurrent writers therefore run one at a time,
 * and an {@code add} issued while a scan runs blocks until the scan commits.
 *
 * <p>This class is thread-safe.
 *
 * @see DiffDatabase
 * @see ChangeScan
 */
public final class Differential {
  private static final Logger logger = Logger.getLogger(Differential.class.getName());

  /** Longest identity accepted, in bytes. */
  public static final int MAX_ID_LENGTH = 512;

  private final DiffDatabase database;
  private final String name;
  private final RegionStore store;
  private final TransactionManager txManager;
  private final ValueCodec codec;
  private final Fingerprinter fingerprinter;
  private final MetricsExporter metrics;
  private final int scanPageSize;
  private final ConflictTracker conflicts;

  Differential(DiffDatabase database, String name, RegionStore store, TransactionManager txManager,
      ValueCodec codec, Fingerprinter fingerprinter, MetricsExporter metrics, int scanPageSize) {
    this.database = database;
    this.name = name;
    this.store = store;
    this.txManager = txManager;
    this.codec = codec;
    this.fingerprinter = fingerprinter;
    this.metrics = metrics;
    this.scanPageSize = scanPageSize;
    this.conflicts = new ConflictTracker(store, name);
  }

  public String name() {
    return name;
  }

  /**
   * Stages {@code value} as the latest observation of item {@code id}.
   *
   * <p>Nothing is written when the fingerprint of {@code value} equals the committed
   * fingerprint of the item, or equals its pending one. Otherwise the pending change is
   * created, or replaced together with its payload if an older one was waiting.
   * All writes happen in one transaction.
   *
   * @param id    identity of the item, 1 to {@value #MAX_ID_LENGTH} bytes
   * @param value the observed value
   * @return {@code true} if a change was staged, {@code false} if nothing changed
   * @throws ConflictingKeyException if conflict tracking is on and {@code id} was already
   *                                 added in this cycle
   * @throws FingerprintException    if the value cannot be fingerprinted
   * @throws CodecException          if the value cannot be encoded
   * @throws DiffStoreException      if the store fails; nothing is written then
   */
  public <T> boolean add(byte[] id, T value) {
    validateId(id);
    database.ensureOpen();

    try (Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      store.lockCollection(conn, name);
      try {
        conflicts.check(conn, id);
      } catch (ConflictingKeyException e) {
        metrics.incrementConflicts(name);
        throw e;
      }
      byte[] fingerprint = fingerprinter.fingerprint(value).toBytes();

      byte[] committed = store.get(conn, name, Region.COMMITTED, id);
      if (Arrays.equals(committed, fingerprint)) {
        metrics.incrementUnchanged(name);
        return false;
      }

      byte[] pending = store.get(conn, name, Region.PENDING, id);
      if (pending != null) {
        if (Arrays.equals(pending, fingerprint)) {
          metrics.incrementUnchanged(name);
          return false;
        }
        // Payloads are shared by every identity pending at the same fingerprint
        if (!store.containsValue(conn, name, Region.PENDING, pending, id)) {
          store.delete(conn, name, Region.PAYLOAD, pending);
        }
      }

      byte[] payload = codec.encode(value);
      store.put(conn, name, Region.PENDING, id, fingerprint);
      store.put(conn, name, Region.PAYLOAD, fingerprint, payload);
      conflicts.mark(conn, id);
      tx.commit();
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to add change to collection " + name, e);
    }

    metrics.incrementStaged(name);
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("Staged change id=" + HexFormat.of().formatHex(id) + " in collection " + name);
    }
    return true;
  }

  /**
   * Stages an item that carries its own identity.
   *
   * @see #add(byte[], Object)
   */
  public boolean add(Identified item) {
    Objects.requireNonNull(item, "item");
    return add(item.id(), item);
  }

  /**
   * Returns {@code true} if {@code value} differs from what was last applied for
   * {@code id}, or if the item was never applied. Pending changes are not considered.
   *
   * @throws FingerprintException if the value cannot be fingerprinted
   * @throws DiffStoreException   if the store fails
   */
  public <T> boolean changed(byte[] id, T value) {
    validateId(id);
    database.ensureOpen();
    byte[] fingerprint = fingerprinter.fingerprint(value).toBytes();
    try (Transaction tx = txManager.beginReadOnly()) {
      byte[] committed = store.get(tx.connection(), name, Region.COMMITTED, id);
      return !Arrays.equals(committed, fingerprint);
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to read committed fingerprint from collection " + name, e);
    }
  }

  /**
   * Number of items applied at least once.
   */
  public int countTracking() {
    return count(Region.COMMITTED);
  }

  /**
   * Number of pending changes.
   */
  public int countChanges() {
    return count(Region.PENDING);
  }

  /**
   * Starts a new conflict tracking cycle: forgets which identities were added so far and,
   * from now on, rejects a second {@link #add} of the same identity until the next reset.
   * Idempotent.
   *
   * @throws DiffStoreException if the store fails; the previous cycle stays in effect then
   */
  public void resetConflictTracking() {
    database.ensureOpen();
    try (Transaction tx = txManager.begin()) {
      store.lockCollection(tx.connection(), name);
      conflicts.reset(tx);
      tx.commit();
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to reset conflict tracking of collection " + name, e);
    }
  }

  /**
   * Returns {@code true} once {@link #resetConflictTracking()} has been called on this handle.
   */
  public boolean isTrackingConflicts() {
    return conflicts.isActive();
  }

  /**
   * Applies every pending change without cancellation.
   *
   * @see #each(CancellationToken, ApplyFunction)
   */
  public int each(ApplyFunction fn) {
    return each(CancellationToken.NONE, fn);
  }

  /**
   * Drains the pending changes in ascending identity order through {@code fn}, in one
   * write transaction.
   *
   * <p>The token is polled before each change; once it reports cancellation no further
   * change is visited. Everything applied up to that point is committed either way.
   *
   * @param token cancellation token
   * @param fn    callback applying one change
   * @return the number of changes applied
   * @throws ApplyException      after committing, if any callback failed or the scan was
   *                             cancelled
   * @throws CorruptedStateError if a pending change has no payload; nothing is committed
   * @throws DiffStoreException  if the store fails; nothing is committed
   */
  public int each(CancellationToken token, ApplyFunction fn) {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(fn, "fn");
    database.ensureOpen();
    long start = System.nanoTime();
    try (ChangeScan scan = ChangeScan.begin(txManager, store, name, codec, scanPageSize, metrics)) {
      return scan.run(token, fn);
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to apply changes of collection " + name, e);
    } finally {
      metrics.recordScanDurationMs(name, Math.max(0L, (System.nanoTime() - start) / 1_000_000L));
    }
  }

  /**
   * Reads the user data of this collection in a transaction that is rolled back afterwards.
   *
   * @param fn reads the data; writes throw {@link IllegalStateException}
   * @return what {@code fn} returned
   */
  public <R> R viewUserData(Function<UserData, R> fn) {
    Objects.requireNonNull(fn, "fn");
    database.ensureOpen();
    try (Transaction tx = txManager.beginReadOnly()) {
      return fn.apply(new UserData(store, tx.connection(), name, true));
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to read user data of collection " + name, e);
    }
  }

  /**
   * Reads or writes the user data of this collection in one transaction, committed when
   * {@code fn} returns normally and rolled back if it throws.
   *
   * @param fn reads and writes the data
   */
  public void updateUserData(Consumer<UserData> fn) {
    Objects.requireNonNull(fn, "fn");
    database.ensureOpen();
    try (Transaction tx = txManager.begin()) {
      fn.accept(new UserData(store, tx.connection(), name, false));
      tx.commit();
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to update user data of collection " + name, e);
    }
  }

  private int count(Region region) {
    database.ensureOpen();
    try (Transaction tx = txManager.beginReadOnly()) {
      return store.count(tx.connection(), name, region);
    } catch (SQLException e) {
      throw new DiffStoreException("Failed to count " + region.id() + " entries of collection " + name, e);
    }
  }

  private static void validateId(byte[] id) {
    Objects.requireNonNull(id, "id");
    if (id.length == 0 || id.length > MAX_ID_LENGTH) {
      throw new IllegalArgumentException("id must be 1 to " + MAX_ID_LENGTH + " bytes, got " + id.length);
    }
  }

  @Override
  public String toString() {
    return "Differential[" + name + "]";
  }
}
