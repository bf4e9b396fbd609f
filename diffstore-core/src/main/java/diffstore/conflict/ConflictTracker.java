package diffstore.conflict;

import diffstore.model.Region;
import diffstore.spi.RegionStore;
import diffstore.tx.TransactionManager.Transaction;

import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rejects a second {@code add} of the same identity within one cycle.
 *
 * <p>A cycle starts with {@link #reset}, which empties the {@link Region#CONFLICTS}
 * region (creating it the first time) and switches enforcement on once that
 * transaction commits. Enforcement is a property of the handle, not of the stored
 * state: a freshly opened differential does not enforce until it is reset.
 *
 * <p>This class is thread-safe.
 */
public final class ConflictTracker {
  private static final Logger logger = Logger.getLogger(ConflictTracker.class.getName());
  private static final byte[] MARKER = new byte[0];

  private final RegionStore store;
  private final String collection;
  private volatile boolean active;

  public ConflictTracker(RegionStore store, String collection) {
    this.store = Objects.requireNonNull(store, "store");
    this.collection = Objects.requireNonNull(collection, "collection");
  }

  public boolean isActive() {
    return active;
  }

  /**
   * Fails if enforcement is on and {@code id} already has a marker in this cycle.
   *
   * @throws ConflictingKeyException on a repeated identity
   */
  public void check(Connection conn, byte[] id) {
    if (active && store.contains(conn, collection, Region.CONFLICTS, id)) {
      throw new ConflictingKeyException(collection, id);
    }
  }

  /**
   * Records that {@code id} was added in this cycle. Does nothing while enforcement is off.
   */
  public void mark(Connection conn, byte[] id) {
    if (active) {
      store.put(conn, collection, Region.CONFLICTS, id, MARKER);
    }
  }

  /**
   * Starts a new cycle inside {@code tx}.
   */
  public void reset(Transaction tx) {
    Connection conn = tx.connection();
    if (store.regionExists(conn, collection, Region.CONFLICTS)) {
      store.clear(conn, collection, Region.CONFLICTS);
    } else {
      store.createRegion(conn, collection, Region.CONFLICTS);
    }
    tx.afterCommit(() -> {
      active = true;
      logger.log(Level.FINE, "Conflict tracking cycle started for collection {0}", collection);
    });
  }
}
