package diffstore.spi;

import diffstore.model.Entry;
import diffstore.model.Region;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence contract for the nested key/value regions of every collection.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries: a differential opens one transaction per {@code add} and
 * one per scan, and every call made inside it goes through the same connection.
 * Keys and values are opaque byte strings. Implementations live in the
 * {@code diffstore-jdbc} module and wrap driver errors in
 * {@link diffstore.DiffStoreException}; see
 * {@code diffstore.jdbc.store.AbstractJdbcRegionStore}.
 */
public interface RegionStore {

  /**
   * Creates the backing tables if they do not exist yet.
   *
   * @param conn the JDBC connection
   */
  void createSchema(Connection conn);

  /**
   * Registers a region under a collection. Does nothing if it already exists.
   *
   * @param conn       the JDBC connection
   * @param collection the collection name
   * @param region     the region to create
   */
  void createRegion(Connection conn, String collection, Region region);

  /**
   * Returns {@code true} if the region has been created for the collection.
   */
  boolean regionExists(Connection conn, String collection, Region region);

  /**
   * Deletes a region together with every entry it holds.
   *
   * @return {@code true} if the region existed
   */
  boolean dropRegion(Connection conn, String collection, Region region);

  /**
   * Takes the write lock of a collection for the rest of the transaction.
   *
   * <p>Must be the first statement of every transaction that modifies change tracking
   * state, so that a later read of the transaction sees everything committed by the
   * previous lock holder. Blocks while another transaction holds the lock. Does nothing
   * if the collection has not been opened.
   *
   * @param conn       the JDBC connection
   * @param collection the collection name
   */
  void lockCollection(Connection conn, String collection);

  /**
   * Returns {@code true} if any region exists for the collection.
   */
  boolean collectionExists(Connection conn, String collection);

  /**
   * Lists the names of all collections with at least one region, in ascending order.
   */
  List<String> listCollections(Connection conn);

  /**
   * Deletes every region and entry of a collection.
   *
   * @return {@code true} if the collection existed
   */
  boolean dropCollection(Connection conn, String collection);

  /**
   * Reads a value.
   *
   * @return the stored value, or {@code null} if the key is absent
   */
  byte[] get(Connection conn, String collection, Region region, byte[] key);

  /**
   * Returns {@code true} if the key is present, regardless of its value.
   */
  default boolean contains(Connection conn, String collection, Region region, byte[] key) {
    return get(conn, collection, region, key) != null;
  }

  /**
   * Inserts or overwrites a value.
   */
  void put(Connection conn, String collection, Region region, byte[] key, byte[] value);

  /**
   * Deletes a key.
   *
   * @return {@code true} if the key was present
   */
  boolean delete(Connection conn, String collection, Region region, byte[] key);

  /**
   * Deletes every entry of a region but keeps the region itself.
   *
   * @return the number of entries removed
   */
  int clear(Connection conn, String collection, Region region);

  /**
   * Counts the entries of a region.
   */
  int count(Connection conn, String collection, Region region);

  /**
   * Reads the next page of entries in ascending unsigned key order.
   *
   * @param conn       the JDBC connection
   * @param collection the collection name
   * @param region     the region to scan
   * @param afterKey   exclusive lower bound, or {@code null} to start at the first key
   * @param limit      maximum number of entries to return
   * @return entries ordered by key; empty once the region is exhausted
   */
  List<Entry> scan(Connection conn, String collection, Region region, byte[] afterKey, int limit);

  /**
   * Returns {@code true} if any entry other than {@code excludedKey} holds exactly
   * {@code value}.
   *
   * <p>Used to decide whether a pending payload is still referenced by another identity.
   *
   * @param excludedKey key to ignore, or {@code null} to consider every entry
   */
  boolean containsValue(Connection conn, String collection, Region region, byte[] value, byte[] excludedKey);
}
