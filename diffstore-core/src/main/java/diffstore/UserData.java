package diffstore;

import diffstore.model.Entry;
import diffstore.model.Region;
import diffstore.spi.RegionStore;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Caller-owned key/value area of a collection, e.g. for the time of the last upstream
 * poll. Change tracking never reads or writes it.
 *
 * <p>Instances are bound to the transaction of {@link Differential#viewUserData} or
 * {@link Differential#updateUserData} and must not be used after the callback returns.
 */
public final class UserData {
  private static final int SCAN_PAGE = 256;

  private final RegionStore store;
  private final Connection conn;
  private final String collection;
  private final boolean readOnly;

  UserData(RegionStore store, Connection conn, String collection, boolean readOnly) {
    this.store = store;
    this.conn = conn;
    this.collection = collection;
    this.readOnly = readOnly;
  }

  /**
   * Returns the value stored under {@code key}, or {@code null}.
   */
  public byte[] get(byte[] key) {
    Objects.requireNonNull(key, "key");
    return store.get(conn, collection, Region.USER_DATA, key);
  }

  /**
   * Returns the UTF-8 value stored under a UTF-8 key, or {@code null}.
   */
  public String getString(String key) {
    Objects.requireNonNull(key, "key");
    byte[] value = get(key.getBytes(StandardCharsets.UTF_8));
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  /**
   * Stores a value, replacing any previous one.
   *
   * @throws IllegalStateException inside a read-only view
   */
  public void put(byte[] key, byte[] value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    ensureWritable();
    store.put(conn, collection, Region.USER_DATA, key, value);
  }

  /**
   * Stores a UTF-8 value under a UTF-8 key.
   *
   * @throws IllegalStateException inside a read-only view
   */
  public void putString(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    put(key.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Removes a key.
   *
   * @return {@code true} if the key was present
   * @throws IllegalStateException inside a read-only view
   */
  public boolean delete(byte[] key) {
    Objects.requireNonNull(key, "key");
    ensureWritable();
    return store.delete(conn, collection, Region.USER_DATA, key);
  }

  /**
   * Returns every entry in ascending key order.
   */
  public List<Entry> entries() {
    List<Entry> entries = new ArrayList<>();
    byte[] afterKey = null;
    while (true) {
      List<Entry> page = store.scan(conn, collection, Region.USER_DATA, afterKey, SCAN_PAGE);
      entries.addAll(page);
      if (page.size() < SCAN_PAGE) {
        return entries;
      }
      afterKey = page.get(page.size() - 1).key();
    }
  }

  public int size() {
    return store.count(conn, collection, Region.USER_DATA);
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  private void ensureWritable() {
    if (readOnly) {
      throw new IllegalStateException("User data is read-only inside viewUserData");
    }
  }
}
