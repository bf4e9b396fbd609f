package diffstore.jdbc.store;

import diffstore.jdbc.JdbcTemplate;
import diffstore.jdbc.TableNames;
import diffstore.model.Entry;
import diffstore.model.Region;
import diffstore.spi.RegionStore;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC region store with standard SQL implementations.
 *
 * <p>Two tables hold every collection: a registry of the regions that exist
 * ({@code collection_name, region}) and the entries themselves
 * ({@code collection_name, region, entry_key, entry_value}, keyed by the first three).
 * Subclasses supply the DDL and the two statements standard SQL has no portable form
 * for: inserting a region row unless it exists, and upserting an entry. Register custom
 * implementations via
 * {@code META-INF/services/diffstore.jdbc.store.AbstractJdbcRegionStore}.
 *
 * <p>Binary keys are compared as unsigned bytes by every supported database, which is
 * the order {@link #scan} returns.
 *
 * @see JdbcRegionStores
 */
public abstract class AbstractJdbcRegionStore implements RegionStore {
  private static final JdbcTemplate.RowMapper<Entry> ENTRY_ROW_MAPPER =
      rs -> new Entry(rs.getBytes("entry_key"), rs.getBytes("entry_value"));

  private final String regionTable;
  private final String entryTable;

  protected AbstractJdbcRegionStore() {
    this(TableNames.DEFAULT_REGION_TABLE, TableNames.DEFAULT_ENTRY_TABLE);
  }

  protected AbstractJdbcRegionStore(String regionTable, String entryTable) {
    this.regionTable = TableNames.validate(regionTable);
    this.entryTable = TableNames.validate(entryTable);
  }

  /**
   * Unique identifier for this region store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this region store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind over differently named tables.
   */
  public abstract AbstractJdbcRegionStore withTableNames(String regionTable, String entryTable);

  /**
   * DDL creating both tables if they do not exist, executed in order.
   */
  protected abstract List<String> schemaStatements();

  /**
   * Inserts {@code (collection_name, region)} into the region table unless present.
   */
  protected abstract String insertRegionIfAbsentSql();

  /**
   * Inserts {@code (collection_name, region, entry_key, entry_value)} into the entry
   * table, or overwrites {@code entry_value} if the key exists.
   */
  protected abstract String upsertEntrySql();

  protected String regionTable() {
    return regionTable;
  }

  protected String entryTable() {
    return entryTable;
  }

  @Override
  public void createSchema(Connection conn) {
    for (String ddl : schemaStatements()) {
      JdbcTemplate.execute(conn, ddl);
    }
  }

  @Override
  public void createRegion(Connection conn, String collection, Region region) {
    JdbcTemplate.update(conn, insertRegionIfAbsentSql(), collection, region.id());
  }

  @Override
  public boolean regionExists(Connection conn, String collection, Region region) {
    String sql = "SELECT 1 FROM " + regionTable + " WHERE collection_name=? AND region=?";
    return !JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE, collection, region.id()).isEmpty();
  }

  @Override
  public boolean dropRegion(Connection conn, String collection, Region region) {
    JdbcTemplate.update(conn,
        "DELETE FROM " + entryTable + " WHERE collection_name=? AND region=?",
        collection, region.id());
    return JdbcTemplate.update(conn,
        "DELETE FROM " + regionTable + " WHERE collection_name=? AND region=?",
        collection, region.id()) > 0;
  }

  /**
   * Locks the {@code _m} row of the region table with {@code SELECT ... FOR UPDATE}.
   * The row is created when the collection is opened.
   */
  @Override
  public void lockCollection(Connection conn, String collection) {
    String sql = "SELECT region FROM " + regionTable + " WHERE collection_name=? AND region=? FOR UPDATE";
    JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE, collection, Region.COMMITTED.id());
  }

  @Override
  public boolean collectionExists(Connection conn, String collection) {
    String sql = "SELECT 1 FROM " + regionTable + " WHERE collection_name=? LIMIT 1";
    return !JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE, collection).isEmpty();
  }

  @Override
  public List<String> listCollections(Connection conn) {
    String sql = "SELECT DISTINCT collection_name FROM " + regionTable + " ORDER BY collection_name";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString(1));
  }

  @Override
  public boolean dropCollection(Connection conn, String collection) {
    JdbcTemplate.update(conn, "DELETE FROM " + entryTable + " WHERE collection_name=?", collection);
    return JdbcTemplate.update(conn,
        "DELETE FROM " + regionTable + " WHERE collection_name=?", collection) > 0;
  }

  @Override
  public byte[] get(Connection conn, String collection, Region region, byte[] key) {
    Objects.requireNonNull(key, "key");
    String sql = "SELECT entry_value FROM " + entryTable +
        " WHERE collection_name=? AND region=? AND entry_key=?";
    return JdbcTemplate.queryForObject(conn, sql, rs -> rs.getBytes(1), collection, region.id(), key);
  }

  @Override
  public void put(Connection conn, String collection, Region region, byte[] key, byte[] value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    JdbcTemplate.update(conn, upsertEntrySql(), collection, region.id(), key, value);
  }

  @Override
  public boolean delete(Connection conn, String collection, Region region, byte[] key) {
    Objects.requireNonNull(key, "key");
    String sql = "DELETE FROM " + entryTable + " WHERE collection_name=? AND region=? AND entry_key=?";
    return JdbcTemplate.update(conn, sql, collection, region.id(), key) > 0;
  }

  @Override
  public int clear(Connection conn, String collection, Region region) {
    String sql = "DELETE FROM " + entryTable + " WHERE collection_name=? AND region=?";
    return JdbcTemplate.update(conn, sql, collection, region.id());
  }

  @Override
  public int count(Connection conn, String collection, Region region) {
    String sql = "SELECT COUNT(*) FROM " + entryTable + " WHERE collection_name=? AND region=?";
    Long count = JdbcTemplate.queryForObject(conn, sql, rs -> rs.getLong(1), collection, region.id());
    return count == null ? 0 : Math.toIntExact(count);
  }

  @Override
  public List<Entry> scan(Connection conn, String collection, Region region, byte[] afterKey, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (afterKey == null) {
      String sql = "SELECT entry_key, entry_value FROM " + entryTable +
          " WHERE collection_name=? AND region=? ORDER BY entry_key LIMIT ?";
      return JdbcTemplate.query(conn, sql, ENTRY_ROW_MAPPER, collection, region.id(), limit);
    }
    String sql = "SELECT entry_key, entry_value FROM " + entryTable +
        " WHERE collection_name=? AND region=? AND entry_key>? ORDER BY entry_key LIMIT ?";
    return JdbcTemplate.query(conn, sql, ENTRY_ROW_MAPPER, collection, region.id(), afterKey, limit);
  }

  // TODO: index entry_value of PENDING rows so this stops scanning the whole region
  @Override
  public boolean containsValue(Connection conn, String collection, Region region, byte[] value,
      byte[] excludedKey) {
    Objects.requireNonNull(value, "value");
    if (excludedKey == null) {
      String sql = "SELECT 1 FROM " + entryTable +
          " WHERE collection_name=? AND region=? AND entry_value=? LIMIT 1";
      return !JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE, collection, region.id(), value).isEmpty();
    }
    String sql = "SELECT 1 FROM " + entryTable +
        " WHERE collection_name=? AND region=? AND entry_value=? AND entry_key<>? LIMIT 1";
    return !JdbcTemplate.query(conn, sql, rs -> Boolean.TRUE,
        collection, region.id(), value, excludedKey).isEmpty();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + regionTable + ", " + entryTable + "]";
  }
}
