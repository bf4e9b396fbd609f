package diffstore.jdbc.store;

import java.util.List;

/**
 * PostgreSQL region store.
 *
 * <p>Keys and values are {@code BYTEA}, which PostgreSQL orders bytewise. Upserts use
 * {@code INSERT ... ON CONFLICT}.
 */
public final class PostgresRegionStore extends AbstractJdbcRegionStore {

  public PostgresRegionStore() {
    super();
  }

  public PostgresRegionStore(String regionTable, String entryTable) {
    super(regionTable, entryTable);
  }

  @Override
  public AbstractJdbcRegionStore withTableNames(String regionTable, String entryTable) {
    return new PostgresRegionStore(regionTable, entryTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected List<String> schemaStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + regionTable() + " (" +
            "collection_name VARCHAR(255) NOT NULL, " +
            "region VARCHAR(8) NOT NULL, " +
            "PRIMARY KEY (collection_name, region))",
        "CREATE TABLE IF NOT EXISTS " + entryTable() + " (" +
            "collection_name VARCHAR(255) NOT NULL, " +
            "region VARCHAR(8) NOT NULL, " +
            "entry_key BYTEA NOT NULL, " +
            "entry_value BYTEA NOT NULL, " +
            "PRIMARY KEY (collection_name, region, entry_key))");
  }

  @Override
  protected String insertRegionIfAbsentSql() {
    return "INSERT INTO " + regionTable() + " (collection_name, region) VALUES (?, ?) " +
        "ON CONFLICT (collection_name, region) DO NOTHING";
  }

  @Override
  protected String upsertEntrySql() {
    return "INSERT INTO " + entryTable() + " (collection_name, region, entry_key, entry_value) " +
        "VALUES (?, ?, ?, ?) " +
        "ON CONFLICT (collection_name, region, entry_key) DO UPDATE SET entry_value = EXCLUDED.entry_value";
  }
}
