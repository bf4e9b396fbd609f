package diffstore.jdbc.store;

import java.util.List;

/**
 * H2 region store. Primarily for testing and embedded use.
 *
 * <p>Uses {@code MERGE INTO ... KEY} for both the region registry and entry upserts.
 */
public final class H2RegionStore extends AbstractJdbcRegionStore {

  public H2RegionStore() {
    super();
  }

  public H2RegionStore(String regionTable, String entryTable) {
    super(regionTable, entryTable);
  }

  @Override
  public AbstractJdbcRegionStore withTableNames(String regionTable, String entryTable) {
    return new H2RegionStore(regionTable, entryTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
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
            "entry_key VARBINARY(512) NOT NULL, " +
            "entry_value VARBINARY NOT NULL, " +
            "PRIMARY KEY (collection_name, region, entry_key))");
  }

  @Override
  protected String insertRegionIfAbsentSql() {
    return "MERGE INTO " + regionTable() + " (collection_name, region) " +
        "KEY (collection_name, region) VALUES (?, ?)";
  }

  @Override
  protected String upsertEntrySql() {
    return "MERGE INTO " + entryTable() + " (collection_name, region, entry_key, entry_value) " +
        "KEY (collection_name, region, entry_key) VALUES (?, ?, ?, ?)";
  }
}
