package diffstore.jdbc.store;

import java.util.List;

/**
 * MySQL region store. Also compatible with TiDB.
 *
 * <p>Collection names use a binary collation so that names differing only in case stay
 * distinct collections. Upserts use {@code ON DUPLICATE KEY UPDATE}.
 */
public final class MySqlRegionStore extends AbstractJdbcRegionStore {

  public MySqlRegionStore() {
    super();
  }

  public MySqlRegionStore(String regionTable, String entryTable) {
    super(regionTable, entryTable);
  }

  @Override
  public AbstractJdbcRegionStore withTableNames(String regionTable, String entryTable) {
    return new MySqlRegionStore(regionTable, entryTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected List<String> schemaStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + regionTable() + " (" +
            "collection_name VARCHAR(255) CHARACTER SET utf8mb4 COLLATE utf8mb4_bin NOT NULL, " +
            "region VARCHAR(8) CHARACTER SET ascii COLLATE ascii_bin NOT NULL, " +
            "PRIMARY KEY (collection_name, region)) ENGINE=InnoDB",
        "CREATE TABLE IF NOT EXISTS " + entryTable() + " (" +
            "collection_name VARCHAR(255) CHARACTER SET utf8mb4 COLLATE utf8mb4_bin NOT NULL, " +
            "region VARCHAR(8) CHARACTER SET ascii COLLATE ascii_bin NOT NULL, " +
            "entry_key VARBINARY(512) NOT NULL, " +
            "entry_value LONGBLOB NOT NULL, " +
            "PRIMARY KEY (collection_name, region, entry_key)) ENGINE=InnoDB");
  }

  @Override
  protected String insertRegionIfAbsentSql() {
    return "INSERT IGNORE INTO " + regionTable() + " (collection_name, region) VALUES (?, ?)";
  }

  @Override
  protected String upsertEntrySql() {
    return "INSERT INTO " + entryTable() + " (collection_name, region, entry_key, entry_value) " +
        "VALUES (?, ?, ?, ?) ON DUPLICATE KEY UPDATE entry_value = VALUES(entry_value)";
  }
}
