package diffstore.jdbc;

import java.util.Objects;

/**
 * Shared table name validation for JDBC region stores.
 */
public final class TableNames {
  public static final String DEFAULT_REGION_TABLE = "diff_region";
  public static final String DEFAULT_ENTRY_TABLE = "diff_entry";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
