package diffstore.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import diffstore.jdbc.store.AbstractJdbcRegionStore;
import diffstore.jdbc.store.H2RegionStore;
import diffstore.jdbc.store.MySqlRegionStore;
import diffstore.jdbc.store.PostgresRegionStore;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

/**
 * Creates a {@link DatabaseSetup} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"}, and {@code "postgresql"} (external servers).
 * External database connection details are read from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}: default {@code jdbc:mysql://localhost:3306/diffstore_bench}</li>
 *   <li>{@code bench.mysql.user}: default {@code root}</li>
 *   <li>{@code bench.mysql.password}: default {@code ""} (empty)</li>
 *   <li>{@code bench.pg.url}: default {@code jdbc:postgresql://localhost:5432/diffstore_bench}</li>
 *   <li>{@code bench.pg.user}: default {@code postgres}</li>
 *   <li>{@code bench.pg.password}: default {@code postgres}</li>
 * </ul>
 *
 * <p>The tables are created by {@link diffstore.DiffDatabase} itself when it is built.
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(DataSource dataSource, AbstractJdbcRegionStore store) {}

  static DatabaseSetup create(String database, String dbName) {
    return switch (database) {
      case "h2" -> createH2(dbName);
      case "mysql" -> createMySql();
      case "postgresql" -> createPostgresql();
      default -> throw new IllegalArgumentException("Unsupported database: " + database);
    };
  }

  private static DatabaseSetup createH2(String dbName) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1");
    return new DatabaseSetup(ds, new H2RegionStore());
  }

  private static DatabaseSetup createMySql() {
    String url = System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/diffstore_bench");
    String user = System.getProperty("bench.mysql.user", "root");
    String password = System.getProperty("bench.mysql.password", "");
    return new DatabaseSetup(pool(url, user, password, "bench-mysql"), new MySqlRegionStore());
  }

  private static DatabaseSetup createPostgresql() {
    String url = System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/diffstore_bench");
    String user = System.getProperty("bench.pg.user", "postgres");
    String password = System.getProperty("bench.pg.password", "postgres");
    return new DatabaseSetup(pool(url, user, password, "bench-pg"), new PostgresRegionStore());
  }

  private static DataSource pool(String url, String user, String password, String poolName) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName(poolName);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    return new HikariDataSource(config);
  }

  /**
   * Empties the benchmark tables. Call after the schema exists.
   */
  static void truncate(DataSource ds) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM diff_entry");
      stmt.execute("DELETE FROM diff_region");
    } catch (Exception e) {
      throw new IllegalStateException("Failed to truncate benchmark tables", e);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
