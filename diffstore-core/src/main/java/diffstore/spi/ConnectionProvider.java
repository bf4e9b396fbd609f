package diffstore.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for the transactions opened by a
 * {@link diffstore.DiffDatabase} and its differentials.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see diffstore.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
