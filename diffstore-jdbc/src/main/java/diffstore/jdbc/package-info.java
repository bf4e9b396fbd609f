/**
 * JDBC plumbing shared by the region stores: a {@link diffstore.spi.ConnectionProvider}
 * over a {@link javax.sql.DataSource}, a small statement helper, and table name
 * validation.
 *
 * @see diffstore.jdbc.store
 */
package diffstore.jdbc;
