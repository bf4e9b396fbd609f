/**
 * JDBC-based {@link diffstore.spi.RegionStore} implementations.
 *
 * <p>{@link diffstore.jdbc.store.AbstractJdbcRegionStore} provides shared SQL and keyset
 * pagination; subclasses supply database-specific DDL and upserts: H2
 * ({@code MERGE INTO ... KEY}), MySQL ({@code ON DUPLICATE KEY UPDATE}), and PostgreSQL
 * ({@code ON CONFLICT}).
 *
 * @see diffstore.jdbc.store.AbstractJdbcRegionStore
 * @see diffstore.jdbc.store.H2RegionStore
 * @see diffstore.jdbc.store.MySqlRegionStore
 * @see diffstore.jdbc.store.PostgresRegionStore
 * @see diffstore.jdbc.store.JdbcRegionStores
 */
package diffstore.jdbc.store;
