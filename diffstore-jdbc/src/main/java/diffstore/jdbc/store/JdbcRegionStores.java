package diffstore.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC region stores with auto-detection support.
 *
 * <p>Region stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/diffstore.jdbc.store.AbstractJdbcRegionStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcRegionStore store = JdbcRegionStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcRegionStore store = JdbcRegionStores.detect("jdbc:mysql://localhost/mydb");
 *
 * // Custom table names
 * AbstractJdbcRegionStore store = JdbcRegionStores.detect(dataSource, "sync_region", "sync_entry");
 *
 * // Get by name
 * AbstractJdbcRegionStore store = JdbcRegionStores.get("postgresql");
 * }</pre>
 */
public final class JdbcRegionStores {

    private static final List<AbstractJdbcRegionStore> STORES;
    private static final Map<String, AbstractJdbcRegionStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcRegionStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcRegionStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcRegionStores() {
    }

    /**
     * Returns all registered region stores.
     */
    public static List<AbstractJdbcRegionStore> all() {
        return STORES;
    }

    /**
     * Gets a region store by name.
     *
     * @param name region store name (case-insensitive)
     * @return the region store
     * @throws IllegalArgumentException if no region store found
     */
    public static AbstractJdbcRegionStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcRegionStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown region store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the region store from a DataSource.
     *
     * @param dataSource the data source
     * @return detected region store
     * @throws IllegalStateException if detection fails or no matching region store
     */
    public static AbstractJdbcRegionStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect region store from DataSource", e);
        }
    }

    /**
     * Auto-detects the region store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected region store
     * @throws IllegalArgumentException if no matching region store found
     */
    public static AbstractJdbcRegionStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcRegionStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No region store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    /**
     * Auto-detects the region store from a DataSource and binds it to custom tables.
     *
     * @param dataSource  the data source
     * @param regionTable name of the region registry table
     * @param entryTable  name of the entry table
     * @return detected region store over the given tables
     * @throws IllegalStateException    if detection fails or no matching region store
     * @throws IllegalArgumentException if a table name is invalid
     */
    public static AbstractJdbcRegionStore detect(DataSource dataSource, String regionTable, String entryTable) {
        return detect(dataSource).withTableNames(regionTable, entryTable);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
