package diffstore.jdbc;

import diffstore.jdbc.store.AbstractJdbcRegionStore;
import diffstore.jdbc.store.H2RegionStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.UUID;

class H2RegionStoreTest extends AbstractRegionStoreIntegrationTest {

    private final H2RegionStore store = new H2RegionStore();
    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:regions_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        try (Connection conn = dataSource.getConnection()) {
            store.createSchema(conn);
        }
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcRegionStore store() {
        return store;
    }
}
