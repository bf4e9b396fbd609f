package diffstore.jdbc;

import diffstore.DiffDatabase;
import diffstore.Differential;
import diffstore.jackson.JacksonValueCodec;
import diffstore.jdbc.store.AbstractJdbcRegionStore;
import diffstore.model.Entry;
import diffstore.model.Region;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Region store contract, run against every supported database.
 * Subclasses provide a DataSource with the schema created and both tables empty.
 */
abstract class AbstractRegionStoreIntegrationTest {

    record Row(String name, int version) {}

    abstract DataSource dataSource();

    abstract AbstractJdbcRegionStore store();

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private void withConnection(Consumer<Connection> action) throws SQLException {
        try (Connection conn = dataSource().getConnection()) {
            conn.setAutoCommit(true);
            action.accept(conn);
        }
    }

    @Test
    void createSchemaIsIdempotent() throws Exception {
        withConnection(conn -> {
            store().createSchema(conn);
            store().createSchema(conn);
        });
    }

    @Test
    void createRegionIsIdempotent() throws Exception {
        withConnection(conn -> {
            store().createRegion(conn, "users", Region.COMMITTED);
            store().createRegion(conn, "users", Region.COMMITTED);

            assertTrue(store().regionExists(conn, "users", Region.COMMITTED));
            assertFalse(store().regionExists(conn, "users", Region.CONFLICTS));
            assertTrue(store().collectionExists(conn, "users"));
            assertFalse(store().collectionExists(conn, "orders"));
        });
    }

    @Test
    void putGetAndOverwrite() throws Exception {
        withConnection(conn -> {
            assertNull(store().get(conn, "users", Region.PENDING, bytes("k")));

            store().put(conn, "users", Region.PENDING, bytes("k"), bytes("v1"));
            assertArrayEquals(bytes("v1"), store().get(conn, "users", Region.PENDING, bytes("k")));

            store().put(conn, "users", Region.PENDING, bytes("k"), bytes("v2"));
            assertArrayEquals(bytes("v2"), store().get(conn, "users", Region.PENDING, bytes("k")));
            assertEquals(1, store().count(conn, "users", Region.PENDING));
        });
    }

    @Test
    void emptyValueIsPresent() throws Exception {
        withConnection(conn -> {
            store().put(conn, "users", Region.CONFLICTS, bytes("k"), new byte[0]);

            assertTrue(store().contains(conn, "users", Region.CONFLICTS, bytes("k")));
            assertArrayEquals(new byte[0], store().get(conn, "users", Region.CONFLICTS, bytes("k")));
        });
    }

    @Test
    void regionsAndCollectionsAreIsolated() throws Exception {
        withConnection(conn -> {
            store().put(conn, "users", Region.COMMITTED, bytes("k"), bytes("committed"));
            store().put(conn, "users", Region.PENDING, bytes("k"), bytes("pending"));
            store().put(conn, "orders", Region.COMMITTED, bytes("k"), bytes("other"));

            assertArrayEquals(bytes("committed"), store().get(conn, "users", Region.COMMITTED, bytes("k")));
            assertArrayEquals(bytes("pending"), store().get(conn, "users", Region.PENDING, bytes("k")));
            assertArrayEquals(bytes("other"), store().get(conn, "orders", Region.COMMITTED, bytes("k")));
        });
    }

    @Test
    void deleteReportsPresence() throws Exception {
        withConnection(conn -> {
            store().put(conn, "users", Region.PAYLOAD, bytes("k"), bytes("v"));

            assertTrue(store().delete(conn, "users", Region.PAYLOAD, bytes("k")));
            assertFalse(store().delete(conn, "users", Region.PAYLOAD, bytes("k")));
            assertNull(store().get(conn, "users", Region.PAYLOAD, bytes("k")));
        });
    }

    @Test
    void scanPagesInUnsignedKeyOrder() throws Exception {
        byte[][] keys = {{(byte) 0xff}, {0x01}, {(byte) 0x80}, {0x7f}, {0x01, 0x00}};
        withConnection(conn -> {
            for (byte[] key : keys) {
                store().put(conn, "users", Region.PENDING, key, bytes("v"));
            }

            List<byte[]> seen = new ArrayList<>();
            byte[] after = null;
            while (true) {
                List<Entry> page = store().scan(conn, "users", Region.PENDING, after, 2);
                page.forEach(e -> seen.add(e.key()));
                if (page.size() < 2) {
                    break;
                }
                after = page.get(page.size() - 1).key();
            }

            assertEquals(5, seen.size());
            assertArrayEquals(new byte[] {0x01}, seen.get(0));
            assertArrayEquals(new byte[] {0x01, 0x00}, seen.get(1));
            assertArrayEquals(new byte[] {0x7f}, seen.get(2));
            assertArrayEquals(new byte[] {(byte) 0x80}, seen.get(3));
            assertArrayEquals(new byte[] {(byte) 0xff}, seen.get(4));
        });
    }

    @Test
    void containsValueHonoursExclusion() throws Exception {
        withConnection(conn -> {
            store().put(conn, "users", Region.PENDING, bytes("a"), bytes("fp"));

            assertTrue(store().containsValue(conn, "users", Region.PENDING, bytes("fp"), null));
            assertFalse(store().containsValue(conn, "users", Region.PENDING, bytes("fp"), bytes("a")));

            store().put(conn, "users", Region.PENDING, bytes("b"), bytes("fp"));
            assertTrue(store().containsValue(conn, "users", Region.PENDING, bytes("fp"), bytes("a")));
            assertFalse(store().containsValue(conn, "users", Region.COMMITTED, bytes("fp"), null));
        });
    }

    @Test
    void clearKeepsRegion() throws Exception {
        withConnection(conn -> {
            store().createRegion(conn, "users", Region.CONFLICTS);
            store().put(conn, "users", Region.CONFLICTS, bytes("a"), new byte[0]);
            store().put(conn, "users", Region.CONFLICTS, bytes("b"), new byte[0]);

            assertEquals(2, store().clear(conn, "users", Region.CONFLICTS));
            assertEquals(0, store().count(conn, "users", Region.CONFLICTS));
            assertTrue(store().regionExists(conn, "users", Region.CONFLICTS));
        });
    }

    @Test
    void dropRegionRemovesEntries() throws Exception {
        withConnection(conn -> {
            store().createRegion(conn, "users", Region.CONFLICTS);
            store().put(conn, "users", Region.CONFLICTS, bytes("a"), new byte[0]);

            assertTrue(store().dropRegion(conn, "users", Region.CONFLICTS));
            assertFalse(store().regionExists(conn, "users", Region.CONFLICTS));
            assertEquals(0, store().count(conn, "users", Region.CONFLICTS));
            assertFalse(store().dropRegion(conn, "users", Region.CONFLICTS));
        });
    }

    @Test
    void listAndDropCollections() throws Exception {
        withConnection(conn -> {
            store().createRegion(conn, "orders", Region.COMMITTED);
            store().createRegion(conn, "users", Region.COMMITTED);
            store().createRegion(conn, "users", Region.PENDING);
            store().put(conn, "users", Region.PENDING, bytes("k"), bytes("v"));

            assertEquals(List.of("orders", "users"), store().listCollections(conn));

            assertTrue(store().dropCollection(conn, "users"));
            assertEquals(List.of("orders"), store().listCollections(conn));
            assertNull(store().get(conn, "users", Region.PENDING, bytes("k")));
            assertFalse(store().dropCollection(conn, "users"));
        });
    }

    @Test
    void lockCollectionBlocksSecondWriterUntilCommit() throws Exception {
        withConnection(conn -> store().createRegion(conn, "users", Region.COMMITTED));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (Connection holder = dataSource().getConnection()) {
            holder.setAutoCommit(false);
            store().lockCollection(holder, "users");

            Future<byte[]> waiter = executor.submit(() -> {
                try (Connection conn = dataSource().getConnection()) {
                    conn.setAutoCommit(false);
                    store().lockCollection(conn, "users");
                    byte[] seen = store().get(conn, "users", Region.PENDING, bytes("k"));
                    conn.commit();
                    return seen;
                }
            });

            Thread.sleep(300);
            assertFalse(waiter.isDone());

            store().put(holder, "users", Region.PENDING, bytes("k"), bytes("v"));
            holder.commit();

            assertArrayEquals(bytes("v"), waiter.get(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void lockCollectionOfUnknownCollectionIsNoOp() throws Exception {
        withConnection(conn -> store().lockCollection(conn, "missing"));
    }

    @Test
    void differentialRoundTrip() {
        DiffDatabase db = DiffDatabase.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource()))
                .regionStore(store())
                .codec(new JacksonValueCodec())
                .build();
        Differential rows = db.open("rows");

        assertTrue(rows.add(bytes("1"), new Row("one", 1)));
        assertTrue(rows.add(bytes("2"), new Row("two", 1)));
        assertFalse(rows.add(bytes("2"), new Row("two", 1)));

        List<Row> applied = new ArrayList<>();
        assertEquals(2, rows.each((id, decoder) -> applied.add(decoder.decode(Row.class))));

        assertEquals(List.of(new Row("one", 1), new Row("two", 1)), applied);
        assertEquals(2, rows.countTracking());
        assertEquals(0, rows.countChanges());
        assertFalse(rows.add(bytes("1"), new Row("one", 1)));
        assertTrue(rows.add(bytes("1"), new Row("one", 2)));
        assertEquals(List.of("rows"), db.collections());
    }
}
