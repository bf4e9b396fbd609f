package diffstore.jdbc;

import diffstore.DiffDatabase;
import diffstore.Differential;
import diffstore.jackson.JacksonValueCodec;
import diffstore.jdbc.store.H2RegionStore;
import diffstore.model.Entry;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class UserDataTest {
  private DiffDatabase db;
  private Differential users;

  @BeforeEach
  void setup() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:userdata_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    db = DiffDatabase.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .regionStore(new H2RegionStore())
        .codec(new JacksonValueCodec())
        .build();
    users = db.open("users");
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void updateCommits() {
    users.updateUserData(data -> {
      assertFalse(data.isReadOnly());
      data.putString("last_poll", "2024-05-01T10:00:00Z");
      data.put(bytes("raw"), new byte[] {1, 2, 3});
    });

    assertEquals("2024-05-01T10:00:00Z", users.viewUserData(data -> data.getString("last_poll")));
    assertArrayEquals(new byte[] {1, 2, 3}, users.viewUserData(data -> data.get(bytes("raw"))));
    assertEquals(2, users.<Integer>viewUserData(data -> data.size()));
  }

  @Test
  void viewIsReadOnly() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> users.viewUserData(data -> {
          assertTrue(data.isReadOnly());
          data.putString("k", "v");
          return null;
        }));
    assertTrue(ex.getMessage().contains("read-only"));

    assertThrows(IllegalStateException.class,
        () -> users.viewUserData(data -> data.delete(bytes("k"))));
    assertNull(users.viewUserData(data -> data.getString("k")));
  }

  @Test
  void updateRollsBackWhenCallbackThrows() {
    users.updateUserData(data -> data.putString("cursor", "1"));

    RuntimeException ex = assertThrows(RuntimeException.class, () -> users.updateUserData(data -> {
      data.putString("cursor", "2");
      data.putString("other", "x");
      throw new RuntimeException("abort");
    }));
    assertEquals("abort", ex.getMessage());

    assertEquals("1", users.viewUserData(data -> data.getString("cursor")));
    assertNull(users.viewUserData(data -> data.getString("other")));
  }

  @Test
  void entriesAreOrderedByKey() {
    users.updateUserData(data -> {
      data.putString("c", "3");
      data.putString("a", "1");
      data.putString("b", "2");
    });

    List<String> keys = users.viewUserData(data -> data.entries().stream()
        .map(Entry::key)
        .map(key -> new String(key, StandardCharsets.UTF_8))
        .collect(Collectors.toList()));

    assertEquals(List.of("a", "b", "c"), keys);
  }

  @Test
  void deleteRemovesKey() {
    users.updateUserData(data -> data.putString("k", "v"));

    users.updateUserData(data -> {
      assertTrue(data.delete(bytes("k")));
      assertFalse(data.delete(bytes("k")));
    });

    assertEquals(0, users.<Integer>viewUserData(data -> data.size()));
  }

  @Test
  void userDataIsIndependentOfChangeTracking() {
    users.updateUserData(data -> data.putString("k", "v"));
    users.add(bytes("k"), "value");
    users.each((id, decoder) -> { });

    assertEquals("v", users.viewUserData(data -> data.getString("k")));
    assertEquals(1, users.<Integer>viewUserData(data -> data.size()));
  }
}
