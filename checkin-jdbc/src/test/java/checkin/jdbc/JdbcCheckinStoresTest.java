package checkin.jdbc;

import checkin.jdbc.store.AbstractJdbcCheckinStore;
import checkin.jdbc.store.H2CheckinStore;
import checkin.jdbc.store.JdbcCheckinStores;
import checkin.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCheckinStoresTest {

  @Test
  void allReturnsBuiltInStores() {
    List<AbstractJdbcCheckinStore> stores = JdbcCheckinStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcCheckinStores.get("MySQL").name());
    assertEquals("postgresql", JdbcCheckinStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcCheckinStores.get("H2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcCheckinStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown check-in store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcCheckinStores.detect("jdbc:mysql://localhost:3306/checkin").name());
    assertEquals("mysql", JdbcCheckinStores.detect("jdbc:tidb://localhost:4000/checkin").name());
    assertEquals("postgresql", JdbcCheckinStores.detect("jdbc:postgresql://localhost/checkin").name());
    assertEquals("h2", JdbcCheckinStores.detect("jdbc:h2:mem:checkin").name());
  }

  @Test
  void detectIsCaseInsensitive() {
    assertEquals("postgresql", JdbcCheckinStores.detect("JDBC:POSTGRESQL://localhost/checkin").name());
  }

  @Test
  void detectThrowsForUnknownUrl() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcCheckinStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("jdbc:mysql:"));
  }

  @Test
  void detectThrowsForEmptyUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcCheckinStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcCheckinStores.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");

    assertEquals("h2", JdbcCheckinStores.detect(ds).name());
  }

  @Test
  void detectWithCodecReturnsFreshStoreOfSameDialect() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    JsonCodec codec = new JsonCodec() {
      @Override
      public String toJson(Map<String, String> values) {
        return JsonCodec.getDefault().toJson(values);
      }

      @Override
      public Map<String, String> parseObject(String json) {
        return JsonCodec.getDefault().parseObject(json);
      }

      @Override
      public String toJsonArray(List<String> values) {
        return JsonCodec.getDefault().toJsonArray(values);
      }

      @Override
      public List<String> parseArray(String json) {
        return JsonCodec.getDefault().parseArray(json);
      }
    };

    AbstractJdbcCheckinStore store = JdbcCheckinStores.detect(ds, codec);

    assertInstanceOf(H2CheckinStore.class, store);
    assertNotSame(JdbcCheckinStores.get("h2"), store);
  }

  @Test
  void schemaResourceFollowsName() {
    for (AbstractJdbcCheckinStore store : JdbcCheckinStores.all()) {
      assertEquals("/schema/" + store.name() + ".sql", store.schemaResource());
      assertNotNull(JdbcCheckinStoresTest.class.getResource(store.schemaResource()),
          "missing DDL for " + store.name());
    }
  }
}
