package checkin.jdbc;

import checkin.jdbc.store.AbstractJdbcCheckinStore;
import checkin.jdbc.store.H2CheckinStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;
import java.util.UUID;

class H2MySqlModeCheckinStoreTest extends AbstractCheckinStoreIntegrationTest {
  private final H2CheckinStore store = new H2CheckinStore();
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    Schemas.apply(dataSource, store.schemaResource());
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcCheckinStore store() {
    return store;
  }
}
