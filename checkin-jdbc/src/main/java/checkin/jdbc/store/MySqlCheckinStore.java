package checkin.jdbc.store;

import checkin.jdbc.JdbcTemplate;
import checkin.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * MySQL check-in store. Also compatible with TiDB.
 *
 * <p>Uses {@code INSERT IGNORE}, which reports 0 affected rows for a row that clashes
 * with a unique key.
 */
public final class MySqlCheckinStore extends AbstractJdbcCheckinStore {

  public MySqlCheckinStore() {
    super();
  }

  public MySqlCheckinStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcCheckinStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlCheckinStore(jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected int insertUnique(Connection conn, String table, String columns, Object... params) {
    return JdbcTemplate.update(conn, insertSql("INSERT IGNORE INTO", table, columns, params.length), params);
  }
}
