package checkin.jdbc.store;

import checkin.jdbc.JdbcTemplate;
import checkin.util.JsonCodec;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL check-in store.
 *
 * <p>Uses {@code ON CONFLICT DO NOTHING} so a duplicate slot or delivery claim does not
 * abort the surrounding transaction.
 */
public final class PostgresCheckinStore extends AbstractJdbcCheckinStore {

  public PostgresCheckinStore() {
    super();
  }

  public PostgresCheckinStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcCheckinStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresCheckinStore(jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected int insertUnique(Connection conn, String table, String columns, Object... params) {
    String sql = insertSql("INSERT INTO", table, columns, params.length) + " ON CONFLICT DO NOTHING";
    return JdbcTemplate.update(conn, sql, params);
  }

  @Override
  protected String level2DueTime() {
    return "e.escalated_at + u.level2_delay_minutes * INTERVAL '1' MINUTE";
  }
}
