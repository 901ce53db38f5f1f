package checkin.jdbc.store;

import checkin.util.JsonCodec;

import java.util.List;

/**
 * H2 check-in store. Primarily for testing.
 *
 * <p>Uses the default insert from {@link AbstractJdbcCheckinStore}, which maps a
 * constraint violation to a skipped row.
 */
public final class H2CheckinStore extends AbstractJdbcCheckinStore {

  public H2CheckinStore() {
    super();
  }

  public H2CheckinStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcCheckinStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2CheckinStore(jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
