/**
 * JDBC-based {@link checkin.spi.CheckinStore} implementations.
 *
 * <p>{@link checkin.jdbc.store.AbstractJdbcCheckinStore} provides shared SQL and row mapping;
 * subclasses supply the database-specific duplicate-tolerant insert: H2 (constraint violation
 * mapped to a skipped row), MySQL ({@code INSERT IGNORE}) and PostgreSQL
 * ({@code ON CONFLICT DO NOTHING}).
 *
 * @see checkin.jdbc.store.AbstractJdbcCheckinStore
 * @see checkin.jdbc.store.H2CheckinStore
 * @see checkin.jdbc.store.MySqlCheckinStore
 * @see checkin.jdbc.store.PostgresCheckinStore
 * @see checkin.jdbc.store.JdbcCheckinStores
 */
package checkin.jdbc.store;
