/**
 * JDBC plumbing shared by the check-in stores.
 *
 * <p>{@link checkin.jdbc.JdbcTemplate} wraps every {@link java.sql.SQLException} in a
 * {@link checkin.spi.CheckinStoreException}; dialect-specific stores live in
 * {@link checkin.jdbc.store}.
 */
package checkin.jdbc;
