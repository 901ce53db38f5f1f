package checkin.util;

import checkin.spi.CheckinStoreException;
import checkin.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs store calls on a fresh auto-commit connection, or inside a single transaction.
 */
public final class JdbcCalls {

    @FunctionalInterface
    public interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    private JdbcCalls() {
    }

    /**
     * Runs {@code action} on a new auto-commit connection.
     *
     * @throws CheckinStoreException if the connection cannot be obtained or the action throws {@link SQLException}
     */
    public static <T> T inConnection(ConnectionProvider connectionProvider, SqlFunction<T> action) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return action.apply(conn);
        } catch (SQLException e) {
            throw new CheckinStoreException("Database call failed", e);
        }
    }

    /**
     * Runs {@code action} in one transaction; rolls back on any exception.
     */
    public static <T> T inTransaction(ConnectionProvider connectionProvider, SqlFunction<T> action) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = action.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CheckinStoreException("Database transaction failed", e);
        }
    }
}
