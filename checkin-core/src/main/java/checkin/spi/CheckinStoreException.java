package checkin.spi;

/**
 * Unchecked exception for persistence failures: JDBC errors raised by {@link CheckinStore}
 * implementations, or a connection that could not be obtained.
 */
public final class CheckinStoreException extends RuntimeException {
    public CheckinStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
