package checkin.retry;

/**
 * Doubling backoff with a hard cap: {@code min(2^retryCount, capMinutes)}.
 *
 * <p>With the default cap of 30 minutes the delays are 1, 2, 4, 8, 16, 30, 30, ...
 * There is no jitter; the cap bounds time-to-notify for a safety alert.
 */
public final class CappedExponentialBackoff implements RetryPolicy {
    public static final long DEFAULT_CAP_MINUTES = 30;

    private final long capMinutes;

    public CappedExponentialBackoff() {
        this(DEFAULT_CAP_MINUTES);
    }

    /**
     * @param capMinutes upper bound on any single delay
     */
    public CappedExponentialBackoff(long capMinutes) {
        if (capMinutes <= 0) {
            throw new IllegalArgumentException("capMinutes must be > 0, got: " + capMinutes);
        }
        this.capMinutes = capMinutes;
    }

    @Override
    public long delayMinutes(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, got: " + retryCount);
        }
        if (retryCount >= 62) {
            return capMinutes;
        }
        return Math.min(1L << retryCount, capMinutes);
    }

    public long capMinutes() {
        return capMinutes;
    }
}
