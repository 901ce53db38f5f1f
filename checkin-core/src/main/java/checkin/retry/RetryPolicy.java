package checkin.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Strategy for spacing SMS retries.
 *
 * @see CappedExponentialBackoff
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Minutes to wait before the next attempt.
     *
     * @param retryCount retries already made, 0 at the first failure
     * @return delay in minutes (positive)
     */
    long delayMinutes(int retryCount);

    default Instant nextRetryAt(Instant now, int retryCount) {
        return now.plus(Duration.ofMinutes(delayMinutes(retryCount)));
    }
}
