package checkin.spi;

import checkin.model.Channel;

/**
 * Observability hook for exporting check-in engine counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see checkin.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * A pending check-in event was created.
     */
    void incrementEventsScheduled();

    /**
     * An event or delivery insert lost to a concurrent writer.
     */
    void incrementDuplicatesSuppressed();

    /**
     * An event was escalated to alerted.
     */
    void incrementEscalations();

    /**
     * An alerted event was escalated to its level-2 contacts.
     */
    void incrementLevel2Escalations();

    void incrementDeliverySent(Channel channel);

    void incrementDeliveryFailed(Channel channel);

    /**
     * A failed SMS used up its last retry.
     */
    void incrementRetriesExhausted();

    default void incrementConfirmations() {
    }

    default void incrementSnoozes() {
    }

    /**
     * Records the duration of the last complete tick.
     *
     * @param durationMs tick duration in milliseconds (always non-negative)
     */
    default void recordTickDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsScheduled() {
        }

        @Override
        public void incrementDuplicatesSuppressed() {
        }

        @Override
        public void incrementEscalations() {
        }

        @Override
        public void incrementLevel2Escalations() {
        }

        @Override
        public void incrementDeliverySent(Channel channel) {
        }

        @Override
        public void incrementDeliveryFailed(Channel channel) {
        }

        @Override
        public void incrementRetriesExhausted() {
        }
    }
}
