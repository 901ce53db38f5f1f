package checkin.retry;

import checkin.alert.DefaultAlertComposer;
import checkin.delivery.DeliveryGateway;
import checkin.model.AlertDelivery;
import checkin.model.Channel;
import checkin.model.DueRetry;
import checkin.spi.AlertComposer;
import checkin.spi.CheckinStore;
import checkin.spi.ConnectionProvider;
import checkin.spi.MetricsExporter;
import checkin.spi.PhoneDecryptor;
import checkin.spi.SmsResult;
import checkin.util.JdbcCalls;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resends failed SMS alerts whose retry time has come.
 *
 * <p>The alert text is composed again from the event and the user's current name rather
 * than stored. A failure increments the retry count and schedules the next attempt via the
 * {@link RetryPolicy}; once {@code maxRetries} is reached the delivery stays {@code failed}
 * with no next retry time.
 */
public final class DeliveryRetryManager {
    private static final Logger logger = Logger.getLogger(DeliveryRetryManager.class.getName());

    private final ConnectionProvider connectionProvider;
    private final CheckinStore store;
    private final DeliveryGateway deliveryGateway;
    private final PhoneDecryptor phoneDecryptor;
    private final AlertComposer alertComposer;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final int batchSize;

    private DeliveryRetryManager(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.deliveryGateway = Objects.requireNonNull(builder.deliveryGateway, "deliveryGateway");
        this.phoneDecryptor = Objects.requireNonNull(builder.phoneDecryptor, "phoneDecryptor");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.alertComposer = builder.alertComposer != null ? builder.alertComposer : new DefaultAlertComposer();
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new CappedExponentialBackoff();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.batchSize = builder.batchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retries every failed SMS due at {@code now}.
     *
     * @return number of deliveries that succeeded on this run
     */
    public int runRetries(Instant now) {
        List<DueRetry> due;
        try {
            due = JdbcCalls.inConnection(connectionProvider, conn -> store.findDueRetries(conn, now, batchSize));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load due retries", e);
            return 0;
        }
        int succeeded = 0;
        for (DueRetry retry : due) {
            try {
                if (retry(retry, now)) {
                    succeeded++;
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to retry delivery " + retry.delivery().deliveryId(), e);
            }
        }
        return succeeded;
    }

    private boolean retry(DueRetry retry, Instant now) {
        AlertDelivery delivery = retry.delivery();
        SmsResult result;
        try {
            String phone = phoneDecryptor.decrypt(retry.phoneEncrypted());
            String text = alertComposer.composeAlertText(retry.userName(), retry.scheduledTime());
            result = deliveryGateway.sendSms(phone, text);
        } catch (RuntimeException e) {
            result = SmsResult.failed(null, "Phone decryption failed: " + e.getMessage());
        }

        if (result.success()) {
            SmsResult sent = result;
            JdbcCalls.inConnection(connectionProvider, conn ->
                store.markDeliverySent(conn, delivery.deliveryId(), sent.providerRef(), sent.providerStatus(), now));
            metrics.incrementDeliverySent(Channel.SMS);
            logger.log(Level.INFO, "Retry of delivery {0} succeeded", delivery.deliveryId());
            return true;
        }

        int newCount = delivery.retryCount() + 1;
        Instant nextRetryAt = newCount < delivery.maxRetries() ? retryPolicy.nextRetryAt(now, newCount) : null;
        String error = result.errorMessage();
        int rows = JdbcCalls.inConnection(connectionProvider, conn -> store.markDeliveryRetryFailed(
            conn, delivery.deliveryId(), delivery.retryCount(), error, nextRetryAt, now));
        if (rows == 0) {
            logger.log(Level.FINE, "Delivery {0} was updated concurrently", delivery.deliveryId());
            return false;
        }
        metrics.incrementDeliveryFailed(Channel.SMS);
        if (nextRetryAt == null) {
            metrics.incrementRetriesExhausted();
            logger.log(Level.WARNING, "Delivery {0} gave up after {1} retries: {2}",
                new Object[]{delivery.deliveryId(), newCount, error});
        } else {
            logger.log(Level.INFO, "Retry {0} of delivery {1} failed, next attempt at {2}",
                new Object[]{newCount, delivery.deliveryId(), nextRetryAt});
        }
        return false;
    }

    /**
     * Builder for {@link DeliveryRetryManager}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CheckinStore store;
        private DeliveryGateway deliveryGateway;
        private PhoneDecryptor phoneDecryptor;
        private AlertComposer alertComposer;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private int batchSize = 100;

        private Builder() {
        }

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder store(CheckinStore store) {
            this.store = store;
            return this;
        }

        public Builder deliveryGateway(DeliveryGateway deliveryGateway) {
            this.deliveryGateway = deliveryGateway;
            return this;
        }

        public Builder phoneDecryptor(PhoneDecryptor phoneDecryptor) {
            this.phoneDecryptor = phoneDecryptor;
            return this;
        }

        public Builder alertComposer(AlertComposer alertComposer) {
            this.alertComposer = alertComposer;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Maximum number of deliveries retried per run. Defaults to {@code 100}.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public DeliveryRetryManager build() {
            return new DeliveryRetryManager(this);
        }
    }
}
