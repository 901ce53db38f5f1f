package checkin;

import checkin.action.CheckinActionHandler;
import checkin.action.ConfirmRequest;
import checkin.action.ConfirmResponse;
import checkin.action.PauseResponse;
import checkin.action.SnoozeRequest;
import checkin.action.SnoozeResponse;
import checkin.alert.DefaultAlertComposer;
import checkin.delivery.DeliveryGateway;
import checkin.escalation.EscalationEngine;
import checkin.escalation.EscalationResult;
import checkin.model.CheckinEvent;
import checkin.model.HistoryEntry;
import checkin.retry.CappedExponentialBackoff;
import checkin.retry.DeliveryRetryManager;
import checkin.retry.RetryPolicy;
import checkin.schedule.CheckinScheduler;
import checkin.spi.AlertComposer;
import checkin.spi.CheckinStore;
import checkin.spi.ConnectionProvider;
import checkin.spi.MetricsExporter;
import checkin.spi.PhoneDecryptor;
import checkin.spi.PushSender;
import checkin.spi.SmsSender;
import checkin.tick.CheckinTicker;
import checkin.tick.TickSummary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Composite entry point that wires the scheduler, escalation engine, retry manager,
 * action handler and ticker around one store into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (CheckinEngine engine = CheckinEngine.builder()
 *     .connectionProvider(connectionProvider)
 *     .store(store)
 *     .smsSender(twilio)
 *     .pushSender(apns)
 *     .phoneDecryptor(new AesGcmPhoneDecryptor(keyHex))
 *     .build()) {
 *   engine.start();
 *   engine.confirmCheckin(userId, ConfirmRequest.latest(), Instant.now());
 * }
 * }</pre>
 */
public final class CheckinEngine implements AutoCloseable {

    private final DeliveryGateway deliveryGateway;
    private final CheckinScheduler scheduler;
    private final EscalationEngine escalationEngine;
    private final DeliveryRetryManager retryManager;
    private final CheckinActionHandler actions;
    private final CheckinTicker ticker;
    private final MetricsExporter metrics;

    private CheckinEngine(Builder builder) {
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        Objects.requireNonNull(builder.store, "store");
        Objects.requireNonNull(builder.smsSender, "smsSender");
        Objects.requireNonNull(builder.phoneDecryptor, "phoneDecryptor");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        AlertComposer composer = builder.alertComposer != null ? builder.alertComposer : new DefaultAlertComposer();
        RetryPolicy retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new CappedExponentialBackoff();

        this.deliveryGateway = new DeliveryGateway(builder.smsSender, builder.pushSender, builder.sendTimeout);
        this.scheduler = CheckinScheduler.builder()
            .connectionProvider(builder.connectionProvider)
            .store(builder.store)
            .deliveryGateway(builder.pushSender != null ? deliveryGateway : null)
            .alertComposer(composer)
            .metrics(metrics)
            .tolerance(builder.tolerance)
            .userLocalTime(builder.userLocalTime)
            .build();
        this.escalationEngine = EscalationEngine.builder()
            .connectionProvider(builder.connectionProvider)
            .store(builder.store)
            .deliveryGateway(deliveryGateway)
            .phoneDecryptor(builder.phoneDecryptor)
            .alertComposer(composer)
            .retryPolicy(retryPolicy)
            .metrics(metrics)
            .maxRetries(builder.maxRetries)
            .batchSize(builder.batchSize)
            .deliveryWorkers(builder.deliveryWorkers)
            .build();
        this.retryManager = DeliveryRetryManager.builder()
            .connectionProvider(builder.connectionProvider)
            .store(builder.store)
            .deliveryGateway(deliveryGateway)
            .phoneDecryptor(builder.phoneDecryptor)
            .alertComposer(composer)
            .retryPolicy(retryPolicy)
            .metrics(metrics)
            .batchSize(builder.batchSize)
            .build();
        this.actions = CheckinActionHandler.builder()
            .connectionProvider(builder.connectionProvider)
            .store(builder.store)
            .metrics(metrics)
            .snoozeLimit(builder.snoozeLimit)
            .snoozeOptions(builder.snoozeOptions)
            .defaultSnoozeMinutes(builder.defaultSnoozeMinutes)
            .build();
        this.ticker = CheckinTicker.builder()
            .scheduler(scheduler)
            .escalationEngine(escalationEngine)
            .retryManager(retryManager)
            .metrics(metrics)
            .clock(builder.clock)
            .intervalMs(builder.tickInterval.toMillis())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the periodic ticker.
     */
    public void start() {
        ticker.start();
    }

    public TickSummary tick(Instant now) {
        return ticker.tick(now);
    }

    public int runScheduledCheckins(Instant now) {
        return scheduler.runScheduledCheckins(now);
    }

    /**
     * Runs both escalation scans.
     *
     * @return number of events escalated at level 1 plus those raised to level 2
     */
    public int runEscalations(Instant now) {
        return escalationEngine.runEscalations(now) + escalationEngine.runLevel2Escalations(now);
    }

    public int runRetries(Instant now) {
        return retryManager.runRetries(now);
    }

    public EscalationResult escalate(String eventId, Instant now) {
        return escalationEngine.escalate(eventId, now);
    }

    public ConfirmResponse confirmCheckin(String userId, ConfirmRequest request, Instant now) {
        return actions.confirmCheckin(userId, request, now);
    }

    public SnoozeResponse snoozeCheckin(String userId, SnoozeRequest request, Instant now) {
        return actions.snoozeCheckin(userId, request, now);
    }

    public Optional<CheckinEvent> getCurrentCheckin(String userId) {
        return actions.getCurrentCheckin(userId);
    }

    public PauseResponse pause(String userId, Instant pauseUntil, Instant now) {
        return actions.pause(userId, pauseUntil, now);
    }

    public PauseResponse resume(String userId, Instant now) {
        return actions.resume(userId, now);
    }

    public List<HistoryEntry> history(String userId, Instant since, Instant until, int limit) {
        return actions.history(userId, since, until, limit);
    }

    public CheckinScheduler scheduler() {
        return scheduler;
    }

    public EscalationEngine escalationEngine() {
        return escalationEngine;
    }

    public DeliveryRetryManager retryManager() {
        return retryManager;
    }

    public CheckinActionHandler actions() {
        return actions;
    }

    /**
     * Shuts down in order: ticker, escalation workers, delivery gateway, then the metrics
     * exporter if it is {@link AutoCloseable}.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            ticker.close();
        } catch (RuntimeException e) {
            first = e;
        }
        try {
            escalationEngine.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        try {
            deliveryGateway.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Builder for {@link CheckinEngine}. Defaults match those of the individual components.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CheckinStore store;
        private SmsSender smsSender;
        private PushSender pushSender;
        private PhoneDecryptor phoneDecryptor;
        private AlertComposer alertComposer;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration tickInterval = Duration.ofMinutes(1);
        private Duration tolerance = Duration.ofMinutes(1);
        private boolean userLocalTime;
        private int maxRetries = 3;
        private int deliveryWorkers = 4;
        private Duration sendTimeout = DeliveryGateway.DEFAULT_SEND_TIMEOUT;
        private int batchSize = 100;
        private int snoozeLimit = 1;
        private Set<Integer> snoozeOptions = Set.of(5, 10, 15, 30);
        private int defaultSnoozeMinutes = 10;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder store(CheckinStore store) {
            this.store = store;
            return this;
        }

        /** <b>Required.</b> */
        public Builder smsSender(SmsSender smsSender) {
            this.smsSender = smsSender;
            return this;
        }

        /** Optional. Without it no reminder or contact pushes are sent. */
        public Builder pushSender(PushSender pushSender) {
            this.pushSender = pushSender;
            return this;
        }

        /** <b>Required.</b> */
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

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
            return this;
        }

        public Builder tolerance(Duration tolerance) {
            this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
            return this;
        }

        public Builder userLocalTime(boolean userLocalTime) {
            this.userLocalTime = userLocalTime;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder deliveryWorkers(int deliveryWorkers) {
            this.deliveryWorkers = deliveryWorkers;
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder snoozeLimit(int snoozeLimit) {
            this.snoozeLimit = snoozeLimit;
            return this;
        }

        public Builder snoozeOptions(Set<Integer> snoozeOptions) {
            this.snoozeOptions = Objects.requireNonNull(snoozeOptions, "snoozeOptions");
            return this;
        }

        public Builder defaultSnoozeMinutes(int defaultSnoozeMinutes) {
            this.defaultSnoozeMinutes = defaultSnoozeMinutes;
            return this;
        }

        public CheckinEngine build() {
            return new CheckinEngine(this);
        }
    }
}
