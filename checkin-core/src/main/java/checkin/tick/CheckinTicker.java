package checkin.tick;

import checkin.escalation.EscalationEngine;
import checkin.retry.DeliveryRetryManager;
import checkin.schedule.CheckinScheduler;
import checkin.spi.MetricsExporter;
import checkin.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic trigger that runs one tick per interval: scheduler, escalation (level 1 then level 2),
 * then retries, strictly in that order.
 *
 * <p>Hosts that already have a cron can skip {@link #start()} and call {@link #tick(Instant)}
 * themselves. A failing phase is logged and does not stop the later phases.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 */
public final class CheckinTicker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(CheckinTicker.class.getName());

    private final CheckinScheduler scheduler;
    private final EscalationEngine escalationEngine;
    private final DeliveryRetryManager retryManager;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long intervalMs;

    private ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean closed;

    private CheckinTicker(Builder builder) {
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.escalationEngine = Objects.requireNonNull(builder.escalationEngine, "escalationEngine");
        this.retryManager = Objects.requireNonNull(builder.retryManager, "retryManager");
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts ticking at a fixed delay. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CheckinTicker has been closed");
        }
        if (tickTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("checkin-ticker-"));
        tickTask = executor.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one tick at the clock's current time. Called by the schedule; may also be invoked directly.
     */
    public void runOnce() {
        if (closed) {
            return;
        }
        try {
            tick(clock.instant());
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Tick failed", t);
        }
    }

    /**
     * Runs the three phases for {@code now}.
     */
    public TickSummary tick(Instant now) {
        long start = System.nanoTime();
        int created = 0;
        int escalated = 0;
        int level2 = 0;
        int retried = 0;
        try {
            created = scheduler.runScheduledCheckins(now);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Scheduling phase failed", e);
        }
        try {
            escalated = escalationEngine.runEscalations(now);
            level2 = escalationEngine.runLevel2Escalations(now);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Escalation phase failed", e);
        }
        try {
            retried = retryManager.runRetries(now);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Retry phase failed", e);
        }
        metrics.recordTickDurationMs(Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)));
        TickSummary summary = new TickSummary(created, escalated, level2, retried);
        if (!summary.equals(TickSummary.EMPTY)) {
            logger.log(Level.INFO, "Tick at {0}: {1}", new Object[]{now, summary});
        }
        return summary;
    }

    /**
     * Cancels the schedule and shuts down the ticker thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link CheckinTicker}.
     */
    public static final class Builder {
        private CheckinScheduler scheduler;
        private EscalationEngine escalationEngine;
        private DeliveryRetryManager retryManager;
        private MetricsExporter metrics;
        private Clock clock;
        private long intervalMs = 60_000L;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder scheduler(CheckinScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder escalationEngine(EscalationEngine escalationEngine) {
            this.escalationEngine = escalationEngine;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder retryManager(DeliveryRetryManager retryManager) {
            this.retryManager = retryManager;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Time source for scheduled ticks.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        public CheckinTicker build() {
            return new CheckinTicker(this);
        }
    }
}
