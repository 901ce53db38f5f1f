package checkin.schedule;

import checkin.alert.DefaultAlertComposer;
import checkin.delivery.DeliveryGateway;
import checkin.model.AuditEntry;
import checkin.model.AuditType;
import checkin.model.CheckinEvent;
import checkin.model.CheckinTime;
import checkin.model.InsertResult;
import checkin.model.User;
import checkin.spi.AlertComposer;
import checkin.spi.CheckinStore;
import checkin.spi.ConnectionProvider;
import checkin.spi.MetricsExporter;
import checkin.spi.PushMessage;
import checkin.spi.PushResult;
import checkin.util.JdbcCalls;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Materializes pending check-in events when a user's daily check-in time arrives.
 *
 * <p>Each run looks at every user not paused at {@code now} and every configured
 * {@link CheckinTime}. A slot is due when it lies within the tolerance window of {@code now}
 * and is not already in the past. The existence check before insert plus the store's
 * {@code (user, scheduledTime)} uniqueness make repeated or concurrent runs create at most
 * one event per slot.
 *
 * <p>Slots are computed against UTC wall-clock time unless {@link Builder#userLocalTime(boolean)}
 * is enabled, in which case each user's IANA zone is used.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class CheckinScheduler {
    private static final Logger logger = Logger.getLogger(CheckinScheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final CheckinStore store;
    private final DeliveryGateway deliveryGateway;
    private final AlertComposer alertComposer;
    private final MetricsExporter metrics;
    private final Duration tolerance;
    private final boolean userLocalTime;

    private CheckinScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        Duration tolerance = builder.tolerance;
        if (tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        this.tolerance = tolerance;
        this.deliveryGateway = builder.deliveryGateway;
        this.alertComposer = builder.alertComposer != null ? builder.alertComposer : new DefaultAlertComposer();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.userLocalTime = builder.userLocalTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates every event that is due at {@code now}.
     *
     * @return number of events created by this run
     */
    public int runScheduledCheckins(Instant now) {
        List<User> users;
        try {
            users = JdbcCalls.inConnection(connectionProvider, conn -> store.findActiveUsers(conn, now));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load active users", e);
            return 0;
        }
        int created = 0;
        for (User user : users) {
            try {
                created += scheduleUser(user, now);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to schedule check-ins for user " + user.userId(), e);
            }
        }
        return created;
    }

    int scheduleUser(User user, Instant now) {
        if (user.isPausedAt(now)) {
            return 0;
        }
        ZoneId zone = zoneFor(user);
        int created = 0;
        for (CheckinTime time : user.checkinTimes()) {
            Instant slot = matchSlot(time, now, zone, tolerance);
            if (slot == null || slot.isBefore(now)) {
                continue;
            }
            if (createEvent(user, slot, now)) {
                created++;
            }
        }
        return created;
    }

    /**
     * Returns the occurrence of {@code time} within {@code tolerance} of {@code now}, or {@code null}.
     * Yesterday, today and tomorrow are considered so the window wraps around midnight.
     */
    public static Instant matchSlot(CheckinTime time, Instant now, ZoneId zone, Duration tolerance) {
        LocalDate today = now.atZone(zone).toLocalDate();
        for (int offset = -1; offset <= 1; offset++) {
            Instant candidate = time.atDate(today.plusDays(offset), zone);
            if (Duration.between(candidate, now).abs().compareTo(tolerance) <= 0) {
                return candidate;
            }
        }
        return null;
    }

    private boolean createEvent(User user, Instant slot, Instant now) {
        CheckinEvent event = CheckinEvent.pending(user.userId(), slot, user.graceMinutes(), now);
        InsertResult result = JdbcCalls.inConnection(connectionProvider, conn -> {
            if (store.findEventForSlot(conn, user.userId(), slot).isPresent()) {
                return null;
            }
            return store.insertEvent(conn, event);
        });
        if (result == null) {
            return false;
        }
        if (result == InsertResult.ALREADY_EXISTS) {
            metrics.incrementDuplicatesSuppressed();
            logger.log(Level.FINE, "Event for user {0} at {1} already created concurrently",
                new Object[]{user.userId(), slot});
            return false;
        }

        metrics.incrementEventsScheduled();
        logger.log(Level.INFO, "Created pending event {0} for user {1} at {2}",
            new Object[]{event.eventId(), user.userId(), slot});

        sendReminder(user, event);

        AuditEntry entry = AuditEntry.of(user.userId(), event.eventId(), AuditType.CHECKIN_SCHEDULED, now, "ok",
            Map.of("scheduled_time", event.scheduledTime().toString(),
                "deadline_time", event.deadlineTime().toString()));
        JdbcCalls.inConnection(connectionProvider, conn -> {
            store.appendAudit(conn, entry);
            return null;
        });
        return true;
    }

    private void sendReminder(User user, CheckinEvent event) {
        if (deliveryGateway == null || user.pushToken() == null || user.pushToken().isEmpty()) {
            return;
        }
        PushMessage message = new PushMessage(
            user.pushToken(),
            alertComposer.reminderTitle(),
            alertComposer.reminderBody(user.graceMinutes()),
            PushMessage.CATEGORY_CHECKIN_REMINDER,
            Map.of("type", "checkin",
                "event_id", event.eventId(),
                "scheduled_time", event.scheduledTime().toString()),
            true);
        PushResult result = deliveryGateway.sendPush(message);
        if (!result.success()) {
            logger.log(Level.WARNING, "Check-in reminder push failed for user {0}: {1}",
                new Object[]{user.userId(), result.errorReason()});
        }
    }

    private ZoneId zoneFor(User user) {
        if (!userLocalTime || user.timezone() == null || user.timezone().isEmpty()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(user.timezone());
        } catch (DateTimeException e) {
            logger.log(Level.WARNING, "Invalid timezone ''{0}'' for user {1}, using UTC",
                new Object[]{user.timezone(), user.userId()});
            return ZoneOffset.UTC;
        }
    }

    /**
     * Builder for {@link CheckinScheduler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CheckinStore store;
        private DeliveryGateway deliveryGateway;
        private AlertComposer alertComposer;
        private MetricsExporter metrics;
        private Duration tolerance = Duration.ofMinutes(1);
        private boolean userLocalTime;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder store(CheckinStore store) {
            this.store = store;
            return this;
        }

        /**
         * Gateway used for the "check-in requested" push sent when an event is created.
         *
         * <p>Optional. When absent no reminders are sent.
         */
        public Builder deliveryGateway(DeliveryGateway deliveryGateway) {
            this.deliveryGateway = deliveryGateway;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link DefaultAlertComposer}.
         */
        public Builder alertComposer(AlertComposer alertComposer) {
            this.alertComposer = alertComposer;
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
         * Sets how far {@code now} may be from a check-in time for the slot to match.
         *
         * <p>Optional. Defaults to 1 minute. Must be &ge; 0.
         */
        public Builder tolerance(Duration tolerance) {
            this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
            return this;
        }

        /**
         * Computes slots in each user's own timezone instead of UTC.
         *
         * <p>Optional. Defaults to {@code false}.
         */
        public Builder userLocalTime(boolean userLocalTime) {
            this.userLocalTime = userLocalTime;
            return this;
        }

        public CheckinScheduler build() {
            return new CheckinScheduler(this);
        }
    }
}
