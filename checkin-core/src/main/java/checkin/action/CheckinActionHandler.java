package checkin.action;

import checkin.model.AuditEntry;
import checkin.model.AuditType;
import checkin.model.CheckinEvent;
import checkin.model.CheckinTransitions;
import checkin.model.EventStatus;
import checkin.model.HistoryEntry;
import checkin.model.InsertResult;
import checkin.spi.CheckinStore;
import checkin.spi.ConnectionProvider;
import checkin.spi.MetricsExporter;
import checkin.util.JdbcCalls;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * User-initiated actions on check-in events: confirm, snooze, current, pause/resume and history.
 *
 * <p>Runs per request, concurrently with ticks. Every status change is a compare-and-set on
 * the status that was read; when the store reports that another writer changed the event
 * first, the event is read again and the action re-evaluated against its new state.
 * Rejections are thrown as {@link CheckinActionException} subclasses; store failures
 * propagate as {@link checkin.spi.CheckinStoreException}.
 */
public final class CheckinActionHandler {
    private static final Logger logger = Logger.getLogger(CheckinActionHandler.class.getName());

    static final int MAX_ATTEMPTS = 3;
    public static final int MAX_HISTORY_LIMIT = 100;

    private final ConnectionProvider connectionProvider;
    private final CheckinStore store;
    private final MetricsExporter metrics;
    private final int snoozeLimit;
    private final Set<Integer> snoozeOptions;
    private final int defaultSnoozeMinutes;

    private CheckinActionHandler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        if (builder.snoozeLimit < 0) {
            throw new IllegalArgumentException("snoozeLimit must be >= 0");
        }
        if (builder.snoozeOptions.isEmpty()) {
            throw new IllegalArgumentException("snoozeOptions cannot be empty");
        }
        for (Integer option : builder.snoozeOptions) {
            if (option == null || option <= 0) {
                throw new IllegalArgumentException("snoozeOptions must be positive, got: " + option);
            }
        }
        if (!builder.snoozeOptions.contains(builder.defaultSnoozeMinutes)) {
            throw new IllegalArgumentException("defaultSnoozeMinutes must be one of " + builder.snoozeOptions);
        }
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.snoozeLimit = builder.snoozeLimit;
        this.snoozeOptions = Set.copyOf(builder.snoozeOptions);
        this.defaultSnoozeMinutes = builder.defaultSnoozeMinutes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Confirms a check-in.
     *
     * <p>The event is located by id if one is given, otherwise by exact scheduled time if one is
     * given, otherwise as the user's latest pending or snoozed event. A lookup that misses never
     * falls through to another one. When nothing matches, a new already-confirmed event is
     * recorded so every confirmation leaves an audit trail. Confirming a confirmed event changes nothing
     * and returns the original confirmation time.
     *
     * @throws InvalidTransitionException if the event is paused
     */
    public ConfirmResponse confirmCheckin(String userId, ConfirmRequest request, Instant now) {
        Objects.requireNonNull(userId, "userId");
        ConfirmRequest req = request != null ? request : ConfirmRequest.latest();
        Instant confirmedAt = req.confirmedAt() != null ? req.confirmedAt() : now;

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            CheckinEvent event = JdbcCalls.inConnection(connectionProvider, conn -> locate(conn, userId, req))
                .orElse(null);
            if (event == null) {
                ConfirmResponse synthesized = confirmUnscheduled(userId, req, confirmedAt);
                if (synthesized != null) {
                    return synthesized;
                }
                continue;
            }
            ConfirmResponse response = confirmExisting(event, confirmedAt);
            if (response != null) {
                return response;
            }
        }
        throw new IllegalStateException("Check-in of user " + userId + " kept changing during confirmation");
    }

    /** Uses exactly one lookup, chosen by the most specific field the request carries. */
    private Optional<CheckinEvent> locate(Connection conn, String userId, ConfirmRequest req) {
        if (req.eventId() != null && !req.eventId().isBlank()) {
            return store.findEvent(conn, userId, req.eventId());
        }
        if (req.scheduledAt() != null) {
            return store.findEventByScheduledTime(conn, userId, req.scheduledAt());
        }
        return store.findLatestOpenEvent(conn, userId);
    }

    /** Returns {@code null} when the event changed underneath and must be re-read. */
    private ConfirmResponse confirmExisting(CheckinEvent event, Instant confirmedAt) {
        EventStatus status = event.status();
        if (status == EventStatus.CONFIRMED) {
            return new ConfirmResponse(event.eventId(), event.confirmedAt(), event.wasEscalated(), true, false);
        }
        if (!CheckinTransitions.canTransition(status, EventStatus.CONFIRMED)) {
            throw new InvalidTransitionException(event.eventId(), status, EventStatus.CONFIRMED);
        }
        boolean late = status == EventStatus.ALERTED;
        AuditEntry entry = late
            ? AuditEntry.of(event.userId(), event.eventId(), AuditType.CHECKIN_CONFIRMED_LATE, confirmedAt, "ok",
                Map.of("was_escalated", "true", "note", "Confirmed after alerts were sent"))
            : AuditEntry.of(event.userId(), event.eventId(), AuditType.CHECKIN_CONFIRMED, confirmedAt, "ok", Map.of());

        boolean updated = JdbcCalls.inTransaction(connectionProvider, conn -> {
            if (store.markConfirmed(conn, event.eventId(), status, confirmedAt) == 0) {
                return false;
            }
            store.appendAudit(conn, entry);
            return true;
        });
        if (!updated) {
            logger.log(Level.FINE, "Event {0} changed state during confirm, re-reading", event.eventId());
            return null;
        }
        metrics.incrementConfirmations();
        logger.log(Level.INFO, "Event {0} confirmed{1}", new Object[]{event.eventId(), late ? " after escalation" : ""});
        return new ConfirmResponse(event.eventId(), confirmedAt, late, false, false);
    }

    /** Returns {@code null} if a concurrent insert took the slot. */
    private ConfirmResponse confirmUnscheduled(String userId, ConfirmRequest req, Instant confirmedAt) {
        Instant scheduledTime = req.scheduledAt() != null ? req.scheduledAt() : confirmedAt;
        CheckinEvent event = CheckinEvent.confirmedWithoutSchedule(userId, scheduledTime, confirmedAt);
        boolean created = JdbcCalls.inTransaction(connectionProvider, conn -> {
            if (store.insertEvent(conn, event) == InsertResult.ALREADY_EXISTS) {
                return false;
            }
            store.appendAudit(conn, AuditEntry.of(userId, event.eventId(), AuditType.CHECKIN_CONFIRMED, confirmedAt,
                "ok", Map.of("source", "unscheduled")));
            return true;
        });
        if (!created) {
            return null;
        }
        metrics.incrementConfirmations();
        logger.log(Level.INFO, "Recorded unscheduled confirmation {0} for user {1}",
            new Object[]{event.eventId(), userId});
        return new ConfirmResponse(event.eventId(), confirmedAt, false, false, true);
    }

    /**
     * Pushes an event's deadline back.
     *
     * @throws InvalidActionException        if the event id is missing or the length is not on the menu
     * @throws EventNotFoundException        if the user has no such event
     * @throws SnoozeLimitExceededException  if the event was already snoozed as often as allowed
     * @throws InvalidTransitionException    if the event is no longer pending or snoozed
     */
    public SnoozeResponse snoozeCheckin(String userId, SnoozeRequest request, Instant now) {
        Objects.requireNonNull(userId, "userId");
        if (request == null || request.eventId() == null || request.eventId().isBlank()) {
            throw new InvalidActionException("event_id is required");
        }
        int minutes = request.minutes() != null ? request.minutes() : defaultSnoozeMinutes;
        if (!snoozeOptions.contains(minutes)) {
            throw new InvalidActionException("snooze minutes must be one of " + new TreeSet<>(snoozeOptions));
        }
        String eventId = request.eventId();

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            CheckinEvent event = JdbcCalls.inConnection(connectionProvider, conn -> store.findEvent(conn, userId, eventId))
                .orElseThrow(() -> new EventNotFoundException(eventId));
            if (event.snoozeCount() >= snoozeLimit) {
                throw new SnoozeLimitExceededException(eventId, snoozeLimit);
            }
            if (!CheckinTransitions.canTransition(event.status(), EventStatus.SNOOZED)) {
                throw new InvalidTransitionException(eventId, event.status(), EventStatus.SNOOZED);
            }
            Instant newDeadline = event.deadlineTime().plus(Duration.ofMinutes(minutes));
            boolean updated = JdbcCalls.inTransaction(connectionProvider, conn -> {
                if (store.markSnoozed(conn, eventId, event.status(), event.snoozeCount(), newDeadline, now) == 0) {
                    return false;
                }
                Map<String, String> details = new LinkedHashMap<>();
                details.put("snooze_minutes", String.valueOf(minutes));
                details.put("new_deadline", newDeadline.toString());
                store.appendAudit(conn, AuditEntry.of(userId, eventId, AuditType.CHECKIN_SNOOZED, now, "ok", details));
                return true;
            });
            if (updated) {
                metrics.incrementSnoozes();
                logger.log(Level.INFO, "Event {0} snoozed {1} min until {2}", new Object[]{eventId, minutes, newDeadline});
                return new SnoozeResponse(eventId, event.deadlineTime(), newDeadline, event.snoozeCount() + 1);
            }
        }
        throw new IllegalStateException("Event " + eventId + " kept changing during snooze");
    }

    /**
     * The user's most recent pending or snoozed event, if any.
     */
    public Optional<CheckinEvent> getCurrentCheckin(String userId) {
        Objects.requireNonNull(userId, "userId");
        return JdbcCalls.inConnection(connectionProvider, conn -> store.findLatestOpenEvent(conn, userId));
    }

    /**
     * Pauses monitoring until {@code pauseUntil} and flips every open event of the user to paused.
     *
     * @throws InvalidActionException if {@code pauseUntil} is not in the future or the user does not exist
     */
    public PauseResponse pause(String userId, Instant pauseUntil, Instant now) {
        Objects.requireNonNull(userId, "userId");
        if (pauseUntil == null || !pauseUntil.isAfter(now)) {
            throw new InvalidActionException("pause_until must be in the future");
        }
        int paused = JdbcCalls.inTransaction(connectionProvider, conn -> {
            if (store.updatePauseUntil(conn, userId, pauseUntil) == 0) {
                throw new InvalidActionException("Unknown user: " + userId);
            }
            int flipped = store.pauseOpenEvents(conn, userId, now);
            store.appendAudit(conn, AuditEntry.of(userId, null, AuditType.MONITORING_PAUSED, now, "ok",
                Map.of("pause_until", pauseUntil.toString())));
            return flipped;
        });
        logger.log(Level.INFO, "Monitoring of user {0} paused until {1} ({2} open event(s) paused)",
            new Object[]{userId, pauseUntil, paused});
        return new PauseResponse(pauseUntil, paused);
    }

    /**
     * Clears the user's pause. Events paused earlier stay paused; the next scheduled slot creates a fresh one.
     */
    public PauseResponse resume(String userId, Instant now) {
        Objects.requireNonNull(userId, "userId");
        JdbcCalls.inTransaction(connectionProvider, conn -> {
            if (store.updatePauseUntil(conn, userId, null) == 0) {
                throw new InvalidActionException("Unknown user: " + userId);
            }
            store.appendAudit(conn, AuditEntry.of(userId, null, AuditType.MONITORING_RESUMED, now, "ok", Map.of()));
            return null;
        });
        logger.log(Level.INFO, "Monitoring of user {0} resumed", userId);
        return new PauseResponse(null, 0);
    }

    /**
     * Past events of the user scheduled in {@code [since, until)}, newest first, each with the
     * contacts that were successfully alerted.
     *
     * @param limit maximum entries; capped at {@value #MAX_HISTORY_LIMIT}
     */
    public List<HistoryEntry> history(String userId, Instant since, Instant until, int limit) {
        Objects.requireNonNull(userId, "userId");
        if (limit <= 0) {
            throw new InvalidActionException("limit must be > 0");
        }
        int effective = Math.min(limit, MAX_HISTORY_LIMIT);
        return JdbcCalls.inConnection(connectionProvider, conn -> {
            List<HistoryEntry> entries = new ArrayList<>();
            for (CheckinEvent event : store.findHistory(conn, userId, since, until, effective)) {
                List<String> notified = event.wasEscalated()
                    ? store.findSentContactIds(conn, event.eventId())
                    : List.of();
                entries.add(new HistoryEntry(event, notified));
            }
            return entries;
        });
    }

    /**
     * Builder for {@link CheckinActionHandler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CheckinStore store;
        private MetricsExporter metrics;
        private int snoozeLimit = 1;
        private Set<Integer> snoozeOptions = Set.of(5, 10, 15, 30);
        private int defaultSnoozeMinutes = 10;

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

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * How many times one event may be snoozed.
         *
         * <p>Optional. Defaults to {@code 1}.
         */
        public Builder snoozeLimit(int snoozeLimit) {
            this.snoozeLimit = snoozeLimit;
            return this;
        }

        /**
         * Allowed snooze lengths in minutes.
         *
         * <p>Optional. Defaults to {@code {5, 10, 15, 30}}.
         */
        public Builder snoozeOptions(Set<Integer> snoozeOptions) {
            this.snoozeOptions = Objects.requireNonNull(snoozeOptions, "snoozeOptions");
            return this;
        }

        /**
         * Snooze length used when the request does not carry one.
         *
         * <p>Optional. Defaults to {@code 10}. Must be one of the snooze options.
         */
        public Builder defaultSnoozeMinutes(int defaultSnoozeMinutes) {
            this.defaultSnoozeMinutes = defaultSnoozeMinutes;
            return this;
        }

        public CheckinActionHandler build() {
            return new CheckinActionHandler(this);
        }
    }
}
