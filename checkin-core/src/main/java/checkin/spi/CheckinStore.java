package checkin.spi;

import checkin.model.AlertDelivery;
import checkin.model.AuditEntry;
import checkin.model.Channel;
import checkin.model.CheckinEvent;
import checkin.model.Contact;
import checkin.model.DueRetry;
import checkin.model.EventStatus;
import checkin.model.InsertResult;
import checkin.model.User;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for users, check-in events, alert deliveries and the audit log.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Every status mutation is a compare-and-set on the expected
 * prior state and returns the number of rows updated (0 or 1); a {@code 0} means
 * another writer got there first. Implementations live in the {@code checkin-jdbc} module.
 *
 * @see checkin.jdbc.store.AbstractJdbcCheckinStore
 */
public interface CheckinStore {

    // ---- users ----

    /**
     * Returns users whose monitoring is not paused at {@code now}
     * ({@code pauseUntil} is null or not after {@code now}).
     */
    List<User> findActiveUsers(Connection conn, Instant now);

    Optional<User> findUser(Connection conn, String userId);

    /**
     * Sets or clears ({@code null}) a user's pause.
     *
     * @return rows updated (0 if the user does not exist)
     */
    int updatePauseUntil(Connection conn, String userId, Instant pauseUntil);

    // ---- events ----

    /**
     * Finds the event of a user scheduled exactly at {@code slot}.
     */
    Optional<CheckinEvent> findEventForSlot(Connection conn, String userId, Instant slot);

    Optional<CheckinEvent> findEventById(Connection conn, String eventId);

    /**
     * Finds an event by id, scoped to its owning user.
     */
    default Optional<CheckinEvent> findEvent(Connection conn, String userId, String eventId) {
        return findEventById(conn, eventId).filter(e -> e.userId().equals(userId));
    }

    default Optional<CheckinEvent> findEventByScheduledTime(Connection conn, String userId, Instant scheduledTime) {
        return findEventForSlot(conn, userId, scheduledTime);
    }

    /**
     * Most recently scheduled pending or snoozed event of a user.
     */
    Optional<CheckinEvent> findLatestOpenEvent(Connection conn, String userId);

    /**
     * Inserts an event. A clash on {@code (userId, scheduledTime)} or on the event id is reported
     * as {@link InsertResult#ALREADY_EXISTS}.
     */
    InsertResult insertEvent(Connection conn, CheckinEvent event);

    /**
     * Events that need a contact pass, for users not paused at {@code now}, oldest deadline first:
     * pending or snoozed events whose deadline is before {@code now}, and alerted events whose
     * contact pass has not been recorded as finished.
     */
    List<CheckinEvent> findOverdueEvents(Connection conn, Instant now, int limit);

    /**
     * Alerted events at escalation level 1 whose user has a positive level-2 delay that has elapsed
     * since {@code escalatedAt}, for users not paused at {@code now}.
     */
    List<CheckinEvent> findLevel2DueEvents(Connection conn, Instant now, int limit);

    /**
     * {@code pending|snoozed|missed -> alerted}, stamping {@code escalatedAt} and the escalation level
     * and clearing {@code contactsAlertedAt}.
     */
    int markAlerted(Connection conn, String eventId, Instant escalatedAt, int escalationLevel);

    /**
     * Raises escalation level 1 to 2 on an alerted event and clears {@code contactsAlertedAt}.
     */
    int markLevel2Escalated(Connection conn, String eventId, Instant now);

    /**
     * Records that the contact pass of an alerted event has finished.
     */
    int markContactsAlerted(Connection conn, String eventId, Instant now);

    /**
     * {@code expected -> confirmed}.
     */
    int markConfirmed(Connection conn, String eventId, EventStatus expected, Instant confirmedAt);

    /**
     * {@code expected -> snoozed}: sets the new deadline and {@code snoozedUntil}, increments the snooze count.
     * Guarded on both the expected status and the expected snooze count.
     */
    int markSnoozed(Connection conn, String eventId, EventStatus expected, int expectedSnoozeCount,
                    Instant newDeadline, Instant now);

    /**
     * Flips every pending or snoozed event of the user to paused.
     *
     * @return number of events paused
     */
    int pauseOpenEvents(Connection conn, String userId, Instant now);

    /**
     * Events of a user scheduled in {@code [since, until)}, newest first. Either bound may be {@code null}.
     */
    List<CheckinEvent> findHistory(Connection conn, String userId, Instant since, Instant until, int limit);

    // ---- contacts ----

    /**
     * Contacts of a user ordered by level ascending.
     */
    List<Contact> findContactsByUser(Connection conn, String userId);

    // ---- deliveries ----

    Optional<AlertDelivery> findDelivery(Connection conn, String eventId, String contactId, Channel channel);

    /**
     * Claims a delivery row. A clash on {@code (eventId, contactId, channel)} is reported
     * as {@link InsertResult#ALREADY_EXISTS}.
     */
    InsertResult insertDelivery(Connection conn, AlertDelivery delivery);

    /**
     * Marks a pending or failed delivery sent and clears {@code nextRetryAt}.
     */
    int markDeliverySent(Connection conn, String deliveryId, String providerRef, String providerStatus, Instant sentAt);

    /**
     * First failure of a pending delivery.
     *
     * @param nextRetryAt when the retry manager should pick it up, or {@code null} for no retry
     */
    int markDeliveryFailed(Connection conn, String deliveryId, String errorMessage, Instant nextRetryAt, Instant now);

    /**
     * Failed retry: sets {@code retryCount = expectedRetryCount + 1}. Guarded on the expected count.
     */
    int markDeliveryRetryFailed(Connection conn, String deliveryId, int expectedRetryCount,
                                String errorMessage, Instant nextRetryAt, Instant now);

    /**
     * Failed SMS deliveries with {@code retryCount < maxRetries} and {@code nextRetryAt <= now}.
     */
    List<DueRetry> findDueRetries(Connection conn, Instant now, int limit);

    /**
     * Contact ids whose delivery for the event ended up sent or delivered.
     */
    List<String> findSentContactIds(Connection conn, String eventId);

    // ---- audit ----

    void appendAudit(Connection conn, AuditEntry entry);

    /**
     * Audit entries of a user, oldest first, optionally restricted to one event.
     */
    List<AuditEntry> findAuditEntries(Connection conn, String userId, String eventId);
}
