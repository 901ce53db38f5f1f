package checkin.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One scheduled instance of "the user must confirm by the deadline".
 *
 * <p>{@code (userId, scheduledTime)} is unique; {@code eventId} doubles as the idempotency key.
 * {@code contactsAlertedAt} is stamped when the contact pass of the current escalation level has
 * finished and cleared whenever a new level is raised.
 */
public record CheckinEvent(
    String eventId,
    String userId,
    Instant scheduledTime,
    Instant deadlineTime,
    EventStatus status,
    Instant confirmedAt,
    Instant snoozedUntil,
    int snoozeCount,
    Instant escalatedAt,
    int escalationLevel,
    Instant level2EscalatedAt,
    Instant contactsAlertedAt,
    Instant createdAt,
    Instant updatedAt
) {
    public CheckinEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(scheduledTime, "scheduledTime");
        Objects.requireNonNull(deadlineTime, "deadlineTime");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Creates a new pending event due at {@code scheduledTime}.
     */
    public static CheckinEvent pending(String userId, Instant scheduledTime, int graceMinutes, Instant now) {
        Instant deadline = scheduledTime.plus(Duration.ofMinutes(graceMinutes));
        return new CheckinEvent(UUID.randomUUID().toString(), userId, scheduledTime, deadline,
            EventStatus.PENDING, null, null, 0, null, 0, null, null, now, now);
    }

    /**
     * Creates an already-confirmed event for a confirmation that matched no existing event.
     */
    public static CheckinEvent confirmedWithoutSchedule(String userId, Instant scheduledTime, Instant confirmedAt) {
        return new CheckinEvent(UUID.randomUUID().toString(), userId, scheduledTime, scheduledTime,
            EventStatus.CONFIRMED, confirmedAt, null, 0, null, 0, null, null, confirmedAt, confirmedAt);
    }

    public boolean wasEscalated() {
        return escalatedAt != null;
    }
}
