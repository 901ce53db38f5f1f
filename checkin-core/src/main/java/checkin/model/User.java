package checkin.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A monitored user, as read by the engine. Users are owned by the account subsystem.
 *
 * @param userId             user identifier
 * @param name               display name used in alert texts
 * @param timezone           IANA zone id (only consulted when user-local scheduling is enabled)
 * @param checkinTimes       daily check-in times, ascending
 * @param graceMinutes       minutes between scheduled time and deadline, &gt; 0
 * @param smsAlertsEnabled   whether contacts are notified on escalation
 * @param level2DelayMinutes delay before level-2 contacts are notified; {@code null} or &le; 0 notifies all levels at once
 * @param pauseUntil         monitoring paused until this instant, or {@code null} when active
 * @param pushToken          device token for check-in reminders, or {@code null}
 */
public record User(
    String userId,
    String name,
    String timezone,
    List<CheckinTime> checkinTimes,
    int graceMinutes,
    boolean smsAlertsEnabled,
    Integer level2DelayMinutes,
    Instant pauseUntil,
    String pushToken
) {
    public User {
        Objects.requireNonNull(userId, "userId");
        checkinTimes = checkinTimes == null ? List.of() : List.copyOf(checkinTimes);
        if (graceMinutes <= 0) {
            throw new IllegalArgumentException("graceMinutes must be > 0, got: " + graceMinutes);
        }
    }

    /**
     * Whether monitoring is paused at {@code now}.
     */
    public boolean isPausedAt(Instant now) {
        return pauseUntil != null && pauseUntil.isAfter(now);
    }

    /**
     * Whether level-2 contacts are notified separately after {@link #level2DelayMinutes()}.
     */
    public boolean stagedEscalation() {
        return level2DelayMinutes != null && level2DelayMinutes > 0;
    }

    public User withPauseUntil(Instant newPauseUntil) {
        return new User(userId, name, timezone, checkinTimes, graceMinutes, smsAlertsEnabled,
            level2DelayMinutes, newPauseUntil, pushToken);
    }
}
