package checkin.action;

import java.time.Instant;

/**
 * A user's "I'm safe" confirmation. All fields are optional.
 *
 * @param eventId     event being confirmed
 * @param scheduledAt scheduled time of the event being confirmed, used when no id is known
 * @param confirmedAt client-side confirmation time; defaults to the server's now
 */
public record ConfirmRequest(String eventId, Instant scheduledAt, Instant confirmedAt) {

    public static ConfirmRequest ofEvent(String eventId) {
        return new ConfirmRequest(eventId, null, null);
    }

    public static ConfirmRequest latest() {
        return new ConfirmRequest(null, null, null);
    }
}
