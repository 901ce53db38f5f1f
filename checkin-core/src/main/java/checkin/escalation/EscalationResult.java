package checkin.escalation;

import java.util.List;

/**
 * Result of escalating one event.
 *
 * @param eventId          the event
 * @param escalated        whether the event is alerted and the delivery pass ran
 * @param contactsNotified number of contacts whose SMS was sent in this pass
 * @param results          one entry per contact attempted
 */
public record EscalationResult(String eventId, boolean escalated, int contactsNotified, List<ContactResult> results) {

    public EscalationResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    static EscalationResult notEscalated(String eventId) {
        return new EscalationResult(eventId, false, 0, List.of());
    }
}
