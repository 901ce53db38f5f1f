package checkin.action;

import checkin.model.EventStatus;

/**
 * The event's current status does not allow the requested action.
 */
public final class InvalidTransitionException extends CheckinActionException {
    private final EventStatus from;
    private final EventStatus to;

    public InvalidTransitionException(String eventId, EventStatus from, EventStatus to) {
        super("invalid_transition", "Event " + eventId + " is already " + from.code() + ", cannot become " + to.code());
        this.from = from;
        this.to = to;
    }

    public EventStatus from() {
        return from;
    }

    public EventStatus to() {
        return to;
    }
}
