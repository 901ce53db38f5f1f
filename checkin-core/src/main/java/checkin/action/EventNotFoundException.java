package checkin.action;

/**
 * The referenced check-in event does not exist (or belongs to another user).
 */
public final class EventNotFoundException extends CheckinActionException {
    private final String eventId;

    public EventNotFoundException(String eventId) {
        super("event_not_found", "Event not found: " + eventId);
        this.eventId = eventId;
    }

    public String eventId() {
        return eventId;
    }

    @Override
    public boolean isNotFound() {
        return true;
    }
}
