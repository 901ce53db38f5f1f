package checkin.action;

/**
 * The event has already been snoozed as often as the policy allows.
 */
public final class SnoozeLimitExceededException extends CheckinActionException {
    private final int limit;

    public SnoozeLimitExceededException(String eventId, int limit) {
        super("already_snoozed", "Event " + eventId + " can only be snoozed " + limit + " time(s)");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
