package checkin.action;

/**
 * Malformed request arguments (missing event id, snooze length not on the menu, pause in the past).
 */
public final class InvalidActionException extends CheckinActionException {
    public InvalidActionException(String message) {
        super("invalid_request", message);
    }
}
