package checkin.action;

/**
 * Base class for rejected user actions. {@link #reason()} is a stable machine-readable code;
 * {@link #isNotFound()} separates "no such event" from bad-request rejections.
 */
public abstract class CheckinActionException extends RuntimeException {
    private final String reason;

    protected CheckinActionException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }

    public boolean isNotFound() {
        return false;
    }
}
