package checkin.model;

/**
 * Lifecycle status of a {@link CheckinEvent}.
 *
 * @see CheckinTransitions
 */
public enum EventStatus {
    PENDING("pending"),
    SNOOZED("snoozed"),
    CONFIRMED("confirmed"),
    MISSED("missed"),
    ALERTED("alerted"),
    PAUSED("paused");

    private final String code;

    EventStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Whether the event is still awaiting the user (pending or snoozed).
     */
    public boolean isOpen() {
        return this == PENDING || this == SNOOZED;
    }

    public static EventStatus fromCode(String code) {
        for (EventStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown event status: " + code);
    }
}
