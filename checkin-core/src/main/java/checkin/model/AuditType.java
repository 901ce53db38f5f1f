package checkin.model;

/**
 * Types of entries written to the append-only audit log.
 */
public enum AuditType {
    CHECKIN_SCHEDULED("checkin_scheduled"),
    CHECKIN_CONFIRMED("checkin_confirmed"),
    CHECKIN_CONFIRMED_LATE("checkin_confirmed_late"),
    CHECKIN_SNOOZED("checkin_snoozed"),
    CHECKIN_ESCALATED("checkin_escalated"),
    CONTACTS_ALERTED("contacts_alerted"),
    LEVEL2_ESCALATED("level2_escalated"),
    MONITORING_PAUSED("monitoring_paused"),
    MONITORING_RESUMED("monitoring_resumed");

    private final String code;

    AuditType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static AuditType fromCode(String code) {
        for (AuditType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown audit type: " + code);
    }
}
