package checkin.escalation;

/**
 * What happened for one contact during an escalation pass.
 */
public enum ContactOutcome {
    /** SMS accepted by the provider. */
    SENT,
    /** SMS rejected or timed out; the delivery is queued for retry. */
    FAILED,
    /** An unexpected error for this contact only. */
    ERROR,
    /** A delivery for this event and contact already existed; nothing was sent. */
    ALREADY_EXISTS
}
