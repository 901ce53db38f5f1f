package checkin.escalation;

/**
 * Per-contact outcome of an escalation pass.
 *
 * @param contactId the contact
 * @param outcome   what happened
 * @param error     failure description for {@link ContactOutcome#FAILED} and {@link ContactOutcome#ERROR}
 */
public record ContactResult(String contactId, ContactOutcome outcome, String error) {

    static ContactResult of(String contactId, ContactOutcome outcome) {
        return new ContactResult(contactId, outcome, null);
    }
}
