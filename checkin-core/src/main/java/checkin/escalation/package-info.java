/**
 * Escalation of missed check-ins to emergency contacts.
 *
 * <p>{@link checkin.escalation.EscalationEngine} is the entry point; per-contact
 * outcomes are reported through {@link checkin.escalation.EscalationResult}.
 */
package checkin.escalation;
