/**
 * Domain model of the check-in engine: users, contacts, check-in events,
 * alert deliveries and audit entries, plus the event state machine.
 *
 * @see checkin.model.CheckinEvent
 * @see checkin.model.CheckinTransitions
 */
package checkin.model;
