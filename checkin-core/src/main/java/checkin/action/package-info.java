/**
 * Request-driven actions on check-ins: confirm, snooze, pause and history.
 *
 * <p>Rejections extend {@link checkin.action.CheckinActionException}; only
 * {@link checkin.action.EventNotFoundException} is of the not-found class.
 */
package checkin.action;
