/**
 * Safety check-in engine: schedules daily check-ins, escalates missed ones to
 * emergency contacts and retries failed alerts.
 *
 * <p>{@link checkin.CheckinEngine} wires all components; each can also be built on its own.
 */
package checkin;
