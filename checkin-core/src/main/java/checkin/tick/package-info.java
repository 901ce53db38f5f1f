/**
 * The periodic trigger driving scheduling, escalation and retries.
 */
package checkin.tick;
