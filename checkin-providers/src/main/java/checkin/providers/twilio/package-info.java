/**
 * Twilio SMS adapter.
 */
package checkin.providers.twilio;
