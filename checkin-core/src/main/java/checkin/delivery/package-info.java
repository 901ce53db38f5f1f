/**
 * Timeout-bounded access to the SMS and push channels.
 */
package checkin.delivery;
