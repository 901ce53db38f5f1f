/**
 * Retries of failed SMS alerts with capped exponential backoff.
 */
package checkin.retry;
