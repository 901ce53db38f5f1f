/**
 * Creation of pending check-in events at each user's scheduled times.
 *
 * @see checkin.schedule.CheckinScheduler
 */
package checkin.schedule;
