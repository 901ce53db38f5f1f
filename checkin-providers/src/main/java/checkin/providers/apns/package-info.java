/**
 * Apple Push Notification service adapter built on Pushy.
 */
package checkin.providers.apns;
