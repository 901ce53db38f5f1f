/**
 * Default English alert and push texts.
 */
package checkin.alert;
