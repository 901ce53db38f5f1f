/**
 * Small shared helpers: JSON codec, thread factory and connection handling.
 */
package checkin.util;
