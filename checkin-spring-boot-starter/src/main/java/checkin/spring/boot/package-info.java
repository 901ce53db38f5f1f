/**
 * Spring Boot auto-configuration for the check-in engine.
 *
 * <p>Bind {@code checkin.*} properties through {@link checkin.spring.boot.CheckinProperties};
 * the engine, store and channel beans all back off when the application defines its own.
 */
package checkin.spring.boot;
