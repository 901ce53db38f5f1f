/**
 * Service Provider Interfaces (SPI) through which the check-in engine reaches
 * the outside world.
 *
 * <p>Integrators implement these to plug in persistence, connection provisioning,
 * SMS and push channels, phone decryption, alert texts and metrics.
 *
 * @see checkin.spi.CheckinStore
 * @see checkin.spi.ConnectionProvider
 * @see checkin.spi.SmsSender
 * @see checkin.spi.PushSender
 * @see checkin.spi.MetricsExporter
 */
package checkin.spi;
