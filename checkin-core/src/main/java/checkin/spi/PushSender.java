package checkin.spi;

/**
 * Push delivery channel.
 */
@FunctionalInterface
public interface PushSender {

    /**
     * Sender used when no push channel is configured; every send fails.
     */
    PushSender DISABLED = message -> PushResult.failed("push not configured");

    PushResult send(PushMessage message);
}
