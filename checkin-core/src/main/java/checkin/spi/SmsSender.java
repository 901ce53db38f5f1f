package checkin.spi;

/**
 * SMS delivery channel.
 *
 * <p>Implementations report provider-side failures through {@link SmsResult#success()};
 * thrown exceptions are treated the same way by the engine.
 */
@FunctionalInterface
public interface SmsSender {

    /**
     * @param phone E.164 destination number
     * @param body  message text
     * @return the provider result, never {@code null}
     */
    SmsResult send(String phone, String body);
}
