package checkin.spi;

/**
 * Provider answer to a push send.
 *
 * @param success           whether the push gateway accepted the notification
 * @param providerMessageId gateway message id, when known
 * @param errorReason       rejection or transport failure reason
 */
public record PushResult(boolean success, String providerMessageId, String errorReason) {

    public static PushResult sent(String providerMessageId) {
        return new PushResult(true, providerMessageId, null);
    }

    public static PushResult failed(String errorReason) {
        return new PushResult(false, null, errorReason);
    }
}
