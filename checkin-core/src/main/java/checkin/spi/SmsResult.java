package checkin.spi;

/**
 * Provider answer to an SMS send.
 *
 * @param success        whether the provider accepted the message
 * @param providerRef    provider message id (e.g. Twilio SID)
 * @param providerStatus provider status string at accept time
 * @param errorCode      provider error code on failure
 * @param errorMessage   human-readable failure reason
 */
public record SmsResult(boolean success, String providerRef, String providerStatus,
                        String errorCode, String errorMessage) {

    public static SmsResult sent(String providerRef, String providerStatus) {
        return new SmsResult(true, providerRef, providerStatus, null, null);
    }

    public static SmsResult failed(String errorCode, String errorMessage) {
        return new SmsResult(false, null, null, errorCode, errorMessage);
    }
}
