package checkin.model;

/**
 * An emergency contact of a user.
 *
 * @param contactId      contact identifier
 * @param userId         owning user
 * @param name           contact display name
 * @param level          priority tier, 1 (primary) or 2 (secondary)
 * @param phoneEncrypted opaque encrypted phone number, decrypted only at send time
 * @param pushToken      device token when the contact has the app, or {@code null}
 * @param hasApp         whether the contact prefers push alerts
 */
public record Contact(
    String contactId,
    String userId,
    String name,
    int level,
    String phoneEncrypted,
    String pushToken,
    boolean hasApp
) {
    public boolean canReceivePush() {
        return hasApp && pushToken != null && !pushToken.isEmpty();
    }
}
