package checkin.model;

import java.time.Instant;

/**
 * A failed SMS delivery due for retry, joined with what is needed to re-derive the alert text.
 *
 * @param delivery       the failed delivery
 * @param phoneEncrypted the contact's encrypted phone
 * @param scheduledTime  scheduled time of the missed event
 * @param userName       current display name of the user
 */
public record DueRetry(AlertDelivery delivery, String phoneEncrypted, Instant scheduledTime, String userName) {}
