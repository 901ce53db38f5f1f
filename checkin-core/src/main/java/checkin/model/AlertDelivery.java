package checkin.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One delivery lineage per {@code (eventId, contactId, channel)}.
 */
public record AlertDelivery(
    String deliveryId,
    String eventId,
    String contactId,
    Channel channel,
    DeliveryStatus status,
    String providerRef,
    String providerStatus,
    String errorMessage,
    int retryCount,
    int maxRetries,
    Instant nextRetryAt,
    Instant sentAt,
    Instant createdAt,
    Instant updatedAt
) {
    public AlertDelivery {
        Objects.requireNonNull(deliveryId, "deliveryId");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(contactId, "contactId");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(status, "status");
    }

    /**
     * A freshly claimed delivery row in {@link DeliveryStatus#PENDING}.
     */
    public static AlertDelivery pending(String eventId, String contactId, Channel channel, int maxRetries, Instant now) {
        return new AlertDelivery(UUID.randomUUID().toString(), eventId, contactId, channel,
            DeliveryStatus.PENDING, null, null, null, 0, maxRetries, null, null, now, now);
    }
}
