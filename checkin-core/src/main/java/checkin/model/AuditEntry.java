package checkin.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit log entry.
 *
 * @param logId     entry identifier
 * @param userId    user the entry belongs to
 * @param eventId   related check-in event, or {@code null}
 * @param type      entry type
 * @param eventTime when the audited action happened
 * @param result    short outcome code ({@code ok}, {@code missed}, ...)
 * @param details   flat detail map, never {@code null}
 */
public record AuditEntry(
    String logId,
    String userId,
    String eventId,
    AuditType type,
    Instant eventTime,
    String result,
    Map<String, String> details
) {
    public AuditEntry {
        Objects.requireNonNull(logId, "logId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(eventTime, "eventTime");
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditEntry of(String userId, String eventId, AuditType type, Instant eventTime,
                                String result, Map<String, String> details) {
        return new AuditEntry(UUID.randomUUID().toString(), userId, eventId, type, eventTime, result, details);
    }
}
