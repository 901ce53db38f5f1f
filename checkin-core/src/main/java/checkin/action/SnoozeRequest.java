package checkin.action;

/**
 * @param eventId event to snooze, required
 * @param minutes snooze length; {@code null} uses the default
 */
public record SnoozeRequest(String eventId, Integer minutes) {}
