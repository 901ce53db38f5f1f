package checkin.action;

import java.time.Instant;

public record SnoozeResponse(String eventId, Instant originalDeadline, Instant newDeadline, int snoozeCount) {}
