package checkin.model;

import java.util.List;

/**
 * A past check-in event together with the contacts that were successfully alerted for it.
 */
public record HistoryEntry(CheckinEvent event, List<String> notifiedContactIds) {
    public HistoryEntry {
        notifiedContactIds = notifiedContactIds == null ? List.of() : List.copyOf(notifiedContactIds);
    }
}
