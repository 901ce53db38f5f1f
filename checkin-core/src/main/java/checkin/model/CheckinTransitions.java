package checkin.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal status transitions of a {@link CheckinEvent}.
 *
 * <pre>
 * pending  -&gt; confirmed | snoozed | alerted | paused | missed
 * snoozed  -&gt; confirmed | snoozed | alerted | paused
 * missed   -&gt; confirmed | alerted
 * alerted  -&gt; confirmed
 * confirmed, paused: terminal
 * </pre>
 *
 * <p>Re-snoozing is further bounded by the snooze cap, which is a policy and not part of this table.
 */
public final class CheckinTransitions {
    private static final Map<EventStatus, Set<EventStatus>> ALLOWED = new EnumMap<>(EventStatus.class);

    static {
        ALLOWED.put(EventStatus.PENDING, EnumSet.of(
            EventStatus.CONFIRMED, EventStatus.SNOOZED, EventStatus.ALERTED, EventStatus.PAUSED, EventStatus.MISSED));
        ALLOWED.put(EventStatus.SNOOZED, EnumSet.of(
            EventStatus.CONFIRMED, EventStatus.SNOOZED, EventStatus.ALERTED, EventStatus.PAUSED));
        ALLOWED.put(EventStatus.MISSED, EnumSet.of(EventStatus.CONFIRMED, EventStatus.ALERTED));
        ALLOWED.put(EventStatus.ALERTED, EnumSet.of(EventStatus.CONFIRMED));
        ALLOWED.put(EventStatus.CONFIRMED, EnumSet.noneOf(EventStatus.class));
        ALLOWED.put(EventStatus.PAUSED, EnumSet.noneOf(EventStatus.class));
    }

    private CheckinTransitions() {
    }

    public static boolean canTransition(EventStatus from, EventStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    /**
     * Statuses from which {@code to} may be entered.
     */
    public static Set<EventStatus> sourcesOf(EventStatus to) {
        Set<EventStatus> sources = EnumSet.noneOf(EventStatus.class);
        for (Map.Entry<EventStatus, Set<EventStatus>> entry : ALLOWED.entrySet()) {
            if (entry.getValue().contains(to)) {
                sources.add(entry.getKey());
            }
        }
        return sources;
    }

    public static boolean isTerminal(EventStatus status) {
        return ALLOWED.get(status).isEmpty();
    }
}
