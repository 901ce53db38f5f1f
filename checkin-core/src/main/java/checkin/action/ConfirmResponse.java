package checkin.action;

import java.time.Instant;

/**
 * @param eventId          the confirmed event (new for a synthesized confirmation)
 * @param confirmedAt      the stored confirmation time; the original one on a repeated confirm
 * @param wasEscalated     contacts had already been alerted
 * @param alreadyConfirmed the event was confirmed before this call and nothing changed
 * @param synthesized      no event matched, a confirmed one was created
 */
public record ConfirmResponse(String eventId, Instant confirmedAt, boolean wasEscalated,
                              boolean alreadyConfirmed, boolean synthesized) {}
