package checkin.spi;

import java.time.Instant;

/**
 * Produces the texts sent to users and contacts. Implementations must be pure: the same
 * input always yields the same text, so a retried SMS can be re-derived instead of stored.
 *
 * @see checkin.alert.DefaultAlertComposer
 */
public interface AlertComposer {

    /**
     * SMS body sent to a contact when {@code userName} missed the check-in at {@code scheduledTime}.
     */
    String composeAlertText(String userName, Instant scheduledTime);

    String reminderTitle();

    /**
     * Body of the "please check in" push sent to the user when an event is created.
     */
    String reminderBody(int graceMinutes);

    String contactAlertTitle();

    /**
     * Body of the push sent to a contact that has the app.
     */
    String contactAlertBody(String userName, Instant scheduledTime);
}
