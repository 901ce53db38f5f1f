package checkin.alert;

import checkin.spi.AlertComposer;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * English alert texts. Times are rendered in a single display zone (UTC unless configured),
 * matching the UTC scheduling default.
 */
public final class DefaultAlertComposer implements AlertComposer {
    static final String FALLBACK_NAME = "Your contact";

    private final DateTimeFormatter smsTime;
    private final DateTimeFormatter pushTime;

    public DefaultAlertComposer() {
        this(ZoneOffset.UTC);
    }

    public DefaultAlertComposer(ZoneId displayZone) {
        Objects.requireNonNull(displayZone, "displayZone");
        this.smsTime = DateTimeFormatter.ofPattern("HH:mm", Locale.US).withZone(displayZone);
        this.pushTime = DateTimeFormatter.ofPattern("h:mm a", Locale.US).withZone(displayZone);
    }

    @Override
    public String composeAlertText(String userName, Instant scheduledTime) {
        return "[Are You Safe] " + displayName(userName) + " missed their " + smsTime.format(scheduledTime)
            + " safety check-in. Please try to contact them to make sure they're okay."
            + " This is an automated message - do not reply.";
    }

    @Override
    public String reminderTitle() {
        return "Are You Safe?";
    }

    @Override
    public String reminderBody(int graceMinutes) {
        return "Please tap 'I'm Safe' to confirm you're okay. [" + graceMinutes + " min window]";
    }

    @Override
    public String contactAlertTitle() {
        return "Safety Alert";
    }

    @Override
    public String contactAlertBody(String userName, Instant scheduledTime) {
        return displayName(userName) + " missed their " + pushTime.format(scheduledTime)
            + " check-in. Please try to contact them.";
    }

    private static String displayName(String userName) {
        return userName == null || userName.isBlank() ? FALLBACK_NAME : userName;
    }
}
