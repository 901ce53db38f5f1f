package checkin.spi;

import java.util.Map;
import java.util.Objects;

/**
 * A push notification. The {@code category} is part of the client contract: it selects
 * the actionable buttons (confirm, snooze) the app renders.
 *
 * @param token         device token
 * @param title         alert title
 * @param body          alert body
 * @param category      notification category, e.g. {@link #CATEGORY_CHECKIN_REMINDER}
 * @param customData    flat key/value data delivered alongside the alert
 * @param timeSensitive whether the notification may break through focus modes
 */
public record PushMessage(String token, String title, String body, String category,
                          Map<String, String> customData, boolean timeSensitive) {

    public static final String CATEGORY_CHECKIN_REMINDER = "CHECKIN_REMINDER";
    public static final String CATEGORY_CONTACT_ALERT = "CONTACT_ALERT";

    public PushMessage {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        customData = customData == null ? Map.of() : Map.copyOf(customData);
    }
}
