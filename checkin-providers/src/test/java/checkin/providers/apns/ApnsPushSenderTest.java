package checkin.providers.apns;

import checkin.spi.PushMessage;
import checkin.spi.PushResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ApnsPushSenderTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void unconfiguredSenderReportsFailure() {
    ApnsPushSender sender = ApnsPushSender.builder().build();

    PushResult result = sender.send(new PushMessage("abcdef0123456789", "Are You Safe?", "Please confirm",
        PushMessage.CATEGORY_CHECKIN_REMINDER, Map.of(), true));

    assertFalse(sender.isConfigured());
    assertFalse(result.success());
    assertEquals(ApnsPushSender.NOT_CONFIGURED, result.errorReason());
    sender.close();
  }

  @Test
  void timeSensitivePayload() throws Exception {
    ApnsPushSender sender = ApnsPushSender.builder().build();
    PushMessage message = new PushMessage("token", "Safety Alert", "Alice missed her check-in",
        PushMessage.CATEGORY_CONTACT_ALERT, Map.of("type", "contact_alert", "event_id", "e1"), true);

    JsonNode json = mapper.readTree(sender.payloadJson(message));

    JsonNode aps = json.get("aps");
    assertEquals("Safety Alert", aps.get("alert").get("title").asText());
    assertEquals("Alice missed her check-in", aps.get("alert").get("body").asText());
    assertEquals("default", aps.get("sound").asText());
    assertEquals("CONTACT_ALERT", aps.get("category").asText());
    assertEquals("time-sensitive", aps.get("interruption-level").asText());
    assertEquals(1.0, aps.get("relevance-score").asDouble());
    assertEquals("contact_alert", json.get("type").asText());
    assertEquals("e1", json.get("event_id").asText());
  }

  @Test
  void plainPayloadDefaultsCategory() throws Exception {
    ApnsPushSender sender = ApnsPushSender.builder().build();
    PushMessage message = new PushMessage("token", "Reminder", "Tap to confirm", null, null, false);

    JsonNode aps = mapper.readTree(sender.payloadJson(message)).get("aps");

    assertEquals(PushMessage.CATEGORY_CHECKIN_REMINDER, aps.get("category").asText());
    assertFalse(aps.has("interruption-level"));
    assertFalse(aps.has("relevance-score"));
  }

  @Test
  void customDataCannotReplaceApsDictionary() throws Exception {
    ApnsPushSender sender = ApnsPushSender.builder().build();
    PushMessage message = new PushMessage("token", "t", "b", null, Map.of("aps", "oops"), false);

    JsonNode json = mapper.readTree(sender.payloadJson(message));

    assertTrue(json.get("aps").isObject());
  }

  @Test
  void signingKeyRequiresTopic() {
    assertThrows(NullPointerException.class, () -> ApnsPushSender.builder()
        .signingKey(new File("missing.p8"), "TEAM", "KEY")
        .build());
  }
}
