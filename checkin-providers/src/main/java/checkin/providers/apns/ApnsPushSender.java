package checkin.providers.apns;

import checkin.spi.PushMessage;
import checkin.spi.PushResult;
import checkin.spi.PushSender;
import com.eatthepath.pushy.apns.ApnsClient;
import com.eatthepath.pushy.apns.ApnsClientBuilder;
import com.eatthepath.pushy.apns.DeliveryPriority;
import com.eatthepath.pushy.apns.PushNotificationResponse;
import com.eatthepath.pushy.apns.PushType;
import com.eatthepath.pushy.apns.auth.ApnsSigningKey;
import com.eatthepath.pushy.apns.util.SimpleApnsPushNotification;
import com.eatthepath.pushy.apns.util.TokenUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PushSender} backed by a Pushy {@link ApnsClient} using token-based authentication.
 *
 * <p>Alerts carry {@code sound: default}, the message category (default
 * {@value PushMessage#CATEGORY_CHECKIN_REMINDER}) and, for time-sensitive messages,
 * {@code interruption-level: time-sensitive} with a relevance score of 1.0. Custom data is
 * merged into the top level of the payload. Notifications are sent with immediate priority
 * and expire at once if the device is offline.
 *
 * <p>A sender built without credentials reports every message as failed with
 * {@value #NOT_CONFIGURED}.
 */
public final class ApnsPushSender implements PushSender, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ApnsPushSender.class.getName());

  static final String NOT_CONFIGURED = "APNs not configured";

  private final ApnsClient apnsClient;
  private final boolean ownsClient;
  private final String topic;
  private final Duration sendTimeout;
  private final ObjectMapper objectMapper;

  private ApnsPushSender(Builder builder, ApnsClient apnsClient, boolean ownsClient) {
    this.apnsClient = apnsClient;
    this.ownsClient = ownsClient;
    this.topic = builder.topic;
    this.sendTimeout = Objects.requireNonNull(builder.sendTimeout, "sendTimeout");
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isConfigured() {
    return apnsClient != null;
  }

  @Override
  public PushResult send(PushMessage message) {
    if (apnsClient == null) {
      logger.log(Level.FINE, "APNs not configured, skipping push to {0}", preview(message.token()));
      return PushResult.failed(NOT_CONFIGURED);
    }
    String payload;
    try {
      payload = payloadJson(message);
    } catch (JsonProcessingException e) {
      return PushResult.failed("Failed to build APNs payload: " + e.getOriginalMessage());
    }
    // Invalidation at the epoch maps to apns-expiration 0: deliver now or drop.
    SimpleApnsPushNotification notification = new SimpleApnsPushNotification(
        TokenUtil.sanitizeTokenString(message.token()), topic, payload,
        Instant.EPOCH, DeliveryPriority.IMMEDIATE, PushType.ALERT);

    try {
      PushNotificationResponse<SimpleApnsPushNotification> response = apnsClient.sendNotification(notification)
          .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      String apnsId = response.getApnsId() != null ? response.getApnsId().toString() : null;
      if (response.isAccepted()) {
        return PushResult.sent(apnsId);
      }
      String reason = response.getRejectionReason().orElse("Rejected");
      logger.log(Level.WARNING, "APNs rejected push to {0}: {1}", new Object[]{preview(message.token()), reason});
      return PushResult.failed(reason);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PushResult.failed("Interrupted");
    } catch (TimeoutException e) {
      return PushResult.failed("APNs send timed out after " + sendTimeout.toMillis() + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.WARNING, "APNs request failed", cause);
      return PushResult.failed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }
  }

  /**
   * Serializes the APNs JSON payload for {@code message}.
   */
  String payloadJson(PushMessage message) throws JsonProcessingException {
    Map<String, Object> alert = new LinkedHashMap<>();
    alert.put("title", message.title());
    alert.put("body", message.body());

    Map<String, Object> aps = new LinkedHashMap<>();
    aps.put("alert", alert);
    aps.put("sound", "default");
    aps.put("category", message.category() != null ? message.category() : PushMessage.CATEGORY_CHECKIN_REMINDER);
    if (message.timeSensitive()) {
      aps.put("interruption-level", "time-sensitive");
      aps.put("relevance-score", 1.0);
    }

    Map<String, Object> root = new LinkedHashMap<>(message.customData());
    root.put("aps", aps);
    return objectMapper.writeValueAsString(root);
  }

  /**
   * Closes the underlying client if this sender created it.
   */
  @Override
  public void close() {
    if (apnsClient != null && ownsClient) {
      apnsClient.close().join();
    }
  }

  private static String preview(String token) {
    return token.length() > 8 ? token.substring(0, 8) + "..." : token;
  }

  /**
   * Builder for {@link ApnsPushSender}.
   *
   * <p>Either pass a ready {@link #apnsClient(ApnsClient)} or a signing key via
   * {@link #signingKey(File, String, String)}; with neither the sender is left unconfigured.
   */
  public static final class Builder {
    private ApnsClient apnsClient;
    private File signingKeyFile;
    private String teamId;
    private String keyId;
    private boolean sandbox;
    private String topic;
    private Duration sendTimeout = Duration.ofSeconds(10);
    private ObjectMapper objectMapper;

    private Builder() {
    }

    /**
     * Uses an existing client. The caller keeps ownership and closes it.
     */
    public Builder apnsClient(ApnsClient apnsClient) {
      this.apnsClient = apnsClient;
      return this;
    }

    /**
     * Token-based credentials: the {@code .p8} key file with its team and key ids.
     */
    public Builder signingKey(File signingKeyFile, String teamId, String keyId) {
      this.signingKeyFile = signingKeyFile;
      this.teamId = teamId;
      this.keyId = keyId;
      return this;
    }

    /** Optional. Defaults to the production APNs host. */
    public Builder sandbox(boolean sandbox) {
      this.sandbox = sandbox;
      return this;
    }

    /** <b>Required</b> when configured: the app bundle id. */
    public Builder topic(String topic) {
      this.topic = topic;
      return this;
    }

    /** Optional. Defaults to 10 seconds. */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /**
     * @throws IllegalStateException if the signing key cannot be loaded or the client cannot be built
     */
    public ApnsPushSender build() {
      if (apnsClient != null) {
        Objects.requireNonNull(topic, "topic");
        return new ApnsPushSender(this, apnsClient, false);
      }
      if (signingKeyFile == null) {
        return new ApnsPushSender(this, null, false);
      }
      Objects.requireNonNull(topic, "topic");
      Objects.requireNonNull(teamId, "teamId");
      Objects.requireNonNull(keyId, "keyId");
      try {
        ApnsClient client = new ApnsClientBuilder()
            .setApnsServer(sandbox ? ApnsClientBuilder.DEVELOPMENT_APNS_HOST : ApnsClientBuilder.PRODUCTION_APNS_HOST)
            .setSigningKey(ApnsSigningKey.loadFromPkcs8File(signingKeyFile, teamId, keyId))
            .build();
        return new ApnsPushSender(this, client, true);
      } catch (IOException | GeneralSecurityException e) {
        throw new IllegalStateException("Failed to create APNs client from " + signingKeyFile, e);
      }
    }
  }
}
