package checkin.providers.twilio;

import checkin.spi.SmsResult;
import checkin.spi.SmsSender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link SmsSender} backed by the Twilio Messages REST API.
 *
 * <p>Posts {@code To}, {@code From} and {@code Body} as a form with HTTP basic auth and maps the
 * JSON answer to an {@link SmsResult}: {@code sid} and {@code status} on success,
 * {@code error_code} and {@code error_message} otherwise. Transport failures never throw; they
 * come back as a failed result.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SmsSender twilio = TwilioSmsSender.builder()
 *     .accountSid("AC...")
 *     .authToken(token)
 *     .fromNumber("+15005550006")
 *     .build();
 * }</pre>
 */
public final class TwilioSmsSender implements SmsSender {
  private static final Logger logger = Logger.getLogger(TwilioSmsSender.class.getName());

  public static final String DEFAULT_BASE_URL = "https://api.twilio.com";
  static final String UNKNOWN_ERROR = "Unknown Twilio error";
  static final String NETWORK_ERROR = "Network error";

  private final String accountSid;
  private final String fromNumber;
  private final String authorization;
  private final URI messagesUri;
  private final Duration requestTimeout;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  private TwilioSmsSender(Builder builder) {
    this.accountSid = requireText(builder.accountSid, "accountSid");
    String authToken = requireText(builder.authToken, "authToken");
    this.fromNumber = requireText(builder.fromNumber, "fromNumber");
    String baseUrl = requireText(builder.baseUrl, "baseUrl");
    if (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    this.requestTimeout = Objects.requireNonNull(builder.requestTimeout, "requestTimeout");
    this.messagesUri = URI.create(baseUrl + "/2010-04-01/Accounts/" + accountSid + "/Messages.json");
    this.authorization = "Basic " + Base64.getEncoder()
        .encodeToString((accountSid + ":" + authToken).getBytes(StandardCharsets.UTF_8));
    this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
        .connectTimeout(builder.requestTimeout)
        .build();
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public SmsResult send(String phone, String body) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("To", phone);
    form.put("From", fromNumber);
    form.put("Body", body);

    HttpRequest request = HttpRequest.newBuilder(messagesUri)
        .timeout(requestTimeout)
        .header("Authorization", authorization)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return SmsResult.failed(null, "Interrupted");
    } catch (IOException e) {
      logger.log(Level.WARNING, "Twilio request failed", e);
      return SmsResult.failed(null, e.getMessage() != null ? e.getMessage() : NETWORK_ERROR);
    }
    return toResult(response.statusCode(), response.body());
  }

  SmsResult toResult(int statusCode, String responseBody) {
    JsonNode json;
    try {
      json = objectMapper.readTree(responseBody == null ? "" : responseBody);
    } catch (IOException e) {
      json = null;
    }
    boolean ok = statusCode >= 200 && statusCode < 300;
    if (ok && json != null && json.hasNonNull("sid")) {
      return SmsResult.sent(json.get("sid").asText(), text(json, "status"));
    }

    String errorCode = json == null ? null : firstText(json, "error_code", "code");
    String errorMessage = json == null ? null : firstText(json, "error_message", "message");
    if (errorCode == null && !ok) {
      errorCode = String.valueOf(statusCode);
    }
    if (errorMessage == null) {
      errorMessage = UNKNOWN_ERROR;
    }
    logger.log(Level.WARNING, "Twilio rejected message (HTTP {0}, code {1}): {2}",
        new Object[]{statusCode, errorCode, errorMessage});
    return SmsResult.failed(errorCode, errorMessage);
  }

  private static String firstText(JsonNode json, String... fields) {
    for (String field : fields) {
      String value = text(json, field);
      if (value != null && !value.isEmpty()) {
        return value;
      }
    }
    return null;
  }

  private static String text(JsonNode json, String field) {
    JsonNode node = json.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  private static String encodeForm(Map<String, String> form) {
    return form.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" +
            URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }

  /**
   * Builder for {@link TwilioSmsSender}.
   */
  public static final class Builder {
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String baseUrl = DEFAULT_BASE_URL;
    private Duration requestTimeout = Duration.ofSeconds(10);
    private HttpClient httpClient;
    private ObjectMapper objectMapper;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder accountSid(String accountSid) {
      this.accountSid = accountSid;
      return this;
    }

    /** <b>Required.</b> */
    public Builder authToken(String authToken) {
      this.authToken = authToken;
      return this;
    }

    /** <b>Required.</b> Sender number in E.164 format. */
    public Builder fromNumber(String fromNumber) {
      this.fromNumber = fromNumber;
      return this;
    }

    /** Optional. Defaults to {@value TwilioSmsSender#DEFAULT_BASE_URL}. */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /** Optional. Defaults to 10 seconds. */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    public TwilioSmsSender build() {
      return new TwilioSmsSender(this);
    }
  }
}
