package checkin.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the check-in engine.
 *
 * @see CheckinAutoConfiguration
 */
@ConfigurationProperties(prefix = "checkin")
public class CheckinProperties {

  /**
   * Whether the periodic ticker starts with the application context.
   */
  private boolean autoStart = true;

  /**
   * Period between ticks.
   */
  private Duration tickInterval = Duration.ofMinutes(1);

  /**
   * Window around a configured check-in time within which an event is created.
   */
  private Duration tolerance = Duration.ofMinutes(1);

  /**
   * Match check-in times against each user's timezone instead of UTC.
   */
  private boolean userLocalTime = false;

  /**
   * Retry attempts per failed SMS delivery.
   */
  private int maxRetries = 3;

  /**
   * Worker threads escalating events concurrently.
   */
  private int deliveryWorkers = 4;

  /**
   * Upper bound for a single provider send.
   */
  private Duration sendTimeout = Duration.ofSeconds(30);

  /**
   * Rows fetched per escalation or retry sweep.
   */
  private int batchSize = 100;

  private final Snooze snooze = new Snooze();
  private final Encryption encryption = new Encryption();
  private final Jdbc jdbc = new Jdbc();
  private final Metrics metrics = new Metrics();
  private final Twilio twilio = new Twilio();
  private final Apns apns = new Apns();

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public Duration getTickInterval() {
    return tickInterval;
  }

  public void setTickInterval(Duration tickInterval) {
    this.tickInterval = tickInterval;
  }

  public Duration getTolerance() {
    return tolerance;
  }

  public void setTolerance(Duration tolerance) {
    this.tolerance = tolerance;
  }

  public boolean isUserLocalTime() {
    return userLocalTime;
  }

  public void setUserLocalTime(boolean userLocalTime) {
    this.userLocalTime = userLocalTime;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public int getDeliveryWorkers() {
    return deliveryWorkers;
  }

  public void setDeliveryWorkers(int deliveryWorkers) {
    this.deliveryWorkers = deliveryWorkers;
  }

  public Duration getSendTimeout() {
    return sendTimeout;
  }

  public void setSendTimeout(Duration sendTimeout) {
    this.sendTimeout = sendTimeout;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Snooze getSnooze() {
    return snooze;
  }

  public Encryption getEncryption() {
    return encryption;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public Twilio getTwilio() {
    return twilio;
  }

  public Apns getApns() {
    return apns;
  }

  public static class Snooze {
    /**
     * Snoozes allowed per event.
     */
    private int limit = 1;

    /**
     * Accepted snooze lengths in minutes.
     */
    private List<Integer> options = List.of(5, 10, 15, 30);

    /**
     * Length used when a request names none.
     */
    private int defaultMinutes = 10;

    public int getLimit() {
      return limit;
    }

    public void setLimit(int limit) {
      this.limit = limit;
    }

    public List<Integer> getOptions() {
      return options;
    }

    public void setOptions(List<Integer> options) {
      this.options = options;
    }

    public int getDefaultMinutes() {
      return defaultMinutes;
    }

    public void setDefaultMinutes(int defaultMinutes) {
      this.defaultMinutes = defaultMinutes;
    }

    Set<Integer> optionSet() {
      return new LinkedHashSet<>(options);
    }
  }

  public static class Encryption {
    /**
     * AES-256 key for stored contact phone numbers, 64 hex characters.
     */
    private String phoneKey;

    public String getPhoneKey() {
      return phoneKey;
    }

    public void setPhoneKey(String phoneKey) {
      this.phoneKey = phoneKey;
    }
  }

  public static class Jdbc {
    /**
     * Create the check-in tables from the bundled dialect script on startup.
     */
    private boolean initializeSchema = false;

    public boolean isInitializeSchema() {
      return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
      this.initializeSchema = initializeSchema;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "checkin";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }

  public static class Twilio {
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String baseUrl = "https://api.twilio.com";
    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getAccountSid() {
      return accountSid;
    }

    public void setAccountSid(String accountSid) {
      this.accountSid = accountSid;
    }

    public String getAuthToken() {
      return authToken;
    }

    public void setAuthToken(String authToken) {
      this.authToken = authToken;
    }

    public String getFromNumber() {
      return fromNumber;
    }

    public void setFromNumber(String fromNumber) {
      this.fromNumber = fromNumber;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }
  }

  public static class Apns {
    /**
     * Path to the {@code .p8} token signing key.
     */
    private String keyFile;
    private String teamId;
    private String keyId;

    /**
     * App bundle id sent as the APNs topic.
     */
    private String topic;
    private boolean sandbox = false;
    private Duration sendTimeout = Duration.ofSeconds(10);

    public String getKeyFile() {
      return keyFile;
    }

    public void setKeyFile(String keyFile) {
      this.keyFile = keyFile;
    }

    public String getTeamId() {
      return teamId;
    }

    public void setTeamId(String teamId) {
      this.teamId = teamId;
    }

    public String getKeyId() {
      return keyId;
    }

    public void setKeyId(String keyId) {
      this.keyId = keyId;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }

    public boolean isSandbox() {
      return sandbox;
    }

    public void setSandbox(boolean sandbox) {
      this.sandbox = sandbox;
    }

    public Duration getSendTimeout() {
      return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
    }
  }
}
