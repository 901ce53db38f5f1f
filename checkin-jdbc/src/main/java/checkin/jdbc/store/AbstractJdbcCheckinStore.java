package checkin.jdbc.store;

import checkin.jdbc.JdbcTemplate;
import checkin.model.AlertDelivery;
import checkin.model.AuditEntry;
import checkin.model.AuditType;
import checkin.model.Channel;
import checkin.model.CheckinEvent;
import checkin.model.CheckinTime;
import checkin.model.CheckinTransitions;
import checkin.model.Contact;
import checkin.model.DeliveryStatus;
import checkin.model.DueRetry;
import checkin.model.EventStatus;
import checkin.model.InsertResult;
import checkin.model.User;
import checkin.spi.CheckinStore;
import checkin.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Base JDBC check-in store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #insertUnique} to provide a database-specific way of
 * inserting a row that may clash with a unique key. Register custom implementations via
 * {@code META-INF/services/checkin.jdbc.store.AbstractJdbcCheckinStore}.
 *
 * <p>Instants are stored with millisecond precision. The expected schema ships as
 * {@code /schema/<name>.sql} on the classpath.
 *
 * @see JdbcCheckinStores
 */
public abstract class AbstractJdbcCheckinStore implements CheckinStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcCheckinStore.class.getName());
  private static final int MAX_ERROR_LENGTH = 1000;

  protected static final String USERS = "users";
  protected static final String CONTACTS = "contacts";
  protected static final String EVENTS = "checkin_events";
  protected static final String DELIVERIES = "alert_deliveries";
  protected static final String EVENT_LOGS = "event_logs";

  protected static final String OPEN_STATUS_IN = inList(Set.of(EventStatus.PENDING, EventStatus.SNOOZED));

  private static final String EVENT_COLUMNS =
      "e.event_id, e.user_id, e.scheduled_time, e.deadline_time, e.status, e.confirmed_at, e.snoozed_until, " +
      "e.snooze_count, e.escalated_at, e.escalation_level, e.level2_escalated_at, e.contacts_alerted_at, e.created_at, e.updated_at";

  private static final String DELIVERY_COLUMNS =
      "d.delivery_id, d.event_id, d.contact_id, d.channel, d.status, d.provider_ref, d.provider_status, " +
      "d.error_message, d.retry_count, d.max_retries, d.next_retry_at, d.sent_at, d.created_at, d.updated_at";

  private static final String USER_COLUMNS =
      "user_id, name, timezone, checkin_times, grace_minutes, sms_alerts_enabled, level2_delay_minutes, " +
      "pause_until, push_token";

  protected static final JdbcTemplate.RowMapper<CheckinEvent> EVENT_ROW_MAPPER = rs -> new CheckinEvent(
      rs.getString("event_id"),
      rs.getString("user_id"),
      instant(rs, "scheduled_time"),
      instant(rs, "deadline_time"),
      EventStatus.fromCode(rs.getString("status")),
      instant(rs, "confirmed_at"),
      instant(rs, "snoozed_until"),
      rs.getInt("snooze_count"),
      instant(rs, "escalated_at"),
      rs.getInt("escalation_level"),
      instant(rs, "level2_escalated_at"),
      instant(rs, "contacts_alerted_at"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  protected static final JdbcTemplate.RowMapper<AlertDelivery> DELIVERY_ROW_MAPPER = rs -> new AlertDelivery(
      rs.getString("delivery_id"),
      rs.getString("event_id"),
      rs.getString("contact_id"),
      Channel.fromCode(rs.getString("channel")),
      DeliveryStatus.fromCode(rs.getString("status")),
      rs.getString("provider_ref"),
      rs.getString("provider_status"),
      rs.getString("error_message"),
      rs.getInt("retry_count"),
      rs.getInt("max_retries"),
      instant(rs, "next_retry_at"),
      instant(rs, "sent_at"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  protected static final JdbcTemplate.RowMapper<Contact> CONTACT_ROW_MAPPER = rs -> new Contact(
      rs.getString("contact_id"),
      rs.getString("user_id"),
      rs.getString("name"),
      rs.getInt("level"),
      rs.getString("phone_enc"),
      rs.getString("push_token"),
      rs.getBoolean("has_app"));

  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<User> userRowMapper;
  private final JdbcTemplate.RowMapper<AuditEntry> auditRowMapper;

  protected AbstractJdbcCheckinStore() {
    this(JsonCodec.getDefault());
  }

  protected AbstractJdbcCheckinStore(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.userRowMapper = rs -> new User(
        rs.getString("user_id"),
        rs.getString("name"),
        rs.getString("timezone"),
        parseTimes(rs.getString("checkin_times")),
        rs.getInt("grace_minutes"),
        rs.getBoolean("sms_alerts_enabled"),
        nullableInt(rs, "level2_delay_minutes"),
        instant(rs, "pause_until"),
        rs.getString("push_token"));
    this.auditRowMapper = rs -> new AuditEntry(
        rs.getString("log_id"),
        rs.getString("user_id"),
        rs.getString("event_id"),
        AuditType.fromCode(rs.getString("event_type")),
        instant(rs, "event_time"),
        rs.getString("result"),
        this.jsonCodec.parseObject(rs.getString("details")));
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect using {@code jsonCodec}.
   */
  public abstract AbstractJdbcCheckinStore withJsonCodec(JsonCodec jsonCodec);

  /**
   * Classpath location of the DDL script for this store's database.
   */
  public String schemaResource() {
    return "/schema/" + name() + ".sql";
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Inserts one row into {@code table}, skipping it if a unique key already holds an equal row.
   *
   * @return rows inserted, 0 when the row clashed with an existing one
   */
  protected int insertUnique(Connection conn, String table, String columns, Object... params) {
    return JdbcTemplate.insertIgnoringDuplicate(conn, insertSql("INSERT INTO", table, columns, params.length), params);
  }

  protected static String insertSql(String verb, String table, String columns, int paramCount) {
    return verb + " " + table + " (" + columns + ") VALUES (" +
        String.join(",", Collections.nCopies(paramCount, "?")) + ")";
  }

  // ---- users ----

  /**
   * {@inheritDoc}
   *
   * <p>Rows with an unreadable schedule or grace period are logged and left out.
   */
  @Override
  public List<User> findActiveUsers(Connection conn, Instant now) {
    String sql = "SELECT " + USER_COLUMNS + " FROM " + USERS +
        " WHERE pause_until IS NULL OR pause_until <= ? ORDER BY user_id";
    List<User> users = new ArrayList<>();
    JdbcTemplate.query(conn, sql, rs -> {
      String userId = rs.getString("user_id");
      try {
        users.add(userRowMapper.map(rs));
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Skipping user {0} with invalid settings: {1}",
            new Object[]{userId, e.getMessage()});
      }
      return userId;
    }, ts(now));
    return users;
  }

  @Override
  public Optional<User> findUser(Connection conn, String userId) {
    String sql = "SELECT " + USER_COLUMNS + " FROM " + USERS + " WHERE user_id=?";
    return JdbcTemplate.queryOne(conn, sql, userRowMapper, userId);
  }

  @Override
  public int updatePauseUntil(Connection conn, String userId, Instant pauseUntil) {
    String sql = "UPDATE " + USERS + " SET pause_until=?, updated_at=? WHERE user_id=?";
    return JdbcTemplate.update(conn, sql, ts(pauseUntil), ts(Instant.now()), userId);
  }

  // ---- events ----

  @Override
  public Optional<CheckinEvent> findEventForSlot(Connection conn, String userId, Instant slot) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e WHERE e.user_id=? AND e.scheduled_time=?";
    return JdbcTemplate.queryOne(conn, sql, EVENT_ROW_MAPPER, userId, ts(slot));
  }

  @Override
  public Optional<CheckinEvent> findEventById(Connection conn, String eventId) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e WHERE e.event_id=?";
    return JdbcTemplate.queryOne(conn, sql, EVENT_ROW_MAPPER, eventId);
  }

  @Override
  public Optional<CheckinEvent> findEvent(Connection conn, String userId, String eventId) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e WHERE e.event_id=? AND e.user_id=?";
    return JdbcTemplate.queryOne(conn, sql, EVENT_ROW_MAPPER, eventId, userId);
  }

  @Override
  public Optional<CheckinEvent> findLatestOpenEvent(Connection conn, String userId) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e" +
        " WHERE e.user_id=? AND e.status IN " + OPEN_STATUS_IN +
        " ORDER BY e.scheduled_time DESC LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, EVENT_ROW_MAPPER, userId);
  }

  @Override
  public InsertResult insertEvent(Connection conn, CheckinEvent event) {
    int inserted = insertUnique(conn, EVENTS,
        "event_id, user_id, scheduled_time, deadline_time, status, confirmed_at, snoozed_until, snooze_count, " +
        "escalated_at, escalation_level, level2_escalated_at, contacts_alerted_at, created_at, updated_at",
        event.eventId(), event.userId(), ts(event.scheduledTime()), ts(event.deadlineTime()),
        event.status().code(), ts(event.confirmedAt()), ts(event.snoozedUntil()), event.snoozeCount(),
        ts(event.escalatedAt()), event.escalationLevel(), ts(event.level2EscalatedAt()), ts(event.contactsAlertedAt()),
        ts(event.createdAt()), ts(event.updatedAt()));
    return inserted > 0 ? InsertResult.CREATED : InsertResult.ALREADY_EXISTS;
  }

  @Override
  public List<CheckinEvent> findOverdueEvents(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e JOIN " + USERS + " u ON u.user_id=e.user_id" +
        " WHERE ((e.status IN " + OPEN_STATUS_IN + " AND e.deadline_time < ?)" +
        " OR (e.status='" + EventStatus.ALERTED.code() + "' AND e.contacts_alerted_at IS NULL))" +
        " AND (u.pause_until IS NULL OR u.pause_until <= ?)" +
        " ORDER BY e.deadline_time LIMIT ?";
    return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, ts(now), ts(now), limit);
  }

  @Override
  public List<CheckinEvent> findLevel2DueEvents(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e" +
        " JOIN " + USERS + " u ON u.user_id=e.user_id" +
        " WHERE e.status='" + EventStatus.ALERTED.code() + "' AND e.escalation_level=1" +
        " AND e.escalated_at IS NOT NULL AND u.level2_delay_minutes > 0" +
        " AND " + level2DueTime() + " <= ?" +
        " AND (u.pause_until IS NULL OR u.pause_until <= ?)" +
        " ORDER BY e.escalated_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, ts(now), ts(now), limit);
  }

  /**
   * SQL expression for the instant an event becomes due for level-2 escalation, in terms of
   * {@code e.escalated_at} and {@code u.level2_delay_minutes}.
   */
  protected String level2DueTime() {
    return "TIMESTAMPADD(MINUTE, u.level2_delay_minutes, e.escalated_at)";
  }

  @Override
  public int markAlerted(Connection conn, String eventId, Instant escalatedAt, int escalationLevel) {
    String sql = "UPDATE " + EVENTS + " SET status='" + EventStatus.ALERTED.code() + "'," +
        " escalated_at=?, escalation_level=?, contacts_alerted_at=NULL, updated_at=?" +
        " WHERE event_id=? AND status IN " + inList(CheckinTransitions.sourcesOf(EventStatus.ALERTED));
    return JdbcTemplate.update(conn, sql, ts(escalatedAt), escalationLevel, ts(escalatedAt), eventId);
  }

  @Override
  public int markLevel2Escalated(Connection conn, String eventId, Instant now) {
    String sql = "UPDATE " + EVENTS + " SET escalation_level=2, level2_escalated_at=?, contacts_alerted_at=NULL," +
        " updated_at=? WHERE event_id=? AND status='" + EventStatus.ALERTED.code() + "' AND escalation_level=1";
    return JdbcTemplate.update(conn, sql, ts(now), ts(now), eventId);
  }

  @Override
  public int markContactsAlerted(Connection conn, String eventId, Instant now) {
    String sql = "UPDATE " + EVENTS + " SET contacts_alerted_at=?, updated_at=?" +
        " WHERE event_id=? AND status='" + EventStatus.ALERTED.code() + "'";
    return JdbcTemplate.update(conn, sql, ts(now), ts(now), eventId);
  }

  @Override
  public int markConfirmed(Connection conn, String eventId, EventStatus expected, Instant confirmedAt) {
    String sql = "UPDATE " + EVENTS + " SET status='" + EventStatus.CONFIRMED.code() + "'," +
        " confirmed_at=?, updated_at=? WHERE event_id=? AND status=?";
    return JdbcTemplate.update(conn, sql, ts(confirmedAt), ts(confirmedAt), eventId, expected.code());
  }

  @Override
  public int markSnoozed(Connection conn, String eventId, EventStatus expected, int expectedSnoozeCount,
      Instant newDeadline, Instant now) {
    String sql = "UPDATE " + EVENTS + " SET status='" + EventStatus.SNOOZED.code() + "'," +
        " deadline_time=?, snoozed_until=?, snooze_count=snooze_count+1, updated_at=?" +
        " WHERE event_id=? AND status=? AND snooze_count=?";
    return JdbcTemplate.update(conn, sql, ts(newDeadline), ts(newDeadline), ts(now), eventId, expected.code(),
        expectedSnoozeCount);
  }

  @Override
  public int pauseOpenEvents(Connection conn, String userId, Instant now) {
    String sql = "UPDATE " + EVENTS + " SET status='" + EventStatus.PAUSED.code() + "', updated_at=?" +
        " WHERE user_id=? AND status IN " + OPEN_STATUS_IN;
    return JdbcTemplate.update(conn, sql, ts(now), userId);
  }

  @Override
  public List<CheckinEvent> findHistory(Connection conn, String userId, Instant since, Instant until, int limit) {
    StringBuilder sql = new StringBuilder("SELECT " + EVENT_COLUMNS + " FROM " + EVENTS + " e WHERE e.user_id=?");
    List<Object> params = new ArrayList<>();
    params.add(userId);
    if (since != null) {
      sql.append(" AND e.scheduled_time >= ?");
      params.add(ts(since));
    }
    if (until != null) {
      sql.append(" AND e.scheduled_time < ?");
      params.add(ts(until));
    }
    sql.append(" ORDER BY e.scheduled_time DESC LIMIT ?");
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), EVENT_ROW_MAPPER, params.toArray());
  }

  // ---- contacts ----

  @Override
  public List<Contact> findContactsByUser(Connection conn, String userId) {
    String sql = "SELECT contact_id, user_id, name, level, phone_enc, push_token, has_app FROM " + CONTACTS +
        " WHERE user_id=? ORDER BY level, contact_id";
    return JdbcTemplate.query(conn, sql, CONTACT_ROW_MAPPER, userId);
  }

  // ---- deliveries ----

  @Override
  public Optional<AlertDelivery> findDelivery(Connection conn, String eventId, String contactId, Channel channel) {
    String sql = "SELECT " + DELIVERY_COLUMNS + " FROM " + DELIVERIES + " d" +
        " WHERE d.event_id=? AND d.contact_id=? AND d.channel=?";
    return JdbcTemplate.queryOne(conn, sql, DELIVERY_ROW_MAPPER, eventId, contactId, channel.code());
  }

  @Override
  public InsertResult insertDelivery(Connection conn, AlertDelivery delivery) {
    int inserted = insertUnique(conn, DELIVERIES,
        "delivery_id, event_id, contact_id, channel, status, provider_ref, provider_status, error_message, " +
        "retry_count, max_retries, next_retry_at, sent_at, created_at, updated_at",
        delivery.deliveryId(), delivery.eventId(), delivery.contactId(), delivery.channel().code(),
        delivery.status().code(), delivery.providerRef(), delivery.providerStatus(),
        truncateError(delivery.errorMessage()), delivery.retryCount(), delivery.maxRetries(),
        ts(delivery.nextRetryAt()), ts(delivery.sentAt()), ts(delivery.createdAt()), ts(delivery.updatedAt()));
    return inserted > 0 ? InsertResult.CREATED : InsertResult.ALREADY_EXISTS;
  }

  @Override
  public int markDeliverySent(Connection conn, String deliveryId, String providerRef, String providerStatus,
      Instant sentAt) {
    String sql = "UPDATE " + DELIVERIES + " SET status='" + DeliveryStatus.SENT.code() + "'," +
        " provider_ref=?, provider_status=?, sent_at=?, next_retry_at=NULL, updated_at=?" +
        " WHERE delivery_id=? AND status IN " + inList(Set.of(DeliveryStatus.PENDING, DeliveryStatus.FAILED));
    return JdbcTemplate.update(conn, sql, providerRef, providerStatus, ts(sentAt), ts(sentAt), deliveryId);
  }

  @Override
  public int markDeliveryFailed(Connection conn, String deliveryId, String errorMessage, Instant nextRetryAt,
      Instant now) {
    String sql = "UPDATE " + DELIVERIES + " SET status='" + DeliveryStatus.FAILED.code() + "'," +
        " error_message=?, next_retry_at=?, updated_at=?" +
        " WHERE delivery_id=? AND status='" + DeliveryStatus.PENDING.code() + "'";
    return JdbcTemplate.update(conn, sql, truncateError(errorMessage), ts(nextRetryAt), ts(now), deliveryId);
  }

  @Override
  public int markDeliveryRetryFailed(Connection conn, String deliveryId, int expectedRetryCount,
      String errorMessage, Instant nextRetryAt, Instant now) {
    String sql = "UPDATE " + DELIVERIES + " SET retry_count=retry_count+1, error_message=?, next_retry_at=?," +
        " updated_at=? WHERE delivery_id=? AND status='" + DeliveryStatus.FAILED.code() + "' AND retry_count=?";
    return JdbcTemplate.update(conn, sql, truncateError(errorMessage), ts(nextRetryAt), ts(now), deliveryId,
        expectedRetryCount);
  }

  @Override
  public List<DueRetry> findDueRetries(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + DELIVERY_COLUMNS + ", c.phone_enc, e.scheduled_time, u.name AS user_name" +
        " FROM " + DELIVERIES + " d" +
        " JOIN " + EVENTS + " e ON e.event_id=d.event_id" +
        " JOIN " + CONTACTS + " c ON c.contact_id=d.contact_id" +
        " JOIN " + USERS + " u ON u.user_id=e.user_id" +
        " WHERE d.channel='" + Channel.SMS.code() + "' AND d.status='" + DeliveryStatus.FAILED.code() + "'" +
        " AND d.retry_count < d.max_retries AND d.next_retry_at IS NOT NULL AND d.next_retry_at <= ?" +
        " ORDER BY d.next_retry_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> new DueRetry(
        DELIVERY_ROW_MAPPER.map(rs),
        rs.getString("phone_enc"),
        instant(rs, "scheduled_time"),
        rs.getString("user_name")), ts(now), limit);
  }

  @Override
  public List<String> findSentContactIds(Connection conn, String eventId) {
    String sql = "SELECT DISTINCT contact_id FROM " + DELIVERIES +
        " WHERE event_id=? AND status IN " + inList(Set.of(DeliveryStatus.SENT, DeliveryStatus.DELIVERED)) +
        " ORDER BY contact_id";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString("contact_id"), eventId);
  }

  // ---- audit ----

  @Override
  public void appendAudit(Connection conn, AuditEntry entry) {
    String sql = insertSql("INSERT INTO", EVENT_LOGS,
        "log_id, user_id, event_id, event_type, event_time, result, details, created_at", 8);
    JdbcTemplate.update(conn, sql,
        entry.logId(), entry.userId(), entry.eventId(), entry.type().code(), ts(entry.eventTime()),
        entry.result(), jsonCodec.toJson(entry.details()), ts(Instant.now()));
  }

  @Override
  public List<AuditEntry> findAuditEntries(Connection conn, String userId, String eventId) {
    String columns = "SELECT log_id, user_id, event_id, event_type, event_time, result, details FROM " + EVENT_LOGS;
    if (eventId == null) {
      return JdbcTemplate.query(conn, columns + " WHERE user_id=? ORDER BY seq", auditRowMapper, userId);
    }
    return JdbcTemplate.query(conn, columns + " WHERE user_id=? AND event_id=? ORDER BY seq",
        auditRowMapper, userId, eventId);
  }

  // ---- conversions ----

  /** Millisecond-precision timestamp, or {@code null}. */
  protected static Timestamp ts(Instant instant) {
    return instant == null ? null : Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
  }

  protected static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }

  private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  private List<CheckinTime> parseTimes(String json) {
    List<CheckinTime> times = new ArrayList<>();
    for (String value : jsonCodec.parseArray(json)) {
      times.add(CheckinTime.parse(value));
    }
    times.sort(null);
    return times;
  }

  /** Encodes check-in times the way {@code users.checkin_times} stores them. */
  public String encodeTimes(List<CheckinTime> times) {
    return jsonCodec.toJsonArray(times.stream().map(CheckinTime::toString).collect(Collectors.toList()));
  }

  private static String inList(Set<? extends Enum<?>> values) {
    return values.stream()
        .map(v -> "'" + code(v) + "'")
        .sorted()
        .collect(Collectors.joining(",", "(", ")"));
  }

  private static String code(Enum<?> value) {
    if (value instanceof EventStatus s) {
      return s.code();
    }
    if (value instanceof DeliveryStatus s) {
      return s.code();
    }
    throw new IllegalArgumentException("No code for " + value);
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
