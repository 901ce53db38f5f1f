package checkin.jdbc;

import checkin.CheckinEngine;
import checkin.action.ConfirmRequest;
import checkin.action.ConfirmResponse;
import checkin.jdbc.store.H2CheckinStore;
import checkin.model.AuditEntry;
import checkin.model.AuditType;
import checkin.model.CheckinEvent;
import checkin.model.CheckinTime;
import checkin.model.EventStatus;
import checkin.model.HistoryEntry;
import checkin.spi.SmsResult;
import checkin.tick.TickSummary;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs whole engines over a pooled H2 database.
 */
class HikariCPIntegrationTest {
  private static final Instant NINE = Instant.parse("2026-03-10T09:00:00Z");

  private HikariDataSource hikariDs;
  private H2CheckinStore store;
  private DataSourceConnectionProvider connectionProvider;
  private final List<String> sentPhones = new CopyOnWriteArrayList<>();
  private final List<CheckinEngine> engines = new ArrayList<>();

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(8);
    config.setMinimumIdle(1);
    config.setPoolName("checkin-test-pool");

    hikariDs = new HikariDataSource(config);
    store = new H2CheckinStore();
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    Schemas.apply(hikariDs, store.schemaResource());

    seedUser("u1", "Alice");
    seedContact("c1", "u1", "enc:+15550000001");
    seedContact("c2", "u1", "enc:+15550000002");
  }

  @AfterEach
  void teardown() {
    engines.forEach(CheckinEngine::close);
    if (hikariDs != null) {
      hikariDs.close();
    }
  }

  private CheckinEngine newEngine() {
    CheckinEngine engine = CheckinEngine.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .smsSender((phone, body) -> {
          sentPhones.add(phone);
          return SmsResult.sent("SM" + sentPhones.size(), "queued");
        })
        .phoneDecryptor(ciphertext -> ciphertext.substring("enc:".length()))
        .build();
    engines.add(engine);
    return engine;
  }

  private static Instant at(String hhmm) {
    return Instant.parse("2026-03-10T" + hhmm + ":00Z");
  }

  @Test
  void missedCheckinRunsThroughPooledConnections() throws Exception {
    CheckinEngine engine = newEngine();

    assertEquals(new TickSummary(1, 0, 0, 0), engine.tick(NINE));
    assertEquals(0, engine.tick(at("09:15")).eventsEscalated());
    assertEquals(1, engine.tick(at("09:16")).eventsEscalated());
    engine.tick(at("09:20"));

    assertEquals(List.of("+15550000001", "+15550000002"), sentPhones.stream().sorted().collect(Collectors.toList()));

    CheckinEvent event;
    try (Connection conn = hikariDs.getConnection()) {
      event = store.findEventForSlot(conn, "u1", NINE).orElseThrow();
      assertEquals(EventStatus.ALERTED, event.status());
      assertEquals(List.of(AuditType.CHECKIN_SCHEDULED, AuditType.CHECKIN_ESCALATED, AuditType.CONTACTS_ALERTED),
          store.findAuditEntries(conn, "u1", event.eventId()).stream()
              .map(AuditEntry::type).collect(Collectors.toList()));
    }

    ConfirmResponse late = engine.confirmCheckin("u1", ConfirmRequest.ofEvent(event.eventId()), at("09:40"));
    assertTrue(late.wasEscalated());

    List<HistoryEntry> history = engine.history("u1", null, null, 10);
    assertEquals(1, history.size());
    assertEquals(EventStatus.CONFIRMED, history.get(0).event().status());
    assertEquals(List.of("c1", "c2"), history.get(0).notifiedContactIds().stream().sorted().collect(Collectors.toList()));
  }

  @Test
  void userWithUnreadableScheduleDoesNotBlockOthers() throws Exception {
    seedUser("u0", "Zed");
    try (Connection conn = hikariDs.getConnection();
        PreparedStatement ps = conn.prepareStatement("UPDATE users SET checkin_times=? WHERE user_id=?")) {
      ps.setString(1, "[\"9am\"]");
      ps.setString(2, "u0");
      ps.executeUpdate();
    }
    CheckinEngine engine = newEngine();

    assertEquals(1, engine.runScheduledCheckins(NINE));
    try (Connection conn = hikariDs.getConnection()) {
      assertTrue(store.findEventForSlot(conn, "u1", NINE).isPresent());
      assertTrue(store.findEventForSlot(conn, "u0", NINE).isEmpty());
    }
  }

  @Test
  void concurrentEnginesCreateOneEventPerSlot() throws Exception {
    int engineCount = 4;
    List<CheckinEngine> concurrent = new ArrayList<>();
    for (int i = 0; i < engineCount; i++) {
      concurrent.add(newEngine());
    }
    ExecutorService pool = Executors.newFixedThreadPool(engineCount);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Integer>> created = new ArrayList<>();
      for (CheckinEngine engine : concurrent) {
        created.add(pool.submit(() -> {
          start.await();
          return engine.runScheduledCheckins(NINE);
        }));
      }
      start.countDown();
      int total = 0;
      for (Future<Integer> f : created) {
        total += f.get(30, TimeUnit.SECONDS);
      }
      assertEquals(1, total);
    } finally {
      pool.shutdownNow();
    }

    try (Connection conn = hikariDs.getConnection()) {
      assertEquals(1, store.findHistory(conn, "u1", null, null, 10).size());
      assertEquals(1, store.findAuditEntries(conn, "u1", null).size());
    }

    // Later ticks on other instances find the event already alerted.
    assertEquals(1, concurrent.get(0).runEscalations(at("09:16")));
    assertEquals(0, concurrent.get(1).runEscalations(at("09:16")));
    assertEquals(0, concurrent.get(2).escalate(
        concurrent.get(2).history("u1", null, null, 1).get(0).event().eventId(), at("09:17")).contactsNotified());
    assertEquals(2, sentPhones.size());
  }

  @Test
  void connectionsAreReturnedToPool() throws Exception {
    CheckinEngine engine = newEngine();
    for (int minute = 0; minute < 30; minute++) {
      engine.tick(NINE.plusSeconds(60L * minute));
    }

    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private void seedUser(String userId, String name) throws SQLException {
    String sql = "INSERT INTO users (user_id, name, timezone, checkin_times, grace_minutes, sms_alerts_enabled)" +
        " VALUES (?,?,?,?,?,?)";
    try (Connection conn = hikariDs.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, userId);
      ps.setString(2, name);
      ps.setString(3, "UTC");
      ps.setString(4, store.encodeTimes(List.of(CheckinTime.parse("09:00"))));
      ps.setInt(5, 15);
      ps.setBoolean(6, true);
      ps.executeUpdate();
    }
  }

  private void seedContact(String contactId, String userId, String phoneEnc) throws SQLException {
    String sql = "INSERT INTO contacts (contact_id, user_id, name, level, phone_enc, has_app) VALUES (?,?,?,?,?,?)";
    try (Connection conn = hikariDs.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, contactId);
      ps.setString(2, userId);
      ps.setString(3, "Contact " + contactId);
      ps.setInt(4, 1);
      ps.setString(5, phoneEnc);
      ps.setBoolean(6, false);
      ps.executeUpdate();
    }
  }
}
