package checkin.action;

import checkin.model.AlertDelivery;
import checkin.model.AuditEntry;
import checkin.model.AuditType;
import checkin.model.Channel;
import checkin.model.CheckinEvent;
import checkin.model.DeliveryStatus;
import checkin.model.EventStatus;
import checkin.model.HistoryEntry;
import checkin.support.CountingMetrics;
import checkin.support.InMemoryCheckinStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static checkin.support.TestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class CheckinActionHandlerTest {
  private static final Instant NINE = Instant.parse("2026-03-10T09:00:00Z");

  private InMemoryCheckinStore store;
  private CountingMetrics metrics;
  private CheckinActionHandler handler;

  @BeforeEach
  void setUp() {
    store = new InMemoryCheckinStore();
    metrics = new CountingMetrics();
    handler = handler(store);
    store.addUser(user("u1", "Alice", 15, "09:00"));
  }

  private CheckinActionHandler handler(InMemoryCheckinStore s) {
    return CheckinActionHandler.builder()
        .connectionProvider(stubCp())
        .store(s)
        .metrics(metrics)
        .build();
  }

  private CheckinEvent pending() {
    CheckinEvent event = CheckinEvent.pending("u1", NINE, 15, NINE);
    store.putEvent(event);
    return event;
  }

  private CheckinEvent withStatus(CheckinEvent e, EventStatus status, Instant escalatedAt) {
    CheckinEvent changed = new CheckinEvent(e.eventId(), e.userId(), e.scheduledTime(), e.deadlineTime(), status,
        null, null, e.snoozeCount(), escalatedAt, escalatedAt != null ? 2 : 0, null, escalatedAt,
        e.createdAt(), e.updatedAt());
    store.putEvent(changed);
    return changed;
  }

  // confirm

  @Test
  void confirmPendingEvent() {
    CheckinEvent event = pending();
    Instant at = NINE.plusSeconds(120);

    ConfirmResponse response = handler.confirmCheckin("u1", ConfirmRequest.ofEvent(event.eventId()), at);

    assertEquals(event.eventId(), response.eventId());
    assertEquals(at, response.confirmedAt());
    assertFalse(response.wasEscalated());
    assertFalse(response.alreadyConfirmed());
    assertFalse(response.synthesized());
    assertEquals(EventStatus.CONFIRMED, store.event(event.eventId()).status());
    assertEquals(at, store.event(event.eventId()).confirmedAt());
    assertEquals(1, store.audit(AuditType.CHECKIN_CONFIRMED).size());
    assertEquals(1, metrics.confirmations.get());
  }

  @Test
  void secondConfirmIsIdempotent() {
    CheckinEvent event = pending();
    Instant first = NINE.plusSeconds(120);
    handler.confirmCheckin("u1", ConfirmRequest.ofEvent(event.eventId()), first);

    ConfirmResponse again = handler.confirmCheckin("u1", ConfirmRequest.ofEvent(event.eventId()), first.plusSeconds(60));

    assertTrue(again.alreadyConfirmed());
    assertEquals(first, again.confirmedAt());
    assertEquals(first, store.event(event.eventId()).confirmedAt());
    assertEquals(1, store.audit().size());
    assertEquals(1, metrics.confirmations.get());
  }

  @Test
  void confirmUsesClientTimestamp() {
    CheckinEvent event = pending();
    Instant client = NINE.plusSeconds(30);
    ConfirmResponse response = handler.confirmCheckin("u1",
        new ConfirmRequest(event.eventId(), null, client), NINE.plusSeconds(90));
    assertEquals(client, response.confirmedAt());
  }

  @Test
  void confirmWithoutIdFindsLatestOpenEvent() {
    CheckinEvent older = CheckinEvent.pending("u1", NINE.minus(Duration.ofHours(12)), 15, NINE);
    store.putEvent(withStatus(older, EventStatus.SNOOZED, null));
    CheckinEvent latest = pending();

    ConfirmResponse response = handler.confirmCheckin("u1", null, NINE.plusSeconds(60));

    assertEquals(latest.eventId(), response.eventId());
    assertEquals(EventStatus.SNOOZED, store.event(older.eventId()).status());
  }

  @Test
  void confirmByScheduledTime() {
    CheckinEvent event = pending();
    ConfirmResponse response = handler.confirmCheckin("u1", new ConfirmRequest(null, NINE, null), NINE.plusSeconds(5));
    assertEquals(event.eventId(), response.eventId());
  }

  @Test
  void lateConfirmReportsEscalation() {
    CheckinEvent alerted = withStatus(pending(), EventStatus.ALERTED, NINE.plus(Duration.ofMinutes(16)));

    ConfirmResponse response = handler.confirmCheckin("u1", ConfirmRequest.ofEvent(alerted.eventId()),
        NINE.plus(Duration.ofMinutes(20)));

    assertTrue(response.wasEscalated());
    assertEquals(EventStatus.CONFIRMED, store.event(alerted.eventId()).status());
    List<AuditEntry> late = store.audit(AuditType.CHECKIN_CONFIRMED_LATE);
    assertEquals(1, late.size());
    assertEquals("true", late.get(0).details().get("was_escalated"));
    assertEquals("Confirmed after alerts were sent", late.get(0).details().get("note"));
    assertTrue(store.audit(AuditType.CHECKIN_CONFIRMED).isEmpty());
  }

  @Test
  void alreadyConfirmedAfterEscalationStillReportsIt() {
    CheckinEvent alerted = withStatus(pending(), EventStatus.ALERTED, NINE.plus(Duration.ofMinutes(16)));
    handler.confirmCheckin("u1", ConfirmRequest.ofEvent(alerted.eventId()), NINE.plus(Duration.ofMinutes(20)));

    ConfirmResponse again = handler.confirmCheckin("u1", ConfirmRequest.ofEvent(alerted.eventId()),
        NINE.plus(Duration.ofMinutes(25)));
    assertTrue(again.alreadyConfirmed());
    assertTrue(again.wasEscalated());
  }

  @Test
  void confirmWithNoMatchingEventSynthesizesOne() {
    Instant at = Instant.parse("2026-03-10T13:37:00Z");

    ConfirmResponse response = handler.confirmCheckin("u1", ConfirmRequest.latest(), at);

    assertTrue(response.synthesized());
    CheckinEvent created = store.event(response.eventId());
    assertEquals(EventStatus.CONFIRMED, created.status());
    assertEquals(at, created.scheduledTime());
    assertEquals(at, created.confirmedAt());
    AuditEntry audit = store.audit(AuditType.CHECKIN_CONFIRMED).get(0);
    assertEquals("unscheduled", audit.details().get("source"));
  }

  @Test
  void confirmOfAnotherUsersEventIsNotApplied() {
    store.addUser(user("u2", "Bob", 15, "09:00"));
    CheckinEvent bobs = CheckinEvent.pending("u2", NINE, 15, NINE);
    store.putEvent(bobs);
    CheckinEvent own = pending();

    ConfirmResponse response = handler.confirmCheckin("u1", ConfirmRequest.ofEvent(bobs.eventId()),
        NINE.plusSeconds(30));

    assertNotEquals(bobs.eventId(), response.eventId());
    assertNotEquals(own.eventId(), response.eventId());
    assertTrue(response.synthesized());
    assertEquals(EventStatus.PENDING, store.event(bobs.eventId()).status());
    assertEquals(EventStatus.PENDING, store.event(own.eventId()).status());
  }

  @Test
  void confirmOfUnknownSlotDoesNotTouchLatestPendingEvent() {
    CheckinEvent own = pending();

    ConfirmResponse response = handler.confirmCheckin("u1",
        new ConfirmRequest(null, NINE.minus(Duration.ofHours(12)), null), NINE.plusSeconds(30));

    assertTrue(response.synthesized());
    assertEquals(NINE.minus(Duration.ofHours(12)), store.event(response.eventId()).scheduledTime());
    assertEquals(EventStatus.PENDING, store.event(own.eventId()).status());
  }

  @Test
  void confirmPausedEventIsRejected() {
    CheckinEvent paused = withStatus(pending(), EventStatus.PAUSED, null);
    var e = assertThrows(InvalidTransitionException.class,
        () -> handler.confirmCheckin("u1", ConfirmRequest.ofEvent(paused.eventId()), NINE));
    assertEquals("invalid_transition", e.reason());
  }

  @Test
  void confirmRetriesWhenEventChangesConcurrently() {
    CheckinEvent event = pending();
    AtomicBoolean raced = new AtomicBoolean();
    InMemoryCheckinStore racing = new InMemoryCheckinStore() {
      @Override
      public synchronized int markConfirmed(Connection conn, String eventId, EventStatus expected, Instant at) {
        if (raced.compareAndSet(false, true)) {
          markAlerted(conn, eventId, NINE.plus(Duration.ofMinutes(16)), 2);
          return 0;
        }
        return super.markConfirmed(conn, eventId, expected, at);
      }
    };
    racing.addUser(user("u1", "Alice", 15, "09:00"));
    racing.putEvent(event);

    ConfirmResponse response = handler(racing).confirmCheckin("u1", ConfirmRequest.ofEvent(event.eventId()),
        NINE.plus(Duration.ofMinutes(17)));

    assertTrue(response.wasEscalated());
    assertEquals(EventStatus.CONFIRMED, racing.event(event.eventId()).status());
    assertEquals(1, racing.audit(AuditType.CHECKIN_CONFIRMED_LATE).size());
  }

  // snooze

  @Test
  void snoozeExtendsDeadline() {
    CheckinEvent event = pending();

    SnoozeResponse response = handler.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), 10),
        NINE.plus(Duration.ofMinutes(5)));

    assertEquals(event.deadlineTime(), response.originalDeadline());
    assertEquals(Instant.parse("2026-03-10T09:25:00Z"), response.newDeadline());
    assertEquals(1, response.snoozeCount());
    CheckinEvent after = store.event(event.eventId());
    assertEquals(EventStatus.SNOOZED, after.status());
    assertEquals(response.newDeadline(), after.deadlineTime());
    assertEquals(response.newDeadline(), after.snoozedUntil());

    AuditEntry audit = store.audit(AuditType.CHECKIN_SNOOZED).get(0);
    assertEquals("10", audit.details().get("snooze_minutes"));
    assertEquals("2026-03-10T09:25:00Z", audit.details().get("new_deadline"));
    assertEquals(1, metrics.snoozes.get());
  }

  @Test
  void snoozeUsesDefaultLength() {
    CheckinEvent event = pending();
    SnoozeResponse response = handler.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), null), NINE);
    assertEquals(event.deadlineTime().plus(Duration.ofMinutes(10)), response.newDeadline());
  }

  @Test
  void secondSnoozeHitsLimit() {
    CheckinEvent event = pending();
    handler.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), 5), NINE);

    var e = assertThrows(SnoozeLimitExceededException.class,
        () -> handler.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), 5), NINE.plusSeconds(60)));
    assertEquals("already_snoozed", e.reason());
    assertFalse(e.isNotFound());
    assertEquals(1, store.event(event.eventId()).snoozeCount());
    assertEquals(1, store.audit(AuditType.CHECKIN_SNOOZED).size());
  }

  @Test
  void higherLimitAllowsRepeatedSnoozes() {
    CheckinEvent event = pending();
    var generous = CheckinActionHandler.builder().connectionProvider(stubCp()).store(store).snoozeLimit(2).build();
    generous.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), 5), NINE);
    SnoozeResponse second = generous.snoozeCheckin("u1", new SnoozeRequest(event.eventId(), 5), NINE);
    assertEquals(2, second.snoozeCount());
    assertEquals(event.deadlineTime().plus(Duration.ofMinutes(10)), second.newDeadline());
  }

  @Test
  void snoozeValidatesBeforeLookingUp() {
    var missingId = assertThrows(InvalidActionException.class,
        () -> handler.snoozeCheckin("u1", new SnoozeRequest(null, 10), NINE));
    assertEquals("invalid_request", missingId.reason());

    assertThrows(InvalidActionException.class,
        () -> handler.snoozeCheckin("u1", new SnoozeRequest("unknown", 7), NINE));
  }

  @Test
  void snoozeUnknownEventIsNotFound() {
    var e = assertThrows(EventNotFoundException.class,
        () -> handler.snoozeCheckin("u1", new SnoozeRequest("unknown", 10), NINE));
    assertTrue(e.isNotFound());
    assertEquals("event_not_found", e.reason());
  }

  @Test
  void snoozeAlertedEventIsInvalidTransition() {
    CheckinEvent alerted = withStatus(pending(), EventStatus.ALERTED, NINE.plus(Duration.ofMinutes(16)));
    assertThrows(InvalidTransitionException.class,
        () -> handler.snoozeCheckin("u1", new SnoozeRequest(alerted.eventId(), 10), NINE));
  }

  // current, pause, history

  @Test
  void currentCheckinIsLatestOpenEvent() {
    assertTrue(handler.getCurrentCheckin("u1").isEmpty());
    CheckinEvent event = pending();
    assertEquals(event.eventId(), handler.getCurrentCheckin("u1").orElseThrow().eventId());
    handler.confirmCheckin("u1", ConfirmRequest.ofEvent(event.eventId()), NINE);
    assertTrue(handler.getCurrentCheckin("u1").isEmpty());
  }

  @Test
  void pauseFlipsOpenEventsAndRecordsAudit() {
    CheckinEvent event = pending();
    Instant until = NINE.plus(Duration.ofDays(2));

    PauseResponse response = handler.pause("u1", until, NINE.plusSeconds(30));

    assertTrue(response.paused());
    assertEquals(1, response.eventsPaused());
    assertEquals(EventStatus.PAUSED, store.event(event.eventId()).status());
    assertEquals(until, store.findUser(null, "u1").orElseThrow().pauseUntil());
    assertEquals(until.toString(), store.audit(AuditType.MONITORING_PAUSED).get(0).details().get("pause_until"));
  }

  @Test
  void pauseMustBeInFuture() {
    assertThrows(InvalidActionException.class, () -> handler.pause("u1", NINE, NINE));
    assertThrows(InvalidActionException.class, () -> handler.pause("u1", null, NINE));
  }

  @Test
  void pauseUnknownUserIsRejected() {
    assertThrows(InvalidActionException.class, () -> handler.pause("ghost", NINE.plusSeconds(60), NINE));
  }

  @Test
  void resumeClearsPause() {
    handler.pause("u1", NINE.plus(Duration.ofDays(1)), NINE);
    PauseResponse response = handler.resume("u1", NINE.plusSeconds(60));
    assertFalse(response.paused());
    assertNull(store.findUser(null, "u1").orElseThrow().pauseUntil());
    assertEquals(1, store.audit(AuditType.MONITORING_RESUMED).size());
  }

  @Test
  void historyIsNewestFirstWithNotifiedContacts() {
    CheckinEvent morning = pending();
    CheckinEvent evening = CheckinEvent.pending("u1", NINE.plus(Duration.ofHours(12)), 15, NINE);
    store.putEvent(evening);
    withStatus(morning, EventStatus.ALERTED, NINE.plus(Duration.ofMinutes(16)));
    AlertDelivery sent = AlertDelivery.pending(morning.eventId(), "c1", Channel.SMS, 3, NINE);
    store.putDelivery(new AlertDelivery(sent.deliveryId(), sent.eventId(), "c1", Channel.SMS, DeliveryStatus.SENT,
        "SM1", "queued", null, 0, 3, null, NINE, NINE, NINE));
    AlertDelivery failed = AlertDelivery.pending(morning.eventId(), "c2", Channel.SMS, 3, NINE);
    store.putDelivery(new AlertDelivery(failed.deliveryId(), failed.eventId(), "c2", Channel.SMS,
        DeliveryStatus.FAILED, null, null, "x", 3, 3, null, null, NINE, NINE));

    List<HistoryEntry> history = handler.history("u1", null, null, 10);

    assertEquals(2, history.size());
    assertEquals(evening.eventId(), history.get(0).event().eventId());
    assertEquals(List.of(), history.get(0).notifiedContactIds());
    assertEquals(List.of("c1"), history.get(1).notifiedContactIds());
  }

  @Test
  void historyHonorsRangeAndLimit() {
    for (int day = 0; day < 5; day++) {
      store.putEvent(CheckinEvent.pending("u1", NINE.plus(Duration.ofDays(day)), 15, NINE));
    }
    assertEquals(2, handler.history("u1", null, null, 2).size());
    List<HistoryEntry> ranged = handler.history("u1", NINE.plus(Duration.ofDays(1)), NINE.plus(Duration.ofDays(3)), 50);
    assertEquals(2, ranged.size());
    assertEquals(NINE.plus(Duration.ofDays(2)), ranged.get(0).event().scheduledTime());
    assertThrows(InvalidActionException.class, () -> handler.history("u1", null, null, 0));
  }

  @Test
  void builderRejectsDefaultOutsideOptions() {
    assertThrows(IllegalArgumentException.class, () -> CheckinActionHandler.builder()
        .connectionProvider(stubCp()).store(store).snoozeOptions(Set.of(5, 15)).build());
  }
}
