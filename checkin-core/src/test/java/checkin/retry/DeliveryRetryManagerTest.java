package checkin.retry;

import checkin.delivery.DeliveryGateway;
import checkin.model.AlertDelivery;
import checkin.model.Channel;
import checkin.model.CheckinEvent;
import checkin.model.Contact;
import checkin.model.DeliveryStatus;
import checkin.support.CountingMetrics;
import checkin.support.InMemoryCheckinStore;
import checkin.support.RecordingSmsSender;
import checkin.support.TestSupport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static checkin.support.TestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class DeliveryRetryManagerTest {
  private static final Instant NINE = Instant.parse("2026-03-10T09:00:00Z");
  private static final Instant FIRST_FAILURE = Instant.parse("2026-03-10T09:16:00Z");

  private InMemoryCheckinStore store;
  private CountingMetrics metrics;
  private RecordingSmsSender sms;
  private DeliveryGateway gateway;
  private DeliveryRetryManager manager;
  private CheckinEvent event;

  @BeforeEach
  void setUp() {
    store = new InMemoryCheckinStore();
    metrics = new CountingMetrics();
    sms = new RecordingSmsSender();
    gateway = new DeliveryGateway(sms, null);
    manager = DeliveryRetryManager.builder()
        .connectionProvider(stubCp())
        .store(store)
        .deliveryGateway(gateway)
        .phoneDecryptor(TestSupport::decrypt)
        .metrics(metrics)
        .build();

    store.addUser(user("u1", "Alice", 15, "09:00"));
    store.addContact(smsContact("c1", "u1", 1, "+15550000001"));
    event = CheckinEvent.pending("u1", NINE, 15, NINE);
    store.putEvent(event);
  }

  @AfterEach
  void tearDown() {
    gateway.close();
  }

  private AlertDelivery failedDelivery(int retryCount, Instant nextRetryAt) {
    AlertDelivery pending = AlertDelivery.pending(event.eventId(), "c1", Channel.SMS, 3, FIRST_FAILURE);
    AlertDelivery failed = new AlertDelivery(pending.deliveryId(), pending.eventId(), pending.contactId(),
        Channel.SMS, DeliveryStatus.FAILED, null, null, "Carrier rejected", retryCount, 3, nextRetryAt, null,
        FIRST_FAILURE, FIRST_FAILURE);
    store.putDelivery(failed);
    return failed;
  }

  @Test
  void nothingDueBeforeNextRetryAt() {
    failedDelivery(0, FIRST_FAILURE.plusSeconds(60));
    assertEquals(0, manager.runRetries(FIRST_FAILURE.plusSeconds(59)));
    assertEquals(0, sms.sendCount());
  }

  @Test
  void successfulRetryMarksSent() {
    AlertDelivery delivery = failedDelivery(0, FIRST_FAILURE.plusSeconds(60));

    assertEquals(1, manager.runRetries(FIRST_FAILURE.plusSeconds(60)));

    AlertDelivery after = store.deliveries().get(0);
    assertEquals(delivery.deliveryId(), after.deliveryId());
    assertEquals(DeliveryStatus.SENT, after.status());
    assertNull(after.nextRetryAt());
    assertEquals(0, after.retryCount());
    assertTrue(sms.bodies.get(0).contains("Alice missed their 09:00"));
    assertEquals("+15550000001", sms.phones.get(0));
    assertEquals(1, metrics.smsSent.get());
  }

  @Test
  void failuresBackOffThenGiveUp() {
    sms.failAll(true);
    failedDelivery(0, FIRST_FAILURE.plusSeconds(60));

    Instant t1 = FIRST_FAILURE.plus(Duration.ofMinutes(1));
    assertEquals(0, manager.runRetries(t1));
    AlertDelivery d1 = store.deliveries().get(0);
    assertEquals(1, d1.retryCount());
    assertEquals(t1.plus(Duration.ofMinutes(2)), d1.nextRetryAt());

    Instant t2 = d1.nextRetryAt();
    manager.runRetries(t2);
    AlertDelivery d2 = store.deliveries().get(0);
    assertEquals(2, d2.retryCount());
    assertEquals(t2.plus(Duration.ofMinutes(4)), d2.nextRetryAt());

    Instant t3 = d2.nextRetryAt();
    manager.runRetries(t3);
    AlertDelivery d3 = store.deliveries().get(0);
    assertEquals(3, d3.retryCount());
    assertNull(d3.nextRetryAt());
    assertEquals(DeliveryStatus.FAILED, d3.status());
    assertEquals(1, metrics.exhausted.get());

    assertEquals(0, manager.runRetries(t3.plus(Duration.ofHours(1))));
    assertEquals(3, sms.sendCount());
  }

  @Test
  void recoversAfterTransientFailure() {
    sms.failAll(true);
    failedDelivery(0, FIRST_FAILURE.plusSeconds(60));
    manager.runRetries(FIRST_FAILURE.plusSeconds(60));

    sms.failAll(false);
    AlertDelivery pending = store.deliveries().get(0);
    assertEquals(1, manager.runRetries(pending.nextRetryAt()));
    assertEquals(DeliveryStatus.SENT, store.deliveries().get(0).status());
    assertEquals(1, store.deliveries().get(0).retryCount());
  }

  @Test
  void exhaustedDeliveryIsNotPickedUp() {
    failedDelivery(3, null);
    assertEquals(0, manager.runRetries(FIRST_FAILURE.plus(Duration.ofDays(1))));
    assertEquals(0, sms.sendCount());
  }

  @Test
  void decryptionFailureCountsAsAttempt() {
    store.addContact(new Contact("c1", "u1", "c1", 1, "garbage", null, false));
    failedDelivery(0, FIRST_FAILURE.plusSeconds(60));

    assertEquals(0, manager.runRetries(FIRST_FAILURE.plusSeconds(60)));

    AlertDelivery after = store.deliveries().get(0);
    assertEquals(1, after.retryCount());
    assertTrue(after.errorMessage().startsWith("Phone decryption failed"));
    assertEquals(0, sms.sendCount());
  }
}
