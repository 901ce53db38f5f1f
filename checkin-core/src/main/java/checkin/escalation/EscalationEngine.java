package checkin.escalation;

import checkin.action.EventNotFoundException;
import checkin.alert.DefaultAlertComposer;
import checkin.delivery.DeliveryGateway;
import checkin.model.AlertDelivery;
import checkin.model.AuditEntry;
import checkin.model.AuditType;
import checkin.model.Channel;
import checkin.model.CheckinEvent;
import checkin.model.CheckinTransitions;
import checkin.model.Contact;
import checkin.model.EventStatus;
import checkin.model.InsertResult;
import checkin.model.User;
import checkin.retry.CappedExponentialBackoff;
import checkin.retry.RetryPolicy;
import checkin.spi.AlertComposer;
import checkin.spi.CheckinStore;
import checkin.spi.ConnectionProvider;
import checkin.spi.MetricsExporter;
import checkin.spi.PhoneDecryptor;
import checkin.spi.PushMessage;
import checkin.spi.PushResult;
import checkin.spi.SmsResult;
import checkin.util.DaemonThreadFactory;
import checkin.util.JdbcCalls;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Detects breached deadlines and notifies emergency contacts.
 *
 * <p>An overdue event is moved to {@code alerted} with a compare-and-set; losing the race to a
 * concurrent confirmation means no contact is notified. The per-contact pass then runs as
 * independent tasks on a bounded worker pool, each capturing its own outcome, so one contact's
 * failure never affects the others. Existing delivery rows make re-running a pass a no-op.
 * A pass that dies before it finishes leaves the event without {@code contactsAlertedAt}, and the
 * next {@link #runEscalations(Instant)} picks it up again.
 *
 * <p>With a positive {@link User#level2DelayMinutes()} escalation is staged: the first pass
 * notifies level-1 contacts only and {@link #runLevel2Escalations(Instant)} notifies the rest
 * once the delay has elapsed. Otherwise all levels are notified at once.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EscalationEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EscalationEngine.class.getName());

    private final ConnectionProvider connectionProvider;
    private final CheckinStore store;
    private final DeliveryGateway deliveryGateway;
    private final PhoneDecryptor phoneDecryptor;
    private final AlertComposer alertComposer;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final int maxRetries;
    private final int batchSize;
    private final ExecutorService workers;

    private EscalationEngine(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.deliveryGateway = Objects.requireNonNull(builder.deliveryGateway, "deliveryGateway");
        this.phoneDecryptor = Objects.requireNonNull(builder.phoneDecryptor, "phoneDecryptor");
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.deliveryWorkers <= 0) {
            throw new IllegalArgumentException("deliveryWorkers must be > 0");
        }
        this.alertComposer = builder.alertComposer != null ? builder.alertComposer : new DefaultAlertComposer();
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new CappedExponentialBackoff();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.maxRetries = builder.maxRetries;
        this.batchSize = builder.batchSize;
        this.workers = Executors.newFixedThreadPool(builder.deliveryWorkers,
            new DaemonThreadFactory("checkin-delivery-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Escalates every pending or snoozed event whose deadline is before {@code now} and finishes
     * contact passes that were interrupted.
     *
     * @return number of events escalated
     */
    public int runEscalations(Instant now) {
        List<CheckinEvent> overdue;
        try {
            overdue = JdbcCalls.inConnection(connectionProvider, conn -> store.findOverdueEvents(conn, now, batchSize));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load overdue events", e);
            return 0;
        }
        int escalated = 0;
        for (CheckinEvent event : overdue) {
            try {
                if (escalate(event.eventId(), now).escalated()) {
                    escalated++;
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to escalate event " + event.eventId(), e);
            }
        }
        return escalated;
    }

    /**
     * Notifies level-2 contacts of staged escalations whose delay has elapsed.
     *
     * @return number of events escalated to level 2
     */
    public int runLevel2Escalations(Instant now) {
        List<CheckinEvent> due;
        try {
            due = JdbcCalls.inConnection(connectionProvider, conn -> store.findLevel2DueEvents(conn, now, batchSize));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load level-2 escalations", e);
            return 0;
        }
        int escalated = 0;
        for (CheckinEvent event : due) {
            try {
                if (escalateLevel2(event.eventId(), now).escalated()) {
                    escalated++;
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed level-2 escalation of event " + event.eventId(), e);
            }
        }
        return escalated;
    }

    /**
     * Escalates one event and runs the contact pass.
     *
     * <p>Pending, snoozed or missed events are moved to alerted first. An already alerted event
     * only re-runs the contact pass, which skips contacts that already have a delivery.
     * Confirmed and paused events are left alone.
     *
     * @throws EventNotFoundException if the event does not exist
     */
    public EscalationResult escalate(String eventId, Instant now) {
        Target target = load(eventId);
        CheckinEvent event = target.event;
        User user = target.user;

        int maxLevel;
        if (CheckinTransitions.canTransition(event.status(), EventStatus.ALERTED)) {
            int level = user.stagedEscalation() ? 1 : 2;
            AuditEntry escalated = AuditEntry.of(user.userId(), eventId, AuditType.CHECKIN_ESCALATED, now, "missed",
                Map.of("escalation_level", String.valueOf(level)));
            boolean marked = JdbcCalls.inTransaction(connectionProvider, conn -> {
                if (store.markAlerted(conn, eventId, now, level) == 0) {
                    return false;
                }
                store.appendAudit(conn, escalated);
                return true;
            });
            if (!marked) {
                logger.log(Level.INFO, "Event {0} changed state concurrently, not escalating", eventId);
                return EscalationResult.notEscalated(eventId);
            }
            metrics.incrementEscalations();
            logger.log(Level.INFO, "Escalated event {0} of user {1} (level {2})",
                new Object[]{eventId, user.userId(), level});
            maxLevel = level == 1 ? 1 : Integer.MAX_VALUE;
        } else if (event.status() == EventStatus.ALERTED) {
            boolean levelOneOnly = event.escalationLevel() == 1
                || (event.escalationLevel() == 0 && user.stagedEscalation());
            maxLevel = levelOneOnly ? 1 : Integer.MAX_VALUE;
        } else {
            return EscalationResult.notEscalated(eventId);
        }
        return notifyContacts(event, user, 1, maxLevel, now);
    }

    /**
     * Raises a staged escalation to level 2 and notifies the level-2 contacts.
     *
     * @throws EventNotFoundException if the event does not exist
     */
    public EscalationResult escalateLevel2(String eventId, Instant now) {
        Target target = load(eventId);
        AuditEntry raised = AuditEntry.of(target.user.userId(), eventId, AuditType.LEVEL2_ESCALATED, now, "ok", Map.of());
        boolean marked = JdbcCalls.inTransaction(connectionProvider, conn -> {
            if (store.markLevel2Escalated(conn, eventId, now) == 0) {
                return false;
            }
            store.appendAudit(conn, raised);
            return true;
        });
        if (!marked) {
            return EscalationResult.notEscalated(eventId);
        }
        metrics.incrementLevel2Escalations();
        logger.log(Level.INFO, "Escalated event {0} to level-2 contacts", eventId);
        return notifyContacts(target.event, target.user, 2, Integer.MAX_VALUE, now);
    }

    private Target load(String eventId) {
        Target target = JdbcCalls.inConnection(connectionProvider, conn -> {
            CheckinEvent event = store.findEventById(conn, eventId).orElse(null);
            if (event == null) {
                return null;
            }
            User user = store.findUser(conn, event.userId())
                .orElseThrow(() -> new IllegalStateException("User " + event.userId() + " of event " + eventId + " not found"));
            return new Target(event, user);
        });
        if (target == null) {
            throw new EventNotFoundException(eventId);
        }
        return target;
    }

    private EscalationResult notifyContacts(CheckinEvent event, User user, int minLevel, int maxLevel, Instant now) {
        if (!user.smsAlertsEnabled()) {
            logger.log(Level.INFO, "SMS alerts disabled for user {0}, no contacts notified", user.userId());
            auditContactsAlerted(event, 0, now);
            return new EscalationResult(event.eventId(), true, 0, List.of());
        }

        List<Contact> contacts = new ArrayList<>();
        for (Contact contact : JdbcCalls.inConnection(connectionProvider,
            conn -> store.findContactsByUser(conn, user.userId()))) {
            if (contact.level() >= minLevel && contact.level() <= maxLevel) {
                contacts.add(contact);
            }
        }
        String smsText = alertComposer.composeAlertText(user.name(), event.scheduledTime());

        List<Future<ContactResult>> futures = new ArrayList<>(contacts.size());
        for (Contact contact : contacts) {
            futures.add(workers.submit(() -> notifyContact(event, user, contact, smsText, now)));
        }
        List<ContactResult> results = new ArrayList<>(contacts.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(gather(contacts.get(i), futures.get(i)));
        }

        int sent = 0;
        for (ContactResult result : results) {
            if (result.outcome() == ContactOutcome.SENT) {
                sent++;
            }
        }
        auditContactsAlerted(event, sent, now);
        return new EscalationResult(event.eventId(), true, sent, results);
    }

    private static ContactResult gather(Contact contact, Future<ContactResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.WARNING, "Delivery to contact " + contact.contactId() + " failed", cause);
            return new ContactResult(contact.contactId(), ContactOutcome.ERROR, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new ContactResult(contact.contactId(), ContactOutcome.ERROR, "interrupted");
        }
    }

    private ContactResult notifyContact(CheckinEvent event, User user, Contact contact, String smsText, Instant now) {
        String eventId = event.eventId();
        String contactId = contact.contactId();
        try {
            boolean smsExists = JdbcCalls.inConnection(connectionProvider,
                conn -> store.findDelivery(conn, eventId, contactId, Channel.SMS).isPresent());
            if (smsExists) {
                return ContactResult.of(contactId, ContactOutcome.ALREADY_EXISTS);
            }

            if (contact.canReceivePush()) {
                pushToContact(event, user, contact, now);
            }

            AlertDelivery sms = AlertDelivery.pending(eventId, contactId, Channel.SMS, maxRetries, now);
            InsertResult claimed = JdbcCalls.inConnection(connectionProvider, conn -> store.insertDelivery(conn, sms));
            if (claimed == InsertResult.ALREADY_EXISTS) {
                metrics.incrementDuplicatesSuppressed();
                return ContactResult.of(contactId, ContactOutcome.ALREADY_EXISTS);
            }

            String phone;
            try {
                phone = phoneDecryptor.decrypt(contact.phoneEncrypted());
            } catch (RuntimeException e) {
                recordFailure(sms.deliveryId(), "Phone decryption failed: " + e.getMessage(), null, now);
                logger.log(Level.WARNING, "Cannot decrypt phone of contact " + contactId, e);
                return new ContactResult(contactId, ContactOutcome.ERROR, e.getMessage());
            }

            SmsResult result = deliveryGateway.sendSms(phone, smsText);
            if (result.success()) {
                JdbcCalls.inConnection(connectionProvider, conn ->
                    store.markDeliverySent(conn, sms.deliveryId(), result.providerRef(), result.providerStatus(), now));
                metrics.incrementDeliverySent(Channel.SMS);
                logger.log(Level.INFO, "SMS alert sent to contact {0} for event {1}", new Object[]{contactId, eventId});
                return ContactResult.of(contactId, ContactOutcome.SENT);
            }
            Instant nextRetryAt = maxRetries > 0 ? retryPolicy.nextRetryAt(now, 0) : null;
            recordFailure(sms.deliveryId(), result.errorMessage(), nextRetryAt, now);
            logger.log(Level.WARNING, "SMS alert to contact {0} for event {1} failed: {2}",
                new Object[]{contactId, eventId, result.errorMessage()});
            return new ContactResult(contactId, ContactOutcome.FAILED, result.errorMessage());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error notifying contact " + contactId + " for event " + eventId, e);
            return new ContactResult(contactId, ContactOutcome.ERROR, e.getMessage());
        }
    }

    private void recordFailure(String deliveryId, String error, Instant nextRetryAt, Instant now) {
        JdbcCalls.inConnection(connectionProvider,
            conn -> store.markDeliveryFailed(conn, deliveryId, error, nextRetryAt, now));
        metrics.incrementDeliveryFailed(Channel.SMS);
    }

    private void pushToContact(CheckinEvent event, User user, Contact contact, Instant now) {
        try {
            AlertDelivery push = AlertDelivery.pending(event.eventId(), contact.contactId(), Channel.PUSH, 0, now);
            InsertResult claimed = JdbcCalls.inConnection(connectionProvider, conn -> store.insertDelivery(conn, push));
            if (claimed == InsertResult.ALREADY_EXISTS) {
                return;
            }
            PushResult result = deliveryGateway.sendPush(new PushMessage(
                contact.pushToken(),
                alertComposer.contactAlertTitle(),
                alertComposer.contactAlertBody(user.name(), event.scheduledTime()),
                PushMessage.CATEGORY_CONTACT_ALERT,
                Map.of("type", "contact_alert", "event_id", event.eventId()),
                true));
            if (result.success()) {
                JdbcCalls.inConnection(connectionProvider, conn ->
                    store.markDeliverySent(conn, push.deliveryId(), result.providerMessageId(), "accepted", now));
                metrics.incrementDeliverySent(Channel.PUSH);
            } else {
                JdbcCalls.inConnection(connectionProvider, conn ->
                    store.markDeliveryFailed(conn, push.deliveryId(), result.errorReason(), null, now));
                metrics.incrementDeliveryFailed(Channel.PUSH);
                logger.log(Level.WARNING, "Push alert to contact {0} failed: {1}",
                    new Object[]{contact.contactId(), result.errorReason()});
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Push alert to contact " + contact.contactId() + " failed", e);
        }
    }

    /**
     * Marks the contact pass finished. Until then the event stays selectable by
     * {@link #runEscalations(Instant)}, which re-runs the pass.
     */
    private void auditContactsAlerted(CheckinEvent event, int sent, Instant now) {
        AuditEntry entry = AuditEntry.of(event.userId(), event.eventId(), AuditType.CONTACTS_ALERTED, now, "ok",
            Map.of("contacts_count", String.valueOf(sent)));
        JdbcCalls.inTransaction(connectionProvider, conn -> {
            store.markContactsAlerted(conn, event.eventId(), now);
            store.appendAudit(conn, entry);
            return null;
        });
    }

    /**
     * Stops the delivery worker pool.
     */
    @Override
    public void close() {
        workers.shutdownNow();
        try {
            workers.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Target {
        final CheckinEvent event;
        final User user;

        Target(CheckinEvent event, User user) {
            this.event = event;
            this.user = user;
        }
    }

    /**
     * Builder for {@link EscalationEngine}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CheckinStore store;
        private DeliveryGateway deliveryGateway;
        private PhoneDecryptor phoneDecryptor;
        private AlertComposer alertComposer;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private int maxRetries = 3;
        private int batchSize = 100;
        private int deliveryWorkers = 4;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder store(CheckinStore store) {
            this.store = store;
            return this;
        }

        /**
         * Gateway through which SMS and push alerts are sent.
         *
         * <p><b>Required.</b>
         */
        public Builder deliveryGateway(DeliveryGateway deliveryGateway) {
            this.deliveryGateway = deliveryGateway;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder phoneDecryptor(PhoneDecryptor phoneDecryptor) {
            this.phoneDecryptor = phoneDecryptor;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link DefaultAlertComposer}.
         */
        public Builder alertComposer(AlertComposer alertComposer) {
            this.alertComposer = alertComposer;
            return this;
        }

        /**
         * Policy for the first retry of a failed SMS.
         *
         * <p>Optional. Defaults to {@link CappedExponentialBackoff}.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Retry budget stamped on each new SMS delivery.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Maximum number of events escalated per run.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Size of the pool that notifies contacts in parallel.
         *
         * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
         */
        public Builder deliveryWorkers(int deliveryWorkers) {
            this.deliveryWorkers = deliveryWorkers;
            return this;
        }

        public EscalationEngine build() {
            return new EscalationEngine(this);
        }
    }
}
