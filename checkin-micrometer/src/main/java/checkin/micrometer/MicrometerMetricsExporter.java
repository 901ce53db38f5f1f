package checkin.micrometer;

import checkin.model.Channel;
import checkin.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code checkin.events.scheduled} - pending events created</li>
 *   <li>{@code checkin.events.duplicates} - inserts suppressed by a uniqueness clash</li>
 *   <li>{@code checkin.escalations} - events moved to alerted</li>
 *   <li>{@code checkin.escalations.level2} - staged escalations raised to level 2</li>
 *   <li>{@code checkin.deliveries.sent} - deliveries accepted by the provider, tagged {@code channel}</li>
 *   <li>{@code checkin.deliveries.failed} - failed delivery attempts, tagged {@code channel}</li>
 *   <li>{@code checkin.retries.exhausted} - SMS deliveries that gave up</li>
 *   <li>{@code checkin.confirmations} - confirmed check-ins</li>
 *   <li>{@code checkin.snoozes} - snoozed check-ins</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code checkin.tick.duration.ms} - duration of the last tick in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter scheduled;
  private final Counter duplicates;
  private final Counter escalations;
  private final Counter level2Escalations;
  private final Map<Channel, Counter> deliveriesSent = new EnumMap<>(Channel.class);
  private final Map<Channel, Counter> deliveriesFailed = new EnumMap<>(Channel.class);
  private final Counter retriesExhausted;
  private final Counter confirmations;
  private final Counter snoozes;
  private final Gauge tickDurationGauge;

  private final AtomicLong lastTickMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "checkin"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "checkin");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "safety.checkin"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.scheduled = Counter.builder(namePrefix + ".events.scheduled")
        .description("Pending check-in events created")
        .register(registry);
    this.duplicates = Counter.builder(namePrefix + ".events.duplicates")
        .description("Inserts suppressed because the row already existed")
        .register(registry);
    this.escalations = Counter.builder(namePrefix + ".escalations")
        .description("Missed check-ins escalated to contacts")
        .register(registry);
    this.level2Escalations = Counter.builder(namePrefix + ".escalations.level2")
        .description("Staged escalations raised to level-2 contacts")
        .register(registry);
    for (Channel channel : Channel.values()) {
      deliveriesSent.put(channel, Counter.builder(namePrefix + ".deliveries.sent")
          .description("Alert deliveries accepted by the provider")
          .tag("channel", channel.code())
          .register(registry));
      deliveriesFailed.put(channel, Counter.builder(namePrefix + ".deliveries.failed")
          .description("Failed alert delivery attempts")
          .tag("channel", channel.code())
          .register(registry));
    }
    this.retriesExhausted = Counter.builder(namePrefix + ".retries.exhausted")
        .description("SMS deliveries that used up their retries")
        .register(registry);
    this.confirmations = Counter.builder(namePrefix + ".confirmations")
        .description("Confirmed check-ins")
        .register(registry);
    this.snoozes = Counter.builder(namePrefix + ".snoozes")
        .description("Snoozed check-ins")
        .register(registry);
    this.tickDurationGauge = Gauge.builder(namePrefix + ".tick.duration.ms", lastTickMs, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementEventsScheduled() {
    if (closed) return;
    scheduled.increment();
  }

  @Override
  public void incrementDuplicatesSuppressed() {
    if (closed) return;
    duplicates.increment();
  }

  @Override
  public void incrementEscalations() {
    if (closed) return;
    escalations.increment();
  }

  @Override
  public void incrementLevel2Escalations() {
    if (closed) return;
    level2Escalations.increment();
  }

  @Override
  public void incrementDeliverySent(Channel channel) {
    if (closed) return;
    deliveriesSent.get(channel).increment();
  }

  @Override
  public void incrementDeliveryFailed(Channel channel) {
    if (closed) return;
    deliveriesFailed.get(channel).increment();
  }

  @Override
  public void incrementRetriesExhausted() {
    if (closed) return;
    retriesExhausted.increment();
  }

  @Override
  public void incrementConfirmations() {
    if (closed) return;
    confirmations.increment();
  }

  @Override
  public void incrementSnoozes() {
    if (closed) return;
    snoozes.increment();
  }

  @Override
  public void recordTickDurationMs(long durationMs) {
    if (closed) return;
    lastTickMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link checkin.CheckinEngine#close()} calls this for the exporter it was built with.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(scheduled, duplicates, escalations, level2Escalations,
        retriesExhausted, confirmations, snoozes, tickDurationGauge));
    meters.addAll(deliveriesSent.values());
    meters.addAll(deliveriesFailed.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
