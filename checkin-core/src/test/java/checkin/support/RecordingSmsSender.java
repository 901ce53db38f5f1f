package checkin.support;

import checkin.spi.SmsResult;
import checkin.spi.SmsSender;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * SmsSender that records every send. Succeeds by default; per-phone behavior can be overridden.
 */
public final class RecordingSmsSender implements SmsSender {
  public final List<String> phones = new CopyOnWriteArrayList<>();
  public final List<String> bodies = new CopyOnWriteArrayList<>();
  private final Map<String, Function<String, SmsResult>> overrides = new ConcurrentHashMap<>();
  private final AtomicInteger sequence = new AtomicInteger();
  private volatile boolean failAll;

  public RecordingSmsSender failFor(String phone, String error) {
    overrides.put(phone, body -> SmsResult.failed("30003", error));
    return this;
  }

  public RecordingSmsSender throwFor(String phone, RuntimeException error) {
    overrides.put(phone, body -> {
      throw error;
    });
    return this;
  }

  public RecordingSmsSender succeedFor(String phone) {
    overrides.remove(phone);
    return this;
  }

  public RecordingSmsSender failAll(boolean failAll) {
    this.failAll = failAll;
    return this;
  }

  @Override
  public SmsResult send(String phone, String body) {
    phones.add(phone);
    bodies.add(body);
    Function<String, SmsResult> override = overrides.get(phone);
    if (override != null) {
      return override.apply(body);
    }
    if (failAll) {
      return SmsResult.failed("30008", "Unknown error");
    }
    return SmsResult.sent("SM" + sequence.incrementAndGet(), "queued");
  }

  public int sendCount() {
    return phones.size();
  }
}
