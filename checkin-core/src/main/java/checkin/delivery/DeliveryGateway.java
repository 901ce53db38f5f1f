package checkin.delivery;

import checkin.spi.PushMessage;
import checkin.spi.PushResult;
import checkin.spi.PushSender;
import checkin.spi.SmsResult;
import checkin.spi.SmsSender;
import checkin.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs provider calls with a bounded timeout on a bounded pool. A timeout, an exception, a
 * {@code null} answer or a full pool all come back as a failed result, so callers only ever
 * branch on {@code success}.
 */
public final class DeliveryGateway implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryGateway.class.getName());

    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CONCURRENT_SENDS = 64;

    private final SmsSender smsSender;
    private final PushSender pushSender;
    private final long timeoutMs;
    private final int maxConcurrentSends;
    private final ExecutorService executor;

    public DeliveryGateway(SmsSender smsSender, PushSender pushSender) {
        this(smsSender, pushSender, DEFAULT_SEND_TIMEOUT);
    }

    /**
     * @param smsSender   SMS channel
     * @param pushSender  push channel, or {@code null} for {@link PushSender#DISABLED}
     * @param sendTimeout upper bound for a single provider call, &gt; 0
     */
    public DeliveryGateway(SmsSender smsSender, PushSender pushSender, Duration sendTimeout) {
        this(smsSender, pushSender, sendTimeout, DEFAULT_MAX_CONCURRENT_SENDS);
    }

    /**
     * @param maxConcurrentSends provider calls allowed in flight at once, &gt; 0; further calls
     *                           fail immediately
     */
    public DeliveryGateway(SmsSender smsSender, PushSender pushSender, Duration sendTimeout,
                           int maxConcurrentSends) {
        this.smsSender = Objects.requireNonNull(smsSender, "smsSender");
        this.pushSender = pushSender != null ? pushSender : PushSender.DISABLED;
        Objects.requireNonNull(sendTimeout, "sendTimeout");
        if (sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("sendTimeout must be positive");
        }
        if (maxConcurrentSends <= 0) {
            throw new IllegalArgumentException("maxConcurrentSends must be positive");
        }
        this.timeoutMs = sendTimeout.toMillis();
        this.maxConcurrentSends = maxConcurrentSends;
        // A sender that ignores interruption keeps its thread past the timeout, so the cap counts those too.
        this.executor = new ThreadPoolExecutor(0, maxConcurrentSends, 60L, TimeUnit.SECONDS,
            new SynchronousQueue<>(), new DaemonThreadFactory("checkin-send-"), new ThreadPoolExecutor.AbortPolicy());
    }

    public SmsResult sendSms(String phone, String body) {
        try {
            SmsResult result = call(() -> smsSender.send(phone, body));
            return result != null ? result : SmsResult.failed(null, "SMS sender returned no result");
        } catch (TimeoutException e) {
            return SmsResult.failed(null, "SMS send timed out after " + timeoutMs + " ms");
        } catch (RejectedExecutionException e) {
            return SmsResult.failed(null, saturated());
        } catch (Exception e) {
            logger.log(Level.WARNING, "SMS sender threw", e);
            return SmsResult.failed(null, describe(e));
        }
    }

    public PushResult sendPush(PushMessage message) {
        try {
            PushResult result = call(() -> pushSender.send(message));
            return result != null ? result : PushResult.failed("push sender returned no result");
        } catch (TimeoutException e) {
            return PushResult.failed("push send timed out after " + timeoutMs + " ms");
        } catch (RejectedExecutionException e) {
            return PushResult.failed(saturated());
        } catch (Exception e) {
            logger.log(Level.WARNING, "Push sender threw", e);
            return PushResult.failed(describe(e));
        }
    }

    private <T> T call(Callable<T> task) throws Exception {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    private String saturated() {
        logger.log(Level.WARNING, "All {0} send slots busy, failing send", maxConcurrentSends);
        return "send rejected: " + maxConcurrentSends + " sends already in flight";
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null ? message : t.getClass().getSimpleName();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
