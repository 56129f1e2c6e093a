package com.apisentinel.core.sink;

import com.apisentinel.core.model.NotificationIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers engine output to the sinks off the ingestion path.
 *
 * <p>
 * Each delivery runs on the supplied executor and is attempted up to
 * {@code attempts} times with exponential backoff. A delivery that still
 * fails is logged and counted; it never reaches the caller.
 * </p>
 *
 * @since 1.0.0
 */
public final class AsyncDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncDispatcher.class);

    @FunctionalInterface
    private interface Delivery {
        void run() throws Exception;
    }

    private final Executor executor;
    private final RecordSink recordSink;
    private final NotificationSink notificationSink;
    private final int attempts;
    private final long backoffMillis;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public AsyncDispatcher(Executor executor, RecordSink recordSink, NotificationSink notificationSink,
            int attempts, long backoffMillis) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.recordSink = Objects.requireNonNull(recordSink, "recordSink must not be null");
        this.notificationSink = Objects.requireNonNull(notificationSink, "notificationSink must not be null");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got: " + attempts);
        }
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must be >= 0, got: " + backoffMillis);
        }
        this.attempts = attempts;
        this.backoffMillis = backoffMillis;
    }

    /**
     * @return completes with {@code true} once stored, {@code false} if every
     *         attempt failed
     */
    public CompletableFuture<Boolean> dispatch(EngineRecord record) {
        return submit(record.toString(), () -> recordSink.append(record));
    }

    public CompletableFuture<Boolean> dispatch(NotificationIntent intent) {
        return submit("notification " + intent.getIntentId(), () -> notificationSink.deliver(intent));
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private CompletableFuture<Boolean> submit(String what, Delivery delivery) {
        try {
            return CompletableFuture.supplyAsync(() -> deliverWithRetry(what, delivery), executor);
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            LOG.error("Dropped {}: dispatcher is shut down", what);
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean deliverWithRetry(String what, Delivery delivery) {
        long backoff = backoffMillis;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                delivery.run();
                delivered.incrementAndGet();
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                if (attempt == attempts) {
                    LOG.error("Delivery of {} failed after {} attempt(s): {}", what, attempts, e.getMessage(), e);
                    break;
                }
                LOG.warn("Delivery of {} failed (attempt {}/{}), retrying in {} ms: {}",
                        what, attempt, attempts, backoff, e.getMessage());
                if (!sleep(backoff)) {
                    break;
                }
                backoff *= 2;
            }
        }
        failed.incrementAndGet();
        return false;
    }

    private static boolean sleep(long millis) {
        if (millis == 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
