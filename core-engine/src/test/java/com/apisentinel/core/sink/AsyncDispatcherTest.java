package com.apisentinel.core.sink;

import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AsyncDispatcher}.
 */
class AsyncDispatcherTest {

    private static final EngineRecord RECORD = EngineRecord.anomaly(AnomalyCandidate.builder()
            .candidateId("cand-1")
            .apiId("orders-api")
            .environment("aws")
            .metricKind(MetricKind.RESPONSE_TIME)
            .category(AnomalyCategory.LATENCY_SPIKE)
            .detectorSource("response_time")
            .deviationScore(80)
            .timestamp(Instant.parse("2026-03-02T10:00:00Z"))
            .build());

    @Test
    @DisplayName("Should deliver a record on the first attempt")
    void shouldDeliver() {
        List<EngineRecord> stored = new ArrayList<>();
        AsyncDispatcher dispatcher = new AsyncDispatcher(Runnable::run, stored::add,
                NotificationSink.discarding(), 3, 0);

        assertThat(dispatcher.dispatch(RECORD).join()).isTrue();
        assertThat(stored).containsExactly(RECORD);
        assertThat(RECORD.getRecordId()).isEqualTo("anomaly:cand-1");
        assertThat(dispatcher.deliveredCount()).isEqualTo(1);
        assertThat(dispatcher.failedCount()).isZero();
    }

    @Test
    @DisplayName("Should retry a failing sink until it succeeds")
    void shouldRetryTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        AsyncDispatcher dispatcher = new AsyncDispatcher(Runnable::run, record -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("store unavailable");
            }
        }, NotificationSink.discarding(), 3, 1);

        assertThat(dispatcher.dispatch(RECORD).join()).isTrue();
        assertThat(calls).hasValue(3);
        assertThat(dispatcher.failedCount()).isZero();
    }

    @Test
    @DisplayName("Should give up after the configured attempts without throwing")
    void shouldReportPermanentFailure() {
        AtomicInteger calls = new AtomicInteger();
        AsyncDispatcher dispatcher = new AsyncDispatcher(Runnable::run, record -> {
            calls.incrementAndGet();
            throw new IOException("disk full");
        }, NotificationSink.discarding(), 2, 0);

        assertThat(dispatcher.dispatch(RECORD).join()).isFalse();
        assertThat(calls).hasValue(2);
        assertThat(dispatcher.failedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop deliveries once the executor is shut down")
    void shouldHandleRejectedExecution() throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        assertThat(executor.awaitTermination(1, TimeUnit.SECONDS)).isTrue();
        AsyncDispatcher dispatcher = new AsyncDispatcher(executor, RecordSink.discarding(),
                NotificationSink.discarding(), 1, 0);

        assertThat(dispatcher.dispatch(RECORD).join()).isFalse();
        assertThat(dispatcher.failedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a non-positive attempt count")
    void shouldValidateAttempts() {
        assertThatThrownBy(() -> new AsyncDispatcher(Runnable::run, RecordSink.discarding(),
                NotificationSink.discarding(), 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attempts");
    }
}
