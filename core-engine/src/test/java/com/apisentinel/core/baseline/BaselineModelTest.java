package com.apisentinel.core.baseline;

import com.apisentinel.core.config.BaselineSettings;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineModel}.
 */
class BaselineModelTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final SeriesKey LATENCY = SeriesKey.of("orders-api", "aws", MetricKind.RESPONSE_TIME);

    private BaselineModel model;
    private BaselineSettings settings;

    @BeforeEach
    void setUp() {
        model = new BaselineModel();
        settings = new BaselineSettings();
    }

    @Test
    @DisplayName("First sample is judged against an empty baseline")
    void shouldReportInsufficientHistoryForFirstSample() {
        BaselineSnapshot snapshot = model.update(latency(120, T0), settings);

        assertThat(snapshot.isInsufficientHistory()).isTrue();
        assertThat(snapshot.getSampleCount()).isZero();
        assertThat(model.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Snapshot returned by update excludes the sample being folded in")
    void shouldReturnPriorStatistics() {
        feed(100, 102, 98, 101, 99);

        BaselineSnapshot prior = model.update(latency(140, T0.plusSeconds(300)), settings);

        assertThat(prior.isInsufficientHistory()).isFalse();
        assertThat(prior.getSampleCount()).isEqualTo(5);
        assertThat(prior.getMean()).isCloseTo(100.0, within(1e-9));
        assertThat(prior.getStddev()).isCloseTo(Math.sqrt(2.0), within(1e-9));
        assertThat(prior.getP50()).isCloseTo(100.0, within(1e-9));
        assertThat(prior.getP99()).isCloseTo(102.0, within(1e-9));

        BaselineSnapshot current = model.snapshot(LATENCY, settings).orElseThrow();
        assertThat(current.getSampleCount()).isEqualTo(6);
        assertThat(current.getMean()).isGreaterThan(100.0);
    }

    @Test
    @DisplayName("Late sample within the lateness bound is folded into the moments and flagged")
    void shouldFlagLateSample() {
        feed(100, 102, 98, 101, 99);

        BaselineSnapshot late = model.update(latency(100, T0.plusSeconds(90)), settings);

        assertThat(late.isLate()).isTrue();
        assertThat(late.isDiscarded()).isFalse();
        BaselineSnapshot current = model.snapshot(LATENCY, settings).orElseThrow();
        assertThat(current.getSampleCount()).isEqualTo(6);
        assertThat(current.getLateCount()).isEqualTo(1);
        assertThat(current.getWindowEnd()).isEqualTo(T0.plusSeconds(240));
    }

    @Test
    @DisplayName("Sample older than the lateness bound is discarded without touching the baseline")
    void shouldDiscardTooLateSample() {
        feed(100, 102, 98, 101, 99);

        BaselineSnapshot discarded = model.update(latency(500, T0.minus(Duration.ofMinutes(10))), settings);

        assertThat(discarded.isDiscarded()).isTrue();
        BaselineSnapshot current = model.snapshot(LATENCY, settings).orElseThrow();
        assertThat(current.getSampleCount()).isEqualTo(5);
        assertThat(current.getMean()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Malformed sample is rejected")
    void shouldRejectMalformedSample() {
        MetricSample negative = MetricSample.builder()
                .apiId("orders-api").environment("aws").metricKind(MetricKind.RESPONSE_TIME)
                .value(-1).timestamp(T0).build();

        assertThatThrownBy(() -> model.update(negative, settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite non-negative");
        assertThat(model.size()).isZero();
    }

    @Test
    @DisplayName("Error window keeps only the most recent samples")
    void shouldSlideErrorWindow() {
        for (int i = 0; i < 8; i++) {
            model.update(MetricSample.builder()
                    .apiId("orders-api").environment("aws").metricKind(MetricKind.ERROR_RATE)
                    .value(i < 3 ? 0.5 : 0.01).requestCount(100)
                    .timestamp(T0.plusSeconds(i * 10L)).build(), settings);
        }

        BaselineSnapshot current = model
                .snapshot(SeriesKey.of("orders-api", "aws", MetricKind.ERROR_RATE), settings)
                .orElseThrow();
        assertThat(current.getWindowRequests()).isEqualTo(500);
        assertThat(current.getWindowErrorRatio()).isCloseTo(0.01, within(1e-9));
        assertThat(current.getRatioP99()).isGreaterThan(0.01);
    }

    @Test
    @DisplayName("Closed buckets carry their mean and expected value")
    void shouldCloseTrendBuckets() {
        for (int i = 0; i < 4; i++) {
            model.update(latency(100 + i * 10, T0.plusSeconds(i * 60L)), settings);
        }

        BaselineSnapshot current = model.snapshot(LATENCY, settings).orElseThrow();

        assertThat(current.getRecentBuckets()).hasSize(3);
        assertThat(current.getRecentBuckets().get(0).getStart()).isEqualTo(T0);
        assertThat(current.getRecentBuckets().get(2).getMean()).isCloseTo(120.0, within(1e-9));
        assertThat(current.getRecentBuckets().get(0).getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Idle series are evicted")
    void shouldEvictIdleSeries() {
        feed(100, 101);

        assertThat(model.evictIdle(T0.plus(Duration.ofHours(1)), settings)).isZero();
        assertThat(model.evictIdle(T0.plus(Duration.ofDays(2)), settings)).isEqualTo(1);
        assertThat(model.snapshot(LATENCY, settings)).isEmpty();

        BaselineSnapshot fresh = model.update(latency(100, T0.plus(Duration.ofDays(2))), settings);
        assertThat(fresh.getSampleCount()).isZero();
    }

    @Test
    @DisplayName("Concurrent updates of one series lose no sample")
    void shouldFoldConcurrentUpdatesOfOneSeries() throws Exception {
        int threads = 8;
        int total = 5000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int stripe = t;
                futures.add(pool.submit(() -> {
                    for (int i = stripe; i < total; i += threads) {
                        model.update(latency(100 + i % 50, T0.plusMillis(i)), settings);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        BaselineSnapshot current = model.snapshot(LATENCY, settings).orElseThrow();
        assertThat(model.size()).isEqualTo(1);
        assertThat(current.getSampleCount()).isEqualTo(total);
        assertThat(current.getVariance()).isGreaterThanOrEqualTo(0.0);
        assertThat(current.getMean()).isBetween(100.0, 149.0);
        assertThat(current.getP50()).isLessThanOrEqualTo(current.getP95());
        assertThat(current.getP95()).isLessThanOrEqualTo(current.getP99());
        assertThat(current.getP99()).isLessThanOrEqualTo(149.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void feed(double... values) {
        for (int i = 0; i < values.length; i++) {
            model.update(latency(values[i], T0.plusSeconds(i * 60L)), settings);
        }
    }

    private static MetricSample latency(double value, Instant ts) {
        return MetricSample.builder()
                .apiId("orders-api")
                .environment("aws")
                .metricKind(MetricKind.RESPONSE_TIME)
                .value(value)
                .timestamp(ts)
                .build();
    }
}
