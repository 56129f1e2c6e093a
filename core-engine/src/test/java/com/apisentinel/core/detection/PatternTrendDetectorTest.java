package com.apisentinel.core.detection;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.TrendBucket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PatternTrendDetector}.
 */
class PatternTrendDetectorTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private PatternTrendDetector detector;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        detector = new PatternTrendDetector();
        config = new EngineConfig();
    }

    @Test
    @DisplayName("Should fire on a rising drift above the seasonal expectation")
    void shouldFireOnSustainedDrift() {
        Optional<AnomalyCandidate> candidate = detector.evaluate(sample(), baseline(10, i -> 110 + i), config);

        assertThat(candidate).isPresent();
        assertThat(candidate.get().getCategory()).isEqualTo(AnomalyCategory.SUSTAINED_DRIFT);
        assertThat(candidate.get().getObservedValue()).isEqualTo(119.0);
        assertThat(candidate.get().getExpectedValue()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should NOT fire with fewer buckets than required")
    void shouldNeedEnoughBuckets() {
        assertThat(detector.evaluate(sample(), baseline(9, i -> 110 + i), config)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire if any bucket is back at its expectation")
    void shouldNeedEveryBucketAbove() {
        assertThat(detector.evaluate(sample(), baseline(10, i -> i == 4 ? 100 : 110 + i), config)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on a recovering (falling) trend")
    void shouldIgnoreFallingTrend() {
        assertThat(detector.evaluate(sample(), baseline(10, i -> 119 - i), config)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on a drift smaller than the drift threshold")
    void shouldIgnoreSmallDrift() {
        // sd 2 → deviation 0.5 sigma per bucket
        assertThat(detector.evaluate(sample(), baseline(10, i -> 101), config)).isEmpty();
    }

    @Test
    @DisplayName("Supports every metric kind")
    void shouldSupportAllKinds() {
        assertThat(detector.supports(MetricKind.RESPONSE_TIME)).isTrue();
        assertThat(detector.supports(MetricKind.ERROR_RATE)).isTrue();
    }

    private static MetricSample sample() {
        return MetricSample.builder()
                .apiId("orders-api")
                .environment("aws")
                .metricKind(MetricKind.RESPONSE_TIME)
                .value(120)
                .timestamp(T0.plusSeconds(600))
                .build();
    }

    private static BaselineSnapshot baseline(int bucketCount, IntToDoubleFunction bucketMean) {
        List<TrendBucket> buckets = new ArrayList<>();
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new TrendBucket(T0.plusSeconds(i * 60L), bucketMean.applyAsDouble(i), 6, 100.0));
        }
        return BaselineSnapshot.builder()
                .seriesKey(SeriesKey.of("orders-api", "aws", MetricKind.RESPONSE_TIME))
                .mean(100)
                .variance(4)
                .percentiles(100, 103, 105)
                .sampleCount(60)
                .recentBuckets(buckets)
                .build();
    }
}
