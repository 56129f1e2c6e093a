package com.apisentinel.core.detection;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ErrorRateDetector}.
 */
class ErrorRateDetectorTest {

    private ErrorRateDetector detector;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        detector = new ErrorRateDetector();
        config = new EngineConfig();
    }

    @Test
    @DisplayName("Should fire when the windowed ratio exceeds its historical p99")
    void shouldFireOnBreach() {
        Optional<AnomalyCandidate> candidate = detector.evaluate(sample(0.2), baseline(30, 200, 0.02), config);

        assertThat(candidate).isPresent();
        AnomalyCandidate c = candidate.get();
        assertThat(c.getCategory()).isEqualTo(AnomalyCategory.ERROR_RATE_BREACH);
        assertThat(c.getObservedValue()).isCloseTo(0.15, within(1e-9));
        assertThat(c.getThreshold()).isCloseTo(0.05, within(1e-9));
        assertThat(c.getDeviationScore()).isGreaterThan(40.0);
    }

    @Test
    @DisplayName("Should NOT fire below the minimum request volume")
    void shouldIgnoreLowVolume() {
        assertThat(detector.evaluate(sample(0.3), baseline(3, 10, 0.0), config)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire below the minimum error ratio even if p99 is lower")
    void shouldApplyMinimumRatio() {
        assertThat(detector.evaluate(sample(0.04), baseline(8, 200, 0.0), config)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when the ratio is within its historical p99")
    void shouldRespectHistoricalP99() {
        assertThat(detector.evaluate(sample(0.15), baseline(30, 200, 0.2), config)).isEmpty();
    }

    @Test
    @DisplayName("Higher request volume yields a higher score for the same ratio")
    void shouldWeighByVolume() {
        double small = detector.evaluate(sample(0.2), baseline(6, 40, 0.02), config)
                .orElseThrow().getDeviationScore();
        double large = detector.evaluate(sample(0.2), baseline(60, 400, 0.02), config)
                .orElseThrow().getDeviationScore();

        assertThat(large).isGreaterThan(small);
    }

    private static MetricSample sample(double ratio) {
        return MetricSample.builder()
                .apiId("orders-api")
                .environment("aws")
                .metricKind(MetricKind.ERROR_RATE)
                .value(ratio)
                .requestCount(40)
                .timestamp(Instant.parse("2026-03-02T10:00:00Z"))
                .build();
    }

    private static BaselineSnapshot baseline(double windowErrors, long windowRequests, double ratioP99) {
        return BaselineSnapshot.builder()
                .seriesKey(SeriesKey.of("orders-api", "aws", MetricKind.ERROR_RATE))
                .mean(0.01)
                .variance(0.0001)
                .sampleCount(20)
                .errorWindow(windowErrors, windowRequests)
                .ratioP99(ratioP99)
                .build();
    }
}
