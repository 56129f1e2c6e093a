package com.apisentinel.core.detection;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.config.EngineConfigLoader;
import com.apisentinel.core.config.EnvironmentProfile;
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
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResponseTimeDetector}.
 */
class ResponseTimeDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private ResponseTimeDetector detector;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        detector = new ResponseTimeDetector();
        config = new EngineConfig();
    }

    @Test
    @DisplayName("Should NOT fire at exactly mean + k·sigma")
    void shouldNotFireAtThreshold() {
        // mean 100, sd 2, k 3 → threshold 106
        assertThat(detector.evaluate(sample(106.0), baseline(100, 4, 104, 10), config)).isEmpty();
    }

    @Test
    @DisplayName("Should fire just above mean + k·sigma when also above p99")
    void shouldFireAboveThreshold() {
        Optional<AnomalyCandidate> candidate = detector.evaluate(sample(106.5), baseline(100, 4, 104, 10), config);

        assertThat(candidate).isPresent();
        AnomalyCandidate c = candidate.get();
        assertThat(c.getCategory()).isEqualTo(AnomalyCategory.LATENCY_SPIKE);
        assertThat(c.getDetectorSource()).isEqualTo(ResponseTimeDetector.NAME);
        assertThat(c.getExpectedValue()).isEqualTo(100.0);
        assertThat(c.getThreshold()).isEqualTo(106.0);
        assertThat(c.getDeviationScore()).isGreaterThan(0.0).isLessThan(40.0);
    }

    @Test
    @DisplayName("Should NOT fire when value is above mean + k·sigma but within the recent p99")
    void shouldRespectP99() {
        assertThat(detector.evaluate(sample(108.0), baseline(100, 4, 110, 10), config)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire while the baseline is warming up")
    void shouldNotFireWithInsufficientHistory() {
        BaselineSnapshot warmingUp = BaselineSnapshot.builder()
                .seriesKey(SeriesKey.of("orders-api", "aws", MetricKind.RESPONSE_TIME))
                .mean(100).variance(4).percentiles(100, 102, 104).sampleCount(2)
                .insufficientHistory(true)
                .build();

        assertThat(detector.evaluate(sample(10_000), warmingUp, config)).isEmpty();
    }

    @Test
    @DisplayName("A large spike saturates towards the top of the score range")
    void shouldScoreLargeSpikeHigh() {
        Optional<AnomalyCandidate> candidate = detector.evaluate(sample(140.0), baseline(100, 2, 102, 5), config);

        assertThat(candidate).isPresent();
        assertThat(candidate.get().getDeviationScore()).isGreaterThan(99.0).isLessThanOrEqualTo(100.0);
    }

    @Test
    @DisplayName("Environment profile sensitivity raises the score of the same deviation")
    void shouldApplyEnvironmentSensitivity() {
        EnvironmentProfile relaxed = new EnvironmentProfile();
        relaxed.setSensitivity(0.5);
        EnvironmentProfile strict = new EnvironmentProfile();
        strict.setSensitivity(2.0);
        config.setEnvironments(Map.of("aws", relaxed, "azure", strict));

        double awsScore = detector.evaluate(sample("aws", 110.0), baseline(100, 4, 104, 10), config)
                .orElseThrow().getDeviationScore();
        double azureScore = detector.evaluate(sample("azure", 110.0), baseline(100, 4, 104, 10), config)
                .orElseThrow().getDeviationScore();

        assertThat(azureScore).isGreaterThan(awsScore);
    }

    @Test
    @DisplayName("Only supports response time series")
    void shouldSupportResponseTimeOnly() {
        assertThat(detector.supports(MetricKind.RESPONSE_TIME)).isTrue();
        assertThat(detector.supports(MetricKind.ERROR_RATE)).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    @Test
    @DisplayName("The same deviation scores lower in a cloud region than on premises")
    void shouldTolerateCloudJitter() {
        EngineConfig bundled = EngineConfigLoader.load(null);
        // mean 100, sd 2: 112 is six sigma out
        BaselineSnapshot baseline = baseline(100, 4, 104, 10);

        double onPremises = detector.evaluate(sample("on-premises", 112), baseline, bundled)
                .orElseThrow().getDeviationScore();
        double aws = detector.evaluate(sample("aws", 112), baseline, bundled)
                .orElseThrow().getDeviationScore();

        assertThat(onPremises).isGreaterThan(aws);
        // 106 is beyond 2.5 sigma but within 3.5 sigma
        assertThat(detector.evaluate(sample("on-premises", 106), baseline, bundled)).isPresent();
        assertThat(detector.evaluate(sample("aws", 106), baseline, bundled)).isEmpty();
    }

    private static MetricSample sample(double value) {
        return sample("aws", value);
    }

    private static MetricSample sample(String env, double value) {
        return MetricSample.builder()
                .apiId("orders-api")
                .environment(env)
                .metricKind(MetricKind.RESPONSE_TIME)
                .value(value)
                .timestamp(NOW)
                .build();
    }

    private static BaselineSnapshot baseline(double mean, double variance, double p99, long count) {
        return BaselineSnapshot.builder()
                .seriesKey(SeriesKey.of("orders-api", "aws", MetricKind.RESPONSE_TIME))
                .mean(mean)
                .variance(variance)
                .percentiles(mean, p99, p99)
                .sampleCount(count)
                .build();
    }
}
