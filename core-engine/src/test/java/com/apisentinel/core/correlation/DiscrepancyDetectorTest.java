package com.apisentinel.core.correlation;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DiscrepancyDetector}.
 */
class DiscrepancyDetectorTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private DiscrepancyDetector detector;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        detector = new DiscrepancyDetector();
        config = new EngineConfig();
        config.setLogicalServices(Map.of(
                "checkout", List.of("checkout-api", "checkout-api-v2"),
                "payments", List.of("payments-api")));
    }

    @Test
    @DisplayName("The slower environment of a logical service is flagged against the fastest peer")
    void shouldFlagSlowEnvironment() {
        DiscrepancyDetector.Outcome outcome = detector.detect(List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api-v2", "azure", 200),
                latency("checkout-api", "gcp", 110)), T0, config, () -> false);

        assertThat(outcome.getCandidates()).hasSize(1);
        AnomalyCandidate candidate = outcome.getCandidates().get(0);
        assertThat(candidate.getEnvironment()).isEqualTo("azure");
        assertThat(candidate.getCategory()).isEqualTo(AnomalyCategory.ENVIRONMENT_DISCREPANCY);
        assertThat(candidate.getDetectorSource()).isEqualTo(DiscrepancyDetector.NAME);
        assertThat(candidate.getExpectedValue()).isEqualTo(100.0);
        assertThat(candidate.getThreshold()).isCloseTo(130.0, within(1e-9));
        assertThat(candidate.getDeviationScore()).isCloseTo(100.0 * 100 / 150, within(1e-9));
        assertThat(candidate.getTimestamp()).isEqualTo(T0);
        assertThat(outcome.getCleared()).isEmpty();
        assertThat(detector.flaggedSeries())
                .containsExactly(SeriesKey.of("checkout-api-v2", "azure", MetricKind.RESPONSE_TIME));
    }

    @Test
    @DisplayName("Differences within the threshold and single-environment services are ignored")
    void shouldIgnoreSmallDifferences() {
        DiscrepancyDetector.Outcome outcome = detector.detect(List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 120),
                latency("payments-api", "aws", 900)), T0, config, () -> false);

        assertThat(outcome.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Different logical services are never compared")
    void shouldCompareWithinLogicalServiceOnly() {
        DiscrepancyDetector.Outcome outcome = detector.detect(List.of(
                latency("checkout-api", "aws", 100),
                latency("payments-api", "azure", 400)), T0, config, () -> false);

        assertThat(outcome.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Baselines without sufficient history take no part")
    void shouldSkipInsufficientHistory() {
        BaselineSnapshot young = BaselineSnapshot.builder()
                .seriesKey(SeriesKey.of("checkout-api", "azure", MetricKind.RESPONSE_TIME))
                .mean(500)
                .sampleCount(2)
                .insufficientHistory(true)
                .build();

        DiscrepancyDetector.Outcome outcome = detector.detect(List.of(
                latency("checkout-api", "aws", 100), young), T0, config, () -> false);

        assertThat(outcome.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("An error ratio is flagged only above the floor and twice the healthiest peer")
    void shouldFlagErrorRateDiscrepancy() {
        DiscrepancyDetector.Outcome flagged = detector.detect(List.of(
                errorRate("checkout-api", "aws", 0.01),
                errorRate("checkout-api", "azure", 0.08)), T0, config, () -> false);

        assertThat(flagged.getCandidates()).hasSize(1);
        AnomalyCandidate candidate = flagged.getCandidates().get(0);
        assertThat(candidate.getEnvironment()).isEqualTo("azure");
        assertThat(candidate.getThreshold()).isCloseTo(0.05, within(1e-9));
        assertThat(candidate.getDeviationScore()).isCloseTo(87.5, within(1e-9));

        DiscrepancyDetector fresh = new DiscrepancyDetector();
        DiscrepancyDetector.Outcome notDoubled = fresh.detect(List.of(
                errorRate("checkout-api", "aws", 0.04),
                errorRate("checkout-api", "azure", 0.06)), T0, config, () -> false);
        DiscrepancyDetector.Outcome belowFloor = fresh.detect(List.of(
                errorRate("checkout-api", "aws", 0.001),
                errorRate("checkout-api", "azure", 0.04)), T0, config, () -> false);

        assertThat(notDoubled.isEmpty()).isTrue();
        assertThat(belowFloor.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A flagged series is reported once, again on a higher band, and cleared when back in line")
    void shouldTrackFlaggedState() {
        List<BaselineSnapshot> slow = List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 200));
        List<BaselineSnapshot> slower = List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 400));
        List<BaselineSnapshot> recovered = List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 105));

        assertThat(detector.detect(slow, T0, config, () -> false).getCandidates()).hasSize(1);
        assertThat(detector.detect(slow, T0.plusSeconds(30), config, () -> false).isEmpty()).isTrue();

        DiscrepancyDetector.Outcome escalated = detector.detect(slower, T0.plusSeconds(60), config, () -> false);
        assertThat(escalated.getCandidates()).hasSize(1);
        assertThat(escalated.getCandidates().get(0).getDeviationScore()).isEqualTo(100.0);

        DiscrepancyDetector.Outcome cleared = detector.detect(recovered, T0.plusSeconds(90), config, () -> false);
        assertThat(cleared.getCandidates()).isEmpty();
        assertThat(cleared.getCleared())
                .containsExactly(SeriesKey.of("checkout-api", "azure", MetricKind.RESPONSE_TIME));
        assertThat(detector.flaggedSeries()).isEmpty();
    }

    @Test
    @DisplayName("A cancelled pass reports nothing and keeps the flagged state")
    void shouldHonourCancellation() {
        detector.detect(List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 200)), T0, config, () -> false);

        DiscrepancyDetector.Outcome cancelled = detector.detect(List.of(
                latency("checkout-api", "aws", 100)), T0.plusSeconds(30), config, () -> true);

        assertThat(cancelled.isEmpty()).isTrue();
        assertThat(detector.flaggedSeries()).hasSize(1);
    }

    @Test
    @DisplayName("Disabling discrepancy detection clears every flagged series")
    void shouldClearWhenDisabled() {
        detector.detect(List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 200)), T0, config, () -> false);
        config.getCorrelation().setDiscrepancyEnabled(false);

        DiscrepancyDetector.Outcome outcome = detector.detect(List.of(
                latency("checkout-api", "aws", 100),
                latency("checkout-api", "azure", 200)), T0.plusSeconds(30), config, () -> false);

        assertThat(outcome.getCandidates()).isEmpty();
        assertThat(outcome.getCleared()).hasSize(1);
    }

    private static BaselineSnapshot latency(String apiId, String env, double mean) {
        return snapshot(SeriesKey.of(apiId, env, MetricKind.RESPONSE_TIME), mean);
    }

    private static BaselineSnapshot errorRate(String apiId, String env, double mean) {
        return snapshot(SeriesKey.of(apiId, env, MetricKind.ERROR_RATE), mean);
    }

    private static BaselineSnapshot snapshot(SeriesKey key, double mean) {
        return BaselineSnapshot.builder()
                .seriesKey(key)
                .mean(mean)
                .variance(4)
                .percentiles(mean, mean * 1.1, mean * 1.2)
                .sampleCount(50)
                .build();
    }
}
