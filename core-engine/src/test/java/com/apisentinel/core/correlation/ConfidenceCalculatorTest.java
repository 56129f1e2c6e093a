package com.apisentinel.core.correlation;

import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.MetricKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ConfidenceCalculator}.
 */
class ConfidenceCalculatorTest {

    @Test
    @DisplayName("Individual confidence is capped below certainty")
    void shouldCapIndividualConfidence() {
        assertThat(ConfidenceCalculator.individual(candidate("aws", 100))).isCloseTo(0.9, within(1e-9));
        assertThat(ConfidenceCalculator.individual(candidate("aws", 50))).isCloseTo(0.45, within(1e-9));
    }

    @Test
    @DisplayName("Agreement across environments beats every individual confidence")
    void shouldExceedIndividualConfidences() {
        AnomalyCandidate aws = candidate("aws", 80);
        AnomalyCandidate azure = candidate("azure", 70);

        double combined = ConfidenceCalculator.combined(List.of(aws, azure));

        assertThat(combined)
                .isGreaterThan(ConfidenceCalculator.individual(aws))
                .isGreaterThan(ConfidenceCalculator.individual(azure))
                .isLessThan(1.0);
        assertThat(combined).isCloseTo(1 - 0.28 * 0.37 * 0.5, within(1e-9));
    }

    @Test
    @DisplayName("Repeats within one environment get no cross-environment discount")
    void shouldNotDiscountSingleEnvironment() {
        double combined = ConfidenceCalculator.combined(List.of(candidate("aws", 80), candidate("aws", 70)));

        assertThat(combined).isCloseTo(1 - 0.28 * 0.37, within(1e-9));
    }

    @Test
    @DisplayName("No members means no confidence")
    void shouldBeZeroForEmpty() {
        assertThat(ConfidenceCalculator.combined(List.of())).isZero();
    }

    private static AnomalyCandidate candidate(String env, double score) {
        return AnomalyCandidate.builder()
                .apiId("orders-api")
                .environment(env)
                .metricKind(MetricKind.RESPONSE_TIME)
                .category(AnomalyCategory.LATENCY_SPIKE)
                .detectorSource("response_time")
                .deviationScore(score)
                .timestamp(Instant.parse("2026-03-02T10:00:00Z"))
                .build();
    }
}
