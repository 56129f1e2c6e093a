package com.apisentinel.core.prediction;

import com.apisentinel.core.baseline.BaselineModel;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.Prediction;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.TrendBucket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PredictiveEngine}.
 */
class PredictiveEngineTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final SeriesKey KEY = SeriesKey.of("orders-api", "aws", MetricKind.RESPONSE_TIME);

    private BaselineModel baselines;
    private AnomalyHistory history;
    private PredictiveEngine engine;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        baselines = new BaselineModel();
        history = new AnomalyHistory();
        engine = new PredictiveEngine(baselines, history);
        config = new EngineConfig();
    }

    @Test
    @DisplayName("A rising trend is projected across the breach threshold")
    void shouldPredictBreachOnRisingTrend() {
        Prediction p = engine.predict(snapshot(false, 10, i -> 100 + 0.5 * i), T0.plusSeconds(540), config);

        assertThat(p.isLowConfidence()).isFalse();
        assertThat(p.getBreachThreshold()).isCloseTo(106.0, within(1e-9));
        assertThat(p.getTrendSlopePerMinute()).isCloseTo(0.5, within(1e-9));
        assertThat(p.getCurrentValue()).isCloseTo(104.5, within(1e-6));
        assertThat(p.getProjectedValue()).isCloseTo(119.5, within(1e-6));
        assertThat(p.getProbabilityOfBreach()).isGreaterThan(0.99);
        assertThat(p.getExpectedTimeToBreach()).isEqualTo(Duration.ofMinutes(3));
        assertThat(p.getExpectedImpactScore()).isGreaterThan(0.0);
        assertThat(p.getConfidence()).isBetween(0.9, 1.0);
        assertThat(p.getForecastHorizon()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("A flat series has a small breach probability and no time to breach")
    void shouldPredictNoBreachOnFlatSeries() {
        Prediction p = engine.predict(snapshot(false, 10, i -> 100), T0.plusSeconds(540), config);

        assertThat(p.getProbabilityOfBreach()).isLessThan(0.01);
        assertThat(p.getExpectedTimeToBreach()).isNull();
        assertThat(p.getExpectedImpactScore()).isZero();
    }

    @Test
    @DisplayName("Recent anomalies raise the breach probability")
    void shouldBoostProbabilityWithRecentAnomalies() {
        double quiet = engine.predict(snapshot(false, 10, i -> 100), T0.plusSeconds(540), config)
                .getProbabilityOfBreach();
        for (int i = 0; i < 3; i++) {
            history.record(anomaly(T0.plusSeconds(i * 60L)));
        }

        Prediction p = engine.predict(snapshot(false, 10, i -> 100), T0.plusSeconds(540), config);

        assertThat(p.getRecentAnomalyCount()).isEqualTo(3);
        assertThat(p.getProbabilityOfBreach()).isGreaterThan(quiet + 0.3);
    }

    @Test
    @DisplayName("Insufficient history still yields a prediction, flagged as low confidence")
    void shouldFlagLowConfidence() {
        Prediction warmingUp = engine.predict(snapshot(true, 10, i -> 100), T0.plusSeconds(540), config);
        Prediction fewBuckets = engine.predict(snapshot(false, 2, i -> 100), T0.plusSeconds(540), config);

        assertThat(warmingUp.isLowConfidence()).isTrue();
        assertThat(warmingUp.getReason()).contains("insufficient baseline history");
        assertThat(warmingUp.getConfidence()).isZero();
        assertThat(fewBuckets.isLowConfidence()).isTrue();
        assertThat(fewBuckets.getReason()).contains("insufficient trend history");
    }

    @Test
    @DisplayName("Run predicts every known series and keeps the latest per series")
    void shouldRunAcrossSeries() {
        feed("aws", 3);
        feed("azure", 3);

        List<Prediction> produced = engine.run(T0.plusSeconds(600), config, () -> false);

        assertThat(produced).hasSize(2);
        assertThat(engine.latest("orders-api", null)).hasSize(2);
        assertThat(engine.latest("orders-api", "azure")).extracting(Prediction::getEnvironment)
                .containsExactly("azure");
        assertThat(engine.latest("payments-api", null)).isEmpty();

        engine.run(T0.plusSeconds(660), config, () -> false);
        assertThat(engine.latest(null, null)).hasSize(2);
    }

    @Test
    @DisplayName("A cancelled run stops before predicting")
    void shouldStopWhenCancelled() {
        feed("aws", 3);

        assertThat(engine.run(T0.plusSeconds(600), config, () -> true)).isEmpty();
        assertThat(engine.latest(null, null)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void feed(String env, int count) {
        for (int i = 0; i < count; i++) {
            baselines.update(MetricSample.builder()
                    .apiId("orders-api").environment(env).metricKind(MetricKind.RESPONSE_TIME)
                    .value(100).timestamp(T0.plusSeconds(i * 60L)).build(), config.getBaseline());
        }
    }

    private static BaselineSnapshot snapshot(boolean insufficient, int bucketCount, IntToDoubleFunction mean) {
        List<TrendBucket> buckets = new ArrayList<>();
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new TrendBucket(T0.plusSeconds(i * 60L), mean.applyAsDouble(i), 6, 100));
        }
        return BaselineSnapshot.builder()
                .seriesKey(KEY)
                .mean(100)
                .variance(4)
                .percentiles(100, 103, 105)
                .sampleCount(insufficient ? 2 : 60)
                .insufficientHistory(insufficient)
                .recentBuckets(buckets)
                .build();
    }

    private static AnomalyCandidate anomaly(Instant ts) {
        return AnomalyCandidate.builder()
                .apiId(KEY.getApiId())
                .environment(KEY.getEnvironment())
                .metricKind(KEY.getMetricKind())
                .category(AnomalyCategory.LATENCY_SPIKE)
                .detectorSource("response_time")
                .deviationScore(80)
                .timestamp(ts)
                .build();
    }
}
