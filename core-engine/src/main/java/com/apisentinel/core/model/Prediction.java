package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Forecast of whether a series will breach its anomaly threshold within the
 * forecast horizon.
 *
 * <p>
 * A prediction with {@link #isLowConfidence()} set is not a statement of
 * "no risk": it means no reliable forecast could be made, and
 * {@link #getReason()} says why.
 * </p>
 *
 * @since 1.0.0
 */
public final class Prediction implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String apiId;
    private final String environment;
    private final MetricKind metricKind;
    private final Duration forecastHorizon;
    private final double probabilityOfBreach;
    private final double expectedImpactScore;
    private final double confidence;
    private final boolean lowConfidence;
    private final String reason;
    private final double currentValue;
    private final double projectedValue;
    private final double breachThreshold;
    private final double trendSlopePerMinute;
    private final Duration expectedTimeToBreach;
    private final int recentAnomalyCount;
    private final Instant generatedAt;

    private Prediction(Builder b) {
        this.apiId = Objects.requireNonNull(b.apiId, "apiId must not be null");
        this.environment = Objects.requireNonNull(b.environment, "environment must not be null");
        this.metricKind = Objects.requireNonNull(b.metricKind, "metricKind must not be null");
        this.forecastHorizon = Objects.requireNonNull(b.forecastHorizon, "forecastHorizon must not be null");
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.probabilityOfBreach = clamp01(b.probabilityOfBreach);
        this.expectedImpactScore = Math.max(0.0, Math.min(100.0, b.expectedImpactScore));
        this.confidence = clamp01(b.confidence);
        this.lowConfidence = b.lowConfidence;
        this.reason = b.reason;
        this.currentValue = b.currentValue;
        this.projectedValue = b.projectedValue;
        this.breachThreshold = b.breachThreshold;
        this.trendSlopePerMinute = b.trendSlopePerMinute;
        this.expectedTimeToBreach = b.expectedTimeToBreach;
        this.recentAnomalyCount = b.recentAnomalyCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public SeriesKey seriesKey() {
        return SeriesKey.of(apiId, environment, metricKind);
    }

    public String getApiId() {
        return apiId;
    }

    public String getEnvironment() {
        return environment;
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    public Duration getForecastHorizon() {
        return forecastHorizon;
    }

    public double getProbabilityOfBreach() {
        return probabilityOfBreach;
    }

    public double getExpectedImpactScore() {
        return expectedImpactScore;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public String getReason() {
        return reason;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getProjectedValue() {
        return projectedValue;
    }

    public double getBreachThreshold() {
        return breachThreshold;
    }

    public double getTrendSlopePerMinute() {
        return trendSlopePerMinute;
    }

    public Duration getExpectedTimeToBreach() {
        return expectedTimeToBreach;
    }

    public int getRecentAnomalyCount() {
        return recentAnomalyCount;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    /**
     * Fluent builder for {@link Prediction}.
     */
    public static class Builder {
        private String apiId;
        private String environment;
        private MetricKind metricKind;
        private Duration forecastHorizon;
        private double probabilityOfBreach;
        private double expectedImpactScore;
        private double confidence;
        private boolean lowConfidence;
        private String reason;
        private double currentValue;
        private double projectedValue;
        private double breachThreshold;
        private double trendSlopePerMinute;
        private Duration expectedTimeToBreach;
        private int recentAnomalyCount;
        private Instant generatedAt;

        public Builder seriesKey(SeriesKey key) {
            this.apiId = key.getApiId();
            this.environment = key.getEnvironment();
            this.metricKind = key.getMetricKind();
            return this;
        }

        public Builder forecastHorizon(Duration forecastHorizon) {
            this.forecastHorizon = forecastHorizon;
            return this;
        }

        public Builder probabilityOfBreach(double probabilityOfBreach) {
            this.probabilityOfBreach = probabilityOfBreach;
            return this;
        }

        public Builder expectedImpactScore(double expectedImpactScore) {
            this.expectedImpactScore = expectedImpactScore;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder lowConfidence(boolean lowConfidence, String reason) {
            this.lowConfidence = lowConfidence;
            this.reason = reason;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder projectedValue(double projectedValue) {
            this.projectedValue = projectedValue;
            return this;
        }

        public Builder breachThreshold(double breachThreshold) {
            this.breachThreshold = breachThreshold;
            return this;
        }

        public Builder trendSlopePerMinute(double trendSlopePerMinute) {
            this.trendSlopePerMinute = trendSlopePerMinute;
            return this;
        }

        public Builder expectedTimeToBreach(Duration expectedTimeToBreach) {
            this.expectedTimeToBreach = expectedTimeToBreach;
            return this;
        }

        public Builder recentAnomalyCount(int recentAnomalyCount) {
            this.recentAnomalyCount = recentAnomalyCount;
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public Prediction build() {
            return new Prediction(this);
        }
    }

    @Override
    public String toString() {
        return "Prediction{" +
                "series=" + apiId + '|' + environment + '|' + metricKind +
                ", probability=" + String.format("%.3f", probabilityOfBreach) +
                ", impact=" + String.format("%.1f", expectedImpactScore) +
                ", confidence=" + String.format("%.2f", confidence) +
                ", lowConfidence=" + lowConfidence +
                ", generatedAt=" + generatedAt +
                '}';
    }
}
