package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A deviation flagged by a detector for one sample.
 *
 * <p>
 * Immutable. {@code deviationScore} is on the common 0–100 scale shared by all
 * detector types, so downstream severity classification does not depend on
 * which detector produced the candidate.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String candidateId;
    private final String apiId;
    private final String environment;
    private final MetricKind metricKind;
    private final AnomalyCategory category;
    private final double observedValue;
    private final double expectedValue;
    private final double threshold;
    private final BaselineSnapshot baseline;
    private final double deviationScore;
    private final String detectorSource;
    private final Instant timestamp;
    private final String description;

    private AnomalyCandidate(Builder b) {
        this.candidateId = b.candidateId != null ? b.candidateId : "cand-" + UUID.randomUUID();
        this.apiId = Objects.requireNonNull(b.apiId, "apiId must not be null");
        this.environment = Objects.requireNonNull(b.environment, "environment must not be null");
        this.metricKind = Objects.requireNonNull(b.metricKind, "metricKind must not be null");
        this.category = Objects.requireNonNull(b.category, "category must not be null");
        this.detectorSource = Objects.requireNonNull(b.detectorSource, "detectorSource must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.observedValue = b.observedValue;
        this.expectedValue = b.expectedValue;
        this.threshold = b.threshold;
        this.baseline = b.baseline;
        this.deviationScore = Math.max(0.0, Math.min(100.0, b.deviationScore));
        this.description = b.description;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public SeriesKey seriesKey() {
        return SeriesKey.of(apiId, environment, metricKind);
    }

    @JsonIgnore
    public DedupKey dedupKey() {
        return DedupKey.of(apiId, environment, metricKind, category);
    }

    public String getCandidateId() {
        return candidateId;
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

    public AnomalyCategory getCategory() {
        return category;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getThreshold() {
        return threshold;
    }

    public BaselineSnapshot getBaseline() {
        return baseline;
    }

    public double getDeviationScore() {
        return deviationScore;
    }

    public String getDetectorSource() {
        return detectorSource;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Fluent builder for {@link AnomalyCandidate}.
     */
    public static class Builder {
        private String candidateId;
        private String apiId;
        private String environment;
        private MetricKind metricKind;
        private AnomalyCategory category;
        private double observedValue;
        private double expectedValue;
        private double threshold;
        private BaselineSnapshot baseline;
        private double deviationScore;
        private String detectorSource;
        private Instant timestamp;
        private String description;

        public Builder candidateId(String candidateId) {
            this.candidateId = candidateId;
            return this;
        }

        public Builder sample(MetricSample sample) {
            this.apiId = sample.getApiId();
            this.environment = sample.getEnvironment();
            this.metricKind = sample.getMetricKind();
            this.observedValue = sample.getValue();
            this.timestamp = sample.getTimestamp();
            return this;
        }

        public Builder apiId(String apiId) {
            this.apiId = apiId;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder metricKind(MetricKind metricKind) {
            this.metricKind = metricKind;
            return this;
        }

        public Builder category(AnomalyCategory category) {
            this.category = category;
            return this;
        }

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder baseline(BaselineSnapshot baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder deviationScore(double deviationScore) {
            this.deviationScore = deviationScore;
            return this;
        }

        public Builder detectorSource(String detectorSource) {
            this.detectorSource = detectorSource;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @return a new candidate
         * @throws NullPointerException if an identity field, category, detector
         *                              source or timestamp is missing
         */
        public AnomalyCandidate build() {
            return new AnomalyCandidate(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyCandidate that))
            return false;
        return candidateId.equals(that.candidateId);
    }

    @Override
    public int hashCode() {
        return candidateId.hashCode();
    }

    @Override
    public String toString() {
        return "AnomalyCandidate{" +
                "id='" + candidateId + '\'' +
                ", series=" + apiId + '|' + environment + '|' + metricKind +
                ", category=" + category +
                ", observed=" + observedValue +
                ", score=" + String.format("%.1f", deviationScore) +
                ", detector='" + detectorSource + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
