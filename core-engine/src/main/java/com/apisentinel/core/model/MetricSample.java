package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One normalized telemetry observation produced by the collector.
 *
 * <p>
 * Immutable. For {@link MetricKind#ERROR_RATE} samples {@code value} is the
 * error ratio in [0, 1] over {@code requestCount} requests; a single request
 * is reported as value 0 or 1 with a count of 1.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Construction never throws on bad data: malformed samples are detected with
 * {@link #validationError()} and dropped by the engine, so one bad record
 * cannot stop ingestion.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String apiId;
    private final String environment;
    private final MetricKind metricKind;
    private final double value;
    private final Instant timestamp;
    private final long requestCount;

    @JsonCreator
    public MetricSample(@JsonProperty("apiId") String apiId,
            @JsonProperty("environment") String environment,
            @JsonProperty("metricKind") MetricKind metricKind,
            @JsonProperty("value") double value,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("requestCount") Long requestCount) {
        this.apiId = apiId;
        this.environment = environment;
        this.metricKind = metricKind;
        this.value = value;
        this.timestamp = timestamp;
        this.requestCount = requestCount != null ? requestCount : 1L;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check the sample for data-quality problems.
     *
     * @return a description of the first problem found, or empty if the
     *         sample is well formed
     */
    public Optional<String> validationError() {
        if (apiId == null || apiId.isBlank()) {
            return Optional.of("apiId is missing");
        }
        if (environment == null || environment.isBlank()) {
            return Optional.of("environment is missing");
        }
        if (metricKind == null) {
            return Optional.of("metricKind is missing");
        }
        if (timestamp == null) {
            return Optional.of("timestamp is missing");
        }
        if (!Double.isFinite(value) || value < 0) {
            return Optional.of("value must be a finite non-negative number, got: " + value);
        }
        if (metricKind == MetricKind.ERROR_RATE && value > 1.0) {
            return Optional.of("error ratio must be within [0, 1], got: " + value);
        }
        if (requestCount < 1) {
            return Optional.of("requestCount must be >= 1, got: " + requestCount);
        }
        return Optional.empty();
    }

    /**
     * @return the series this sample belongs to
     * @throws NullPointerException if an identity field is missing
     */
    @JsonIgnore
    public SeriesKey seriesKey() {
        return SeriesKey.of(apiId, environment, metricKind);
    }

    /**
     * @return number of failed requests represented by an error-rate sample
     */
    @JsonIgnore
    public double errorCount() {
        return value * requestCount;
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

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getRequestCount() {
        return requestCount;
    }

    /**
     * Fluent builder, mainly for programmatic producers and tests.
     */
    public static class Builder {
        private String apiId;
        private String environment;
        private MetricKind metricKind;
        private double value;
        private Instant timestamp;
        private Long requestCount;

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

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder requestCount(long requestCount) {
            this.requestCount = requestCount;
            return this;
        }

        public MetricSample build() {
            return new MetricSample(apiId, environment, metricKind, value, timestamp, requestCount);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && requestCount == that.requestCount
                && Objects.equals(apiId, that.apiId)
                && Objects.equals(environment, that.environment)
                && metricKind == that.metricKind
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiId, environment, metricKind, value, timestamp, requestCount);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "apiId='" + apiId + '\'' +
                ", environment='" + environment + '\'' +
                ", metricKind=" + metricKind +
                ", value=" + value +
                ", timestamp=" + timestamp +
                ", requestCount=" + requestCount +
                '}';
    }
}
