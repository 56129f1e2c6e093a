package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable copy of one series baseline.
 *
 * <p>
 * When returned from a baseline update, the statistical fields (mean,
 * variance, percentiles, ratio percentile, sample count) describe the
 * baseline <strong>before</strong> the sample was folded in, i.e. what the
 * sample must be judged against. The error window totals and the bucket list
 * are current, so they include the sample.
 * </p>
 *
 * <p>
 * A snapshot with {@link #isInsufficientHistory()} set means "no decision
 * possible": detectors and the predictive engine must not alert on it.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String apiId;
    private final String environment;
    private final MetricKind metricKind;
    private final double mean;
    private final double variance;
    private final double p50;
    private final double p95;
    private final double p99;
    private final long sampleCount;
    private final long lateCount;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final boolean insufficientHistory;
    private final boolean late;
    private final boolean discarded;
    private final double windowErrors;
    private final long windowRequests;
    private final double ratioP99;
    private final List<TrendBucket> recentBuckets;

    private BaselineSnapshot(Builder b) {
        this.apiId = Objects.requireNonNull(b.apiId, "apiId must not be null");
        this.environment = Objects.requireNonNull(b.environment, "environment must not be null");
        this.metricKind = Objects.requireNonNull(b.metricKind, "metricKind must not be null");
        this.mean = b.mean;
        this.variance = Math.max(0.0, b.variance);
        this.p50 = b.p50;
        this.p95 = Math.max(b.p50, b.p95);
        this.p99 = Math.max(this.p95, b.p99);
        this.sampleCount = b.sampleCount;
        this.lateCount = b.lateCount;
        this.windowStart = b.windowStart;
        this.windowEnd = b.windowEnd;
        this.insufficientHistory = b.insufficientHistory;
        this.late = b.late;
        this.discarded = b.discarded;
        this.windowErrors = b.windowErrors;
        this.windowRequests = b.windowRequests;
        this.ratioP99 = b.ratioP99;
        this.recentBuckets = b.recentBuckets != null
                ? Collections.unmodifiableList(new ArrayList<>(b.recentBuckets))
                : Collections.emptyList();
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

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getStddev() {
        return Math.sqrt(variance);
    }

    public double getP50() {
        return p50;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public long getLateCount() {
        return lateCount;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public boolean isInsufficientHistory() {
        return insufficientHistory;
    }

    public boolean isLate() {
        return late;
    }

    public boolean isDiscarded() {
        return discarded;
    }

    public double getWindowErrors() {
        return windowErrors;
    }

    public long getWindowRequests() {
        return windowRequests;
    }

    /**
     * @return error ratio of the current sliding window, or 0 when empty
     */
    public double getWindowErrorRatio() {
        return windowRequests > 0 ? windowErrors / windowRequests : 0.0;
    }

    public double getRatioP99() {
        return ratioP99;
    }

    /**
     * @return closed buckets, oldest first; unmodifiable
     */
    @JsonIgnore
    public List<TrendBucket> getRecentBuckets() {
        return recentBuckets;
    }

    /**
     * Fluent builder for {@link BaselineSnapshot}. The series identity is
     * required.
     */
    public static class Builder {
        private String apiId;
        private String environment;
        private MetricKind metricKind;
        private double mean;
        private double variance;
        private double p50;
        private double p95;
        private double p99;
        private long sampleCount;
        private long lateCount;
        private Instant windowStart;
        private Instant windowEnd;
        private boolean insufficientHistory;
        private boolean late;
        private boolean discarded;
        private double windowErrors;
        private long windowRequests;
        private double ratioP99;
        private List<TrendBucket> recentBuckets;

        public Builder seriesKey(SeriesKey key) {
            this.apiId = key.getApiId();
            this.environment = key.getEnvironment();
            this.metricKind = key.getMetricKind();
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder variance(double variance) {
            this.variance = variance;
            return this;
        }

        public Builder percentiles(double p50, double p95, double p99) {
            this.p50 = p50;
            this.p95 = p95;
            this.p99 = p99;
            return this;
        }

        public Builder sampleCount(long sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder lateCount(long lateCount) {
            this.lateCount = lateCount;
            return this;
        }

        public Builder window(Instant windowStart, Instant windowEnd) {
            this.windowStart = windowStart;
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder insufficientHistory(boolean insufficientHistory) {
            this.insufficientHistory = insufficientHistory;
            return this;
        }

        public Builder late(boolean late) {
            this.late = late;
            return this;
        }

        public Builder discarded(boolean discarded) {
            this.discarded = discarded;
            return this;
        }

        public Builder errorWindow(double windowErrors, long windowRequests) {
            this.windowErrors = windowErrors;
            this.windowRequests = windowRequests;
            return this;
        }

        public Builder ratioP99(double ratioP99) {
            this.ratioP99 = ratioP99;
            return this;
        }

        public Builder recentBuckets(List<TrendBucket> recentBuckets) {
            this.recentBuckets = recentBuckets;
            return this;
        }

        public BaselineSnapshot build() {
            return new BaselineSnapshot(this);
        }
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{" +
                "series=" + apiId + '|' + environment + '|' + metricKind +
                ", mean=" + mean +
                ", stddev=" + getStddev() +
                ", p99=" + p99 +
                ", sampleCount=" + sampleCount +
                ", insufficientHistory=" + insufficientHistory +
                ", late=" + late +
                '}';
    }
}
