package com.apisentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Tuning of the per-series baseline model.
 *
 * @since 1.0.0
 */
public class BaselineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** EWMA smoothing factor for mean and variance. */
    private double ewmaAlpha = 0.05;

    /** Number of recent values kept for percentile estimation. */
    private int reservoirSize = 256;

    /** Samples required before a baseline is trusted. */
    private int minSamples = 5;

    /** Samples further behind the latest timestamp are discarded. */
    private int maxLatenessSeconds = 600;

    /** Samples dated further ahead of the engine clock are malformed. */
    private int maxClockSkewSeconds = 300;

    private int bucketSeconds = 60;

    /** Completed buckets kept for trend analysis. */
    private int trendBuckets = 10;

    /** Observations an hour-of-week slot needs before it overrides the mean. */
    private int minSeasonalSamples = 3;

    /** In-order samples in the rolling error window. */
    private int errorWindowSamples = 5;

    private int idleEvictionMinutes = 1440;

    void validate(List<String> errors) {
        if (!(ewmaAlpha > 0 && ewmaAlpha <= 1)) {
            errors.add("baseline.ewmaAlpha must be in (0, 1]");
        }
        if (reservoirSize < 2) {
            errors.add("baseline.reservoirSize must be >= 2");
        }
        if (minSamples < 1) {
            errors.add("baseline.minSamples must be >= 1");
        }
        if (maxLatenessSeconds < 0) {
            errors.add("baseline.maxLatenessSeconds must be >= 0");
        }
        if (maxClockSkewSeconds < 0) {
            errors.add("baseline.maxClockSkewSeconds must be >= 0");
        }
        if (bucketSeconds <= 0) {
            errors.add("baseline.bucketSeconds must be > 0");
        }
        if (trendBuckets < 2) {
            errors.add("baseline.trendBuckets must be >= 2");
        }
        if (minSeasonalSamples < 1) {
            errors.add("baseline.minSeasonalSamples must be >= 1");
        }
        if (errorWindowSamples < 1) {
            errors.add("baseline.errorWindowSamples must be >= 1");
        }
        if (idleEvictionMinutes <= 0) {
            errors.add("baseline.idleEvictionMinutes must be > 0");
        }
    }

    public Duration maxLateness() {
        return Duration.ofSeconds(maxLatenessSeconds);
    }

    public Duration maxClockSkew() {
        return Duration.ofSeconds(maxClockSkewSeconds);
    }

    public Duration bucketDuration() {
        return Duration.ofSeconds(bucketSeconds);
    }

    public Duration idleEviction() {
        return Duration.ofMinutes(idleEvictionMinutes);
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    public int getReservoirSize() {
        return reservoirSize;
    }

    public void setReservoirSize(int reservoirSize) {
        this.reservoirSize = reservoirSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public int getMaxLatenessSeconds() {
        return maxLatenessSeconds;
    }

    public void setMaxLatenessSeconds(int maxLatenessSeconds) {
        this.maxLatenessSeconds = maxLatenessSeconds;
    }

    public int getMaxClockSkewSeconds() {
        return maxClockSkewSeconds;
    }

    public void setMaxClockSkewSeconds(int maxClockSkewSeconds) {
        this.maxClockSkewSeconds = maxClockSkewSeconds;
    }

    public int getBucketSeconds() {
        return bucketSeconds;
    }

    public void setBucketSeconds(int bucketSeconds) {
        this.bucketSeconds = bucketSeconds;
    }

    public int getTrendBuckets() {
        return trendBuckets;
    }

    public void setTrendBuckets(int trendBuckets) {
        this.trendBuckets = trendBuckets;
    }

    public int getMinSeasonalSamples() {
        return minSeasonalSamples;
    }

    public void setMinSeasonalSamples(int minSeasonalSamples) {
        this.minSeasonalSamples = minSeasonalSamples;
    }

    public int getErrorWindowSamples() {
        return errorWindowSamples;
    }

    public void setErrorWindowSamples(int errorWindowSamples) {
        this.errorWindowSamples = errorWindowSamples;
    }

    public int getIdleEvictionMinutes() {
        return idleEvictionMinutes;
    }

    public void setIdleEvictionMinutes(int idleEvictionMinutes) {
        this.idleEvictionMinutes = idleEvictionMinutes;
    }
}
