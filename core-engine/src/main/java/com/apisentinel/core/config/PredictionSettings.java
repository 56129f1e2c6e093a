package com.apisentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Predictive engine parameters.
 *
 * @since 1.0.0
 */
public class PredictionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = true;

    private int intervalSeconds = 60;

    private int horizonMinutes = 30;

    private int anomalyLookbackMinutes = 30;

    private double lowConfidenceThreshold = 0.3;

    /** Completed buckets required to fit a trend at all. */
    private int minBuckets = 3;

    void validate(List<String> errors) {
        if (intervalSeconds <= 0) {
            errors.add("prediction.intervalSeconds must be > 0");
        }
        if (horizonMinutes <= 0) {
            errors.add("prediction.horizonMinutes must be > 0");
        }
        if (anomalyLookbackMinutes <= 0) {
            errors.add("prediction.anomalyLookbackMinutes must be > 0");
        }
        if (lowConfidenceThreshold < 0 || lowConfidenceThreshold > 1) {
            errors.add("prediction.lowConfidenceThreshold must be in [0, 1]");
        }
        if (minBuckets < 2) {
            errors.add("prediction.minBuckets must be >= 2");
        }
    }

    public Duration interval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public Duration horizon() {
        return Duration.ofMinutes(horizonMinutes);
    }

    public Duration anomalyLookback() {
        return Duration.ofMinutes(anomalyLookbackMinutes);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(int intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public int getHorizonMinutes() {
        return horizonMinutes;
    }

    public void setHorizonMinutes(int horizonMinutes) {
        this.horizonMinutes = horizonMinutes;
    }

    public int getAnomalyLookbackMinutes() {
        return anomalyLookbackMinutes;
    }

    public void setAnomalyLookbackMinutes(int anomalyLookbackMinutes) {
        this.anomalyLookbackMinutes = anomalyLookbackMinutes;
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public void setLowConfidenceThreshold(double lowConfidenceThreshold) {
        this.lowConfidenceThreshold = lowConfidenceThreshold;
    }

    public int getMinBuckets() {
        return minBuckets;
    }

    public void setMinBuckets(int minBuckets) {
        this.minBuckets = minBuckets;
    }
}
