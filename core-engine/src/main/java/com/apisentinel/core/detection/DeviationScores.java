package com.apisentinel.core.detection;

import com.apisentinel.core.model.BaselineSnapshot;

/**
 * Maps detector-specific deviation measures onto the common (0, 100] score
 * scale.
 *
 * <p>
 * All scores saturate exponentially, so a deviation just past the threshold
 * scores low and an extreme one approaches 100. Sensitivity scales how fast
 * the score rises.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeviationScores {

    private DeviationScores() {
        // utility class
    }

    /**
     * Standard deviation floored at {@code |mean| * minRelativeStddev}.
     */
    public static double effectiveStddev(BaselineSnapshot baseline, double minRelativeStddev) {
        double floor = Math.abs(baseline.getMean()) * minRelativeStddev;
        double sd = Math.max(baseline.getStddev(), floor);
        return sd > 0 ? sd : Double.MIN_NORMAL;
    }

    /**
     * Score of a z-score beyond the deviation factor {@code k}.
     */
    public static double zScore(double z, double k, double sensitivity) {
        return saturate(sensitivity * (z - k) / k);
    }

    /**
     * Score of an error ratio exceeding its limit, damped for low request
     * volumes.
     *
     * @param requests    requests in the error window
     * @param volumeScale request count at which volume confidence reaches ~63%
     * @param excess      relative excess over the limit
     */
    public static double errorRate(long requests, double volumeScale, double excess, double sensitivity) {
        double volume = 1 - Math.exp(-requests / volumeScale);
        return clamp(100.0 * volume * (1 - Math.exp(-sensitivity * excess)));
    }

    /**
     * Score of a sustained drift of {@code meanDeviation} sigmas.
     */
    public static double drift(double meanDeviation, double sensitivity) {
        return saturate(sensitivity * meanDeviation / 2.0);
    }

    private static double saturate(double x) {
        return clamp(100.0 * (1 - Math.exp(-x)));
    }

    private static double clamp(double score) {
        if (Double.isNaN(score) || score <= 0) {
            return Double.MIN_NORMAL;
        }
        return Math.min(100.0, score);
    }
}
