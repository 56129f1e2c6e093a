package com.apisentinel.core.config;

import com.apisentinel.core.model.Severity;

import java.io.Serializable;
import java.util.List;

/**
 * Alert manager parameters: severity bands, alerting threshold and lifecycle
 * limits.
 *
 * @since 1.0.0
 */
public class AlertingSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double criticalScore = 90.0;
    private double majorScore = 70.0;
    private double warningScore = 40.0;

    /** Lowest severity that raises an alert. */
    private String alertingThreshold = "warning";

    private int resolveAfterCleanSamples = 5;

    private int maxActiveAlerts = 5000;

    /** Resolved alerts remembered for idempotent resolve and lookups. */
    private int recentResolvedCapacity = 1000;

    void validate(List<String> errors) {
        if (!(warningScore > 0 && warningScore <= majorScore && majorScore <= criticalScore
                && criticalScore <= 100)) {
            errors.add("alerting bands must satisfy 0 < warningScore <= majorScore <= criticalScore <= 100");
        }
        try {
            Severity.fromWireName(alertingThreshold);
        } catch (IllegalArgumentException e) {
            errors.add("alerting.alertingThreshold '" + alertingThreshold
                    + "' is not one of info, warning, major, critical");
        }
        if (resolveAfterCleanSamples < 1) {
            errors.add("alerting.resolveAfterCleanSamples must be >= 1");
        }
        if (maxActiveAlerts < 1) {
            errors.add("alerting.maxActiveAlerts must be >= 1");
        }
        if (recentResolvedCapacity < 0) {
            errors.add("alerting.recentResolvedCapacity must be >= 0");
        }
    }

    /**
     * Map a deviation score onto a severity band.
     *
     * @param score deviation score in [0, 100]
     * @return the highest band whose lower bound {@code score} reaches
     */
    public Severity severityOf(double score) {
        if (score >= criticalScore) {
            return Severity.CRITICAL;
        }
        if (score >= majorScore) {
            return Severity.MAJOR;
        }
        if (score >= warningScore) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    public Severity alertingSeverity() {
        return Severity.fromWireName(alertingThreshold);
    }

    public double getCriticalScore() {
        return criticalScore;
    }

    public void setCriticalScore(double criticalScore) {
        this.criticalScore = criticalScore;
    }

    public double getMajorScore() {
        return majorScore;
    }

    public void setMajorScore(double majorScore) {
        this.majorScore = majorScore;
    }

    public double getWarningScore() {
        return warningScore;
    }

    public void setWarningScore(double warningScore) {
        this.warningScore = warningScore;
    }

    public String getAlertingThreshold() {
        return alertingThreshold;
    }

    public void setAlertingThreshold(String alertingThreshold) {
        this.alertingThreshold = alertingThreshold;
    }

    public int getResolveAfterCleanSamples() {
        return resolveAfterCleanSamples;
    }

    public void setResolveAfterCleanSamples(int resolveAfterCleanSamples) {
        this.resolveAfterCleanSamples = resolveAfterCleanSamples;
    }

    public int getMaxActiveAlerts() {
        return maxActiveAlerts;
    }

    public void setMaxActiveAlerts(int maxActiveAlerts) {
        this.maxActiveAlerts = maxActiveAlerts;
    }

    public int getRecentResolvedCapacity() {
        return recentResolvedCapacity;
    }

    public void setRecentResolvedCapacity(int recentResolvedCapacity) {
        this.recentResolvedCapacity = recentResolvedCapacity;
    }
}
