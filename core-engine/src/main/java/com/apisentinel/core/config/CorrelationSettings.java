package com.apisentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Cross-environment correlation parameters.
 *
 * @since 1.0.0
 */
public class CorrelationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int windowSeconds = 300;

    /** Combined confidence at which a single environment opens an incident on its own. */
    private double singleEnvironmentThreshold = 0.95;

    /** Environments needed before the incident severity is bumped one band. */
    private int escalationEnvironmentCount = 3;

    private int closeTimeoutMinutes = 15;

    private int maxOpenIncidents = 1000;

    private int recentIncidentCapacity = 500;

    /** Uncorrelated candidates held per logical service. */
    private int maxPendingPerService = 256;

    private int sweepIntervalSeconds = 30;

    /** Compare per-environment baselines of one logical service on every sweep. */
    private boolean discrepancyEnabled = true;

    /** Relative response time difference, against the fastest peer, that flags an environment. */
    private double discrepancyThreshold = 0.3;

    /** Error ratio a peer must exceed, as a multiple of the healthiest peer's. */
    private double discrepancyErrorFactor = 2.0;

    /** Error ratio below which no environment is flagged. */
    private double discrepancyMinErrorRatio = 0.05;

    void validate(List<String> errors) {
        if (windowSeconds <= 0) {
            errors.add("correlation.windowSeconds must be > 0");
        }
        if (!(singleEnvironmentThreshold > 0 && singleEnvironmentThreshold <= 1)) {
            errors.add("correlation.singleEnvironmentThreshold must be in (0, 1]");
        }
        if (escalationEnvironmentCount < 2) {
            errors.add("correlation.escalationEnvironmentCount must be >= 2");
        }
        if (closeTimeoutMinutes <= 0) {
            errors.add("correlation.closeTimeoutMinutes must be > 0");
        }
        if (maxOpenIncidents < 1) {
            errors.add("correlation.maxOpenIncidents must be >= 1");
        }
        if (recentIncidentCapacity < 0) {
            errors.add("correlation.recentIncidentCapacity must be >= 0");
        }
        if (maxPendingPerService < 1) {
            errors.add("correlation.maxPendingPerService must be >= 1");
        }
        if (sweepIntervalSeconds <= 0) {
            errors.add("correlation.sweepIntervalSeconds must be > 0");
        }
        if (!(discrepancyThreshold > 0)) {
            errors.add("correlation.discrepancyThreshold must be > 0");
        }
        if (!(discrepancyErrorFactor > 1)) {
            errors.add("correlation.discrepancyErrorFactor must be > 1");
        }
        if (!(discrepancyMinErrorRatio >= 0 && discrepancyMinErrorRatio < 1)) {
            errors.add("correlation.discrepancyMinErrorRatio must be in [0, 1)");
        }
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    public Duration closeTimeout() {
        return Duration.ofMinutes(closeTimeoutMinutes);
    }

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public double getSingleEnvironmentThreshold() {
        return singleEnvironmentThreshold;
    }

    public void setSingleEnvironmentThreshold(double singleEnvironmentThreshold) {
        this.singleEnvironmentThreshold = singleEnvironmentThreshold;
    }

    public int getEscalationEnvironmentCount() {
        return escalationEnvironmentCount;
    }

    public void setEscalationEnvironmentCount(int escalationEnvironmentCount) {
        this.escalationEnvironmentCount = escalationEnvironmentCount;
    }

    public int getCloseTimeoutMinutes() {
        return closeTimeoutMinutes;
    }

    public void setCloseTimeoutMinutes(int closeTimeoutMinutes) {
        this.closeTimeoutMinutes = closeTimeoutMinutes;
    }

    public int getMaxOpenIncidents() {
        return maxOpenIncidents;
    }

    public void setMaxOpenIncidents(int maxOpenIncidents) {
        this.maxOpenIncidents = maxOpenIncidents;
    }

    public int getRecentIncidentCapacity() {
        return recentIncidentCapacity;
    }

    public void setRecentIncidentCapacity(int recentIncidentCapacity) {
        this.recentIncidentCapacity = recentIncidentCapacity;
    }

    public int getMaxPendingPerService() {
        return maxPendingPerService;
    }

    public void setMaxPendingPerService(int maxPendingPerService) {
        this.maxPendingPerService = maxPendingPerService;
    }

    public int getSweepIntervalSeconds() {
        return sweepIntervalSeconds;
    }

    public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
        this.sweepIntervalSeconds = sweepIntervalSeconds;
    }

    public boolean isDiscrepancyEnabled() {
        return discrepancyEnabled;
    }

    public void setDiscrepancyEnabled(boolean discrepancyEnabled) {
        this.discrepancyEnabled = discrepancyEnabled;
    }

    public double getDiscrepancyThreshold() {
        return discrepancyThreshold;
    }

    public void setDiscrepancyThreshold(double discrepancyThreshold) {
        this.discrepancyThreshold = discrepancyThreshold;
    }

    public double getDiscrepancyErrorFactor() {
        return discrepancyErrorFactor;
    }

    public void setDiscrepancyErrorFactor(double discrepancyErrorFactor) {
        this.discrepancyErrorFactor = discrepancyErrorFactor;
    }

    public double getDiscrepancyMinErrorRatio() {
        return discrepancyMinErrorRatio;
    }

    public void setDiscrepancyMinErrorRatio(double discrepancyMinErrorRatio) {
        this.discrepancyMinErrorRatio = discrepancyMinErrorRatio;
    }
}
