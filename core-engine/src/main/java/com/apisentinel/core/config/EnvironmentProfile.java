package com.apisentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Detection tuning for one environment (or the global defaults).
 *
 * <pre>
 * environments:
 *   aws-prod:
 *     sensitivity: 1.5
 *     deviationFactor: 2.5
 * </pre>
 *
 * @since 1.0.0
 */
public class EnvironmentProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Multiplier applied to deviation scores; higher scores anomalies higher. */
    private double sensitivity = 1.0;

    /** Number of standard deviations a value must exceed to be anomalous. */
    private double deviationFactor = 3.0;

    public EnvironmentProfile() {
    }

    public EnvironmentProfile(double sensitivity, double deviationFactor) {
        this.sensitivity = sensitivity;
        this.deviationFactor = deviationFactor;
    }

    void validate(String name, List<String> errors) {
        if (!(sensitivity > 0) || Double.isInfinite(sensitivity)) {
            errors.add("Environment '" + name + "' requires 'sensitivity' > 0");
        }
        if (!(deviationFactor > 0) || Double.isInfinite(deviationFactor)) {
            errors.add("Environment '" + name + "' requires 'deviationFactor' > 0");
        }
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    @Override
    public String toString() {
        return "EnvironmentProfile{sensitivity=" + sensitivity + ", deviationFactor=" + deviationFactor + '}';
    }
}
