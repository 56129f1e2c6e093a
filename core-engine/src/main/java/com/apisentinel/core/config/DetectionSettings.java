package com.apisentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Global detector parameters. Per-environment sensitivity and deviation
 * factor live in {@link EnvironmentProfile}.
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Floor of the stddev relative to the mean, keeps flat series from flagging noise. */
    private double minRelativeStddev = 0.01;

    /** Requests the error window must hold before the error ratio is judged. */
    private int minRequestVolume = 20;

    /** Request count at which volume confidence reaches ~63%. */
    private double volumeScale = 50.0;

    /** Error ratio never considered anomalous. */
    private double minErrorRatio = 0.05;

    /** Mean normalized bucket deviation (in sigmas) that counts as drift. */
    private double driftThreshold = 1.5;

    void validate(List<String> errors) {
        if (minRelativeStddev < 0) {
            errors.add("detection.minRelativeStddev must be >= 0");
        }
        if (minRequestVolume < 1) {
            errors.add("detection.minRequestVolume must be >= 1");
        }
        if (!(volumeScale > 0)) {
            errors.add("detection.volumeScale must be > 0");
        }
        if (minErrorRatio < 0 || minErrorRatio >= 1) {
            errors.add("detection.minErrorRatio must be in [0, 1)");
        }
        if (!(driftThreshold > 0)) {
            errors.add("detection.driftThreshold must be > 0");
        }
    }

    public double getMinRelativeStddev() {
        return minRelativeStddev;
    }

    public void setMinRelativeStddev(double minRelativeStddev) {
        this.minRelativeStddev = minRelativeStddev;
    }

    public int getMinRequestVolume() {
        return minRequestVolume;
    }

    public void setMinRequestVolume(int minRequestVolume) {
        this.minRequestVolume = minRequestVolume;
    }

    public double getVolumeScale() {
        return volumeScale;
    }

    public void setVolumeScale(double volumeScale) {
        this.volumeScale = volumeScale;
    }

    public double getMinErrorRatio() {
        return minErrorRatio;
    }

    public void setMinErrorRatio(double minErrorRatio) {
        this.minErrorRatio = minErrorRatio;
    }

    public double getDriftThreshold() {
        return driftThreshold;
    }

    public void setDriftThreshold(double driftThreshold) {
        this.driftThreshold = driftThreshold;
    }
}
