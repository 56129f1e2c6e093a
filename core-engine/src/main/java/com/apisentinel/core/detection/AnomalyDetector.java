package com.apisentinel.core.detection;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;

import java.io.Serializable;
import java.util.Optional;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: every decision is a pure
 * function of the sample, the baseline snapshot it is judged against and the
 * configuration snapshot. New strategies (for example a learned model) plug
 * in by implementing this interface and registering in
 * {@link DetectorFactory}.
 * </p>
 */
public interface AnomalyDetector extends Serializable {

    /**
     * Judge a single sample against its baseline.
     *
     * @param sample   the incoming sample
     * @param baseline statistics from before the sample was folded in
     * @param config   configuration snapshot
     * @return a candidate if the sample deviates, empty otherwise
     */
    Optional<AnomalyCandidate> evaluate(MetricSample sample, BaselineSnapshot baseline, EngineConfig config);

    /**
     * @return {@code true} if this detector judges series of {@code kind}
     */
    boolean supports(MetricKind kind);

    /**
     * Return the detector type name, recorded as candidate source.
     *
     * @return detector name
     */
    String getName();

    /**
     * @return {@code true} if {@code baseline} allows any decision at all
     */
    static boolean isJudgeable(BaselineSnapshot baseline) {
        return !baseline.isInsufficientHistory() && !baseline.isLate() && !baseline.isDiscarded();
    }
}
