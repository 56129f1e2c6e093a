package com.apisentinel.core.engine;

import com.apisentinel.core.alerting.AlertTransition;
import com.apisentinel.core.correlation.IncidentChange;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricSample;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing one sample.
 *
 * @since 1.0.0
 */
public final class IngestResult {

    public enum Status {
        /** Folded into the baseline and judged (or still warming up). */
        ACCEPTED,
        /** Folded into the moments only; never judged. */
        LATE,
        /** Malformed or beyond the allowed lateness; nothing changed. */
        DISCARDED
    }

    private final MetricSample sample;
    private final Status status;
    private final String reason;
    private final BaselineSnapshot baseline;
    private final List<AnomalyCandidate> candidates;
    private final List<IncidentChange> incidentChanges;
    private final List<AlertTransition> alertTransitions;

    IngestResult(MetricSample sample, Status status, String reason, BaselineSnapshot baseline,
            List<AnomalyCandidate> candidates, List<IncidentChange> incidentChanges,
            List<AlertTransition> alertTransitions) {
        this.sample = sample;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.reason = reason;
        this.baseline = baseline;
        this.candidates = Collections.unmodifiableList(candidates);
        this.incidentChanges = Collections.unmodifiableList(incidentChanges);
        this.alertTransitions = Collections.unmodifiableList(alertTransitions);
    }

    static IngestResult discarded(MetricSample sample, String reason) {
        return new IngestResult(sample, Status.DISCARDED, reason, null, List.of(), List.of(), List.of());
    }

    public MetricSample getSample() {
        return sample;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return why the sample was discarded, {@code null} otherwise
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return the baseline the sample was judged against, {@code null} if
     *         discarded as malformed
     */
    public BaselineSnapshot getBaseline() {
        return baseline;
    }

    public List<AnomalyCandidate> getCandidates() {
        return candidates;
    }

    public List<IncidentChange> getIncidentChanges() {
        return incidentChanges;
    }

    public List<AlertTransition> getAlertTransitions() {
        return alertTransitions;
    }

    public boolean isAnomalous() {
        return !candidates.isEmpty();
    }

    @Override
    public String toString() {
        return "IngestResult{status=" + status + ", candidates=" + candidates.size()
                + ", incidentChanges=" + incidentChanges.size()
                + ", alertTransitions=" + alertTransitions.size()
                + (reason != null ? ", reason='" + reason + '\'' : "") + '}';
    }
}
