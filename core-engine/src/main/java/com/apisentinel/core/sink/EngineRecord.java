package com.apisentinel.core.sink;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.Incident;
import com.apisentinel.core.model.Prediction;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Append-only record handed to the {@link RecordSink}.
 *
 * <p>
 * {@code recordId} is derived from the entity and its version, so a record
 * delivered twice (retries are at-least-once) carries the same id and the
 * store can drop the duplicate.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String recordId;
    private final RecordType type;
    private final Instant emittedAt;
    private final Object payload;

    private EngineRecord(String recordId, RecordType type, Instant emittedAt, Object payload) {
        this.recordId = Objects.requireNonNull(recordId, "recordId must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.emittedAt = Objects.requireNonNull(emittedAt, "emittedAt must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
    }

    public static EngineRecord anomaly(AnomalyCandidate candidate) {
        return new EngineRecord("anomaly:" + candidate.getCandidateId(), RecordType.ANOMALY,
                candidate.getTimestamp(), candidate);
    }

    public static EngineRecord incident(Incident incident) {
        String version = incident.getMembers().size() + ":" + incident.getSeverity().wireName()
                + (incident.isOpen() ? "" : ":closed");
        Instant at = incident.isOpen() ? incident.getLastMemberAt() : incident.getClosedAt();
        return new EngineRecord("incident:" + incident.getIncidentId() + ":" + version, RecordType.INCIDENT,
                at, incident);
    }

    public static EngineRecord prediction(Prediction prediction) {
        return new EngineRecord("prediction:" + prediction.seriesKey() + ":" + prediction.getGeneratedAt().toEpochMilli(),
                RecordType.PREDICTION, prediction.getGeneratedAt(), prediction);
    }

    public static EngineRecord alert(Alert alert) {
        String version = alert.getState().wireName() + ":" + alert.getOccurrenceCount() + ":"
                + alert.getSeverity().wireName() + (alert.getAcknowledgedBy() != null ? ":ack" : "")
                + (alert.getSnoozedUntil() != null ? ":snoozed" : "");
        return new EngineRecord("alert:" + alert.getAlertId() + ":" + version.toLowerCase(Locale.ROOT),
                RecordType.ALERT, alert.getUpdatedAt(), alert);
    }

    public String getRecordId() {
        return recordId;
    }

    public RecordType getType() {
        return type;
    }

    public Instant getEmittedAt() {
        return emittedAt;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngineRecord that))
            return false;
        return recordId.equals(that.recordId);
    }

    @Override
    public int hashCode() {
        return recordId.hashCode();
    }

    @Override
    public String toString() {
        return "EngineRecord{" + type + " " + recordId + '}';
    }
}
