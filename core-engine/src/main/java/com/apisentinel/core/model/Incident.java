package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A correlated group of anomaly candidates believed to share a root cause.
 *
 * <p>
 * Instances are immutable. The correlator publishes a new version of the
 * incident for every change (member added, severity escalated, closed); all
 * versions share the same {@code incidentId}.
 * </p>
 *
 * <h3>Propagation</h3>
 * <p>
 * {@link #getPropagationPath()} lists environments in the order they joined
 * the incident. The first entry is the origin environment.
 * </p>
 *
 * @since 1.0.0
 */
public final class Incident implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Why an incident was closed.
     */
    public enum CloseReason {
        /** No new member arrived within the close timeout. */
        TIMEOUT,
        /** Every member series produced a non-anomalous sample. */
        CLEARED,
        /** Closed early because too many incidents were open. */
        CAPACITY
    }

    private final String incidentId;
    private final String logicalService;
    private final List<AnomalyCandidate> members;
    private final List<String> propagationPath;
    private final Severity severity;
    private final double correlationConfidence;
    private final Instant createdAt;
    private final Instant lastMemberAt;
    private final Instant closedAt;
    private final CloseReason closeReason;

    private Incident(Builder b) {
        this.incidentId = b.incidentId != null ? b.incidentId : "inc-" + UUID.randomUUID();
        this.logicalService = Objects.requireNonNull(b.logicalService, "logicalService must not be null");
        this.members = Collections.unmodifiableList(new ArrayList<>(b.members));
        this.propagationPath = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(b.propagationPath)));
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.correlationConfidence = b.correlationConfidence;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.lastMemberAt = b.lastMemberAt != null ? b.lastMemberAt : b.createdAt;
        this.closedAt = b.closedAt;
        this.closeReason = b.closeReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this incident's values
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.incidentId = incidentId;
        b.logicalService = logicalService;
        b.members.addAll(members);
        b.propagationPath.addAll(propagationPath);
        b.severity = severity;
        b.correlationConfidence = correlationConfidence;
        b.createdAt = createdAt;
        b.lastMemberAt = lastMemberAt;
        b.closedAt = closedAt;
        b.closeReason = closeReason;
        return b;
    }

    public boolean isOpen() {
        return closedAt == null;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public String getLogicalService() {
        return logicalService;
    }

    @JsonIgnore
    public List<AnomalyCandidate> getMembers() {
        return members;
    }

    public List<String> getMemberCandidateIds() {
        List<String> ids = new ArrayList<>(members.size());
        for (AnomalyCandidate member : members) {
            ids.add(member.getCandidateId());
        }
        return ids;
    }

    public Set<String> getEnvironmentsInvolved() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(propagationPath));
    }

    public Set<String> getApiIds() {
        Set<String> apis = new LinkedHashSet<>();
        for (AnomalyCandidate member : members) {
            apis.add(member.getApiId());
        }
        return apis;
    }

    @JsonIgnore
    public Set<SeriesKey> memberSeries() {
        Set<SeriesKey> series = new LinkedHashSet<>();
        for (AnomalyCandidate member : members) {
            series.add(member.seriesKey());
        }
        return series;
    }

    public List<String> getPropagationPath() {
        return propagationPath;
    }

    public String getOriginEnvironment() {
        return propagationPath.isEmpty() ? null : propagationPath.get(0);
    }

    /**
     * @return time between the first anomaly in the origin environment and the
     *         first anomaly in the second environment, or {@code null} if only
     *         one environment is involved
     */
    public Duration getPropagationDelay() {
        if (propagationPath.size() < 2) {
            return null;
        }
        Instant origin = firstSeen(propagationPath.get(0));
        Instant next = firstSeen(propagationPath.get(1));
        return origin != null && next != null ? Duration.between(origin, next).abs() : null;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getCorrelationConfidence() {
        return correlationConfidence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastMemberAt() {
        return lastMemberAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }

    private Instant firstSeen(String environment) {
        Instant first = null;
        for (AnomalyCandidate member : members) {
            if (member.getEnvironment().equals(environment)
                    && (first == null || member.getTimestamp().isBefore(first))) {
                first = member.getTimestamp();
            }
        }
        return first;
    }

    /**
     * Fluent builder for {@link Incident}.
     */
    public static class Builder {
        private String incidentId;
        private String logicalService;
        private final List<AnomalyCandidate> members = new ArrayList<>();
        private final List<String> propagationPath = new ArrayList<>();
        private Severity severity;
        private double correlationConfidence;
        private Instant createdAt;
        private Instant lastMemberAt;
        private Instant closedAt;
        private CloseReason closeReason;

        public Builder incidentId(String incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder logicalService(String logicalService) {
            this.logicalService = logicalService;
            return this;
        }

        /**
         * Append a member; its environment joins the propagation path if new.
         */
        public Builder addMember(AnomalyCandidate member) {
            Objects.requireNonNull(member, "member must not be null");
            members.add(member);
            if (!propagationPath.contains(member.getEnvironment())) {
                propagationPath.add(member.getEnvironment());
            }
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder correlationConfidence(double correlationConfidence) {
            this.correlationConfidence = correlationConfidence;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastMemberAt(Instant lastMemberAt) {
            this.lastMemberAt = lastMemberAt;
            return this;
        }

        public Builder closed(Instant closedAt, CloseReason reason) {
            this.closedAt = closedAt;
            this.closeReason = reason;
            return this;
        }

        public Incident build() {
            return new Incident(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Incident that))
            return false;
        return incidentId.equals(that.incidentId)
                && members.size() == that.members.size()
                && Objects.equals(closedAt, that.closedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(incidentId, members.size(), closedAt);
    }

    @Override
    public String toString() {
        return "Incident{" +
                "id='" + incidentId + '\'' +
                ", service='" + logicalService + '\'' +
                ", members=" + members.size() +
                ", environments=" + propagationPath +
                ", severity=" + severity +
                ", confidence=" + String.format("%.3f", correlationConfidence) +
                ", closedAt=" + closedAt +
                '}';
    }
}
