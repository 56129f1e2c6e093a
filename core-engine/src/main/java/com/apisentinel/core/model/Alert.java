package com.apisentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Alert emitted by the alert manager for an anomaly candidate or an incident.
 *
 * <p>
 * Instances are immutable; every state transition produces a new version with
 * the same {@code alertId}. Serialized to JSON for the record store and
 * notification intents.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code dedupKey}, {@code severity}, {@code state} and {@code createdAt} are
 * present; omitting any of them throws a {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * What raised the alert.
     */
    public enum SourceType {
        CANDIDATE,
        INCIDENT
    }

    private final String alertId;
    private final DedupKey dedupKey;
    private final Severity severity;
    private final AlertState state;
    private final SourceType sourceType;
    private final String sourceId;
    private final String title;
    private final String description;
    private final Set<String> environments;
    private final List<String> tags;
    private final double peakScore;
    private final int occurrenceCount;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant resolvedAt;
    private final String resolutionReason;
    private final String resolvedBy;
    private final String acknowledgedBy;
    private final Instant acknowledgedAt;
    private final String snoozedBy;
    private final Instant snoozedUntil;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    private Alert(Builder builder) {
        this.alertId = builder.alertId != null ? builder.alertId : "alert-" + UUID.randomUUID();
        this.dedupKey = Objects.requireNonNull(builder.dedupKey, "dedupKey must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.sourceType = builder.sourceType;
        this.sourceId = builder.sourceId;
        this.title = builder.title;
        this.description = builder.description;
        this.environments = Collections.unmodifiableSet(new LinkedHashSet<>(builder.environments));
        this.tags = Collections.unmodifiableList(new ArrayList<>(builder.tags));
        this.peakScore = builder.peakScore;
        this.occurrenceCount = Math.max(1, builder.occurrenceCount);
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
        this.resolvedAt = builder.resolvedAt;
        this.resolutionReason = builder.resolutionReason;
        this.resolvedBy = builder.resolvedBy;
        this.acknowledgedBy = builder.acknowledgedBy;
        this.acknowledgedAt = builder.acknowledgedAt;
        this.snoozedBy = builder.snoozedBy;
        this.snoozedUntil = builder.snoozedUntil;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this alert's values
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.alertId = alertId;
        b.dedupKey = dedupKey;
        b.severity = severity;
        b.state = state;
        b.sourceType = sourceType;
        b.sourceId = sourceId;
        b.title = title;
        b.description = description;
        b.environments.addAll(environments);
        b.tags.addAll(tags);
        b.peakScore = peakScore;
        b.occurrenceCount = occurrenceCount;
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        b.resolvedAt = resolvedAt;
        b.resolutionReason = resolutionReason;
        b.resolvedBy = resolvedBy;
        b.acknowledgedBy = acknowledgedBy;
        b.acknowledgedAt = acknowledgedAt;
        b.snoozedBy = snoozedBy;
        b.snoozedUntil = snoozedUntil;
        return b;
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String alertId;
        private DedupKey dedupKey;
        private Severity severity;
        private AlertState state;
        private SourceType sourceType;
        private String sourceId;
        private String title;
        private String description;
        private final Set<String> environments = new LinkedHashSet<>();
        private final List<String> tags = new ArrayList<>();
        private double peakScore;
        private int occurrenceCount = 1;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant resolvedAt;
        private String resolutionReason;
        private String resolvedBy;
        private String acknowledgedBy;
        private Instant acknowledgedAt;
        private String snoozedBy;
        private Instant snoozedUntil;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder dedupKey(DedupKey dedupKey) {
            this.dedupKey = dedupKey;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        public Builder source(SourceType sourceType, String sourceId) {
            this.sourceType = sourceType;
            this.sourceId = sourceId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder environments(Set<String> environments) {
            this.environments.clear();
            this.environments.addAll(environments);
            return this;
        }

        public Builder addEnvironment(String environment) {
            this.environments.add(environment);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder peakScore(double peakScore) {
            this.peakScore = peakScore;
            return this;
        }

        public Builder occurrenceCount(int occurrenceCount) {
            this.occurrenceCount = occurrenceCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder resolved(Instant resolvedAt, String reason) {
            this.state = AlertState.RESOLVED;
            this.resolvedAt = resolvedAt;
            this.updatedAt = resolvedAt;
            this.resolutionReason = reason;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder acknowledged(String by, Instant at) {
            this.acknowledgedBy = by;
            this.acknowledgedAt = at;
            return this;
        }

        /**
         * Mute notifications of this alert until {@code until}.
         */
        public Builder snoozed(String by, Instant until) {
            this.snoozedBy = by;
            this.snoozedUntil = until;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAlertId() {
        return alertId;
    }

    public DedupKey getDedupKey() {
        return dedupKey;
    }

    public Severity getSeverity() {
        return severity;
    }

    public AlertState getState() {
        return state;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getEnvironments() {
        return environments;
    }

    public List<String> getTags() {
        return tags;
    }

    public double getPeakScore() {
        return peakScore;
    }

    public int getOccurrenceCount() {
        return occurrenceCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getResolutionReason() {
        return resolutionReason;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public String getSnoozedBy() {
        return snoozedBy;
    }

    public Instant getSnoozedUntil() {
        return snoozedUntil;
    }

    /**
     * @return {@code true} if notifications are muted at {@code at}
     */
    public boolean isSnoozedAt(Instant at) {
        return snoozedUntil != null && at.isBefore(snoozedUntil);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(alertId, alert.alertId)
                && state == alert.state
                && severity == alert.severity
                && occurrenceCount == alert.occurrenceCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, state, severity, occurrenceCount);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", dedupKey=" + dedupKey +
                ", severity=" + severity +
                ", state=" + state +
                ", occurrences=" + occurrenceCount +
                ", createdAt=" + createdAt +
                ", resolvedAt=" + resolvedAt +
                (snoozedUntil != null ? ", snoozedUntil=" + snoozedUntil : "") +
                '}';
    }
}
