package com.apisentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Request to notify humans about an alert transition.
 *
 * <p>
 * The engine decides <em>that</em> and <em>what</em> to send; delivery is the
 * transport's business. {@code intentId} is stable per (alert, transition,
 * severity), so a transport receiving the same intent twice can drop the
 * duplicate.
 * </p>
 *
 * @since 1.0.0
 */
public final class NotificationIntent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Alert transitions that are worth a notification.
     */
    public enum Transition {
        OPENED,
        ESCALATED,
        RESOLVED
    }

    private final String intentId;
    private final String alertId;
    private final Transition transition;
    private final Severity severity;
    private final String title;
    private final String summary;
    private final Set<String> affectedEnvironments;
    private final DedupKey dedupKey;
    private final Instant createdAt;

    public NotificationIntent(Alert alert, Transition transition, Instant createdAt) {
        Objects.requireNonNull(alert, "alert must not be null");
        this.transition = Objects.requireNonNull(transition, "transition must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.alertId = alert.getAlertId();
        this.severity = alert.getSeverity();
        this.title = alert.getTitle();
        this.summary = alert.getDescription();
        this.affectedEnvironments = Collections.unmodifiableSet(new LinkedHashSet<>(alert.getEnvironments()));
        this.dedupKey = alert.getDedupKey();
        this.intentId = alertId + ":" + transition.name().toLowerCase(Locale.ROOT) + ":" + severity.wireName();
    }

    public String getIntentId() {
        return intentId;
    }

    public String getAlertId() {
        return alertId;
    }

    public Transition getTransition() {
        return transition;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getSummary() {
        return summary;
    }

    public Set<String> getAffectedEnvironments() {
        return affectedEnvironments;
    }

    public DedupKey getDedupKey() {
        return dedupKey;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "NotificationIntent{" +
                "intentId='" + intentId + '\'' +
                ", transition=" + transition +
                ", severity=" + severity +
                ", environments=" + affectedEnvironments +
                '}';
    }
}
