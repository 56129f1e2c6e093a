package com.apisentinel.core.alerting;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.NotificationIntent;

import java.util.Objects;
import java.util.Optional;

/**
 * One step in an alert's lifecycle, carrying the new alert version.
 *
 * @since 1.0.0
 */
public final class AlertTransition {

    public enum Kind {
        OPENED,
        /** A repeated signal folded into the existing alert. */
        SUPPRESSED,
        /** As {@link #SUPPRESSED}, and the severity band went up. */
        ESCALATED,
        RESOLVED,
        ACKNOWLEDGED,
        SNOOZED
    }

    private final Kind kind;
    private final Alert alert;

    public AlertTransition(Kind kind, Alert alert) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
    }

    public Kind getKind() {
        return kind;
    }

    public Alert getAlert() {
        return alert;
    }

    /**
     * @return the notification this transition calls for, if any; none while the alert is snoozed
     */
    public Optional<NotificationIntent> toNotification() {
        NotificationIntent.Transition transition = switch (kind) {
            case OPENED -> NotificationIntent.Transition.OPENED;
            case ESCALATED -> NotificationIntent.Transition.ESCALATED;
            case RESOLVED -> NotificationIntent.Transition.RESOLVED;
            case SUPPRESSED, ACKNOWLEDGED, SNOOZED -> null;
        };
        if (transition == null || alert.isSnoozedAt(alert.getUpdatedAt())) {
            return Optional.empty();
        }
        return Optional.of(new NotificationIntent(alert, transition, alert.getUpdatedAt()));
    }

    @Override
    public String toString() {
        return kind + " " + alert;
    }
}
