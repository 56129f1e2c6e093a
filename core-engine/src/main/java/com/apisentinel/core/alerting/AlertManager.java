package com.apisentinel.core.alerting;

import com.apisentinel.core.config.AlertingSettings;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.correlation.IncidentChange;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AlertState;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.DedupKey;
import com.apisentinel.core.model.Incident;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Turns anomaly candidates and incidents into deduplicated alerts.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * One active alert exists per {@link DedupKey}. The first qualifying signal
 * opens it; later signals with the same key fold into it ({@code SUPPRESSED}),
 * raising its occurrence count and merging severity upward. A band increase is
 * reported as {@code ESCALATED}. The alert resolves after enough consecutive
 * clean samples, when its incident closes, on {@link #resolve}, or when the
 * active-alert limit forces the oldest out. Each alert resolves exactly once.
 * A {@link #snooze snoozed} alert keeps its lifecycle but produces no
 * notifications until the snooze deadline.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * State is partitioned by dedup key; transitions of one key are serialized,
 * different keys proceed in parallel. Listeners run after locks are released.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    public static final String REASON_RECOVERED = "recovered";
    public static final String REASON_MANUAL = "manual";
    public static final String REASON_CAPACITY = "capacity";

    private static final List<AnomalyCategory> SERIES_CATEGORIES = List.of(
            AnomalyCategory.LATENCY_SPIKE, AnomalyCategory.ERROR_RATE_BREACH, AnomalyCategory.SUSTAINED_DRIFT);

    private final Map<DedupKey, AlertSlot> slots = new ConcurrentHashMap<>();
    private final Map<String, DedupKey> activeIds = new ConcurrentHashMap<>();
    private final Map<String, Alert> recentlyResolved = new LinkedHashMap<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Signals
    // ---------------------------------------------------------------

    /**
     * Open or update the alert of a candidate's dedup key.
     *
     * @return transitions caused, empty if the candidate is below the alerting
     *         threshold and no alert is active for its key
     */
    public List<AlertTransition> onCandidate(AnomalyCandidate candidate, EngineConfig config) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        AlertingSettings settings = config.getAlerting();
        Severity severity = settings.severityOf(candidate.getDeviationScore());
        boolean qualifies = severity.isAtLeast(settings.alertingSeverity());

        Optional<AlertTransition> transition = withSlot(candidate.dedupKey(), qualifies, slot -> {
            slot.cleanStreak = 0;
            if (slot.current == null) {
                return open(slot, Alert.builder()
                        .dedupKey(candidate.dedupKey())
                        .severity(severity)
                        .state(AlertState.OPEN)
                        .source(Alert.SourceType.CANDIDATE, candidate.getCandidateId())
                        .title(title(candidate.getCategory(), candidate.getApiId(), candidate.getEnvironment()))
                        .description(candidate.getDescription())
                        .addEnvironment(candidate.getEnvironment())
                        .tags(List.of(tag(candidate.getCategory()), "env:" + candidate.getEnvironment()))
                        .peakScore(candidate.getDeviationScore())
                        .createdAt(candidate.getTimestamp())
                        .build());
            }
            Alert previous = slot.current;
            return fold(slot, previous.toBuilder()
                    .source(Alert.SourceType.CANDIDATE, candidate.getCandidateId())
                    .description(candidate.getDescription())
                    .peakScore(Math.max(previous.getPeakScore(), candidate.getDeviationScore())),
                    severity, candidate.getTimestamp());
        });

        List<AlertTransition> transitions = new ArrayList<>();
        transition.ifPresent(transitions::add);
        if (transition.map(t -> t.getKind() == AlertTransition.Kind.OPENED).orElse(false)) {
            transitions.addAll(enforceCapacity(settings, candidate.getTimestamp()));
        }
        publish(transitions, settings);
        return transitions;
    }

    /**
     * Count a non-anomalous sample towards resolving the alerts of its series.
     */
    public List<AlertTransition> onCleanSample(SeriesKey series, Instant timestamp, EngineConfig config) {
        AlertingSettings settings = config.getAlerting();
        List<AlertTransition> transitions = new ArrayList<>();
        for (AnomalyCategory category : SERIES_CATEGORIES) {
            AlertSlot slot = slots.get(DedupKey.of(series, category));
            if (slot == null) {
                continue;
            }
            synchronized (slot) {
                if (slot.retired || slot.current == null) {
                    continue;
                }
                slot.cleanStreak++;
                if (slot.cleanStreak >= settings.getResolveAfterCleanSamples()) {
                    transitions.add(retire(slot, timestamp, REASON_RECOVERED, null));
                }
            }
        }
        publish(transitions, settings);
        return transitions;
    }

    /**
     * Raise, update or resolve the cross-environment alert of an incident.
     */
    public List<AlertTransition> onIncident(IncidentChange change, EngineConfig config) {
        Incident incident = change.getIncident();
        AlertingSettings settings = config.getAlerting();
        DedupKey key = incidentKey(incident);
        List<AlertTransition> transitions = new ArrayList<>();

        if (change.getType() == IncidentChange.Type.CLOSED) {
            AlertSlot slot = slots.get(key);
            if (slot != null) {
                synchronized (slot) {
                    if (!slot.retired && slot.current != null
                            && incident.getIncidentId().equals(slot.current.getSourceId())) {
                        transitions.add(retire(slot, incident.getClosedAt(),
                                "incident " + incident.getCloseReason().name().toLowerCase(Locale.ROOT), null));
                    }
                }
            }
            publish(transitions, settings);
            return transitions;
        }

        boolean qualifies = incident.getSeverity().isAtLeast(settings.alertingSeverity());
        double peak = incident.getMembers().stream().mapToDouble(AnomalyCandidate::getDeviationScore).max().orElse(0);
        Instant at = incident.getLastMemberAt();
        withSlot(key, qualifies, slot -> {
            if (slot.current == null) {
                return open(slot, Alert.builder()
                        .dedupKey(key)
                        .severity(incident.getSeverity())
                        .state(AlertState.OPEN)
                        .source(Alert.SourceType.INCIDENT, incident.getIncidentId())
                        .title(title(AnomalyCategory.CROSS_ENVIRONMENT, incident.getLogicalService(),
                                String.join(", ", incident.getPropagationPath())))
                        .description(incidentDescription(incident))
                        .environments(incident.getEnvironmentsInvolved())
                        .tags(incidentTags(incident))
                        .peakScore(peak)
                        .createdAt(at)
                        .build());
            }
            Alert previous = slot.current;
            return fold(slot, previous.toBuilder()
                    .source(Alert.SourceType.INCIDENT, incident.getIncidentId())
                    .description(incidentDescription(incident))
                    .environments(incident.getEnvironmentsInvolved())
                    .tags(incidentTags(incident))
                    .peakScore(Math.max(previous.getPeakScore(), peak)),
                    incident.getSeverity(), at);
        }).ifPresent(transitions::add);

        if (transitions.stream().anyMatch(t -> t.getKind() == AlertTransition.Kind.OPENED)) {
            transitions.addAll(enforceCapacity(settings, at));
        }
        publish(transitions, settings);
        return transitions;
    }

    /**
     * Resolve the active alert of {@code key} because its condition no longer
     * holds. Used by detectors that re-evaluate state rather than samples.
     */
    public Optional<AlertTransition> clear(DedupKey key, Instant at, EngineConfig config) {
        AlertSlot slot = slots.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        AlertTransition transition = null;
        synchronized (slot) {
            if (!slot.retired && slot.current != null) {
                transition = retire(slot, at, REASON_RECOVERED, null);
            }
        }
        Optional<AlertTransition> result = Optional.ofNullable(transition);
        result.ifPresent(t -> publish(List.of(t), config.getAlerting()));
        return result;
    }

    // ---------------------------------------------------------------
    // Operator actions and queries
    // ---------------------------------------------------------------

    public Optional<AlertTransition> resolve(String alertId, Instant now, EngineConfig config) {
        return resolve(alertId, null, now, config);
    }

    /**
     * Resolve an alert by id. Idempotent: resolving an already resolved or
     * unknown alert changes nothing.
     *
     * @param resolvedBy operator recorded on the resolved alert, may be {@code null}
     * @return the resolution, empty if nothing changed
     */
    public Optional<AlertTransition> resolve(String alertId, String resolvedBy, Instant now, EngineConfig config) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        DedupKey key = activeIds.get(alertId);
        AlertSlot slot = key == null ? null : slots.get(key);
        if (slot == null) {
            LOG.debug("Resolve of alert {} ignored: not active", alertId);
            return Optional.empty();
        }
        AlertTransition transition = null;
        synchronized (slot) {
            if (!slot.retired && slot.current != null && slot.current.getAlertId().equals(alertId)) {
                transition = retire(slot, now, REASON_MANUAL, resolvedBy);
            }
        }
        Optional<AlertTransition> result = Optional.ofNullable(transition);
        result.ifPresent(t -> publish(List.of(t), config.getAlerting()));
        return result;
    }

    /**
     * Record who acknowledged an active alert. Does not change its state.
     *
     * @return the acknowledged alert version, empty if the alert is not active
     */
    public Optional<Alert> acknowledge(String alertId, String user, Instant now) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        Objects.requireNonNull(user, "user must not be null");
        DedupKey key = activeIds.get(alertId);
        AlertSlot slot = key == null ? null : slots.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        Alert acknowledged;
        synchronized (slot) {
            if (slot.retired || slot.current == null || !slot.current.getAlertId().equals(alertId)) {
                return Optional.empty();
            }
            acknowledged = slot.current.toBuilder().acknowledged(user, now).build();
            slot.current = acknowledged;
        }
        LOG.info("Alert {} acknowledged by {}", alertId, user);
        notifyListeners(new AlertTransition(AlertTransition.Kind.ACKNOWLEDGED, acknowledged));
        return Optional.of(acknowledged);
    }

    /**
     * Mute notifications of an active alert for {@code duration}. The alert
     * still folds signals, escalates and resolves as usual; snoozing again
     * replaces the deadline.
     *
     * @return the snoozed alert version, empty if the alert is not active
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public Optional<Alert> snooze(String alertId, Duration duration, String user, Instant now) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        Objects.requireNonNull(user, "user must not be null");
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("snooze duration must be positive: " + duration);
        }
        DedupKey key = activeIds.get(alertId);
        AlertSlot slot = key == null ? null : slots.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        Alert snoozed;
        synchronized (slot) {
            if (slot.retired || slot.current == null || !slot.current.getAlertId().equals(alertId)) {
                return Optional.empty();
            }
            snoozed = slot.current.toBuilder().snoozed(user, now.plus(duration)).build();
            slot.current = snoozed;
        }
        LOG.info("Alert {} snoozed by {} until {}", alertId, user, snoozed.getSnoozedUntil());
        notifyListeners(new AlertTransition(AlertTransition.Kind.SNOOZED, snoozed));
        return Optional.of(snoozed);
    }

    public Optional<Alert> get(String alertId) {
        DedupKey key = activeIds.get(alertId);
        if (key != null) {
            AlertSlot slot = slots.get(key);
            if (slot != null) {
                synchronized (slot) {
                    if (!slot.retired && slot.current != null && slot.current.getAlertId().equals(alertId)) {
                        return Optional.of(slot.current);
                    }
                }
            }
        }
        synchronized (recentlyResolved) {
            return Optional.ofNullable(recentlyResolved.get(alertId));
        }
    }

    /**
     * @return open and suppressed alerts, oldest first
     */
    public List<Alert> listOpen() {
        List<Alert> open = new ArrayList<>();
        for (AlertSlot slot : slots.values()) {
            synchronized (slot) {
                if (!slot.retired && slot.current != null) {
                    open.add(slot.current);
                }
            }
        }
        open.sort(Comparator.comparing(Alert::getCreatedAt));
        return open;
    }

    /**
     * @return active alerts touching {@code environment}, including
     *         cross-environment alerts that span it
     */
    public List<Alert> listByEnvironment(String environment) {
        return listOpen().stream()
                .filter(a -> a.getEnvironments().contains(environment))
                .toList();
    }

    public int activeCount() {
        return activeIds.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Run {@code action} under the lock of the key's slot. A slot is created
     * only when {@code mayOpen}; a slot without an alert is otherwise ignored.
     */
    private Optional<AlertTransition> withSlot(DedupKey key, boolean mayOpen,
            Function<AlertSlot, AlertTransition> action) {
        while (true) {
            AlertSlot slot = mayOpen ? slots.computeIfAbsent(key, k -> new AlertSlot()) : slots.get(key);
            if (slot == null) {
                return Optional.empty();
            }
            synchronized (slot) {
                if (slot.retired) {
                    continue;
                }
                if (slot.current == null && !mayOpen) {
                    return Optional.empty();
                }
                return Optional.of(action.apply(slot));
            }
        }
    }

    private AlertTransition open(AlertSlot slot, Alert alert) {
        slot.current = alert;
        activeIds.put(alert.getAlertId(), alert.getDedupKey());
        return new AlertTransition(AlertTransition.Kind.OPENED, alert);
    }

    private static AlertTransition fold(AlertSlot slot, Alert.Builder next, Severity severity, Instant at) {
        Alert previous = slot.current;
        Severity merged = Severity.max(previous.getSeverity(), severity);
        Alert updated = next
                .state(AlertState.SUPPRESSED)
                .severity(merged)
                .occurrenceCount(previous.getOccurrenceCount() + 1)
                .updatedAt(at.isBefore(previous.getUpdatedAt()) ? previous.getUpdatedAt() : at)
                .build();
        slot.current = updated;
        AlertTransition.Kind kind = merged.compareTo(previous.getSeverity()) > 0
                ? AlertTransition.Kind.ESCALATED
                : AlertTransition.Kind.SUPPRESSED;
        return new AlertTransition(kind, updated);
    }

    // Caller holds the slot lock.
    private AlertTransition retire(AlertSlot slot, Instant at, String reason, String resolvedBy) {
        Alert previous = slot.current;
        Instant resolvedAt = at.isBefore(previous.getUpdatedAt()) ? previous.getUpdatedAt() : at;
        Alert resolved = previous.toBuilder().resolved(resolvedAt, reason).resolvedBy(resolvedBy).build();
        slot.current = null;
        slot.retired = true;
        slots.remove(resolved.getDedupKey(), slot);
        activeIds.remove(resolved.getAlertId());
        return new AlertTransition(AlertTransition.Kind.RESOLVED, resolved);
    }

    // Runs without holding any slot lock; locks one slot at a time.
    private List<AlertTransition> enforceCapacity(AlertingSettings settings, Instant now) {
        List<AlertTransition> transitions = new ArrayList<>();
        while (activeIds.size() > settings.getMaxActiveAlerts()) {
            List<Alert> open = listOpen();
            if (open.isEmpty()) {
                break;
            }
            Alert oldest = open.get(0);
            AlertSlot slot = slots.get(oldest.getDedupKey());
            if (slot == null) {
                continue;
            }
            synchronized (slot) {
                if (!slot.retired && slot.current != null
                        && slot.current.getAlertId().equals(oldest.getAlertId())) {
                    transitions.add(retire(slot, now, REASON_CAPACITY, null));
                }
            }
        }
        if (!transitions.isEmpty()) {
            LOG.warn("Active alert limit {} exceeded, resolved {} oldest alert(s)",
                    settings.getMaxActiveAlerts(), transitions.size());
        }
        return transitions;
    }

    private void publish(List<AlertTransition> transitions, AlertingSettings settings) {
        for (AlertTransition transition : transitions) {
            Alert alert = transition.getAlert();
            switch (transition.getKind()) {
                case OPENED -> LOG.info("Alert {} opened: {} [{}]", alert.getAlertId(), alert.getTitle(),
                        alert.getSeverity());
                case ESCALATED -> LOG.info("Alert {} escalated to {}", alert.getAlertId(), alert.getSeverity());
                case RESOLVED -> {
                    if (alert.getResolvedBy() != null) {
                        LOG.info("Alert {} resolved by {} ({})", alert.getAlertId(), alert.getResolvedBy(),
                                alert.getResolutionReason());
                    } else {
                        LOG.info("Alert {} resolved ({})", alert.getAlertId(), alert.getResolutionReason());
                    }
                    rememberResolved(alert, settings.getRecentResolvedCapacity());
                }
                default -> LOG.debug("Alert {} {}: occurrences={}", alert.getAlertId(), transition.getKind(),
                        alert.getOccurrenceCount());
            }
            notifyListeners(transition);
        }
    }

    private void rememberResolved(Alert alert, int capacity) {
        synchronized (recentlyResolved) {
            recentlyResolved.put(alert.getAlertId(), alert);
            while (recentlyResolved.size() > capacity) {
                String eldest = recentlyResolved.keySet().iterator().next();
                recentlyResolved.remove(eldest);
            }
        }
    }

    private void notifyListeners(AlertTransition transition) {
        for (AlertListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                LOG.warn("Alert listener {} failed on {}: {}", listener, transition.getKind(), e.getMessage(), e);
            }
        }
    }

    static DedupKey incidentKey(Incident incident) {
        return DedupKey.of(incident.getLogicalService(), DedupKey.ALL_ENVIRONMENTS,
                incident.getMembers().get(0).getMetricKind(), AnomalyCategory.CROSS_ENVIRONMENT);
    }

    private static String title(AnomalyCategory category, String subject, String where) {
        String what = switch (category) {
            case LATENCY_SPIKE -> "Latency spike";
            case ERROR_RATE_BREACH -> "Error rate breach";
            case SUSTAINED_DRIFT -> "Sustained degradation";
            case CROSS_ENVIRONMENT -> "Cross-environment incident";
            case ENVIRONMENT_DISCREPANCY -> "Environment discrepancy";
        };
        return what + " on " + subject + " (" + where + ")";
    }

    private static String tag(AnomalyCategory category) {
        return category.name().toLowerCase(Locale.ROOT);
    }

    private static List<String> incidentTags(Incident incident) {
        List<String> tags = new ArrayList<>();
        tags.add(tag(AnomalyCategory.CROSS_ENVIRONMENT));
        for (String env : incident.getEnvironmentsInvolved()) {
            tags.add("env:" + env);
        }
        return tags;
    }

    private static String incidentDescription(Incident incident) {
        StringBuilder sb = new StringBuilder()
                .append(incident.getMembers().size()).append(" correlated anomalies on ")
                .append(incident.getApiIds())
                .append(", started in ").append(incident.getOriginEnvironment());
        if (incident.getPropagationDelay() != null) {
            sb.append(", reached ").append(incident.getPropagationPath().get(1))
                    .append(" after ").append(incident.getPropagationDelay().toSeconds()).append("s");
        }
        return sb.append(String.format(" (confidence %.2f)", incident.getCorrelationConfidence())).toString();
    }
}
