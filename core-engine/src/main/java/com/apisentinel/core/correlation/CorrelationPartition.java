package com.apisentinel.core.correlation;

import com.apisentinel.core.config.AlertingSettings;
import com.apisentinel.core.config.CorrelationSettings;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.Incident;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Correlation state of one logical service: pending candidates and open
 * incidents.
 *
 * <p>
 * Every method must be called while holding the partition's monitor.
 * </p>
 */
final class CorrelationPartition {

    private final String logicalService;
    private final Deque<AnomalyCandidate> pending = new ArrayDeque<>();
    private final Map<String, Tracked> open = new LinkedHashMap<>();

    CorrelationPartition(String logicalService) {
        this.logicalService = logicalService;
    }

    /**
     * An open incident plus the bookkeeping needed to detect clearing.
     */
    private static final class Tracked {
        Incident incident;
        final Map<SeriesKey, Instant> lastAnomaly = new HashMap<>();
        final Set<SeriesKey> cleared = new HashSet<>();

        Tracked(Incident incident) {
            this.incident = incident;
            for (AnomalyCandidate m : incident.getMembers()) {
                lastAnomaly.merge(m.seriesKey(), m.getTimestamp(),
                        (a, b) -> a.isAfter(b) ? a : b);
            }
        }
    }

    // ---------------------------------------------------------------
    // Candidates
    // ---------------------------------------------------------------

    List<IncidentChange> accept(AnomalyCandidate candidate, CorrelationSettings settings,
            AlertingSettings bands) {
        Instant now = candidate.getTimestamp();
        List<IncidentChange> changes = new ArrayList<>(expire(now, settings));

        Duration window = settings.window();
        Optional<Tracked> target = open.values().stream()
                .filter(t -> Duration.between(t.incident.getLastMemberAt(), now).abs().compareTo(window) <= 0)
                .max(Comparator.comparing(t -> t.incident.getLastMemberAt()));

        if (target.isPresent()) {
            Tracked tracked = target.get();
            tracked.incident = withMembers(tracked.incident.toBuilder(), List.of(candidate),
                    tracked.incident.getSeverity(), settings, bands);
            tracked.lastAnomaly.merge(candidate.seriesKey(), now, (a, b) -> a.isAfter(b) ? a : b);
            tracked.cleared.remove(candidate.seriesKey());
            changes.add(new IncidentChange(IncidentChange.Type.UPDATED, tracked.incident));
            return changes;
        }

        prunePending(now, window);
        List<AnomalyCandidate> group = new ArrayList<>(pending);
        group.add(candidate);
        long environments = group.stream().map(AnomalyCandidate::getEnvironment).distinct().count();
        double confidence = ConfidenceCalculator.combined(group);

        if (environments >= 2 || confidence >= settings.getSingleEnvironmentThreshold()) {
            group.sort(Comparator.comparing(AnomalyCandidate::getTimestamp));
            Incident incident = withMembers(Incident.builder()
                    .logicalService(logicalService)
                    .createdAt(now), group, null, settings, bands);
            pending.clear();
            open.put(incident.getIncidentId(), new Tracked(incident));
            changes.add(new IncidentChange(IncidentChange.Type.OPENED, incident));
        } else {
            pending.addLast(candidate);
            while (pending.size() > settings.getMaxPendingPerService()) {
                pending.removeFirst();
            }
        }
        return changes;
    }

    /**
     * Record a non-anomalous in-order sample of {@code series}.
     */
    List<IncidentChange> clean(SeriesKey series, Instant timestamp) {
        List<IncidentChange> changes = new ArrayList<>();
        Iterator<Tracked> it = open.values().iterator();
        while (it.hasNext()) {
            Tracked tracked = it.next();
            Instant last = tracked.lastAnomaly.get(series);
            if (last == null || !timestamp.isAfter(last)) {
                continue;
            }
            tracked.cleared.add(series);
            if (tracked.cleared.containsAll(tracked.lastAnomaly.keySet())) {
                it.remove();
                changes.add(new IncidentChange(IncidentChange.Type.CLOSED,
                        close(tracked.incident, timestamp, Incident.CloseReason.CLEARED)));
            }
        }
        return changes;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    List<IncidentChange> expire(Instant now, CorrelationSettings settings) {
        List<IncidentChange> changes = new ArrayList<>();
        Iterator<Tracked> it = open.values().iterator();
        while (it.hasNext()) {
            Tracked tracked = it.next();
            if (tracked.incident.getLastMemberAt().plus(settings.closeTimeout()).isBefore(now)) {
                it.remove();
                changes.add(new IncidentChange(IncidentChange.Type.CLOSED,
                        close(tracked.incident, now, Incident.CloseReason.TIMEOUT)));
            }
        }
        prunePending(now, settings.window());
        return changes;
    }

    Optional<IncidentChange> closeIfOpen(String incidentId, Instant now, Incident.CloseReason reason) {
        Tracked tracked = open.remove(incidentId);
        if (tracked == null) {
            return Optional.empty();
        }
        return Optional.of(new IncidentChange(IncidentChange.Type.CLOSED,
                close(tracked.incident, now, reason)));
    }

    List<Incident> openIncidents() {
        List<Incident> incidents = new ArrayList<>(open.size());
        for (Tracked tracked : open.values()) {
            incidents.add(tracked.incident);
        }
        return incidents;
    }

    int openCount() {
        return open.size();
    }

    int pendingCount() {
        return pending.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void prunePending(Instant now, Duration window) {
        pending.removeIf(c -> Duration.between(c.getTimestamp(), now).compareTo(window) > 0);
    }

    private static Incident close(Incident incident, Instant now, Incident.CloseReason reason) {
        Instant closedAt = now.isBefore(incident.getLastMemberAt()) ? incident.getLastMemberAt() : now;
        return incident.toBuilder().closed(closedAt, reason).build();
    }

    private static Incident withMembers(Incident.Builder builder, List<AnomalyCandidate> added,
            Severity current, CorrelationSettings settings, AlertingSettings bands) {
        for (AnomalyCandidate member : added) {
            builder.addMember(member);
        }
        Incident draft = builder.severity(Severity.INFO).build();

        Severity memberMax = Severity.INFO;
        Instant lastMember = draft.getLastMemberAt();
        for (AnomalyCandidate member : draft.getMembers()) {
            memberMax = Severity.max(memberMax, bands.severityOf(member.getDeviationScore()));
            if (lastMember == null || member.getTimestamp().isAfter(lastMember)) {
                lastMember = member.getTimestamp();
            }
        }
        if (draft.getEnvironmentsInvolved().size() >= settings.getEscalationEnvironmentCount()) {
            memberMax = memberMax.bump();
        }

        return draft.toBuilder()
                .severity(Severity.max(current, memberMax))
                .correlationConfidence(ConfidenceCalculator.combined(draft.getMembers()))
                .lastMemberAt(lastMember)
                .build();
    }
}
