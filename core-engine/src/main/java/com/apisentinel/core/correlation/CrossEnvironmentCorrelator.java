package com.apisentinel.core.correlation;

import com.apisentinel.core.config.CorrelationSettings;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.Incident;
import com.apisentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Groups anomaly candidates of the same logical service into incidents.
 *
 * <h3>Grouping</h3>
 * <p>
 * A candidate joins the open incident of its logical service whose last
 * member lies within the correlation window. Otherwise it is combined with the
 * pending candidates of that service; the group becomes an incident as soon
 * as it spans two environments, or its combined confidence
 * ({@link ConfidenceCalculator}) reaches the single-environment threshold.
 * </p>
 *
 * <h3>Closing</h3>
 * <ul>
 * <li>{@code TIMEOUT}: no member within the close timeout, checked on every
 * candidate and by {@link #sweep}</li>
 * <li>{@code CLEARED}: every member series produced a clean sample after its
 * last anomaly</li>
 * <li>{@code CAPACITY}: the oldest incident is closed when more than
 * {@code maxOpenIncidents} are open</li>
 * </ul>
 *
 * <h3>Thread safety</h3>
 * <p>
 * State is partitioned by logical service, each partition with its own lock.
 * Candidates of unrelated services never contend.
 * </p>
 *
 * @since 1.0.0
 */
public final class CrossEnvironmentCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(CrossEnvironmentCorrelator.class);

    private final Map<String, CorrelationPartition> partitions = new ConcurrentHashMap<>();
    private final Deque<Incident> recentlyClosed = new ArrayDeque<>();

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Correlate one candidate.
     *
     * @return incident versions produced, in order (possibly timeouts first)
     */
    public List<IncidentChange> onCandidate(AnomalyCandidate candidate, EngineConfig config) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(config, "config must not be null");

        String service = config.logicalServiceOf(candidate.getApiId());
        CorrelationPartition partition = partitions.computeIfAbsent(service, CorrelationPartition::new);
        List<IncidentChange> changes;
        synchronized (partition) {
            changes = partition.accept(candidate, config.getCorrelation(), config.getAlerting());
        }
        changes = new ArrayList<>(changes);
        changes.addAll(enforceCapacity(candidate.getTimestamp(), config.getCorrelation()));
        record(changes, config.getCorrelation());
        return changes;
    }

    /**
     * Note a non-anomalous sample of {@code series}; closes incidents whose
     * member series have all cleared.
     */
    public List<IncidentChange> onCleanSample(SeriesKey series, Instant timestamp, EngineConfig config) {
        CorrelationPartition partition = partitions.get(config.logicalServiceOf(series.getApiId()));
        if (partition == null) {
            return List.of();
        }
        List<IncidentChange> changes;
        synchronized (partition) {
            changes = partition.clean(series, timestamp);
        }
        record(changes, config.getCorrelation());
        return changes;
    }

    /**
     * Close timed-out incidents partition by partition.
     *
     * @param cancelled checked between partitions; a {@code true} answer stops
     *                  the sweep early
     */
    public List<IncidentChange> sweep(Instant now, EngineConfig config, BooleanSupplier cancelled) {
        List<IncidentChange> changes = new ArrayList<>();
        for (CorrelationPartition partition : partitions.values()) {
            if (cancelled.getAsBoolean()) {
                LOG.info("Correlation sweep cancelled");
                break;
            }
            synchronized (partition) {
                changes.addAll(partition.expire(now, config.getCorrelation()));
            }
        }
        record(changes, config.getCorrelation());
        return changes;
    }

    public List<Incident> openIncidents() {
        List<Incident> incidents = new ArrayList<>();
        for (CorrelationPartition partition : partitions.values()) {
            synchronized (partition) {
                incidents.addAll(partition.openIncidents());
            }
        }
        incidents.sort(Comparator.comparing(Incident::getCreatedAt));
        return incidents;
    }

    /**
     * Open incidents plus retained closed ones that were active at or after
     * {@code since}, oldest first.
     */
    public List<Incident> recentIncidents(Instant since) {
        List<Incident> incidents = new ArrayList<>();
        for (Incident incident : openIncidents()) {
            if (!incident.getLastMemberAt().isBefore(since)) {
                incidents.add(incident);
            }
        }
        synchronized (recentlyClosed) {
            for (Incident incident : recentlyClosed) {
                if (!incident.getClosedAt().isBefore(since)) {
                    incidents.add(incident);
                }
            }
        }
        incidents.sort(Comparator.comparing(Incident::getCreatedAt));
        return incidents;
    }

    public Optional<Incident> get(String incidentId) {
        for (Incident incident : openIncidents()) {
            if (incident.getIncidentId().equals(incidentId)) {
                return Optional.of(incident);
            }
        }
        synchronized (recentlyClosed) {
            return recentlyClosed.stream()
                    .filter(i -> i.getIncidentId().equals(incidentId))
                    .findFirst();
        }
    }

    public int openCount() {
        int count = 0;
        for (CorrelationPartition partition : partitions.values()) {
            synchronized (partition) {
                count += partition.openCount();
            }
        }
        return count;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    // Runs outside any partition lock; locks one partition at a time.
    private List<IncidentChange> enforceCapacity(Instant now, CorrelationSettings settings) {
        List<IncidentChange> changes = new ArrayList<>();
        int excess = openCount() - settings.getMaxOpenIncidents();
        while (excess-- > 0) {
            Incident oldest = null;
            CorrelationPartition owner = null;
            for (CorrelationPartition partition : partitions.values()) {
                synchronized (partition) {
                    for (Incident incident : partition.openIncidents()) {
                        if (oldest == null || incident.getCreatedAt().isBefore(oldest.getCreatedAt())) {
                            oldest = incident;
                            owner = partition;
                        }
                    }
                }
            }
            if (owner == null) {
                break;
            }
            synchronized (owner) {
                owner.closeIfOpen(oldest.getIncidentId(), now, Incident.CloseReason.CAPACITY)
                        .ifPresent(changes::add);
            }
        }
        if (!changes.isEmpty()) {
            LOG.warn("Open incident limit {} exceeded, closed {} oldest incident(s)",
                    settings.getMaxOpenIncidents(), changes.size());
        }
        return changes;
    }

    private void record(List<IncidentChange> changes, CorrelationSettings settings) {
        for (IncidentChange change : changes) {
            Incident incident = change.getIncident();
            switch (change.getType()) {
                case OPENED -> LOG.info("Incident {} opened for '{}' across {} (confidence {})",
                        incident.getIncidentId(), incident.getLogicalService(),
                        incident.getPropagationPath(), String.format("%.3f", incident.getCorrelationConfidence()));
                case UPDATED -> LOG.debug("Incident {} updated: {}", incident.getIncidentId(), incident);
                case CLOSED -> {
                    LOG.info("Incident {} closed ({})", incident.getIncidentId(), incident.getCloseReason());
                    retain(incident, settings.getRecentIncidentCapacity());
                }
            }
        }
    }

    private void retain(Incident closed, int capacity) {
        synchronized (recentlyClosed) {
            recentlyClosed.addLast(closed);
            while (recentlyClosed.size() > capacity) {
                recentlyClosed.removeFirst();
            }
        }
    }
}
