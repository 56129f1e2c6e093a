package com.apisentinel.core.correlation;

import com.apisentinel.core.config.CorrelationSettings;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Compares the baselines of one logical service across environments.
 *
 * <p>
 * Unlike the per-sample detectors this one judges steady state: an
 * environment whose typical response time is more than
 * {@code discrepancyThreshold} (relative to the pair's average) above its
 * fastest peer, or whose error ratio exceeds both {@code discrepancyMinErrorRatio}
 * and {@code discrepancyErrorFactor} times its healthiest peer, is flagged.
 * Only baselines with sufficient history take part.
 * </p>
 *
 * <p>
 * A series is reported when it becomes flagged and again when its severity
 * band rises; a flagged series that no longer diverges is reported as
 * cleared. Calls are serialized.
 * </p>
 *
 * @since 1.1.0
 */
public final class DiscrepancyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DiscrepancyDetector.class);

    public static final String NAME = "environment_discrepancy";

    private final Map<SeriesKey, Severity> flagged = new HashMap<>();

    /**
     * Result of one comparison pass.
     */
    public static final class Outcome {

        private static final Outcome EMPTY = new Outcome(Collections.emptyList(), Collections.emptyList());

        private final List<AnomalyCandidate> candidates;
        private final List<SeriesKey> cleared;

        Outcome(List<AnomalyCandidate> candidates, List<SeriesKey> cleared) {
            this.candidates = Collections.unmodifiableList(candidates);
            this.cleared = Collections.unmodifiableList(cleared);
        }

        /**
         * @return newly flagged or escalated series, one candidate each
         */
        public List<AnomalyCandidate> getCandidates() {
            return candidates;
        }

        /**
         * @return previously flagged series that are back in line with their peers
         */
        public List<SeriesKey> getCleared() {
            return cleared;
        }

        public boolean isEmpty() {
            return candidates.isEmpty() && cleared.isEmpty();
        }
    }

    /**
     * Compare the given baselines.
     *
     * @param baselines current baselines of every tracked series
     * @param now       timestamp of the produced candidates
     * @param cancelled checked between logical services; a cancelled pass
     *                  reports nothing and leaves the flagged state unchanged
     */
    public synchronized Outcome detect(Collection<BaselineSnapshot> baselines, Instant now,
            EngineConfig config, BooleanSupplier cancelled) {
        Objects.requireNonNull(baselines, "baselines must not be null");
        CorrelationSettings settings = config.getCorrelation();
        if (!settings.isDiscrepancyEnabled()) {
            if (flagged.isEmpty()) {
                return Outcome.EMPTY;
            }
            List<SeriesKey> cleared = new ArrayList<>(flagged.keySet());
            flagged.clear();
            return new Outcome(Collections.emptyList(), cleared);
        }

        Map<String, List<BaselineSnapshot>> groups = new LinkedHashMap<>();
        for (BaselineSnapshot baseline : baselines) {
            if (baseline.isInsufficientHistory()) {
                continue;
            }
            String group = config.logicalServiceOf(baseline.getApiId()) + "|" + baseline.getMetricKind();
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(baseline);
        }

        Map<SeriesKey, AnomalyCandidate> diverging = new HashMap<>();
        for (List<BaselineSnapshot> group : groups.values()) {
            if (cancelled.getAsBoolean()) {
                LOG.debug("Discrepancy pass cancelled after {} diverging series", diverging.size());
                return Outcome.EMPTY;
            }
            for (BaselineSnapshot baseline : group) {
                BaselineSnapshot peer = bestPeer(baseline, group);
                AnomalyCandidate candidate = peer == null ? null : compare(baseline, peer, now, settings);
                if (candidate != null) {
                    diverging.put(baseline.seriesKey(), candidate);
                }
            }
        }

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (Map.Entry<SeriesKey, AnomalyCandidate> e : diverging.entrySet()) {
            AnomalyCandidate candidate = e.getValue();
            Severity severity = config.getAlerting().severityOf(candidate.getDeviationScore());
            Severity previous = flagged.get(e.getKey());
            if (previous == null || severity.compareTo(previous) > 0) {
                flagged.put(e.getKey(), severity);
                candidates.add(candidate);
                LOG.info("Environment discrepancy on {}: {}", e.getKey(), candidate.getDescription());
            }
        }

        List<SeriesKey> cleared = new ArrayList<>();
        for (SeriesKey key : new ArrayList<>(flagged.keySet())) {
            if (!diverging.containsKey(key)) {
                flagged.remove(key);
                cleared.add(key);
                LOG.info("Environment discrepancy on {} cleared", key);
            }
        }
        return new Outcome(candidates, cleared);
    }

    /**
     * @return series currently considered out of line with their peers
     */
    public synchronized Set<SeriesKey> flaggedSeries() {
        return new HashSet<>(flagged.keySet());
    }

    // Lowest mean among series of other environments.
    private static BaselineSnapshot bestPeer(BaselineSnapshot baseline, List<BaselineSnapshot> group) {
        BaselineSnapshot best = null;
        for (BaselineSnapshot other : group) {
            if (other.getEnvironment().equals(baseline.getEnvironment())) {
                continue;
            }
            if (best == null || other.getMean() < best.getMean()) {
                best = other;
            }
        }
        return best;
    }

    private static AnomalyCandidate compare(BaselineSnapshot baseline, BaselineSnapshot peer, Instant now,
            CorrelationSettings settings) {
        double value = baseline.getMean();
        double reference = peer.getMean();
        if (value <= reference) {
            return null;
        }
        double threshold;
        double score;
        String description;
        if (baseline.getMetricKind() == MetricKind.ERROR_RATE) {
            threshold = Math.max(settings.getDiscrepancyMinErrorRatio(),
                    reference * settings.getDiscrepancyErrorFactor());
            if (value <= threshold) {
                return null;
            }
            score = 100.0 * Math.min(1.0, (value - reference) / value);
            description = String.format("Error ratio %.1f%% in %s against %.1f%% in %s",
                    value * 100, baseline.getEnvironment(), reference * 100, peer.getEnvironment());
        } else {
            double relative = (value - reference) / ((value + reference) / 2);
            if (relative <= settings.getDiscrepancyThreshold()) {
                return null;
            }
            threshold = reference * (1 + settings.getDiscrepancyThreshold());
            score = 100.0 * Math.min(1.0, relative);
            description = String.format("Mean response time %.1fms in %s is %.0f%% above %.1fms in %s",
                    value, baseline.getEnvironment(), relative * 100, reference, peer.getEnvironment());
        }
        return AnomalyCandidate.builder()
                .apiId(baseline.getApiId())
                .environment(baseline.getEnvironment())
                .metricKind(baseline.getMetricKind())
                .category(AnomalyCategory.ENVIRONMENT_DISCREPANCY)
                .observedValue(value)
                .expectedValue(reference)
                .threshold(threshold)
                .baseline(baseline)
                .deviationScore(score)
                .detectorSource(NAME)
                .timestamp(now)
                .description(description)
                .build();
    }
}
