package com.apisentinel.core.baseline;

import com.apisentinel.core.config.BaselineSettings;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling statistical profile of every metric series seen so far.
 *
 * <h3>Statistics</h3>
 * <ul>
 * <li>Mean and variance are exponentially weighted. While a series is young
 * the weight is {@code 1/n}, giving the exact population moments.</li>
 * <li>p50/p95/p99 come from a reservoir of the most recent in-order
 * values.</li>
 * <li>Completed time buckets carry their mean and the hour-of-week seasonal
 * expectation in force when they closed.</li>
 * <li>{@code error_rate} series also keep a rolling error window and the
 * historical 99th percentile of its ratio.</li>
 * </ul>
 *
 * <h3>Ordering</h3>
 * <p>
 * A sample earlier than the latest timestamp of its series is <em>late</em>:
 * it updates the moments and counts but nothing time-ordered, and its
 * snapshot is flagged so detectors skip it. A sample behind by more than the
 * configured lateness is <em>discarded</em> without touching the state.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Each series has its own lock; updates to different series never contend,
 * updates to the same series are applied one at a time and every snapshot is
 * consistent.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineModel {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineModel.class);

    private final Map<SeriesKey, BaselineState> states = new ConcurrentHashMap<>();

    /**
     * Fold a sample into its series baseline.
     *
     * @param sample   a valid sample; must not be {@code null}
     * @param settings settings snapshot to apply
     * @return snapshot holding the statistics from before the sample plus the
     *         current error window and buckets
     * @throws IllegalArgumentException if the sample is malformed
     */
    public BaselineSnapshot update(MetricSample sample, BaselineSettings settings) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        sample.validationError().ifPresent(err -> {
            throw new IllegalArgumentException("Malformed sample: " + err);
        });

        SeriesKey key = sample.seriesKey();
        while (true) {
            BaselineState state = states.computeIfAbsent(key, k -> {
                LOG.debug("New baseline for {}", k);
                return new BaselineState(k, settings);
            });
            synchronized (state) {
                if (state.isRetired()) {
                    continue;
                }
                BaselineSnapshot snapshot = state.update(sample, settings);
                if (snapshot.isDiscarded()) {
                    LOG.warn("Discarded sample for {} at {}: later than allowed lateness {}",
                            key, sample.getTimestamp(), settings.maxLateness());
                } else if (snapshot.isLate()) {
                    LOG.debug("Late sample for {} at {}", key, sample.getTimestamp());
                }
                return snapshot;
            }
        }
    }

    /**
     * @return current baseline of {@code key}, empty if the series is unknown
     */
    public Optional<BaselineSnapshot> snapshot(SeriesKey key, BaselineSettings settings) {
        BaselineState state = states.get(key);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return state.isRetired() ? Optional.empty() : Optional.of(state.current(settings));
        }
    }

    public List<SeriesKey> keys() {
        return new ArrayList<>(states.keySet());
    }

    public int size() {
        return states.size();
    }

    /**
     * Drop series that have not produced a sample within the idle period.
     *
     * @return number of evicted series
     */
    public int evictIdle(Instant now, BaselineSettings settings) {
        int evicted = 0;
        for (Map.Entry<SeriesKey, BaselineState> e : states.entrySet()) {
            BaselineState state = e.getValue();
            synchronized (state) {
                if (state.isIdle(now, settings) && states.remove(e.getKey(), state)) {
                    state.retire();
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            LOG.info("Evicted {} idle baseline(s)", evicted);
        }
        return evicted;
    }
}
