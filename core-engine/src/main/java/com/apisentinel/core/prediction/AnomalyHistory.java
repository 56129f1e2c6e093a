package com.apisentinel.core.prediction;

import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.SeriesKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timestamps of recent anomaly candidates per series, bounded by the look-back
 * of the predictive engine.
 *
 * @since 1.0.0
 */
public final class AnomalyHistory {

    private static final int MAX_PER_SERIES = 1024;

    private final Map<SeriesKey, Deque<Instant>> history = new ConcurrentHashMap<>();

    public void record(AnomalyCandidate candidate) {
        Instant at = candidate.getTimestamp();
        // compute keeps the append atomic with prune's removal of the same key
        history.compute(candidate.seriesKey(), (k, times) -> {
            Deque<Instant> deque = times != null ? times : new ArrayDeque<>();
            synchronized (deque) {
                deque.addLast(at);
                if (deque.size() > MAX_PER_SERIES) {
                    deque.removeFirst();
                }
            }
            return deque;
        });
    }

    /**
     * @return candidates of {@code key} in {@code (now - lookback, now]}
     */
    public int count(SeriesKey key, Instant now, Duration lookback) {
        Deque<Instant> times = history.get(key);
        if (times == null) {
            return 0;
        }
        Instant since = now.minus(lookback);
        synchronized (times) {
            while (!times.isEmpty() && !times.peekFirst().isAfter(since)) {
                times.removeFirst();
            }
            int count = 0;
            for (Instant t : times) {
                if (t.isAfter(since) && !t.isAfter(now)) {
                    count++;
                }
            }
            return count;
        }
    }

    /**
     * Drop expired timestamps and series left without any.
     */
    public void prune(Instant now, Duration lookback) {
        Instant since = now.minus(lookback);
        for (SeriesKey key : history.keySet()) {
            history.computeIfPresent(key, (k, times) -> {
                synchronized (times) {
                    while (!times.isEmpty() && !times.peekFirst().isAfter(since)) {
                        times.removeFirst();
                    }
                    return times.isEmpty() ? null : times;
                }
            });
        }
    }

    public int size() {
        return history.size();
    }
}
