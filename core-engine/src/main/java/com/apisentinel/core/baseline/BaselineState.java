package com.apisentinel.core.baseline;

import com.apisentinel.core.config.BaselineSettings;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.TrendBucket;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Mutable statistics of one series.
 *
 * <p>
 * Not thread-safe: {@link BaselineModel} serializes access per instance.
 * </p>
 */
final class BaselineState {

    private static final int HOURS_PER_WEEK = 168;

    private final SeriesKey key;

    // EWMA moments
    private long count;
    private long lateCount;
    private double mean;
    private double variance;

    private Instant firstSeen;
    private Instant latest;

    private final Ring values;
    private final Ring ratios;

    // rolling error window of in-order samples: {errors, requests}
    private final Deque<double[]> errorWindow = new ArrayDeque<>();
    private double windowErrors;
    private long windowRequests;

    // open bucket and the ring of completed ones
    private Instant bucketStart;
    private double bucketSum;
    private long bucketCount;
    private final Deque<TrendBucket> buckets = new ArrayDeque<>();

    private final double[] seasonalMean = new double[HOURS_PER_WEEK];
    private final long[] seasonalCount = new long[HOURS_PER_WEEK];

    private boolean retired;

    BaselineState(SeriesKey key, BaselineSettings settings) {
        this.key = key;
        this.values = new Ring(settings.getReservoirSize());
        this.ratios = new Ring(settings.getReservoirSize());
    }

    /**
     * Fold a sample in and return the snapshot it must be judged against.
     */
    BaselineSnapshot update(MetricSample sample, BaselineSettings settings) {
        Instant ts = sample.getTimestamp();

        if (latest != null && ts.isBefore(latest)) {
            if (Duration.between(ts, latest).compareTo(settings.maxLateness()) > 0) {
                return priorSnapshot(settings).discarded(true).build();
            }
            BaselineSnapshot prior = priorSnapshot(settings).late(true).build();
            foldMoments(sample.getValue(), settings);
            lateCount++;
            return prior;
        }

        BaselineSnapshot.Builder prior = priorSnapshot(settings);

        if (firstSeen == null) {
            firstSeen = ts;
        }
        latest = ts;
        rollBucket(ts, settings);
        bucketSum += sample.getValue();
        bucketCount++;
        values.add(sample.getValue());
        if (key.getMetricKind() == MetricKind.ERROR_RATE) {
            foldErrorWindow(sample, settings);
        }
        foldMoments(sample.getValue(), settings);

        return prior.errorWindow(windowErrors, windowRequests)
                .recentBuckets(new ArrayList<>(buckets))
                .window(firstSeen, latest)
                .build();
    }

    /**
     * Current statistics, sample already folded in.
     */
    BaselineSnapshot current(BaselineSettings settings) {
        return priorSnapshot(settings).build();
    }

    boolean isIdle(Instant now, BaselineSettings settings) {
        return latest != null && latest.plus(settings.idleEviction()).isBefore(now);
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private BaselineSnapshot.Builder priorSnapshot(BaselineSettings settings) {
        double p50 = mean;
        double p95 = mean;
        double p99 = mean;
        if (values.size() > 0) {
            Percentile percentile = new Percentile();
            percentile.setData(values.toArray());
            p50 = percentile.evaluate(50.0);
            p95 = percentile.evaluate(95.0);
            p99 = percentile.evaluate(99.0);
        }
        double ratioP99 = ratios.size() > 0 ? new Percentile().evaluate(ratios.toArray(), 99.0) : 0.0;

        return BaselineSnapshot.builder()
                .seriesKey(key)
                .mean(mean)
                .variance(variance)
                .percentiles(p50, p95, p99)
                .sampleCount(count)
                .lateCount(lateCount)
                .window(firstSeen, latest)
                .insufficientHistory(count < settings.getMinSamples())
                .errorWindow(windowErrors, windowRequests)
                .ratioP99(ratioP99)
                .recentBuckets(new ArrayList<>(buckets));
    }

    // Effective weight max(alpha, 1/n) yields the exact population moments while n < 1/alpha.
    private void foldMoments(double x, BaselineSettings settings) {
        count++;
        double w = Math.max(settings.getEwmaAlpha(), 1.0 / count);
        double delta = x - mean;
        mean += w * delta;
        variance = (1 - w) * (variance + w * delta * delta);
    }

    private void foldErrorWindow(MetricSample sample, BaselineSettings settings) {
        double errors = sample.errorCount();
        long requests = sample.getRequestCount();
        errorWindow.addLast(new double[] { errors, requests });
        windowErrors += errors;
        windowRequests += requests;
        while (errorWindow.size() > settings.getErrorWindowSamples()) {
            double[] evicted = errorWindow.removeFirst();
            windowErrors -= evicted[0];
            windowRequests -= (long) evicted[1];
        }
        if (windowRequests > 0) {
            ratios.add(windowErrors / windowRequests);
        }
    }

    private void rollBucket(Instant ts, BaselineSettings settings) {
        long width = settings.getBucketSeconds();
        Instant start = Instant.ofEpochSecond(Math.floorDiv(ts.getEpochSecond(), width) * width);
        if (bucketStart == null) {
            bucketStart = start;
            return;
        }
        if (!start.isAfter(bucketStart)) {
            return;
        }
        if (bucketCount > 0) {
            double bucketMean = bucketSum / bucketCount;
            int slot = hourOfWeek(bucketStart);
            double expected = seasonalCount[slot] >= settings.getMinSeasonalSamples()
                    ? seasonalMean[slot]
                    : mean;
            buckets.addLast(new TrendBucket(bucketStart, bucketMean, bucketCount, expected));
            while (buckets.size() > settings.getTrendBuckets()) {
                buckets.removeFirst();
            }
            seasonalCount[slot]++;
            double w = Math.max(settings.getEwmaAlpha(), 1.0 / seasonalCount[slot]);
            seasonalMean[slot] += w * (bucketMean - seasonalMean[slot]);
        }
        bucketStart = start;
        bucketSum = 0;
        bucketCount = 0;
    }

    static int hourOfWeek(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        DayOfWeek day = t.getDayOfWeek();
        return (day.getValue() - 1) * 24 + t.getHour();
    }

    /**
     * Fixed-capacity ring of doubles, overwriting the oldest value.
     */
    private static final class Ring {
        private final double[] data;
        private int next;
        private int size;

        Ring(int capacity) {
            this.data = new double[capacity];
        }

        void add(double v) {
            data[next] = v;
            next = (next + 1) % data.length;
            if (size < data.length) {
                size++;
            }
        }

        int size() {
            return size;
        }

        double[] toArray() {
            double[] out = new double[size];
            int start = size < data.length ? 0 : next;
            for (int i = 0; i < size; i++) {
                out[i] = data[(start + i) % data.length];
            }
            return out;
        }
    }
}
