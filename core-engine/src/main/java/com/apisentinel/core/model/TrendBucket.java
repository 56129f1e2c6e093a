package com.apisentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A closed time bucket of one series: its mean and the seasonal expectation
 * (same hour of week) that was in force when the bucket closed.
 *
 * @since 1.0.0
 */
public final class TrendBucket implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant start;
    private final double mean;
    private final long count;
    private final double expected;

    public TrendBucket(Instant start, double mean, long count, double expected) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.mean = mean;
        this.count = count;
        this.expected = expected;
    }

    public Instant getStart() {
        return start;
    }

    public double getMean() {
        return mean;
    }

    public long getCount() {
        return count;
    }

    public double getExpected() {
        return expected;
    }

    @Override
    public String toString() {
        return "TrendBucket{start=" + start + ", mean=" + mean + ", count=" + count
                + ", expected=" + expected + '}';
    }
}
