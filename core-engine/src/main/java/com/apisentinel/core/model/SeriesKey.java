package com.apisentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of one metric series: (api, environment, metric kind).
 *
 * <p>
 * One live baseline exists per series key.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String apiId;
    private final String environment;
    private final MetricKind metricKind;

    private SeriesKey(String apiId, String environment, MetricKind metricKind) {
        this.apiId = Objects.requireNonNull(apiId, "apiId must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.metricKind = Objects.requireNonNull(metricKind, "metricKind must not be null");
    }

    public static SeriesKey of(String apiId, String environment, MetricKind metricKind) {
        return new SeriesKey(apiId, environment, metricKind);
    }

    public String getApiId() {
        return apiId;
    }

    public String getEnvironment() {
        return environment;
    }

    public MetricKind getMetricKind() {
        return metricKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return apiId.equals(that.apiId)
                && environment.equals(that.environment)
                && metricKind == that.metricKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiId, environment, metricKind);
    }

    @Override
    public String toString() {
        return apiId + "|" + environment + "|" + metricKind;
    }
}
