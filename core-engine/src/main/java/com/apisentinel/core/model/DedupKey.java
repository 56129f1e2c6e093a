package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity used to collapse repeated anomaly signals into a single alert
 * lifecycle: api + environment + metric kind + anomaly category.
 *
 * <p>
 * Incident-sourced alerts use the logical service as {@code apiId} and
 * {@value #ALL_ENVIRONMENTS} as environment.
 * </p>
 *
 * @since 1.0.0
 */
public final class DedupKey implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Environment placeholder for keys that span environments. */
    public static final String ALL_ENVIRONMENTS = "*";

    private final String apiId;
    private final String environment;
    private final MetricKind metricKind;
    private final AnomalyCategory category;

    private DedupKey(String apiId, String environment, MetricKind metricKind, AnomalyCategory category) {
        this.apiId = Objects.requireNonNull(apiId, "apiId must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.metricKind = Objects.requireNonNull(metricKind, "metricKind must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    public static DedupKey of(String apiId, String environment, MetricKind metricKind,
            AnomalyCategory category) {
        return new DedupKey(apiId, environment, metricKind, category);
    }

    public static DedupKey of(SeriesKey series, AnomalyCategory category) {
        return new DedupKey(series.getApiId(), series.getEnvironment(), series.getMetricKind(), category);
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

    public AnomalyCategory getCategory() {
        return category;
    }

    /**
     * @return {@code true} if this key covers several environments
     */
    public boolean isCrossEnvironment() {
        return ALL_ENVIRONMENTS.equals(environment);
    }

    @JsonValue
    public String asString() {
        return apiId + "|" + environment + "|" + metricKind + "|" + category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DedupKey that))
            return false;
        return apiId.equals(that.apiId)
                && environment.equals(that.environment)
                && metricKind == that.metricKind
                && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiId, environment, metricKind, category);
    }

    @Override
    public String toString() {
        return asString();
    }
}
