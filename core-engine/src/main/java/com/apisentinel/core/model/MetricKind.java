package com.apisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Family of a telemetry metric.
 *
 * <p>
 * Serialized by its wire name ({@code response_time}, {@code error_rate}).
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricKind {

    /** Request latency in milliseconds. */
    RESPONSE_TIME("response_time"),

    /** Ratio of failed requests in [0, 1]. */
    ERROR_RATE("error_rate");

    private final String wireName;

    MetricKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve a metric kind from its wire name or enum constant name.
     *
     * @param name wire name, case-insensitive
     * @return the matching kind
     * @throws IllegalArgumentException if {@code name} is unknown
     */
    @JsonCreator
    public static MetricKind fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (MetricKind kind : values()) {
                if (kind.wireName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown metric kind: '" + name + "'. Supported: response_time, error_rate");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
