package com.apisentinel.core.model;

/**
 * Kind of anomaly signal. Part of every {@link DedupKey}, so repeated signals
 * of the same category collapse into one alert lifecycle.
 *
 * @since 1.0.0
 */
public enum AnomalyCategory {

    /** Single response time far above the baseline. */
    LATENCY_SPIKE,

    /** Rolling error ratio above its historical 99th percentile. */
    ERROR_RATE_BREACH,

    /** Several consecutive buckets drifting above their seasonal expectation. */
    SUSTAINED_DRIFT,

    /** Correlated anomalies spanning environments (incident-sourced alerts). */
    CROSS_ENVIRONMENT,

    /** One environment's baseline far off its peers for the same logical service. */
    ENVIRONMENT_DISCREPANCY
}
