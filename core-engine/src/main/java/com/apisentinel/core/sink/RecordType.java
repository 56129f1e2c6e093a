package com.apisentinel.core.sink;

/**
 * Kind of entity an {@link EngineRecord} carries.
 *
 * @since 1.0.0
 */
public enum RecordType {
    ANOMALY,
    INCIDENT,
    PREDICTION,
    ALERT
}
