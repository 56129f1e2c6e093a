package com.apisentinel.core.sink;

/**
 * Append-only destination for engine records (anomalies, incidents,
 * predictions, alerts).
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RecordSink {

    /**
     * Append one record. Delivery is at-least-once: implementations should
     * treat a repeated {@link EngineRecord#getRecordId()} as a no-op.
     *
     * @throws Exception if the record could not be stored; the call is retried
     */
    void append(EngineRecord record) throws Exception;

    /** Sink that drops everything. */
    static RecordSink discarding() {
        return record -> {
        };
    }
}
