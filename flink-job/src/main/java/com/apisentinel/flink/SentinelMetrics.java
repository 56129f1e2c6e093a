package com.apisentinel.flink;

import com.apisentinel.core.alerting.AlertTransition;
import com.apisentinel.core.correlation.IncidentChange;
import com.apisentinel.core.engine.IngestResult;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for API Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The reporter is configured at cluster level; the job only defines the
 * metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code samples_processed_total} – samples accepted by the engine</li>
 *   <li>{@code samples_discarded_total} – malformed or too-late samples</li>
 *   <li>{@code anomalies_detected_total} – anomaly candidates</li>
 *   <li>{@code incidents_opened_total} – cross-environment incidents opened</li>
 *   <li>{@code alerts_opened_total} – alerts opened</li>
 *   <li>{@code notifications_emitted_total} – notification intents emitted</li>
 *   <li>{@code processing_latency_ms} – histogram of per-sample latency</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter samplesProcessed;
    private final Counter samplesDiscarded;
    private final Counter anomaliesDetected;
    private final Counter incidentsOpened;
    private final Counter alertsOpened;
    private final Counter notificationsEmitted;
    private final Histogram processingLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("api_sentinel");

        this.samplesProcessed = group.counter("samples_processed_total");
        this.samplesDiscarded = group.counter("samples_discarded_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.incidentsOpened = group.counter("incidents_opened_total");
        this.alertsOpened = group.counter("alerts_opened_total");
        this.notificationsEmitted = group.counter("notifications_emitted_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void record(IngestResult result) {
        if (result.getStatus() == IngestResult.Status.DISCARDED) {
            samplesDiscarded.inc();
            return;
        }
        samplesProcessed.inc();
        anomaliesDetected.inc(result.getCandidates().size());
        recordIncidents(result.getIncidentChanges().stream()
                .filter(c -> c.getType() == IncidentChange.Type.OPENED)
                .count());
        recordAlerts(result.getAlertTransitions().stream()
                .filter(t -> t.getKind() == AlertTransition.Kind.OPENED)
                .count());
    }

    public void recordIncidents(long opened) {
        incidentsOpened.inc(opened);
    }

    public void recordAlerts(long opened) {
        alertsOpened.inc(opened);
    }

    public void recordNotifications(long emitted) {
        notificationsEmitted.inc(emitted);
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
