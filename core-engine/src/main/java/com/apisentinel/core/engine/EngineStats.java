package com.apisentinel.core.engine;

/**
 * Point-in-time counters of an {@link AnalysisEngine}.
 *
 * @since 1.0.0
 */
public final class EngineStats {

    private final long samplesProcessed;
    private final long samplesDiscarded;
    private final long anomaliesDetected;
    private final long incidentsOpened;
    private final long alertsOpened;
    private final long notificationsEmitted;
    private final long deliveryFailures;
    private final int trackedSeries;
    private final int openIncidents;
    private final int activeAlerts;

    EngineStats(long samplesProcessed, long samplesDiscarded, long anomaliesDetected, long incidentsOpened,
            long alertsOpened, long notificationsEmitted, long deliveryFailures, int trackedSeries,
            int openIncidents, int activeAlerts) {
        this.samplesProcessed = samplesProcessed;
        this.samplesDiscarded = samplesDiscarded;
        this.anomaliesDetected = anomaliesDetected;
        this.incidentsOpened = incidentsOpened;
        this.alertsOpened = alertsOpened;
        this.notificationsEmitted = notificationsEmitted;
        this.deliveryFailures = deliveryFailures;
        this.trackedSeries = trackedSeries;
        this.openIncidents = openIncidents;
        this.activeAlerts = activeAlerts;
    }

    public long getSamplesProcessed() {
        return samplesProcessed;
    }

    public long getSamplesDiscarded() {
        return samplesDiscarded;
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected;
    }

    public long getIncidentsOpened() {
        return incidentsOpened;
    }

    public long getAlertsOpened() {
        return alertsOpened;
    }

    public long getNotificationsEmitted() {
        return notificationsEmitted;
    }

    public long getDeliveryFailures() {
        return deliveryFailures;
    }

    public int getTrackedSeries() {
        return trackedSeries;
    }

    public int getOpenIncidents() {
        return openIncidents;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    @Override
    public String toString() {
        return "EngineStats{processed=" + samplesProcessed
                + ", discarded=" + samplesDiscarded
                + ", anomalies=" + anomaliesDetected
                + ", incidentsOpened=" + incidentsOpened
                + ", alertsOpened=" + alertsOpened
                + ", notifications=" + notificationsEmitted
                + ", deliveryFailures=" + deliveryFailures
                + ", series=" + trackedSeries
                + ", openIncidents=" + openIncidents
                + ", activeAlerts=" + activeAlerts + '}';
    }
}
