package com.apisentinel.core.engine;

import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.Incident;
import com.apisentinel.core.model.Prediction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the engine for dashboards and operators.
 *
 * @since 1.0.0
 */
public interface EngineQueries {

    /**
     * @return open and suppressed alerts, oldest first
     */
    List<Alert> openAlerts();

    List<Alert> alertsByEnvironment(String environment);

    Optional<Alert> alert(String alertId);

    /**
     * @return incidents active at or after {@code since}, oldest first
     */
    List<Incident> recentIncidents(Instant since);

    /**
     * @param apiId       API filter, {@code null} for any
     * @param environment environment filter, {@code null} for any
     */
    List<Prediction> latestPredictions(String apiId, String environment);
}
