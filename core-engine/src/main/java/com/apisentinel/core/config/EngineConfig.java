package com.apisentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section is optional):
 * </p>
 *
 * <pre>
 * defaults:
 *   sensitivity: 1.0
 *   deviationFactor: 3.0
 * environments:
 *   aws-prod: { sensitivity: 1.2 }
 * logicalServices:
 *   checkout: [checkout-aws, checkout-azure]
 * detectors: [response_time, error_rate, pattern]
 * baseline:    { ewmaAlpha: 0.05, minSamples: 5 }
 * detection:   { minRequestVolume: 20 }
 * correlation: { windowSeconds: 300 }
 * alerting:    { alertingThreshold: warning }
 * prediction:  { horizonMinutes: 30 }
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Lookups that miss a configured
 * environment or logical service fall back to the defaults and log the gap
 * once.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfig.class);

    private EnvironmentProfile defaults = new EnvironmentProfile();
    private Map<String, EnvironmentProfile> environments = new LinkedHashMap<>();
    private Map<String, List<String>> logicalServices = new LinkedHashMap<>();
    private List<String> detectors = new ArrayList<>(List.of("response_time", "error_rate", "pattern"));

    private BaselineSettings baseline = new BaselineSettings();
    private DetectionSettings detection = new DetectionSettings();
    private CorrelationSettings correlation = new CorrelationSettings();
    private AlertingSettings alerting = new AlertingSettings();
    private PredictionSettings prediction = new PredictionSettings();

    /** Threads of the ingestion worker pool used by asynchronous submits. */
    private int workerThreads = 4;

    /** Delivery attempts per outbound record or notification. */
    private int deliveryAttempts = 3;

    private int deliveryBackoffMillis = 200;

    private final Set<String> reportedGaps = ConcurrentHashMap.newKeySet();

    // ---------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------

    /**
     * Resolve the detection profile of an environment.
     *
     * @param environment environment name
     * @return the configured profile, or {@link #getDefaults()} if none is
     *         configured
     */
    public EnvironmentProfile environmentProfile(String environment) {
        EnvironmentProfile profile = environments.get(environment);
        if (profile != null) {
            return profile;
        }
        if (!environments.isEmpty() && reportedGaps.add("env:" + environment)) {
            LOG.warn("No profile configured for environment '{}', using defaults {}", environment, defaults);
        }
        return defaults;
    }

    /**
     * Resolve the logical service an API belongs to.
     *
     * @param apiId API identifier
     * @return the configured logical service, or {@code apiId} itself
     */
    public String logicalServiceOf(String apiId) {
        for (Map.Entry<String, List<String>> e : logicalServices.entrySet()) {
            if (e.getValue() != null && e.getValue().contains(apiId)) {
                return e.getKey();
            }
        }
        if (reportedGaps.add("api:" + apiId)) {
            LOG.warn("API '{}' is not mapped to a logical service, correlating under its own id", apiId);
        }
        return apiId;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (defaults == null) {
            errors.add("'defaults' must not be null");
        } else {
            defaults.validate("defaults", errors);
        }
        environments.forEach((name, profile) -> {
            if (profile == null) {
                errors.add("Environment '" + name + "' has no profile");
            } else {
                profile.validate(name, errors);
            }
        });

        Map<String, String> owner = new LinkedHashMap<>();
        logicalServices.forEach((service, apis) -> {
            if (apis == null || apis.isEmpty()) {
                errors.add("Logical service '" + service + "' lists no APIs");
                return;
            }
            for (String api : apis) {
                String previous = owner.putIfAbsent(api, service);
                if (previous != null && !previous.equals(service)) {
                    errors.add("API '" + api + "' is mapped to both '" + previous + "' and '" + service + "'");
                }
            }
        });

        if (detectors == null || detectors.isEmpty()) {
            errors.add("At least one detector must be configured");
        } else {
            for (String type : detectors) {
                String normalized = type == null ? "" : type.toLowerCase(Locale.ROOT);
                if (!List.of("response_time", "error_rate", "pattern").contains(normalized)) {
                    errors.add("Unknown detector type: '" + type
                            + "'. Supported: response_time, error_rate, pattern");
                }
            }
        }

        baseline.validate(errors);
        detection.validate(errors);
        correlation.validate(errors);
        alerting.validate(errors);
        prediction.validate(errors);

        if (workerThreads < 1) {
            errors.add("workerThreads must be >= 1");
        }
        if (deliveryAttempts < 1) {
            errors.add("deliveryAttempts must be >= 1");
        }
        if (deliveryBackoffMillis < 0) {
            errors.add("deliveryBackoffMillis must be >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Bean properties (used by SnakeYAML)
    // ---------------------------------------------------------------

    public EnvironmentProfile getDefaults() {
        return defaults;
    }

    public void setDefaults(EnvironmentProfile defaults) {
        this.defaults = defaults;
    }

    /**
     * @return unmodifiable view of the per-environment profiles
     */
    public Map<String, EnvironmentProfile> getEnvironments() {
        return Collections.unmodifiableMap(environments);
    }

    public void setEnvironments(Map<String, EnvironmentProfile> environments) {
        this.environments = environments != null ? new LinkedHashMap<>(environments) : new LinkedHashMap<>();
    }

    /**
     * @return unmodifiable view of logical service to API ids
     */
    public Map<String, List<String>> getLogicalServices() {
        return Collections.unmodifiableMap(logicalServices);
    }

    public void setLogicalServices(Map<String, List<String>> logicalServices) {
        this.logicalServices = logicalServices != null ? new LinkedHashMap<>(logicalServices)
                : new LinkedHashMap<>();
    }

    public List<String> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<String> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    public BaselineSettings getBaseline() {
        return baseline;
    }

    public void setBaseline(BaselineSettings baseline) {
        this.baseline = baseline != null ? baseline : new BaselineSettings();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    public CorrelationSettings getCorrelation() {
        return correlation;
    }

    public void setCorrelation(CorrelationSettings correlation) {
        this.correlation = correlation != null ? correlation : new CorrelationSettings();
    }

    public AlertingSettings getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertingSettings alerting) {
        this.alerting = alerting != null ? alerting : new AlertingSettings();
    }

    public PredictionSettings getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionSettings prediction) {
        this.prediction = prediction != null ? prediction : new PredictionSettings();
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getDeliveryAttempts() {
        return deliveryAttempts;
    }

    public void setDeliveryAttempts(int deliveryAttempts) {
        this.deliveryAttempts = deliveryAttempts;
    }

    public int getDeliveryBackoffMillis() {
        return deliveryBackoffMillis;
    }

    public void setDeliveryBackoffMillis(int deliveryBackoffMillis) {
        this.deliveryBackoffMillis = deliveryBackoffMillis;
    }

    @Override
    public String toString() {
        return "EngineConfig{environments=" + environments.keySet()
                + ", logicalServices=" + logicalServices.keySet()
                + ", detectors=" + detectors + '}';
    }
}
