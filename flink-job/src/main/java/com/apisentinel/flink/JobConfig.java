package com.apisentinel.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the API Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through Kubernetes Deployment env vars, Docker
 * {@code -e} flags or a shell environment. Engine tuning lives in the YAML
 * file named by {@code ENGINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaMetricsTopic;
    private final String kafkaRecordsTopic;
    private final String kafkaNotificationsTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Engine / health
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaMetricsTopic = b.kafkaMetricsTopic;
        this.kafkaRecordsTopic = b.kafkaRecordsTopic;
        this.kafkaNotificationsTopic = b.kafkaNotificationsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.engineConfigPath = b.engineConfigPath;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaMetricsTopic(env("KAFKA_METRICS_TOPIC", "api-metrics"))
                    .kafkaRecordsTopic(env("KAFKA_RECORDS_TOPIC", "api-sentinel-records"))
                    .kafkaNotificationsTopic(env("KAFKA_NOTIFICATIONS_TOPIC", "api-sentinel-notifications"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "api-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaMetricsTopic() {
        return kafkaMetricsTopic;
    }

    public String getKafkaRecordsTopic() {
        return kafkaRecordsTopic;
    }

    public String getKafkaNotificationsTopic() {
        return kafkaNotificationsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, port in
     * [1, 65535], non-blank and distinct topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaMetricsTopic = "api-metrics";
        private String kafkaRecordsTopic = "api-sentinel-records";
        private String kafkaNotificationsTopic = "api-sentinel-notifications";
        private String kafkaGroupId = "api-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String engineConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaMetricsTopic(String v) {
            this.kafkaMetricsTopic = v;
            return this;
        }

        public Builder kafkaRecordsTopic(String v) {
            this.kafkaRecordsTopic = v;
            return this;
        }

        public Builder kafkaNotificationsTopic(String v) {
            this.kafkaNotificationsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaMetricsTopic, "kafkaMetricsTopic");
            requireNonBlank(kafkaRecordsTopic, "kafkaRecordsTopic");
            requireNonBlank(kafkaNotificationsTopic, "kafkaNotificationsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (kafkaMetricsTopic.equals(kafkaRecordsTopic)
                    || kafkaMetricsTopic.equals(kafkaNotificationsTopic)) {
                throw new IllegalArgumentException(
                        "Output topics must differ from the metrics topic '" + kafkaMetricsTopic + "'");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (engineConfigPath == null) {
                engineConfigPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaMetricsTopic='" + kafkaMetricsTopic + '\'' +
                ", kafkaRecordsTopic='" + kafkaRecordsTopic + '\'' +
                ", kafkaNotificationsTopic='" + kafkaNotificationsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
