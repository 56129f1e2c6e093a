package com.apisentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobConfigTest {

    @Test
    @DisplayName("Builder defaults form a valid configuration")
    void shouldBuildDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaMetricsTopic()).isEqualTo("api-metrics");
        assertThat(config.getKafkaRecordsTopic()).isEqualTo("api-sentinel-records");
        assertThat(config.getKafkaNotificationsTopic()).isEqualTo("api-sentinel-notifications");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getEngineConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Missing engine config path falls back to the bundled defaults")
    void shouldNormalizeNullConfigPath() {
        JobConfig config = new JobConfig.Builder().engineConfigPath(null).build();

        assertThat(config.getEngineConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Blank topic is rejected")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaRecordsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaRecordsTopic must not be null or blank");
    }

    @Test
    @DisplayName("Output topic equal to the input topic is rejected")
    void shouldRejectFeedbackLoop() {
        assertThatThrownBy(() -> new JobConfig.Builder()
                .kafkaMetricsTopic("metrics")
                .kafkaNotificationsTopic("metrics")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output topics must differ from the metrics topic");
    }

    @Test
    @DisplayName("Out-of-range numeric settings are rejected")
    void shouldRejectOutOfRangeNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .hasMessageContaining("parallelism must be >= 1");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .hasMessageContaining("healthPort must be in [1, 65535]");
    }
}
