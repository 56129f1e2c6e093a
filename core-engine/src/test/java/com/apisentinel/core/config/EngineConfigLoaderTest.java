package com.apisentinel.core.config;

import com.apisentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getEnvironments()).containsOnlyKeys("aws", "azure");
        assertThat(config.environmentProfile("azure").getSensitivity()).isEqualTo(2.0);
        assertThat(config.logicalServiceOf("orders-api-v2")).isEqualTo("orders");
        assertThat(config.getDetectors()).containsExactly("response_time", "error_rate");
        assertThat(config.getCorrelation().getWindowSeconds()).isEqualTo(120);
        assertThat(config.getAlerting().alertingSeverity()).isEqualTo(Severity.MAJOR);
        // untouched sections keep their defaults
        assertThat(config.getBaseline().getMinSamples()).isEqualTo(5);
        assertThat(config.getPrediction().isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Bundled engine.yml is valid")
    void shouldLoadBundledDefault() {
        EngineConfig config = EngineConfigLoader.load(null);

        assertThat(config.getDetectors()).containsExactly("response_time", "error_rate", "pattern");
        assertThat(config.getEnvironments()).containsOnlyKeys("on-premises", "aws", "azure", "gcp");
        assertThat(config.environmentProfile("aws").getDeviationFactor())
                .isGreaterThan(config.environmentProfile("on-premises").getDeviationFactor());
        assertThat(config.environmentProfile("gcp").getSensitivity())
                .isLessThan(config.environmentProfile("on-premises").getSensitivity());
    }

    @Test
    @DisplayName("Unknown environments and unmapped APIs fall back to defaults")
    void shouldFallBackForUnknownNames() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.environmentProfile("gcp")).isSameAs(config.getDefaults());
        assertThat(config.logicalServiceOf("payments-api")).isEqualTo("payments-api");
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Environment 'aws' requires 'sensitivity' > 0")
                .hasMessageContaining("API 'orders-api' is mapped to both 'orders' and 'billing'")
                .hasMessageContaining("Unknown detector type: 'magic'")
                .hasMessageContaining("alerting.alertingThreshold 'loud'");
    }

    @Test
    @DisplayName("An empty file yields the built-in defaults")
    void shouldUseDefaultsForEmptyFile() {
        EngineConfig config = EngineConfigLoader.fromClasspath("empty-engine.yml");

        assertThat(config.getDetectors()).hasSize(3);
        assertThat(config.getAlerting().getWarningScore()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("Should load from a file path and prefer it over the classpath")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("engine.yml");
        Files.write(file, List.of("detectors:", "  - pattern", "workerThreads: 2"), StandardCharsets.UTF_8);

        EngineConfig config = EngineConfigLoader.load(file.toString());

        assertThat(config.getDetectors()).containsExactly("pattern");
        assertThat(config.getWorkerThreads()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile("/does/not/exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
