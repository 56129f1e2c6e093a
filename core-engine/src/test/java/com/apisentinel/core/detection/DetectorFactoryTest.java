package com.apisentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create ResponseTimeDetector for 'response_time' type")
    void shouldCreateResponseTimeDetector() {
        assertThat(DetectorFactory.create("response_time")).isInstanceOf(ResponseTimeDetector.class);
    }

    @Test
    @DisplayName("Should create ErrorRateDetector for 'error_rate' type")
    void shouldCreateErrorRateDetector() {
        assertThat(DetectorFactory.create("error_rate")).isInstanceOf(ErrorRateDetector.class);
    }

    @Test
    @DisplayName("Should create PatternTrendDetector for 'pattern' type, case-insensitively")
    void shouldCreatePatternDetector() {
        assertThat(DetectorFactory.create("PATTERN")).isInstanceOf(PatternTrendDetector.class);
    }

    @Test
    @DisplayName("Should throw for unknown detector type")
    void shouldThrowForUnknownType() {
        assertThatThrownBy(() -> DetectorFactory.create("unknown"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown detector type");
    }

    @Test
    @DisplayName("Should create all detectors from a list, in order")
    void shouldCreateAll() {
        List<AnomalyDetector> detectors = DetectorFactory.createAll(List.of("error_rate", "response_time"));

        assertThat(detectors).hasSize(2);
        assertThat(detectors.get(0).getName()).isEqualTo("error_rate");
        assertThat(detectors.get(1).getName()).isEqualTo("response_time");
    }
}
