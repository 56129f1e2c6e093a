package com.apisentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from the configured
 * detector type names.
 *
 * <p>
 * This is the single point of extension when adding new detection
 * strategies: register the new type string here and create the corresponding
 * detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector of the given type.
     *
     * @param type detector type name; must not be {@code null}
     * @return an appropriate {@link AnomalyDetector} instance
     * @throws NullPointerException     if {@code type} is {@code null}
     * @throws IllegalArgumentException if the type is unknown
     */
    public static AnomalyDetector create(String type) {
        Objects.requireNonNull(type, "Detector type must not be null");

        return switch (type.toLowerCase(Locale.ROOT)) {
            case ResponseTimeDetector.NAME -> new ResponseTimeDetector();
            case ErrorRateDetector.NAME -> new ErrorRateDetector();
            case PatternTrendDetector.NAME -> new PatternTrendDetector();
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + type
                            + "'. Supported types: response_time, error_rate, pattern");
        };
    }

    /**
     * Create detectors for every type in the supplied list.
     *
     * @param types detector type names; must not be {@code null}
     * @return unmodifiable list of detectors (one per type)
     */
    public static List<AnomalyDetector> createAll(List<String> types) {
        Objects.requireNonNull(types, "Detector types must not be null");
        LOG.info("Creating {} detector(s) from configuration: {}", types.size(), types);
        return Collections.unmodifiableList(types.stream()
                .map(DetectorFactory::create)
                .toList());
    }
}
