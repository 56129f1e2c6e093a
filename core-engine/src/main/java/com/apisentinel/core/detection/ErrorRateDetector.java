package com.apisentinel.core.detection;

import com.apisentinel.core.config.DetectionSettings;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Flags a rolling error ratio above its historical 99th percentile.
 *
 * <p>
 * The ratio is judged over the baseline's error window, and only once the
 * window holds at least {@code minRequestVolume} requests: two failures out
 * of three calls say nothing. The limit never drops below
 * {@code minErrorRatio}.
 * </p>
 *
 * @since 1.0.0
 */
public class ErrorRateDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ErrorRateDetector.class);

    public static final String NAME = "error_rate";

    @Override
    public Optional<AnomalyCandidate> evaluate(MetricSample sample, BaselineSnapshot baseline,
            EngineConfig config) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        if (!AnomalyDetector.isJudgeable(baseline)) {
            return Optional.empty();
        }

        DetectionSettings settings = config.getDetection();
        long requests = baseline.getWindowRequests();
        if (requests < settings.getMinRequestVolume()) {
            LOG.trace("{} error window too small: {} request(s)", sample.seriesKey(), requests);
            return Optional.empty();
        }

        double ratio = baseline.getWindowErrorRatio();
        double limit = Math.max(baseline.getRatioP99(), settings.getMinErrorRatio());
        if (ratio <= limit) {
            return Optional.empty();
        }

        double excess = (ratio - limit) / Math.max(limit, 0.01);
        double sensitivity = config.environmentProfile(sample.getEnvironment()).getSensitivity();
        double score = DeviationScores.errorRate(requests, settings.getVolumeScale(), excess, sensitivity);
        LOG.debug("Error rate breach on {}: ratio={} limit={} requests={} score={}",
                sample.seriesKey(), ratio, limit, requests, score);

        return Optional.of(AnomalyCandidate.builder()
                .sample(sample)
                .observedValue(ratio)
                .category(AnomalyCategory.ERROR_RATE_BREACH)
                .expectedValue(baseline.getRatioP99())
                .threshold(limit)
                .baseline(baseline)
                .deviationScore(score)
                .detectorSource(NAME)
                .description(String.format(
                        "Error ratio %.1f%% over the last %d requests exceeds limit %.1f%%",
                        ratio * 100, requests, limit * 100))
                .build());
    }

    @Override
    public boolean supports(MetricKind kind) {
        return kind == MetricKind.ERROR_RATE;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
