package com.apisentinel.core.detection;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.config.EnvironmentProfile;
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
 * Flags response times far above the series baseline.
 *
 * <p>
 * A value is anomalous when it is strictly above
 * {@code mean + deviationFactor × σ} <em>and</em> above the baseline p99.
 * The second condition keeps heavy-tailed series, whose normal spikes already
 * populate the upper percentiles, from alerting on every tail sample.
 * </p>
 *
 * <p>
 * σ is floored at {@code minRelativeStddev × mean} so a perfectly flat
 * history does not turn a one-millisecond wobble into an incident.
 * </p>
 *
 * @since 1.0.0
 */
public class ResponseTimeDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ResponseTimeDetector.class);

    public static final String NAME = "response_time";

    @Override
    public Optional<AnomalyCandidate> evaluate(MetricSample sample, BaselineSnapshot baseline,
            EngineConfig config) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        if (!AnomalyDetector.isJudgeable(baseline)) {
            return Optional.empty();
        }

        EnvironmentProfile profile = config.environmentProfile(sample.getEnvironment());
        double k = profile.getDeviationFactor();
        double sd = DeviationScores.effectiveStddev(baseline, config.getDetection().getMinRelativeStddev());
        double threshold = baseline.getMean() + k * sd;
        double value = sample.getValue();

        if (value <= threshold || value <= baseline.getP99()) {
            LOG.trace("{} within baseline: value={} threshold={} p99={}",
                    sample.seriesKey(), value, threshold, baseline.getP99());
            return Optional.empty();
        }

        double z = (value - baseline.getMean()) / sd;
        double score = DeviationScores.zScore(z, k, profile.getSensitivity());
        LOG.debug("Latency spike on {}: value={} mean={} sd={} z={} score={}",
                sample.seriesKey(), value, baseline.getMean(), sd, z, score);

        return Optional.of(AnomalyCandidate.builder()
                .sample(sample)
                .category(AnomalyCategory.LATENCY_SPIKE)
                .expectedValue(baseline.getMean())
                .threshold(threshold)
                .baseline(baseline)
                .deviationScore(score)
                .detectorSource(NAME)
                .description(String.format(
                        "Response time %.1f ms is %.1f sigma above baseline %.1f ms (p99 %.1f ms)",
                        value, z, baseline.getMean(), baseline.getP99()))
                .build());
    }

    @Override
    public boolean supports(MetricKind kind) {
        return kind == MetricKind.RESPONSE_TIME;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
