package com.apisentinel.core.detection;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.TrendBucket;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags sustained drift: every recent completed bucket sits above its
 * seasonal expectation.
 *
 * <p>
 * Catches gradual degradation that never produces a single spike large
 * enough for {@link ResponseTimeDetector}. Fires only when
 * </p>
 * <ul>
 * <li>all {@code trendBuckets} buckets deviate upward,</li>
 * <li>their mean normalized deviation reaches {@code driftThreshold} sigma,
 * and</li>
 * <li>the least-squares slope over the bucket means is not negative (a
 * recovering series is left alone).</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PatternTrendDetector implements AnomalyDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PatternTrendDetector.class);

    public static final String NAME = "pattern";

    @Override
    public Optional<AnomalyCandidate> evaluate(MetricSample sample, BaselineSnapshot baseline,
            EngineConfig config) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");
        if (!AnomalyDetector.isJudgeable(baseline)) {
            return Optional.empty();
        }

        List<TrendBucket> buckets = baseline.getRecentBuckets();
        int required = config.getBaseline().getTrendBuckets();
        if (buckets.size() < required) {
            return Optional.empty();
        }
        buckets = buckets.subList(buckets.size() - required, buckets.size());

        double sd = DeviationScores.effectiveStddev(baseline, config.getDetection().getMinRelativeStddev());
        SimpleRegression regression = new SimpleRegression();
        double deviationSum = 0;
        for (int i = 0; i < buckets.size(); i++) {
            TrendBucket bucket = buckets.get(i);
            double deviation = (bucket.getMean() - bucket.getExpected()) / sd;
            if (deviation <= 0) {
                return Optional.empty();
            }
            deviationSum += deviation;
            regression.addData(i, bucket.getMean());
        }

        double meanDeviation = deviationSum / buckets.size();
        double driftThreshold = config.getDetection().getDriftThreshold();
        double slope = regression.getSlope();
        if (meanDeviation < driftThreshold || slope < 0) {
            LOG.trace("{} no sustained drift: meanDeviation={} slope={}", sample.seriesKey(), meanDeviation, slope);
            return Optional.empty();
        }

        TrendBucket last = buckets.get(buckets.size() - 1);
        double sensitivity = config.environmentProfile(sample.getEnvironment()).getSensitivity();
        double score = DeviationScores.drift(meanDeviation, sensitivity);
        LOG.debug("Sustained drift on {}: meanDeviation={} slope={} score={}",
                sample.seriesKey(), meanDeviation, slope, score);

        return Optional.of(AnomalyCandidate.builder()
                .sample(sample)
                .observedValue(last.getMean())
                .category(AnomalyCategory.SUSTAINED_DRIFT)
                .expectedValue(last.getExpected())
                .threshold(last.getExpected() + driftThreshold * sd)
                .baseline(baseline)
                .deviationScore(score)
                .detectorSource(NAME)
                .description(String.format(
                        "%s drifted %.1f sigma above its seasonal expectation for %d consecutive buckets",
                        sample.getMetricKind(), meanDeviation, buckets.size()))
                .build());
    }

    @Override
    public boolean supports(MetricKind kind) {
        return true;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
