package com.apisentinel.core.prediction;

import com.apisentinel.core.baseline.BaselineModel;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.config.EnvironmentProfile;
import com.apisentinel.core.config.PredictionSettings;
import com.apisentinel.core.detection.DeviationScores;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.Prediction;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.model.TrendBucket;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Forecasts the probability that a series breaches its anomaly threshold
 * within the forecast horizon.
 *
 * <h3>Model</h3>
 * <ol>
 * <li>Least-squares trend over the recent bucket means, in units per
 * minute.</li>
 * <li>The trend is projected to {@code now + horizon}; the probability that a
 * normal variable centred there, with σ combining baseline noise and trend
 * residuals, exceeds the threshold is the trend probability.</li>
 * <li>Recent anomaly candidates raise it:
 * {@code p = 1 − (1 − pTrend)(1 − 0.5(1 − e^(−count/3)))}.</li>
 * </ol>
 *
 * <p>
 * The threshold is the one the detectors use: {@code max(mean + kσ, p99)} for
 * response times, {@code max(ratioP99, minErrorRatio)} for error rates.
 * </p>
 *
 * <p>
 * Each run replaces the previous prediction of every series it reaches.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictiveEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PredictiveEngine.class);

    private final BaselineModel baselines;
    private final AnomalyHistory history;
    private final Map<SeriesKey, Prediction> latest = new ConcurrentHashMap<>();

    public PredictiveEngine(BaselineModel baselines, AnomalyHistory history) {
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Predict every known series.
     *
     * @param cancelled checked between series; a {@code true} answer ends the
     *                  run, keeping the predictions made so far
     * @return predictions produced by this run
     */
    public List<Prediction> run(Instant now, EngineConfig config, BooleanSupplier cancelled) {
        List<SeriesKey> keys = baselines.keys();
        latest.keySet().retainAll(keys);

        List<Prediction> produced = new ArrayList<>(keys.size());
        for (SeriesKey key : keys) {
            if (cancelled.getAsBoolean()) {
                LOG.info("Prediction run cancelled after {} of {} series", produced.size(), keys.size());
                break;
            }
            try {
                predict(key, now, config).ifPresent(p -> {
                    latest.put(key, p);
                    produced.add(p);
                });
            } catch (RuntimeException e) {
                LOG.error("Prediction failed for {}: {}", key, e.getMessage(), e);
            }
        }
        history.prune(now, config.getPrediction().anomalyLookback());
        LOG.debug("Prediction run produced {} prediction(s)", produced.size());
        return produced;
    }

    /**
     * Predict one series from a single consistent baseline snapshot.
     *
     * @return the prediction, empty if the series is unknown
     */
    public Optional<Prediction> predict(SeriesKey key, Instant now, EngineConfig config) {
        return baselines.snapshot(key, config.getBaseline())
                .map(snapshot -> predict(snapshot, now, config));
    }

    /**
     * @param apiId       API filter, {@code null} for any
     * @param environment environment filter, {@code null} for any
     * @return latest predictions matching the filters, highest probability first
     */
    public List<Prediction> latest(String apiId, String environment) {
        List<Prediction> matches = new ArrayList<>();
        for (Prediction p : latest.values()) {
            if ((apiId == null || apiId.equals(p.getApiId()))
                    && (environment == null || environment.equals(p.getEnvironment()))) {
                matches.add(p);
            }
        }
        matches.sort(Comparator.comparingDouble(Prediction::getProbabilityOfBreach).reversed());
        return matches;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    Prediction predict(BaselineSnapshot snapshot, Instant now, EngineConfig config) {
        PredictionSettings settings = config.getPrediction();
        SeriesKey key = snapshot.seriesKey();
        EnvironmentProfile profile = config.environmentProfile(key.getEnvironment());
        Duration horizon = settings.horizon();

        double sd = DeviationScores.effectiveStddev(snapshot, config.getDetection().getMinRelativeStddev());
        double threshold = breachThreshold(snapshot, sd, profile, config);
        int recentAnomalies = history.count(key, now, settings.anomalyLookback());
        double frequencyBoost = 0.5 * (1 - Math.exp(-recentAnomalies / 3.0));

        Prediction.Builder builder = Prediction.builder()
                .seriesKey(key)
                .forecastHorizon(horizon)
                .breachThreshold(threshold)
                .recentAnomalyCount(recentAnomalies)
                .generatedAt(now);

        List<TrendBucket> buckets = snapshot.getRecentBuckets();
        if (snapshot.isInsufficientHistory() || buckets.size() < settings.getMinBuckets()) {
            String reason = snapshot.isInsufficientHistory()
                    ? "insufficient baseline history (" + snapshot.getSampleCount() + " samples)"
                    : "insufficient trend history (" + buckets.size() + " buckets)";
            return builder.currentValue(snapshot.getMean())
                    .projectedValue(snapshot.getMean())
                    .probabilityOfBreach(frequencyBoost)
                    .confidence(0.0)
                    .lowConfidence(true, reason)
                    .build();
        }

        Instant origin = buckets.get(0).getStart();
        SimpleRegression regression = new SimpleRegression();
        for (TrendBucket bucket : buckets) {
            regression.addData(minutesBetween(origin, bucket.getStart()), bucket.getMean());
        }
        double slope = regression.getSlope();
        double nowX = minutesBetween(origin, now);
        double currentValue = regression.predict(nowX);
        double projected = regression.predict(nowX + horizon.toMinutes());
        double mse = regression.getMeanSquareError();
        double residual = Double.isNaN(mse) ? 0.0 : Math.sqrt(mse);

        double sigma = Math.sqrt(snapshot.getVariance() + residual * residual);
        double pTrend = sigma > 0
                ? 1 - new NormalDistribution(projected, sigma).cumulativeProbability(threshold)
                : (projected > threshold ? 1.0 : 0.0);
        double probability = 1 - (1 - pTrend) * (1 - frequencyBoost);

        double countFactor = Math.min(1.0, (double) buckets.size() / config.getBaseline().getTrendBuckets());
        double stability = 1.0 / (1.0 + sd / Math.max(Math.abs(snapshot.getMean()), 1e-9));
        double fit = 1.0 / (1.0 + residual / sd);
        double confidence = countFactor * stability * fit;

        builder.currentValue(currentValue)
                .projectedValue(projected)
                .trendSlopePerMinute(slope)
                .probabilityOfBreach(probability)
                .expectedImpactScore(impact(snapshot, projected, threshold, sd, profile, config))
                .expectedTimeToBreach(timeToBreach(currentValue, slope, threshold, horizon))
                .confidence(confidence);

        if (confidence < settings.getLowConfidenceThreshold()) {
            builder.lowConfidence(true, String.format(
                    "confidence %.2f below %.2f (buckets %d, stability %.2f, fit %.2f)",
                    confidence, settings.getLowConfidenceThreshold(), buckets.size(), stability, fit));
        }
        Prediction prediction = builder.build();
        LOG.debug("Prediction for {}: p={} projected={} threshold={} confidence={}",
                key, prediction.getProbabilityOfBreach(), projected, threshold, confidence);
        return prediction;
    }

    private static double breachThreshold(BaselineSnapshot snapshot, double sd, EnvironmentProfile profile,
            EngineConfig config) {
        if (snapshot.getMetricKind() == MetricKind.ERROR_RATE) {
            return Math.max(snapshot.getRatioP99(), config.getDetection().getMinErrorRatio());
        }
        return Math.max(snapshot.getMean() + profile.getDeviationFactor() * sd, snapshot.getP99());
    }

    private static double impact(BaselineSnapshot snapshot, double projected, double threshold, double sd,
            EnvironmentProfile profile, EngineConfig config) {
        if (projected <= threshold) {
            return 0.0;
        }
        if (snapshot.getMetricKind() == MetricKind.ERROR_RATE) {
            double excess = (projected - threshold) / Math.max(threshold, 0.01);
            long volume = Math.max(snapshot.getWindowRequests(), config.getDetection().getMinRequestVolume());
            return DeviationScores.errorRate(volume, config.getDetection().getVolumeScale(), excess,
                    profile.getSensitivity());
        }
        double k = profile.getDeviationFactor();
        double z = Math.max((projected - snapshot.getMean()) / sd, k);
        return DeviationScores.zScore(z, k, profile.getSensitivity());
    }

    private static Duration timeToBreach(double current, double slope, double threshold, Duration horizon) {
        if (current >= threshold) {
            return Duration.ZERO;
        }
        if (!(slope > 0)) {
            return null;
        }
        double minutes = (threshold - current) / slope;
        if (minutes > horizon.toMinutes()) {
            return null;
        }
        return Duration.ofSeconds(Math.round(minutes * 60));
    }

    private static double minutesBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 60_000.0;
    }
}
