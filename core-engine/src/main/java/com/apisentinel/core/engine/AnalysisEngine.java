package com.apisentinel.core.engine;

import com.apisentinel.core.alerting.AlertListener;
import com.apisentinel.core.alerting.AlertManager;
import com.apisentinel.core.alerting.AlertTransition;
import com.apisentinel.core.baseline.BaselineModel;
import com.apisentinel.core.config.ConfigHolder;
import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.correlation.CrossEnvironmentCorrelator;
import com.apisentinel.core.correlation.DiscrepancyDetector;
import com.apisentinel.core.correlation.IncidentChange;
import com.apisentinel.core.detection.AnomalyDetector;
import com.apisentinel.core.detection.DetectorFactory;
import com.apisentinel.core.model.Alert;
import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.BaselineSnapshot;
import com.apisentinel.core.model.DedupKey;
import com.apisentinel.core.model.Incident;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.Prediction;
import com.apisentinel.core.model.SeriesKey;
import com.apisentinel.core.prediction.AnomalyHistory;
import com.apisentinel.core.prediction.PredictiveEngine;
import com.apisentinel.core.sink.AsyncDispatcher;
import com.apisentinel.core.sink.EngineRecord;
import com.apisentinel.core.sink.NotificationSink;
import com.apisentinel.core.sink.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the analysis, correlation and alerting pipeline.
 *
 * <h3>Per sample</h3>
 * <ol>
 * <li>validate; malformed samples are dropped and counted</li>
 * <li>fold into the series baseline and take the prior snapshot</li>
 * <li>run every configured detector (a failing detector is skipped)</li>
 * <li>correlate candidates into incidents and update alerts; a clean sample
 * counts towards clearing incidents and resolving alerts</li>
 * <li>hand records and notification intents to the {@link AsyncDispatcher}</li>
 * </ol>
 *
 * <h3>Periodic jobs</h3>
 * <p>
 * {@link #sweep(Instant)} closes timed-out incidents, compares the baselines
 * of each logical service across environments, prunes the anomaly history and
 * evicts idle baselines; {@link #runPredictions(Instant)} refreshes every
 * forecast.
 * {@link #start()} schedules both. Each job takes one configuration snapshot
 * and stops between partitions or series once {@link #close()} is called.
 * </p>
 *
 * <h3>Usage</h3>
 *
 * <pre>
 * AnalysisEngine engine = AnalysisEngine.builder()
 *         .config(ConfigHolder.of(EngineConfigLoader.load()))
 *         .recordSink(store::append)
 *         .notificationSink(pager::send)
 *         .build();
 * engine.start();
 * engine.submit(sample);
 * </pre>
 *
 * @since 1.0.0
 */
public final class AnalysisEngine implements EngineQueries, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    private final ConfigHolder config;
    private final Clock clock;
    private final BaselineModel baselines = new BaselineModel();
    private final AnomalyHistory history = new AnomalyHistory();
    private final CrossEnvironmentCorrelator correlator = new CrossEnvironmentCorrelator();
    private final DiscrepancyDetector discrepancies = new DiscrepancyDetector();
    private final AlertManager alerts = new AlertManager();
    private final PredictiveEngine predictive = new PredictiveEngine(baselines, history);
    private final AsyncDispatcher dispatcher;

    private final ExecutorService ingestExecutor;
    private final ScheduledExecutorService scheduler;
    private final List<ExecutorService> owned = new ArrayList<>();
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
    private final AtomicBoolean closing = new AtomicBoolean();

    private final AtomicReference<DetectorSet> detectors = new AtomicReference<>();

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final AtomicLong anomalies = new AtomicLong();
    private final AtomicLong incidentsOpened = new AtomicLong();
    private final AtomicLong alertsOpened = new AtomicLong();
    private final AtomicLong notifications = new AtomicLong();

    /** Detectors built for one configuration snapshot. */
    private static final class DetectorSet {
        final EngineConfig config;
        final List<AnomalyDetector> detectors;

        DetectorSet(EngineConfig config) {
            this.config = config;
            this.detectors = DetectorFactory.createAll(config.getDetectors());
        }
    }

    private AnalysisEngine(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config must not be null");
        this.clock = b.clock;
        EngineConfig initial = config.current();

        if (b.ingestExecutor != null) {
            this.ingestExecutor = b.ingestExecutor;
        } else {
            this.ingestExecutor = Executors.newFixedThreadPool(initial.getWorkerThreads(),
                    daemonThreads("api-sentinel-ingest"));
            owned.add(ingestExecutor);
        }
        if (b.scheduler != null) {
            this.scheduler = b.scheduler;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("api-sentinel-jobs"));
            owned.add(scheduler);
        }
        Executor delivery = b.deliveryExecutor;
        if (delivery == null) {
            ExecutorService pool = Executors.newFixedThreadPool(2, daemonThreads("api-sentinel-delivery"));
            owned.add(pool);
            delivery = pool;
        }
        this.dispatcher = new AsyncDispatcher(delivery, b.recordSink, b.notificationSink,
                initial.getDeliveryAttempts(), initial.getDeliveryBackoffMillis());
        this.detectors.set(new DetectorSet(initial));
        for (AlertListener listener : b.listeners) {
            alerts.addListener(listener);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnalysisEngine}.
     *
     * <p>
     * Executors that are not supplied are created and owned by the engine and
     * shut down on {@link #close()}.
     * </p>
     */
    public static class Builder {
        private ConfigHolder config;
        private Clock clock = Clock.systemUTC();
        private RecordSink recordSink = RecordSink.discarding();
        private NotificationSink notificationSink = NotificationSink.discarding();
        private ExecutorService ingestExecutor;
        private Executor deliveryExecutor;
        private ScheduledExecutorService scheduler;
        private final List<AlertListener> listeners = new ArrayList<>();

        public Builder config(ConfigHolder config) {
            this.config = config;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = ConfigHolder.of(config);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder recordSink(RecordSink recordSink) {
            this.recordSink = Objects.requireNonNull(recordSink, "recordSink must not be null");
            return this;
        }

        public Builder notificationSink(NotificationSink notificationSink) {
            this.notificationSink = Objects.requireNonNull(notificationSink, "notificationSink must not be null");
            return this;
        }

        public Builder ingestExecutor(ExecutorService ingestExecutor) {
            this.ingestExecutor = ingestExecutor;
            return this;
        }

        public Builder deliveryExecutor(Executor deliveryExecutor) {
            this.deliveryExecutor = deliveryExecutor;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Deliver records and notifications on the calling thread, so sinks see
         * them before {@link AnalysisEngine#process} returns.
         */
        public Builder synchronousDelivery() {
            this.deliveryExecutor = Runnable::run;
            return this;
        }

        public Builder addListener(AlertListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public AnalysisEngine build() {
            return new AnalysisEngine(this);
        }
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Process one sample on the calling thread.
     *
     * @param sample the sample; malformed samples are dropped, never thrown
     * @return what the sample caused
     */
    public IngestResult process(MetricSample sample) {
        if (sample == null) {
            discarded.incrementAndGet();
            LOG.warn("Discarded null sample");
            return IngestResult.discarded(null, "null sample");
        }
        Optional<String> error = sample.validationError();
        if (error.isPresent()) {
            discarded.incrementAndGet();
            LOG.warn("Discarded malformed sample {}: {}", sample, error.get());
            return IngestResult.discarded(sample, error.get());
        }

        EngineConfig cfg = config.current();
        Instant horizon = clock.instant().plus(cfg.getBaseline().maxClockSkew());
        if (sample.getTimestamp().isAfter(horizon)) {
            discarded.incrementAndGet();
            LOG.warn("Discarded sample {} dated after {}: beyond the allowed clock skew", sample, horizon);
            return IngestResult.discarded(sample, "timestamp beyond allowed clock skew "
                    + cfg.getBaseline().maxClockSkew());
        }
        processed.incrementAndGet();
        BaselineSnapshot baseline = baselines.update(sample, cfg.getBaseline());
        if (baseline.isDiscarded()) {
            discarded.incrementAndGet();
            return IngestResult.discarded(sample, "beyond maximum lateness " + cfg.getBaseline().maxLateness());
        }
        if (baseline.isLate()) {
            return new IngestResult(sample, IngestResult.Status.LATE, null, baseline,
                    List.of(), List.of(), List.of());
        }

        List<AnomalyCandidate> candidates = detect(sample, baseline, cfg);
        List<IncidentChange> incidentChanges = new ArrayList<>();
        List<AlertTransition> transitions = new ArrayList<>();

        for (AnomalyCandidate candidate : candidates) {
            anomalies.incrementAndGet();
            history.record(candidate);
            dispatcher.dispatch(EngineRecord.anomaly(candidate));
            incidentChanges.addAll(correlator.onCandidate(candidate, cfg));
            transitions.addAll(alerts.onCandidate(candidate, cfg));
        }
        if (candidates.isEmpty() && AnomalyDetector.isJudgeable(baseline)) {
            incidentChanges.addAll(correlator.onCleanSample(sample.seriesKey(), sample.getTimestamp(), cfg));
            transitions.addAll(alerts.onCleanSample(sample.seriesKey(), sample.getTimestamp(), cfg));
        }
        transitions.addAll(publishIncidents(incidentChanges, cfg));
        publishAlerts(transitions);

        return new IngestResult(sample, IngestResult.Status.ACCEPTED, null, baseline,
                candidates, incidentChanges, transitions);
    }

    /**
     * Process one sample on the ingestion worker pool.
     */
    public CompletableFuture<IngestResult> submit(MetricSample sample) {
        return CompletableFuture.supplyAsync(() -> process(sample), ingestExecutor);
    }

    // ---------------------------------------------------------------
    // Periodic jobs
    // ---------------------------------------------------------------

    /**
     * Close timed-out incidents, raise or clear environment discrepancies,
     * prune the anomaly history and evict idle baselines.
     *
     * @return incident changes, with their alert resolutions already published
     */
    public List<IncidentChange> sweep(Instant now) {
        EngineConfig cfg = config.current();
        List<IncidentChange> changes = correlator.sweep(now, cfg, closing::get);
        publishAlerts(publishIncidents(changes, cfg));
        if (closing.get()) {
            return changes;
        }
        compareEnvironments(now, cfg);
        history.prune(now, cfg.getPrediction().anomalyLookback());
        baselines.evictIdle(now, cfg.getBaseline());
        return changes;
    }

    private void compareEnvironments(Instant now, EngineConfig cfg) {
        List<BaselineSnapshot> current = new ArrayList<>();
        for (SeriesKey key : baselines.keys()) {
            baselines.snapshot(key, cfg.getBaseline()).ifPresent(current::add);
        }
        DiscrepancyDetector.Outcome outcome = discrepancies.detect(current, now, cfg, closing::get);
        List<AlertTransition> transitions = new ArrayList<>();
        for (AnomalyCandidate candidate : outcome.getCandidates()) {
            anomalies.incrementAndGet();
            history.record(candidate);
            dispatcher.dispatch(EngineRecord.anomaly(candidate));
            transitions.addAll(alerts.onCandidate(candidate, cfg));
        }
        for (SeriesKey cleared : outcome.getCleared()) {
            alerts.clear(DedupKey.of(cleared, AnomalyCategory.ENVIRONMENT_DISCREPANCY), now, cfg)
                    .ifPresent(transitions::add);
        }
        publishAlerts(transitions);
    }

    /**
     * Refresh the prediction of every known series.
     */
    public List<Prediction> runPredictions(Instant now) {
        EngineConfig cfg = config.current();
        if (!cfg.getPrediction().isEnabled()) {
            return List.of();
        }
        List<Prediction> predictions = predictive.run(now, cfg, closing::get);
        for (Prediction prediction : predictions) {
            dispatcher.dispatch(EngineRecord.prediction(prediction));
        }
        return predictions;
    }

    /**
     * Schedule the sweep and prediction jobs at their configured intervals.
     */
    public synchronized void start() {
        if (closing.get()) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!scheduled.isEmpty()) {
            return;
        }
        EngineConfig cfg = config.current();
        long sweepMs = cfg.getCorrelation().sweepInterval().toMillis();
        long predictMs = cfg.getPrediction().interval().toMillis();
        scheduled.add(scheduler.scheduleWithFixedDelay(() -> runJob("sweep", () -> sweep(clock.instant())),
                sweepMs, sweepMs, TimeUnit.MILLISECONDS));
        scheduled.add(scheduler.scheduleWithFixedDelay(
                () -> runJob("prediction", () -> runPredictions(clock.instant())),
                predictMs, predictMs, TimeUnit.MILLISECONDS));
        LOG.info("Analysis engine started (sweep every {} ms, predictions every {} ms)", sweepMs, predictMs);
    }

    /**
     * Cancel periodic jobs, let an in-flight job finish its current unit of
     * work and shut down owned executors.
     */
    @Override
    public synchronized void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        scheduled.forEach(f -> f.cancel(false));
        for (ExecutorService executor : owned) {
            executor.shutdown();
        }
        for (ExecutorService executor : owned) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Executor did not terminate in time, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Analysis engine stopped: {}", stats());
    }

    /**
     * Re-read the configuration source; a failed reload keeps the current
     * configuration.
     */
    public boolean reloadConfig() {
        return config.reload();
    }

    // ---------------------------------------------------------------
    // Operator actions
    // ---------------------------------------------------------------

    /**
     * Resolve an alert. Idempotent.
     *
     * @return the resolved alert, empty if it was not active
     */
    public Optional<Alert> resolveAlert(String alertId) {
        return resolveAlert(alertId, null);
    }

    /**
     * Resolve an alert on behalf of an operator. Idempotent.
     *
     * @param user recorded as {@code resolvedBy}, may be {@code null}
     * @return the resolved alert, empty if it was not active
     */
    public Optional<Alert> resolveAlert(String alertId, String user) {
        Optional<AlertTransition> transition = alerts.resolve(alertId, user, clock.instant(), config.current());
        transition.ifPresent(t -> publishAlerts(List.of(t)));
        return transition.map(AlertTransition::getAlert);
    }

    /**
     * Mute notifications of an active alert until {@code duration} from now.
     *
     * @return the snoozed alert, empty if it was not active
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public Optional<Alert> snoozeAlert(String alertId, Duration duration, String user) {
        Optional<Alert> snoozed = alerts.snooze(alertId, duration, user, clock.instant());
        snoozed.ifPresent(a -> dispatcher.dispatch(EngineRecord.alert(a)));
        return snoozed;
    }

    public Optional<Alert> acknowledgeAlert(String alertId, String user) {
        Optional<Alert> acknowledged = alerts.acknowledge(alertId, user, clock.instant());
        acknowledged.ifPresent(a -> dispatcher.dispatch(EngineRecord.alert(a)));
        return acknowledged;
    }

    public void addAlertListener(AlertListener listener) {
        alerts.addListener(listener);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    @Override
    public List<Alert> openAlerts() {
        return alerts.listOpen();
    }

    @Override
    public List<Alert> alertsByEnvironment(String environment) {
        return alerts.listByEnvironment(environment);
    }

    @Override
    public Optional<Alert> alert(String alertId) {
        return alerts.get(alertId);
    }

    @Override
    public List<Incident> recentIncidents(Instant since) {
        return correlator.recentIncidents(since);
    }

    @Override
    public List<Prediction> latestPredictions(String apiId, String environment) {
        return predictive.latest(apiId, environment);
    }

    public EngineStats stats() {
        return new EngineStats(processed.get(), discarded.get(), anomalies.get(), incidentsOpened.get(),
                alertsOpened.get(), notifications.get(), dispatcher.failedCount(), baselines.size(),
                correlator.openCount(), alerts.activeCount());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<AnomalyCandidate> detect(MetricSample sample, BaselineSnapshot baseline, EngineConfig cfg) {
        if (!AnomalyDetector.isJudgeable(baseline)) {
            LOG.trace("{} warming up ({} prior sample(s))", sample.seriesKey(), baseline.getSampleCount());
            return List.of();
        }
        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (AnomalyDetector detector : detectorsFor(cfg)) {
            if (!detector.supports(sample.getMetricKind())) {
                continue;
            }
            try {
                detector.evaluate(sample, baseline, cfg).ifPresent(candidates::add);
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] failed on {}: {}", detector.getName(), sample, e.getMessage(), e);
            }
        }
        return candidates;
    }

    private List<AnomalyDetector> detectorsFor(EngineConfig cfg) {
        DetectorSet set = detectors.get();
        if (set.config != cfg) {
            set = new DetectorSet(cfg);
            detectors.set(set);
        }
        return set.detectors;
    }

    private List<AlertTransition> publishIncidents(List<IncidentChange> changes, EngineConfig cfg) {
        List<AlertTransition> transitions = new ArrayList<>();
        for (IncidentChange change : changes) {
            if (change.getType() == IncidentChange.Type.OPENED) {
                incidentsOpened.incrementAndGet();
            }
            dispatcher.dispatch(EngineRecord.incident(change.getIncident()));
            transitions.addAll(alerts.onIncident(change, cfg));
        }
        return transitions;
    }

    private void publishAlerts(List<AlertTransition> transitions) {
        for (AlertTransition transition : transitions) {
            if (transition.getKind() == AlertTransition.Kind.OPENED) {
                alertsOpened.incrementAndGet();
            }
            dispatcher.dispatch(EngineRecord.alert(transition.getAlert()));
            transition.toNotification().ifPresent(intent -> {
                notifications.incrementAndGet();
                dispatcher.dispatch(intent);
            });
        }
    }

    private void runJob(String name, Runnable job) {
        try {
            job.run();
        } catch (RuntimeException e) {
            LOG.error("Periodic {} job failed: {}", name, e.getMessage(), e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
