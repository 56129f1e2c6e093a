package com.apisentinel.flink;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.engine.AnalysisEngine;
import com.apisentinel.core.engine.IngestResult;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.NotificationIntent;
import com.apisentinel.core.sink.EngineRecord;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that hosts one {@link AnalysisEngine} per
 * parallel subtask.
 *
 * <p>
 * The stream is keyed by logical service, so every environment of a service
 * reaches the same subtask and the engine can correlate across them. Engine
 * records go to the main output; notification intents go to the
 * {@link #NOTIFICATIONS} side output.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * Baselines, incidents and alerts live inside the engine, scoped to the
 * operator instance rather than Flink keyed state. After a restart the
 * engine warms up again from the incoming stream.
 * </p>
 *
 * <h3>Periodic work</h3>
 * <p>
 * Processing-time timers drive the incident sweep and the prediction run.
 * Timers are per key, so the last run time guards against running the
 * subtask-wide jobs once per key.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisProcessFunction
        extends KeyedProcessFunction<String, MetricSample, EngineRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisProcessFunction.class);

    /** Side output carrying notification intents. */
    public static final OutputTag<NotificationIntent> NOTIFICATIONS =
            new OutputTag<NotificationIntent>("notifications") {
                private static final long serialVersionUID = 1L;
            };

    /** Engine configuration (serializable config, not runtime state). */
    private final EngineConfig config;

    private transient AnalysisEngine engine;
    private transient BufferedEngineOutput output;
    private transient SentinelMetrics metrics;
    private transient long lastSweepMs;
    private transient long lastPredictionMs;

    /**
     * @param config validated engine configuration
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public AnalysisProcessFunction(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Engine config must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        output = new BufferedEngineOutput();
        engine = AnalysisEngine.builder()
                .config(config)
                .recordSink(output)
                .notificationSink(output)
                .synchronousDelivery()
                .build();
        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnalysisProcessFunction opened with detectors {}", config.getDetectors());
    }

    @Override
    public void close() {
        LOG.info("AnalysisProcessFunction closing");
        if (engine != null) {
            engine.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricSample sample,
            KeyedProcessFunction<String, MetricSample, EngineRecord>.Context ctx,
            Collector<EngineRecord> out) throws Exception {
        long startNanos = System.nanoTime();

        IngestResult result = engine.process(sample);
        metrics.record(result);
        if (result.isAnomalous()) {
            LOG.debug("Sample for service {} produced {} candidate(s)",
                    ctx.getCurrentKey(), result.getCandidates().size());
        }
        emit(ctx, out);

        long now = ctx.timerService().currentProcessingTime();
        ctx.timerService().registerProcessingTimeTimer(nextTick(now));

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, MetricSample, EngineRecord>.OnTimerContext ctx,
            Collector<EngineRecord> out) throws Exception {
        Instant now = Instant.ofEpochMilli(timestamp);
        if (timestamp - lastSweepMs >= config.getCorrelation().sweepInterval().toMillis()) {
            lastSweepMs = timestamp;
            try {
                engine.sweep(now);
            } catch (RuntimeException e) {
                LOG.error("Incident sweep failed – retrying on next timer", e);
            }
        }
        if (timestamp - lastPredictionMs >= config.getPrediction().interval().toMillis()) {
            lastPredictionMs = timestamp;
            try {
                engine.runPredictions(now);
            } catch (RuntimeException e) {
                LOG.error("Prediction run failed – retrying on next timer", e);
            }
        }
        emit(ctx, out);
        ctx.timerService().registerProcessingTimeTimer(nextTick(timestamp));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void emit(KeyedProcessFunction<String, MetricSample, EngineRecord>.Context ctx,
            Collector<EngineRecord> out) {
        int intents = output.drain(out::collect, intent -> ctx.output(NOTIFICATIONS, intent));
        metrics.recordNotifications(intents);
    }

    /** Aligned to the sweep interval so keys share the same timer instants. */
    private long nextTick(long now) {
        long interval = Math.min(config.getCorrelation().sweepInterval().toMillis(),
                config.getPrediction().interval().toMillis());
        return (now / interval + 1) * interval;
    }
}
