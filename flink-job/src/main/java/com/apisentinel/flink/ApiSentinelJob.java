package com.apisentinel.flink;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.config.EngineConfigLoader;
import com.apisentinel.core.model.MetricSample;
import com.apisentinel.core.model.NotificationIntent;
import com.apisentinel.core.sink.EngineRecord;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the API Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 * Kafka (api metrics)
 *   → MetricSampleDeserializationSchema (drop unparseable)
 *   → keyBy(logical service)
 *   → AnalysisProcessFunction (baseline → detect → correlate → alert)
 *   → Kafka (records)         main output
 *   → Kafka (notifications)   side output
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Kafka and Flink settings come from environment variables via
 * {@link JobConfig#fromEnvironment()}; engine tuning is read from the YAML
 * file named by {@code ENGINE_CONFIG_PATH}, falling back to the bundled
 * {@code engine.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ApiSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(ApiSentinelJob.class);
    static final String JOB_NAME = "API Sentinel – Analysis & Alerting";

    private ApiSentinelJob() {
        // utility class
    }

    public static void main(String[] args) throws Exception {
        // ---------------------------------------------------------------
        // 1. Configuration
        // ---------------------------------------------------------------
        JobConfig jobConfig = JobConfig.fromEnvironment();
        LOG.info("Starting API Sentinel with config: {}", jobConfig);

        EngineConfig engineConfig = EngineConfigLoader.load(jobConfig.getEngineConfigPath());
        LOG.info("Loaded engine config: {} environment profile(s), detectors {}",
                engineConfig.getEnvironments().size(), engineConfig.getDetectors());

        // ---------------------------------------------------------------
        // 2. Health server
        // ---------------------------------------------------------------
        HealthServer healthServer = new HealthServer(JOB_NAME);
        healthServer.start(jobConfig.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        // ---------------------------------------------------------------
        // 3. Flink environment
        // ---------------------------------------------------------------
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(jobConfig.getParallelism());
        env.enableCheckpointing(jobConfig.getCheckpointIntervalMs(), CheckpointingMode.EXACTLY_ONCE);

        // ---------------------------------------------------------------
        // 4. Kafka source
        // ---------------------------------------------------------------
        KafkaSource<MetricSample> source = KafkaSource.<MetricSample>builder()
                .setBootstrapServers(jobConfig.getKafkaBootstrapServers())
                .setTopics(jobConfig.getKafkaMetricsTopic())
                .setGroupId(jobConfig.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.latest())
                .setValueOnlyDeserializer(new MetricSampleDeserializationSchema())
                .build();

        DataStream<MetricSample> samples = env
                .fromSource(source, WatermarkStrategy.noWatermarks(), "kafka-api-metrics")
                .filter(Objects::nonNull)
                .name("filter-unparseable");

        // ---------------------------------------------------------------
        // 5. Analysis
        // ---------------------------------------------------------------
        SingleOutputStreamOperator<EngineRecord> records = samples
                .keyBy(new LogicalServiceKeySelector(engineConfig))
                .process(new AnalysisProcessFunction(engineConfig))
                .name("api-analysis");

        DataStream<NotificationIntent> notifications =
                records.getSideOutput(AnalysisProcessFunction.NOTIFICATIONS);

        // ---------------------------------------------------------------
        // 6. Kafka sinks
        // ---------------------------------------------------------------
        records.sinkTo(kafkaSink(jobConfig, jobConfig.getKafkaRecordsTopic(),
                new JsonSerializationSchema<EngineRecord>()))
                .name("kafka-records");
        notifications.sinkTo(kafkaSink(jobConfig, jobConfig.getKafkaNotificationsTopic(),
                new JsonSerializationSchema<NotificationIntent>()))
                .name("kafka-notifications");

        // ---------------------------------------------------------------
        // 7. Execute
        // ---------------------------------------------------------------
        healthServer.markReady();
        env.execute(JOB_NAME);
    }

    private static <T> KafkaSink<T> kafkaSink(JobConfig jobConfig, String topic,
            JsonSerializationSchema<T> schema) {
        return KafkaSink.<T>builder()
                .setBootstrapServers(jobConfig.getKafkaBootstrapServers())
                .setRecordSerializer(KafkaRecordSerializationSchema.<T>builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(schema)
                        .build())
                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                .build();
    }
}
