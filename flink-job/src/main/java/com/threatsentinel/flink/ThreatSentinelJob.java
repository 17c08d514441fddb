package com.threatsentinel.flink;

import com.threatsentinel.core.model.Alert;
import com.threatsentinel.core.model.Incident;
import com.threatsentinel.core.model.RawSecurityEvent;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the Threat Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (security-events)
 *     → Deserialize JSON → RawSecurityEvent
 *     → Key by actor field (userId)
 *     → SiemProcessFunction (detection, correlation, escalation)
 *     → alerts            → Kafka (security-alerts)
 *     → incidents (side)  → Kafka (security-incidents)
 *     → containment (side)→ Kafka (containment-commands)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}. The rule set and engine settings are validated before
 * the job is submitted, so a bad file fails the launch instead of the tasks.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThreatSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(ThreatSentinelJob.class);

    /** Key for events that carry no actor; they share one task. */
    static final String UNKNOWN_KEY = "__unknown__";

    private ThreatSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Threat Sentinel with config: {}", config);

        // fail fast on invalid rules or settings
        try (EngineSession probe = EngineSession.open(config)) {
            LOG.info("Validated {} detection rule(s)", probe.getEngine().getRules().size());
        }

        AtomicBoolean ready = new AtomicBoolean(false);
        HealthServer healthServer = new HealthServer(ready::get);
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config);

        ready.set(true);
        env.execute("Threat Sentinel - Security Event Correlation");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the full Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config) {
        KafkaSource<RawSecurityEvent> kafkaSource = KafkaSource.<RawSecurityEvent>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaEventTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new EventDeserializationSchema())
                .build();

        WatermarkStrategy<RawSecurityEvent> watermarks = WatermarkStrategy
                .<RawSecurityEvent>forBoundedOutOfOrderness(Duration.ofMillis(config.getMaxOutOfOrdernessMs()))
                .withTimestampAssigner((event, recordTimestamp) -> event.getTimestamp() != null
                        ? event.getTimestamp().toEpochMilli()
                        : recordTimestamp)
                .withIdleness(Duration.ofMinutes(1));

        DataStream<RawSecurityEvent> events = env.fromSource(kafkaSource, watermarks, "kafka-events-source");

        String keyField = config.getKeyField();
        SingleOutputStreamOperator<Alert> alerts = events
                .filter(Objects::nonNull) // drop deserialization failures
                .keyBy(event -> keyOf(event, keyField))
                .process(new SiemProcessFunction(config))
                .name("threat-detection");

        alerts.sinkTo(sink(config, config.getKafkaAlertTopic(), new JsonRecordSerializationSchema<Alert>()))
                .name("kafka-alerts-sink");
        alerts.getSideOutput(SiemProcessFunction.INCIDENTS)
                .sinkTo(sink(config, config.getKafkaIncidentTopic(),
                        new JsonRecordSerializationSchema<Incident>()))
                .name("kafka-incidents-sink");
        alerts.getSideOutput(SiemProcessFunction.CONTAINMENT)
                .sinkTo(sink(config, config.getKafkaContainmentTopic(),
                        new JsonRecordSerializationSchema<ContainmentCommand>()))
                .name("kafka-containment-sink");
    }

    /**
     * @return the event's actor value, or {@link #UNKNOWN_KEY}
     */
    static String keyOf(RawSecurityEvent event, String keyField) {
        Object value = event.getMetadata().get(keyField);
        return value != null && !value.toString().isBlank() ? value.toString() : UNKNOWN_KEY;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static <T> KafkaSink<T> sink(JobConfig config, String topic, JsonRecordSerializationSchema<T> schema) {
        return KafkaSink.<T>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setKafkaProducerConfig(config.kafkaProducerProperties())
                .setRecordSerializer(KafkaRecordSerializationSchema.<T>builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(schema)
                        .build())
                .build();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
