package com.logsentinel.flink;

import com.logsentinel.core.config.ConfigLoader;
import com.logsentinel.core.config.SentinelConfig;
import com.logsentinel.core.model.AnomalyEvent;
import com.logsentinel.core.model.LogRecord;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Log Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (log record topic)
 *     -> Deserialize JSON -> LogRecord
 *     -> Key by constant (all detectors see every record)
 *     -> DetectorProcessFunction (parallelism 1)
 *     -> Serialize AnomalyEvent -> JSON
 *     -> Kafka (anomaly event topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Transport settings come from environment variables via {@link JobConfig};
 * detectors from the YAML file resolved by {@link ConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Checkpointing keeps Kafka offsets consistent. Detector state is not part
 * of Flink state; it lives in the persistence directory of the detector
 * configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(LogSentinelJob.class);

        /** The record stream is keyed by this single value. */
        static final int DETECTION_KEY = 0;

        private LogSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Log Sentinel with config: {}", config);

                // 2. Load detector definitions
                SentinelConfig sentinelConfig = loadSentinelConfig(config);
                if (sentinelConfig.getDetectors().isEmpty()) {
                        throw new IllegalStateException(
                                        "No detectors defined. Provide them via "
                                                        + ConfigLoader.ENV_CONFIG_PATH
                                                        + " or a classpath " + ConfigLoader.DEFAULT_RESOURCE
                                                        + " file.");
                }
                LOG.info("Loaded {} detector definition(s)", sentinelConfig.getDetectors().size());

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, sentinelConfig);

                // 5. Execute
                env.execute("Log Sentinel: Missing Value Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka -> Flink -> Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        SentinelConfig sentinelConfig) {
                KafkaSource<LogRecord> kafkaSource = KafkaSource.<LogRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new LogRecordDeserializationSchema())
                                .build();

                // detectors work on record time, Flink watermarks are not used
                DataStream<LogRecord> records = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-log-records-source");

                DataStream<AnomalyEvent> events = records
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(record -> DETECTION_KEY)
                                .process(new DetectorProcessFunction(sentinelConfig,
                                                config.getStatisticsPeriodSeconds()))
                                .name("missing-value-detection")
                                .setParallelism(1)
                                .setMaxParallelism(1);

                KafkaSink<AnomalyEvent> kafkaSink = KafkaSink.<AnomalyEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaEventTopic())
                                                                .setValueSerializationSchema(
                                                                                new AnomalyEventSerializationSchema())
                                                                .build())
                                .build();

                events.sinkTo(kafkaSink).name("kafka-anomaly-events-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static SentinelConfig loadSentinelConfig(JobConfig config) {
                String path = config.getSentinelConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
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
