package com.driftguard.flink;

import com.driftguard.core.config.MonitorConfig;
import com.driftguard.core.config.MonitorConfigLoader;
import com.driftguard.core.model.TelemetryRecord;
import com.driftguard.core.reference.BaselineTable;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
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
 * Main entry point for the LLM DriftGuard Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)
 *     -&gt; Deserialize JSON -&gt; TelemetryRecord
 *     -&gt; Key by stream field (default model_id)
 *     -&gt; AnnotationProcessFunction (one MonitoringSession per key)
 *     -&gt; Serialize TelemetryRecord -&gt; JSON
 *     -&gt; Kafka (annotated topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * monitoring settings from the YAML file loaded by
 * {@link MonitorConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Off by default; monitoring windows are in-memory and start empty when the
 * job starts. Setting {@code FLINK_CHECKPOINT_INTERVAL_MS} enables
 * exactly-once checkpoints of the keyed sessions.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftGuardJob {

        private static final Logger LOG = LoggerFactory.getLogger(DriftGuardJob.class);

        private DriftGuardJob() {
                // entry-point class - not instantiable
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting LLM DriftGuard with config: {}", config);

                // fails fast on an invalid configuration
                MonitorConfig monitorConfig = MonitorConfigLoader.load(config.getMonitorConfigPath());

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                if (config.isCheckpointingEnabled()) {
                        configureCheckpointing(env, config);
                }

                buildPipeline(env, config, monitorConfig);

                env.execute("LLM DriftGuard - Telemetry Annotation");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka -&gt; Flink -&gt; Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        MonitorConfig monitorConfig) {
                KafkaSource<TelemetryRecord> kafkaSource = KafkaSource.<TelemetryRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new TelemetryRecordDeserializationSchema())
                                .build();

                DataStream<TelemetryRecord> records = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-telemetry-source");

                String keyField = config.getStreamKeyField();
                DataStream<TelemetryRecord> annotated = records
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(record -> streamKey(record, keyField))
                                .process(new AnnotationProcessFunction(monitorConfig,
                                                config.getReferenceReloadIntervalMs()))
                                .name("record-annotation");

                KafkaSink<TelemetryRecord> kafkaSink = KafkaSink.<TelemetryRecord>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaOutputTopic())
                                                                .setValueSerializationSchema(
                                                                                new TelemetryRecordSerializationSchema())
                                                                .build())
                                .build();

                annotated.sinkTo(kafkaSink).name("kafka-annotated-sink");
        }

        /**
         * @return the record's stream key, or the default model row name when
         *         the key field is absent
         */
        static String streamKey(TelemetryRecord record, String keyField) {
                return record.getStringField(keyField).orElse(BaselineTable.DEFAULT_MODEL);
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
        }
}
