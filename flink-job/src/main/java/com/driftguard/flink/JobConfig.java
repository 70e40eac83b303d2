package com.driftguard.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the DriftGuard Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through container env vars or a shell
 * environment. Monitoring behaviour itself lives in the YAML file named by
 * {@code DRIFTGUARD_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaOutputTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;

    /** {@code 0} disables checkpointing. */
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Monitoring
    // ---------------------------------------------------------------
    private final String monitorConfigPath;
    private final String streamKeyField;

    /** {@code 0} loads reference data once per task. */
    private final long referenceReloadIntervalMs;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaOutputTopic = b.kafkaOutputTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.monitorConfigPath = b.monitorConfigPath;
        this.streamKeyField = b.streamKeyField;
        this.referenceReloadIntervalMs = b.referenceReloadIntervalMs;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "llm-telemetry"))
                    .kafkaOutputTopic(env("KAFKA_OUTPUT_TOPIC", "llm-telemetry-annotated"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "llm-driftguard"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "0"))
                    .monitorConfigPath(env("DRIFTGUARD_CONFIG_PATH", ""))
                    .streamKeyField(env("STREAM_KEY_FIELD", "model_id"))
                    .referenceReloadIntervalMs(parseLongEnv("REFERENCE_RELOAD_INTERVAL_MS", "0"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaOutputTopic() {
        return kafkaOutputTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public boolean isCheckpointingEnabled() {
        return checkpointIntervalMs > 0;
    }

    public String getMonitorConfigPath() {
        return monitorConfigPath;
    }

    public String getStreamKeyField() {
        return streamKeyField;
    }

    public long getReferenceReloadIntervalMs() {
        return referenceReloadIntervalMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, non-negative intervals, non-blank topic
     * names and key field).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "llm-telemetry";
        private String kafkaOutputTopic = "llm-telemetry-annotated";
        private String kafkaGroupId = "llm-driftguard";
        private int parallelism = 1;
        private long checkpointIntervalMs = 0;
        private String monitorConfigPath = "";
        private String streamKeyField = "model_id";
        private long referenceReloadIntervalMs = 0;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaOutputTopic(String v) {
            this.kafkaOutputTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder monitorConfigPath(String v) {
            this.monitorConfigPath = v;
            return this;
        }

        public Builder streamKeyField(String v) {
            this.streamKeyField = v;
            return this;
        }

        public Builder referenceReloadIntervalMs(long v) {
            this.referenceReloadIntervalMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaOutputTopic, "kafkaOutputTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(streamKeyField, "streamKeyField");
            if (monitorConfigPath == null) {
                monitorConfigPath = "";
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 0) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 0, got: " + checkpointIntervalMs);
            }
            if (referenceReloadIntervalMs < 0) {
                throw new IllegalArgumentException(
                        "referenceReloadIntervalMs must be >= 0, got: " + referenceReloadIntervalMs);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaOutputTopic='" + kafkaOutputTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", monitorConfigPath='" + monitorConfigPath + '\'' +
                ", streamKeyField='" + streamKeyField + '\'' +
                ", referenceReloadIntervalMs=" + referenceReloadIntervalMs +
                '}';
    }
}
