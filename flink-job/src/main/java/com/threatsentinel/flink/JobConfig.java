package com.threatsentinel.flink;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Typed, immutable configuration object for the Threat Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured entirely through the deployment environment.
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
    private final String kafkaEventTopic;
    private final String kafkaAlertTopic;
    private final String kafkaIncidentTopic;
    private final String kafkaContainmentTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final long maxOutOfOrdernessMs;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final String siemConfigPath;
    private final String keyField;

    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaEventTopic = b.kafkaEventTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaIncidentTopic = b.kafkaIncidentTopic;
        this.kafkaContainmentTopic = b.kafkaContainmentTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.maxOutOfOrdernessMs = b.maxOutOfOrdernessMs;
        this.rulesConfigPath = b.rulesConfigPath;
        this.siemConfigPath = b.siemConfigPath;
        this.keyField = b.keyField;
        this.healthPort = b.healthPort;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Resolve against an explicit variable lookup.
     *
     * @param env variable name to value, {@code null} when unset
     */
    static JobConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "Environment lookup must not be null");
        EnvReader reader = new EnvReader(env);
        try {
            return new Builder()
                    .kafkaBootstrapServers(reader.get("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaEventTopic(reader.get("KAFKA_EVENT_TOPIC", "security-events"))
                    .kafkaAlertTopic(reader.get("KAFKA_ALERT_TOPIC", "security-alerts"))
                    .kafkaIncidentTopic(reader.get("KAFKA_INCIDENT_TOPIC", "security-incidents"))
                    .kafkaContainmentTopic(reader.get("KAFKA_CONTAINMENT_TOPIC", "containment-commands"))
                    .kafkaGroupId(reader.get("KAFKA_GROUP_ID", "threat-sentinel"))
                    .parallelism(Integer.parseInt(reader.get("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(reader.get("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .maxOutOfOrdernessMs(Long.parseLong(reader.get("MAX_OUT_OF_ORDERNESS_MS", "5000")))
                    .rulesConfigPath(reader.get("RULES_CONFIG_PATH", ""))
                    .siemConfigPath(reader.get("SIEM_CONFIG_PATH", ""))
                    .keyField(reader.get("EVENT_KEY_FIELD", "userId"))
                    .healthPort(Integer.parseInt(reader.get("HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Convenience for tests: resolve against a fixed map.
     */
    static JobConfig fromMap(Map<String, String> values) {
        return fromEnvironment(values::get);
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaEventTopic() {
        return kafkaEventTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaIncidentTopic() {
        return kafkaIncidentTopic;
    }

    public String getKafkaContainmentTopic() {
        return kafkaContainmentTopic;
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

    public long getMaxOutOfOrdernessMs() {
        return maxOutOfOrdernessMs;
    }

    /**
     * @return rules file path, blank to use {@code RulesLoader.load()}
     */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    /**
     * @return engine settings file path, blank to use {@code SiemConfigLoader.load()}
     */
    public String getSiemConfigPath() {
        return siemConfigPath;
    }

    public String getKeyField() {
        return keyField;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, port in
     * [1, 65535], non-blank topic names and key field).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaEventTopic = "security-events";
        private String kafkaAlertTopic = "security-alerts";
        private String kafkaIncidentTopic = "security-incidents";
        private String kafkaContainmentTopic = "containment-commands";
        private String kafkaGroupId = "threat-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private long maxOutOfOrdernessMs = 5_000;
        private String rulesConfigPath = "";
        private String siemConfigPath = "";
        private String keyField = "userId";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaEventTopic(String v) {
            this.kafkaEventTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaIncidentTopic(String v) {
            this.kafkaIncidentTopic = v;
            return this;
        }

        public Builder kafkaContainmentTopic(String v) {
            this.kafkaContainmentTopic = v;
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

        public Builder maxOutOfOrdernessMs(long v) {
            this.maxOutOfOrdernessMs = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder siemConfigPath(String v) {
            this.siemConfigPath = v;
            return this;
        }

        public Builder keyField(String v) {
            this.keyField = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
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
            requireNonBlank(kafkaEventTopic, "kafkaEventTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaIncidentTopic, "kafkaIncidentTopic");
            requireNonBlank(kafkaContainmentTopic, "kafkaContainmentTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(keyField, "keyField");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (maxOutOfOrdernessMs < 0) {
                throw new IllegalArgumentException(
                        "maxOutOfOrdernessMs must be >= 0, got: " + maxOutOfOrdernessMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            rulesConfigPath = rulesConfigPath != null ? rulesConfigPath : "";
            siemConfigPath = siemConfigPath != null ? siemConfigPath : "";

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

    private static final class EnvReader {
        private final Function<String, String> env;

        EnvReader(Function<String, String> env) {
            this.env = env;
        }

        String get(String name, String defaultValue) {
            String value = env.apply(name);
            return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
        }
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaEventTopic='" + kafkaEventTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaIncidentTopic='" + kafkaIncidentTopic + '\'' +
                ", kafkaContainmentTopic='" + kafkaContainmentTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", maxOutOfOrdernessMs=" + maxOutOfOrdernessMs +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", siemConfigPath='" + siemConfigPath + '\'' +
                ", keyField='" + keyField + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
