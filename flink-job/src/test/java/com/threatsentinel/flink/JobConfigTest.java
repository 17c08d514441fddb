package com.threatsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should use defaults when no variables are set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromMap(Map.of());

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaEventTopic()).isEqualTo("security-events");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("security-alerts");
        assertThat(config.getKafkaIncidentTopic()).isEqualTo("security-incidents");
        assertThat(config.getKafkaContainmentTopic()).isEqualTo("containment-commands");
        assertThat(config.getKafkaGroupId()).isEqualTo("threat-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000);
        assertThat(config.getKeyField()).isEqualTo("userId");
        assertThat(config.getRulesConfigPath()).isEmpty();
        assertThat(config.getSiemConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should read overrides and ignore blank values")
    void shouldReadOverrides() {
        JobConfig config = JobConfig.fromMap(Map.of(
                "KAFKA_BOOTSTRAP_SERVERS", "kafka-1:9092,kafka-2:9092",
                "KAFKA_ALERT_TOPIC", "soc-alerts",
                "FLINK_PARALLELISM", " 4 ",
                "SIEM_CONFIG_PATH", "/etc/sentinel/siem.yml",
                "EVENT_KEY_FIELD", "   "));

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka-1:9092,kafka-2:9092");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("soc-alerts");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getSiemConfigPath()).isEqualTo("/etc/sentinel/siem.yml");
        assertThat(config.getKeyField()).isEqualTo("userId");
    }

    @Test
    @DisplayName("Should wrap unparseable numbers in IllegalStateException")
    void shouldRejectNonNumericValues() {
        assertThatThrownBy(() -> JobConfig.fromMap(Map.of("HEALTH_PORT", "http")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Should validate ranges and required names")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> JobConfig.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> JobConfig.builder().healthPort(70_000).build())
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> JobConfig.builder().kafkaIncidentTopic(" ").build())
                .hasMessageContaining("kafkaIncidentTopic");
        assertThatThrownBy(() -> JobConfig.builder().maxOutOfOrdernessMs(-1).build())
                .hasMessageContaining("maxOutOfOrdernessMs");
    }

    @Test
    @DisplayName("Should build Kafka client properties")
    void shouldBuildKafkaProperties() {
        JobConfig config = JobConfig.builder().kafkaBootstrapServers("broker:9092").kafkaGroupId("g1").build();

        assertThat(config.kafkaConsumerProperties())
                .containsEntry("bootstrap.servers", "broker:9092")
                .containsEntry("group.id", "g1");
        assertThat(config.kafkaProducerProperties()).containsEntry("bootstrap.servers", "broker:9092");
    }
}
