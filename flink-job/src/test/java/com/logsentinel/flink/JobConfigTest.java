package com.logsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("log-records");
        assertThat(config.getKafkaEventTopic()).isEqualTo("anomaly-events");
        assertThat(config.getKafkaGroupId()).isEqualTo("log-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getSentinelConfigPath()).isEmpty();
        assertThat(config.getStatisticsPeriodSeconds()).isEqualTo(3600);
    }

    @Test
    @DisplayName("Should expose bootstrap servers in producer properties")
    void shouldBuildProducerProperties() {
        JobConfig config = new JobConfig.Builder().kafkaBootstrapServers("kafka:9092").build();

        assertThat(config.kafkaProducerProperties().getProperty("bootstrap.servers")).isEqualTo("kafka:9092");
    }

    @Test
    @DisplayName("Should reject blank topic names")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaEventTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaEventTopic");
    }

    @Test
    @DisplayName("Should reject a non-positive statistics period")
    void shouldRejectStatisticsPeriod() {
        assertThatThrownBy(() -> new JobConfig.Builder().statisticsPeriodSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("statisticsPeriodSeconds");
    }

    @Test
    @DisplayName("Should reject a parallelism below one")
    void shouldRejectParallelism() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
