package com.logsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.AffectedValue;
import com.logsentinel.core.model.AnomalyEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyEventSerializationSchema}.
 */
class AnomalyEventSerializationSchemaTest {

    @Test
    @DisplayName("Should write the event as JSON with an ISO-8601 timestamp")
    void shouldSerializeEvent() throws IOException {
        AnomalyEvent event = AnomalyEvent.builder()
                .eventType("Analysis.MissingValueDetector")
                .detectorName("silent_hosts")
                .headline("Interval too large between values")
                .messageLine("/host: web1 overdue 400s (interval 3600)")
                .affectedPaths(List.of("/host"))
                .affectedValue(new AffectedValue("/host", "web1", 400, 3600))
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        byte[] bytes = new AnomalyEventSerializationSchema().serialize(event);

        JsonNode json = new ObjectMapper().readTree(bytes);
        assertThat(json.get("eventType").asText()).isEqualTo("Analysis.MissingValueDetector");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.get("messageLines").get(0).asText()).isEqualTo("/host: web1 overdue 400s (interval 3600)");
        assertThat(json.get("affectedValues").get(0).get("OverdueTime").asLong()).isEqualTo(400);
        assertThat(json.get("affectedValues").get(0).get("TargetPathList").asText()).isEqualTo("/host");
        assertThat(json.has("logLine")).isFalse();
    }
}
