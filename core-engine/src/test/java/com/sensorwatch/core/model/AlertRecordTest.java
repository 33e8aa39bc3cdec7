package com.sensorwatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertRecord}.
 */
class AlertRecordTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private AlertRecord record;

    @BeforeEach
    void setUp() {
        Alert alert = Alert.builder()
                .sensorId("TEMP_001")
                .level(AlertLevel.CRITICAL)
                .value(85.0)
                .message("Too hot")
                .timestamp(NOW)
                .build();
        record = AlertRecord.of(alert);
    }

    @Test
    @DisplayName("Should copy sensor, message, level, value and time from the alert")
    void shouldCopyAlertFields() {
        assertThat(record.getSensorId()).isEqualTo("TEMP_001");
        assertThat(record.getMessage()).isEqualTo("Too hot");
        assertThat(record.getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(record.getMeasuredValue()).isEqualTo(85.0);
        assertThat(record.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should serialize to JSON with an ISO-8601 timestamp")
    void shouldSerializeToJson() throws Exception {
        String json = record.toJson();
        JsonNode node = new ObjectMapper().readTree(json);

        assertThat(json).startsWith("{\"timestamp\"");
        assertThat(node.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(node.get("sensorId").asText()).isEqualTo("TEMP_001");
        assertThat(node.get("message").asText()).isEqualTo("Too hot");
        assertThat(node.get("level").asText()).isEqualTo("CRITICAL");
        assertThat(node.get("measuredValue").asDouble()).isEqualTo(85.0);
    }

    @Test
    @DisplayName("Should render a single CSV line")
    void shouldRenderCsv() {
        assertThat(record.toCsv()).isEqualTo("2024-03-01T12:00:00Z,TEMP_001,CRITICAL,85.0,'Too hot'");
    }
}
