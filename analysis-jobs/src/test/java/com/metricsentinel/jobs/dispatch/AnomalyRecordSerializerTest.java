package com.metricsentinel.jobs.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.AnomalyKind;
import com.metricsentinel.core.model.AnomalyRecord;
import com.metricsentinel.core.model.MetricKind;
import com.metricsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnomalyRecordSerializer} and {@link LoggingAlertDispatcher}.
 */
class AnomalyRecordSerializerTest {

    private final AnomalyRecordSerializer serializer = new AnomalyRecordSerializer();

    private static AnomalyRecord record(Severity severity) {
        return AnomalyRecord.builder()
                .checkName("daily_cost")
                .metricKind(MetricKind.COST)
                .source("ec2")
                .timestamp(Instant.parse("2024-03-08T00:00:00Z"))
                .observedValue(250.0)
                .baselineMean(100.0)
                .threshold(104.32)
                .kind(AnomalyKind.SPIKE)
                .severity(severity)
                .details("Spike: cost=250.00 above threshold 104.32")
                .build();
    }

    @Test
    @DisplayName("Writes every field with an ISO-8601 timestamp")
    void shouldWriteJson() throws Exception {
        JsonNode json = new ObjectMapper().readTree(serializer.toJson(record(Severity.HIGH)));

        assertThat(json.get("checkName").asText()).isEqualTo("daily_cost");
        assertThat(json.get("metricKind").asText()).isEqualTo("COST");
        assertThat(json.get("source").asText()).isEqualTo("ec2");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-08T00:00:00Z");
        assertThat(json.get("kind").asText()).isEqualTo("SPIKE");
        assertThat(json.get("severity").asText()).isEqualTo("HIGH");
        assertThat(json.get("observedValue").asDouble()).isEqualTo(250.0);
        assertThat(json.get("baselineMean").asDouble()).isEqualTo(100.0);
        assertThat(json.get("threshold").asDouble()).isEqualTo(104.32);
        assertThat(json.get("details").asText()).startsWith("Spike");
    }

    @Test
    @DisplayName("Fields appear in a stable order, check name first")
    void shouldKeepFieldOrder() {
        String json = serializer.toJson(record(Severity.MEDIUM));

        assertThat(json).startsWith("{\"checkName\":\"daily_cost\",\"metricKind\":\"COST\"");
        assertThat(json.indexOf("\"timestamp\"")).isLessThan(json.indexOf("\"severity\""));
    }

    @Test
    @DisplayName("Byte form is the UTF-8 encoding of the JSON string")
    void shouldSerializeToUtf8Bytes() {
        AnomalyRecord record = record(Severity.MEDIUM);

        assertThat(new String(serializer.serialize(record), StandardCharsets.UTF_8))
                .isEqualTo(serializer.toJson(record));
    }

    @Test
    @DisplayName("The logging dispatcher serializes each record once")
    void shouldLogEachRecord() {
        List<AnomalyRecord> seen = new ArrayList<>();
        LoggingAlertDispatcher dispatcher = new LoggingAlertDispatcher(new AnomalyRecordSerializer() {
            @Override
            public String toJson(AnomalyRecord record) {
                seen.add(record);
                return super.toJson(record);
            }
        });

        dispatcher.dispatch(record(Severity.HIGH));
        dispatcher.dispatch(record(Severity.MEDIUM));

        assertThat(seen).extracting(AnomalyRecord::getSeverity).containsExactly(Severity.HIGH, Severity.MEDIUM);
    }
}
