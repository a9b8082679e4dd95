package com.metricsentinel.jobs.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricsentinel.core.error.CollaboratorException;
import com.metricsentinel.core.model.AnomalyRecord;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts {@link AnomalyRecord} to JSON for alert transports.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings. Thread-safe; one instance may be
 * shared by all dispatchers.
 * </p>
 */
public class AnomalyRecordSerializer {

    private final ObjectMapper mapper;

    public AnomalyRecordSerializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @throws CollaboratorException if the record cannot be written
     */
    public String toJson(AnomalyRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Failed to serialize anomaly record: " + e.getMessage(), e);
        }
    }

    public byte[] serialize(AnomalyRecord record) {
        return toJson(record).getBytes(StandardCharsets.UTF_8);
    }
}
