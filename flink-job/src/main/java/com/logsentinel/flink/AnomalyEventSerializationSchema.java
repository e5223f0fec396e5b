package com.logsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsentinel.core.model.AnomalyEvent;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts an {@link AnomalyEvent} to
 * JSON bytes for publishing to the Kafka event topic. Timestamps are written
 * as ISO-8601 strings.
 */
public class AnomalyEventSerializationSchema implements SerializationSchema<AnomalyEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEventSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(AnomalyEvent event) {
        try {
            return objectMapper().writeValueAsBytes(event);
        } catch (Exception e) {
            LOG.error("Failed to serialize anomaly event: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
