package com.logsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.LogRecord;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes to a
 * {@link LogRecord}.
 *
 * <p>
 * Expected message layout:
 * </p>
 *
 * <pre>
 * {"timestamp": 1700000000.5,
 *  "matches": {"/model/host": "web1", "/model/raw": {"bytes": "AAE="}, "/model/tags": ["a", "b"]},
 *  "logLine": "..."}
 * </pre>
 * <p>
 * {@code timestamp} (epoch seconds) and {@code logLine} are optional. Match
 * values are strings, numbers, booleans or {@code {"bytes": base64}} objects,
 * or arrays of those. Malformed messages are logged and dropped (returns
 * {@code null}), so a single bad record does not crash the pipeline.
 * </p>
 */
public class LogRecordDeserializationSchema implements DeserializationSchema<LogRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LogRecordDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public LogRecord deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return toRecord(objectMapper().readTree(message));
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Failed to deserialize log record, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(LogRecord nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<LogRecord> getProducedType() {
        return TypeInformation.of(LogRecord.class);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static LogRecord toRecord(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Log record must be a JSON object");
        }
        LogRecord record = new LogRecord();

        JsonNode timestamp = root.get("timestamp");
        if (timestamp != null && !timestamp.isNull()) {
            if (!timestamp.isNumber()) {
                throw new IllegalArgumentException("'timestamp' must be epoch seconds, got: " + timestamp);
            }
            record.setTimestamp(toInstant(timestamp.asDouble()));
        }

        JsonNode logLine = root.get("logLine");
        if (logLine != null && logLine.isTextual()) {
            record.setLogLine(logLine.asText());
        }

        JsonNode matches = root.get("matches");
        if (matches == null || !matches.isObject()) {
            throw new IllegalArgumentException("'matches' object is required");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = matches.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray()) {
                for (JsonNode value : field.getValue()) {
                    addMatch(record, field.getKey(), value);
                }
            } else {
                addMatch(record, field.getKey(), field.getValue());
            }
        }
        return record;
    }

    private static void addMatch(LogRecord record, String path, JsonNode value) {
        if (value.isNull()) {
            return;
        }
        if (value.isValueNode()) {
            record.addMatch(path, value.asText());
        } else if (value.isObject() && value.path("bytes").isTextual()) {
            // throws IllegalArgumentException on invalid base64
            record.addMatch(path, Base64.getDecoder().decode(value.get("bytes").asText()));
        } else {
            throw new IllegalArgumentException("Unsupported match value at " + path + ": " + value);
        }
    }

    private static Instant toInstant(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000d);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return mapper;
    }
}
