package com.logsentinel.core.detection.missing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logsentinel.core.persistence.PersistenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes an {@link ExpectedValueRegistry} through a
 * {@link PersistenceStore}.
 *
 * <p>
 * Document layout: an object keyed by channel key, each value the array
 * {@code [lastSeen, interval, suppressUntil, sourcePath]} with
 * {@code suppressUntil == 0} meaning not suppressed.
 * </p>
 */
final class RegistryPersistence {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryPersistence.class);

    private final PersistenceStore store;
    private final String documentName;
    private final ChannelKeyExtractor extractor;
    private final long defaultInterval;

    RegistryPersistence(PersistenceStore store, String documentName, ChannelKeyExtractor extractor,
            long defaultInterval) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.documentName = Objects.requireNonNull(documentName, "documentName must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.defaultInterval = defaultInterval;
    }

    /**
     * Load persisted entries into {@code registry}. Entries from other target
     * paths are dropped; entries with a different interval get the configured
     * one and stay suppressed until their new due time.
     *
     * @return number of entries restored
     */
    int load(ExpectedValueRegistry registry) {
        Optional<JsonNode> document = store.load(documentName);
        if (document.isEmpty()) {
            return 0;
        }
        if (!document.get().isObject()) {
            LOG.warn("Ignoring persisted document {}: expected a JSON object", documentName);
            return 0;
        }

        int restored = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = document.get().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!isWellFormed(value)) {
                LOG.warn("Skipping malformed persisted entry '{}' in {}: {}", field.getKey(), documentName, value);
                continue;
            }
            String sourcePath = value.get(3).asText();
            if (!extractor.acceptsSourcePath(sourcePath)) {
                LOG.debug("Dropping persisted entry '{}' of path {} not configured any more", field.getKey(),
                        sourcePath);
                continue;
            }
            double lastSeen = value.get(0).asDouble();
            long interval = value.get(1).asLong();
            double suppressUntil = value.get(2).asDouble();
            if (interval != defaultInterval) {
                interval = defaultInterval;
                suppressUntil = lastSeen + defaultInterval;
            }
            registry.restore(field.getKey(), TrackingEntry.restore(lastSeen, interval, suppressUntil, sourcePath));
            restored++;
        }
        LOG.debug("Loaded {} entries from {}", restored, documentName);
        return restored;
    }

    /**
     * Write the registry as it is.
     *
     * @throws java.io.UncheckedIOException if the store fails
     */
    void save(ExpectedValueRegistry registry) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, TrackingEntry> e : registry.entries().entrySet()) {
            TrackingEntry entry = e.getValue();
            ArrayNode tuple = document.putArray(e.getKey());
            tuple.add(entry.getLastSeen());
            tuple.add(entry.getInterval());
            tuple.add(entry.getSuppressUntil());
            tuple.add(entry.getSourcePath());
        }
        store.store(documentName, document);
    }

    String getDocumentName() {
        return documentName;
    }

    private static boolean isWellFormed(JsonNode value) {
        return value.isArray()
                && value.size() == 4
                && value.get(0).isNumber()
                && value.get(1).isNumber()
                && value.get(2).isNumber()
                && value.get(3).isTextual();
    }
}
