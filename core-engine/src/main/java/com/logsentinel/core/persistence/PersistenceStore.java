package com.logsentinel.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Key-value store holding one JSON document per name.
 *
 * <p>
 * Names are relative and may contain {@code '/'} separators, e.g.
 * {@code MissingValueDetector/Default}.
 * </p>
 */
public interface PersistenceStore {

    /**
     * Load a document.
     *
     * @param name document name
     * @return the document, or empty if none was stored under this name
     * @throws java.io.UncheckedIOException if the document exists but cannot be
     *                                      read or parsed
     */
    Optional<JsonNode> load(String name);

    /**
     * Replace a document.
     *
     * @param name     document name
     * @param document the new content
     * @throws java.io.UncheckedIOException if the write fails; the previous
     *                                      content is left in place
     */
    void store(String name, JsonNode document);
}
