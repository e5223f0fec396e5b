package com.logsentinel.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PersistenceStore} keeping each document as a JSON file below a base
 * directory.
 *
 * <h3>Atomic writes</h3>
 * <p>
 * A document is first written to a temporary file in the target directory
 * and then moved over the old file, so a crash mid-write leaves either the
 * old or the new document, never a truncated one.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFilePersistenceStore implements PersistenceStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFilePersistenceStore.class);

    private final Path baseDir;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param baseDir directory below which documents are stored; created on
     *                first write
     */
    public JsonFilePersistenceStore(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "Persistence directory must not be null");
    }

    @Override
    public Optional<JsonNode> load(String name) {
        Path file = resolve(name);
        if (!Files.exists(file)) {
            LOG.debug("No persisted document at {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read persisted document " + file, e);
        }
    }

    @Override
    public void store(String name, JsonNode document) {
        Objects.requireNonNull(document, "Document must not be null");
        Path file = resolve(name);
        Path tmp = null;
        try {
            Files.createDirectories(file.getParent());
            tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), document);
            move(tmp, file);
            LOG.debug("Persisted document {}", file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write persisted document " + file, e);
        }
    }

    public Path getBaseDir() {
        return baseDir;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Path resolve(String name) {
        Objects.requireNonNull(name, "Document name must not be null");
        Path file = baseDir.resolve(name).normalize();
        if (!file.startsWith(baseDir.normalize())) {
            throw new IllegalArgumentException("Document name escapes the persistence directory: " + name);
        }
        return file;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
