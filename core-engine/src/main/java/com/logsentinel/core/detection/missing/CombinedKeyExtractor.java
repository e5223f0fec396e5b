package com.logsentinel.core.detection.missing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.LogRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All values of all target paths form one composite channel.
 *
 * <p>
 * The key is the JSON array of the values in target-path order, the source
 * path the JSON array of the matching paths. A record missing any target
 * path cannot be keyed.
 * </p>
 */
public final class CombinedKeyExtractor implements ChannelKeyExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> targetPaths;
    private final MatchValueDecoder decoder;
    private final String encodedTargetPaths;

    public CombinedKeyExtractor(List<String> targetPaths, MatchValueDecoder decoder) {
        this.targetPaths = List.copyOf(Objects.requireNonNull(targetPaths, "targetPaths must not be null"));
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.encodedTargetPaths = encode(this.targetPaths);
    }

    @Override
    public Optional<List<ChannelObservation>> extract(LogRecord record) {
        List<String> values = new ArrayList<>();
        List<String> paths = new ArrayList<>();
        for (String path : targetPaths) {
            Optional<List<Object>> matches = record.getMatches(path);
            if (matches.isEmpty()) {
                return Optional.empty();
            }
            for (Object value : matches.get()) {
                values.add(decoder.decode(value));
                paths.add(path);
            }
        }
        return Optional.of(List.of(new ChannelObservation(encode(paths), encode(values))));
    }

    @Override
    public boolean acceptsSourcePath(String sourcePath) {
        return encodedTargetPaths.equals(sourcePath);
    }

    @Override
    public List<String> getTargetPaths() {
        return targetPaths;
    }

    /**
     * @param parts ordered values or paths
     * @return deterministic composite encoding, e.g. {@code ["a","b"]}
     */
    static String encode(List<String> parts) {
        try {
            return MAPPER.writeValueAsString(parts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode composite key " + parts, e);
        }
    }
}
