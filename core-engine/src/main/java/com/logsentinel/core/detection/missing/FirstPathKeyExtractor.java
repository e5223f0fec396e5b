package com.logsentinel.core.detection.missing;

import com.logsentinel.core.model.LogRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Target paths are alternatives: the first one present in the record
 * provides the channel. Useful when the same identifier (host name, service
 * name) sits at different paths depending on the log format.
 */
public final class FirstPathKeyExtractor implements ChannelKeyExtractor {

    private final List<String> targetPaths;
    private final MatchValueDecoder decoder;

    public FirstPathKeyExtractor(List<String> targetPaths, MatchValueDecoder decoder) {
        this.targetPaths = List.copyOf(Objects.requireNonNull(targetPaths, "targetPaths must not be null"));
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    @Override
    public Optional<List<ChannelObservation>> extract(LogRecord record) {
        for (String path : targetPaths) {
            Optional<List<Object>> matches = record.getMatches(path);
            if (matches.isPresent() && !matches.get().isEmpty()) {
                String key = decoder.decode(matches.get().get(0));
                return Optional.of(List.of(new ChannelObservation(path, key)));
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean acceptsSourcePath(String sourcePath) {
        return targetPaths.contains(sourcePath);
    }

    @Override
    public List<String> getTargetPaths() {
        return targetPaths;
    }
}
