package com.logsentinel.core.detection.missing;

import com.logsentinel.core.model.LogRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Every value under every present target path is its own channel. Absent
 * paths are skipped.
 */
public final class PerValueKeyExtractor implements ChannelKeyExtractor {

    private final List<String> targetPaths;
    private final MatchValueDecoder decoder;

    public PerValueKeyExtractor(List<String> targetPaths, MatchValueDecoder decoder) {
        this.targetPaths = List.copyOf(Objects.requireNonNull(targetPaths, "targetPaths must not be null"));
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    }

    @Override
    public Optional<List<ChannelObservation>> extract(LogRecord record) {
        List<ChannelObservation> observations = new ArrayList<>();
        for (String path : targetPaths) {
            record.getMatches(path).ifPresent(values -> {
                for (Object value : values) {
                    observations.add(new ChannelObservation(path, decoder.decode(value)));
                }
            });
        }
        return Optional.of(observations);
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
