package com.logsentinel.core.detection.missing;

import com.logsentinel.core.detection.DetectorContext;
import com.logsentinel.core.model.DetectorDefinition;

/**
 * {@link MissingValueDetector} whose target paths are alternatives.
 *
 * <p>
 * The first target path present in a record provides the channel, so one
 * identifier (host name, service name) can be followed across log formats
 * that place it at different paths. {@code combineValues} has no effect.
 * Events list all target paths for every reported value.
 * </p>
 */
public class MissingValueListDetector extends MissingValueDetector {

    private final String joinedTargetPaths;

    public MissingValueListDetector(DetectorDefinition definition, DetectorContext context) {
        super(definition, context, new FirstPathKeyExtractor(definition.getTargetPaths(),
                new MatchValueDecoder(context.getCharset())));
        this.joinedTargetPaths = String.join(", ", definition.getTargetPaths());
    }

    @Override
    protected String reportedPath(OverdueChannel channel) {
        return joinedTargetPaths;
    }
}
