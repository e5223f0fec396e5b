package com.logsentinel.core.detection.missing;

import com.logsentinel.core.model.LogRecord;

import java.util.List;
import java.util.Optional;

/**
 * Derives the channels a record belongs to.
 *
 * <p>
 * The strategy is fixed when the detector is built:
 * </p>
 * <ul>
 * <li>{@link PerValueKeyExtractor}: one channel per matched value</li>
 * <li>{@link CombinedKeyExtractor}: one composite channel per record, all
 * target paths required</li>
 * <li>{@link FirstPathKeyExtractor}: the first target path present wins</li>
 * </ul>
 */
public interface ChannelKeyExtractor {

    /**
     * Extract the channels of a record.
     *
     * @param record the parsed record
     * @return empty if the record cannot be keyed at all ("no key"); otherwise
     *         the observed channels, possibly an empty list
     */
    Optional<List<ChannelObservation>> extract(LogRecord record);

    /**
     * Decide whether a persisted entry still belongs to this configuration.
     *
     * @param sourcePath the source path stored with the entry
     * @return {@code true} if the entry should be kept on reload
     */
    boolean acceptsSourcePath(String sourcePath);

    /**
     * @return the configured target paths, in order
     */
    List<String> getTargetPaths();
}
