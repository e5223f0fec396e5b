/**
 * Detection of values that stop appearing in the record stream.
 *
 * <p>
 * {@link com.logsentinel.core.detection.missing.MissingValueDetector} wires
 * together a {@link com.logsentinel.core.detection.missing.ChannelKeyExtractor},
 * the {@link com.logsentinel.core.detection.missing.ExpectedValueRegistry}
 * (tracking state, scan watermark, alerting) and the
 * {@link com.logsentinel.core.detection.missing.LearningController}.
 * All times are record times in epoch seconds.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.detection.missing;
