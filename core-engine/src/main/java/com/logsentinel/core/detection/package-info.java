/**
 * Pluggable anomaly detection engine.
 *
 * <p>
 * All detectors implement the
 * {@link com.logsentinel.core.detection.AnomalyDetector} interface and are
 * instantiated via {@link com.logsentinel.core.detection.DetectorFactory}.
 * Detectors that keep state between runs also implement
 * {@link com.logsentinel.core.detection.TimeTriggeredComponent}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new detector type, implement {@code AnomalyDetector} and register
 * the type string in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.detection;
