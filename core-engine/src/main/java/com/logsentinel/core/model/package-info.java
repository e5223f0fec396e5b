/**
 * Domain model classes for Log Sentinel.
 *
 * <ul>
 * <li>{@link com.logsentinel.core.model.LogRecord}: parsed log record, path
 * to matched values</li>
 * <li>{@link com.logsentinel.core.model.AnomalyEvent}: event emitted by
 * detectors</li>
 * <li>{@link com.logsentinel.core.model.DetectorDefinition}: detector
 * configuration POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.model;
