package com.logsentinel.core.detection;

import com.logsentinel.core.model.LogRecord;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Detectors are <strong>stateful</strong> and observe the whole record
 * stream. Anomalies are not returned but handed to the
 * {@link com.logsentinel.core.event.AnomalyEventSink}s the detector was built
 * with, because one record may close out a batch of anomalies that concern
 * other channels.
 * </p>
 * <p>
 * Implementations are not thread-safe; the dispatch host calls them from a
 * single thread.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Observe a single record.
     *
     * @param record the parsed log record
     * @return {@code true} if the detector could use the record, {@code false}
     *         if the record carried nothing this detector tracks
     */
    boolean receiveRecord(LogRecord record);

    /**
     * Return the configured name of this detector.
     *
     * @return detector name
     */
    String getName();

    /**
     * Log processing statistics gathered since the previous call and reset
     * them.
     */
    void logStatistics();
}
