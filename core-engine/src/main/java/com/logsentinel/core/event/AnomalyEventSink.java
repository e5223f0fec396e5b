package com.logsentinel.core.event;

import com.logsentinel.core.model.AnomalyEvent;

/**
 * Receives anomaly events produced by detectors.
 *
 * <p>
 * Implementations are called on the dispatch thread, synchronously, right
 * after a scan produced the event. They must not throw for transport
 * problems; those belong to the sink.
 * </p>
 */
public interface AnomalyEventSink {

    /**
     * Handle one anomaly event.
     *
     * @param event the event; never {@code null}
     */
    void receiveEvent(AnomalyEvent event);
}
