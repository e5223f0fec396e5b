package com.logsentinel.core.detection;

import java.time.Instant;

/**
 * Component that needs periodic callbacks from the dispatch host, e.g. to
 * write its state to persistence.
 */
public interface TimeTriggeredComponent {

    /**
     * Periodic callback.
     *
     * @param triggerTime current wall-clock time of the host
     * @return seconds until the component wants to be called again
     */
    long doTimer(Instant triggerTime);

    /**
     * Write the component state to persistence immediately.
     *
     * @throws java.io.UncheckedIOException if the write fails
     */
    void doPersist();
}
