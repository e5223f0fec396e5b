package com.logsentinel.flink;

import com.logsentinel.core.event.AnomalyEventSink;
import com.logsentinel.core.model.AnomalyEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Buffers events emitted by detectors until the operator forwards them to its
 * {@link org.apache.flink.util.Collector}.
 */
public class CollectingEventSink implements AnomalyEventSink {

    private final List<AnomalyEvent> buffer = new ArrayList<>();

    @Override
    public void receiveEvent(AnomalyEvent event) {
        buffer.add(event);
    }

    /**
     * @return buffered events in emission order; the buffer is empty afterwards
     */
    public List<AnomalyEvent> drain() {
        if (buffer.isEmpty()) {
            return List.of();
        }
        List<AnomalyEvent> events = List.copyOf(buffer);
        buffer.clear();
        return events;
    }
}
