package com.logsentinel.core.event;

import com.logsentinel.core.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event sink that writes every anomaly event to the log.
 */
public final class Slf4jAnomalyEventSink implements AnomalyEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(Slf4jAnomalyEventSink.class);

    @Override
    public void receiveEvent(AnomalyEvent event) {
        LOG.warn("{} [{}] {} at {}", event.getEventType(), event.getDetectorName(),
                event.getHeadline(), event.getTimestamp());
        for (String line : event.getMessageLines()) {
            LOG.warn("  {}", line);
        }
    }
}
