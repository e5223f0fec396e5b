package com.logsentinel.flink;

import com.logsentinel.core.detection.AnomalyDetector;
import com.logsentinel.core.detection.TimeTriggeredComponent;
import com.logsentinel.core.model.AnomalyEvent;
import com.logsentinel.core.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Drives a set of detectors from a single thread: hands every record to every
 * detector, runs their timers and logs their statistics.
 *
 * <p>
 * A failing detector is logged and skipped so the remaining detectors still
 * see the record. Persistence failures are counted and retried on a later
 * timer; detector state is left as it was.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorDispatcher.class);

    /** Seconds before a failed persistence write is attempted again. */
    static final long RETRY_DELAY_SECONDS = 60;

    private final List<AnomalyDetector> detectors;
    private final CollectingEventSink eventSink;
    private final long statisticsPeriodMillis;

    private long nextStatisticsMillis = -1;
    private int persistenceFailures;

    /**
     * @param detectors               detectors built on {@code eventSink}
     * @param eventSink               sink the detectors emit into
     * @param statisticsPeriodSeconds seconds between two statistics log lines
     */
    public DetectorDispatcher(List<AnomalyDetector> detectors, CollectingEventSink eventSink,
            long statisticsPeriodSeconds) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
        if (statisticsPeriodSeconds <= 0) {
            throw new IllegalArgumentException(
                    "statisticsPeriodSeconds must be > 0, got: " + statisticsPeriodSeconds);
        }
        this.statisticsPeriodMillis = statisticsPeriodSeconds * 1000;
    }

    // ---------------------------------------------------------------
    // Records
    // ---------------------------------------------------------------

    /**
     * @param record the parsed record
     * @return {@code true} if at least one detector could use the record
     */
    public boolean dispatch(LogRecord record) {
        boolean handled = false;
        for (AnomalyDetector detector : detectors) {
            try {
                handled |= detector.receiveRecord(record);
            } catch (RuntimeException e) {
                LOG.error("Detector [{}] threw an exception, continuing with next detector",
                        detector.getName(), e);
            }
        }
        return handled;
    }

    /**
     * @return events emitted since the previous call
     */
    public List<AnomalyEvent> drainEvents() {
        return eventSink.drain();
    }

    // ---------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------

    /**
     * Run all time-triggered detectors and, when due, log statistics.
     *
     * @param nowMillis current processing time
     * @return processing time at which this method wants to run again
     */
    public long onTimer(long nowMillis) {
        if (nextStatisticsMillis < 0) {
            nextStatisticsMillis = nowMillis + statisticsPeriodMillis;
        } else if (nowMillis >= nextStatisticsMillis) {
            detectors.forEach(AnomalyDetector::logStatistics);
            nextStatisticsMillis = nowMillis + statisticsPeriodMillis;
        }

        long nextMillis = nextStatisticsMillis;
        Instant now = Instant.ofEpochMilli(nowMillis);
        for (AnomalyDetector detector : detectors) {
            if (!(detector instanceof TimeTriggeredComponent component)) {
                continue;
            }
            long delaySeconds;
            try {
                delaySeconds = component.doTimer(now);
            } catch (RuntimeException e) {
                persistenceFailures++;
                LOG.error("Timer of detector [{}] failed, retrying in {}s", detector.getName(),
                        RETRY_DELAY_SECONDS, e);
                delaySeconds = RETRY_DELAY_SECONDS;
            }
            nextMillis = Math.min(nextMillis, nowMillis + Math.max(1, delaySeconds) * 1000);
        }
        return nextMillis;
    }

    /**
     * Write the state of every time-triggered detector now.
     *
     * @return number of detectors whose state could not be written
     */
    public int persistAll() {
        int failures = 0;
        for (AnomalyDetector detector : detectors) {
            if (detector instanceof TimeTriggeredComponent component) {
                try {
                    component.doPersist();
                } catch (RuntimeException e) {
                    failures++;
                    LOG.error("Could not persist detector [{}]", detector.getName(), e);
                }
            }
        }
        persistenceFailures += failures;
        return failures;
    }

    /**
     * @return persistence failures since the previous call
     */
    public int drainPersistenceFailures() {
        int failures = persistenceFailures;
        persistenceFailures = 0;
        return failures;
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }
}
