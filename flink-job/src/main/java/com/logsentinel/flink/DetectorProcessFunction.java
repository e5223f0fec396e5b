package com.logsentinel.flink;

import com.logsentinel.core.config.SentinelConfig;
import com.logsentinel.core.detection.DetectorContext;
import com.logsentinel.core.detection.DetectorFactory;
import com.logsentinel.core.event.Slf4jAnomalyEventSink;
import com.logsentinel.core.model.AnomalyEvent;
import com.logsentinel.core.model.LogRecord;
import com.logsentinel.core.persistence.JsonFilePersistenceStore;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs every configured detector
 * against the whole record stream.
 *
 * <p>
 * Detectors observe all records and keep global state, so the stream is keyed
 * by a constant and this operator runs with parallelism 1. Flink never calls
 * {@code processElement} and {@code onTimer} concurrently, which gives the
 * detectors the single-threaded access they require.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * Detectors are built in {@link #open(Configuration)} and restore their
 * expected values from the persistence directory. A processing-time timer
 * chain drives their periodic persistence and the statistics log; state is
 * written once more in {@link #close()}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorProcessFunction
        extends KeyedProcessFunction<Integer, LogRecord, AnomalyEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectorProcessFunction.class);

    private final SentinelConfig sentinelConfig;
    private final long statisticsPeriodSeconds;

    private transient DetectorDispatcher dispatcher;
    private transient SentinelMetrics metrics;

    /** Timestamp of the timer this instance registered, {@code null} before the first record. */
    private transient Long pendingTimer;

    /**
     * @param sentinelConfig          validated detector configuration
     * @param statisticsPeriodSeconds seconds between two statistics log lines
     * @throws IllegalArgumentException if no detector is configured
     */
    public DetectorProcessFunction(SentinelConfig sentinelConfig, long statisticsPeriodSeconds) {
        this.sentinelConfig = Objects.requireNonNull(sentinelConfig, "SentinelConfig must not be null");
        if (sentinelConfig.getDetectors().isEmpty()) {
            throw new IllegalArgumentException("At least one detector must be configured");
        }
        this.statisticsPeriodSeconds = statisticsPeriodSeconds;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        CollectingEventSink eventSink = new CollectingEventSink();
        DetectorContext context = DetectorContext.fromConfig(sentinelConfig,
                new JsonFilePersistenceStore(Path.of(sentinelConfig.getPersistenceDir())),
                List.of(eventSink, new Slf4jAnomalyEventSink()),
                Clock.systemUTC());
        dispatcher = new DetectorDispatcher(
                DetectorFactory.createAll(sentinelConfig.getDetectors(), context),
                eventSink, statisticsPeriodSeconds);

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DetectorProcessFunction opened with {} detector(s), persistence in {}",
                dispatcher.getDetectors().size(), sentinelConfig.getPersistenceDir());
    }

    @Override
    public void close() {
        if (dispatcher == null) {
            return;
        }
        int failures = dispatcher.persistAll();
        LOG.info("DetectorProcessFunction closing, {} detector(s) could not be persisted", failures);
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(LogRecord record,
            KeyedProcessFunction<Integer, LogRecord, AnomalyEvent>.Context ctx,
            Collector<AnomalyEvent> out) {
        long startNanos = System.nanoTime();

        if (pendingTimer == null) {
            pendingTimer = ctx.timerService().currentProcessingTime();
            ctx.timerService().registerProcessingTimeTimer(pendingTimer);
        }

        if (!dispatcher.dispatch(record)) {
            metrics.incrementRecordsUnhandled();
        }
        emit(out);

        metrics.incrementRecordsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<Integer, LogRecord, AnomalyEvent>.OnTimerContext ctx,
            Collector<AnomalyEvent> out) {
        // timers restored from a checkpoint belong to a previous chain
        if (pendingTimer == null || timestamp != pendingTimer) {
            LOG.debug("Ignoring stale timer {}", timestamp);
            return;
        }

        pendingTimer = dispatcher.onTimer(timestamp);
        ctx.timerService().registerProcessingTimeTimer(pendingTimer);

        metrics.incrementPersistenceFailures(dispatcher.drainPersistenceFailures());
        emit(out);
    }

    private void emit(Collector<AnomalyEvent> out) {
        List<AnomalyEvent> events = dispatcher.drainEvents();
        for (AnomalyEvent event : events) {
            out.collect(event);
        }
        if (!events.isEmpty()) {
            metrics.incrementAnomaliesDetected(events.size());
        }
    }
}
