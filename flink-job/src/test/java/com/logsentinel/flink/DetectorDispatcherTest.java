package com.logsentinel.flink;

import com.logsentinel.core.detection.AnomalyDetector;
import com.logsentinel.core.detection.TimeTriggeredComponent;
import com.logsentinel.core.model.AnomalyEvent;
import com.logsentinel.core.model.LogRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectorDispatcher}.
 */
class DetectorDispatcherTest {

    @Test
    @DisplayName("Should keep dispatching when one detector fails")
    void shouldIsolateFailingDetector() {
        CollectingEventSink sink = new CollectingEventSink();
        StubDetector failing = new StubDetector("failing", sink);
        failing.fail = true;
        StubDetector healthy = new StubDetector("healthy", sink);
        DetectorDispatcher dispatcher = new DetectorDispatcher(List.of(failing, healthy), sink, 60);

        assertThat(dispatcher.dispatch(new LogRecord())).isTrue();

        assertThat(healthy.received).isEqualTo(1);
        assertThat(dispatcher.drainEvents()).hasSize(1);
        assertThat(dispatcher.drainEvents()).isEmpty();
    }

    @Test
    @DisplayName("Should schedule the earliest timer any detector asks for")
    void shouldScheduleEarliestTimer() {
        CollectingEventSink sink = new CollectingEventSink();
        StubDetector a = new StubDetector("a", sink);
        a.delay = 600;
        StubDetector b = new StubDetector("b", sink);
        b.delay = 30;
        DetectorDispatcher dispatcher = new DetectorDispatcher(List.of(a, b), sink, 3600);

        assertThat(dispatcher.onTimer(1_000_000)).isEqualTo(1_030_000);
        assertThat(a.lastTimer).isEqualTo(Instant.ofEpochMilli(1_000_000));
    }

    @Test
    @DisplayName("Should log statistics once per period")
    void shouldLogStatisticsPerPeriod() {
        CollectingEventSink sink = new CollectingEventSink();
        StubDetector detector = new StubDetector("a", sink);
        detector.delay = 10_000;
        DetectorDispatcher dispatcher = new DetectorDispatcher(List.of(detector), sink, 60);

        assertThat(dispatcher.onTimer(0)).isEqualTo(60_000);
        assertThat(detector.statistics).isZero();

        dispatcher.onTimer(60_000);
        assertThat(detector.statistics).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count persistence failures and retry later")
    void shouldRetryFailedPersistence() {
        CollectingEventSink sink = new CollectingEventSink();
        StubDetector detector = new StubDetector("a", sink);
        detector.fail = true;
        DetectorDispatcher dispatcher = new DetectorDispatcher(List.of(detector), sink, 3600);

        long next = dispatcher.onTimer(0);

        assertThat(next).isEqualTo(DetectorDispatcher.RETRY_DELAY_SECONDS * 1000);
        assertThat(dispatcher.drainPersistenceFailures()).isEqualTo(1);
        assertThat(dispatcher.persistAll()).isEqualTo(1);
        assertThat(dispatcher.drainPersistenceFailures()).isEqualTo(1);
        assertThat(dispatcher.drainPersistenceFailures()).isZero();
    }

    /** Detector recording every call made to it. */
    private static final class StubDetector implements AnomalyDetector, TimeTriggeredComponent {

        private final String name;
        private final CollectingEventSink sink;
        boolean fail;
        long delay = 60;
        int received;
        int statistics;
        Instant lastTimer;

        StubDetector(String name, CollectingEventSink sink) {
            this.name = name;
            this.sink = sink;
        }

        @Override
        public boolean receiveRecord(LogRecord record) {
            if (fail) {
                throw new IllegalStateException("boom");
            }
            received++;
            sink.receiveEvent(AnomalyEvent.builder()
                    .eventType("Analysis.Stub")
                    .detectorName(name)
                    .timestamp(Instant.EPOCH)
                    .build());
            return true;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void logStatistics() {
            statistics++;
        }

        @Override
        public long doTimer(Instant triggerTime) {
            lastTimer = triggerTime;
            if (fail) {
                doPersist();
            }
            return delay;
        }

        @Override
        public void doPersist() {
            if (fail) {
                throw new UncheckedIOException(new IOException("disk full"));
            }
        }
    }
}
