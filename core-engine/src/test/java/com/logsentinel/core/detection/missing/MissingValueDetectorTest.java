package com.logsentinel.core.detection.missing;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logsentinel.core.detection.AllowlistResult;
import com.logsentinel.core.detection.DetectorContext;
import com.logsentinel.core.model.AffectedValue;
import com.logsentinel.core.model.AnomalyEvent;
import com.logsentinel.core.model.DetectorDefinition;
import com.logsentinel.core.model.LogRecord;
import com.logsentinel.core.support.InMemoryPersistenceStore;
import com.logsentinel.core.support.RecordingEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.logsentinel.core.support.Records.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MissingValueDetector}.
 */
class MissingValueDetectorTest {

    private static final String EVENT_TYPE = "Analysis.MissingValueDetector";

    private InMemoryPersistenceStore store;
    private RecordingEventSink sink;
    private DetectorContext context;
    private MissingValueDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryPersistenceStore();
        sink = new RecordingEventSink();
        context = contextAt(0);
        detector = new MissingValueDetector(definition(), context);
    }

    // ------------------------------------------------------------------
    // Alerting
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should report a silent value once and suppress it afterwards")
    void shouldReportSilentValue() {
        assertThat(detector.receiveRecord(at(0, "svc", "A"))).isTrue();
        assertThat(detector.getTrackingEntry("A")).hasValue(TrackingEntry.normal(0, 3600, "svc"));

        detector.receiveRecord(at(4000, "svc", "B"));

        assertThat(sink.getEvents()).hasSize(1);
        AnomalyEvent event = sink.last();
        assertThat(event.getEventType()).isEqualTo(EVENT_TYPE);
        assertThat(event.getDetectorName()).isEqualTo("svc_watch");
        assertThat(event.getHeadline()).isEqualTo("Interval too large between values");
        assertThat(event.getMessageLines()).containsExactly("svc: A overdue 400s (interval 3600)");
        assertThat(event.getAffectedValues()).containsExactly(new AffectedValue("svc", "A", 400, 3600));
        assertThat(event.getTimestamp()).isEqualTo(Instant.ofEpochSecond(4000));
        assertThat(event.getLogLine()).isEqualTo("line@4000");
        assertThat(detector.getTrackingEntry("A").orElseThrow().getSuppressUntil()).isEqualTo(90400.0);

        detector.receiveRecord(at(5000, "svc", "B"));
        assertThat(sink.getEvents()).hasSize(1);
    }

    @Test
    @DisplayName("Should batch all overdue values of one scan into a single event")
    void shouldBatchOverdueValues() {
        detector.receiveRecord(at(0, "svc", "A", "svc", "B"));

        detector.receiveRecord(at(4000, "svc", "C", "other", "x"));

        assertThat(sink.getEvents()).hasSize(1);
        assertThat(sink.last().getMessageLines()).containsExactly(
                "svc: A overdue 400s (interval 3600)",
                "svc: B overdue 400s (interval 3600)");
        assertThat(sink.last().getAffectedPaths()).containsExactly("svc");
    }

    @Test
    @DisplayName("Should deliver each event to every sink")
    void shouldDeliverToAllSinks() {
        RecordingEventSink second = new RecordingEventSink();
        DetectorContext twoSinks = new DetectorContext(StandardCharsets.UTF_8, store, List.of(sink, second),
                Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), 600, 1);
        MissingValueDetector fanOut = new MissingValueDetector(definition(), twoSinks);

        fanOut.receiveRecord(at(0, "svc", "A"));
        fanOut.receiveRecord(at(4000, "svc", "B"));

        assertThat(sink.getEvents()).hasSize(1);
        assertThat(second.getEvents()).hasSize(1);
    }

    @Test
    @DisplayName("Should omit the log line when not configured")
    void shouldOmitLogLine() {
        DetectorDefinition definition = definition();
        definition.setOutputLogLine(false);
        MissingValueDetector quiet = new MissingValueDetector(definition, context);

        quiet.receiveRecord(at(0, "svc", "A"));
        quiet.receiveRecord(at(4000, "svc", "B"));

        assertThat(sink.last().getLogLine()).isNull();
    }

    @Test
    @DisplayName("Should report a long gap in a single value")
    void shouldReportGapInSingleValue() {
        detector.receiveRecord(at(0, "svc", "A"));

        detector.receiveRecord(at(5000, "svc", "A"));

        assertThat(sink.getEvents()).hasSize(1);
        assertThat(sink.last().getMessageLines()).containsExactly("svc: A overdue 1400s (interval 3600)");
    }

    @Test
    @DisplayName("Should use the clock when the record has no timestamp")
    void shouldFallBackToClock() {
        MissingValueDetector clocked = new MissingValueDetector(definition(), contextAt(777));
        LogRecord record = new LogRecord();
        record.addMatch("svc", "A");

        clocked.receiveRecord(record);

        assertThat(clocked.getTrackingEntry("A").orElseThrow().getLastSeen()).isEqualTo(777.0);
    }

    @Test
    @DisplayName("Should return false for records without the target path")
    void shouldRejectUnrelatedRecord() {
        assertThat(detector.receiveRecord(at(0, "other", "x"))).isFalse();
        assertThat(detector.getRegistry().size()).isZero();
    }

    // ------------------------------------------------------------------
    // Combined values
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should track combined values only when every path is present")
    void shouldRequireAllPathsWhenCombining() {
        DetectorDefinition definition = definition();
        definition.setTargetPaths(List.of("host", "svc"));
        definition.setCombineValues(true);
        MissingValueDetector combined = new MissingValueDetector(definition, context);

        assertThat(combined.receiveRecord(at(0, "host", "h1"))).isFalse();
        assertThat(combined.getRegistry().size()).isZero();

        assertThat(combined.receiveRecord(at(10, "host", "h1", "svc", "s1"))).isTrue();
        assertThat(combined.getTrackingEntry("[\"h1\",\"s1\"]"))
                .hasValue(TrackingEntry.normal(10, 3600, "[\"host\",\"svc\"]"));
    }

    // ------------------------------------------------------------------
    // Learning
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should stop learning at the configured time after start-up")
    void shouldStopLearningAfterConfiguredTime() {
        DetectorDefinition definition = definition();
        definition.setStopLearningTime(100L);
        MissingValueDetector learning = new MissingValueDetector(definition, contextAt(1000));

        learning.receiveRecord(at(1050, "svc", "A"));
        learning.receiveRecord(at(1200, "svc", "B"));

        assertThat(learning.isLearning()).isFalse();
        assertThat(learning.getRegistry().entries()).containsOnlyKeys("A");
    }

    @Test
    @DisplayName("Should keep learning while new values keep arriving")
    void shouldExtendLearningWhileValuesArrive() {
        DetectorDefinition definition = definition();
        definition.setStopLearningNoAnomalyTime(100L);
        MissingValueDetector learning = new MissingValueDetector(definition, contextAt(1000));

        learning.receiveRecord(at(1050, "svc", "A"));
        learning.receiveRecord(at(1120, "svc", "B"));
        assertThat(learning.isLearning()).isTrue();

        learning.receiveRecord(at(1300, "svc", "C"));

        assertThat(learning.isLearning()).isFalse();
        assertThat(learning.getRegistry().entries()).containsOnlyKeys("A", "B");
    }

    // ------------------------------------------------------------------
    // Administrative surface
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should report a manually added value on the next record")
    void shouldCheckManuallyAddedValue() {
        DetectorDefinition definition = definition();
        definition.setLearnMode(false);
        MissingValueDetector manual = new MissingValueDetector(definition, context);
        manual.setCheckValue("A", 60, "svc");

        assertThat(manual.receiveRecord(at(100, "svc", "B"))).isTrue();

        assertThat(sink.last().getMessageLines()).containsExactly("svc: A overdue 40s (interval 60)");
        assertThat(manual.getRegistry().contains("B")).isFalse();
    }

    @Test
    @DisplayName("Should fail to remove an untracked value")
    void shouldFailToRemoveUnknownValue() {
        detector.receiveRecord(at(0, "svc", "A"));

        assertThatThrownBy(() -> detector.removeCheckValue("Z"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(detector.getRegistry().entries()).containsOnlyKeys("A");
    }

    @Test
    @DisplayName("Should set a custom interval through allowlisting")
    void shouldAllowlistCustomInterval() {
        detector.receiveRecord(at(0, "svc", "A"));

        AllowlistResult result = detector.allowlistEvent(EVENT_TYPE, "A", "svc", 7200);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Updated 'A' in 'svc' to new interval 7200.");
        assertThat(detector.getTrackingEntry("A").orElseThrow().getInterval()).isEqualTo(7200);
    }

    @Test
    @DisplayName("Should reset to the default interval for directive -1")
    void shouldAllowlistDefaultInterval() {
        detector.setCheckValue("A", 10, "svc");

        AllowlistResult result = detector.allowlistEvent(EVENT_TYPE, "A", "svc", -1);

        assertThat(result.getMessage()).isEqualTo("Updated 'A' in 'svc' to new interval 3600.");
        assertThat(detector.getTrackingEntry("A").orElseThrow().getInterval()).isEqualTo(3600);
    }

    @Test
    @DisplayName("Should remove the value for other negative directives")
    void shouldAllowlistRemoval() {
        detector.receiveRecord(at(0, "svc", "A"));

        AllowlistResult result = detector.allowlistEvent(EVENT_TYPE, "A", "svc", -2L);

        assertThat(result.isSuccess()).isTrue();
        assertThat(detector.getTrackingEntry("A")).isEmpty();
        assertThat(detector.allowlistEvent(EVENT_TYPE, "A", "svc", -2).isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should reject allowlisting of foreign events and non-integer data")
    void shouldRejectInvalidAllowlisting() {
        detector.receiveRecord(at(0, "svc", "A"));

        assertThat(detector.allowlistEvent("Analysis.Other", "A", "svc", 10).isSuccess()).isFalse();
        assertThat(detector.allowlistEvent(EVENT_TYPE, "A", "svc", "10").isSuccess()).isFalse();
        assertThat(detector.allowlistEvent(EVENT_TYPE, "A", "svc", 1.5).isSuccess()).isFalse();
        assertThat(detector.getTrackingEntry("A").orElseThrow().getInterval()).isEqualTo(3600);
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should persist once per period")
    void shouldPersistOnTimer() {
        detector.receiveRecord(at(0, "svc", "A"));

        assertThat(detector.doTimer(Instant.ofEpochSecond(1000))).isEqualTo(600);
        assertThat(detector.doTimer(Instant.ofEpochSecond(1100))).isEqualTo(500);
        assertThat(store.getWrites()).isZero();

        assertThat(detector.doTimer(Instant.ofEpochSecond(1600))).isEqualTo(600);
        assertThat(store.getWrites()).isEqualTo(1);
        assertThat(store.load("MissingValueDetector/Default")).isPresent();
    }

    @Test
    @DisplayName("Should restore tracked values after a restart")
    void shouldRestoreAfterRestart() {
        detector.receiveRecord(at(0, "svc", "A"));
        detector.receiveRecord(at(4000, "svc", "B"));
        detector.doPersist();

        MissingValueDetector restarted = new MissingValueDetector(definition(), context);

        assertThat(restarted.getRegistry().entries()).isEqualTo(detector.getRegistry().entries());
        restarted.receiveRecord(at(5000, "svc", "B"));
        assertThat(sink.getEvents()).hasSize(1);
    }

    @Test
    @DisplayName("Should use the configured interval for reloaded entries with a different one")
    void shouldAdoptNewDefaultIntervalOnReload() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.putArray("A").add(1000.0).add(60).add(0).add("svc");
        store.put("MissingValueDetector/Default", document);

        MissingValueDetector restarted = new MissingValueDetector(definition(), context);

        assertThat(restarted.getTrackingEntry("A"))
                .hasValue(TrackingEntry.restore(1000, 3600, 4600, "svc"));
    }

    // ------------------------------------------------------------------
    // Statistics
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should reset statistics after logging them")
    void shouldResetStatistics() {
        detector.receiveRecord(at(0, "svc", "A"));
        detector.receiveRecord(at(1, "other", "x"));
        assertThat(detector.getRecordsTotal()).isEqualTo(2);
        assertThat(detector.getRecordsHandled()).isEqualTo(1);

        detector.logStatistics();

        assertThat(detector.getRecordsTotal()).isZero();
        assertThat(detector.getRecordsHandled()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectorContext contextAt(long epochSeconds) {
        return new DetectorContext(StandardCharsets.UTF_8, store, List.of(sink),
                Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC), 600, 2);
    }

    private static DetectorDefinition definition() {
        DetectorDefinition definition = new DetectorDefinition();
        definition.setName("svc_watch");
        definition.setType(DetectorDefinition.TYPE_MISSING_VALUE);
        definition.setTargetPaths(List.of("svc"));
        definition.setLearnMode(true);
        definition.setCombineValues(false);
        definition.setDefaultInterval(3600);
        definition.setRealertInterval(86400);
        return definition;
    }
}
