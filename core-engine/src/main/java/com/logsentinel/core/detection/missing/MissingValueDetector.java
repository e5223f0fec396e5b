package com.logsentinel.core.detection.missing;

import com.logsentinel.core.detection.AllowlistResult;
import com.logsentinel.core.detection.AnomalyDetector;
import com.logsentinel.core.detection.DetectorContext;
import com.logsentinel.core.detection.TimeTriggeredComponent;
import com.logsentinel.core.event.AnomalyEventSink;
import com.logsentinel.core.model.AffectedValue;
import com.logsentinel.core.model.AnomalyEvent;
import com.logsentinel.core.model.DetectorDefinition;
import com.logsentinel.core.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reports values that stop appearing in the log stream.
 *
 * <p>
 * Every distinct value (or value combination) of the target paths is a
 * channel. A channel seen once is expected again within
 * {@code defaultInterval} seconds of record time; if it stays silent longer,
 * the next scan reports it and suppresses further reports for
 * {@code realertInterval} seconds. Typical use: detect a host or service
 * that stopped logging.
 * </p>
 *
 * <h3>Learning</h3>
 * <p>
 * Unknown channels are only registered while learning is on. Learning can be
 * switched off by a cutoff, see {@link LearningController}. Administrative
 * calls ({@link #allowlistEvent}) add, change or remove channels at any time.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The registry is loaded from persistence on construction and written back
 * from {@link #doTimer(Instant)} once per persistence period.
 * </p>
 *
 * @since 1.0.0
 */
public class MissingValueDetector implements AnomalyDetector, TimeTriggeredComponent {

    private static final Logger LOG = LoggerFactory.getLogger(MissingValueDetector.class);

    public static final String HEADLINE = "Interval too large between values";

    private static final String ALLOWLIST_USAGE = "Allowlisting data has to be an integer with the new interval, "
            + "-1 to reset to defaults, other negative value to remove the entry";

    private final String name;
    private final long defaultInterval;
    private final boolean outputLogLine;
    private final ChannelKeyExtractor extractor;
    private final ExpectedValueRegistry registry;
    private final LearningController learning;
    private final RegistryPersistence persistence;
    private final List<AnomalyEventSink> eventSinks;
    private final Clock clock;
    private final long persistencePeriod;
    private final int statLevel;

    private Double nextPersistTime;

    // statistics since the last logStatistics() call
    private long recordsTotal;
    private long recordsHandled;
    private final List<String> learnedValues = new ArrayList<>();

    /**
     * @param definition detector configuration
     * @param context    shared collaborators
     * @throws IllegalStateException        if the definition is invalid
     * @throws java.io.UncheckedIOException if persisted state cannot be read
     */
    public MissingValueDetector(DetectorDefinition definition, DetectorContext context) {
        this(definition, context, extractorFor(definition, context));
    }

    protected MissingValueDetector(DetectorDefinition definition, DetectorContext context,
            ChannelKeyExtractor extractor) {
        Objects.requireNonNull(definition, "DetectorDefinition must not be null");
        Objects.requireNonNull(context, "DetectorContext must not be null");
        definition.validate();

        this.name = definition.getName();
        this.defaultInterval = definition.getDefaultInterval();
        this.outputLogLine = definition.isOutputLogLine();
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.registry = new ExpectedValueRegistry(definition.getRealertInterval());
        this.eventSinks = context.getEventSinks();
        this.clock = context.getClock();
        this.persistencePeriod = context.getPersistencePeriod();
        this.statLevel = context.getStatLevel();
        this.learning = new LearningController(name, definition.isLearnMode(), definition.getStopLearningTime(),
                definition.getStopLearningNoAnomalyTime(), RecordTime.toEpochSeconds(clock.instant()));
        this.persistence = new RegistryPersistence(context.getPersistenceStore(),
                getClass().getSimpleName() + "/" + definition.getPersistenceId(), extractor, defaultInterval);

        int restored = persistence.load(registry);
        LOG.info("Detector '{}' started with {} persisted value(s), learnMode={}", name, restored,
                learning.isLearning());
    }

    private static ChannelKeyExtractor extractorFor(DetectorDefinition definition, DetectorContext context) {
        MatchValueDecoder decoder = new MatchValueDecoder(context.getCharset());
        return definition.isCombineValues()
                ? new CombinedKeyExtractor(definition.getTargetPaths(), decoder)
                : new PerValueKeyExtractor(definition.getTargetPaths(), decoder);
    }

    // ---------------------------------------------------------------
    // Record processing
    // ---------------------------------------------------------------

    @Override
    public boolean receiveRecord(LogRecord record) {
        Objects.requireNonNull(record, "LogRecord must not be null");
        recordsTotal++;

        Instant timestamp = record.getTimestamp() != null ? record.getTimestamp() : clock.instant();
        double time = RecordTime.toEpochSeconds(timestamp);
        learning.checkCutoff(time);

        Optional<List<ChannelObservation>> observations = extractor.extract(record);
        if (observations.isEmpty() || observations.get().isEmpty()) {
            LOG.trace("Detector [{}]: no channel in {}", name, record);
            return false;
        }

        RegistryUpdate update = registry.process(observations.get(), time, learning.isLearning(), defaultInterval);
        for (String key : update.getLearnedKeys()) {
            learning.onValueLearned(time);
            learnedValues.add(key);
        }
        if (!update.getOverdueChannels().isEmpty()) {
            publish(update.getOverdueChannels(), record, timestamp);
        }

        recordsHandled++;
        return true;
    }

    private void publish(List<OverdueChannel> overdue, LogRecord record, Instant timestamp) {
        AnomalyEvent.Builder builder = AnomalyEvent.builder()
                .eventType(getEventType())
                .detectorName(name)
                .headline(HEADLINE)
                .timestamp(timestamp)
                .affectedPaths(record.getPaths().stream()
                        .filter(extractor.getTargetPaths()::contains)
                        .toList());
        for (OverdueChannel channel : overdue) {
            String path = reportedPath(channel);
            builder.messageLine(String.format("%s: %s overdue %ds (interval %d)",
                    path, channel.getKey(), channel.getOverdueSeconds(), channel.getInterval()));
            builder.affectedValue(new AffectedValue(path, channel.getKey(), channel.getOverdueSeconds(),
                    channel.getInterval()));
        }
        if (outputLogLine) {
            builder.logLine(record.getLogLine());
        }

        AnomalyEvent event = builder.build();
        LOG.debug("Detector [{}] reporting {} overdue value(s)", name, overdue.size());
        for (AnomalyEventSink sink : eventSinks) {
            sink.receiveEvent(event);
        }
    }

    /**
     * Path shown for an overdue channel in events.
     *
     * @param channel the overdue channel
     * @return the path the channel was extracted from
     */
    protected String reportedPath(OverdueChannel channel) {
        return channel.getPath();
    }

    /**
     * @return event type of events from this detector, e.g.
     *         {@code Analysis.MissingValueDetector}
     */
    public String getEventType() {
        return "Analysis." + getClass().getSimpleName();
    }

    // ---------------------------------------------------------------
    // Administrative surface
    // ---------------------------------------------------------------

    /**
     * Add or overwrite a monitored value.
     *
     * @param value    channel key
     * @param interval allowed silence in seconds
     * @param path     source path of the value
     */
    public void setCheckValue(String value, long interval, String path) {
        registry.setCheckValue(value, interval, path);
        LOG.debug("Detector '{}' set check value '{}' with interval {}", name, value, interval);
    }

    /**
     * Stop monitoring a value.
     *
     * @param value channel key
     * @throws IllegalArgumentException if the value is not monitored
     */
    public void removeCheckValue(String value) {
        registry.removeCheckValue(value);
        LOG.debug("Detector '{}' removed check value '{}'", name, value);
    }

    /**
     * Apply an administrator's decision about a reported value.
     *
     * @param eventType       event type of the reported event
     * @param value           the reported channel key
     * @param path            the reported path
     * @param allowlistingData integer directive: {@code -1} resets the value to
     *                        the default interval, {@code >= 0} sets a custom
     *                        interval, any other negative number removes the
     *                        value
     * @return confirmation, or a failure describing why nothing changed
     */
    public AllowlistResult allowlistEvent(String eventType, String value, String path, Object allowlistingData) {
        if (!getEventType().equals(eventType)) {
            LOG.error("Detector '{}' rejected allowlisting: event type {} not from this source", name, eventType);
            return AllowlistResult.failure("Event not from this source");
        }
        if (value == null || path == null) {
            return AllowlistResult.failure("Allowlisting requires the value and its path");
        }
        if (!(allowlistingData instanceof Integer || allowlistingData instanceof Long
                || allowlistingData instanceof Short || allowlistingData instanceof Byte)) {
            LOG.error("Detector '{}' rejected allowlisting data {}", name, allowlistingData);
            return AllowlistResult.failure(ALLOWLIST_USAGE);
        }

        long newInterval = ((Number) allowlistingData).longValue();
        if (newInterval == -1) {
            newInterval = defaultInterval;
        }
        if (newInterval < 0) {
            try {
                removeCheckValue(value);
            } catch (IllegalArgumentException e) {
                LOG.error("Detector '{}' could not remove '{}': {}", name, value, e.getMessage());
                return AllowlistResult.failure(e.getMessage());
            }
            return AllowlistResult.success(String.format("Removed '%s' in '%s' from monitoring.", value, path));
        }
        setCheckValue(value, newInterval, path);
        return AllowlistResult.success(
                String.format("Updated '%s' in '%s' to new interval %d.", value, path, newInterval));
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    @Override
    public long doTimer(Instant triggerTime) {
        double now = RecordTime.toEpochSeconds(triggerTime);
        if (nextPersistTime == null) {
            nextPersistTime = now + persistencePeriod;
            return persistencePeriod;
        }
        double delta = nextPersistTime - now;
        if (delta <= 0) {
            doPersist();
            nextPersistTime = now + persistencePeriod;
            return persistencePeriod;
        }
        return (long) Math.ceil(delta);
    }

    @Override
    public void doPersist() {
        persistence.save(registry);
        LOG.debug("Detector '{}' persisted {} value(s) to {}", name, registry.size(),
                persistence.getDocumentName());
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    @Override
    public void logStatistics() {
        if (statLevel == 1) {
            LOG.info("'{}' processed {} out of {} log records successfully and learned {} new value(s)",
                    name, recordsHandled, recordsTotal, learnedValues.size());
        } else if (statLevel == 2) {
            LOG.info("'{}' processed {} out of {} log records successfully and learned {} new value(s): {}",
                    name, recordsHandled, recordsTotal, learnedValues.size(), learnedValues);
        }
        recordsTotal = 0;
        recordsHandled = 0;
        learnedValues.clear();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @Override
    public String getName() {
        return name;
    }

    public boolean isLearning() {
        return learning.isLearning();
    }

    public List<String> getTargetPaths() {
        return extractor.getTargetPaths();
    }

    /**
     * @param value channel key
     * @return tracking state of the value, if monitored
     */
    public Optional<TrackingEntry> getTrackingEntry(String value) {
        return registry.get(value);
    }

    /** @return read-only access to the tracked values */
    public ExpectedValueRegistry getRegistry() {
        return registry;
    }

    long getRecordsTotal() {
        return recordsTotal;
    }

    long getRecordsHandled() {
        return recordsHandled;
    }
}
