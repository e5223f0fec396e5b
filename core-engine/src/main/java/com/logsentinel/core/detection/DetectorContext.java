package com.logsentinel.core.detection;

import com.logsentinel.core.config.SentinelConfig;
import com.logsentinel.core.event.AnomalyEventSink;
import com.logsentinel.core.persistence.PersistenceStore;

import java.nio.charset.Charset;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Shared collaborators handed to every detector at construction time.
 *
 * @since 1.0.0
 */
public final class DetectorContext {

    private final Charset charset;
    private final PersistenceStore persistenceStore;
    private final List<AnomalyEventSink> eventSinks;
    private final Clock clock;
    private final long persistencePeriod;
    private final int statLevel;

    /**
     * @param charset           charset for byte-valued matches
     * @param persistenceStore  where detectors keep their state
     * @param eventSinks        receivers of anomaly events
     * @param clock             process clock, used when a record carries no
     *                          timestamp and for timer bookkeeping
     * @param persistencePeriod seconds between two persistence writes
     * @param statLevel         0 = no statistics, 1 = counts, 2 = counts and
     *                          learned values
     */
    public DetectorContext(Charset charset, PersistenceStore persistenceStore,
            List<AnomalyEventSink> eventSinks, Clock clock, long persistencePeriod, int statLevel) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
        this.persistenceStore = Objects.requireNonNull(persistenceStore, "persistenceStore must not be null");
        this.eventSinks = List.copyOf(Objects.requireNonNull(eventSinks, "eventSinks must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (persistencePeriod <= 0) {
            throw new IllegalArgumentException("persistencePeriod must be > 0, got: " + persistencePeriod);
        }
        this.persistencePeriod = persistencePeriod;
        this.statLevel = statLevel;
    }

    /**
     * Build a context from the loaded configuration.
     *
     * @param config           validated configuration
     * @param persistenceStore store for detector state
     * @param eventSinks       receivers of anomaly events
     * @param clock            process clock
     * @return new context
     */
    public static DetectorContext fromConfig(SentinelConfig config, PersistenceStore persistenceStore,
            List<AnomalyEventSink> eventSinks, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        return new DetectorContext(config.charset(), persistenceStore, eventSinks, clock,
                config.getPersistencePeriod(), config.getStatLevel());
    }

    public Charset getCharset() {
        return charset;
    }

    public PersistenceStore getPersistenceStore() {
        return persistenceStore;
    }

    public List<AnomalyEventSink> getEventSinks() {
        return eventSinks;
    }

    public Clock getClock() {
        return clock;
    }

    public long getPersistencePeriod() {
        return persistencePeriod;
    }

    public int getStatLevel() {
        return statLevel;
    }
}
