package com.logsentinel.core.detection.missing;

import java.util.Objects;

/**
 * Tracking state of one channel.
 *
 * <p>
 * An entry is either {@link State#NORMAL} or {@link State#SUPPRESSED}; in
 * the latter state it carries the record time before which it must not be
 * reported again. Times are epoch seconds of record time.
 * </p>
 *
 * <p>
 * {@code lastSeen} never decreases. When an observation arrives more than
 * {@code interval} seconds after the previous one, the entry remembers the
 * gap until the next scan has reported it.
 * </p>
 */
public final class TrackingEntry {

    /** Alerting state of an entry. */
    public enum State {
        /** Not alerted, reported as soon as it becomes overdue. */
        NORMAL,
        /** Alerted, re-alerts suppressed until {@link #getSuppressUntil()}. */
        SUPPRESSED
    }

    private final String sourcePath;
    private final long interval;
    private double lastSeen;
    private State state;
    private double suppressUntil;

    private boolean gapPending;
    private double gapStart;

    private TrackingEntry(double lastSeen, long interval, State state, double suppressUntil, String sourcePath) {
        this.lastSeen = lastSeen;
        this.interval = interval;
        this.state = state;
        this.suppressUntil = suppressUntil;
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath must not be null");
    }

    /**
     * @return a fresh, non-suppressed entry
     */
    public static TrackingEntry normal(double lastSeen, long interval, String sourcePath) {
        return new TrackingEntry(lastSeen, interval, State.NORMAL, 0, sourcePath);
    }

    /**
     * Rebuild an entry from its persisted form, where a suppression deadline
     * of {@code 0} stands for {@link State#NORMAL}.
     */
    public static TrackingEntry restore(double lastSeen, long interval, double suppressUntil, String sourcePath) {
        return suppressUntil == 0
                ? normal(lastSeen, interval, sourcePath)
                : new TrackingEntry(lastSeen, interval, State.SUPPRESSED, suppressUntil, sourcePath);
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Record an observation of this channel at record time {@code time}.
     * Older timestamps leave {@code lastSeen} unchanged.
     */
    void observe(double time) {
        if (state == State.SUPPRESSED && time >= suppressUntil) {
            clearSuppression();
        }
        if (time <= lastSeen) {
            return;
        }
        if (state == State.NORMAL && time - lastSeen > interval && !gapPending) {
            gapPending = true;
            gapStart = lastSeen;
        }
        lastSeen = time;
    }

    void suppress(double until) {
        state = State.SUPPRESSED;
        suppressUntil = until;
        clearGap();
    }

    void clearSuppression() {
        state = State.NORMAL;
        suppressUntil = 0;
    }

    void clearGap() {
        gapPending = false;
        gapStart = 0;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public double getLastSeen() {
        return lastSeen;
    }

    public long getInterval() {
        return interval;
    }

    public State getState() {
        return state;
    }

    public boolean isSuppressed() {
        return state == State.SUPPRESSED;
    }

    /**
     * @return suppression deadline, {@code 0} in {@link State#NORMAL}
     */
    public double getSuppressUntil() {
        return suppressUntil;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    /** @return the record time at which the channel becomes overdue */
    public double getDueTime() {
        return lastSeen + interval;
    }

    boolean isGapPending() {
        return gapPending;
    }

    /** @return seconds by which the last jump in {@code lastSeen} exceeded the interval */
    double getGapOverdue() {
        return lastSeen - gapStart - interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrackingEntry that))
            return false;
        return Double.compare(lastSeen, that.lastSeen) == 0
                && interval == that.interval
                && state == that.state
                && Double.compare(suppressUntil, that.suppressUntil) == 0
                && sourcePath.equals(that.sourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastSeen, interval, state, suppressUntil, sourcePath);
    }

    @Override
    public String toString() {
        return "TrackingEntry{" +
                "lastSeen=" + lastSeen +
                ", interval=" + interval +
                ", state=" + state +
                ", suppressUntil=" + suppressUntil +
                ", sourcePath='" + sourcePath + '\'' +
                '}';
    }
}
