package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Anomaly event emitted by a detector.
 *
 * <p>
 * A missing-value scan emits one event per scan, carrying every channel that
 * was found overdue in that scan. The event is serialized to JSON by sinks
 * that publish it to external systems.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code eventType}, {@code detectorName} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Event type class, e.g. {@code Analysis.MissingValueDetector}. */
    private String eventType;

    /** Configured name of the detector that produced the event. */
    private String detectorName;

    /** Human-readable one-line summary. */
    private String headline;

    /** One formatted line per affected channel. */
    private List<String> messageLines = new ArrayList<>();

    /** Target paths present in the record that triggered the scan. */
    private List<String> affectedPaths = new ArrayList<>();

    /** Structured description of every affected channel. */
    private List<AffectedValue> affectedValues = new ArrayList<>();

    /** Record time at which the anomaly was detected. */
    private Instant timestamp;

    /** Original log line of the triggering record, if configured. */
    private String logLine;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public AnomalyEvent() {
    }

    private AnomalyEvent(Builder builder) {
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType must not be null");
        this.detectorName = Objects.requireNonNull(builder.detectorName, "detectorName must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.headline = builder.headline;
        this.messageLines = new ArrayList<>(builder.messageLines);
        this.affectedPaths = new ArrayList<>(builder.affectedPaths);
        this.affectedValues = new ArrayList<>(builder.affectedValues);
        this.logLine = builder.logLine;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyEvent} instances.
     */
    public static class Builder {
        private String eventType;
        private String detectorName;
        private String headline;
        private final List<String> messageLines = new ArrayList<>();
        private final List<String> affectedPaths = new ArrayList<>();
        private final List<AffectedValue> affectedValues = new ArrayList<>();
        private Instant timestamp;
        private String logLine;

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder detectorName(String detectorName) {
            this.detectorName = detectorName;
            return this;
        }

        public Builder headline(String headline) {
            this.headline = headline;
            return this;
        }

        public Builder messageLine(String line) {
            this.messageLines.add(line);
            return this;
        }

        public Builder affectedPaths(List<String> paths) {
            this.affectedPaths.addAll(paths);
            return this;
        }

        public Builder affectedValue(AffectedValue value) {
            this.affectedValues.add(value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder logLine(String logLine) {
            this.logLine = logLine;
            return this;
        }

        /**
         * Build the event.
         *
         * @return a new {@link AnomalyEvent}
         * @throws NullPointerException if a required field is {@code null}
         */
        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public void setDetectorName(String detectorName) {
        this.detectorName = detectorName;
    }

    public String getHeadline() {
        return headline;
    }

    public void setHeadline(String headline) {
        this.headline = headline;
    }

    public List<String> getMessageLines() {
        return Collections.unmodifiableList(messageLines);
    }

    public void setMessageLines(List<String> messageLines) {
        this.messageLines = messageLines != null ? new ArrayList<>(messageLines) : new ArrayList<>();
    }

    public List<String> getAffectedPaths() {
        return Collections.unmodifiableList(affectedPaths);
    }

    public void setAffectedPaths(List<String> affectedPaths) {
        this.affectedPaths = affectedPaths != null ? new ArrayList<>(affectedPaths) : new ArrayList<>();
    }

    public List<AffectedValue> getAffectedValues() {
        return Collections.unmodifiableList(affectedValues);
    }

    public void setAffectedValues(List<AffectedValue> affectedValues) {
        this.affectedValues = affectedValues != null ? new ArrayList<>(affectedValues) : new ArrayList<>();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getLogLine() {
        return logLine;
    }

    public void setLogLine(String logLine) {
        this.logLine = logLine;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return Objects.equals(eventType, that.eventType)
                && Objects.equals(detectorName, that.detectorName)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(affectedValues, that.affectedValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, detectorName, timestamp, affectedValues);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" +
                "eventType='" + eventType + '\'' +
                ", detectorName='" + detectorName + '\'' +
                ", timestamp=" + timestamp +
                ", headline='" + headline + '\'' +
                ", affectedValues=" + affectedValues +
                '}';
    }
}
