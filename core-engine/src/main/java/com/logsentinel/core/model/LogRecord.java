package com.logsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single parsed log record.
 *
 * <p>
 * The parsing layer hands records over as a mapping from parser path to the
 * values matched under that path. A path may carry several matches, so every
 * path maps to a list. Values are usually {@link String}s but may be raw
 * {@code byte[]} sequences that still need decoding.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A record is built once by
 * the source and then only read by detectors on the dispatch thread.
 * </p>
 *
 * @since 1.0.0
 */
public class LogRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Parser path to matched values, in parser order. */
    private final Map<String, List<Object>> matches = new LinkedHashMap<>();

    /** Record timestamp taken from the log data; may be absent. */
    private Instant timestamp;

    /** Original text of the log line, used for reporting only. */
    private String logLine;

    // ---------------------------------------------------------------
    // Matches
    // ---------------------------------------------------------------

    /**
     * Append a matched value under the given path.
     *
     * @param path  the parser path; must not be {@code null}
     * @param value the matched value ({@link String}, {@code byte[]}, ...);
     *              must not be {@code null}
     * @throws NullPointerException if {@code path} or {@code value} is
     *                              {@code null}
     */
    public void addMatch(String path, Object value) {
        Objects.requireNonNull(path, "Match path must not be null");
        Objects.requireNonNull(value, "Match value must not be null for path " + path);
        matches.computeIfAbsent(path, p -> new ArrayList<>()).add(value);
    }

    /**
     * Return the values matched under a path.
     *
     * @param path the parser path
     * @return optional list of values, empty if the path did not match
     */
    public Optional<List<Object>> getMatches(String path) {
        List<Object> values = matches.get(path);
        return values == null ? Optional.empty() : Optional.of(Collections.unmodifiableList(values));
    }

    /**
     * @param path the parser path
     * @return {@code true} if the record carries at least one match for the path
     */
    public boolean hasPath(String path) {
        return matches.containsKey(path);
    }

    /**
     * Return an <strong>unmodifiable</strong> view of all matched paths in
     * parser order.
     *
     * @return unmodifiable list of paths
     */
    public List<String> getPaths() {
        return List.copyOf(matches.keySet());
    }

    // ---------------------------------------------------------------
    // Timestamp / log line
    // ---------------------------------------------------------------

    /**
     * @return the record timestamp, or {@code null} if the log data carried none
     */
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
        if (!(o instanceof LogRecord that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(logLine, that.logLine)
                && Objects.equals(matches.keySet(), that.matches.keySet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, logLine, matches.keySet());
    }

    @Override
    public String toString() {
        return "LogRecord{timestamp=" + timestamp + ", paths=" + matches.keySet() + '}';
    }
}
