package com.logsentinel.core.detection.missing;

import java.util.Objects;

/**
 * A channel found overdue by a registry scan.
 */
public final class OverdueChannel {

    private final String path;
    private final String key;
    private final long overdueSeconds;
    private final long interval;

    public OverdueChannel(String path, String key, long overdueSeconds, long interval) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.overdueSeconds = overdueSeconds;
        this.interval = interval;
    }

    public String getPath() {
        return path;
    }

    public String getKey() {
        return key;
    }

    public long getOverdueSeconds() {
        return overdueSeconds;
    }

    public long getInterval() {
        return interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OverdueChannel that))
            return false;
        return overdueSeconds == that.overdueSeconds
                && interval == that.interval
                && path.equals(that.path)
                && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, key, overdueSeconds, interval);
    }

    @Override
    public String toString() {
        return path + ": " + key + " overdue " + overdueSeconds + "s (interval " + interval + ")";
    }
}
