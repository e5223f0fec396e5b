package com.logsentinel.core.detection.missing;

import java.util.Objects;

/**
 * One channel seen in a record: the channel key and the path it came from.
 */
public final class ChannelObservation {

    private final String path;
    private final String key;

    public ChannelObservation(String path, String key) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    /** @return the source path, or the composite path encoding in combined mode */
    public String getPath() {
        return path;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelObservation that))
            return false;
        return path.equals(that.path) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, key);
    }

    @Override
    public String toString() {
        return path + "=" + key;
    }
}
