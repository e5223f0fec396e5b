package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One overdue channel inside an {@link AnomalyEvent}.
 *
 * <p>
 * JSON property names follow the analysis-component layout consumed by
 * downstream event handlers.
 * </p>
 *
 * @since 1.0.0
 */
public final class AffectedValue implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String targetPath;
    private final String value;
    private final long overdueTime;
    private final long interval;

    @JsonCreator
    public AffectedValue(@JsonProperty("TargetPathList") String targetPath,
            @JsonProperty("Value") String value,
            @JsonProperty("OverdueTime") long overdueTime,
            @JsonProperty("Interval") long interval) {
        this.targetPath = targetPath;
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.overdueTime = overdueTime;
        this.interval = interval;
    }

    @JsonProperty("TargetPathList")
    public String getTargetPath() {
        return targetPath;
    }

    @JsonProperty("Value")
    public String getValue() {
        return value;
    }

    /** @return whole seconds past the allowed interval */
    @JsonProperty("OverdueTime")
    public long getOverdueTime() {
        return overdueTime;
    }

    @JsonProperty("Interval")
    public long getInterval() {
        return interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AffectedValue that))
            return false;
        return overdueTime == that.overdueTime
                && interval == that.interval
                && Objects.equals(targetPath, that.targetPath)
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetPath, value, overdueTime, interval);
    }

    @Override
    public String toString() {
        return "AffectedValue{" +
                "targetPath='" + targetPath + '\'' +
                ", value='" + value + '\'' +
                ", overdueTime=" + overdueTime +
                ", interval=" + interval +
                '}';
    }
}
