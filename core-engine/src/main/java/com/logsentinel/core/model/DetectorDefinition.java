package com.logsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single detector instance loaded from configuration.
 *
 * <p>
 * Supported detector types:
 * </p>
 * <ul>
 * <li>{@code missing_value}: tracks every value (or value combination) of the
 * target paths and reports values that stop appearing</li>
 * <li>{@code missing_value_list}: like {@code missing_value}, but the channel
 * is taken from the first target path present in a record</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String TYPE_MISSING_VALUE = "missing_value";
    public static final String TYPE_MISSING_VALUE_LIST = "missing_value_list";

    /** Unique detector name used in events and logs. */
    private String name;

    /** Detector type: "missing_value" or "missing_value_list". */
    private String type;

    /** Parser paths whose values identify a channel. */
    private List<String> targetPaths = new ArrayList<>();

    /** Whether unseen channels are registered. */
    private boolean learnMode;

    /** Seconds of record time a channel may stay silent. */
    private long defaultInterval = 3600;

    /** Seconds of record time before an overdue channel is reported again. */
    private long realertInterval = 86400;

    /** Treat all target-path values of a record as one composite channel. */
    private boolean combineValues = true;

    /** Attach the original log line to emitted events. */
    private boolean outputLogLine = true;

    /** Name of the persistence document of this detector. */
    private String persistenceId = "Default";

    /** Seconds after start-up at which learning switches off. */
    private Long stopLearningTime;

    /** Seconds without a newly learned channel after which learning switches off. */
    private Long stopLearningNoAnomalyTime;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Detector 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Detector 'type' is required");
        } else if (!TYPE_MISSING_VALUE.equals(type) && !TYPE_MISSING_VALUE_LIST.equals(type)) {
            errors.add("Unknown detector type: '" + type + "'. Supported: "
                    + TYPE_MISSING_VALUE + ", " + TYPE_MISSING_VALUE_LIST);
        }
        if (targetPaths == null || targetPaths.isEmpty()) {
            errors.add("Detector '" + name + "' requires at least one entry in 'targetPaths'");
        } else if (targetPaths.stream().anyMatch(p -> p == null || p.isBlank())) {
            errors.add("Detector '" + name + "' contains a blank target path");
        }
        if (defaultInterval <= 0) {
            errors.add("Detector '" + name + "' requires 'defaultInterval' > 0");
        }
        if (realertInterval <= 0) {
            errors.add("Detector '" + name + "' requires 'realertInterval' > 0");
        }
        if (persistenceId == null || persistenceId.isBlank()) {
            errors.add("Detector '" + name + "' requires 'persistenceId'");
        }
        if (stopLearningTime != null && stopLearningNoAnomalyTime != null) {
            errors.add("Detector '" + name + "': 'stopLearningTime' and "
                    + "'stopLearningNoAnomalyTime' are mutually exclusive");
        }
        if (stopLearningTime != null && stopLearningTime < 0) {
            errors.add("Detector '" + name + "' requires 'stopLearningTime' >= 0");
        }
        if (stopLearningNoAnomalyTime != null && stopLearningNoAnomalyTime < 0) {
            errors.add("Detector '" + name + "' requires 'stopLearningNoAnomalyTime' >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     *
     * @param type detector type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public List<String> getTargetPaths() {
        return targetPaths;
    }

    public void setTargetPaths(List<String> targetPaths) {
        this.targetPaths = targetPaths != null ? new ArrayList<>(targetPaths) : new ArrayList<>();
    }

    public boolean isLearnMode() {
        return learnMode;
    }

    public void setLearnMode(boolean learnMode) {
        this.learnMode = learnMode;
    }

    public long getDefaultInterval() {
        return defaultInterval;
    }

    public void setDefaultInterval(long defaultInterval) {
        this.defaultInterval = defaultInterval;
    }

    public long getRealertInterval() {
        return realertInterval;
    }

    public void setRealertInterval(long realertInterval) {
        this.realertInterval = realertInterval;
    }

    public boolean isCombineValues() {
        return combineValues;
    }

    public void setCombineValues(boolean combineValues) {
        this.combineValues = combineValues;
    }

    public boolean isOutputLogLine() {
        return outputLogLine;
    }

    public void setOutputLogLine(boolean outputLogLine) {
        this.outputLogLine = outputLogLine;
    }

    public String getPersistenceId() {
        return persistenceId;
    }

    public void setPersistenceId(String persistenceId) {
        this.persistenceId = persistenceId;
    }

    public Long getStopLearningTime() {
        return stopLearningTime;
    }

    public void setStopLearningTime(Long stopLearningTime) {
        this.stopLearningTime = stopLearningTime;
    }

    public Long getStopLearningNoAnomalyTime() {
        return stopLearningNoAnomalyTime;
    }

    public void setStopLearningNoAnomalyTime(Long stopLearningNoAnomalyTime) {
        this.stopLearningNoAnomalyTime = stopLearningNoAnomalyTime;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "DetectorDefinition{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", targetPaths=" + targetPaths +
                ", learnMode=" + learnMode +
                ", defaultInterval=" + defaultInterval +
                ", realertInterval=" + realertInterval +
                ", combineValues=" + combineValues +
                ", persistenceId='" + persistenceId + '\'' +
                '}';
    }
}
