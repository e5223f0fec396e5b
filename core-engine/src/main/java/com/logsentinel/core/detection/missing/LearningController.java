package com.logsentinel.core.detection.missing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether unseen channels are registered.
 *
 * <p>
 * Learning can end in two ways, configured exclusively:
 * </p>
 * <ul>
 * <li>a fixed cutoff, {@code stopLearningTime} seconds after start-up</li>
 * <li>an inactivity cutoff that moves to {@code recordTime +
 * stopLearningNoAnomalyTime} every time a new channel is learned</li>
 * </ul>
 * <p>
 * Once a record's time passes the cutoff, learning stays off for the rest of
 * the session.
 * </p>
 */
public final class LearningController {

    private static final Logger LOG = LoggerFactory.getLogger(LearningController.class);

    private final String detectorName;
    private final Long stopLearningNoAnomalyTime;
    private boolean learnMode;
    private Double stopLearningTimestamp;

    /**
     * @param detectorName              name used in log messages
     * @param learnMode                 initial learning state
     * @param stopLearningTime          seconds after {@code startTime} at which
     *                                  learning ends, or {@code null}
     * @param stopLearningNoAnomalyTime inactivity window in seconds, or
     *                                  {@code null}
     * @param startTime                 start-up time in epoch seconds
     */
    public LearningController(String detectorName, boolean learnMode, Long stopLearningTime,
            Long stopLearningNoAnomalyTime, double startTime) {
        if (stopLearningTime != null && stopLearningNoAnomalyTime != null) {
            throw new IllegalArgumentException(
                    "stopLearningTime and stopLearningNoAnomalyTime are mutually exclusive");
        }
        this.detectorName = detectorName;
        this.learnMode = learnMode;
        this.stopLearningNoAnomalyTime = stopLearningNoAnomalyTime;
        if (learnMode && stopLearningTime != null) {
            this.stopLearningTimestamp = startTime + stopLearningTime;
        } else if (learnMode && stopLearningNoAnomalyTime != null) {
            this.stopLearningTimestamp = startTime + stopLearningNoAnomalyTime;
        }
    }

    /**
     * Switch learning off if {@code recordTime} lies past the cutoff.
     *
     * @param recordTime record time in epoch seconds
     */
    public void checkCutoff(double recordTime) {
        if (learnMode && stopLearningTimestamp != null && stopLearningTimestamp < recordTime) {
            LOG.info("Stopping learning in detector '{}' at record time {}", detectorName, recordTime);
            learnMode = false;
        }
    }

    /**
     * Re-arm the inactivity cutoff after a channel was learned.
     *
     * @param recordTime record time of the learning record
     */
    public void onValueLearned(double recordTime) {
        if (stopLearningTimestamp != null && stopLearningNoAnomalyTime != null) {
            stopLearningTimestamp = recordTime + stopLearningNoAnomalyTime;
        }
    }

    public boolean isLearning() {
        return learnMode;
    }

    /**
     * @return the current cutoff in epoch seconds, or {@code null} if learning
     *         has no cutoff
     */
    public Double getStopLearningTimestamp() {
        return stopLearningTimestamp;
    }
}
