package com.logsentinel.core.detection.missing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracking state of all channels of one detector, together with the scan
 * watermark.
 *
 * <h3>Watermark</h3>
 * <p>
 * {@code nextCheckTimestamp} is the earliest record time at which any entry
 * can need attention: the due time of a {@code NORMAL} entry or the end of
 * suppression of a {@code SUPPRESSED} one. Records below the watermark only
 * touch the entries they mention; the first record at or past it triggers a
 * full scan, which reports overdue entries and recomputes the watermark.
 * Every public mutator leaves the watermark consistent with the entries.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. One registry belongs to one detector and is driven by the
 * dispatch thread only.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExpectedValueRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ExpectedValueRegistry.class);

    private final Map<String, TrackingEntry> entries = new LinkedHashMap<>();
    private final long realertInterval;

    private double lastSeenTimestampMax;
    private double nextCheckTimestamp;
    private boolean gapPending;

    /**
     * @param realertInterval seconds an alerted entry stays suppressed
     */
    public ExpectedValueRegistry(long realertInterval) {
        if (realertInterval <= 0) {
            throw new IllegalArgumentException("realertInterval must be > 0, got: " + realertInterval);
        }
        this.realertInterval = realertInterval;
    }

    // ---------------------------------------------------------------
    // Record processing
    // ---------------------------------------------------------------

    /**
     * Apply one record: refresh the observed channels, register unknown ones
     * when {@code learn} is set, then scan if the record crosses the
     * watermark.
     *
     * @param observations    channels observed in the record
     * @param time            record time in epoch seconds
     * @param learn           whether unknown channels are registered
     * @param defaultInterval interval given to newly registered channels
     * @return learned keys and overdue channels
     */
    public RegistryUpdate process(List<ChannelObservation> observations, double time,
            boolean learn, long defaultInterval) {
        List<String> learned = new ArrayList<>();
        for (ChannelObservation observation : observations) {
            TrackingEntry entry = entries.get(observation.getKey());
            if (entry != null) {
                entry.observe(time);
                gapPending |= entry.isGapPending();
            } else if (learn) {
                entries.put(observation.getKey(),
                        TrackingEntry.normal(time, defaultInterval, observation.getPath()));
                nextCheckTimestamp = Math.min(nextCheckTimestamp, time + defaultInterval);
                learned.add(observation.getKey());
            }
        }

        lastSeenTimestampMax = Math.max(lastSeenTimestampMax, time);
        if (lastSeenTimestampMax < nextCheckTimestamp && !gapPending) {
            return new RegistryUpdate(learned, List.of());
        }
        return new RegistryUpdate(learned, scan());
    }

    private List<OverdueChannel> scan() {
        double now = lastSeenTimestampMax;
        double candidate = Double.POSITIVE_INFINITY;
        List<OverdueChannel> overdue = new ArrayList<>();

        for (Map.Entry<String, TrackingEntry> e : entries.entrySet()) {
            TrackingEntry entry = e.getValue();
            if (entry.isSuppressed()) {
                if (now < entry.getSuppressUntil()) {
                    candidate = Math.min(candidate, entry.getSuppressUntil());
                    entry.clearGap();
                    continue;
                }
                entry.clearSuppression();
            }

            double overdueTime = now - entry.getLastSeen() - entry.getInterval();
            if (overdueTime >= 0) {
                overdue.add(new OverdueChannel(entry.getSourcePath(), e.getKey(), (long) overdueTime,
                        entry.getInterval()));
            } else if (entry.isGapPending()) {
                overdue.add(new OverdueChannel(entry.getSourcePath(), e.getKey(), (long) entry.getGapOverdue(),
                        entry.getInterval()));
            } else {
                candidate = Math.min(candidate, entry.getDueTime());
                continue;
            }
            double until = now + realertInterval;
            entry.suppress(until);
            candidate = Math.min(candidate, until);
        }

        gapPending = false;
        nextCheckTimestamp = candidate == Double.POSITIVE_INFINITY ? now + realertInterval : candidate;
        if (!overdue.isEmpty()) {
            LOG.debug("Scan at {} found {} overdue channel(s), next check at {}", now, overdue.size(),
                    nextCheckTimestamp);
        }
        return overdue;
    }

    // ---------------------------------------------------------------
    // Administrative updates
    // ---------------------------------------------------------------

    /**
     * Insert or overwrite the entry for {@code key}. The entry counts as seen
     * at the newest record time so far, and the next record triggers a scan.
     *
     * @param key      channel key
     * @param interval allowed silence in seconds
     * @param path     source path reported for the channel
     */
    public void setCheckValue(String key, long interval, String path) {
        Objects.requireNonNull(key, "key must not be null");
        entries.put(key, TrackingEntry.normal(lastSeenTimestampMax, interval, path));
        nextCheckTimestamp = 0;
    }

    /**
     * Stop tracking {@code key}.
     *
     * @param key channel key
     * @throws IllegalArgumentException if the key is not tracked
     */
    public void removeCheckValue(String key) {
        if (entries.remove(key) == null) {
            throw new IllegalArgumentException("Value '" + key + "' is not tracked");
        }
    }

    /**
     * Put back an entry read from persistence. The next record triggers a
     * scan.
     */
    public void restore(String key, TrackingEntry entry) {
        entries.put(Objects.requireNonNull(key, "key must not be null"),
                Objects.requireNonNull(entry, "entry must not be null"));
        nextCheckTimestamp = 0;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Optional<TrackingEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return unmodifiable view of all entries in insertion order
     */
    public Map<String, TrackingEntry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public double getLastSeenTimestampMax() {
        return lastSeenTimestampMax;
    }

    public double getNextCheckTimestamp() {
        return nextCheckTimestamp;
    }

    public long getRealertInterval() {
        return realertInterval;
    }
}
