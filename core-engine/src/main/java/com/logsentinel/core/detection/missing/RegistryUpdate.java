package com.logsentinel.core.detection.missing;

import java.util.List;

/**
 * What one record changed in the {@link ExpectedValueRegistry}.
 */
public final class RegistryUpdate {

    private final List<String> learnedKeys;
    private final List<OverdueChannel> overdueChannels;

    RegistryUpdate(List<String> learnedKeys, List<OverdueChannel> overdueChannels) {
        this.learnedKeys = List.copyOf(learnedKeys);
        this.overdueChannels = List.copyOf(overdueChannels);
    }

    /** @return keys registered while processing the record */
    public List<String> getLearnedKeys() {
        return learnedKeys;
    }

    /** @return channels reported by the scan, empty if no scan was due */
    public List<OverdueChannel> getOverdueChannels() {
        return overdueChannels;
    }
}
