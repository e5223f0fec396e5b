package com.logsentinel.core.detection.missing;

import java.time.Instant;

/**
 * Conversion of {@link Instant}s to the epoch-second doubles used for record
 * time arithmetic.
 */
final class RecordTime {

    private RecordTime() {
    }

    static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }
}
