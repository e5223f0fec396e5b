package com.logsentinel.core.detection;

import com.logsentinel.core.detection.missing.MissingValueDetector;
import com.logsentinel.core.detection.missing.MissingValueListDetector;
import com.logsentinel.core.model.DetectorDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from
 * {@link DetectorDefinition}s.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * register the new type string here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector for the given definition.
     *
     * @param definition the detector configuration; must not be {@code null}
     * @param context    shared collaborators; must not be {@code null}
     * @return an appropriate {@link AnomalyDetector} instance
     * @throws NullPointerException     if an argument or the type is {@code null}
     * @throws IllegalArgumentException if the detector type is unknown
     */
    public static AnomalyDetector create(DetectorDefinition definition, DetectorContext context) {
        Objects.requireNonNull(definition, "DetectorDefinition must not be null");
        Objects.requireNonNull(context, "DetectorContext must not be null");
        Objects.requireNonNull(definition.getType(), "Detector type must not be null");

        String type = definition.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case DetectorDefinition.TYPE_MISSING_VALUE -> new MissingValueDetector(definition, context);
            case DetectorDefinition.TYPE_MISSING_VALUE_LIST -> new MissingValueListDetector(definition, context);
            default -> throw new IllegalArgumentException(
                    "Unknown detector type: '" + definition.getType()
                            + "'. Supported types: " + DetectorDefinition.TYPE_MISSING_VALUE
                            + ", " + DetectorDefinition.TYPE_MISSING_VALUE_LIST);
        };
    }

    /**
     * Create detectors for every definition in the supplied list.
     *
     * @param definitions detector configurations; must not be {@code null}
     * @param context     shared collaborators
     * @return unmodifiable list of detectors (one per definition)
     */
    public static List<AnomalyDetector> createAll(List<DetectorDefinition> definitions, DetectorContext context) {
        Objects.requireNonNull(definitions, "Definitions list must not be null");
        LOG.info("Creating {} detector(s) from configuration", definitions.size());
        List<AnomalyDetector> detectors = definitions.stream()
                .map(definition -> create(definition, context))
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}
