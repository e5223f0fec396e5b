package com.logsentinel.core.config;

import com.logsentinel.core.model.DetectorDefinition;

import java.io.Serializable;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the Log Sentinel YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * encoding: UTF-8
 * persistenceDir: /var/lib/log-sentinel
 * persistencePeriod: 600
 * statLevel: 1
 * detectors:
 *   - name: missing_hosts
 *     type: missing_value
 *     targetPaths: [/model/host]
 *     learnMode: true
 *     defaultInterval: 3600
 *     realertInterval: 86400
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the settings and every
 * detector definition.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Charset used to decode byte-valued matches. */
    private String encoding = "UTF-8";

    /** Directory holding one persistence document per detector. */
    private String persistenceDir = "/var/lib/log-sentinel";

    /** Seconds between two persistence writes. */
    private long persistencePeriod = 600;

    /** 0 = no statistics, 1 = counts, 2 = counts and learned values. */
    private int statLevel = 1;

    private List<DetectorDefinition> detectors = new ArrayList<>();

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    /**
     * @return the configured charset
     * @throws IllegalStateException if the encoding name is not supported
     */
    public Charset charset() {
        try {
            return Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalStateException("Unsupported encoding: " + encoding, e);
        }
    }

    public String getPersistenceDir() {
        return persistenceDir;
    }

    public void setPersistenceDir(String persistenceDir) {
        this.persistenceDir = persistenceDir;
    }

    public long getPersistencePeriod() {
        return persistencePeriod;
    }

    public void setPersistencePeriod(long persistencePeriod) {
        this.persistencePeriod = persistencePeriod;
    }

    public int getStatLevel() {
        return statLevel;
    }

    public void setStatLevel(int statLevel) {
        this.statLevel = statLevel;
    }

    /**
     * Return the detector list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of detector definitions
     */
    public List<DetectorDefinition> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    /**
     * Set the detector list (used by SnakeYAML during deserialization).
     *
     * @param detectors the detector definitions
     */
    public void setDetectors(List<DetectorDefinition> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    /**
     * Validate the global settings and every detector definition.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!isSupportedEncoding(encoding)) {
            errors.add("Unsupported 'encoding': " + encoding);
        }
        if (persistenceDir == null || persistenceDir.isBlank()) {
            errors.add("'persistenceDir' is required");
        }
        if (persistencePeriod <= 0) {
            errors.add("'persistencePeriod' must be > 0, got: " + persistencePeriod);
        }
        if (statLevel < 0 || statLevel > 2) {
            errors.add("'statLevel' must be in [0, 2], got: " + statLevel);
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < detectors.size(); i++) {
            DetectorDefinition definition = Objects.requireNonNull(detectors.get(i),
                    "Detector at index " + i + " is null");
            try {
                definition.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (definition.getName() != null && !names.add(definition.getName())) {
                errors.add("Duplicate detector name: '" + definition.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static boolean isSupportedEncoding(String name) {
        try {
            return name != null && Charset.isSupported(name);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "encoding='" + encoding + '\'' +
                ", persistenceDir='" + persistenceDir + '\'' +
                ", persistencePeriod=" + persistencePeriod +
                ", statLevel=" + statLevel +
                ", detectors=" + detectors +
                '}';
    }
}
