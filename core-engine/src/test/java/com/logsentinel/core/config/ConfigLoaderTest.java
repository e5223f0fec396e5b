package com.logsentinel.core.config;

import com.logsentinel.core.model.DetectorDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-config.yml");

        assertThat(config.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(config.getPersistenceDir()).isEqualTo("/tmp/log-sentinel-test");
        assertThat(config.getPersistencePeriod()).isEqualTo(60);
        assertThat(config.getStatLevel()).isEqualTo(2);
        assertThat(config.getDetectors()).hasSize(2);

        DetectorDefinition hosts = config.getDetectors().get(0);
        assertThat(hosts.getName()).isEqualTo("test_hosts");
        assertThat(hosts.getTargetPaths()).containsExactly("/model/host", "/model/service");
        assertThat(hosts.isLearnMode()).isTrue();
        assertThat(hosts.getDefaultInterval()).isEqualTo(300);
        assertThat(hosts.getRealertInterval()).isEqualTo(900);
        assertThat(hosts.getStopLearningTime()).isEqualTo(3600L);
        assertThat(hosts.getStopLearningNoAnomalyTime()).isNull();
    }

    @Test
    @DisplayName("Should apply defaults and normalise the type to lowercase")
    void shouldApplyDefaults() {
        DetectorDefinition list = ConfigLoader.fromClasspath("test-config.yml").getDetectors().get(1);

        assertThat(list.getType()).isEqualTo(DetectorDefinition.TYPE_MISSING_VALUE_LIST);
        assertThat(list.isLearnMode()).isFalse();
        assertThat(list.getDefaultInterval()).isEqualTo(3600);
        assertThat(list.getRealertInterval()).isEqualTo(86400);
        assertThat(list.isCombineValues()).isTrue();
        assertThat(list.isOutputLogLine()).isFalse();
        assertThat(list.getPersistenceId()).isEqualTo("Default");
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaultResource() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getDetectors()).extracting(DetectorDefinition::getName)
                .containsExactly("silent_hosts", "silent_services");
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-config.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("persistencePeriod")
                .hasMessageContaining("statLevel")
                .hasMessageContaining("targetPaths")
                .hasMessageContaining("defaultInterval")
                .hasMessageContaining("mutually exclusive")
                .hasMessageContaining("Unknown detector type: 'rate'")
                .hasMessageContaining("Duplicate detector name: 'broken'");
    }

    @Test
    @DisplayName("Should wrap YAML syntax errors")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("malformed-config.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed configuration");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load configuration from a file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sentinel.yml");
        Files.write(file, List.of(
                "persistenceDir: " + dir,
                "detectors:",
                "  - name: from_file",
                "    type: missing_value",
                "    targetPaths: [/x]"));

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getEncoding()).isEqualTo("UTF-8");
        assertThat(config.getDetectors()).singleElement()
                .extracting(DetectorDefinition::getName).isEqualTo("from_file");
    }

    @Test
    @DisplayName("Should use defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = Files.createFile(dir.resolve("empty.yml"));

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getDetectors()).isEmpty();
        assertThat(config.getPersistencePeriod()).isEqualTo(600);
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject an unsupported encoding")
    void shouldRejectUnsupportedEncoding() {
        SentinelConfig config = new SentinelConfig();
        config.setEncoding("no-such-charset");

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unsupported 'encoding'");
    }
}
