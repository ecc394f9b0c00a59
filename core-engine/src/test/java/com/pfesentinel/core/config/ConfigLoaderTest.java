package com.pfesentinel.core.config;

import com.pfesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaultResource() {
        DetectionConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        SeverityMap severities = config.severityMap();
        assertThat(severities.severityOf("sw_error")).isEqualTo(Severity.CRITICAL);
        assertThat(severities.severityOf("fabric_drop")).isEqualTo(Severity.HIGH);
        assertThat(severities.severityOf("never_seen_before")).isEqualTo(Severity.LOW);
        assertThat(config.getThresholds().getSpikeSigma()).isEqualTo(3.0);
        assertThat(config.getThresholds().getMlContamination()).isEqualTo(0.15);
        assertThat(config.getBaseline().getEwmaAlpha()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Should apply overrides and keep defaults for omitted values")
    void shouldLoadOverrides() {
        DetectionConfig config = ConfigLoader.fromClasspath("test-detection.yml");

        SeverityMap severities = config.severityMap();
        assertThat(severities.getDefaultSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(severities.severityOf("FABRIC_DROP")).isEqualTo(Severity.HIGH);
        assertThat(severities.severityOf("unmapped")).isEqualTo(Severity.MEDIUM);
        assertThat(config.getThresholds().getSpikeSigma()).isEqualTo(4.0);
        assertThat(config.getThresholds().getMlTrees()).isEqualTo(50);
        assertThat(config.getThresholds().getSpikeMinRatio()).isEqualTo(2.0);
        assertThat(config.getBaseline().getEwmaAlpha()).isEqualTo(0.5);
        assertThat(config.getDashboard().getOrgId()).isEqualTo(7);
        assertThat(config.getDashboard().getDashboardUid()).isEqualTo("pfe-exceptions");
    }

    @Test
    @DisplayName("Should report every invalid value in one exception")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-detection.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Detection configuration validation failed")
                .hasMessageContaining("defaultSeverity")
                .hasMessageContaining("severities.sw_error")
                .hasMessageContaining("thresholds.spikeSigma")
                .hasMessageContaining("thresholds.mlContamination")
                .hasMessageContaining("baseline.ewmaAlpha");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("duplicate-keys.yml"))
                .hasMessageContaining("sw_error");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        DetectionConfig config = ConfigLoader.fromClasspath("empty-detection.yml");

        assertThat(config.getSeverities()).isEmpty();
        assertThat(config.severityMap().getDefaultSeverity()).isEqualTo(Severity.LOW);
        assertThat(config.getThresholds().getEmergenceThreshold()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("detection.yml");
        Files.writeString(file, "severities:\n  ttl_expired: HIGH\n");

        DetectionConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.severityMap().severityOf("ttl_expired")).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }
}
