package com.opsforge.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyticsConfigLoader}.
 */
class AnalyticsConfigLoaderTest {

    @Test
    @DisplayName("Should load the bundled defaults from the classpath")
    void shouldLoadBundledDefaults() {
        AnalyticsConfig config = AnalyticsConfigLoader.fromClasspath(AnalyticsConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getCorrelation().getEdgeThreshold()).isEqualTo(0.5);
        assertThat(config.getForecast().getHorizon()).isEqualTo(12);
        assertThat(config.getLearning().getCoordinatorAgent()).isEqualTo("Orchestrator");
        assertThat(config.getLearning().getMaxObservationsPerSignature()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should overlay a partial file on the defaults")
    void shouldLoadPartialConfig() {
        AnalyticsConfig config = AnalyticsConfigLoader.fromClasspath("test-opsforge.yml");

        assertThat(config.getCorrelation().getEdgeThreshold()).isEqualTo(0.6);
        assertThat(config.getCorrelation().getTimeWindowSeconds()).isEqualTo(120);
        assertThat(config.getCorrelation().getSameHostWeight()).isEqualTo(0.4);
        assertThat(config.getForecast().getAlpha()).isEqualTo(0.5);
        assertThat(config.getForecast().getBeta()).isEqualTo(0.2);
        assertThat(config.getLearning().getBaseThreshold()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldFailValidation() {
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromClasspath("invalid-opsforge.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("alpha")
                .hasMessageContaining("minPoints");
    }

    @Test
    @DisplayName("Should wrap malformed YAML")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromClasspath("malformed-opsforge.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file and treat an empty file as defaults")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path custom = Files.writeString(dir.resolve("custom.yml"), "learning:\n  baseThreshold: 70\n");
        Path empty = Files.writeString(dir.resolve("empty.yml"), "");

        assertThat(AnalyticsConfigLoader.fromFile(custom.toString()).getLearning().getBaseThreshold())
                .isEqualTo(70);
        assertThat(AnalyticsConfigLoader.fromFile(empty.toString()).getForecast().getAlpha())
                .isEqualTo(0.4);
        assertThatThrownBy(() -> AnalyticsConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
