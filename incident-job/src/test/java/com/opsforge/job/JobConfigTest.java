package com.opsforge.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults when no variables are set")
    void shouldApplyDefaults() {
        JobConfig config = JobConfig.fromEnvironment(Map.of());

        assertThat(config.getInputPath()).isEmpty();
        assertThat(config.getOutputPath()).isEmpty();
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getIncidentTimeoutSeconds()).isEqualTo(30);
        assertThat(config.getAnalyticsConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should read every variable")
    void shouldReadVariables() {
        JobConfig config = JobConfig.fromEnvironment(Map.of(
                JobConfig.ENV_INPUT_PATH, "/data/in.json",
                JobConfig.ENV_OUTPUT_PATH, "/data/out.json",
                JobConfig.ENV_PARALLELISM, "8",
                JobConfig.ENV_INCIDENT_TIMEOUT_SECONDS, " 5 ",
                JobConfig.ENV_CONFIG_PATH, "/etc/opsforge.yml"));

        assertThat(config.getInputPath()).isEqualTo("/data/in.json");
        assertThat(config.getOutputPath()).isEqualTo("/data/out.json");
        assertThat(config.getParallelism()).isEqualTo(8);
        assertThat(config.getIncidentTimeoutSeconds()).isEqualTo(5);
        assertThat(config.getAnalyticsConfigPath()).isEqualTo("/etc/opsforge.yml");
    }

    @Test
    @DisplayName("Should wrap unparseable numbers")
    void shouldRejectBadNumber() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of(JobConfig.ENV_PARALLELISM, "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("many");
    }

    @Test
    @DisplayName("Builder should validate ranges")
    void builderShouldValidate() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().incidentTimeoutSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("incidentTimeoutSeconds");
    }
}
