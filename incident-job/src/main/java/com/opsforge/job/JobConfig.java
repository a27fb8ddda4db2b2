package com.opsforge.job;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration for the incident batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a container spec or a shell without arguments.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_INPUT_PATH = "OPSFORGE_INPUT_PATH";
    public static final String ENV_OUTPUT_PATH = "OPSFORGE_OUTPUT_PATH";
    public static final String ENV_PARALLELISM = "OPSFORGE_PARALLELISM";
    public static final String ENV_CONFIG_PATH = "OPSFORGE_CONFIG_PATH";
    public static final String ENV_INCIDENT_TIMEOUT_SECONDS = "OPSFORGE_INCIDENT_TIMEOUT_SECONDS";

    // ---------------------------------------------------------------
    // I/O
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputPath;

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long incidentTimeoutSeconds;

    // ---------------------------------------------------------------
    // Analytics
    // ---------------------------------------------------------------
    private final String analyticsConfigPath;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.parallelism = b.parallelism;
        this.incidentTimeoutSeconds = b.incidentTimeoutSeconds;
        this.analyticsConfigPath = b.analyticsConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from an explicit variable map.
     */
    static JobConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment map must not be null");
        try {
            return new Builder()
                    .inputPath(env(env, ENV_INPUT_PATH, ""))
                    .outputPath(env(env, ENV_OUTPUT_PATH, ""))
                    .parallelism(Integer.parseInt(env(env, ENV_PARALLELISM, "4")))
                    .incidentTimeoutSeconds(Long.parseLong(env(env, ENV_INCIDENT_TIMEOUT_SECONDS, "30")))
                    .analyticsConfigPath(env(env, ENV_CONFIG_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return input file path; empty means standard input
     */
    public String getInputPath() {
        return inputPath;
    }

    /**
     * @return output file path; empty means standard output
     */
    public String getOutputPath() {
        return outputPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getIncidentTimeoutSeconds() {
        return incidentTimeoutSeconds;
    }

    /**
     * @return analytics YAML path; empty means classpath resolution
     */
    public String getAnalyticsConfigPath() {
        return analyticsConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that parallelism and the
     * per-incident timeout are positive and that no path is {@code null}.
     * </p>
     */
    public static class Builder {
        private String inputPath = "";
        private String outputPath = "";
        private int parallelism = 4;
        private long incidentTimeoutSeconds = 30;
        private String analyticsConfigPath = "";

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder incidentTimeoutSeconds(long v) {
            this.incidentTimeoutSeconds = v;
            return this;
        }

        public Builder analyticsConfigPath(String v) {
            this.analyticsConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(inputPath, "inputPath required");
            Objects.requireNonNull(outputPath, "outputPath required");
            Objects.requireNonNull(analyticsConfigPath, "analyticsConfigPath required");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (incidentTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "incidentTimeoutSeconds must be >= 1, got: " + incidentTimeoutSeconds);
            }

            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", parallelism=" + parallelism +
                ", incidentTimeoutSeconds=" + incidentTimeoutSeconds +
                ", analyticsConfigPath='" + analyticsConfigPath + '\'' +
                '}';
    }
}
