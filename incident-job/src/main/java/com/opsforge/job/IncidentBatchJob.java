package com.opsforge.job;

import com.opsforge.core.config.AnalyticsConfig;
import com.opsforge.core.config.AnalyticsConfigLoader;
import com.opsforge.core.model.RecordParser;
import com.opsforge.core.pipeline.IncidentPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for the OpsForge incident batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   incident batch JSON (file or stdin)
 *     → IncidentBatchReader → IncidentEnvelope per incident
 *     → RecordParser → typed alerts and metrics
 *     → IncidentPipeline (correlate, forecast, select, learn)
 *     → ReportWriter → result JSON (file or stdout)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * analytics settings from YAML via {@link AnalyticsConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentBatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentBatchJob.class);

    private IncidentBatchJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting OpsForge incident job with config: {}", config);

        // 2. Load analytics settings
        AnalyticsConfig analytics = loadAnalytics(config);

        // 3. Run
        IncidentBatchResult result = run(config, analytics, Clock.systemUTC());
        LOG.info("Batch complete: {} processed, {} failed", result.getProcessed(), result.getFailed());
    }

    /**
     * Read, process and write one batch.
     */
    static IncidentBatchResult run(JobConfig config, AnalyticsConfig analytics, Clock clock)
            throws IOException, InterruptedException {
        IncidentBatchReader reader = new IncidentBatchReader();
        IncidentBatch batch = config.getInputPath().isBlank()
                ? reader.read(System.in)
                : reader.read(Path.of(config.getInputPath()));

        IncidentPipeline pipeline = new IncidentPipeline(analytics);
        List<IncidentOutcome> outcomes;
        try (IncidentBatchProcessor processor = new IncidentBatchProcessor(pipeline, new RecordParser(clock),
                config.getParallelism(), config.getIncidentTimeoutSeconds())) {
            outcomes = processor.process(batch);
        }

        IncidentBatchResult result = new IncidentBatchResult(clock.instant(), outcomes);
        ReportWriter writer = new ReportWriter();
        if (config.getOutputPath().isBlank()) {
            writer.write(result, System.out);
        } else {
            writer.write(result, Path.of(config.getOutputPath()));
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalyticsConfig loadAnalytics(JobConfig config) {
        String path = config.getAnalyticsConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalyticsConfigLoader.fromFile(path);
        }
        return AnalyticsConfigLoader.load();
    }
}
