package com.opsforge.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsforge.core.config.AnalyticsConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end test of {@link IncidentBatchJob#run}.
 */
class IncidentBatchJobTest {

    @Test
    @DisplayName("Should read a batch file and write an ISO-dated JSON report")
    void shouldRunBatch(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("batch.json");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("sample-batch.json")) {
            Files.copy(in, input);
        }
        Path output = dir.resolve("out/report.json");
        JobConfig config = new JobConfig.Builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .parallelism(2)
                .build();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

        IncidentBatchResult result = IncidentBatchJob.run(config, AnalyticsConfig.defaults(), clock);

        assertThat(result.getProcessed()).isEqualTo(3);
        assertThat(result.getFailed()).isEqualTo(1);

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertThat(json.get("generatedAt").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("processed").asInt()).isEqualTo(3);
        JsonNode first = json.get("outcomes").get(0);
        assertThat(first.get("status").asText()).isEqualTo("OK");
        assertThat(first.get("report").get("correlation").get("primaryAlertId").asText()).isEqualTo("A");
        assertThat(first.has("error")).isFalse();
        JsonNode second = json.get("outcomes").get(1);
        assertThat(second.get("status").asText()).isEqualTo("FAILED");
        assertThat(second.has("report")).isFalse();
    }
}
