package com.opsforge.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IncidentBatchReader}.
 */
class IncidentBatchReaderTest {

    private final IncidentBatchReader reader = new IncidentBatchReader();

    @Test
    @DisplayName("Should read incidents and keep raw alert fields")
    void shouldReadSampleBatch() throws IOException {
        IncidentBatch batch;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("sample-batch.json")) {
            batch = reader.read(in);
        }

        assertThat(batch.getIncidents()).extracting(IncidentEnvelope::getIncidentId)
                .containsExactly("INC-100", "INC-101", "INC-102");
        IncidentEnvelope first = batch.getIncidents().get(0);
        assertThat(first.getAlerts()).hasSize(3);
        assertThat(first.getAlerts().get(1).getField("alert_id")).contains("B");
        assertThat(first.getMetrics()).hasSize(5);
        assertThat(first.getOutcomeQuality()).isEqualTo(0.9);
        assertThat(batch.getIncidents().get(2).getRelevanceScores()).containsEntry("PatchOps", 90);
        assertThat(batch.getIncidents().get(1).getRelevanceScores()).isEmpty();
    }

    @Test
    @DisplayName("Should fail on invalid JSON")
    void shouldRejectInvalidJson() {
        InputStream in = new ByteArrayInputStream("{\"incidents\": [".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> reader.read(in)).isInstanceOf(IOException.class);
    }
}
