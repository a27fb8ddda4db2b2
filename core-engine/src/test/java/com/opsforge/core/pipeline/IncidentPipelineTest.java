package com.opsforge.core.pipeline;

import com.opsforge.core.config.AnalyticsConfig;
import com.opsforge.core.forecast.RiskLevel;
import com.opsforge.core.learning.SelectionSource;
import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.MalformedInputException;
import com.opsforge.core.model.MetricPoint;
import com.opsforge.core.model.Severity;
import com.opsforge.core.store.InMemorySelectionHistoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IncidentPipeline}.
 */
class IncidentPipelineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemorySelectionHistoryStore store;
    private IncidentPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemorySelectionHistoryStore(1000);
        pipeline = new IncidentPipeline(AnalyticsConfig.defaults(), store, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should correlate, forecast, select and record one incident")
    void shouldProcessIncident() {
        IncidentRequest request = IncidentRequest.builder()
                .incidentId("INC-1")
                .alerts(databaseAlerts())
                .metrics(cpuSeries("db1", 85, 88, 90, 93, 96))
                .build();

        IncidentReport report = pipeline.process(request);

        assertThat(report.getIncidentId()).isEqualTo("INC-1");
        assertThat(report.getCorrelation().getPrimaryAlertId()).isEqualTo("A");
        assertThat(report.getCorrelation().getSuppressedCount()).isEqualTo(1);
        assertThat(report.getForecast().getSeries()).hasSize(1);
        assertThat(report.getRisk().getLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(report.getSelection().getAgents()).containsExactly("Orchestrator", "AlertOps");
        assertThat(report.getSignatureKey()).isEqualTo("database_database_disk");
        assertThat(report.getRecordedQuality()).isEqualTo(0.8);
        assertThat(store.getHistory("database_database_disk")).hasSize(1);
    }

    @Test
    @DisplayName("Analysis alone should leave the history untouched until recorded")
    void analyzeShouldNotRecord() {
        IncidentReport report = pipeline.analyze(IncidentRequest.builder()
                .incidentId("INC-3")
                .alerts(databaseAlerts())
                .build());

        assertThat(report.getSignature().getKeywords()).containsExactly("Database", "Database", "Disk");
        assertThat(store.getHistory("database_database_disk")).isEmpty();

        pipeline.record(report);

        assertThat(store.getHistory("database_database_disk")).singleElement()
                .satisfies(o -> assertThat(o.getOutcomeQuality()).isEqualTo(0.8));
    }

    @Test
    @DisplayName("Incidents without metrics should skip forecasting")
    void shouldSkipForecastWithoutMetrics() {
        IncidentReport report = pipeline.process(IncidentRequest.builder()
                .incidentId("INC-2")
                .alerts(databaseAlerts())
                .relevanceScores(Map.of("PatchOps", 90))
                .observedQuality(0.5)
                .build());

        assertThat(report.getForecast()).isNull();
        assertThat(report.getRisk()).isNull();
        assertThat(report.getSelection().getAgents()).containsExactly("Orchestrator", "PatchOps");
        assertThat(report.getRecordedQuality()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Repeated good outcomes should switch selection to the learned set")
    void shouldLearnFromHistory() {
        for (int i = 0; i < 3; i++) {
            IncidentReport report = pipeline.process(request("INC-" + i, 0.9));
            assertThat(report.getSelection().getSource()).isEqualTo(SelectionSource.SCORED);
        }

        IncidentReport learned = pipeline.process(request("INC-LEARNED", 0.9));

        assertThat(learned.getSelection().getSource()).isEqualTo(SelectionSource.LEARNED);
        assertThat(learned.getSelection().getAgents()).containsExactly("AlertOps", "Orchestrator");
    }

    @Test
    @DisplayName("Should be safe to call from many threads")
    void shouldProcessConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<IncidentReport>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = "INC-" + i;
                futures.add(pool.submit(() -> pipeline.process(request(id, 0.7))));
            }
            for (Future<IncidentReport> future : futures) {
                assertThat(future.get().getCorrelation().getPrimaryAlertId()).isEqualTo("A");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.getHistory("database_database_disk")).hasSize(40);
    }

    @Test
    @DisplayName("Malformed incidents should propagate the error")
    void shouldPropagateMalformedInput() {
        List<AlertRecord> duplicated = List.of(databaseAlerts().get(0), databaseAlerts().get(0));

        assertThatThrownBy(() -> pipeline.process(IncidentRequest.builder()
                .incidentId("INC-BAD")
                .alerts(duplicated)
                .build()))
                .isInstanceOf(MalformedInputException.class);
        assertThat(store.signatureCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static IncidentRequest request(String id, double quality) {
        return IncidentRequest.builder()
                .incidentId(id)
                .alerts(databaseAlerts())
                .observedQuality(quality)
                .build();
    }

    private static List<AlertRecord> databaseAlerts() {
        return List.of(
                alert("A", "db1", 0, "Database unresponsive"),
                alert("B", "db1", 10, "Database timeout"),
                alert("C", "web1", 500, "Disk full"));
    }

    private static AlertRecord alert(String id, String host, long offsetSeconds, String title) {
        return AlertRecord.builder()
                .id(id)
                .title(title)
                .host(host)
                .severity(Severity.CRITICAL)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .build();
    }

    private static List<MetricPoint> cpuSeries(String host, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(host, "cpu_usage", values[i], T0.plusSeconds(60L * i)));
        }
        return points;
    }
}
