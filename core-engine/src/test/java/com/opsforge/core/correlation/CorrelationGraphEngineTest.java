package com.opsforge.core.correlation;

import com.opsforge.core.config.CorrelationSettings;
import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.CorrelationResult;
import com.opsforge.core.model.MalformedInputException;
import com.opsforge.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CorrelationGraphEngine}.
 */
class CorrelationGraphEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private CorrelationGraphEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CorrelationGraphEngine(new CorrelationSettings());
    }

    @Test
    @DisplayName("Should cluster two database alerts on the same host and exclude the unrelated one")
    void shouldClusterRelatedAlerts() {
        List<AlertRecord> alerts = List.of(
                alert("A", "db1", 0, "Database unresponsive"),
                alert("B", "db1", 10, "Database timeout"),
                alert("C", "web1", 500, "Disk full"));

        CorrelationResult result = engine.correlate(alerts);

        assertThat(result.getPrimaryAlertId()).isEqualTo("A");
        assertThat(result.getRelatedAlertIds()).containsExactly("B");
        assertThat(result.getSuppressedCount()).isEqualTo(1);
        assertThat(result.getConfidence()).isEqualTo(0.85);
        assertThat(result.getRootCause()).isEqualTo("Database unresponsive");
        assertThat(result.getReasoning()).containsExactly(
                "Identified cluster of 2 related alerts",
                "Primary alert: Database unresponsive on db1",
                "Time span: 10s");
    }

    @Test
    @DisplayName("Correlation should be idempotent")
    void shouldBeIdempotent() {
        List<AlertRecord> alerts = List.of(
                alert("A", "db1", 0, "Database unresponsive"),
                alert("B", "db1", 10, "Database timeout"),
                alert("C", "web1", 500, "Disk full"));

        assertThat(engine.correlate(alerts)).isEqualTo(engine.correlate(alerts));
    }

    @Test
    @DisplayName("Primary should be the earliest alert even when it arrives last")
    void primaryShouldBeEarliest() {
        List<AlertRecord> alerts = List.of(
                alert("late", "db1", 30, "Replication lag"),
                alert("early", "db1", 5, "Replication stopped"));

        CorrelationResult result = engine.correlate(alerts);

        assertThat(result.getPrimaryAlertId()).isEqualTo("early");
        assertThat(result.getRelatedAlertIds()).containsExactly("late");
    }

    @Nested
    @DisplayName("Degenerate inputs")
    class DegenerateInputs {

        @Test
        @DisplayName("Empty input should report no alerts with full confidence")
        void emptyInput() {
            CorrelationResult result = engine.correlate(List.of());

            assertThat(result.getPrimaryAlertId()).isNull();
            assertThat(result.getConfidence()).isEqualTo(1.0);
            assertThat(result.getRootCause()).isEqualTo("No alerts");
            assertThat(result.getSuppressedCount()).isZero();
        }

        @Test
        @DisplayName("A single alert should be its own root cause")
        void singleAlert() {
            CorrelationResult result = engine.correlate(List.of(alert("A", "db1", 0, "Database down")));

            assertThat(result.getPrimaryAlertId()).isEqualTo("A");
            assertThat(result.getRelatedAlertIds()).isEmpty();
            assertThat(result.getConfidence()).isEqualTo(1.0);
            assertThat(result.getRootCause()).isEqualTo("Database down");
            assertThat(result.getSuppressedCount()).isZero();
        }

        @Test
        @DisplayName("Unrelated alerts should yield low confidence and the first alert")
        void unrelatedAlerts() {
            CorrelationResult result = engine.correlate(List.of(
                    alert("X", "web1", 0, "Disk full"),
                    alert("Y", "db2", 900, "Certificate expiring")));

            assertThat(result.getPrimaryAlertId()).isEqualTo("X");
            assertThat(result.getRelatedAlertIds()).isEmpty();
            assertThat(result.getConfidence()).isEqualTo(0.3);
            assertThat(result.getRootCause()).isEqualTo("No clear correlation detected");
            assertThat(result.getReasoning()).containsExactly("Alerts appear unrelated");
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("Same host within the window with a shared word is always an edge")
        void sameHostCloseSharedWordIsEdge() {
            double score = engine.score(
                    alert("A", "db1", 0, "Database unresponsive"),
                    alert("B", "db1", 60, "database slow"));

            assertThat(score).isGreaterThan(0.5);
        }

        @Test
        @DisplayName("A score exactly at the threshold should not create an edge")
        void thresholdIsStrict() {
            // same host (0.4) + one shared word (0.1), outside the window
            List<AlertRecord> alerts = List.of(
                    alert("A", "db1", 0, "Database unresponsive"),
                    alert("B", "db1", 3600, "Database timeout"));

            assertThat(engine.score(alerts.get(0), alerts.get(1))).isEqualTo(0.5);
            assertThat(engine.correlate(alerts).getRelatedAlertIds()).isEmpty();
        }

        @Test
        @DisplayName("Keyword contribution should be capped")
        void keywordWeightIsCapped() {
            double score = engine.score(
                    alert("A", "web1", 0, "high cpu load on node"),
                    alert("B", "db9", 7200, "high cpu load on node"));

            assertThat(score).isEqualTo(0.3);
        }

        @Test
        @DisplayName("Window boundary should be inclusive")
        void windowIsInclusive() {
            CorrelationSettings settings = new CorrelationSettings();
            double atBoundary = engine.score(alert("A", "a", 0, "x"), alert("B", "b", 60, "y"));
            double past = engine.score(alert("A", "a", 0, "x"), alert("B", "b", 61, "y"));

            assertThat(atBoundary).isEqualTo(settings.getTimeProximityWeight());
            assertThat(past).isZero();
        }
    }

    @Test
    @DisplayName("Later changes to the settings bean should not reach the engine")
    void settingsAreCopiedAtConstruction() {
        CorrelationSettings settings = new CorrelationSettings();
        CorrelationGraphEngine own = new CorrelationGraphEngine(settings);
        settings.setSameHostWeight(-1.0);

        assertThat(own.score(alert("A", "web1", 0, "x"), alert("B", "web1", 600, "y"))).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Equal-size components should be resolved by the earliest alert")
    void tieBreakByEarliestTimestamp() {
        List<AlertRecord> alerts = List.of(
                alert("web-b", "web1", 1000, "Nginx down"),
                alert("web-a", "web1", 1005, "Nginx restart"),
                alert("db-a", "db1", 0, "Postgres down"),
                alert("db-b", "db1", 5, "Postgres restart"));

        CorrelationResult result = engine.correlate(alerts);

        assertThat(result.getPrimaryAlertId()).isEqualTo("db-a");
        assertThat(result.getRelatedAlertIds()).containsExactly("db-b");
    }

    @Test
    @DisplayName("Duplicate alert ids should be rejected")
    void shouldRejectDuplicateIds() {
        List<AlertRecord> alerts = List.of(
                alert("A", "db1", 0, "Database unresponsive"),
                alert("A", "db1", 10, "Database timeout"));

        assertThatThrownBy(() -> engine.correlate(alerts))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Duplicate");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AlertRecord alert(String id, String host, long offsetSeconds, String title) {
        return AlertRecord.builder()
                .id(id)
                .title(title)
                .host(host)
                .severity(Severity.HIGH)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .build();
    }
}
