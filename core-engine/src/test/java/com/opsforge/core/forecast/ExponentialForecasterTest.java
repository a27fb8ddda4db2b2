package com.opsforge.core.forecast;

import com.opsforge.core.config.ForecastSettings;
import com.opsforge.core.model.ForecastResult;
import com.opsforge.core.model.ForecastSummary;
import com.opsforge.core.model.MetricPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ExponentialForecaster}.
 */
class ExponentialForecasterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private ExponentialForecaster forecaster;

    @BeforeEach
    void setUp() {
        forecaster = new ExponentialForecaster(new ForecastSettings(), Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should group by host and metric and skip short series")
    void shouldGroupAndSkip() {
        List<MetricPoint> points = new ArrayList<>();
        points.addAll(series("web1", "cpu_usage", 40, 41, 42, 43, 44, 45));
        points.addAll(series("web1", "memory_usage", 60, 60, 61, 61, 62));
        points.addAll(series("db1", "cpu_usage", 10, 11));

        ForecastSummary summary = forecaster.summarize(points);

        assertThat(summary.getGeneratedAt()).isEqualTo(T0);
        assertThat(summary.getHorizon()).isEqualTo(12);
        assertThat(summary.getSeries())
                .extracting(r -> r.getHost() + "/" + r.getMetric())
                .containsExactly("web1/cpu_usage", "web1/memory_usage");
    }

    @Test
    @DisplayName("Reported forecast should be capped at the display limit")
    void forecastShouldBeCapped() {
        ForecastSummary summary = forecaster.summarize(series("web1", "cpu_usage", 1, 2, 3, 4, 5));

        ForecastResult result = summary.getSeries().get(0);
        assertThat(result.getForecast()).hasSize(8);
        assertThat(result.getLastValue()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Points should be ordered by timestamp before fitting")
    void shouldSortByTimestamp() {
        List<MetricPoint> shuffled = List.of(
                point("web1", "cpu_usage", 3, 18),
                point("web1", "cpu_usage", 0, 10),
                point("web1", "cpu_usage", 2, 14),
                point("web1", "cpu_usage", 4, 16),
                point("web1", "cpu_usage", 1, 12));

        ForecastResult result = forecaster.summarize(shuffled, 3, 5).getSeries().get(0);

        assertThat(result.getLastValue()).isEqualTo(16.0);
    }

    @Test
    @DisplayName("Top anomalies should rank the spiking series first")
    void shouldRankAnomalies() {
        List<MetricPoint> points = new ArrayList<>();
        points.addAll(series("web1", "cpu_usage", 50, 51, 50, 51, 50, 51));
        points.addAll(series("web2", "cpu_usage", 50, 50, 50, 50, 50, 99));
        points.addAll(series("web3", "cpu_usage", 20, 20, 20, 20, 20, 20));

        ForecastSummary summary = forecaster.summarize(points);

        assertThat(summary.getTopAnomalies()).hasSize(3);
        assertThat(summary.getTopAnomalies().get(0).getHost()).isEqualTo("web2");
        assertThat(summary.getTopAnomalies()).allSatisfy(r -> assertThat(r.getAnomalyScore()).isNotNegative());
        assertThat(summary.getSeries()).filteredOn(r -> r.getHost().equals("web3"))
                .singleElement()
                .satisfies(r -> assertThat(r.getAnomalyScore()).isZero());
    }

    @Test
    @DisplayName("No points should yield an empty summary")
    void emptyInput() {
        ForecastSummary summary = forecaster.summarize(List.of());

        assertThat(summary.getSeries()).isEmpty();
        assertThat(summary.getTopAnomalies()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<MetricPoint> series(String host, String metric, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(point(host, metric, i, values[i]));
        }
        return points;
    }

    private static MetricPoint point(String host, String metric, int minute, double value) {
        return new MetricPoint(host, metric, value, T0.plusSeconds(60L * minute));
    }
}
