package com.opsforge.core.forecast;

import com.opsforge.core.config.ForecastSettings;
import com.opsforge.core.model.ForecastResult;
import com.opsforge.core.model.ForecastSummary;
import com.opsforge.core.model.MalformedInputException;
import com.opsforge.core.model.MetricPoint;
import com.opsforge.core.stats.TimeseriesStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Batch forecaster over arbitrary (host, metric) streams.
 *
 * <p>
 * Points are grouped by host and metric name in first-seen order, each group
 * is sorted chronologically and fitted with {@link HoltLinearModel}. Groups
 * with fewer than {@code minPoints} observations are left out of the summary:
 * sparse series are expected, not exceptional.
 * </p>
 *
 * <h3>Anomaly score</h3>
 * <p>
 * Each series is scored by the z-score of its latest residual against all of
 * its residuals (see {@link TimeseriesStats#zScore(double, double[])}).
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Holds a copy of the settings taken at construction; safe to share across
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public class ExponentialForecaster {

    private static final Logger LOG = LoggerFactory.getLogger(ExponentialForecaster.class);

    private final ForecastSettings settings;
    private final Clock clock;

    public ExponentialForecaster() {
        this(new ForecastSettings(), Clock.systemUTC());
    }

    /**
     * @param settings smoothing constants and batch defaults
     * @param clock    source of the summary's {@code generatedAt}
     * @throws IllegalStateException if the settings are invalid
     */
    public ExponentialForecaster(ForecastSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "ForecastSettings must not be null").copy();
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.settings.validate();
    }

    /**
     * Summarize using the configured horizon and minimum series length.
     *
     * @param points metric observations in any order
     * @return the forecast summary
     */
    public ForecastSummary summarize(Iterable<MetricPoint> points) {
        return summarize(points, settings.getHorizon(), settings.getMinPoints());
    }

    /**
     * Forecast every (host, metric) series with at least {@code minPoints}
     * observations.
     *
     * @param points    metric observations in any order; must not be {@code null}
     * @param horizon   forecast steps, {@code >= 0}
     * @param minPoints minimum observations per series, {@code >= 1}
     * @return the forecast summary
     * @throws MalformedInputException if {@code horizon} or {@code minPoints} is out of range
     */
    public ForecastSummary summarize(Iterable<MetricPoint> points, int horizon, int minPoints) {
        Objects.requireNonNull(points, "Metric points must not be null");
        if (horizon < 0) {
            throw new MalformedInputException("horizon must be >= 0, got: " + horizon);
        }
        if (minPoints < 1) {
            throw new MalformedInputException("minPoints must be >= 1, got: " + minPoints);
        }

        Map<SeriesKey, List<MetricPoint>> grouped = new LinkedHashMap<>();
        for (MetricPoint point : points) {
            Objects.requireNonNull(point, "Metric point must not be null");
            grouped.computeIfAbsent(new SeriesKey(point.getHost(), point.getMetricName()),
                    k -> new ArrayList<>()).add(point);
        }

        List<ForecastResult> series = new ArrayList<>();
        for (Map.Entry<SeriesKey, List<MetricPoint>> entry : grouped.entrySet()) {
            try {
                series.add(forecastSeries(entry.getKey(), entry.getValue(), horizon, minPoints));
            } catch (InsufficientDataException e) {
                LOG.debug("Skipping series: {}", e.getMessage());
            }
        }

        List<ForecastResult> topAnomalies = series.stream()
                .sorted(Comparator.comparingDouble(ForecastResult::getAnomalyScore).reversed())
                .limit(settings.getTopAnomalies())
                .toList();

        LOG.debug("Forecast {} of {} series, horizon={}", series.size(), grouped.size(), horizon);
        return new ForecastSummary(clock.instant(), horizon, series, topAnomalies);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ForecastResult forecastSeries(SeriesKey key, List<MetricPoint> points, int horizon, int minPoints)
            throws InsufficientDataException {
        if (points.size() < minPoints) {
            throw new InsufficientDataException(key.toString(), points.size(), minPoints);
        }

        List<MetricPoint> ordered = new ArrayList<>(points);
        ordered.sort(Comparator.comparing(MetricPoint::getTimestamp));
        double[] values = new double[ordered.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = ordered.get(i).getValue();
        }

        HoltLinearFit fit = HoltLinearModel.fit(values, horizon, settings.getAlpha(), settings.getBeta());
        double latestResidual = fit.latestResidual();
        double anomalyScore = TimeseriesStats.zScore(latestResidual, fit.getResiduals());

        double[] forecast = fit.getForecast();
        int shown = Math.min(horizon, settings.getDisplayCap());
        List<Double> reported = new ArrayList<>(shown);
        for (int i = 0; i < shown; i++) {
            reported.add(forecast[i]);
        }

        return new ForecastResult(key.host(), key.metric(), values[values.length - 1], fit.getTrend(),
                reported, anomalyScore, latestResidual);
    }

    private static final class SeriesKey {
        private final String host;
        private final String metric;

        SeriesKey(String host, String metric) {
            this.host = host;
            this.metric = metric;
        }

        String host() {
            return host;
        }

        String metric() {
            return metric;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof SeriesKey that))
                return false;
            return host.equals(that.host) && metric.equals(that.metric);
        }

        @Override
        public int hashCode() {
            return Objects.hash(host, metric);
        }

        @Override
        public String toString() {
            return host + "/" + metric;
        }
    }
}
