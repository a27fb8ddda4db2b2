package com.opsforge.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Forecast and anomaly score for one (host, metric) series.
 *
 * @since 1.0.0
 */
public final class ForecastResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String host;
    private final String metric;
    private final double lastValue;
    private final double trend;
    private final List<Double> forecast;
    private final double anomalyScore;
    private final double latestResidual;

    /**
     * @param forecast reported forecast slice (already truncated for display)
     */
    public ForecastResult(String host, String metric, double lastValue, double trend,
                          List<Double> forecast, double anomalyScore, double latestResidual) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.lastValue = lastValue;
        this.trend = trend;
        this.forecast = Collections.unmodifiableList(new ArrayList<>(forecast));
        this.anomalyScore = anomalyScore;
        this.latestResidual = latestResidual;
    }

    public String getHost() {
        return host;
    }

    public String getMetric() {
        return metric;
    }

    public double getLastValue() {
        return lastValue;
    }

    public double getTrend() {
        return trend;
    }

    public List<Double> getForecast() {
        return forecast;
    }

    /**
     * @return z-score of the latest residual against the series' residuals, never negative
     */
    public double getAnomalyScore() {
        return anomalyScore;
    }

    public double getLatestResidual() {
        return latestResidual;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastResult that))
            return false;
        return Double.compare(lastValue, that.lastValue) == 0
                && Double.compare(trend, that.trend) == 0
                && Double.compare(anomalyScore, that.anomalyScore) == 0
                && Double.compare(latestResidual, that.latestResidual) == 0
                && host.equals(that.host)
                && metric.equals(that.metric)
                && forecast.equals(that.forecast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, metric, lastValue, trend, forecast, anomalyScore, latestResidual);
    }

    @Override
    public String toString() {
        return "ForecastResult{" +
                "host='" + host + '\'' +
                ", metric='" + metric + '\'' +
                ", lastValue=" + lastValue +
                ", trend=" + trend +
                ", anomalyScore=" + anomalyScore +
                '}';
    }
}
