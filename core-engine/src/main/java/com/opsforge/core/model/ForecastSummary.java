package com.opsforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Batch forecast over every qualifying (host, metric) series.
 *
 * @since 1.0.0
 */
public final class ForecastSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant generatedAt;
    private final int horizon;
    private final List<ForecastResult> series;
    private final List<ForecastResult> topAnomalies;

    /**
     * @param topAnomalies results sorted by anomaly score, highest first, already capped
     */
    public ForecastSummary(Instant generatedAt, int horizon, List<ForecastResult> series,
                           List<ForecastResult> topAnomalies) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.horizon = horizon;
        this.series = Collections.unmodifiableList(new ArrayList<>(series));
        this.topAnomalies = Collections.unmodifiableList(new ArrayList<>(topAnomalies));
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public int getHorizon() {
        return horizon;
    }

    public List<ForecastResult> getSeries() {
        return series;
    }

    public List<ForecastResult> getTopAnomalies() {
        return topAnomalies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastSummary that))
            return false;
        return horizon == that.horizon
                && generatedAt.equals(that.generatedAt)
                && series.equals(that.series)
                && topAnomalies.equals(that.topAnomalies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(generatedAt, horizon, series, topAnomalies);
    }

    @Override
    public String toString() {
        return "ForecastSummary{generatedAt=" + generatedAt
                + ", horizon=" + horizon
                + ", series=" + series.size()
                + ", topAnomalies=" + topAnomalies + '}';
    }
}
