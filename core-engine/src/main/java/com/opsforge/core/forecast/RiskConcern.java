package com.opsforge.core.forecast;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single series flagged by {@link FailureRiskAssessor}.
 *
 * @since 1.0.0
 */
public final class RiskConcern implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String host;
    private final String metric;
    private final double current;
    private final boolean increasing;
    private final RiskLevel level;

    public RiskConcern(String host, String metric, double current, boolean increasing, RiskLevel level) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.current = current;
        this.increasing = increasing;
        this.level = Objects.requireNonNull(level, "level must not be null");
    }

    public String getHost() {
        return host;
    }

    public String getMetric() {
        return metric;
    }

    public double getCurrent() {
        return current;
    }

    /**
     * @return {@code true} when the latest value is above the value two samples earlier
     */
    public boolean isIncreasing() {
        return increasing;
    }

    public RiskLevel getLevel() {
        return level;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RiskConcern that))
            return false;
        return Double.compare(current, that.current) == 0
                && increasing == that.increasing
                && host.equals(that.host)
                && metric.equals(that.metric)
                && level == that.level;
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, metric, current, increasing, level);
    }

    @Override
    public String toString() {
        return "RiskConcern{" + host + '/' + metric + '=' + current
                + (increasing ? " increasing" : " stable") + ", " + level + '}';
    }
}
