package com.opsforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single metric observation for one host.
 *
 * @since 1.0.0
 */
public final class MetricPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String host;
    private final String metricName;
    private final double value;
    private final Instant timestamp;

    /**
     * @throws NullPointerException    if {@code host}, {@code metricName} or
     *                                 {@code timestamp} is {@code null}
     * @throws MalformedInputException if {@code value} is NaN or infinite
     */
    public MetricPoint(String host, String metricName, double value, Instant timestamp) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        if (!Double.isFinite(value)) {
            throw new MalformedInputException("Metric " + host + "/" + metricName + " has non-finite value " + value);
        }
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getHost() {
        return host;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && host.equals(that.host)
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, metricName, value, timestamp);
    }

    @Override
    public String toString() {
        return "MetricPoint{" + host + '/' + metricName + '=' + value + " @ " + timestamp + '}';
    }
}
