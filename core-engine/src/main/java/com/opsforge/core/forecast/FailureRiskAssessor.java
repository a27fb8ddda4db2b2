package com.opsforge.core.forecast;

import com.opsforge.core.model.MetricPoint;
import com.opsforge.core.stats.TimeseriesStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Rule-based resource-exhaustion check over CPU and memory series.
 *
 * <p>
 * Complements the forecaster with a blunt saturation check: a CPU series
 * averaging above {@value #CPU_MEAN_LIMIT} or a memory series averaging above
 * {@value #MEMORY_MEAN_LIMIT} is a concern; it is {@link RiskLevel#HIGH} when
 * the latest value also exceeds the corresponding critical mark.
 * </p>
 *
 * @since 1.0.0
 */
public class FailureRiskAssessor {

    private static final Logger LOG = LoggerFactory.getLogger(FailureRiskAssessor.class);

    static final int MIN_TOTAL_POINTS = 5;
    static final int MIN_SERIES_POINTS = 3;

    static final double CPU_MEAN_LIMIT = 80.0;
    static final double CPU_CRITICAL = 90.0;
    static final double MEMORY_MEAN_LIMIT = 85.0;
    static final double MEMORY_CRITICAL = 92.0;

    static final double CONCERN_CONFIDENCE = 0.75;
    static final double CLEAR_CONFIDENCE = 0.8;

    /**
     * @param points metric observations in any order; must not be {@code null}
     * @return the overall assessment
     */
    public RiskAssessment assess(List<MetricPoint> points) {
        Objects.requireNonNull(points, "Metric points must not be null");
        if (points.size() < MIN_TOTAL_POINTS) {
            return new RiskAssessment(RiskLevel.UNKNOWN, 0.0, List.of(),
                    List.of("Insufficient data for prediction"));
        }

        Map<String, List<MetricPoint>> bySeries = new LinkedHashMap<>();
        for (MetricPoint point : points) {
            bySeries.computeIfAbsent(point.getHost() + "/" + point.getMetricName(), k -> new ArrayList<>())
                    .add(point);
        }

        List<RiskConcern> concerns = new ArrayList<>();
        for (List<MetricPoint> series : bySeries.values()) {
            if (series.size() < MIN_SERIES_POINTS) {
                continue;
            }
            List<MetricPoint> ordered = new ArrayList<>(series);
            ordered.sort(Comparator.comparing(MetricPoint::getTimestamp));
            RiskConcern concern = evaluate(ordered);
            if (concern != null) {
                concerns.add(concern);
            }
        }

        if (concerns.isEmpty()) {
            return new RiskAssessment(RiskLevel.LOW, CLEAR_CONFIDENCE, List.of(),
                    List.of("All metrics within normal ranges"));
        }

        boolean high = concerns.stream().anyMatch(c -> c.getLevel() == RiskLevel.HIGH);
        RiskLevel overall = high ? RiskLevel.HIGH : RiskLevel.MEDIUM;
        LOG.debug("Risk {} from {} concern(s)", overall, concerns.size());
        return new RiskAssessment(overall, CONCERN_CONFIDENCE, concerns, List.of(
                "Analyzed " + points.size() + " data points",
                "Found " + concerns.size() + " concerning trends",
                "Resource exhaustion predicted within forecast window"));
    }

    private static RiskConcern evaluate(List<MetricPoint> ordered) {
        MetricPoint first = ordered.get(0);
        String name = first.getMetricName().toLowerCase(Locale.ROOT);
        double[] values = new double[ordered.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = ordered.get(i).getValue();
        }
        double last = values[values.length - 1];
        boolean increasing = last - values[values.length - 3] > 0;
        double mean = TimeseriesStats.mean(values);

        if (name.contains("cpu") && mean > CPU_MEAN_LIMIT) {
            return new RiskConcern(first.getHost(), first.getMetricName(), last, increasing,
                    last > CPU_CRITICAL ? RiskLevel.HIGH : RiskLevel.MEDIUM);
        }
        if (name.contains("memory") && mean > MEMORY_MEAN_LIMIT) {
            return new RiskConcern(first.getHost(), first.getMetricName(), last, increasing,
                    last > MEMORY_CRITICAL ? RiskLevel.HIGH : RiskLevel.MEDIUM);
        }
        return null;
    }
}
