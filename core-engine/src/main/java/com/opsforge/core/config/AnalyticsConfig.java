package com.opsforge.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analytics YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * correlation:
 *   edgeThreshold: 0.5
 *   sameHostWeight: 0.4
 *   timeProximityWeight: 0.3
 *   timeWindowSeconds: 60
 *   keywordMatchWeight: 0.1
 *   keywordWeightCap: 0.3
 * forecast:
 *   alpha: 0.4
 *   beta: 0.2
 *   horizon: 12
 *   minPoints: 5
 * learning:
 *   suggestionMinObservations: 3
 *   thresholdMinObservations: 5
 *   thresholdFloor: 50
 *   thresholdCeiling: 85
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private CorrelationSettings correlation = new CorrelationSettings();
    private ForecastSettings forecast = new ForecastSettings();
    private LearningSettings learning = new LearningSettings();

    /**
     * @return a configuration holding every documented default
     */
    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    public CorrelationSettings getCorrelation() {
        return correlation;
    }

    /**
     * Set the correlation section; {@code null} restores the defaults.
     */
    public void setCorrelation(CorrelationSettings correlation) {
        this.correlation = correlation != null ? correlation : new CorrelationSettings();
    }

    public ForecastSettings getForecast() {
        return forecast;
    }

    public void setForecast(ForecastSettings forecast) {
        this.forecast = forecast != null ? forecast : new ForecastSettings();
    }

    public LearningSettings getLearning() {
        return learning;
    }

    public void setLearning(LearningSettings learning) {
        this.learning = learning != null ? learning : new LearningSettings();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception if any section is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collect(errors, correlation::validate);
        collect(errors, forecast::validate);
        collect(errors, learning::validate);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analytics configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Runnable validation) {
        try {
            validation.run();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "AnalyticsConfig{correlation=" + correlation
                + ", forecast=" + forecast
                + ", learning=" + learning + '}';
    }
}
