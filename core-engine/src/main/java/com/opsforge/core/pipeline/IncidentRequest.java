package com.opsforge.core.pipeline;

import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.MetricPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One incident to be analysed by {@link IncidentPipeline}.
 *
 * <p>
 * Immutable. Relevance scores and observed outcome quality are optional: an
 * empty score map makes the pipeline fall back to keyword heuristics, and a
 * {@code null} quality makes it record the configured assumed quality.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentRequest {

    private final String incidentId;
    private final List<AlertRecord> alerts;
    private final List<MetricPoint> metrics;
    private final Map<String, Integer> relevanceScores;
    private final Double observedQuality;

    private IncidentRequest(Builder builder) {
        this.incidentId = Objects.requireNonNull(builder.incidentId, "incidentId must not be null");
        this.alerts = Collections.unmodifiableList(new ArrayList<>(builder.alerts));
        this.metrics = Collections.unmodifiableList(new ArrayList<>(builder.metrics));
        this.relevanceScores = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relevanceScores));
        this.observedQuality = builder.observedQuality;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link IncidentRequest}.
     */
    public static class Builder {
        private String incidentId;
        private List<AlertRecord> alerts = List.of();
        private List<MetricPoint> metrics = List.of();
        private Map<String, Integer> relevanceScores = Map.of();
        private Double observedQuality;

        public Builder incidentId(String incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder alerts(List<AlertRecord> alerts) {
            this.alerts = alerts == null ? List.of() : alerts;
            return this;
        }

        public Builder metrics(List<MetricPoint> metrics) {
            this.metrics = metrics == null ? List.of() : metrics;
            return this;
        }

        public Builder relevanceScores(Map<String, Integer> relevanceScores) {
            this.relevanceScores = relevanceScores == null ? Map.of() : relevanceScores;
            return this;
        }

        public Builder observedQuality(Double observedQuality) {
            this.observedQuality = observedQuality;
            return this;
        }

        public IncidentRequest build() {
            return new IncidentRequest(this);
        }
    }

    public String getIncidentId() {
        return incidentId;
    }

    public List<AlertRecord> getAlerts() {
        return alerts;
    }

    public List<MetricPoint> getMetrics() {
        return metrics;
    }

    public Map<String, Integer> getRelevanceScores() {
        return relevanceScores;
    }

    /**
     * @return the observed outcome quality, or {@code null} if unknown
     */
    public Double getObservedQuality() {
        return observedQuality;
    }

    @Override
    public String toString() {
        return "IncidentRequest{" + incidentId + ", alerts=" + alerts.size() + ", metrics=" + metrics.size() + '}';
    }
}
