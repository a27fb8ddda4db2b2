package com.opsforge.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.opsforge.core.model.RawRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One incident as it appears in a batch input document.
 *
 * <p>
 * Alerts and metrics stay loosely typed here; they are converted per incident
 * so that one malformed record fails only its own incident.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IncidentEnvelope {

    private String incidentId;
    private List<RawRecord> alerts = new ArrayList<>();
    private List<RawRecord> metrics = new ArrayList<>();
    private Map<String, Integer> relevanceScores = new LinkedHashMap<>();
    private Double outcomeQuality;

    public String getIncidentId() {
        return incidentId;
    }

    public void setIncidentId(String incidentId) {
        this.incidentId = incidentId;
    }

    public List<RawRecord> getAlerts() {
        return alerts;
    }

    public void setAlerts(List<RawRecord> alerts) {
        this.alerts = alerts == null ? new ArrayList<>() : alerts;
    }

    public List<RawRecord> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<RawRecord> metrics) {
        this.metrics = metrics == null ? new ArrayList<>() : metrics;
    }

    public Map<String, Integer> getRelevanceScores() {
        return relevanceScores;
    }

    public void setRelevanceScores(Map<String, Integer> relevanceScores) {
        this.relevanceScores = relevanceScores == null ? new LinkedHashMap<>() : relevanceScores;
    }

    public Double getOutcomeQuality() {
        return outcomeQuality;
    }

    public void setOutcomeQuality(Double outcomeQuality) {
        this.outcomeQuality = outcomeQuality;
    }

    @Override
    public String toString() {
        return "IncidentEnvelope{" + incidentId + ", alerts=" + alerts.size() + ", metrics=" + metrics.size() + '}';
    }
}
