package com.opsforge.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a batch input document: {@code {"incidents": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IncidentBatch {

    private List<IncidentEnvelope> incidents = new ArrayList<>();

    public List<IncidentEnvelope> getIncidents() {
        return incidents;
    }

    public void setIncidents(List<IncidentEnvelope> incidents) {
        this.incidents = incidents == null ? new ArrayList<>() : incidents;
    }
}
