package com.opsforge.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.opsforge.core.pipeline.IncidentReport;

import java.util.Objects;

/**
 * Result of processing one incident of a batch: either a report or the reason
 * it failed.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IncidentOutcome {

    /** Per-incident processing status. */
    public enum Status {
        OK,
        FAILED
    }

    private final String incidentId;
    private final Status status;
    private final IncidentReport report;
    private final String error;

    private IncidentOutcome(String incidentId, Status status, IncidentReport report, String error) {
        this.incidentId = incidentId;
        this.status = status;
        this.report = report;
        this.error = error;
    }

    public static IncidentOutcome ok(IncidentReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return new IncidentOutcome(report.getIncidentId(), Status.OK, report, null);
    }

    public static IncidentOutcome failed(String incidentId, String error) {
        return new IncidentOutcome(incidentId, Status.FAILED, null, error);
    }

    /**
     * @return the incident id as supplied; may be {@code null} for a failed
     *         incident that had none
     */
    public String getIncidentId() {
        return incidentId;
    }

    public Status getStatus() {
        return status;
    }

    public IncidentReport getReport() {
        return report;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "IncidentOutcome{" + incidentId + ' ' + status + (error == null ? "" : ": " + error) + '}';
    }
}
