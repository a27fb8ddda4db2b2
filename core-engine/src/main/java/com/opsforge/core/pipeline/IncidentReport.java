package com.opsforge.core.pipeline;

import com.opsforge.core.forecast.RiskAssessment;
import com.opsforge.core.learning.SpecialistSelection;
import com.opsforge.core.model.CorrelationResult;
import com.opsforge.core.model.ForecastSummary;
import com.opsforge.core.model.IncidentSignature;

import java.io.Serializable;
import java.util.Objects;

/**
 * Everything the analytics core concluded about one incident.
 *
 * @since 1.0.0
 */
public final class IncidentReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String incidentId;
    private final CorrelationResult correlation;
    private final ForecastSummary forecast;
    private final RiskAssessment risk;
    private final SpecialistSelection selection;
    private final IncidentSignature signature;
    private final double recordedQuality;

    public IncidentReport(String incidentId, CorrelationResult correlation, ForecastSummary forecast,
            RiskAssessment risk, SpecialistSelection selection, IncidentSignature signature, double recordedQuality) {
        this.incidentId = Objects.requireNonNull(incidentId, "incidentId must not be null");
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
        this.forecast = forecast;
        this.risk = risk;
        this.selection = Objects.requireNonNull(selection, "selection must not be null");
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.recordedQuality = recordedQuality;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public CorrelationResult getCorrelation() {
        return correlation;
    }

    /**
     * @return the forecast summary, or {@code null} when the incident carried no metrics
     */
    public ForecastSummary getForecast() {
        return forecast;
    }

    /**
     * @return the risk assessment, or {@code null} when the incident carried no metrics
     */
    public RiskAssessment getRisk() {
        return risk;
    }

    public SpecialistSelection getSelection() {
        return selection;
    }

    public IncidentSignature getSignature() {
        return signature;
    }

    public String getSignatureKey() {
        return signature.getKey();
    }

    /**
     * @return the outcome quality recorded, or to be recorded, against the signature
     */
    public double getRecordedQuality() {
        return recordedQuality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IncidentReport that))
            return false;
        return Double.compare(recordedQuality, that.recordedQuality) == 0
                && incidentId.equals(that.incidentId)
                && correlation.equals(that.correlation)
                && Objects.equals(forecast, that.forecast)
                && Objects.equals(risk, that.risk)
                && selection.equals(that.selection)
                && signature.equals(that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(incidentId, correlation, forecast, risk, selection, signature, recordedQuality);
    }

    @Override
    public String toString() {
        return "IncidentReport{" + incidentId
                + ", primary=" + correlation.getPrimaryAlertId()
                + ", signature='" + signature.getKey() + '\''
                + ", agents=" + selection.getAgents() + '}';
    }
}
