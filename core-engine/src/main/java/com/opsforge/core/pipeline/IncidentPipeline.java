package com.opsforge.core.pipeline;

import com.opsforge.core.config.AnalyticsConfig;
import com.opsforge.core.config.LearningSettings;
import com.opsforge.core.correlation.CorrelationGraphEngine;
import com.opsforge.core.forecast.ExponentialForecaster;
import com.opsforge.core.forecast.FailureRiskAssessor;
import com.opsforge.core.forecast.RiskAssessment;
import com.opsforge.core.learning.AdaptiveSelectionLearner;
import com.opsforge.core.learning.KeywordRelevanceScorer;
import com.opsforge.core.learning.SignatureExtractor;
import com.opsforge.core.learning.SpecialistSelection;
import com.opsforge.core.learning.SpecialistSelector;
import com.opsforge.core.model.CorrelationResult;
import com.opsforge.core.model.ForecastSummary;
import com.opsforge.core.model.IncidentSignature;
import com.opsforge.core.store.InMemorySelectionHistoryStore;
import com.opsforge.core.store.SelectionHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one incident through correlation, forecasting and specialist
 * selection, then records the outcome for future learning.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li>Correlate the alerts into a primary alert and related cluster.</li>
 * <li>If the incident carries metrics, forecast every series and assess
 * resource-exhaustion risk.</li>
 * <li>Extract the incident signature and select specialists, using the
 * supplied relevance scores or keyword heuristics when none were given.</li>
 * <li>Record the selection with the observed outcome quality, or the
 * configured assumed quality when none was observed.</li>
 * </ol>
 *
 * <p>
 * Instances are thread-safe: the only shared mutable state is the history
 * store.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentPipeline.class);

    private final CorrelationGraphEngine correlationEngine;
    private final ExponentialForecaster forecaster;
    private final FailureRiskAssessor riskAssessor;
    private final AdaptiveSelectionLearner learner;
    private final SpecialistSelector selector;
    private final LearningSettings learningSettings;

    /**
     * Creates a pipeline backed by an in-memory history store.
     */
    public IncidentPipeline(AnalyticsConfig config) {
        this(config, new InMemorySelectionHistoryStore(config.getLearning().getMaxObservationsPerSignature()));
    }

    public IncidentPipeline(AnalyticsConfig config, SelectionHistoryStore store) {
        this(config, store, Clock.systemUTC());
    }

    public IncidentPipeline(AnalyticsConfig config, SelectionHistoryStore store, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.learningSettings = config.getLearning().copy();
        this.correlationEngine = new CorrelationGraphEngine(config.getCorrelation());
        this.forecaster = new ExponentialForecaster(config.getForecast(), clock);
        this.riskAssessor = new FailureRiskAssessor();
        this.learner = new AdaptiveSelectionLearner(store, learningSettings, clock);
        this.selector = new SpecialistSelector(learner, learningSettings);
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Analyzes the incident and records the outcome in one step.
     *
     * @param request the incident
     * @return the analysis report
     * @throws com.opsforge.core.model.MalformedInputException if the incident
     *                                                         data is malformed
     */
    public IncidentReport process(IncidentRequest request) {
        IncidentReport report = analyze(request);
        record(report);
        return report;
    }

    /**
     * Runs every stage except recording. The learner is read but not written,
     * so a caller that abandons the report leaves no trace in the history.
     *
     * @param request the incident
     * @return the analysis report, not yet recorded
     * @throws com.opsforge.core.model.MalformedInputException if the incident
     *                                                         data is malformed
     */
    public IncidentReport analyze(IncidentRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        LOG.debug("Analyzing incident {}", request.getIncidentId());

        CorrelationResult correlation = correlationEngine.correlate(request.getAlerts());

        ForecastSummary forecast = null;
        RiskAssessment risk = null;
        if (!request.getMetrics().isEmpty()) {
            forecast = forecaster.summarize(request.getMetrics());
            risk = riskAssessor.assess(request.getMetrics());
        }

        IncidentSignature signature = SignatureExtractor.extract(request.getAlerts());
        Map<String, Integer> scores = request.getRelevanceScores().isEmpty()
                ? KeywordRelevanceScorer.fallbackScores(request.getAlerts(), request.getMetrics())
                : request.getRelevanceScores();
        SpecialistSelection selection = selector.select(signature, scores, learningSettings.getBaseThreshold());

        double quality = request.getObservedQuality() != null
                ? request.getObservedQuality()
                : learningSettings.getAssumedOutcomeQuality();

        LOG.info("Incident {} correlated to '{}' ({} suppressed), specialists {}",
                request.getIncidentId(), correlation.getPrimaryAlertId(),
                correlation.getSuppressedCount(), selection.getAgents());
        return new IncidentReport(request.getIncidentId(), correlation, forecast, risk, selection,
                signature, quality);
    }

    /**
     * Records the report's selection and outcome quality against its signature.
     *
     * @param report a report produced by {@link #analyze(IncidentRequest)}
     */
    public void record(IncidentReport report) {
        Objects.requireNonNull(report, "report must not be null");
        learner.recordOutcome(report.getSignature(), report.getSelection().getAgents(),
                report.getRecordedQuality());
    }

    /**
     * @return the learner backing this pipeline
     */
    public AdaptiveSelectionLearner getLearner() {
        return learner;
    }
}
