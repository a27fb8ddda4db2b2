package com.opsforge.core.learning;

import com.opsforge.core.config.LearningSettings;
import com.opsforge.core.model.IncidentSignature;
import com.opsforge.core.model.MalformedInputException;
import com.opsforge.core.model.SelectionObservation;
import com.opsforge.core.stats.TimeseriesStats;
import com.opsforge.core.store.SelectionHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Learns which specialist sets resolve incidents of a given signature well.
 *
 * <h3>Learning model</h3>
 * <p>
 * Every resolved incident is recorded as a {@link SelectionObservation} under
 * its signature key. {@link #suggest(IncidentSignature)} averages outcome
 * quality per distinct specialist set and proposes the best one once enough
 * history exists. {@link #adjustThreshold(IncidentSignature, int)} nudges the
 * relevance threshold down when a signature has historically resolved well
 * (engage more specialists cheaply) and up when it has resolved poorly.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * The learner keeps no state of its own; concurrency is delegated to the
 * {@link SelectionHistoryStore}. Readers see a consistent snapshot of each
 * bucket.
 * </p>
 *
 * @since 1.0.0
 */
public class AdaptiveSelectionLearner {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveSelectionLearner.class);

    static final int MIN_BASE_THRESHOLD = 0;
    static final int MAX_BASE_THRESHOLD = 100;

    private final SelectionHistoryStore store;
    private final LearningSettings settings;
    private final Clock clock;

    /**
     * @throws IllegalStateException if the settings are invalid
     */
    public AdaptiveSelectionLearner(SelectionHistoryStore store, LearningSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null").copy();
        this.settings.validate();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Records how an incident with {@code signature} resolved.
     *
     * @throws MalformedInputException if {@code agentsUsed} is empty or the
     *                                 quality lies outside [0, 1]
     */
    public void recordOutcome(IncidentSignature signature, Collection<String> agentsUsed, double outcomeQuality) {
        Objects.requireNonNull(signature, "signature must not be null");
        SelectionObservation observation = new SelectionObservation(agentsUsed, outcomeQuality, clock.instant());
        store.appendHistory(signature.getKey(), observation);
        LOG.debug("Recorded outcome {} for signature '{}' with {}",
                outcomeQuality, signature.getKey(), observation.getAgentSet());
    }

    public Optional<SpecialistSuggestion> suggest(IncidentSignature signature) {
        return suggest(signature, settings.getSuggestionMinObservations());
    }

    /**
     * Proposes the specialist set with the highest average outcome quality.
     *
     * <p>
     * Sets are compared in the order they were first observed; a later set
     * must be strictly better to win. Nothing is suggested when fewer than
     * {@code minObservations} outcomes are on record or when the best average
     * is below the configured suggestion floor.
     * </p>
     *
     * @param signature       the incident signature
     * @param minObservations history required before suggesting
     * @return the suggestion, or empty
     */
    public Optional<SpecialistSuggestion> suggest(IncidentSignature signature, int minObservations) {
        Objects.requireNonNull(signature, "signature must not be null");
        List<SelectionObservation> history = store.getHistory(signature.getKey());
        if (history.isEmpty() || history.size() < minObservations) {
            return Optional.empty();
        }

        Map<SortedSet<String>, List<Double>> byAgentSet = new LinkedHashMap<>();
        for (SelectionObservation observation : history) {
            byAgentSet.computeIfAbsent(observation.getAgentSet(), k -> new ArrayList<>())
                    .add(observation.getOutcomeQuality());
        }

        SortedSet<String> best = null;
        double bestAverage = 0.0;
        for (Map.Entry<SortedSet<String>, List<Double>> entry : byAgentSet.entrySet()) {
            double average = average(entry.getValue());
            if (best == null || average > bestAverage) {
                best = entry.getKey();
                bestAverage = average;
            }
        }

        if (bestAverage < settings.getSuggestionConfidenceFloor()) {
            LOG.debug("No suggestion for '{}': best average {} below floor", signature.getKey(), bestAverage);
            return Optional.empty();
        }
        return Optional.of(new SpecialistSuggestion(
                new ArrayList<>(best), bestAverage, history.size(), signature.getKeywords()));
    }

    public int adjustThreshold(IncidentSignature signature, int baseThreshold) {
        return adjustThreshold(signature, baseThreshold, settings.getThresholdMinObservations());
    }

    /**
     * Returns {@code baseThreshold} nudged by the signature's historical
     * outcome quality.
     *
     * <p>
     * With at least {@code minObservations} outcomes on record, an average at
     * or above the high-quality mark lowers the threshold by one step and an
     * average at or below the low-quality mark raises it by one step. The
     * result always lies within the configured floor and ceiling.
     * </p>
     *
     * @throws MalformedInputException if {@code baseThreshold} is outside [0, 100]
     */
    public int adjustThreshold(IncidentSignature signature, int baseThreshold, int minObservations) {
        Objects.requireNonNull(signature, "signature must not be null");
        if (baseThreshold < MIN_BASE_THRESHOLD || baseThreshold > MAX_BASE_THRESHOLD) {
            throw new MalformedInputException("baseThreshold must be in [0, 100], got: " + baseThreshold);
        }

        int threshold = baseThreshold;
        List<SelectionObservation> history = store.getHistory(signature.getKey());
        if (!history.isEmpty() && history.size() >= minObservations) {
            double average = average(history.stream().map(SelectionObservation::getOutcomeQuality).toList());
            if (average >= settings.getHighQualityMark()) {
                threshold = baseThreshold - settings.getThresholdStep();
            } else if (average <= settings.getLowQualityMark()) {
                threshold = baseThreshold + settings.getThresholdStep();
            }
            LOG.debug("Signature '{}' average quality {} over {} outcomes", signature.getKey(), average, history.size());
        }
        return (int) TimeseriesStats.clamp(threshold, settings.getThresholdFloor(), settings.getThresholdCeiling());
    }

    // -------------------------------------------------------------------------
    // Internal
    // -------------------------------------------------------------------------

    private static double average(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
