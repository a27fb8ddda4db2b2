package com.opsforge.core.learning;

import com.opsforge.core.config.LearningSettings;
import com.opsforge.core.model.IncidentSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses which specialists to engage for an incident.
 *
 * <h3>Selection order</h3>
 * <ol>
 * <li>If the learner has a suggestion for the signature whose confidence
 * reaches the override level, that set is returned unchanged.</li>
 * <li>Otherwise the base threshold is adjusted by the learner and the
 * coordinator is combined with every specialist scoring at or above it, in
 * score-map order.</li>
 * <li>If no specialist qualified, the baseline specialist is added so that
 * every incident gets at least one.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class SpecialistSelector {

    private static final Logger LOG = LoggerFactory.getLogger(SpecialistSelector.class);

    private final AdaptiveSelectionLearner learner;
    private final LearningSettings settings;

    public SpecialistSelector(AdaptiveSelectionLearner learner, LearningSettings settings) {
        this.learner = Objects.requireNonNull(learner, "learner must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null").copy();
        this.settings.validate();
    }

    /**
     * @param signature       incident signature
     * @param relevanceScores relevance per specialist, iteration order preserved
     * @param baseThreshold   threshold before adjustment, in [0, 100]
     * @return the selection
     */
    public SpecialistSelection select(IncidentSignature signature, Map<String, Integer> relevanceScores,
            int baseThreshold) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(relevanceScores, "relevanceScores must not be null");

        Optional<SpecialistSuggestion> suggestion = learner.suggest(signature);
        if (suggestion.isPresent() && suggestion.get().getConfidence() >= settings.getOverrideConfidence()) {
            LOG.debug("Using learned specialists {} for '{}'", suggestion.get().getAgents(), signature.getKey());
            return new SpecialistSelection(suggestion.get().getAgents(), baseThreshold,
                    SelectionSource.LEARNED, suggestion.get());
        }

        int threshold = learner.adjustThreshold(signature, baseThreshold);
        String coordinator = settings.getCoordinatorAgent();
        List<String> selected = new ArrayList<>();
        selected.add(coordinator);
        for (Map.Entry<String, Integer> entry : relevanceScores.entrySet()) {
            String agent = entry.getKey();
            if (agent == null || agent.equals(coordinator) || entry.getValue() == null) {
                continue;
            }
            if (entry.getValue() >= threshold) {
                selected.add(agent);
            }
        }
        if (selected.size() == 1) {
            selected.add(settings.getBaselineAgent());
        }

        LOG.debug("Selected {} at threshold {} for '{}'", selected, threshold, signature.getKey());
        return new SpecialistSelection(selected, threshold, SelectionSource.SCORED, suggestion.orElse(null));
    }
}
