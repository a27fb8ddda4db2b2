package com.opsforge.core.learning;

import com.opsforge.core.model.AlertRecord;
import com.opsforge.core.model.MetricPoint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Heuristic relevance scores used when no external scorer supplied any.
 *
 * @since 1.0.0
 */
public final class KeywordRelevanceScorer {

    static final int ALERT_KEYWORD_POINTS = 5;
    static final int METRIC_KEYWORD_POINTS = 3;
    static final int METRIC_SAMPLE_SIZE = 10;
    static final int MAX_KEYWORD_SCORE = 40;

    static final int CORRELATION_SCORE_MANY = 85;
    static final int CORRELATION_SCORE_SINGLE = 70;
    static final int FORECAST_SCORE_RICH = 75;
    static final int FORECAST_SCORE_SPARSE = 30;
    static final int FORECAST_MIN_POINTS = 10;

    private KeywordRelevanceScorer() {
        // utility class, not instantiable
    }

    /**
     * Scores how strongly the incident text mentions the keywords of
     * {@code agentName}.
     *
     * <p>
     * Each alert whose title or description contains any of the agent's
     * keywords adds {@value #ALERT_KEYWORD_POINTS}; each of the first
     * {@value #METRIC_SAMPLE_SIZE} metric points whose name contains one adds
     * {@value #METRIC_KEYWORD_POINTS}. The total is capped at
     * {@value #MAX_KEYWORD_SCORE}. Unknown agents score 0.
     * </p>
     */
    public static int keywordRelevance(String agentName, List<AlertRecord> alerts, List<MetricPoint> metrics) {
        Objects.requireNonNull(alerts, "Alerts must not be null");
        SpecialistCapability capability = SpecialistCapability.forAgent(agentName).orElse(null);
        if (capability == null) {
            return 0;
        }

        int score = 0;
        for (AlertRecord alert : alerts) {
            String description = alert.getDescription() == null ? "" : alert.getDescription();
            if (capability.mentionedIn(alert.getTitle() + " " + description)) {
                score += ALERT_KEYWORD_POINTS;
            }
        }
        if (metrics != null) {
            int limit = Math.min(metrics.size(), METRIC_SAMPLE_SIZE);
            for (int i = 0; i < limit; i++) {
                if (capability.mentionedIn(metrics.get(i).getMetricName())) {
                    score += METRIC_KEYWORD_POINTS;
                }
            }
        }
        return Math.min(score, MAX_KEYWORD_SCORE);
    }

    /**
     * @return relevance per specialist, in catalog order
     */
    public static Map<String, Integer> fallbackScores(List<AlertRecord> alerts, List<MetricPoint> metrics) {
        Objects.requireNonNull(alerts, "Alerts must not be null");
        int metricCount = metrics == null ? 0 : metrics.size();

        Map<String, Integer> scores = new LinkedHashMap<>();
        scores.put(SpecialistCapability.ALERT_OPS.getAgentName(),
                alerts.size() > 1 ? CORRELATION_SCORE_MANY : CORRELATION_SCORE_SINGLE);
        scores.put(SpecialistCapability.PREDICTIVE_OPS.getAgentName(),
                metricCount > FORECAST_MIN_POINTS ? FORECAST_SCORE_RICH : FORECAST_SCORE_SPARSE);
        scores.put(SpecialistCapability.PATCH_OPS.getAgentName(),
                keywordRelevance(SpecialistCapability.PATCH_OPS.getAgentName(), alerts, metrics));
        scores.put(SpecialistCapability.TASK_OPS.getAgentName(),
                keywordRelevance(SpecialistCapability.TASK_OPS.getAgentName(), alerts, metrics));
        return scores;
    }
}
