package com.opsforge.core.learning;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Catalog of the specialists that can be engaged on an incident, with the
 * keywords that make each one relevant.
 *
 * @since 1.0.0
 */
public enum SpecialistCapability {

    ALERT_OPS("AlertOps", "Alert correlation and noise reduction",
            List.of("alert", "correlation", "duplicate", "similar", "related", "cluster")),

    PREDICTIVE_OPS("PredictiveOps", "Metric trend forecasting",
            List.of("trend", "forecast", "predict", "spike", "increase", "pattern", "metric", "usage")),

    PATCH_OPS("PatchOps", "Patch and update management",
            List.of("patch", "update", "kb", "hotfix", "version", "upgrade", "reboot", "install")),

    TASK_OPS("TaskOps", "Routine task automation",
            List.of("automate", "task", "workflow", "restart", "cleanup", "reset", "routine"));

    private final String agentName;
    private final String expertise;
    private final List<String> keywords;

    SpecialistCapability(String agentName, String expertise, List<String> keywords) {
        this.agentName = agentName;
        this.expertise = expertise;
        this.keywords = keywords;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getExpertise() {
        return expertise;
    }

    /**
     * @return lower-case trigger keywords
     */
    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * @return the capability registered under {@code agentName}, if any
     */
    public static Optional<SpecialistCapability> forAgent(String agentName) {
        if (agentName == null) {
            return Optional.empty();
        }
        for (SpecialistCapability capability : values()) {
            if (capability.agentName.equalsIgnoreCase(agentName.trim())) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    boolean mentionedIn(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
