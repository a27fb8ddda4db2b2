package com.opsforge.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the adaptive specialist-selection learner.
 *
 * <p>
 * Two different history minimums apply: a suggestion needs
 * {@code suggestionMinObservations} outcomes, a threshold adjustment needs
 * {@code thresholdMinObservations}.
 * </p>
 *
 * @since 1.0.0
 */
public class LearningSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int suggestionMinObservations = 3;
    private int thresholdMinObservations = 5;
    /** Minimum average quality an agent set needs to be suggested. */
    private double suggestionConfidenceFloor = 0.7;
    /** Suggestions at or above this confidence replace score-based selection. */
    private double overrideConfidence = 0.85;
    private double highQualityMark = 0.75;
    private double lowQualityMark = 0.4;
    private int thresholdFloor = 50;
    private int thresholdCeiling = 85;
    private int thresholdStep = 5;
    private int baseThreshold = 60;
    /** Quality recorded when the caller did not observe the real outcome. */
    private double assumedOutcomeQuality = 0.8;
    /** Oldest observations are evicted beyond this count; 0 keeps everything. */
    private int maxObservationsPerSignature = 1000;
    private String coordinatorAgent = "Orchestrator";
    private String baselineAgent = "AlertOps";

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (suggestionMinObservations < 1) {
            errors.add("suggestionMinObservations must be >= 1, got: " + suggestionMinObservations);
        }
        if (thresholdMinObservations < 1) {
            errors.add("thresholdMinObservations must be >= 1, got: " + thresholdMinObservations);
        }
        CorrelationSettings.requireUnit(errors, "suggestionConfidenceFloor", suggestionConfidenceFloor);
        CorrelationSettings.requireUnit(errors, "overrideConfidence", overrideConfidence);
        CorrelationSettings.requireUnit(errors, "highQualityMark", highQualityMark);
        CorrelationSettings.requireUnit(errors, "lowQualityMark", lowQualityMark);
        CorrelationSettings.requireUnit(errors, "assumedOutcomeQuality", assumedOutcomeQuality);
        if (lowQualityMark >= highQualityMark) {
            errors.add("lowQualityMark must be < highQualityMark, got: "
                    + lowQualityMark + " >= " + highQualityMark);
        }
        if (thresholdFloor < 0 || thresholdCeiling > 100 || thresholdFloor > thresholdCeiling) {
            errors.add("threshold bounds must satisfy 0 <= floor <= ceiling <= 100, got: ["
                    + thresholdFloor + ", " + thresholdCeiling + "]");
        }
        if (thresholdStep < 0) {
            errors.add("thresholdStep must be >= 0, got: " + thresholdStep);
        }
        if (baseThreshold < 0 || baseThreshold > 100) {
            errors.add("baseThreshold must be in [0, 100], got: " + baseThreshold);
        }
        if (maxObservationsPerSignature < 0) {
            errors.add("maxObservationsPerSignature must be >= 0, got: " + maxObservationsPerSignature);
        }
        if (coordinatorAgent == null || coordinatorAgent.isBlank()) {
            errors.add("coordinatorAgent must not be blank");
        }
        if (baselineAgent == null || baselineAgent.isBlank()) {
            errors.add("baselineAgent must not be blank");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid learning settings: " + String.join("; ", errors));
        }
    }

    /**
     * @return an independent copy, so later setter calls on this instance do
     *         not reach components built from the copy
     */
    public LearningSettings copy() {
        LearningSettings copy = new LearningSettings();
        copy.suggestionMinObservations = suggestionMinObservations;
        copy.thresholdMinObservations = thresholdMinObservations;
        copy.suggestionConfidenceFloor = suggestionConfidenceFloor;
        copy.overrideConfidence = overrideConfidence;
        copy.highQualityMark = highQualityMark;
        copy.lowQualityMark = lowQualityMark;
        copy.thresholdFloor = thresholdFloor;
        copy.thresholdCeiling = thresholdCeiling;
        copy.thresholdStep = thresholdStep;
        copy.baseThreshold = baseThreshold;
        copy.assumedOutcomeQuality = assumedOutcomeQuality;
        copy.maxObservationsPerSignature = maxObservationsPerSignature;
        copy.coordinatorAgent = coordinatorAgent;
        copy.baselineAgent = baselineAgent;
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getSuggestionMinObservations() {
        return suggestionMinObservations;
    }

    public void setSuggestionMinObservations(int suggestionMinObservations) {
        this.suggestionMinObservations = suggestionMinObservations;
    }

    public int getThresholdMinObservations() {
        return thresholdMinObservations;
    }

    public void setThresholdMinObservations(int thresholdMinObservations) {
        this.thresholdMinObservations = thresholdMinObservations;
    }

    public double getSuggestionConfidenceFloor() {
        return suggestionConfidenceFloor;
    }

    public void setSuggestionConfidenceFloor(double suggestionConfidenceFloor) {
        this.suggestionConfidenceFloor = suggestionConfidenceFloor;
    }

    public double getOverrideConfidence() {
        return overrideConfidence;
    }

    public void setOverrideConfidence(double overrideConfidence) {
        this.overrideConfidence = overrideConfidence;
    }

    public double getHighQualityMark() {
        return highQualityMark;
    }

    public void setHighQualityMark(double highQualityMark) {
        this.highQualityMark = highQualityMark;
    }

    public double getLowQualityMark() {
        return lowQualityMark;
    }

    public void setLowQualityMark(double lowQualityMark) {
        this.lowQualityMark = lowQualityMark;
    }

    public int getThresholdFloor() {
        return thresholdFloor;
    }

    public void setThresholdFloor(int thresholdFloor) {
        this.thresholdFloor = thresholdFloor;
    }

    public int getThresholdCeiling() {
        return thresholdCeiling;
    }

    public void setThresholdCeiling(int thresholdCeiling) {
        this.thresholdCeiling = thresholdCeiling;
    }

    public int getThresholdStep() {
        return thresholdStep;
    }

    public void setThresholdStep(int thresholdStep) {
        this.thresholdStep = thresholdStep;
    }

    public int getBaseThreshold() {
        return baseThreshold;
    }

    public void setBaseThreshold(int baseThreshold) {
        this.baseThreshold = baseThreshold;
    }

    public double getAssumedOutcomeQuality() {
        return assumedOutcomeQuality;
    }

    public void setAssumedOutcomeQuality(double assumedOutcomeQuality) {
        this.assumedOutcomeQuality = assumedOutcomeQuality;
    }

    public int getMaxObservationsPerSignature() {
        return maxObservationsPerSignature;
    }

    public void setMaxObservationsPerSignature(int maxObservationsPerSignature) {
        this.maxObservationsPerSignature = maxObservationsPerSignature;
    }

    public String getCoordinatorAgent() {
        return coordinatorAgent;
    }

    public void setCoordinatorAgent(String coordinatorAgent) {
        this.coordinatorAgent = coordinatorAgent;
    }

    public String getBaselineAgent() {
        return baselineAgent;
    }

    public void setBaselineAgent(String baselineAgent) {
        this.baselineAgent = baselineAgent;
    }

    @Override
    public String toString() {
        return "LearningSettings{" +
                "suggestionMinObservations=" + suggestionMinObservations +
                ", thresholdMinObservations=" + thresholdMinObservations +
                ", suggestionConfidenceFloor=" + suggestionConfidenceFloor +
                ", thresholdBounds=[" + thresholdFloor + ", " + thresholdCeiling + "]" +
                ", thresholdStep=" + thresholdStep +
                ", maxObservationsPerSignature=" + maxObservationsPerSignature +
                '}';
    }
}
