package com.opsforge.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs for the correlation graph.
 *
 * <p>
 * A pair of alerts is joined by an edge when the sum of its signal weights is
 * <strong>strictly greater</strong> than {@code edgeThreshold}.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private double edgeThreshold = 0.5;
    private double sameHostWeight = 0.4;
    private double timeProximityWeight = 0.3;
    /** Maximum absolute timestamp difference, inclusive, for the time signal. */
    private long timeWindowSeconds = 60;
    /** Weight per shared title keyword. */
    private double keywordMatchWeight = 0.1;
    private double keywordWeightCap = 0.3;
    private double clusterConfidence = 0.85;
    private double unrelatedConfidence = 0.3;

    /**
     * @throws IllegalStateException if any weight is negative, a confidence is
     *                               outside [0, 1], or the window is negative
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        requireNonNegative(errors, "edgeThreshold", edgeThreshold);
        requireNonNegative(errors, "sameHostWeight", sameHostWeight);
        requireNonNegative(errors, "timeProximityWeight", timeProximityWeight);
        requireNonNegative(errors, "keywordMatchWeight", keywordMatchWeight);
        requireNonNegative(errors, "keywordWeightCap", keywordWeightCap);
        if (timeWindowSeconds < 0) {
            errors.add("timeWindowSeconds must be >= 0, got: " + timeWindowSeconds);
        }
        requireUnit(errors, "clusterConfidence", clusterConfidence);
        requireUnit(errors, "unrelatedConfidence", unrelatedConfidence);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid correlation settings: " + String.join("; ", errors));
        }
    }

    /**
     * @return an independent copy, so later setter calls on this instance do
     *         not reach components built from the copy
     */
    public CorrelationSettings copy() {
        CorrelationSettings copy = new CorrelationSettings();
        copy.edgeThreshold = edgeThreshold;
        copy.sameHostWeight = sameHostWeight;
        copy.timeProximityWeight = timeProximityWeight;
        copy.timeWindowSeconds = timeWindowSeconds;
        copy.keywordMatchWeight = keywordMatchWeight;
        copy.keywordWeightCap = keywordWeightCap;
        copy.clusterConfidence = clusterConfidence;
        copy.unrelatedConfidence = unrelatedConfidence;
        return copy;
    }

    static void requireNonNegative(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            errors.add(name + " must be >= 0, got: " + value);
        }
    }

    static void requireUnit(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            errors.add(name + " must be in [0, 1], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getEdgeThreshold() {
        return edgeThreshold;
    }

    public void setEdgeThreshold(double edgeThreshold) {
        this.edgeThreshold = edgeThreshold;
    }

    public double getSameHostWeight() {
        return sameHostWeight;
    }

    public void setSameHostWeight(double sameHostWeight) {
        this.sameHostWeight = sameHostWeight;
    }

    public double getTimeProximityWeight() {
        return timeProximityWeight;
    }

    public void setTimeProximityWeight(double timeProximityWeight) {
        this.timeProximityWeight = timeProximityWeight;
    }

    public long getTimeWindowSeconds() {
        return timeWindowSeconds;
    }

    public void setTimeWindowSeconds(long timeWindowSeconds) {
        this.timeWindowSeconds = timeWindowSeconds;
    }

    public double getKeywordMatchWeight() {
        return keywordMatchWeight;
    }

    public void setKeywordMatchWeight(double keywordMatchWeight) {
        this.keywordMatchWeight = keywordMatchWeight;
    }

    public double getKeywordWeightCap() {
        return keywordWeightCap;
    }

    public void setKeywordWeightCap(double keywordWeightCap) {
        this.keywordWeightCap = keywordWeightCap;
    }

    public double getClusterConfidence() {
        return clusterConfidence;
    }

    public void setClusterConfidence(double clusterConfidence) {
        this.clusterConfidence = clusterConfidence;
    }

    public double getUnrelatedConfidence() {
        return unrelatedConfidence;
    }

    public void setUnrelatedConfidence(double unrelatedConfidence) {
        this.unrelatedConfidence = unrelatedConfidence;
    }

    @Override
    public String toString() {
        return "CorrelationSettings{" +
                "edgeThreshold=" + edgeThreshold +
                ", sameHostWeight=" + sameHostWeight +
                ", timeProximityWeight=" + timeProximityWeight +
                ", timeWindowSeconds=" + timeWindowSeconds +
                ", keywordMatchWeight=" + keywordMatchWeight +
                ", keywordWeightCap=" + keywordWeightCap +
                '}';
    }
}
