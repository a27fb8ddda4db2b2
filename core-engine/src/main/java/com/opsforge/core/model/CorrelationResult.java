package com.opsforge.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of correlating one batch of alerts.
 *
 * <p>
 * {@code confidence} is a coarse, explainable label (0.85 for an edge-backed
 * cluster, 0.3 for unrelated alerts, 1.0 for trivial input). It is not a
 * calibrated probability.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String primaryAlertId;
    private final List<String> relatedAlertIds;
    private final double confidence;
    private final String rootCause;
    private final List<String> reasoning;
    private final int suppressedCount;

    /**
     * @param primaryAlertId  id of the root-cause alert, or {@code null} for empty input
     * @param relatedAlertIds ids of the remaining cluster members, in timestamp order
     * @param confidence      confidence label in [0, 1]
     * @param rootCause       short description of the root cause
     * @param reasoning       human-readable reasoning trail
     * @param suppressedCount number of alerts that can be suppressed as duplicates
     */
    public CorrelationResult(String primaryAlertId, List<String> relatedAlertIds, double confidence,
                             String rootCause, List<String> reasoning, int suppressedCount) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
        this.primaryAlertId = primaryAlertId;
        this.relatedAlertIds = Collections.unmodifiableList(new ArrayList<>(relatedAlertIds));
        this.confidence = confidence;
        this.rootCause = Objects.requireNonNull(rootCause, "rootCause must not be null");
        this.reasoning = Collections.unmodifiableList(new ArrayList<>(reasoning));
        this.suppressedCount = suppressedCount;
    }

    /**
     * @return the primary alert id, or {@code null} when no alerts were supplied
     */
    public String getPrimaryAlertId() {
        return primaryAlertId;
    }

    public List<String> getRelatedAlertIds() {
        return relatedAlertIds;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getRootCause() {
        return rootCause;
    }

    public List<String> getReasoning() {
        return reasoning;
    }

    public int getSuppressedCount() {
        return suppressedCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationResult that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && suppressedCount == that.suppressedCount
                && Objects.equals(primaryAlertId, that.primaryAlertId)
                && relatedAlertIds.equals(that.relatedAlertIds)
                && rootCause.equals(that.rootCause)
                && reasoning.equals(that.reasoning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryAlertId, relatedAlertIds, confidence, rootCause, reasoning, suppressedCount);
    }

    @Override
    public String toString() {
        return "CorrelationResult{" +
                "primaryAlertId='" + primaryAlertId + '\'' +
                ", relatedAlertIds=" + relatedAlertIds +
                ", confidence=" + confidence +
                ", rootCause='" + rootCause + '\'' +
                ", suppressedCount=" + suppressedCount +
                '}';
    }
}
