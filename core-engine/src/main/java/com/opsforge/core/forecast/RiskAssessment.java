package com.opsforge.core.forecast;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Overall resource-exhaustion risk across a batch of metric series.
 *
 * @since 1.0.0
 */
public final class RiskAssessment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final RiskLevel level;
    private final double confidence;
    private final List<RiskConcern> concerns;
    private final List<String> reasoning;

    public RiskAssessment(RiskLevel level, double confidence, List<RiskConcern> concerns, List<String> reasoning) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.confidence = confidence;
        this.concerns = Collections.unmodifiableList(new ArrayList<>(concerns));
        this.reasoning = Collections.unmodifiableList(new ArrayList<>(reasoning));
    }

    public RiskLevel getLevel() {
        return level;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<RiskConcern> getConcerns() {
        return concerns;
    }

    public List<String> getReasoning() {
        return reasoning;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RiskAssessment that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && level == that.level
                && concerns.equals(that.concerns)
                && reasoning.equals(that.reasoning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, confidence, concerns, reasoning);
    }

    @Override
    public String toString() {
        return "RiskAssessment{level=" + level + ", confidence=" + confidence + ", concerns=" + concerns + '}';
    }
}
