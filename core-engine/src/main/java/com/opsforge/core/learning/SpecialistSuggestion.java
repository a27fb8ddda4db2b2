package com.opsforge.core.learning;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A specialist set the learner recommends for a signature, with the average
 * outcome quality it achieved.
 *
 * @since 1.0.0
 */
public final class SpecialistSuggestion implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> agents;
    private final double confidence;
    private final int basedOnIncidents;
    private final List<String> keywords;

    public SpecialistSuggestion(List<String> agents, double confidence, int basedOnIncidents, List<String> keywords) {
        this.agents = Collections.unmodifiableList(new ArrayList<>(agents));
        this.confidence = confidence;
        this.basedOnIncidents = basedOnIncidents;
        this.keywords = Collections.unmodifiableList(new ArrayList<>(keywords));
    }

    /**
     * @return the recommended specialists, sorted by name
     */
    public List<String> getAgents() {
        return agents;
    }

    /**
     * @return average outcome quality of this set, in [0, 1]
     */
    public double getConfidence() {
        return confidence;
    }

    /**
     * @return number of observations recorded for the signature
     */
    public int getBasedOnIncidents() {
        return basedOnIncidents;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpecialistSuggestion that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && basedOnIncidents == that.basedOnIncidents
                && agents.equals(that.agents)
                && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agents, confidence, basedOnIncidents, keywords);
    }

    @Override
    public String toString() {
        return "SpecialistSuggestion{agents=" + agents
                + ", confidence=" + confidence
                + ", basedOnIncidents=" + basedOnIncidents + '}';
    }
}
