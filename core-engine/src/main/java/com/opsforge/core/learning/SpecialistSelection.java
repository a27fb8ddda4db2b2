package com.opsforge.core.learning;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Specialists chosen for one incident.
 *
 * @since 1.0.0
 */
public final class SpecialistSelection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> agents;
    private final int threshold;
    private final SelectionSource source;
    private final SpecialistSuggestion suggestion;

    public SpecialistSelection(List<String> agents, int threshold, SelectionSource source,
            SpecialistSuggestion suggestion) {
        this.agents = Collections.unmodifiableList(new ArrayList<>(agents));
        this.threshold = threshold;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.suggestion = suggestion;
    }

    public List<String> getAgents() {
        return agents;
    }

    /**
     * @return the relevance threshold applied; for learned selections, the
     *         unadjusted base threshold
     */
    public int getThreshold() {
        return threshold;
    }

    public SelectionSource getSource() {
        return source;
    }

    /**
     * @return the learner's suggestion, or {@code null} if it had none
     */
    public SpecialistSuggestion getSuggestion() {
        return suggestion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpecialistSelection that))
            return false;
        return threshold == that.threshold
                && agents.equals(that.agents)
                && source == that.source
                && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agents, threshold, source, suggestion);
    }

    @Override
    public String toString() {
        return "SpecialistSelection{agents=" + agents + ", threshold=" + threshold + ", source=" + source + '}';
    }
}
