package com.opsforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One recorded incident outcome: which specialists were engaged and how well
 * the incident resolved.
 *
 * <p>
 * Immutable. The agent set is stored sorted so that two observations with the
 * same specialists compare equal regardless of the order they were supplied in.
 * </p>
 *
 * @since 1.0.0
 */
public final class SelectionObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SortedSet<String> agentSet;
    private final double outcomeQuality;
    private final Instant observedAt;

    /**
     * @param agents         specialists engaged; must not be empty
     * @param outcomeQuality resolution quality in [0, 1]
     * @param observedAt     when the outcome was recorded
     * @throws MalformedInputException if the agent set is empty or the quality is out of range
     */
    public SelectionObservation(Collection<String> agents, double outcomeQuality, Instant observedAt) {
        Objects.requireNonNull(agents, "agents must not be null");
        if (agents.isEmpty()) {
            throw new MalformedInputException("Agent set must not be empty");
        }
        if (Double.isNaN(outcomeQuality) || outcomeQuality < 0.0 || outcomeQuality > 1.0) {
            throw new MalformedInputException("outcomeQuality must be in [0, 1], got: " + outcomeQuality);
        }
        this.agentSet = Collections.unmodifiableSortedSet(new TreeSet<>(agents));
        this.outcomeQuality = outcomeQuality;
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
    }

    public SortedSet<String> getAgentSet() {
        return agentSet;
    }

    public double getOutcomeQuality() {
        return outcomeQuality;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SelectionObservation that))
            return false;
        return Double.compare(outcomeQuality, that.outcomeQuality) == 0
                && agentSet.equals(that.agentSet)
                && observedAt.equals(that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentSet, outcomeQuality, observedAt);
    }

    @Override
    public String toString() {
        return "SelectionObservation{agents=" + agentSet
                + ", quality=" + outcomeQuality
                + ", observedAt=" + observedAt + '}';
    }
}
