package com.opsforge.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of a batch output document.
 */
public final class IncidentBatchResult {

    private final Instant generatedAt;
    private final List<IncidentOutcome> outcomes;

    public IncidentBatchResult(Instant generatedAt, List<IncidentOutcome> outcomes) {
        this.generatedAt = generatedAt;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public int getProcessed() {
        return outcomes.size();
    }

    public long getFailed() {
        return outcomes.stream().filter(o -> o.getStatus() == IncidentOutcome.Status.FAILED).count();
    }

    /**
     * @return outcomes in input order
     */
    public List<IncidentOutcome> getOutcomes() {
        return outcomes;
    }
}
