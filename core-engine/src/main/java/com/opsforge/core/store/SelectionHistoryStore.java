package com.opsforge.core.store;

import com.opsforge.core.model.SelectionObservation;

import java.util.List;

/**
 * Keyed history of specialist-selection outcomes.
 *
 * <p>
 * Implementations must be safe for concurrent use: an append is atomic with
 * respect to reads of the same key, and {@link #getHistory(String)} returns a
 * snapshot that later appends do not affect.
 * </p>
 *
 * @since 1.0.0
 */
public interface SelectionHistoryStore {

    /**
     * @param key signature key
     * @return observations for {@code key}, oldest first; empty if none were recorded
     */
    List<SelectionObservation> getHistory(String key);

    /**
     * Appends {@code observation} to the history of {@code key}, creating the
     * bucket on first use.
     */
    void appendHistory(String key, SelectionObservation observation);
}
