package com.opsforge.core.learning;

/**
 * How a {@link SpecialistSelection} was arrived at.
 *
 * @since 1.0.0
 */
public enum SelectionSource {
    /** A high-confidence learned suggestion was used as-is. */
    LEARNED,
    /** Specialists were chosen by relevance score against an adjusted threshold. */
    SCORED
}
