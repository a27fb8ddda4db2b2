/**
 * Adaptive specialist selection.
 *
 * <p>
 * Incidents are bucketed by an {@link com.opsforge.core.model.IncidentSignature}
 * extracted from their leading alert titles.
 * {@link com.opsforge.core.learning.AdaptiveSelectionLearner} records how each
 * incident resolved and turns that history into suggestions and threshold
 * adjustments; {@link com.opsforge.core.learning.SpecialistSelector} applies
 * them.
 * </p>
 *
 * @since 1.0.0
 */
package com.opsforge.core.learning;
