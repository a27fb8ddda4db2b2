/**
 * Alert correlation.
 *
 * <p>
 * {@link com.opsforge.core.correlation.CorrelationGraphEngine} builds a
 * weighted similarity graph over a batch of alerts and reports the largest
 * connected component as the incident, with its earliest alert as the root
 * cause.
 * </p>
 *
 * @since 1.0.0
 */
package com.opsforge.core.correlation;
