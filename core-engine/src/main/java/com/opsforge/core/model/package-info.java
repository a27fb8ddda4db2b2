/**
 * Domain model shared by the analytics components and the incident job.
 *
 * <ul>
 * <li>{@link com.opsforge.core.model.AlertRecord} and
 * {@link com.opsforge.core.model.MetricPoint}: typed, immutable inputs</li>
 * <li>{@link com.opsforge.core.model.RawRecord} and
 * {@link com.opsforge.core.model.RecordParser}: loosely-typed ingestion
 * records and their validation</li>
 * <li>{@link com.opsforge.core.model.CorrelationResult},
 * {@link com.opsforge.core.model.ForecastResult},
 * {@link com.opsforge.core.model.ForecastSummary}: analysis outputs</li>
 * <li>{@link com.opsforge.core.model.IncidentSignature} and
 * {@link com.opsforge.core.model.SelectionObservation}: adaptive learning
 * state</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.opsforge.core.model;
