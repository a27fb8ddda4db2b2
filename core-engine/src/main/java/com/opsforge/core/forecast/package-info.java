/**
 * Metric forecasting and anomaly scoring.
 *
 * <ul>
 * <li>{@link com.opsforge.core.forecast.HoltLinearModel}: level + trend
 * smoother for one series</li>
 * <li>{@link com.opsforge.core.forecast.ExponentialForecaster}: groups
 * (host, metric) streams, forecasts each and ranks anomalies</li>
 * <li>{@link com.opsforge.core.forecast.FailureRiskAssessor}: CPU/memory
 * saturation check</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.opsforge.core.forecast;
