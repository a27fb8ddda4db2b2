/**
 * Configuration loading and validation for the analytics core.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.opsforge.core.config.AnalyticsConfigLoader} into an
 * {@link com.opsforge.core.config.AnalyticsConfig} instance. Validation is
 * performed automatically after parsing so misconfiguration fails fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.opsforge.core.config;
