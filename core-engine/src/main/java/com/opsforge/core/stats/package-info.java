/**
 * Shared numeric helpers: mean, population variance, z-scores and smoothing
 * constant validation.
 *
 * @since 1.0.0
 */
package com.opsforge.core.stats;
