package com.opsforge.core.forecast;

/**
 * Coarse resource-exhaustion risk.
 *
 * @since 1.0.0
 */
public enum RiskLevel {
    /** Not enough data to judge. */
    UNKNOWN,
    LOW,
    MEDIUM,
    HIGH
}
