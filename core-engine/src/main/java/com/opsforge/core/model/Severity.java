package com.opsforge.core.model;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value severity name, e.g. {@code "critical"}
     * @return the matching severity
     * @throws MalformedInputException if {@code value} is blank or unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedInputException("Severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("Unknown severity: '" + value
                    + "'. Supported: info, low, medium, high, critical", e);
        }
    }
}
