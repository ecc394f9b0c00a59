package com.pfesentinel.core.model;

import java.util.Locale;

/**
 * Operator-facing severity of a detection.
 *
 * <p>
 * Declaration order is the ranking order: {@link #CRITICAL} has rank 0 and
 * {@link #LOW} rank 3. Lower rank means more urgent.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public int rank() {
        return ordinal();
    }

    /**
     * @return the more urgent of the two severities
     */
    public static Severity mostUrgent(Severity a, Severity b) {
        return a.rank() <= b.rank() ? a : b;
    }

    /**
     * Parse a severity name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static Severity parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Severity name must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + name
                    + "'. Supported: CRITICAL, HIGH, MEDIUM, LOW", e);
        }
    }
}
