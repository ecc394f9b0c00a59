package com.pfesentinel.core.config;

import com.pfesentinel.core.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Finite exception-type to severity table with a defined default.
 *
 * <p>
 * Lookups are case-insensitive. Exception types not in the table resolve to
 * the default severity ({@link Severity#LOW} unless configured otherwise).
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityMap {

    private final Map<String, Severity> severities;
    private final Severity defaultSeverity;

    /**
     * @param severities      exception type to severity; must not be {@code null}
     * @param defaultSeverity severity for unmapped types; must not be {@code null}
     */
    public SeverityMap(Map<String, Severity> severities, Severity defaultSeverity) {
        Objects.requireNonNull(severities, "Severity table must not be null");
        this.defaultSeverity = Objects.requireNonNull(defaultSeverity, "Default severity must not be null");
        Map<String, Severity> normalised = new LinkedHashMap<>();
        severities.forEach((type, severity) -> normalised.put(normalise(type),
                Objects.requireNonNull(severity, "Severity for '" + type + "' must not be null")));
        this.severities = Collections.unmodifiableMap(normalised);
    }

    /**
     * @return a map that resolves every exception type to {@link Severity#LOW}
     */
    public static SeverityMap allLow() {
        return new SeverityMap(Map.of(), Severity.LOW);
    }

    public Severity severityOf(String exceptionType) {
        if (exceptionType == null) {
            return defaultSeverity;
        }
        return severities.getOrDefault(normalise(exceptionType), defaultSeverity);
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    public Map<String, Severity> asMap() {
        return severities;
    }

    private static String normalise(String exceptionType) {
        return Objects.requireNonNull(exceptionType, "Exception type must not be null")
                .trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "SeverityMap{default=" + defaultSeverity + ", entries=" + severities.size() + '}';
    }
}
