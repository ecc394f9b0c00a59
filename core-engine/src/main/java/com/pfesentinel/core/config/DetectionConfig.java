package com.pfesentinel.core.config;

import com.pfesentinel.core.model.Severity;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for the detection YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * defaultSeverity: LOW
 * severities:
 *   sw_error: CRITICAL
 *   firewall_discard: MEDIUM
 * thresholds:
 *   emergenceThreshold: 0.5
 * baseline:
 *   ewmaAlpha: 0.3
 * dashboard:
 *   baseUrl: http://grafana:3000
 * </pre>
 *
 * <p>
 * Every section is optional. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String defaultSeverity = Severity.LOW.name();
    private Map<String, String> severities = new LinkedHashMap<>();
    private DetectionThresholds thresholds = new DetectionThresholds();
    private BaselineSettings baseline = new BaselineSettings();
    private DashboardSettings dashboard = new DashboardSettings();

    /**
     * Validate every section, collecting all errors into one exception.
     *
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            Severity.parse(defaultSeverity);
        } catch (IllegalArgumentException e) {
            errors.add("defaultSeverity: " + e.getMessage());
        }
        severities.forEach((type, name) -> {
            if (type == null || type.isBlank()) {
                errors.add("severities: exception type must not be blank");
                return;
            }
            try {
                Severity.parse(name);
            } catch (IllegalArgumentException e) {
                errors.add("severities." + type + ": " + e.getMessage());
            }
        });
        thresholds.validate(errors);
        baseline.validate(errors);
        dashboard.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Build the severity table. Assumes {@link #validate()} has passed.
     */
    public SeverityMap severityMap() {
        Map<String, Severity> table = new LinkedHashMap<>();
        severities.forEach((type, name) -> table.put(type, Severity.parse(name)));
        return new SeverityMap(table, Severity.parse(defaultSeverity));
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getDefaultSeverity() {
        return defaultSeverity;
    }

    public void setDefaultSeverity(String defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Map<String, String> getSeverities() {
        return Collections.unmodifiableMap(severities);
    }

    public void setSeverities(Map<String, String> severities) {
        this.severities = severities != null ? new LinkedHashMap<>(severities) : new LinkedHashMap<>();
    }

    public DetectionThresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(DetectionThresholds thresholds) {
        this.thresholds = thresholds != null ? thresholds : new DetectionThresholds();
    }

    public BaselineSettings getBaseline() {
        return baseline;
    }

    public void setBaseline(BaselineSettings baseline) {
        this.baseline = baseline != null ? baseline : new BaselineSettings();
    }

    public DashboardSettings getDashboard() {
        return dashboard;
    }

    public void setDashboard(DashboardSettings dashboard) {
        this.dashboard = dashboard != null ? dashboard : new DashboardSettings();
    }

    @Override
    public String toString() {
        return "DetectionConfig{defaultSeverity=" + defaultSeverity
                + ", severities=" + severities.size()
                + ", dashboard=" + dashboard.getBaseUrl() + '}';
    }
}
