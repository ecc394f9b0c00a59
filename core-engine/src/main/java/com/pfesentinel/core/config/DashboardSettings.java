package com.pfesentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Where detection deep links point.
 *
 * @since 1.0.0
 */
public class DashboardSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String baseUrl = "http://localhost:3000";
    private String dashboardUid = "pfe-exceptions";
    private String dashboardSlug = "pfe-exceptions";
    private int orgId = 1;
    private int displayWindowHours = 48;

    void validate(List<String> errors) {
        if (baseUrl == null || baseUrl.isBlank()) {
            errors.add("dashboard.baseUrl is required");
        }
        if (dashboardUid == null || dashboardUid.isBlank()) {
            errors.add("dashboard.dashboardUid is required");
        }
        if (displayWindowHours < 1) {
            errors.add("dashboard.displayWindowHours must be >= 1, got: " + displayWindowHours);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getDashboardUid() {
        return dashboardUid;
    }

    public void setDashboardUid(String dashboardUid) {
        this.dashboardUid = dashboardUid;
    }

    public String getDashboardSlug() {
        return dashboardSlug;
    }

    public void setDashboardSlug(String dashboardSlug) {
        this.dashboardSlug = dashboardSlug;
    }

    public int getOrgId() {
        return orgId;
    }

    public void setOrgId(int orgId) {
        this.orgId = orgId;
    }

    public int getDisplayWindowHours() {
        return displayWindowHours;
    }

    public void setDisplayWindowHours(int displayWindowHours) {
        this.displayWindowHours = displayWindowHours;
    }
}
