package com.pfesentinel.core.engine;

import com.pfesentinel.core.config.DashboardSettings;
import com.pfesentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Builds dashboard deep links for detections.
 * <p>
 * Links select the device, slot and exception type and show a fixed window
 * ending now. Construction never throws: a link that cannot be built falls
 * back to the dashboard landing page.
 * </p>
 */
public class DashboardLinkBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardLinkBuilder.class);

    static final String LANDING_PATH = "/dashboards";

    private final DashboardSettings settings;
    private final Clock clock;

    public DashboardLinkBuilder(DashboardSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "DashboardSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    public String link(SeriesKey key) {
        try {
            Instant to = clock.instant();
            Instant from = to.minus(Duration.ofHours(settings.getDisplayWindowHours()));
            String link = base() + "/d/" + encode(settings.getDashboardUid())
                    + '/' + encode(settings.getDashboardSlug())
                    + "?orgId=" + settings.getOrgId()
                    + "&var-device=" + encode(key.getDevice())
                    + "&var-slot=" + encode(key.getSlot())
                    + "&var-exception=" + encode(key.getExceptionType())
                    + "&from=" + from.toEpochMilli()
                    + "&to=" + to.toEpochMilli();
            URI.create(link);
            return link;
        } catch (RuntimeException e) {
            String landing = landing();
            LOG.warn("Could not build dashboard link for {}, using {}: {}", key, landing, e.getMessage());
            return landing;
        }
    }

    private String base() {
        String base = settings.getBaseUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private String landing() {
        try {
            String base = base();
            URI.create(base + LANDING_PATH);
            return base + LANDING_PATH;
        } catch (RuntimeException e) {
            return LANDING_PATH;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
