package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.baseline.SampleStatistics;
import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.Severity;
import com.pfesentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Flags a device/slot where several exception types rise together.
 * <p>
 * Emits one synthetic detection per location under the exception type
 * {@value #CORRELATED_EXCEPTION_TYPE}, carrying the most urgent severity of
 * the contributing types.
 * </p>
 */
public class CorrelationRule implements DetectionRule {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationRule.class);

    public static final String RULE_NAME = "correlated_exceptions";
    public static final String CORRELATED_EXCEPTION_TYPE = "multiple_correlated";

    @Override
    public List<Detection> evaluate(RuleContext context) {
        DetectionThresholds t = context.getThresholds();
        Map<String, List<SeriesKey>> elevatedByLocation = new LinkedHashMap<>();
        for (SeriesKey key : context.keys()) {
            if (isElevated(key, context, t)) {
                elevatedByLocation
                        .computeIfAbsent(key.getDevice() + '\u0000' + key.getSlot(), k -> new ArrayList<>())
                        .add(key);
            }
        }

        List<Detection> detections = new ArrayList<>();
        for (List<SeriesKey> group : elevatedByLocation.values()) {
            if (group.size() < t.getCorrelationMinExceptions()) {
                continue;
            }
            detections.add(report(group, context, t));
        }
        return detections;
    }

    private boolean isElevated(SeriesKey key, RuleContext context, DetectionThresholds t) {
        Baseline baseline = context.staticBaseline(key);
        double[] values = context.recent(key).validValues();
        if (values.length == 0 || !baseline.hasAtLeast(t.getMinBaselineSamples())) {
            return false;
        }
        double recentMean = SampleStatistics.mean(values);
        return recentMean > t.getCorrelationRatio() * baseline.getMean()
                && recentMean >= t.getCorrelationMinMean();
    }

    private Detection report(List<SeriesKey> group, RuleContext context, DetectionThresholds t) {
        Severity severity = null;
        Instant earliest = null;
        StringJoiner contributors = new StringJoiner(", ");
        for (SeriesKey key : group) {
            severity = severity == null ? context.severityOf(key) : Severity.mostUrgent(severity, context.severityOf(key));
            TimeSeries recent = context.recent(key);
            Instant first = recent.validSamples().get(0).getTime();
            if (earliest == null || first.isBefore(earliest)) {
                earliest = first;
            }
            double recentMean = SampleStatistics.mean(recent.validValues());
            double baseMean = context.staticBaseline(key).getMean();
            contributors.add(String.format(Locale.ROOT, "%s %.1fx",
                    key.getExceptionType(), recentMean / Math.max(baseMean, t.getRatioEpsilon())));
        }

        SeriesKey anchor = group.get(0);
        SeriesKey key = anchor.withExceptionType(CORRELATED_EXCEPTION_TYPE);
        LOG.debug("Correlated increase at {}/{} across {} exception types",
                anchor.getDevice(), anchor.getSlot(), group.size());
        return Detection.builder()
                .key(key)
                .rule(RULE_NAME)
                .severity(severity)
                .detectedAt(earliest)
                .details(String.format(Locale.ROOT, "Correlated increase in %d exception types: %s",
                        group.size(), contributors))
                .build();
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }
}
