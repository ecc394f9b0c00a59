package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.baseline.SampleStatistics;
import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares the recent window with the same time of week seven days earlier.
 */
public class WeeklyComparisonRule extends SeriesRule {

    public static final String RULE_NAME = "weekly_anomaly";

    public WeeklyComparisonRule() {
        super(RULE_NAME);
    }

    @Override
    protected Optional<Detection> evaluate(SeriesKey key, RuleContext context) {
        DetectionThresholds t = context.getThresholds();
        Baseline weekly = context.weeklyBaseline(key);
        List<Sample> recent = context.recent(key).validSamples();
        if (recent.isEmpty() || !weekly.hasAtLeast(t.getMinBaselineSamples())) {
            return Optional.empty();
        }

        double recentMean = SampleStatistics.mean(context.recent(key).validValues());
        if (recentMean < t.getWeeklyMinMean() || recentMean <= t.getWeeklyRatio() * weekly.getMean()) {
            return Optional.empty();
        }

        String details = String.format(Locale.ROOT,
                "Weekly anomaly: recent mean %.3f exc/s is %.1fx last week's %.3f",
                recentMean, recentMean / Math.max(weekly.getMean(), t.getRatioEpsilon()), weekly.getMean());
        return Optional.of(detection(key, context)
                .detectedAt(recent.get(0).getTime())
                .details(details)
                .build());
    }
}
