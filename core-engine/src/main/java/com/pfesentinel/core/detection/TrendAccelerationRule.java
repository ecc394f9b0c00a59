package com.pfesentinel.core.detection;

import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a steadily climbing hourly rate. Only meaningful for long lookbacks.
 */
public class TrendAccelerationRule extends SeriesRule {

    public static final String RULE_NAME = "trend_acceleration";

    public TrendAccelerationRule() {
        super(RULE_NAME);
    }

    @Override
    protected Optional<Detection> evaluate(SeriesKey key, RuleContext context) {
        DetectionThresholds t = context.getThresholds();
        if (context.getLookback().compareTo(Duration.ofHours(t.getTrendMinLookbackHours())) < 0) {
            return Optional.empty();
        }
        List<Sample> hourly = context.hourly(key).validSamples();
        if (hourly.size() < t.getTrendMinPoints()) {
            return Optional.empty();
        }

        int bestSteps = 0;
        int bestStart = 0;
        int steps = 0;
        int start = 0;
        for (int i = 1; i < hourly.size(); i++) {
            if (hourly.get(i).getValue() > hourly.get(i - 1).getValue()) {
                if (steps == 0) {
                    start = i - 1;
                }
                steps++;
                if (steps > bestSteps) {
                    bestSteps = steps;
                    bestStart = start;
                }
            } else {
                steps = 0;
            }
        }

        double first = hourly.get(0).getValue();
        double last = hourly.get(hourly.size() - 1).getValue();
        double growth = (last - first) / Math.max(first, t.getRatioEpsilon());
        if (bestSteps < t.getTrendMinSteps() || growth <= t.getTrendMinGrowth() || last < t.getTrendMinLastValue()) {
            return Optional.empty();
        }

        String details = String.format(Locale.ROOT,
                "Trend acceleration: %d consecutive hourly increases, %.3f -> %.3f exc/s (+%.0f%%)",
                bestSteps, first, last, growth * 100);
        return Optional.of(detection(key, context)
                .detectedAt(hourly.get(bestStart).getTime())
                .details(details)
                .build());
    }
}
