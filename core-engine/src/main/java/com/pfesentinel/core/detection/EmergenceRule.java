package com.pfesentinel.core.detection;

import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags an exception that appears out of nothing: a run of consecutive
 * samples at or above the emergence level, immediately preceded by a
 * near-zero sample. A series already elevated when the window opens is not
 * new.
 * <p>
 * Only the first qualifying run is reported.
 * </p>
 */
public class EmergenceRule extends SeriesRule {

    public static final String RULE_NAME = "new_exception";

    public EmergenceRule() {
        super(RULE_NAME);
    }

    @Override
    protected Optional<Detection> evaluate(SeriesKey key, RuleContext context) {
        DetectionThresholds t = context.getThresholds();
        List<Sample> samples = context.recent(key).validSamples();
        int required = context.getMinConsecutiveSamples();
        if (samples.size() < required) {
            return Optional.empty();
        }

        int runStart = -1;
        for (int i = 0; i < samples.size(); i++) {
            double value = samples.get(i).getValue();
            if (value < t.getEmergenceThreshold()) {
                runStart = -1;
                continue;
            }
            if (runStart < 0) {
                if (i == 0 || samples.get(i - 1).getValue() >= t.getNearZeroThreshold()) {
                    // elevated but not emerging
                    continue;
                }
                runStart = i;
            }
            if (i - runStart + 1 >= required) {
                return Optional.of(report(key, context, samples, runStart, i));
            }
        }
        return Optional.empty();
    }

    private Detection report(SeriesKey key, RuleContext context, List<Sample> samples, int from, int to) {
        double peak = 0;
        for (int i = from; i <= to; i++) {
            peak = Math.max(peak, samples.get(i).getValue());
        }
        Sample first = samples.get(from);
        String details = String.format(Locale.ROOT,
                "New exception: %d consecutive samples >= %.2f exc/s after near-zero activity (first=%.3f, peak=%.3f)",
                to - from + 1, context.getThresholds().getEmergenceThreshold(), first.getValue(), peak);
        return detection(key, context)
                .detectedAt(first.getTime())
                .details(details)
                .build();
    }
}
