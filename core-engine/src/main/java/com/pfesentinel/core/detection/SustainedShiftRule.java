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
 * Flags a level shift that holds across the recent window.
 * <p>
 * Two distinct paths:
 * <ul>
 * <li><b>known series</b> (baseline has enough samples): the recent mean
 * crosses the absolute level, exceeds the baseline mean by the shift ratio,
 * or the recent minimum clears {@code mean + std}; in every case most recent
 * samples must individually sit above the baseline mean.</li>
 * <li><b>new series</b> (no usable baseline): reported when the recent mean
 * alone reaches the new-series level, with the baseline taken as 0.</li>
 * </ul>
 * The dynamic variant compares against the resolved dynamic reference
 * instead of the two-day baseline.
 */
public class SustainedShiftRule extends SeriesRule {

    public static final String RULE_NAME = "sustained_change";
    public static final String DYNAMIC_RULE_NAME = "sustained_change_dynamic";

    private final boolean dynamic;

    public SustainedShiftRule(boolean dynamic) {
        super(dynamic ? DYNAMIC_RULE_NAME : RULE_NAME);
        this.dynamic = dynamic;
    }

    @Override
    protected Optional<Detection> evaluate(SeriesKey key, RuleContext context) {
        DetectionThresholds t = context.getThresholds();
        List<Sample> recent = context.recent(key).validSamples();
        if (recent.size() < context.getMinConsecutiveSamples()) {
            return Optional.empty();
        }
        double[] values = context.recent(key).validValues();
        double recentMean = SampleStatistics.mean(values);

        Baseline baseline;
        String suffix;
        if (dynamic) {
            Optional<DynamicBaseline> resolved = context.dynamicBaseline(key);
            baseline = resolved.map(DynamicBaseline::getReference).orElse(Baseline.EMPTY);
            suffix = resolved.map(d -> " " + d.annotation()).orElse("");
        } else {
            baseline = context.staticBaseline(key);
            suffix = "";
        }

        if (!baseline.hasAtLeast(t.getMinBaselineSamples())) {
            if (recentMean < t.getNewSeriesMinMean()) {
                return Optional.empty();
            }
            String details = String.format(Locale.ROOT,
                    "Sustained change on new series: recent mean %.3f exc/s with no baseline (assumed 0)%s",
                    recentMean, suffix);
            return Optional.of(detection(key, context)
                    .detectedAt(recent.get(0).getTime())
                    .details(details)
                    .build());
        }

        double baseMean = baseline.getMean();
        if (baseMean < t.getNoSignalLevel() && recentMean < t.getNoSignalLevel()) {
            return Optional.empty();
        }

        double recentMin = SampleStatistics.min(values);
        boolean crossedLevel = recentMean >= t.getShiftAbsoluteLevel() && baseMean < t.getShiftAbsoluteLevel();
        boolean ratioShift = baseMean >= t.getShiftMinBaselineMean() && recentMean > t.getShiftRatio() * baseMean;
        boolean floorShift = baseMean > t.getShiftMinBaselineMean() && recentMin > baseMean + baseline.getStd();
        if (!crossedLevel && !ratioShift && !floorShift) {
            return Optional.empty();
        }

        Sample firstAbove = null;
        int above = 0;
        for (Sample sample : recent) {
            if (sample.getValue() > baseMean) {
                above++;
                if (firstAbove == null) {
                    firstAbove = sample;
                }
            }
        }
        double fraction = (double) above / recent.size();
        if (firstAbove == null || fraction < t.getSustainedFraction()) {
            return Optional.empty();
        }

        String details = String.format(Locale.ROOT,
                "Sustained change: recent mean %.3f exc/s vs baseline %.3f (%.1fx), %.0f%% of samples above baseline%s",
                recentMean, baseMean, recentMean / Math.max(baseMean, t.getRatioEpsilon()),
                fraction * 100, suffix);
        return Optional.of(detection(key, context)
                .detectedAt(firstAbove.getTime())
                .details(details)
                .build());
    }

    public boolean isDynamic() {
        return dynamic;
    }
}
