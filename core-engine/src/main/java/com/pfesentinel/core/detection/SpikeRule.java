package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.baseline.EwmaBaseline;
import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a short burst: the recent maximum clears both the baseline band and
 * an absolute floor, and is a multiple of the baseline mean.
 * <p>
 * In static mode the band is {@code mean + sigma * std} of the two-day
 * baseline. In dynamic mode it is the EWMA upper bound of the history; after
 * a regime change the band of the new recent baseline applies too, whichever
 * is higher.
 * </p>
 */
public class SpikeRule extends SeriesRule {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeRule.class);

    public static final String RULE_NAME = "spike";
    public static final String DYNAMIC_RULE_NAME = "spike_dynamic";

    private final boolean dynamic;

    public SpikeRule(boolean dynamic) {
        super(dynamic ? DYNAMIC_RULE_NAME : RULE_NAME);
        this.dynamic = dynamic;
    }

    @Override
    protected Optional<Detection> evaluate(SeriesKey key, RuleContext context) {
        DetectionThresholds t = context.getThresholds();
        List<Sample> recent = context.recent(key).validSamples();
        if (recent.isEmpty()) {
            return Optional.empty();
        }

        double baselineMean;
        double threshold;
        String suffix;
        if (dynamic) {
            Optional<DynamicBaseline> resolved = context.dynamicBaseline(key);
            if (resolved.isEmpty() || resolved.get().getEwma().getSampleCount() < t.getMinBaselineSamples()) {
                LOG.trace("Skipping {}: not enough history for EWMA", key);
                return Optional.empty();
            }
            DynamicBaseline dyn = resolved.get();
            EwmaBaseline ewma = dyn.getEwma();
            Baseline reference = dyn.getReference();
            threshold = ewma.getUpperBound();
            if (dyn.isRegimeChange()) {
                threshold = Math.max(threshold, reference.getMean() + t.getSpikeSigma() * reference.getStd());
            }
            baselineMean = reference.getSampleCount() > 0 ? reference.getMean() : ewma.getEwma();
            suffix = " " + dyn.annotation();
        } else {
            Baseline baseline = context.staticBaseline(key);
            if (!baseline.hasAtLeast(t.getMinBaselineSamples())) {
                LOG.trace("Skipping {}: {} baseline samples", key, baseline.getSampleCount());
                return Optional.empty();
            }
            baselineMean = baseline.getMean();
            threshold = baseline.getMean() + t.getSpikeSigma() * baseline.getStd();
            suffix = "";
        }

        Sample peak = recent.get(0);
        for (Sample sample : recent) {
            if (sample.getValue() > peak.getValue()) {
                peak = sample;
            }
        }
        double max = peak.getValue();
        double ratio = max / Math.max(baselineMean, t.getRatioEpsilon());
        if (max <= threshold || max < t.getSpikeMinRate() || ratio <= t.getSpikeMinRatio()) {
            return Optional.empty();
        }

        String details = String.format(Locale.ROOT,
                "Spike: peak %.3f exc/s is %.1fx baseline mean %.3f (threshold %.3f)%s",
                max, ratio, baselineMean, threshold, suffix);
        return Optional.of(detection(key, context)
                .detectedAt(peak.getTime())
                .details(details)
                .build());
    }

    public boolean isDynamic() {
        return dynamic;
    }
}
