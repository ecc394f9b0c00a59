package com.pfesentinel.core.ml;

import com.pfesentinel.core.baseline.SampleStatistics;
import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.Severity;
import com.pfesentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Unsupervised outlier detection over one series.
 *
 * <p>
 * Builds point features, scores them with an {@link OutlierScorer} fit on
 * the series itself and flags the top {@code contamination} fraction of
 * scores, keeping only points scored above the neutral isolation score 0.5.
 * The detection's confidence is the mean flagged score normalized to the
 * batch score range, capped by how far that mean sits above 0.5.
 * </p>
 *
 * <p>
 * Model failures are logged and reported as "no detection"; they never reach
 * the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierDetector.class);

    public static final String RULE_NAME = "ml_isolation_forest";

    private static final double DEGENERATE_CONFIDENCE = 0.5;
    /** Isolation score of a point no easier to isolate than average. */
    static final double NEUTRAL_SCORE = 0.5;

    private final OutlierScorer scorer;
    private final DetectionThresholds thresholds;

    public OutlierDetector(OutlierScorer scorer, DetectionThresholds thresholds) {
        this.scorer = Objects.requireNonNull(scorer, "OutlierScorer must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "DetectionThresholds must not be null");
    }

    /**
     * @param series        the recent series of one key
     * @param severity      severity to report with
     * @param minConfidence confidence a detection must reach, in [0, 1]
     * @return a detection, or empty when the series is too short, idle,
     *         unremarkable or the model failed
     */
    public Optional<Detection> detect(TimeSeries series, Severity severity, double minConfidence) {
        SeriesKey key = series.getKey();
        List<Sample> samples = series.validSamples();
        if (samples.size() < thresholds.getMlMinSamples()) {
            LOG.trace("Skipping {}: {} valid samples", key, samples.size());
            return Optional.empty();
        }
        double[] values = series.validValues();
        if (SampleStatistics.max(values) < thresholds.getMlMinPeak()) {
            LOG.trace("Skipping {}: no activity", key);
            return Optional.empty();
        }

        double[] scores;
        try {
            scores = scorer.score(FeatureExtractor.extract(values));
            if (scores.length != values.length) {
                throw new IllegalStateException("Expected " + values.length + " scores, got " + scores.length);
            }
        } catch (RuntimeException e) {
            LOG.error("Outlier model failed for {}", key, e);
            return Optional.empty();
        }

        double cutoff = SampleStatistics.interpolatedPercentile(scores, 1.0 - thresholds.getMlContamination());
        boolean[] flagged = new boolean[scores.length];
        int flaggedCount = 0;
        double flaggedScoreSum = 0;
        double normalSum = 0;
        int peakIndex = -1;
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > cutoff && scores[i] > NEUTRAL_SCORE) {
                flagged[i] = true;
                flaggedCount++;
                flaggedScoreSum += scores[i];
                if (peakIndex < 0 || values[i] > values[peakIndex]) {
                    peakIndex = i;
                }
            } else {
                normalSum += values[i];
            }
        }
        if (flaggedCount == 0) {
            return Optional.empty();
        }

        double confidence = confidence(flaggedScoreSum / flaggedCount, scores);
        if (confidence < minConfidence) {
            LOG.trace("Skipping {}: confidence {} below {}", key, confidence, minConfidence);
            return Optional.empty();
        }

        int normalCount = scores.length - flaggedCount;
        double normalMean = normalCount == 0 ? 0.0 : normalSum / normalCount;
        double peak = values[peakIndex];
        double factor = normalMean > 0 ? peak / normalMean : peak;
        String details = String.format(Locale.ROOT,
                "ML anomaly: %d of %d points anomalous (%.0f%%), peak %.2f exc/s (normal mean %.2f exc/s, %.1fx)",
                flaggedCount, scores.length, 100.0 * flaggedCount / scores.length, peak, normalMean, factor);
        return Optional.of(Detection.builder()
                .key(key)
                .severity(severity)
                .rule(RULE_NAME)
                .detectedAt(samples.get(peakIndex).getTime())
                .details(details)
                .confidence(confidence)
                .build());
    }

    /**
     * Range-normalized mean flagged score, capped by its margin over
     * {@link #NEUTRAL_SCORE}. A zero-width range gives 0.5 before the cap;
     * {@link #detect} never gets there, since tied scores flag nothing.
     */
    static double confidence(double meanFlaggedScore, double[] scores) {
        double strength = clamp((meanFlaggedScore - NEUTRAL_SCORE) / (1.0 - NEUTRAL_SCORE));
        double min = SampleStatistics.min(scores);
        double max = SampleStatistics.max(scores);
        if (max - min <= 0) {
            return Math.min(DEGENERATE_CONFIDENCE, strength);
        }
        return Math.min(clamp((meanFlaggedScore - min) / (max - min)), strength);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
