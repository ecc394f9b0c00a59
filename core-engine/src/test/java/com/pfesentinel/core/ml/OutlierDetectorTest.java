package com.pfesentinel.core.ml;

import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.Severity;
import com.pfesentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import static com.pfesentinel.core.SeriesFixtures.NOW;
import static com.pfesentinel.core.SeriesFixtures.alternating;
import static com.pfesentinel.core.SeriesFixtures.constant;
import static com.pfesentinel.core.SeriesFixtures.key;
import static com.pfesentinel.core.SeriesFixtures.minutely;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link OutlierDetector}.
 */
class OutlierDetectorTest {

    private static final SeriesKey KEY = key("sw_error");
    private static final DetectionThresholds THRESHOLDS = new DetectionThresholds();

    @Test
    @DisplayName("Should never report a series whose peak is below 0.1")
    void shouldSkipIdleSeries() {
        OutlierDetector detector = new OutlierDetector(new IsolationForestScorer(100, 0.7), THRESHOLDS);
        double[] values = alternating(60, 0.05, 0.04);
        values[30] = 0.099;

        assertThat(detector.detect(minutely(KEY, NOW, values), Severity.HIGH, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Should skip series with fewer than 20 valid samples")
    void shouldSkipShortSeries() {
        OutlierDetector detector = new OutlierDetector(new IsolationForestScorer(100, 0.7), THRESHOLDS);

        assertThat(detector.detect(minutely(KEY, NOW, constant(19, 5.0)), Severity.HIGH, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Should flag the burst in an otherwise steady series")
    void shouldDetectBurst() {
        OutlierDetector detector = new OutlierDetector(new IsolationForestScorer(100, 0.7), THRESHOLDS);
        double[] values = alternating(60, 1.0, 0.05);
        values[40] = 25.0;
        values[41] = 30.0;

        Optional<Detection> detection = detector.detect(minutely(KEY, NOW, values), Severity.HIGH, 0.0);

        assertThat(detection).hasValueSatisfying(d -> {
            assertThat(d.getRule()).isEqualTo("ml_isolation_forest");
            assertThat(d.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(d.getConfidence()).isPresent();
            assertThat(d.getConfidence().getAsDouble()).isBetween(0.0, 1.0);
            assertThat(d.getDetectedAt()).isEqualTo(NOW.plusSeconds(41 * 60));
            assertThat(d.getDetails()).contains("ML anomaly").contains("30.00");
        });
    }

    @Test
    @DisplayName("Should report the highest-value flagged point with a deterministic scorer")
    void shouldUseScores() {
        double[] values = alternating(20, 2.0, 0.5);
        values[7] = 9.0;
        values[3] = 4.0;
        OutlierScorer scorer = features -> {
            double[] scores = new double[features.length];
            scores[3] = 0.8;
            scores[7] = 1.0;
            return scores;
        };
        OutlierDetector detector = new OutlierDetector(scorer, THRESHOLDS);

        Optional<Detection> detection = detector.detect(minutely(KEY, NOW, values), Severity.LOW, 0.65);

        // cutoff is the 85th percentile (0.0); flagged mean 0.9 is 0.9 of the range but only 0.8 above neutral
        assertThat(detection).hasValueSatisfying(d -> {
            assertThat(d.getConfidence().getAsDouble()).isCloseTo(0.8, within(1e-9));
            assertThat(d.getDetectedAt()).isEqualTo(NOW.plusSeconds(7 * 60));
            assertThat(d.getDetails()).contains("2 of 20 points");
        });
    }

    @Test
    @DisplayName("Should drop detections under the confidence threshold")
    void shouldApplyConfidenceThreshold() {
        OutlierScorer scorer = features -> {
            double[] scores = new double[features.length];
            for (int i = 0; i < scores.length; i++) {
                scores[i] = i / 19.0;
            }
            return scores;
        };
        OutlierDetector detector = new OutlierDetector(scorer, THRESHOLDS);
        TimeSeries series = minutely(KEY, NOW, alternating(20, 2.0, 0.5));

        // flagged are scores 17..19 of 19, mean ~0.947, which sits ~0.895 above neutral
        assertThat(detector.detect(series, Severity.LOW, 0.9)).isEmpty();
        assertThat(detector.detect(series, Severity.LOW, 0.85)).isPresent();
    }

    @Test
    @DisplayName("Should swallow model failures as no detection")
    void shouldSurviveModelFailure() {
        OutlierScorer failing = features -> {
            throw new IllegalStateException("singular matrix");
        };
        OutlierDetector detector = new OutlierDetector(failing, THRESHOLDS);

        assertThat(detector.detect(minutely(KEY, NOW, alternating(30, 2.0, 0.5)), Severity.LOW, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Should stay quiet on steady noise at the default confidence threshold")
    void shouldIgnoreSteadyNoise() {
        OutlierDetector detector = new OutlierDetector(new IsolationForestScorer(100, 0.7), THRESHOLDS);

        for (long seed = 1; seed <= 10; seed++) {
            Random random = new Random(seed);
            double[] values = new double[60];
            for (int i = 0; i < values.length; i++) {
                values[i] = 1.0 + 0.05 * random.nextGaussian();
            }

            assertThat(detector.detect(minutely(KEY, NOW, values), Severity.HIGH, 0.65))
                    .as("noise seed %d", seed)
                    .isEmpty();
        }
    }

    @Test
    @DisplayName("Should flag nothing when no score rises above the neutral isolation score")
    void shouldIgnoreScoresBelowNeutral() {
        OutlierScorer scorer = features -> {
            double[] scores = new double[features.length];
            Arrays.fill(scores, 0.3);
            scores[5] = 0.45;
            return scores;
        };
        OutlierDetector detector = new OutlierDetector(scorer, THRESHOLDS);

        assertThat(detector.detect(minutely(KEY, NOW, alternating(20, 2.0, 0.5)), Severity.LOW, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Should flag nothing when every score is tied")
    void shouldIgnoreTiedScores() {
        OutlierScorer scorer = features -> {
            double[] scores = new double[features.length];
            Arrays.fill(scores, 0.9);
            return scores;
        };
        OutlierDetector detector = new OutlierDetector(scorer, THRESHOLDS);

        assertThat(detector.detect(minutely(KEY, NOW, alternating(20, 2.0, 0.5)), Severity.LOW, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Confidence is capped by the margin over the neutral score")
    void shouldCapConfidenceByNeutralMargin() {
        assertThat(OutlierDetector.confidence(0.9, new double[] {0.9, 0.9, 0.9})).isEqualTo(0.5);
        assertThat(OutlierDetector.confidence(0.6, new double[] {0.5, 0.6})).isCloseTo(0.2, within(1e-9));
        assertThat(OutlierDetector.confidence(0.4, new double[] {0.0, 0.5})).isZero();
        assertThat(OutlierDetector.confidence(2.0, new double[] {0.0, 1.0})).isEqualTo(1.0);
    }
}
