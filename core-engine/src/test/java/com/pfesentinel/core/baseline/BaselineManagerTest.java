package com.pfesentinel.core.baseline;

import com.pfesentinel.core.config.BaselineSettings;
import com.pfesentinel.core.model.Sample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pfesentinel.core.SeriesFixtures.NOW;
import static com.pfesentinel.core.SeriesFixtures.alternating;
import static com.pfesentinel.core.SeriesFixtures.constant;
import static com.pfesentinel.core.SeriesFixtures.samples;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineManager}.
 */
class BaselineManagerTest {

    private BaselineManager manager;

    @BeforeEach
    void setUp() {
        manager = new BaselineManager();
    }

    @Test
    @DisplayName("Every baseline function returns the empty baseline for empty input")
    void shouldReturnEmptyForEmptyInput() {
        List<Sample> none = List.of();

        assertThat(manager.simpleBaseline(none)).isEqualTo(Baseline.EMPTY);
        assertThat(manager.simpleBaseline(null)).isEqualTo(Baseline.EMPTY);
        assertThat(manager.contextualBaseline(none, NOW).getBaseline()).isEqualTo(Baseline.EMPTY);
        assertThat(manager.contextualBaseline(none, NOW).isContextMatched()).isFalse();
        assertThat(manager.multiWindowBaseline(none, NOW).getComposite()).isEqualTo(Baseline.EMPTY);
        assertThat(manager.ewmaBaseline(none).isEmpty()).isTrue();
        assertThat(manager.detectRegimeChange(none, Baseline.EMPTY).isDetected()).isFalse();
    }

    @Test
    @DisplayName("Missing values are excluded from every statistic")
    void shouldIgnoreMissingValues() {
        List<Sample> series = new ArrayList<>(samples(NOW, Duration.ofMinutes(1), 1.0, 3.0));
        series.add(Sample.missing(NOW.plusSeconds(600)));
        series.add(Sample.of(NOW.plusSeconds(700), Double.NaN));

        Baseline baseline = manager.simpleBaseline(series);

        assertThat(baseline.getSampleCount()).isEqualTo(2);
        assertThat(baseline.getMean()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Simple baseline computes mean, median, sample std, min, max and p95")
    void shouldComputeSimpleStatistics() {
        Baseline baseline = manager.simpleBaseline(samples(NOW, Duration.ofMinutes(1), 2, 4, 4, 4, 5, 5, 7, 9));

        assertThat(baseline.getMean()).isEqualTo(5.0);
        assertThat(baseline.getMedian()).isEqualTo(4.5);
        assertThat(baseline.getStd()).isCloseTo(Math.sqrt(32.0 / 7), within(1e-9));
        assertThat(baseline.getMin()).isEqualTo(2.0);
        assertThat(baseline.getMax()).isEqualTo(9.0);
        assertThat(baseline.getP95()).isEqualTo(9.0);
        assertThat(baseline.getSampleCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Simple baseline is order-independent and idempotent")
    void shouldBeOrderIndependent() {
        List<Sample> ordered = samples(NOW, Duration.ofMinutes(1), 0.3, 1.7, 0.2, 2.9, 0.8, 1.1);
        List<Sample> shuffled = new ArrayList<>(ordered);
        Collections.reverse(shuffled);
        Collections.swap(shuffled, 0, 3);

        Baseline first = manager.simpleBaseline(ordered);

        assertThat(manager.simpleBaseline(shuffled)).isEqualTo(first);
        assertThat(manager.simpleBaseline(ordered)).isEqualTo(first);
    }

    @Test
    @DisplayName("Single sample has zero standard deviation")
    void shouldHandleSingleSample() {
        Baseline baseline = manager.simpleBaseline(samples(NOW, Duration.ofMinutes(1), 3.0));

        assertThat(baseline.getStd()).isZero();
        assertThat(baseline.getMedian()).isEqualTo(3.0);
        assertThat(baseline.getSampleCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Contextual baseline keeps samples near the same hour of a matching day class")
    void shouldMatchHourContext() {
        // NOW is a Wednesday at 12:00 UTC; a week of hourly samples with 10.0 around noon
        List<Sample> week = new ArrayList<>();
        Instant start = NOW.minus(Duration.ofDays(7));
        for (int h = 0; h < 7 * 24; h++) {
            Instant t = start.plus(Duration.ofHours(h));
            int hour = (12 + h) % 24;
            week.add(Sample.of(t, Math.abs(hour - 12) <= 2 ? 10.0 : 1.0));
        }

        ContextualBaseline contextual = manager.contextualBaseline(week, NOW);

        assertThat(contextual.isContextMatched()).isTrue();
        assertThat(contextual.getBaseline().getMean()).isEqualTo(10.0);
        // five weekdays x five hours each
        assertThat(contextual.getBaseline().getSampleCount()).isEqualTo(25);
        assertThat(contextual.getContext()).contains("weekday");
    }

    @Test
    @DisplayName("Contextual hour window wraps around midnight")
    void shouldWrapAroundMidnight() {
        Instant midnight = Instant.parse("2024-03-13T00:30:00Z");
        List<Sample> series = new ArrayList<>();
        for (int day = 1; day <= 2; day++) {
            Instant lateEvening = Instant.parse("2024-03-13T23:00:00Z").minus(Duration.ofDays(day));
            series.addAll(samples(lateEvening, Duration.ofMinutes(10), constant(6, 4.0)));
        }
        series.addAll(samples(Instant.parse("2024-03-12T12:00:00Z"), Duration.ofMinutes(10), constant(6, 1.0)));

        ContextualBaseline contextual = manager.contextualBaseline(series, midnight);

        assertThat(contextual.isContextMatched()).isTrue();
        assertThat(contextual.getBaseline().getMean()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Contextual baseline falls back to all samples when too few match")
    void shouldFallBackWhenContextIsScarce() {
        List<Sample> series = samples(NOW.minus(Duration.ofHours(8)), Duration.ofMinutes(30),
                constant(8, 2.0));

        ContextualBaseline contextual = manager.contextualBaseline(series, NOW);

        assertThat(contextual.isContextMatched()).isFalse();
        assertThat(contextual.getBaseline().getSampleCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Adaptive weights sum to 1 and favor the short window")
    void shouldWeightWindows() {
        Baseline shortWindow = new Baseline(1, 1, 0.5, 0, 2, 2, 100);
        Baseline mediumWindow = new Baseline(1, 1, 0.5, 0, 2, 2, 50);
        Baseline longWindow = new Baseline(1, 1, 0.5, 0, 2, 2, 10);

        WindowWeights weights = BaselineManager.adaptiveWeights(shortWindow, mediumWindow, longWindow);

        assertThat(weights.sum()).isCloseTo(1.0, within(1e-9));
        assertThat(weights.getShort()).isGreaterThan(weights.getLong());
        assertThat(weights.getShort()).isGreaterThan(weights.getMedium());
    }

    @Test
    @DisplayName("Adaptive weights are zero when every window is empty")
    void shouldReturnNoWeightsForEmptyWindows() {
        WindowWeights weights = BaselineManager.adaptiveWeights(Baseline.EMPTY, Baseline.EMPTY, Baseline.EMPTY);

        assertThat(weights.sum()).isZero();
    }

    @Test
    @DisplayName("Empty windows get no weight")
    void shouldNotWeightEmptyWindows() {
        Baseline mediumWindow = new Baseline(1, 1, 0.5, 0, 2, 2, 50);
        Baseline longWindow = new Baseline(1, 1, 0.5, 0, 2, 2, 200);

        WindowWeights weights = BaselineManager.adaptiveWeights(Baseline.EMPTY, mediumWindow, longWindow);

        assertThat(weights.getShort()).isZero();
        assertThat(weights.sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("A gap before the reference time does not dilute the composite")
    void shouldKeepCompositeWithinDataAfterGap() {
        // flat 1.0 for a day, ending 5 hours before the reference time
        List<Sample> series = samples(NOW.minus(Duration.ofHours(29)), Duration.ofMinutes(5), constant(288, 1.0));

        MultiWindowBaseline multi = manager.multiWindowBaseline(series, NOW);

        assertThat(multi.getShort().getSampleCount()).isZero();
        assertThat(multi.getWeights().getShort()).isZero();
        assertThat(multi.getComposite().getMean()).isCloseTo(1.0, within(1e-9));
        assertThat(multi.getComposite().getMean()).isGreaterThanOrEqualTo(multi.getComposite().getMin());
    }

    @Test
    @DisplayName("Multi-window composite blends nested windows ending at the reference time")
    void shouldBuildMultiWindowComposite() {
        // 6 days at 1.0 then the last 2 hours at 3.0, sampled every 30 minutes
        List<Sample> series = new ArrayList<>(samples(NOW.minus(Duration.ofDays(6)), Duration.ofMinutes(30),
                constant(6 * 48 - 4, 1.0)));
        series.addAll(samples(NOW.minus(Duration.ofMinutes(90)), Duration.ofMinutes(30), constant(4, 3.0)));

        MultiWindowBaseline multi = manager.multiWindowBaseline(series, NOW);

        assertThat(multi.getShort().getMean()).isEqualTo(3.0);
        assertThat(multi.getLong().getSampleCount()).isEqualTo(series.size());
        assertThat(multi.getWeights().sum()).isCloseTo(1.0, within(1e-9));
        assertThat(multi.getComposite().getMean()).isBetween(1.0, 3.0);
        assertThat(multi.getComposite().getMin()).isEqualTo(1.0);
        assertThat(multi.getComposite().getMax()).isEqualTo(3.0);
        assertThat(multi.getComposite().getSampleCount()).isEqualTo(series.size());
    }

    @Test
    @DisplayName("EWMA follows the recurrence seeded with the oldest value")
    void shouldComputeEwma() {
        EwmaBaseline ewma = manager.ewmaBaseline(samples(NOW, Duration.ofMinutes(1), 1.0, 2.0), 0.5);

        // ewma = 0.5*2 + 0.5*1 = 1.5; var = 0.5*(2-1.5)^2 = 0.125
        assertThat(ewma.getEwma()).isCloseTo(1.5, within(1e-9));
        assertThat(ewma.getEwmaStd()).isCloseTo(Math.sqrt(0.125), within(1e-9));
        assertThat(ewma.getUpperBound()).isCloseTo(1.5 + 3 * Math.sqrt(0.125), within(1e-9));
        assertThat(ewma.getSampleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("EWMA lower bound is never negative")
    void shouldFloorEwmaLowerBound() {
        EwmaBaseline ewma = manager.ewmaBaseline(samples(NOW, Duration.ofMinutes(1), 0.0, 5.0, 0.0, 6.0, 0.1));

        assertThat(ewma.getEwma() - 3 * ewma.getEwmaStd()).isNegative();
        assertThat(ewma.getLowerBound()).isZero();
    }

    @Test
    @DisplayName("EWMA rejects an alpha outside (0, 1]")
    void shouldRejectInvalidAlpha() {
        assertThatThrownBy(() -> manager.ewmaBaseline(List.of(), 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alpha");
        assertThatThrownBy(() -> manager.ewmaBaseline(List.of(), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Regime change never fires with fewer than 20 recent samples")
    void shouldNotDetectRegimeChangeWithFewSamples() {
        Baseline historical = BaselineManager.fromValues(alternating(100, 1.0, 0.1));
        List<Sample> recent = samples(NOW, Duration.ofMinutes(1), constant(19, 50.0));

        assertThat(manager.detectRegimeChange(recent, historical).isDetected()).isFalse();
    }

    @Test
    @DisplayName("Regime change fires on a sustained new level and returns the recent baseline")
    void shouldDetectSustainedRegimeChange() {
        Baseline historical = BaselineManager.fromValues(alternating(100, 1.0, 0.1));
        List<Sample> recent = samples(NOW, Duration.ofMinutes(1), constant(30, 5.0));

        RegimeChange change = manager.detectRegimeChange(recent, historical);

        assertThat(change.isDetected()).isTrue();
        assertThat(change.getNewBaseline()).hasValueSatisfying(b -> assertThat(b.getMean()).isEqualTo(5.0));
    }

    @Test
    @DisplayName("Regime change also fires on a sustained drop below half the historical mean")
    void shouldDetectDrop() {
        Baseline historical = BaselineManager.fromValues(alternating(100, 4.0, 0.1));
        List<Sample> recent = samples(NOW, Duration.ofMinutes(1), constant(25, 0.5));

        assertThat(manager.detectRegimeChange(recent, historical).isDetected()).isTrue();
    }

    @Test
    @DisplayName("A short burst is not a regime change")
    void shouldIgnoreShortBurst() {
        Baseline historical = BaselineManager.fromValues(alternating(100, 1.0, 0.1));
        double[] values = constant(30, 1.0);
        for (int i = 0; i < 10; i++) {
            values[i] = 20.0;
        }

        RegimeChange change = manager.detectRegimeChange(samples(NOW, Duration.ofMinutes(1), values), historical);

        assertThat(change.isDetected()).isFalse();
        assertThat(change.getNewBaseline()).isEmpty();
    }

    @Test
    @DisplayName("Custom window settings are applied")
    void shouldApplySettings() {
        BaselineSettings settings = new BaselineSettings();
        settings.setShortWindowHours(1);
        settings.setEwmaAlpha(0.1);

        BaselineManager custom = new BaselineManager(settings);

        assertThat(custom.getShortWindow()).isEqualTo(Duration.ofHours(1));
        assertThat(custom.getEwmaAlpha()).isEqualTo(0.1);
    }
}
