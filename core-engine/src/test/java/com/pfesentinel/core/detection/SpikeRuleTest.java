package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.baseline.EwmaBaseline;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.SeriesKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pfesentinel.core.SeriesFixtures.NOW;
import static com.pfesentinel.core.SeriesFixtures.key;
import static com.pfesentinel.core.SeriesFixtures.minutely;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SpikeRule}.
 */
class SpikeRuleTest {

    private static final SeriesKey KEY = key("fabric_drop");
    private static final Baseline TWO_DAY = new Baseline(0.1, 0.1, 0.05, 0.0, 0.3, 0.2, 576);

    @Test
    @DisplayName("Should fire when the peak clears mean + 3 std and twice the mean")
    void shouldFireOnSpike() {
        List<Detection> detections = new SpikeRule(false).evaluate(staticContext(TWO_DAY, 0.1, 0.2, 1.0, 0.1));

        assertThat(detections).singleElement().satisfies(d -> {
            assertThat(d.getRule()).isEqualTo("spike");
            assertThat(d.getDetectedAt()).isEqualTo(NOW.plusSeconds(120));
            assertThat(d.getDetails()).contains("Spike");
        });
    }

    @Test
    @DisplayName("Should NOT fire for a peak inside the baseline band")
    void shouldNotFireForSmallPeak() {
        assertThat(new SpikeRule(false).evaluate(staticContext(TWO_DAY, 0.1, 0.2, 0.1))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire below the absolute rate floor")
    void shouldNotFireBelowMinimumRate() {
        Baseline quiet = new Baseline(0.01, 0.01, 0.01, 0.0, 0.05, 0.03, 576);

        assertThat(new SpikeRule(false).evaluate(staticContext(quiet, 0.0, 0.45, 0.0))).isEmpty();
    }

    @Test
    @DisplayName("Should skip series with fewer than 10 baseline samples")
    void shouldSkipWithoutBaseline() {
        Baseline thin = new Baseline(0.1, 0.1, 0.05, 0.0, 0.3, 0.2, 9);

        assertThat(new SpikeRule(false).evaluate(staticContext(thin, 5.0))).isEmpty();
    }

    @Test
    @DisplayName("Dynamic variant uses the EWMA upper bound and annotates the baseline")
    void shouldFireDynamically() {
        DynamicBaseline dynamic = new DynamicBaseline(
                new Baseline(0.2, 0.2, 0.05, 0.1, 0.4, 0.3, 500),
                new EwmaBaseline(0.2, 0.05, 500, 0.3),
                BaselineType.MULTI_WINDOW, false);

        List<Detection> detections = new SpikeRule(true).evaluate(dynamicContext(dynamic, 0.2, 2.0, 0.2));

        assertThat(detections).singleElement().satisfies(d -> {
            assertThat(d.getRule()).isEqualTo("spike_dynamic");
            assertThat(d.getDetails()).endsWith("[baseline=multi_window, regime_change=false]");
        });
    }

    @Test
    @DisplayName("Dynamic variant skips series with too little EWMA history")
    void shouldSkipDynamicWithoutHistory() {
        DynamicBaseline dynamic = new DynamicBaseline(Baseline.EMPTY,
                new EwmaBaseline(0.2, 0.05, 5, 0.3), BaselineType.MULTI_WINDOW, false);

        assertThat(new SpikeRule(true).evaluate(dynamicContext(dynamic, 5.0))).isEmpty();
    }

    @Test
    @DisplayName("Dynamic variant does not re-report the new level after a regime change")
    void shouldRespectRegimeChange() {
        DynamicBaseline dynamic = new DynamicBaseline(
                new Baseline(3.0, 3.0, 0.2, 2.5, 3.5, 3.4, 60),
                new EwmaBaseline(0.2, 0.05, 500, 0.3),
                BaselineType.REGIME_CHANGE, true);

        assertThat(new SpikeRule(true).evaluate(dynamicContext(dynamic, 3.0, 3.2, 3.1))).isEmpty();
    }

    private static RuleContext staticContext(Baseline baseline, double... recent) {
        return RuleContext.builder()
                .now(NOW)
                .recent(minutely(KEY, NOW, recent))
                .staticBaseline(KEY, baseline)
                .build();
    }

    private static RuleContext dynamicContext(DynamicBaseline dynamic, double... recent) {
        return RuleContext.builder()
                .now(NOW)
                .recent(minutely(KEY, NOW, recent))
                .dynamicBaseline(KEY, dynamic)
                .build();
    }
}
