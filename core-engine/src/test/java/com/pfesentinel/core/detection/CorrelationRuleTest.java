package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.config.SeverityMap;
import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pfesentinel.core.SeriesFixtures.NOW;
import static com.pfesentinel.core.SeriesFixtures.constant;
import static com.pfesentinel.core.SeriesFixtures.minutely;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CorrelationRule}.
 */
class CorrelationRuleTest {

    private static final SeriesKey SW_ERROR = SeriesKey.of("r1", "fpc0", "sw_error");
    private static final SeriesKey FABRIC_DROP = SeriesKey.of("r1", "fpc0", "fabric_drop");
    private static final SeriesKey TTL_EXPIRED = SeriesKey.of("r1", "fpc0", "ttl_expired");
    private static final SeriesKey OTHER_SLOT = SeriesKey.of("r1", "fpc1", "fabric_drop");
    private static final SeverityMap SEVERITIES = new SeverityMap(
            Map.of("sw_error", Severity.CRITICAL, "fabric_drop", Severity.HIGH), Severity.LOW);

    private final CorrelationRule rule = new CorrelationRule();

    @Test
    @DisplayName("Should emit one synthetic detection when two exception types rise together")
    void shouldCorrelateExceptions() {
        RuleContext context = RuleContext.builder()
                .now(NOW)
                .severities(SEVERITIES)
                .recent(minutely(SW_ERROR, NOW, constant(10, 1.0)))
                .recent(minutely(FABRIC_DROP, NOW.minusSeconds(300), constant(10, 2.0)))
                .recent(minutely(TTL_EXPIRED, NOW, constant(10, 1.0)))
                .staticBaseline(SW_ERROR, baseline(0.5))
                .staticBaseline(FABRIC_DROP, baseline(1.0))
                .staticBaseline(TTL_EXPIRED, baseline(1.0))
                .build();

        List<Detection> detections = rule.evaluate(context);

        assertThat(detections).singleElement().satisfies(d -> {
            assertThat(d.getRule()).isEqualTo("correlated_exceptions");
            assertThat(d.getExceptionType()).isEqualTo("multiple_correlated");
            assertThat(d.getDevice()).isEqualTo("r1");
            assertThat(d.getSlot()).isEqualTo("fpc0");
            assertThat(d.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(d.getDetectedAt()).isEqualTo(NOW.minusSeconds(300));
            assertThat(d.getDetails()).contains("sw_error").contains("fabric_drop").doesNotContain("ttl_expired");
        });
    }

    @Test
    @DisplayName("Should NOT fire for a single elevated exception type")
    void shouldNotFireForSingleException() {
        RuleContext context = RuleContext.builder()
                .now(NOW)
                .recent(minutely(SW_ERROR, NOW, constant(10, 1.0)))
                .recent(minutely(FABRIC_DROP, NOW, constant(10, 1.0)))
                .staticBaseline(SW_ERROR, baseline(0.5))
                .staticBaseline(FABRIC_DROP, baseline(1.0))
                .build();

        assertThat(rule.evaluate(context)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT correlate across slots")
    void shouldNotCorrelateAcrossSlots() {
        RuleContext context = RuleContext.builder()
                .now(NOW)
                .recent(minutely(SW_ERROR, NOW, constant(10, 1.0)))
                .recent(minutely(OTHER_SLOT, NOW, constant(10, 2.0)))
                .staticBaseline(SW_ERROR, baseline(0.5))
                .staticBaseline(OTHER_SLOT, baseline(1.0))
                .build();

        assertThat(rule.evaluate(context)).isEmpty();
    }

    @Test
    @DisplayName("Should ignore exception types without a baseline")
    void shouldRequireBaselines() {
        RuleContext context = RuleContext.builder()
                .now(NOW)
                .recent(minutely(SW_ERROR, NOW, constant(10, 1.0)))
                .recent(minutely(FABRIC_DROP, NOW, constant(10, 2.0)))
                .staticBaseline(SW_ERROR, baseline(0.5))
                .build();

        assertThat(rule.evaluate(context)).isEmpty();
    }

    private static Baseline baseline(double mean) {
        return new Baseline(mean, mean, 0.1, mean, mean, mean, 100);
    }
}
