package com.pfesentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link DetectionRule} instances by rule name.
 *
 * <p>
 * This is the single point of extension when adding new rules: register the
 * rule name here and include it in {@link #createAll(boolean)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    private RuleFactory() {
        // utility class
    }

    /**
     * Create the rule with the given name.
     *
     * @param ruleName rule name as carried by its detections; must not be {@code null}
     * @return a new rule instance
     * @throws NullPointerException     if {@code ruleName} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectionRule create(String ruleName) {
        Objects.requireNonNull(ruleName, "Rule name must not be null");

        String name = ruleName.toLowerCase(Locale.ROOT);
        return switch (name) {
            case EmergenceRule.RULE_NAME -> new EmergenceRule();
            case SpikeRule.RULE_NAME -> new SpikeRule(false);
            case SpikeRule.DYNAMIC_RULE_NAME -> new SpikeRule(true);
            case SustainedShiftRule.RULE_NAME -> new SustainedShiftRule(false);
            case SustainedShiftRule.DYNAMIC_RULE_NAME -> new SustainedShiftRule(true);
            case WeeklyComparisonRule.RULE_NAME -> new WeeklyComparisonRule();
            case TrendAccelerationRule.RULE_NAME -> new TrendAccelerationRule();
            case CorrelationRule.RULE_NAME -> new CorrelationRule();
            default -> throw new IllegalArgumentException(
                    "Unknown rule: '" + ruleName + "'. Supported rules: new_exception, spike, spike_dynamic, "
                            + "sustained_change, sustained_change_dynamic, weekly_anomaly, trend_acceleration, "
                            + "correlated_exceptions");
        };
    }

    /**
     * Create the full rule set for one analysis mode.
     * <p>
     * Dynamic mode replaces the static spike and sustained-shift rules with
     * their dynamic variants; the two never run together. The returned list
     * is <strong>unmodifiable</strong>.
     * </p>
     *
     * @param dynamicBaseline whether the dynamic variants are used
     * @return unmodifiable list of rules
     */
    public static List<DetectionRule> createAll(boolean dynamicBaseline) {
        List<String> names = List.of(
                EmergenceRule.RULE_NAME,
                dynamicBaseline ? SpikeRule.DYNAMIC_RULE_NAME : SpikeRule.RULE_NAME,
                dynamicBaseline ? SustainedShiftRule.DYNAMIC_RULE_NAME : SustainedShiftRule.RULE_NAME,
                WeeklyComparisonRule.RULE_NAME,
                TrendAccelerationRule.RULE_NAME,
                CorrelationRule.RULE_NAME);
        LOG.debug("Creating {} rule(s), dynamic baseline {}", names.size(), dynamicBaseline);
        return Collections.unmodifiableList(names.stream()
                .map(RuleFactory::create)
                .toList());
    }
}
