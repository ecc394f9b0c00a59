package com.pfesentinel.core.detection;

import com.pfesentinel.core.model.Detection;

import java.util.List;

/**
 * Contract for all detection rules.
 * <p>
 * Rules are <strong>stateless</strong>: everything they need for one run
 * (recent series, baselines, thresholds, severity table) arrives in the
 * {@link RuleContext}. Rules never see each other's output; merging happens
 * afterwards in fusion.
 * </p>
 */
public interface DetectionRule {

    /**
     * Evaluate the rule over every series in the context.
     *
     * @param context inputs for this run
     * @return zero or more candidate detections, never {@code null}
     */
    List<Detection> evaluate(RuleContext context);

    /**
     * Return the rule name carried by the detections this rule emits.
     *
     * @return rule name
     */
    String getRuleName();
}
