package com.pfesentinel.core.detection;

import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base class for rules that judge each series on its own and report at most
 * once per key.
 *
 * @since 1.0.0
 */
public abstract class SeriesRule implements DetectionRule {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesRule.class);

    private final String ruleName;

    protected SeriesRule(String ruleName) {
        this.ruleName = ruleName;
    }

    @Override
    public List<Detection> evaluate(RuleContext context) {
        List<Detection> detections = new ArrayList<>();
        for (SeriesKey key : context.keys()) {
            Optional<Detection> detection = evaluate(key, context);
            if (detection.isPresent()) {
                LOG.debug("Rule [{}] fired for {}: {}", ruleName, key, detection.get().getDetails());
                detections.add(detection.get());
            }
        }
        return detections;
    }

    /**
     * Evaluate one series.
     *
     * @return a detection if the series triggers the rule, empty otherwise
     */
    protected abstract Optional<Detection> evaluate(SeriesKey key, RuleContext context);

    @Override
    public String getRuleName() {
        return ruleName;
    }

    protected Detection.Builder detection(SeriesKey key, RuleContext context) {
        return Detection.builder()
                .key(key)
                .rule(ruleName)
                .severity(context.severityOf(key));
    }
}
