package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.baseline.BaselineManager;
import com.pfesentinel.core.baseline.ContextualBaseline;
import com.pfesentinel.core.baseline.EwmaBaseline;
import com.pfesentinel.core.baseline.MultiWindowBaseline;
import com.pfesentinel.core.baseline.RegimeChange;
import com.pfesentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;

/**
 * Picks the reference baseline for one series in dynamic mode.
 *
 * <ol>
 * <li>multi-window composite over the history, ending where the recent
 * window starts</li>
 * <li>contextual baseline instead, when the time-of-day context really
 * matched enough samples</li>
 * <li>the recent baseline instead, when a regime change fired</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class DynamicBaselineResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DynamicBaselineResolver.class);

    private final BaselineManager baselineManager;
    private final int minSamples;

    /**
     * @param baselineManager statistics provider; must not be {@code null}
     * @param minSamples      samples a contextual baseline needs to be preferred
     */
    public DynamicBaselineResolver(BaselineManager baselineManager, int minSamples) {
        this.baselineManager = Objects.requireNonNull(baselineManager, "BaselineManager must not be null");
        this.minSamples = minSamples;
    }

    /**
     * @param history     samples before the recent window
     * @param recent      samples inside the recent window
     * @param recentStart start of the recent window
     * @param now         end of the recent window
     */
    public DynamicBaseline resolve(Collection<Sample> history, Collection<Sample> recent,
                                   Instant recentStart, Instant now) {
        MultiWindowBaseline multiWindow = baselineManager.multiWindowBaseline(history, recentStart);
        ContextualBaseline contextual = baselineManager.contextualBaseline(history, now);
        EwmaBaseline ewma = baselineManager.ewmaBaseline(history);

        Baseline reference;
        BaselineType type;
        if (contextual.isContextMatched() && contextual.getBaseline().hasAtLeast(minSamples)) {
            reference = contextual.getBaseline();
            type = BaselineType.CONTEXTUAL;
        } else {
            reference = multiWindow.getComposite();
            type = BaselineType.MULTI_WINDOW;
        }

        RegimeChange regime = baselineManager.detectRegimeChange(recent, reference);
        if (regime.isDetected()) {
            LOG.debug("Using recent baseline after regime change (was {})", type.label());
            return new DynamicBaseline(regime.getNewBaseline().orElseThrow(), ewma,
                    BaselineType.REGIME_CHANGE, true);
        }
        return new DynamicBaseline(reference, ewma, type, false);
    }
}
