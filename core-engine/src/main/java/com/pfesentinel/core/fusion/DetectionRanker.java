package com.pfesentinel.core.fusion;

import com.pfesentinel.core.model.Detection;
import com.pfesentinel.core.model.DetectionSummary;
import com.pfesentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges candidate detections from all rules and the outlier model into the
 * final report order.
 *
 * <ul>
 * <li>one detection per series key: higher confidence wins, a missing
 * confidence counts as 0; on a tie the more urgent severity wins, then the
 * earlier candidate</li>
 * <li>order: severity rank, then confidence descending with missing
 * confidence last, then key</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DetectionRanker {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionRanker.class);

    static final Comparator<Detection> ORDER = Comparator
            .comparingInt((Detection d) -> d.getSeverity().rank())
            .thenComparing(d -> !d.hasConfidence())
            .thenComparing(d -> d.getConfidence().orElse(0.0), Comparator.reverseOrder())
            .thenComparing(Detection::getKey);

    /**
     * @param candidates detections in the order the rules produced them
     * @return deduplicated, ordered detections
     */
    public List<Detection> rank(List<Detection> candidates) {
        Objects.requireNonNull(candidates, "Candidates must not be null");
        Map<SeriesKey, Detection> byKey = new LinkedHashMap<>();
        for (Detection candidate : candidates) {
            byKey.merge(candidate.getKey(), candidate, DetectionRanker::preferred);
        }
        List<Detection> ranked = new ArrayList<>(byKey.values());
        ranked.sort(ORDER);
        if (ranked.size() < candidates.size()) {
            LOG.debug("Merged {} candidate(s) into {} detection(s)", candidates.size(), ranked.size());
        }
        return ranked;
    }

    public DetectionSummary summarize(List<Detection> ranked) {
        return DetectionSummary.of(ranked);
    }

    static Detection preferred(Detection kept, Detection challenger) {
        int byConfidence = Double.compare(
                challenger.getConfidence().orElse(0.0), kept.getConfidence().orElse(0.0));
        if (byConfidence != 0) {
            return byConfidence > 0 ? challenger : kept;
        }
        return challenger.getSeverity().rank() < kept.getSeverity().rank() ? challenger : kept;
    }
}
