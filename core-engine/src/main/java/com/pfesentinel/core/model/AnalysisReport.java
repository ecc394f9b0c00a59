package com.pfesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one analysis run: the ranked, deduplicated detections and their
 * summary.
 *
 * @since 1.0.0
 */
public final class AnalysisReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant analyzedAt;
    private final List<Detection> detections;
    private final DetectionSummary summary;

    public AnalysisReport(Instant analyzedAt, List<Detection> detections) {
        this.analyzedAt = Objects.requireNonNull(analyzedAt, "analyzedAt must not be null");
        this.detections = List.copyOf(Objects.requireNonNull(detections, "detections must not be null"));
        this.summary = DetectionSummary.of(this.detections);
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public List<Detection> getDetections() {
        return detections;
    }

    public DetectionSummary getSummary() {
        return summary;
    }

    @Override
    public String toString() {
        return "AnalysisReport{analyzedAt=" + analyzedAt + ", summary=" + summary + '}';
    }
}
