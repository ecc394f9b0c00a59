package com.pfesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts over a final detection list: total, per severity, and how many
 * came from the outlier model.
 *
 * @since 1.0.0
 */
public final class DetectionSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int total;
    private final Map<Severity, Integer> bySeverity;
    private final int mlDetections;

    private DetectionSummary(int total, Map<Severity, Integer> bySeverity, int mlDetections) {
        this.total = total;
        this.bySeverity = bySeverity;
        this.mlDetections = mlDetections;
    }

    /**
     * Summarise a detection list. Every severity is present in the result,
     * with a zero count when nothing was detected at that level.
     */
    public static DetectionSummary of(List<Detection> detections) {
        Objects.requireNonNull(detections, "Detections must not be null");
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        int ml = 0;
        for (Detection detection : detections) {
            counts.merge(detection.getSeverity(), 1, Integer::sum);
            if (detection.hasConfidence()) {
                ml++;
            }
        }
        return new DetectionSummary(detections.size(), Collections.unmodifiableMap(counts), ml);
    }

    public int getTotal() {
        return total;
    }

    public int count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0);
    }

    @JsonIgnore
    public int getCritical() {
        return count(Severity.CRITICAL);
    }

    @JsonIgnore
    public int getHigh() {
        return count(Severity.HIGH);
    }

    @JsonIgnore
    public int getMedium() {
        return count(Severity.MEDIUM);
    }

    @JsonIgnore
    public int getLow() {
        return count(Severity.LOW);
    }

    public int getMlDetections() {
        return mlDetections;
    }

    /**
     * @return severity name to count, in ranking order
     */
    public Map<String, Integer> getBySeverity() {
        Map<String, Integer> view = new LinkedHashMap<>();
        bySeverity.forEach((severity, count) -> view.put(severity.name(), count));
        return view;
    }

    @Override
    public String toString() {
        return "DetectionSummary{total=" + total
                + ", bySeverity=" + bySeverity
                + ", mlDetections=" + mlDetections + '}';
    }
}
