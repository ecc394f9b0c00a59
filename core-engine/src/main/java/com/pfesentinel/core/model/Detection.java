package com.pfesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A candidate or final anomaly report for one {@link SeriesKey}.
 *
 * <p>
 * Only detections produced by the outlier model carry a confidence. Absence
 * is modelled with {@link OptionalDouble#empty()} and is distinct from a
 * score of {@code 0.0}; ordering puts it after any present value.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code key}, {@code severity}, {@code rule} and
 * {@code detectedAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonPropertyOrder({"device", "exception", "slot", "severity", "rule", "detectedAt",
        "details", "confidence", "dashboardLink"})
public final class Detection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeriesKey key;
    private final Severity severity;
    private final String rule;
    private final Instant detectedAt;
    private final String details;
    /** {@code null} when the detection has no confidence score. */
    private final Double confidence;
    private final String dashboardLink;

    private Detection(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.rule = Objects.requireNonNull(builder.rule, "rule must not be null");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.details = builder.details;
        this.confidence = builder.confidence;
        this.dashboardLink = builder.dashboardLink;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this detection's values
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.key = key;
        b.severity = severity;
        b.rule = rule;
        b.detectedAt = detectedAt;
        b.details = details;
        b.confidence = confidence;
        b.dashboardLink = dashboardLink;
        return b;
    }

    /**
     * @return a copy of this detection pointing at the given dashboard link
     */
    public Detection withDashboardLink(String link) {
        return toBuilder().dashboardLink(link).build();
    }

    /**
     * Fluent builder for {@link Detection} instances.
     */
    public static class Builder {
        private SeriesKey key;
        private Severity severity;
        private String rule;
        private Instant detectedAt;
        private String details;
        private Double confidence;
        private String dashboardLink;

        public Builder key(SeriesKey key) {
            this.key = key;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder rule(String rule) {
            this.rule = rule;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * @param confidence score in [0, 1]
         * @throws IllegalArgumentException if outside [0, 1]
         */
        public Builder confidence(double confidence) {
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
            }
            this.confidence = confidence;
            return this;
        }

        public Builder noConfidence() {
            this.confidence = null;
            return this;
        }

        public Builder dashboardLink(String dashboardLink) {
            this.dashboardLink = dashboardLink;
            return this;
        }

        public Detection build() {
            return new Detection(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonIgnore
    public SeriesKey getKey() {
        return key;
    }

    @JsonProperty("device")
    public String getDevice() {
        return key.getDevice();
    }

    @JsonProperty("slot")
    public String getSlot() {
        return key.getSlot();
    }

    @JsonProperty("exception")
    public String getExceptionType() {
        return key.getExceptionType();
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getRule() {
        return rule;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getDetails() {
        return details;
    }

    /**
     * @return the model confidence, or empty for rule-based detections
     */
    public OptionalDouble getConfidence() {
        return confidence == null ? OptionalDouble.empty() : OptionalDouble.of(confidence);
    }

    @JsonIgnore
    public boolean hasConfidence() {
        return confidence != null;
    }

    public String getDashboardLink() {
        return dashboardLink;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection that))
            return false;
        return key.equals(that.key)
                && rule.equals(that.rule)
                && detectedAt.equals(that.detectedAt)
                && severity == that.severity
                && Objects.equals(confidence, that.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, rule, detectedAt, severity, confidence);
    }

    @Override
    public String toString() {
        return "Detection{" +
                "key=" + key +
                ", severity=" + severity +
                ", rule='" + rule + '\'' +
                ", detectedAt=" + detectedAt +
                ", confidence=" + confidence +
                ", details='" + details + '\'' +
                '}';
    }
}
