package com.pfesentinel.core.detection;

import com.pfesentinel.core.baseline.Baseline;
import com.pfesentinel.core.config.DetectionThresholds;
import com.pfesentinel.core.config.SeverityMap;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.Severity;
import com.pfesentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Everything the rules see during one analysis run.
 * <p>
 * Keys are the series that have samples in the recent window. Lookups for
 * any other auxiliary input return an empty series or {@link Baseline#EMPTY}
 * rather than {@code null}.
 * </p>
 */
public final class RuleContext {

    private final Instant now;
    private final Duration lookback;
    private final int minConsecutiveSamples;
    private final DetectionThresholds thresholds;
    private final SeverityMap severities;
    private final Map<SeriesKey, TimeSeries> recent;
    private final Map<SeriesKey, TimeSeries> hourly;
    private final Map<SeriesKey, Baseline> staticBaselines;
    private final Map<SeriesKey, Baseline> weeklyBaselines;
    private final Map<SeriesKey, DynamicBaseline> dynamicBaselines;
    private final List<SeriesKey> keys;

    private RuleContext(Builder builder) {
        this.now = Objects.requireNonNull(builder.now, "now must not be null");
        this.lookback = Objects.requireNonNull(builder.lookback, "lookback must not be null");
        this.minConsecutiveSamples = builder.minConsecutiveSamples;
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds must not be null");
        this.severities = Objects.requireNonNull(builder.severities, "severities must not be null");
        this.recent = Map.copyOf(builder.recent);
        this.hourly = Map.copyOf(builder.hourly);
        this.staticBaselines = Map.copyOf(builder.staticBaselines);
        this.weeklyBaselines = Map.copyOf(builder.weeklyBaselines);
        this.dynamicBaselines = Map.copyOf(builder.dynamicBaselines);
        this.keys = List.copyOf(new TreeSet<>(recent.keySet()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return recent-window keys in a stable order
     */
    public List<SeriesKey> keys() {
        return keys;
    }

    public TimeSeries recent(SeriesKey key) {
        TimeSeries series = recent.get(key);
        return series != null ? series : TimeSeries.empty(key);
    }

    public TimeSeries hourly(SeriesKey key) {
        TimeSeries series = hourly.get(key);
        return series != null ? series : TimeSeries.empty(key);
    }

    public Baseline staticBaseline(SeriesKey key) {
        return staticBaselines.getOrDefault(key, Baseline.EMPTY);
    }

    public Baseline weeklyBaseline(SeriesKey key) {
        return weeklyBaselines.getOrDefault(key, Baseline.EMPTY);
    }

    public Optional<DynamicBaseline> dynamicBaseline(SeriesKey key) {
        return Optional.ofNullable(dynamicBaselines.get(key));
    }

    public Severity severityOf(SeriesKey key) {
        return severities.severityOf(key.getExceptionType());
    }

    public Instant getNow() {
        return now;
    }

    public Duration getLookback() {
        return lookback;
    }

    public int getMinConsecutiveSamples() {
        return minConsecutiveSamples;
    }

    public DetectionThresholds getThresholds() {
        return thresholds;
    }

    public static final class Builder {
        private Instant now;
        private Duration lookback = Duration.ofHours(1);
        private int minConsecutiveSamples = 3;
        private DetectionThresholds thresholds = new DetectionThresholds();
        private SeverityMap severities = SeverityMap.allLow();
        private final Map<SeriesKey, TimeSeries> recent = new HashMap<>();
        private final Map<SeriesKey, TimeSeries> hourly = new HashMap<>();
        private final Map<SeriesKey, Baseline> staticBaselines = new HashMap<>();
        private final Map<SeriesKey, Baseline> weeklyBaselines = new HashMap<>();
        private final Map<SeriesKey, DynamicBaseline> dynamicBaselines = new HashMap<>();

        private Builder() {
        }

        public Builder now(Instant now) {
            this.now = now;
            return this;
        }

        public Builder lookback(Duration lookback) {
            this.lookback = lookback;
            return this;
        }

        public Builder minConsecutiveSamples(int minConsecutiveSamples) {
            this.minConsecutiveSamples = minConsecutiveSamples;
            return this;
        }

        public Builder thresholds(DetectionThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder severities(SeverityMap severities) {
            this.severities = severities;
            return this;
        }

        public Builder recent(TimeSeries series) {
            recent.put(series.getKey(), series);
            return this;
        }

        public Builder recent(Map<SeriesKey, TimeSeries> series) {
            recent.putAll(series);
            return this;
        }

        public Builder hourly(TimeSeries series) {
            hourly.put(series.getKey(), series);
            return this;
        }

        public Builder hourly(Map<SeriesKey, TimeSeries> series) {
            hourly.putAll(series);
            return this;
        }

        public Builder staticBaseline(SeriesKey key, Baseline baseline) {
            staticBaselines.put(key, baseline);
            return this;
        }

        public Builder weeklyBaseline(SeriesKey key, Baseline baseline) {
            weeklyBaselines.put(key, baseline);
            return this;
        }

        public Builder dynamicBaseline(SeriesKey key, DynamicBaseline baseline) {
            dynamicBaselines.put(key, baseline);
            return this;
        }

        public RuleContext build() {
            return new RuleContext(this);
        }
    }
}
