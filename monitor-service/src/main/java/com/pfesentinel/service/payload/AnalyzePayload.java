package com.pfesentinel.service.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pfesentinel.core.engine.AnalysisRequest;
import com.pfesentinel.core.engine.InMemorySeriesSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /analyze}.
 *
 * <p>
 * Every parameter is optional; absent ones fall back to the
 * {@link AnalysisRequest} defaults, except the lookback which falls back to
 * the service-wide default. The series are loaded into an
 * {@link InMemorySeriesSource} that the engine queries like a store.
 * </p>
 */
public class AnalyzePayload {

    private Integer lookbackHours;
    private Integer minConsecutiveSamples;
    private Boolean useMl;
    private Double mlConfidenceThreshold;
    private Boolean useDynamicBaseline;
    private List<SeriesPayload> series = new ArrayList<>();

    public Integer getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(Integer lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public Integer getMinConsecutiveSamples() {
        return minConsecutiveSamples;
    }

    public void setMinConsecutiveSamples(Integer minConsecutiveSamples) {
        this.minConsecutiveSamples = minConsecutiveSamples;
    }

    @JsonProperty("useML")
    public Boolean getUseMl() {
        return useMl;
    }

    @JsonProperty("useML")
    public void setUseMl(Boolean useMl) {
        this.useMl = useMl;
    }

    public Double getMlConfidenceThreshold() {
        return mlConfidenceThreshold;
    }

    public void setMlConfidenceThreshold(Double mlConfidenceThreshold) {
        this.mlConfidenceThreshold = mlConfidenceThreshold;
    }

    public Boolean getUseDynamicBaseline() {
        return useDynamicBaseline;
    }

    public void setUseDynamicBaseline(Boolean useDynamicBaseline) {
        this.useDynamicBaseline = useDynamicBaseline;
    }

    public List<SeriesPayload> getSeries() {
        return series;
    }

    public void setSeries(List<SeriesPayload> series) {
        this.series = series;
    }

    /**
     * @param defaultLookbackHours lookback used when the payload names none
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public AnalysisRequest toRequest(int defaultLookbackHours) {
        AnalysisRequest.Builder builder = AnalysisRequest.builder()
                .lookbackHours(lookbackHours != null ? lookbackHours : defaultLookbackHours);
        if (minConsecutiveSamples != null) {
            builder.minConsecutiveSamples(minConsecutiveSamples);
        }
        if (useMl != null) {
            builder.useMl(useMl);
        }
        if (mlConfidenceThreshold != null) {
            builder.mlConfidenceThreshold(mlConfidenceThreshold);
        }
        if (useDynamicBaseline != null) {
            builder.useDynamicBaseline(useDynamicBaseline);
        }
        return builder.build();
    }

    /**
     * @throws IllegalArgumentException if a series is malformed
     */
    public InMemorySeriesSource toSource() {
        InMemorySeriesSource source = new InMemorySeriesSource();
        if (series == null) {
            return source;
        }
        for (SeriesPayload s : series) {
            if (s == null) {
                throw new IllegalArgumentException("series entries must not be null");
            }
            source.add(s.toKey(), s.toSamples());
        }
        return source;
    }
}
