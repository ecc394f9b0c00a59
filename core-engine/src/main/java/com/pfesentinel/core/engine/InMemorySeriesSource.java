package com.pfesentinel.core.engine;

import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;
import com.pfesentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link RateSeriesSource} over raw samples held in memory.
 * <p>
 * Fetches slice each series to {@code [start, stop)}, drop missing values and
 * average what remains into epoch-aligned buckets, each stamped with its
 * start time.
 * </p>
 */
public class InMemorySeriesSource implements RateSeriesSource {

    private final Map<SeriesKey, List<Sample>> samples = new HashMap<>();

    public InMemorySeriesSource add(SeriesKey key, List<Sample> series) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(series, "series must not be null");
        samples.computeIfAbsent(key, k -> new ArrayList<>()).addAll(series);
        return this;
    }

    public InMemorySeriesSource add(TimeSeries series) {
        return add(series.getKey(), series.getSamples());
    }

    public int size() {
        return samples.size();
    }

    @Override
    public Map<SeriesKey, TimeSeries> fetch(Instant start, Instant stop, Duration aggregateEvery) {
        if (aggregateEvery.isZero() || aggregateEvery.isNegative()) {
            throw new IllegalArgumentException("aggregateEvery must be positive, got: " + aggregateEvery);
        }
        long bucketMillis = aggregateEvery.toMillis();
        Map<SeriesKey, TimeSeries> result = new HashMap<>();
        samples.forEach((key, raw) -> {
            TreeMap<Long, double[]> buckets = new TreeMap<>();
            for (Sample sample : raw) {
                Instant time = sample.getTime();
                if (!sample.isValid() || time.isBefore(start) || !time.isBefore(stop)) {
                    continue;
                }
                long bucket = Math.floorDiv(time.toEpochMilli(), bucketMillis) * bucketMillis;
                double[] acc = buckets.computeIfAbsent(bucket, b -> new double[2]);
                acc[0] += sample.getValue();
                acc[1]++;
            }
            if (buckets.isEmpty()) {
                return;
            }
            List<Sample> aggregated = new ArrayList<>(buckets.size());
            buckets.forEach((bucket, acc) -> aggregated.add(Sample.of(Instant.ofEpochMilli(bucket), acc[0] / acc[1])));
            result.put(key, new TimeSeries(key, aggregated));
        });
        return result;
    }
}
