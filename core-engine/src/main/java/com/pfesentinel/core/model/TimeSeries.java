package com.pfesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Time-ordered samples for one {@link SeriesKey}.
 *
 * <p>
 * Samples are sorted ascending by time on construction because the
 * collaborator that produces them does not guarantee ordering.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeriesKey key;
    private final List<Sample> samples;

    public TimeSeries(SeriesKey key, Collection<Sample> samples) {
        this.key = Objects.requireNonNull(key, "SeriesKey must not be null");
        Objects.requireNonNull(samples, "Samples must not be null");
        List<Sample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(Sample::getTime));
        this.samples = Collections.unmodifiableList(sorted);
    }

    public static TimeSeries empty(SeriesKey key) {
        return new TimeSeries(key, List.of());
    }

    public SeriesKey getKey() {
        return key;
    }

    /**
     * @return all samples, including missing ones, ascending by time
     */
    public List<Sample> getSamples() {
        return samples;
    }

    /**
     * @return samples carrying a value, ascending by time
     */
    public List<Sample> validSamples() {
        return samples.stream().filter(Sample::isValid).toList();
    }

    /**
     * @return the non-null values, ascending by time
     */
    public double[] validValues() {
        return samples.stream()
                .filter(Sample::isValid)
                .mapToDouble(Sample::getValue)
                .toArray();
    }

    public int validCount() {
        return (int) samples.stream().filter(Sample::isValid).count();
    }

    /**
     * Samples with {@code start <= time < end}.
     */
    public TimeSeries slice(Instant start, Instant end) {
        return new TimeSeries(key, samples.stream()
                .filter(s -> !s.getTime().isBefore(start) && s.getTime().isBefore(end))
                .toList());
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    @Override
    public String toString() {
        return "TimeSeries{key=" + key + ", samples=" + samples.size() + '}';
    }
}
