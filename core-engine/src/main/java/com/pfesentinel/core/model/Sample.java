package com.pfesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single rate measurement (exceptions per second) at a point in time.
 *
 * <p>
 * A {@code null} value represents missing telemetry. It is never the same as
 * a zero rate and is filtered out before any statistic is computed.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant time;
    private final Double value;

    /**
     * @param time  sample timestamp; must not be {@code null}
     * @param value rate in exceptions/second, or {@code null} when missing
     */
    public Sample(Instant time, Double value) {
        this.time = Objects.requireNonNull(time, "Sample time must not be null");
        this.value = value;
    }

    public static Sample of(Instant time, double value) {
        return new Sample(time, value);
    }

    public static Sample missing(Instant time) {
        return new Sample(time, null);
    }

    public Instant getTime() {
        return time;
    }

    /**
     * @return the rate, or {@code null} when the sample is missing
     */
    public Double getValue() {
        return value;
    }

    public boolean isValid() {
        return value != null && !value.isNaN();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return time.equals(that.time) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, value);
    }

    @Override
    public String toString() {
        return "Sample{time=" + time + ", value=" + value + '}';
    }
}
