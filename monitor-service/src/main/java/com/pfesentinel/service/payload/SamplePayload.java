package com.pfesentinel.service.payload;

import java.time.Instant;

/**
 * One rate point. A {@code null} value marks a missing sample.
 */
public class SamplePayload {

    private Instant time;
    private Double value;

    public SamplePayload() {
    }

    public SamplePayload(Instant time, Double value) {
        this.time = time;
        this.value = value;
    }

    public Instant getTime() {
        return time;
    }

    public void setTime(Instant time) {
        this.time = time;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }
}
