package com.pfesentinel.service.payload;

import com.pfesentinel.core.model.Sample;
import com.pfesentinel.core.model.SeriesKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw samples of one (device, slot, exception) series as posted by a client.
 */
public class SeriesPayload {

    private String device;
    private String slot;
    private String exception;
    private List<SamplePayload> samples = new ArrayList<>();

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public String getSlot() {
        return slot;
    }

    public void setSlot(String slot) {
        this.slot = slot;
    }

    public String getException() {
        return exception;
    }

    public void setException(String exception) {
        this.exception = exception;
    }

    public List<SamplePayload> getSamples() {
        return samples;
    }

    public void setSamples(List<SamplePayload> samples) {
        this.samples = samples;
    }

    /**
     * @throws IllegalArgumentException if a key component is blank
     */
    public SeriesKey toKey() {
        return new SeriesKey(required(device, "device"), required(slot, "slot"),
                required(exception, "exception"));
    }

    /**
     * @throws IllegalArgumentException if a sample has no timestamp
     */
    public List<Sample> toSamples() {
        List<Sample> result = new ArrayList<>();
        if (samples == null) {
            return result;
        }
        for (SamplePayload sample : samples) {
            if (sample == null || sample.getTime() == null) {
                throw new IllegalArgumentException("sample time is required for series " + toKey());
            }
            result.add(new Sample(sample.getTime(), sample.getValue()));
        }
        return result;
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("series " + field + " is required");
        }
        return value;
    }
}
