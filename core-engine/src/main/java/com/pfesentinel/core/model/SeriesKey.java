package com.pfesentinel.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one logical rate series: an exception counter on a given
 * PFE slot of a given device.
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Comparable<SeriesKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::getDevice)
            .thenComparing(SeriesKey::getSlot)
            .thenComparing(SeriesKey::getExceptionType);

    private final String device;
    private final String slot;
    private final String exceptionType;

    /**
     * @throws NullPointerException if any component is {@code null}
     */
    public SeriesKey(String device, String slot, String exceptionType) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.slot = Objects.requireNonNull(slot, "slot must not be null");
        this.exceptionType = Objects.requireNonNull(exceptionType, "exceptionType must not be null");
    }

    public static SeriesKey of(String device, String slot, String exceptionType) {
        return new SeriesKey(device, slot, exceptionType);
    }

    public String getDevice() {
        return device;
    }

    public String getSlot() {
        return slot;
    }

    public String getExceptionType() {
        return exceptionType;
    }

    /**
     * @return a key on the same device and slot with a different exception type
     */
    public SeriesKey withExceptionType(String otherType) {
        return new SeriesKey(device, slot, otherType);
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return device.equals(that.device)
                && slot.equals(that.slot)
                && exceptionType.equals(that.exceptionType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(device, slot, exceptionType);
    }

    @Override
    public String toString() {
        return device + "/" + slot + "/" + exceptionType;
    }
}
